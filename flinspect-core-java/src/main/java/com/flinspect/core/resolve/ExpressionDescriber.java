package com.flinspect.core.resolve;

import com.flinspect.core.model.ArgumentExpr;
import com.flinspect.core.model.ArgumentExpr.ComponentRef;
import com.flinspect.core.model.ArgumentExpr.LiteralExpr;
import com.flinspect.core.model.ArgumentExpr.NameRef;
import com.flinspect.core.model.ArgumentExpr.OtherExpr;
import com.flinspect.core.model.ArgumentExpr.Subscript;
import com.flinspect.core.model.ArgumentExpr.Subscripted;
import com.flinspect.core.model.ExpressionDescriptor;
import com.flinspect.core.model.ExpressionDescriptor.ArrayElementOrSlice;
import com.flinspect.core.model.ExpressionDescriptor.Literal;
import com.flinspect.core.model.ExpressionDescriptor.NamedVariable;
import com.flinspect.core.model.ExpressionDescriptor.StructureComponent;
import com.flinspect.core.model.ExpressionDescriptor.Unclassified;
import com.flinspect.core.model.IntrinsicType;
import com.flinspect.core.model.Rank;
import com.flinspect.core.model.TypeSpec;
import com.flinspect.core.model.UnitId;
import com.flinspect.core.model.VariableDecl;
import com.flinspect.core.registry.NodeRegistry;

import java.util.Optional;

/**
 * Turns recorded argument forms into descriptors using the declarations visible from the
 * calling scope.
 *
 * A call-shaped {@code a(i)} is an array element if {@code a} is declared as an array where
 * the call happens, and a genuine function call otherwise.
 */
public class ExpressionDescriber {

    private final NodeRegistry registry;

    public ExpressionDescriber(NodeRegistry registry) {
        this.registry = registry;
    }

    public ExpressionDescriptor describe(UnitId scope, ArgumentExpr expr) {
        if (expr instanceof NameRef ref) {
            Optional<VariableDecl> decl = registry.lookupVariable(scope, ref.name());
            return decl.map(d -> (ExpressionDescriptor) new NamedVariable(ref.name(), d.type(), d.rank()))
                    .orElseGet(() -> new NamedVariable(ref.name(), TypeSpec.UNKNOWN, Rank.UNKNOWN));
        }
        if (expr instanceof Subscripted sub) {
            return subscripted(scope, sub);
        }
        if (expr instanceof ComponentRef component) {
            return new StructureComponent(component.field());
        }
        if (expr instanceof LiteralExpr literal) {
            return new Literal(literal.type());
        }
        if (expr instanceof OtherExpr other) {
            return new Unclassified(other.label());
        }
        throw new IllegalStateException("Unhandled argument form: " + expr);
    }

    private ExpressionDescriptor subscripted(UnitId scope, Subscripted sub) {
        Optional<VariableDecl> decl = registry.lookupVariable(scope, sub.name());
        if (sub.callShaped()) {
            boolean array = decl.isPresent() && decl.get().rank() != 0;
            if (!array) return new Unclassified("function reference " + sub.name());
        }
        int scalar = 0;
        int retained = 0;
        for (Subscript s : sub.subscripts()) {
            if (s.triplet() || isArrayValued(scope, s.value())) {
                retained++;
            } else {
                scalar++;
            }
        }
        TypeSpec type = decl.map(VariableDecl::type).orElse(TypeSpec.UNKNOWN);
        int baseRank = decl.map(VariableDecl::rank).orElse(Rank.UNKNOWN);
        return new ArrayElementOrSlice(sub.name(), type, baseRank, scalar, retained);
    }

    /** A vector subscript keeps its dimension; unknown ranks count as scalar. */
    private boolean isArrayValued(UnitId scope, ArgumentExpr value) {
        return rankOf(describe(scope, value)) > 0;
    }

    // --- exhaustive accessors over the descriptor variants ---

    public static TypeSpec typeOf(ExpressionDescriptor d) {
        if (d instanceof NamedVariable v) return v.type();
        if (d instanceof ArrayElementOrSlice a) return a.type();
        if (d instanceof Literal l) {
            return l.type() == IntrinsicType.DERIVED ? TypeSpec.UNKNOWN : TypeSpec.of(l.type());
        }
        if (d instanceof StructureComponent || d instanceof Unclassified) return TypeSpec.UNKNOWN;
        throw new IllegalStateException("Unhandled descriptor: " + d);
    }

    public static int rankOf(ExpressionDescriptor d) {
        if (d instanceof NamedVariable v) return v.rank();
        if (d instanceof ArrayElementOrSlice a) return a.rank();
        if (d instanceof Literal) return 0;
        if (d instanceof StructureComponent || d instanceof Unclassified) return Rank.UNKNOWN;
        throw new IllegalStateException("Unhandled descriptor: " + d);
    }
}
