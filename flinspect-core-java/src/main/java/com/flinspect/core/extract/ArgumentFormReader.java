package com.flinspect.core.extract;

import com.flinspect.core.model.ArgumentExpr;
import com.flinspect.core.model.ArgumentExpr.ComponentRef;
import com.flinspect.core.model.ArgumentExpr.LiteralExpr;
import com.flinspect.core.model.ArgumentExpr.NameRef;
import com.flinspect.core.model.ArgumentExpr.OtherExpr;
import com.flinspect.core.model.ArgumentExpr.Subscript;
import com.flinspect.core.model.ArgumentExpr.Subscripted;
import com.flinspect.core.model.IntrinsicType;
import com.flinspect.core.parse_tree.ConstructTag;
import com.flinspect.core.parse_tree.PtNode;

import java.util.ArrayList;
import java.util.List;

import static com.flinspect.core.extract.DeclarationReader.lower;

/**
 * Records the syntactic form of an actual argument. No lookups happen here; names are
 * classified against declarations only when the call is resolved.
 */
final class ArgumentFormReader {

    private ArgumentFormReader() {}

    static ArgumentExpr formOf(PtNode node) {
        if (node == null) return new OtherExpr("empty");
        return switch (node.tag()) {
            case ACTUAL_ARG, EXPR, DESIGNATOR, LITERAL_CONSTANT -> formOf(firstChild(node));
            case NAME -> new NameRef(lower(node.value()));
            case DATA_REF -> dataRef(node);
            case ARRAY_ELEMENT -> arrayElement(node);
            case STRUCTURE_COMPONENT -> new ComponentRef(lower(node.nameValue()));
            case FUNCTION_REFERENCE -> functionReference(node);
            case INT_LITERAL_CONSTANT -> new LiteralExpr(IntrinsicType.INTEGER);
            case REAL_LITERAL_CONSTANT -> new LiteralExpr(IntrinsicType.REAL);
            case LOGICAL_LITERAL_CONSTANT -> new LiteralExpr(IntrinsicType.LOGICAL);
            case CHAR_LITERAL_CONSTANT -> new LiteralExpr(IntrinsicType.CHARACTER);
            case COMPLEX_LITERAL_CONSTANT -> new LiteralExpr(IntrinsicType.COMPLEX);
            case NEGATE, UNARY_PLUS, PARENTHESES -> {
                ArgumentExpr inner = formOf(firstChild(node));
                yield inner instanceof LiteralExpr ? inner : new OtherExpr(node.label());
            }
            case UNKNOWN -> node.children().size() == 1 ? formOf(node.children().get(0)) : new OtherExpr(node.label());
            default -> new OtherExpr(node.label());
        };
    }

    private static ArgumentExpr dataRef(PtNode dataRef) {
        PtNode inner = firstChild(dataRef);
        if (inner == null && dataRef.value() != null) return new NameRef(lower(dataRef.value()));
        return formOf(inner);
    }

    private static ArgumentExpr arrayElement(PtNode element) {
        PtNode base = element.child(ConstructTag.DATA_REF);
        ArgumentExpr baseForm = base != null ? dataRef(base) : new OtherExpr(element.label());
        if (!(baseForm instanceof NameRef name)) {
            // a%b(i): still a field access
            return baseForm instanceof ComponentRef ? baseForm : new OtherExpr(element.label());
        }
        List<Subscript> subscripts = new ArrayList<>();
        for (PtNode ss : element.children(ConstructTag.SECTION_SUBSCRIPT)) {
            subscripts.add(subscriptOf(ss));
        }
        return new Subscripted(name.name(), false, subscripts);
    }

    private static Subscript subscriptOf(PtNode sectionSubscript) {
        if (sectionSubscript.child(ConstructTag.SUBSCRIPT_TRIPLET) != null) return Subscript.ofTriplet();
        PtNode expr = sectionSubscript.firstDescendant(ConstructTag.EXPR);
        return Subscript.of(expr != null ? formOf(expr) : new OtherExpr(sectionSubscript.label()));
    }

    /**
     * {@code f(x, y)} with no keywords may be an array element the front end could not
     * classify; it is recorded call-shaped and settled at resolution time.
     */
    private static ArgumentExpr functionReference(PtNode reference) {
        PtNode call = reference.child(ConstructTag.CALL);
        if (call == null) return new OtherExpr(reference.label());
        PtNode designator = call.child(ConstructTag.PROCEDURE_DESIGNATOR);
        String name = designator != null ? designator.nameValue() : null;
        if (name == null) return new OtherExpr(reference.label());
        List<Subscript> subscripts = new ArrayList<>();
        for (PtNode spec : call.children(ConstructTag.ACTUAL_ARG_SPEC)) {
            if (spec.child(ConstructTag.KEYWORD) != null) return new OtherExpr(reference.label());
            subscripts.add(Subscript.of(formOf(spec.child(ConstructTag.ACTUAL_ARG))));
        }
        return new Subscripted(lower(name), true, subscripts);
    }

    private static PtNode firstChild(PtNode node) {
        return node.children().isEmpty() ? null : node.children().get(0);
    }
}
