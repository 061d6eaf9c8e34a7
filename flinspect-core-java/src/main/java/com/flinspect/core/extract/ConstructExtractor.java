package com.flinspect.core.extract;

import com.flinspect.core.model.ActualArgument;
import com.flinspect.core.model.ArgumentDescriptor;
import com.flinspect.core.model.CallForm;
import com.flinspect.core.model.CallSite;
import com.flinspect.core.model.ComponentDescriptor;
import com.flinspect.core.model.Intent;
import com.flinspect.core.model.Rank;
import com.flinspect.core.model.SourceLocation;
import com.flinspect.core.model.TypeSpec;
import com.flinspect.core.model.UnitId;
import com.flinspect.core.model.UnitKind;
import com.flinspect.core.model.UnitPayload.DerivedTypePayload;
import com.flinspect.core.model.UnitPayload.InterfacePayload;
import com.flinspect.core.model.UnitPayload.ModulePayload;
import com.flinspect.core.model.UnitPayload.ProgramPayload;
import com.flinspect.core.model.UnitPayload.SubprogramPayload;
import com.flinspect.core.model.UsesEdge;
import com.flinspect.core.model.VariableDecl;
import com.flinspect.core.parse_tree.ConstructTag;
import com.flinspect.core.parse_tree.PtNode;
import com.flinspect.core.registry.NodeRegistry;
import com.flinspect.core.registry.NodeRegistry.NameKindConflictException;

import java.util.ArrayList;
import java.util.EnumSet;
import java.util.HashMap;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;
import java.util.TreeSet;
import java.util.function.UnaryOperator;

import static com.flinspect.core.extract.DeclarationReader.lower;

/**
 * Walks the generic trees of one dump and fills a file-local {@link NodeRegistry} with program
 * units, variables, USE edges and unresolved call sites.
 */
public class ConstructExtractor {

    private static final Set<ConstructTag> NAME_LIST = EnumSet.of(ConstructTag.NAME);
    private static final Set<ConstructTag> ACCESS_ID_LIST = EnumSet.of(ConstructTag.ACCESS_ID);
    private static final Set<ConstructTag> SHAPED_ENTITIES = EnumSet.of(
            ConstructTag.DECLARATION, ConstructTag.OBJECT_DECL, ConstructTag.POINTER_DECL, ConstructTag.TARGET_DECL);

    private final NodeRegistry registry;
    private final String fileKey;
    private int callOrdinal;

    public ConstructExtractor(NodeRegistry registry) {
        if (registry.fileKey() == null) {
            throw new IllegalArgumentException("Extraction needs a file-local registry");
        }
        this.registry = registry;
        this.fileKey = registry.fileKey();
    }

    /** Extracts every top-level construct, then settles name/kind conflicts. */
    public void extract(Iterable<PtNode> roots) {
        extract(roots.iterator());
    }

    public void extract(Iterator<PtNode> roots) {
        while (roots.hasNext()) {
            extractTopLevel(roots.next());
        }
        registry.normalizeConflicts();
    }

    void extractTopLevel(PtNode node) {
        switch (node.tag()) {
            case MODULE -> extractModule(node);
            case MAIN_PROGRAM -> extractProgram(node);
            case SUBROUTINE_SUBPROGRAM -> extractSubprogram(null, node, UnitKind.SUBROUTINE);
            case FUNCTION_SUBPROGRAM -> extractSubprogram(null, node, UnitKind.FUNCTION);
            default -> {
                // Program, ProgramUnit and wrappers this version does not know
                for (PtNode child : node.children()) extractTopLevel(child);
            }
        }
    }

    // ------------------------------------------------------------------
    // Program units
    // ------------------------------------------------------------------

    private void extractModule(PtNode node) {
        PtNode stmt = node.child(ConstructTag.MODULE_STMT);
        String name = stmt != null ? lower(stmt.nameValue()) : null;
        if (name == null) {
            System.err.println("[flinspect] WARNING: " + fileKey + ":" + node.line() + ": module without a name, skipped");
            return;
        }
        UnitId id = internUnit(null, name, UnitKind.MODULE, node.line());
        Scope scope = new Scope(id);
        walk(scope, node);
        registry.define(id, location(node), new ModulePayload(scope.defaultPrivate,
                new ArrayList<>(scope.publicNames), new ArrayList<>(scope.privateNames)));
        scope.flush();
    }

    private void extractProgram(PtNode node) {
        PtNode stmt = node.child(ConstructTag.PROGRAM_STMT);
        String name = stmt != null ? lower(stmt.nameValue()) : null;
        if (name == null) name = "_main_" + fileStem();
        UnitId id = internUnit(null, name, UnitKind.PROGRAM, node.line());
        Scope scope = new Scope(id);
        walk(scope, node);
        registry.define(id, location(node), new ProgramPayload());
        scope.flush();
    }

    /**
     * Subprograms, nested ones included, and interface bodies (which have no execution part).
     *
     * @return the unit id, or null if the statement carries no name
     */
    private UnitId extractSubprogram(UnitId container, PtNode node, UnitKind kind) {
        PtNode stmt = node.child(kind == UnitKind.SUBROUTINE ? ConstructTag.SUBROUTINE_STMT : ConstructTag.FUNCTION_STMT);
        if (stmt == null) {
            System.err.println("[flinspect] WARNING: " + fileKey + ":" + node.line() + ": " + node.label()
                    + " without its statement, skipped");
            return null;
        }
        List<String> names = new ArrayList<>();
        for (PtNode n : stmt.children(ConstructTag.NAME)) names.add(lower(n.value()));
        if (names.isEmpty()) return null;

        String name = names.get(0);
        List<String> dummies = new ArrayList<>();
        if (kind == UnitKind.SUBROUTINE) {
            for (PtNode arg : stmt.children(ConstructTag.DUMMY_ARG)) {
                String dummy = arg.nameValue();
                if (dummy != null) dummies.add(lower(dummy));
            }
        } else {
            dummies.addAll(names.subList(1, names.size()));
        }

        UnitId id = internUnit(container, name, kind, node.line());
        Scope scope = new Scope(id);
        walk(scope, node);

        List<ArgumentDescriptor> arguments = new ArrayList<>();
        for (String dummy : dummies) {
            VariableDecl decl = scope.variables.get(dummy);
            if (decl == null) {
                decl = VariableDecl.undeclared(dummy);
                scope.variables.put(dummy, decl);
            }
            arguments.add(decl.toArgument());
        }

        TypeSpec resultType = null;
        int resultRank = Rank.UNKNOWN;
        if (kind == UnitKind.FUNCTION) {
            PtNode suffix = stmt.child(ConstructTag.SUFFIX);
            String resultName = suffix != null && suffix.nameValue() != null ? lower(suffix.nameValue()) : name;
            VariableDecl result = scope.variables.get(resultName);
            PtNode prefix = stmt.child(ConstructTag.PREFIX_SPEC);
            TypeSpec prefixType = prefix != null
                    ? DeclarationReader.typeOf(prefix.firstDescendant(ConstructTag.DECLARATION_TYPE_SPEC))
                    : TypeSpec.UNKNOWN;
            resultType = prefixType.isKnown() || result == null ? prefixType : result.type();
            resultRank = result != null ? result.rank() : 0;
        }
        registry.define(id, location(node), new SubprogramPayload(arguments, resultType, resultRank));
        scope.flush();
        return id;
    }

    private UnitId internUnit(UnitId container, String name, UnitKind kind, int line) {
        try {
            return registry.intern(container, name, kind);
        } catch (NameKindConflictException e) {
            System.err.println("[flinspect] WARNING: " + fileKey + ":" + line + ": " + e.getMessage());
            return registry.internShadow(container, name, kind);
        }
    }

    // ------------------------------------------------------------------
    // Scope walk
    // ------------------------------------------------------------------

    /** Visits the constructs of one scope; nested scopes get their own walk. */
    private void walk(Scope scope, PtNode node) {
        List<PtNode> kids = node.children();
        for (int i = 0; i < kids.size(); i++) {
            PtNode c = kids.get(i);
            switch (c.tag()) {
                case MODULE_STMT, PROGRAM_STMT, SUBROUTINE_STMT, FUNCTION_STMT -> { }
                case USE_STMT -> useStmt(scope, c);
                case TYPE_DECLARATION_STMT -> typeDeclaration(scope, c);
                case OPTIONAL_STMT -> {
                    for (String n : listedNames(c, kids, i)) {
                        scope.update(n, d -> d.withOptional(true));
                    }
                }
                case INTENT_STMT -> {
                    PtNode spec = c.firstDescendant(ConstructTag.INTENT);
                    Intent intent = Intent.fromDump(spec != null ? spec.value() : null);
                    for (String n : listedNames(c, kids, i)) {
                        scope.update(n, d -> d.withIntent(intent));
                    }
                }
                case DIMENSION_STMT, ALLOCATABLE_STMT, POINTER_STMT, TARGET_STMT -> shapeStmt(scope, c, kids, i);
                case ACCESS_STMT -> accessStmt(scope, c, kids, i);
                case INTERFACE_BLOCK -> interfaceBlock(scope, c);
                case DERIVED_TYPE_DEF -> derivedType(scope, c);
                case SUBROUTINE_SUBPROGRAM -> extractSubprogram(scope.id, c, UnitKind.SUBROUTINE);
                case FUNCTION_SUBPROGRAM -> extractSubprogram(scope.id, c, UnitKind.FUNCTION);
                case CALL_STMT -> callStmt(scope, c);
                default -> walk(scope, c);
            }
        }
    }

    private static List<String> listedNames(PtNode stmt, List<PtNode> siblings, int index) {
        List<String> names = new ArrayList<>();
        for (PtNode item : DeclarationReader.itemsWithTrailing(stmt, siblings, index, NAME_LIST)) {
            if (item.is(ConstructTag.NAME)) names.add(lower(item.value()));
        }
        return names;
    }

    private void useStmt(Scope scope, PtNode stmt) {
        String moduleName = lower(stmt.nameValue());
        if (moduleName == null) return;
        List<String> only = null;
        Map<String, String> renames = new TreeMap<>();
        for (PtNode c : stmt.children()) {
            if (c.is(ConstructTag.ONLY)) {
                if (only == null) only = new ArrayList<>();
                PtNode rename = c.firstDescendant(ConstructTag.RENAME);
                if (rename != null) {
                    addRename(rename, renames);
                } else {
                    String name = DeclarationReader.genericSpecName(c.firstDescendant(ConstructTag.GENERIC_SPEC));
                    if (name == null) name = lower(c.nameValue());
                    if (name != null) only.add(name);
                }
            } else if (c.is(ConstructTag.RENAME)) {
                addRename(c, renames);
            }
        }
        UnitId module = internUnit(null, moduleName, UnitKind.MODULE, stmt.line());
        registry.addUse(new UsesEdge(scope.id, module, only, renames, stmt.line()));
    }

    /** {@code Rename -> Names} lists the local name, then the remote one. */
    private static void addRename(PtNode rename, Map<String, String> renames) {
        List<PtNode> names = rename.descendants(ConstructTag.NAME);
        if (names.size() >= 2) {
            renames.put(lower(names.get(0).value()), lower(names.get(1).value()));
        }
    }

    private void typeDeclaration(Scope scope, PtNode stmt) {
        TypeSpec type = DeclarationReader.typeOf(stmt.child(ConstructTag.DECLARATION_TYPE_SPEC));
        Integer attrRank = null;
        boolean optional = false;
        Intent intent = Intent.UNSPECIFIED;
        Boolean access = null;

        List<PtNode> kids = stmt.children();
        for (int i = 0; i < kids.size(); i++) {
            PtNode c = kids.get(i);
            if (!c.is(ConstructTag.ATTR_SPEC)) continue;
            Integer rank = DeclarationReader.rankOf(kids, i);
            if (rank != null) attrRank = rank;
            if (c.child(ConstructTag.OPTIONAL) != null) optional = true;
            PtNode intentNode = c.firstDescendant(ConstructTag.INTENT);
            if (intentNode != null) intent = Intent.fromDump(intentNode.value());
            Boolean a = DeclarationReader.accessOf(c.child(ConstructTag.ACCESS_SPEC));
            if (a != null) access = a;
        }

        for (PtNode entity : stmt.children(ConstructTag.ENTITY_DECL)) {
            String name = lower(entity.nameValue());
            if (name == null) continue;
            // the entity's own array spec wins over the DIMENSION attribute
            Integer rank = DeclarationReader.declaredRank(entity);
            if (rank == null) rank = attrRank;
            scope.declare(new VariableDecl(name, type, rank != null ? rank : 0, optional, intent, entity.line()),
                    rank != null);
            if (access != null) scope.setAccess(name, access);
        }
    }

    /** DIMENSION, ALLOCATABLE, POINTER and TARGET statements; entries without a shape change nothing. */
    private void shapeStmt(Scope scope, PtNode stmt, List<PtNode> siblings, int index) {
        for (PtNode item : DeclarationReader.itemsWithTrailing(stmt, siblings, index, SHAPED_ENTITIES)) {
            if (!SHAPED_ENTITIES.contains(item.tag())) continue;
            String name = lower(item.nameValue());
            Integer rank = DeclarationReader.declaredRank(item);
            if (name != null && rank != null) scope.shape(name, rank);
        }
    }

    private void accessStmt(Scope scope, PtNode stmt, List<PtNode> siblings, int index) {
        Boolean access = DeclarationReader.accessOf(stmt.child(ConstructTag.ACCESS_SPEC));
        if (access == null) return;
        List<String> names = new ArrayList<>();
        for (PtNode item : DeclarationReader.itemsWithTrailing(stmt, siblings, index, ACCESS_ID_LIST)) {
            if (!item.is(ConstructTag.ACCESS_ID)) continue;
            String name = DeclarationReader.genericSpecName(item.firstDescendant(ConstructTag.GENERIC_SPEC));
            if (name == null) {
                PtNode n = item.firstDescendant(ConstructTag.NAME);
                name = n != null ? lower(n.value()) : null;
            }
            if (name != null) names.add(name);
        }
        if (names.isEmpty()) {
            scope.defaultPrivate = !access;
        } else {
            for (String name : names) scope.setAccess(name, access);
        }
    }

    private void interfaceBlock(Scope scope, PtNode block) {
        PtNode stmt = block.child(ConstructTag.INTERFACE_STMT);
        String genericName = stmt != null
                ? DeclarationReader.genericSpecName(stmt.firstDescendant(ConstructTag.GENERIC_SPEC))
                : null;

        List<String> members = new ArrayList<>();
        for (PtNode spec : block.children(ConstructTag.INTERFACE_SPECIFICATION)) {
            for (PtNode procedureStmt : spec.descendants(ConstructTag.PROCEDURE_STMT)) {
                for (PtNode n : procedureStmt.children(ConstructTag.NAME)) members.add(lower(n.value()));
            }
            for (PtNode body : spec.descendants(ConstructTag.INTERFACE_BODY)) {
                for (PtNode c : body.children()) {
                    UnitId bodyId = null;
                    if (c.is(ConstructTag.SUBROUTINE_BODY)) {
                        bodyId = extractSubprogram(scope.id, c, UnitKind.SUBROUTINE);
                    } else if (c.is(ConstructTag.FUNCTION_BODY)) {
                        bodyId = extractSubprogram(scope.id, c, UnitKind.FUNCTION);
                    }
                    if (bodyId != null) members.add(registry.unit(bodyId).name());
                }
            }
        }
        if (genericName == null) return;

        UnitId id = internUnit(scope.id, genericName, UnitKind.INTERFACE, block.line());
        registry.define(id, location(block), new InterfacePayload(members));
    }

    private void derivedType(Scope scope, PtNode def) {
        PtNode stmt = def.child(ConstructTag.DERIVED_TYPE_STMT);
        String name = null;
        if (stmt != null) {
            name = stmt.nameValue();
            if (name == null) {
                PtNode n = stmt.firstDescendant(ConstructTag.NAME);
                name = n != null ? n.value() : null;
            }
        }
        if (name == null) return;

        List<ComponentDescriptor> components = new ArrayList<>();
        for (PtNode component : def.descendants(ConstructTag.DATA_COMPONENT_DEF_STMT)) {
            TypeSpec type = DeclarationReader.typeOf(component.child(ConstructTag.DECLARATION_TYPE_SPEC));
            Integer attrRank = null;
            List<PtNode> kids = component.children();
            for (int i = 0; i < kids.size(); i++) {
                if (kids.get(i).is(ConstructTag.COMPONENT_ATTR_SPEC)) {
                    Integer rank = DeclarationReader.rankOf(kids, i);
                    if (rank != null) attrRank = rank;
                }
            }
            for (PtNode decl : component.descendants(ConstructTag.COMPONENT_DECL)) {
                String field = lower(decl.nameValue());
                if (field == null) continue;
                Integer rank = null;
                List<PtNode> declKids = decl.children();
                for (int i = 0; i < declKids.size(); i++) {
                    if (declKids.get(i).is(ConstructTag.COMPONENT_ARRAY_SPEC)) rank = DeclarationReader.rankOf(declKids, i);
                }
                int finalRank = rank != null ? rank : attrRank != null ? attrRank : 0;
                components.add(new ComponentDescriptor(field, type, finalRank));
            }
        }

        UnitId id = internUnit(scope.id, lower(name), UnitKind.DERIVED_TYPE, def.line());
        registry.define(id, location(def), new DerivedTypePayload(components));
    }

    private void callStmt(Scope scope, PtNode stmt) {
        PtNode call = stmt.firstDescendant(ConstructTag.CALL);
        if (call == null) return;
        PtNode designator = call.child(ConstructTag.PROCEDURE_DESIGNATOR);
        if (designator == null) return;

        String callee;
        CallForm form;
        PtNode componentRef = designator.child(ConstructTag.PROC_COMPONENT_REF);
        if (componentRef != null) {
            PtNode component = componentRef.firstDescendant(ConstructTag.STRUCTURE_COMPONENT);
            callee = component != null ? lower(component.nameValue()) : null;
            form = CallForm.COMPONENT;
        } else {
            callee = lower(designator.nameValue());
            form = CallForm.NAME;
        }
        if (callee == null) return;

        List<ActualArgument> arguments = new ArrayList<>();
        for (PtNode spec : call.children(ConstructTag.ACTUAL_ARG_SPEC)) {
            PtNode keyword = spec.child(ConstructTag.KEYWORD);
            String kw = keyword != null ? lower(keyword.nameValue()) : null;
            arguments.add(new ActualArgument(kw, ArgumentFormReader.formOf(spec.child(ConstructTag.ACTUAL_ARG))));
        }
        String id = fileKey + ":" + stmt.line() + ":" + (callOrdinal++);
        registry.addCallSite(new CallSite(id, scope.id, callee, form, arguments, location(stmt)));
    }

    // ------------------------------------------------------------------

    private SourceLocation location(PtNode node) {
        return new SourceLocation(fileKey, node.line());
    }

    private String fileStem() {
        int dot = fileKey.lastIndexOf('.');
        return dot > 0 ? fileKey.substring(0, dot) : fileKey;
    }

    /** Declarations and accessibility collected while walking one scope. */
    private final class Scope {
        final UnitId id;
        final Map<String, VariableDecl> variables = new LinkedHashMap<>();
        final Set<String> publicNames = new TreeSet<>();
        final Set<String> privateNames = new TreeSet<>();
        final Map<String, Integer> statementRanks = new HashMap<>();
        boolean defaultPrivate;

        Scope(UnitId id) {
            this.id = id;
        }

        /**
         * A type declaration keeps attributes set earlier by OPTIONAL or INTENT statements, and
         * the rank of a shape statement unless it declares a shape of its own.
         */
        void declare(VariableDecl decl, boolean shaped) {
            VariableDecl earlier = variables.get(decl.name());
            Integer statementRank = statementRanks.get(decl.name());
            int rank = !shaped && statementRank != null ? statementRank : decl.rank();
            if (earlier != null || rank != decl.rank()) {
                boolean earlierOptional = earlier != null && earlier.optional();
                Intent earlierIntent = earlier != null ? earlier.intent() : Intent.UNSPECIFIED;
                decl = new VariableDecl(decl.name(), decl.type(), rank,
                        decl.optional() || earlierOptional,
                        decl.intent() != Intent.UNSPECIFIED ? decl.intent() : earlierIntent,
                        decl.line());
            }
            variables.put(decl.name(), decl);
        }

        void update(String name, UnaryOperator<VariableDecl> change) {
            variables.put(name, change.apply(variables.getOrDefault(name, VariableDecl.undeclared(name))));
        }

        void shape(String name, int rank) {
            statementRanks.put(name, rank);
            update(name, d -> d.withRank(rank));
        }

        void setAccess(String name, boolean isPublic) {
            (isPublic ? publicNames : privateNames).add(name);
        }

        void flush() {
            for (VariableDecl decl : variables.values()) registry.declare(id, decl);
        }
    }
}
