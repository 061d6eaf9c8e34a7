package com.flinspect.core.extract;

import com.flinspect.core.model.IntrinsicType;
import com.flinspect.core.model.Rank;
import com.flinspect.core.model.TypeSpec;
import com.flinspect.core.parse_tree.ConstructTag;
import com.flinspect.core.parse_tree.PtNode;

import java.util.ArrayList;
import java.util.EnumSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * Reads declared types, ranks and accessibility out of declaration subtrees.
 */
final class DeclarationReader {

    static final Set<ConstructTag> SHAPE_SPECS = EnumSet.of(
            ConstructTag.ASSUMED_SHAPE_SPEC,
            ConstructTag.EXPLICIT_SHAPE_SPEC,
            ConstructTag.DEFERRED_SHAPE_SPEC_LIST,
            ConstructTag.ASSUMED_SIZE_SPEC,
            ConstructTag.ASSUMED_RANK_SPEC);

    private DeclarationReader() {}

    static String lower(String name) {
        return name == null ? null : name.toLowerCase(Locale.ROOT);
    }

    /** Type named by a {@code DeclarationTypeSpec} subtree; unknown if absent or unrecognized. */
    static TypeSpec typeOf(PtNode declarationTypeSpec) {
        if (declarationTypeSpec == null) return TypeSpec.UNKNOWN;
        PtNode typeNode = firstTypeNode(declarationTypeSpec);
        if (typeNode == null) return TypeSpec.UNKNOWN;
        return switch (typeNode.tag()) {
            case INTEGER_TYPE_SPEC -> TypeSpec.of(IntrinsicType.INTEGER);
            case REAL, DOUBLE_PRECISION -> TypeSpec.of(IntrinsicType.REAL);
            case COMPLEX, DOUBLE_COMPLEX -> TypeSpec.of(IntrinsicType.COMPLEX);
            case LOGICAL -> TypeSpec.of(IntrinsicType.LOGICAL);
            case CHARACTER -> TypeSpec.of(IntrinsicType.CHARACTER);
            case TYPE, CLASS -> {
                PtNode spec = typeNode.firstDescendant(ConstructTag.DERIVED_TYPE_SPEC);
                String name = spec != null ? lower(spec.nameValue()) : null;
                yield TypeSpec.derived(name, typeNode.is(ConstructTag.CLASS));
            }
            default -> TypeSpec.UNKNOWN;
        };
    }

    private static PtNode firstTypeNode(PtNode node) {
        for (PtNode c : node.children()) {
            switch (c.tag()) {
                case INTEGER_TYPE_SPEC, REAL, DOUBLE_PRECISION, COMPLEX, DOUBLE_COMPLEX,
                        LOGICAL, CHARACTER, TYPE, CLASS -> {
                    return c;
                }
                default -> {
                    PtNode found = firstTypeNode(c);
                    if (found != null) return found;
                }
            }
        }
        return null;
    }

    /**
     * Rank declared by the array spec held by {@code siblings.get(index)} (an {@code ArraySpec},
     * or a node with one below it). The front end prints the second and later specs of a list as
     * following siblings of the holder, so those are counted too. Returns null if the holder
     * carries no array spec.
     */
    static Integer rankOf(List<PtNode> siblings, int index) {
        PtNode holder = siblings.get(index);
        PtNode arraySpec = arraySpecOf(holder);
        if (arraySpec == null) return null;
        List<PtNode> specs = new ArrayList<>(arraySpec.children());
        for (int j = index + 1; j < siblings.size() && SHAPE_SPECS.contains(siblings.get(j).tag()); j++) {
            specs.add(siblings.get(j));
        }
        return countRank(specs);
    }

    /**
     * Rank given by the array spec directly under an entity ({@code EntityDecl}, or an entry of a
     * DIMENSION, ALLOCATABLE, POINTER or TARGET statement). POINTER entries carry a bare
     * {@code DeferredShapeSpecList}. Returns null if the entity names no shape.
     */
    static Integer declaredRank(PtNode entity) {
        List<PtNode> kids = entity.children();
        for (int i = 0; i < kids.size(); i++) {
            PtNode c = kids.get(i);
            if (c.is(ConstructTag.ARRAY_SPEC)) return rankOf(kids, i);
            if (c.is(ConstructTag.DEFERRED_SHAPE_SPEC_LIST)) {
                List<PtNode> specs = new ArrayList<>();
                for (int j = i; j < kids.size() && SHAPE_SPECS.contains(kids.get(j).tag()); j++) {
                    specs.add(kids.get(j));
                }
                return countRank(specs);
            }
        }
        return null;
    }

    static PtNode arraySpecOf(PtNode holder) {
        if (holder.is(ConstructTag.ARRAY_SPEC) || holder.is(ConstructTag.COMPONENT_ARRAY_SPEC)) return holder;
        PtNode spec = holder.firstDescendant(ConstructTag.ARRAY_SPEC);
        return spec != null ? spec : holder.firstDescendant(ConstructTag.COMPONENT_ARRAY_SPEC);
    }

    private static int countRank(List<PtNode> specs) {
        int rank = 0;
        for (PtNode spec : specs) {
            switch (spec.tag()) {
                case ASSUMED_SHAPE_SPEC, EXPLICIT_SHAPE_SPEC -> rank++;
                case DEFERRED_SHAPE_SPEC_LIST -> rank += deferredCount(spec);
                case ASSUMED_SIZE_SPEC -> rank += spec.children(ConstructTag.EXPLICIT_SHAPE_SPEC).size() + 1;
                case ASSUMED_RANK_SPEC -> {
                    return Rank.UNKNOWN;
                }
                default -> { }
            }
        }
        return rank;
    }

    /** {@code DeferredShapeSpecList -> int = '2'} stores the count rather than listing colons. */
    private static int deferredCount(PtNode spec) {
        String value = spec.value();
        if (value == null && !spec.children().isEmpty()) value = spec.children().get(0).value();
        if (value == null) return 1;
        try {
            return Integer.parseInt(value.trim());
        } catch (NumberFormatException e) {
            return 1;
        }
    }

    /**
     * Accessibility named in an {@code AccessSpec} subtree: TRUE for public, FALSE for private,
     * null if neither is found.
     */
    static Boolean accessOf(PtNode accessSpec) {
        if (accessSpec == null) return null;
        Boolean own = accessWord(accessSpec.value());
        if (own != null) return own;
        for (PtNode c : accessSpec.children()) {
            Boolean word = accessWord(c.value() != null ? c.value() : c.label());
            if (word != null) return word;
            Boolean nested = accessOf(c);
            if (nested != null) return nested;
        }
        return null;
    }

    private static Boolean accessWord(String text) {
        if (text == null) return null;
        if (text.equalsIgnoreCase("public")) return Boolean.TRUE;
        if (text.equalsIgnoreCase("private")) return Boolean.FALSE;
        return null;
    }

    /**
     * Name of a {@code GenericSpec}: a plain name, {@code operator(<op>)} or {@code assignment(=)}.
     */
    static String genericSpecName(PtNode genericSpec) {
        if (genericSpec == null) return null;
        String plain = genericSpec.nameValue();
        if (plain != null) return lower(plain);
        if (genericSpec.child(ConstructTag.ASSIGNMENT) != null) return "assignment(=)";
        PtNode op = genericSpec.child(ConstructTag.DEFINED_OPERATOR);
        if (op != null) {
            PtNode named = op.firstDescendant(ConstructTag.NAME);
            if (named != null) return "operator(" + lower(named.value()) + ")";
            for (PtNode c : op.children()) {
                if (c.value() != null) return "operator(" + lower(c.value()) + ")";
                if (!c.children().isEmpty() && c.children().get(0).value() != null) {
                    return "operator(" + lower(c.children().get(0).value()) + ")";
                }
            }
        }
        PtNode any = genericSpec.firstDescendant(ConstructTag.NAME);
        return any != null ? lower(any.value()) : null;
    }

    /**
     * Children of {@code stmt} followed by the contiguous siblings after it whose tag is in
     * {@code listTags}: the front end prints list tails at the statement's own depth.
     */
    static List<PtNode> itemsWithTrailing(PtNode stmt, List<PtNode> siblings, int index, Set<ConstructTag> listTags) {
        List<PtNode> items = new ArrayList<>(stmt.children());
        for (int j = index + 1; j < siblings.size() && listTags.contains(siblings.get(j).tag()); j++) {
            items.add(siblings.get(j));
        }
        return items;
    }
}
