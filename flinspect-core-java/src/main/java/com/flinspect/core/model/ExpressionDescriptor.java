package com.flinspect.core.model;

/**
 * Minimal shape of an actual argument, enough to test it against a dummy argument.
 */
public sealed interface ExpressionDescriptor {

    record NamedVariable(String name, TypeSpec type, int rank) implements ExpressionDescriptor {}

    /**
     * @param scalarSubscripts   subscripts that remove a dimension
     * @param retainedSubscripts triplets and array-valued subscripts, which keep a dimension
     */
    record ArrayElementOrSlice(String base, TypeSpec type, int baseRank, int scalarSubscripts, int retainedSubscripts)
            implements ExpressionDescriptor {

        /** Base rank minus scalar subscripts; unknown if the base rank is unknown. */
        public int rank() {
            if (!Rank.isKnown(baseRank)) return Rank.UNKNOWN;
            int r = baseRank - scalarSubscripts;
            return r >= 0 ? r : Rank.UNKNOWN;
        }
    }

    /** Field access through a derived-type value; the field type is never recovered. */
    record StructureComponent(String field) implements ExpressionDescriptor {}

    record Literal(IntrinsicType type) implements ExpressionDescriptor {}

    record Unclassified(String reason) implements ExpressionDescriptor {}
}
