package com.flinspect.core.model;

import java.util.List;

/**
 * Syntactic form of an actual argument, as recorded by the extractor.
 * Turned into an {@link ExpressionDescriptor} at resolution time.
 */
public sealed interface ArgumentExpr {

    /** A bare name: {@code x}. */
    record NameRef(String name) implements ArgumentExpr {}

    /**
     * A subscripted name: {@code a(i, :)}.
     *
     * @param callShaped the dump rendered it as a function reference rather than an array element
     */
    record Subscripted(String name, boolean callShaped, List<Subscript> subscripts) implements ArgumentExpr {

        public Subscripted {
            subscripts = List.copyOf(subscripts);
        }
    }

    /** A structure component: {@code a%b%c}, keeping the innermost field. */
    record ComponentRef(String field) implements ArgumentExpr {}

    record LiteralExpr(IntrinsicType type) implements ArgumentExpr {}

    /** Anything else, tagged with the dump label that introduced it. */
    record OtherExpr(String label) implements ArgumentExpr {}

    /**
     * One subscript position.
     *
     * @param value the subscript expression, null for a triplet
     */
    record Subscript(boolean triplet, ArgumentExpr value) {

        public static Subscript ofTriplet() {
            return new Subscript(true, null);
        }

        public static Subscript of(ArgumentExpr value) {
            return new Subscript(false, value);
        }
    }
}
