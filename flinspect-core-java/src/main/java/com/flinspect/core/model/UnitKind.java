package com.flinspect.core.model;

/** The closed set of program-unit kinds. */
public enum UnitKind {
    MODULE("module"),
    PROGRAM("program"),
    SUBROUTINE("subroutine"),
    FUNCTION("function"),
    INTERFACE("interface"),
    DERIVED_TYPE("type");

    private final String tag;

    UnitKind(String tag) {
        this.tag = tag;
    }

    /** Short tag used inside {@link UnitId} strings. */
    public String tag() { return tag; }

    public boolean isProcedure() {
        return this == SUBROUTINE || this == FUNCTION;
    }

    /**
     * Whether two units of these kinds may share one qualified name.
     * A generic interface may be named after a specific procedure or a derived type.
     */
    public static boolean compatible(UnitKind a, UnitKind b) {
        if (a == INTERFACE) return b.isProcedure() || b == DERIVED_TYPE;
        if (b == INTERFACE) return a.isProcedure() || a == DERIVED_TYPE;
        return false;
    }
}
