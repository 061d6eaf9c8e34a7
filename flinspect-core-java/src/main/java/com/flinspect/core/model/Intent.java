package com.flinspect.core.model;

public enum Intent {
    IN,
    OUT,
    INOUT,
    UNSPECIFIED;

    /** Maps the dump's {@code Intent = In|Out|InOut} value. */
    public static Intent fromDump(String value) {
        if (value == null) return UNSPECIFIED;
        return switch (value.toLowerCase()) {
            case "in" -> IN;
            case "out" -> OUT;
            case "inout" -> INOUT;
            default -> UNSPECIFIED;
        };
    }
}
