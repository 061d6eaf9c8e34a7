package com.flinspect.core.model;

/** One actual argument of a call, with its keyword if written {@code k=...}. */
public record ActualArgument(String keyword, ArgumentExpr expr) {

    public static ActualArgument positional(ArgumentExpr expr) {
        return new ActualArgument(null, expr);
    }

    public boolean hasKeyword() {
        return keyword != null;
    }
}
