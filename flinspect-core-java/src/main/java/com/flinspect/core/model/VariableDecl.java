package com.flinspect.core.model;

import java.util.Comparator;

/** A variable declared in a scope, dummy arguments included. */
public record VariableDecl(String name, TypeSpec type, int rank, boolean optional, Intent intent, int line) {

    /** Total order used to pick one declaration when a merged scope holds two. */
    public static final Comparator<VariableDecl> ORDER = Comparator
            .comparingInt(VariableDecl::line)
            .thenComparing(VariableDecl::name)
            .thenComparingInt(VariableDecl::rank)
            .thenComparing(d -> d.type().toString())
            .thenComparing(VariableDecl::optional)
            .thenComparing(VariableDecl::intent);

    public static VariableDecl undeclared(String name) {
        return new VariableDecl(name, TypeSpec.UNKNOWN, Rank.UNKNOWN, false, Intent.UNSPECIFIED, 0);
    }

    public VariableDecl withType(TypeSpec newType) {
        return new VariableDecl(name, newType, rank, optional, intent, line);
    }

    public VariableDecl withRank(int newRank) {
        return new VariableDecl(name, type, newRank, optional, intent, line);
    }

    public VariableDecl withOptional(boolean newOptional) {
        return new VariableDecl(name, type, rank, newOptional, intent, line);
    }

    public VariableDecl withIntent(Intent newIntent) {
        return new VariableDecl(name, type, rank, optional, newIntent, line);
    }

    public ArgumentDescriptor toArgument() {
        return new ArgumentDescriptor(name, type, rank, optional, intent);
    }
}
