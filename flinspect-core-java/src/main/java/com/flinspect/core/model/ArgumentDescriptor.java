package com.flinspect.core.model;

/** One dummy argument of a subprogram, in declaration order. */
public record ArgumentDescriptor(String name, TypeSpec type, int rank, boolean optional, Intent intent) {

    @Override
    public String toString() {
        return name + ": " + type + " rank " + Rank.format(rank) + (optional ? " optional" : "");
    }
}
