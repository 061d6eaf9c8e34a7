package com.flinspect.core.model;

/**
 * Stable identity of a program unit.
 *
 * Ids are built from the container's id, the kind tag and the name, e.g.
 * {@code module:m/subroutine:s}. Top-level units other than modules carry the dump
 * file key ({@code program:p@main_ptree}) because only modules merge across files.
 */
public record UnitId(String value) implements Comparable<UnitId> {

    public UnitId {
        if (value == null || value.isEmpty()) {
            throw new IllegalArgumentException("UnitId value must not be empty");
        }
    }

    public static UnitId of(UnitKind kind, UnitId container, String name, String fileKey) {
        if (container != null) {
            return new UnitId(container.value + "/" + kind.tag() + ":" + name);
        }
        if (kind == UnitKind.MODULE || fileKey == null) {
            return new UnitId(kind.tag() + ":" + name);
        }
        return new UnitId(kind.tag() + ":" + name + "@" + fileKey);
    }

    public static UnitId module(String name) {
        return of(UnitKind.MODULE, null, name, null);
    }

    @Override
    public int compareTo(UnitId other) {
        return value.compareTo(other.value);
    }

    @Override
    public String toString() {
        return value;
    }
}
