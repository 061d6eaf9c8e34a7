package com.flinspect.core.model;

import java.util.List;

/**
 * An interface's member names after binding.
 *
 * @param bound   members that name a subroutine or function in the registry
 * @param unbound member names with no procedure yet, typically defined in a file not merged in
 */
public record InterfaceMembers(List<UnitId> bound, List<String> unbound) {

    public static final InterfaceMembers NONE = new InterfaceMembers(List.of(), List.of());

    public InterfaceMembers {
        bound = List.copyOf(bound);
        unbound = List.copyOf(unbound);
    }
}
