package com.flinspect.core.model;

import java.util.List;

/**
 * The unresolved seed of a Calls edge.
 *
 * @param id         {@code <file key>:<line>:<ordinal>}, unique across files
 * @param calleeName target name as written, lower-cased
 */
public record CallSite(
        String id,
        UnitId caller,
        String calleeName,
        CallForm form,
        List<ActualArgument> arguments,
        SourceLocation location
) {

    public CallSite {
        arguments = List.copyOf(arguments);
    }
}
