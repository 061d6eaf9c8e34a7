package com.flinspect.core.model;

/** A resolved (or explicitly unresolved) Calls edge. */
public record CallEdge(CallSite site, Resolution resolution) {

    public UnitId caller() {
        return site.caller();
    }

    public ResolutionStatus status() {
        return resolution.status();
    }
}
