package com.flinspect.core.model;

public record ContainsEdge(UnitId parent, UnitId child) {}
