package com.flinspect.core.model;

/** One data component of a derived type. */
public record ComponentDescriptor(String name, TypeSpec type, int rank) {}
