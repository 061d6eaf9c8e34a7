package com.flinspect.core.model;

/** How a CALL statement names its target. */
public enum CallForm {
    /** {@code call f(...)} */
    NAME,
    /** {@code call obj%proc(...)}; type-bound dispatch is not resolved. */
    COMPONENT
}
