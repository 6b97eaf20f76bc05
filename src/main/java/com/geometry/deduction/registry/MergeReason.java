package com.geometry.deduction.registry;

/**
 * Why an object was replaced by another.
 */
public enum MergeReason {
    /** A rename collided with the key of an existing object. */
    KEY_COLLISION,
    /** Two live objects were found to have the same structural identity. */
    DUPLICATE,
    /** An expression was superseded by its substituted form. */
    SUBSTITUTION,
    /** Direct replacement requested by a caller. */
    EXPLICIT
}
