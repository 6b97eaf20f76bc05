package com.geometry.deduction.constraint;

/**
 * Lifecycle of an {@link Expression}.
 */
public enum ExpressionState {
    /** Asserted directly, still has free unknowns. */
    UNRESOLVED,
    /** Successor of an earlier expression after substitution, still has free unknowns. */
    PARTIALLY_SUBSTITUTED,
    /** Reduced to zero; terminal and never stored. */
    RESOLVED,
    /** Reduced to a nonzero constant; terminal and fatal. */
    CONTRADICTION;

    public boolean isTerminal() {
        return this == RESOLVED || this == CONTRADICTION;
    }
}
