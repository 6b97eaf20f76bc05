package com.geometry.deduction.constraint;

/**
 * Callback run by the {@link ConstraintStore} after a new expression is registered
 * when automatic solving is enabled.
 */
@FunctionalInterface
public interface SolveTrigger {

    void solveSystem();
}
