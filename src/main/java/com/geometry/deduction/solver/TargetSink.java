package com.geometry.deduction.solver;

import com.geometry.deduction.constraint.Expression;

import java.util.List;

/**
 * Receives the expressions left live after a solve pass so that entities whose
 * unknowns share an expression with a wanted measure can become targets too.
 */
@FunctionalInterface
public interface TargetSink {

    void expandTargets(List<Expression> liveExpressions);

    /**
     * Called once the outermost solve has finished and the system is stable again.
     */
    default void solveSettled() {
    }
}
