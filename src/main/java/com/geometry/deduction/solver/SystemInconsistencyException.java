package com.geometry.deduction.solver;

import com.geometry.deduction.core.GeometryException;

/**
 * Thrown when the asserted relations cannot all hold for positive measures: the
 * algebra solver proves there is no solution, a uniquely determined measure is not
 * positive, candidates fail to narrow to exactly one positive value, or a
 * substitution leaves a nonzero constant.
 */
public class SystemInconsistencyException extends GeometryException {

    public SystemInconsistencyException(String message) {
        super(message);
    }
}
