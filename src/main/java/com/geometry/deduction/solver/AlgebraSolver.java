package com.geometry.deduction.solver;

import com.geometry.deduction.algebra.Polynomial;

import java.util.List;

/**
 * Algebra-solving capability used by the {@link EquationSolver}.
 * Each input polynomial is implicitly equated to zero.
 *
 * Implementations must distinguish "provably no solution" from "cannot solve with
 * the available methods": the former is fatal to the session, the latter is deferred
 * until more facts arrive.
 */
public interface AlgebraSolver {

    /**
     * Solves the system {@code p == 0} for every {@code p} in {@code equations}.
     * The call is atomic: it returns a complete outcome or throws.
     */
    SolverOutcome solve(List<Polynomial> equations);
}
