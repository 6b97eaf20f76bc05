package com.geometry.deduction.solver;

import com.geometry.deduction.algebra.Polynomial;
import com.geometry.deduction.algebra.Unknown;

import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Result of an {@link AlgebraSolver} call.
 *
 * @param status   overall outcome
 * @param branches solution branches, each a partial assignment of unknowns; empty unless SOLVED
 */
public record SolverOutcome(Status status, List<Map<Unknown, Polynomial>> branches) {

    public enum Status {
        SOLVED,
        NO_SOLUTION,
        CANNOT_SOLVE
    }

    public SolverOutcome {
        Objects.requireNonNull(status, "status is required");
        branches = branches != null
                ? branches.stream().map(Map::copyOf).toList()
                : List.of();
        if (status == Status.SOLVED && branches.isEmpty()) {
            throw new IllegalArgumentException("SOLVED outcome requires at least one branch");
        }
    }

    public static SolverOutcome solved(List<Map<Unknown, Polynomial>> branches) {
        return new SolverOutcome(Status.SOLVED, branches);
    }

    public static SolverOutcome noSolution() {
        return new SolverOutcome(Status.NO_SOLUTION, List.of());
    }

    public static SolverOutcome cannotSolve() {
        return new SolverOutcome(Status.CANNOT_SOLVE, List.of());
    }

    public boolean isSolved() {
        return status == Status.SOLVED;
    }
}
