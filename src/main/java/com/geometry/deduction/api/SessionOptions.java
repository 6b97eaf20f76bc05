package com.geometry.deduction.api;

import com.geometry.deduction.registry.EntityRegistry;
import com.geometry.deduction.solver.EquationSolver;

/**
 * Options for a geometry session.
 * Configures automatic solving, solver limits and cascade bounds.
 */
public class SessionOptions {

    private static final int DEFAULT_MAX_SOLVER_BRANCHES = 64;
    private static final long DEFAULT_ROOT_SEARCH_LIMIT = 1_000_000_000_000L;

    private final boolean autoSolve;
    private final int maxSolverBranches;
    private final long rootSearchLimit;
    private final int maxCascadeSteps;
    private final int maxSolvePasses;
    private final boolean typeOneConstructions;

    private SessionOptions(Builder builder) {
        this.autoSolve = builder.autoSolve;
        this.maxSolverBranches = builder.maxSolverBranches;
        this.rootSearchLimit = builder.rootSearchLimit;
        this.maxCascadeSteps = builder.maxCascadeSteps;
        this.maxSolvePasses = builder.maxSolvePasses;
        this.typeOneConstructions = builder.typeOneConstructions;
    }

    /** Solve after every newly asserted relation. */
    public boolean isAutoSolve() {
        return autoSolve;
    }

    public int getMaxSolverBranches() {
        return maxSolverBranches;
    }

    public long getRootSearchLimit() {
        return rootSearchLimit;
    }

    public int getMaxCascadeSteps() {
        return maxCascadeSteps;
    }

    public int getMaxSolvePasses() {
        return maxSolvePasses;
    }

    /** Run implied constructions, such as triangle enumeration, before the first target. */
    public boolean isTypeOneConstructions() {
        return typeOneConstructions;
    }

    /**
     * Creates default options.
     */
    public static SessionOptions defaults() {
        return builder().build();
    }

    /**
     * Creates options that only solve when asked to.
     */
    public static SessionOptions manualSolve() {
        return builder().autoSolve(false).build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private boolean autoSolve = true;
        private int maxSolverBranches = DEFAULT_MAX_SOLVER_BRANCHES;
        private long rootSearchLimit = DEFAULT_ROOT_SEARCH_LIMIT;
        private int maxCascadeSteps = EntityRegistry.DEFAULT_MAX_CASCADE_STEPS;
        private int maxSolvePasses = EquationSolver.DEFAULT_MAX_SOLVE_PASSES;
        private boolean typeOneConstructions = true;

        public Builder autoSolve(boolean autoSolve) {
            this.autoSolve = autoSolve;
            return this;
        }

        public Builder maxSolverBranches(int maxSolverBranches) {
            requirePositive(maxSolverBranches, "maxSolverBranches");
            this.maxSolverBranches = maxSolverBranches;
            return this;
        }

        public Builder rootSearchLimit(long rootSearchLimit) {
            requirePositive(rootSearchLimit, "rootSearchLimit");
            this.rootSearchLimit = rootSearchLimit;
            return this;
        }

        public Builder maxCascadeSteps(int maxCascadeSteps) {
            requirePositive(maxCascadeSteps, "maxCascadeSteps");
            this.maxCascadeSteps = maxCascadeSteps;
            return this;
        }

        public Builder maxSolvePasses(int maxSolvePasses) {
            requirePositive(maxSolvePasses, "maxSolvePasses");
            this.maxSolvePasses = maxSolvePasses;
            return this;
        }

        public Builder typeOneConstructions(boolean typeOneConstructions) {
            this.typeOneConstructions = typeOneConstructions;
            return this;
        }

        public SessionOptions build() {
            return new SessionOptions(this);
        }

        private static void requirePositive(long value, String name) {
            if (value <= 0) {
                throw new IllegalArgumentException(name + " must be positive");
            }
        }
    }

    @Override
    public String toString() {
        return "SessionOptions{" +
                "autoSolve=" + autoSolve +
                ", maxSolverBranches=" + maxSolverBranches +
                ", rootSearchLimit=" + rootSearchLimit +
                ", maxCascadeSteps=" + maxCascadeSteps +
                ", maxSolvePasses=" + maxSolvePasses +
                ", typeOneConstructions=" + typeOneConstructions +
                '}';
    }
}
