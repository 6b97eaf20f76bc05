package com.geometry.deduction.metrics;

import com.geometry.deduction.core.model.ObjectKind;
import com.geometry.deduction.solver.SolverOutcome;

import java.time.Duration;

/**
 * No-op implementation of {@link MetricsService}.
 */
public class NoOpMetricsService implements MetricsService {

    @Override
    public void incrementEntityCreated(ObjectKind kind) {
    }

    @Override
    public void incrementEntityMerged(ObjectKind kind) {
    }

    @Override
    public void incrementExpressionAsserted() {
    }

    @Override
    public void incrementExpressionResolved() {
    }

    @Override
    public void recordSolveDuration(SolverOutcome.Status status, Duration duration) {
    }

    @Override
    public void recordSolutionBranches(int branches) {
    }

    @Override
    public void incrementTargetAdded(ObjectKind kind) {
    }

    @Override
    public void incrementTheoremApplied(String theorem) {
    }
}
