package com.geometry.deduction.metrics;

import com.geometry.deduction.core.model.ObjectKind;
import com.geometry.deduction.solver.SolverOutcome;

import java.time.Duration;

/**
 * Interface for recording deduction engine metrics.
 * Implementations can integrate with Micrometer or other metrics systems.
 * The default {@link NoOpMetricsService} does nothing, so a session works
 * without any metrics backend configured.
 */
public interface MetricsService {

    void incrementEntityCreated(ObjectKind kind);

    void incrementEntityMerged(ObjectKind kind);

    void incrementExpressionAsserted();

    void incrementExpressionResolved();

    void recordSolveDuration(SolverOutcome.Status status, Duration duration);

    void recordSolutionBranches(int branches);

    void incrementTargetAdded(ObjectKind kind);

    void incrementTheoremApplied(String theorem);
}
