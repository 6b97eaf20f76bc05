package com.geometry.deduction.metrics;

import com.geometry.deduction.core.model.ObjectKind;
import com.geometry.deduction.solver.SolverOutcome;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.DistributionSummary;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;

import java.time.Duration;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Micrometer-based implementation of {@link MetricsService}.
 *
 * <p>Recorded metrics:</p>
 * <ul>
 *   <li>{@code geometry.entity.created} Counter (tag: kind)</li>
 *   <li>{@code geometry.entity.merged} Counter (tag: kind)</li>
 *   <li>{@code geometry.expression.asserted} Counter</li>
 *   <li>{@code geometry.expression.resolved} Counter</li>
 *   <li>{@code geometry.solve.duration} Timer (tag: status)</li>
 *   <li>{@code geometry.solve.branches} DistributionSummary</li>
 *   <li>{@code geometry.target.added} Counter (tag: kind)</li>
 *   <li>{@code geometry.theorem.applied} Counter (tag: theorem)</li>
 * </ul>
 */
public class MicrometerMetricsService implements MetricsService {

    private final MeterRegistry registry;
    private final Map<String, Timer> timerCache = new ConcurrentHashMap<>();
    private final Map<String, Counter> counterCache = new ConcurrentHashMap<>();
    private final Counter expressionAssertedCounter;
    private final Counter expressionResolvedCounter;
    private final DistributionSummary branchesSummary;

    public MicrometerMetricsService(MeterRegistry registry) {
        this.registry = registry;
        this.expressionAssertedCounter = Counter.builder("geometry.expression.asserted")
                .description("Number of constraint expressions registered")
                .register(registry);
        this.expressionResolvedCounter = Counter.builder("geometry.expression.resolved")
                .description("Number of constraint expressions resolved to zero")
                .register(registry);
        this.branchesSummary = DistributionSummary.builder("geometry.solve.branches")
                .description("Number of solution branches returned by the algebra solver")
                .register(registry);
    }

    @Override
    public void incrementEntityCreated(ObjectKind kind) {
        taggedCounter("geometry.entity.created", "Number of registered objects created", "kind", kind.name())
                .increment();
    }

    @Override
    public void incrementEntityMerged(ObjectKind kind) {
        taggedCounter("geometry.entity.merged", "Number of registered objects merged away", "kind", kind.name())
                .increment();
    }

    @Override
    public void incrementExpressionAsserted() {
        expressionAssertedCounter.increment();
    }

    @Override
    public void incrementExpressionResolved() {
        expressionResolvedCounter.increment();
    }

    @Override
    public void recordSolveDuration(SolverOutcome.Status status, Duration duration) {
        Timer timer = timerCache.computeIfAbsent(status.name(), k ->
                Timer.builder("geometry.solve.duration")
                        .description("Duration of system solve passes")
                        .tag("status", status.name())
                        .register(registry));
        timer.record(duration);
    }

    @Override
    public void recordSolutionBranches(int branches) {
        branchesSummary.record(branches);
    }

    @Override
    public void incrementTargetAdded(ObjectKind kind) {
        taggedCounter("geometry.target.added", "Number of solve targets added", "kind", kind.name())
                .increment();
    }

    @Override
    public void incrementTheoremApplied(String theorem) {
        taggedCounter("geometry.theorem.applied", "Number of theorem applications", "theorem", theorem)
                .increment();
    }

    private Counter taggedCounter(String name, String description, String tag, String value) {
        return counterCache.computeIfAbsent(name + ":" + value, k ->
                Counter.builder(name)
                        .description(description)
                        .tag(tag, value)
                        .register(registry));
    }
}
