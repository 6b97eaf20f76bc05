package com.geometry.deduction.solver;

import com.geometry.deduction.algebra.Polynomial;
import com.geometry.deduction.algebra.Rational;
import com.geometry.deduction.algebra.Unknown;
import com.geometry.deduction.constraint.ConstraintStore;
import com.geometry.deduction.constraint.Expression;
import com.geometry.deduction.constraint.SolveTrigger;
import com.geometry.deduction.logging.LogContext;
import com.geometry.deduction.measure.MeasureLayer;
import com.geometry.deduction.metrics.MetricsService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Resolves the live constraint set and feeds accepted values back into expressions
 * and measures.
 *
 * <p>Every unknown stands for a measure, so only positive values are accepted. A value
 * found in every branch of the algebra solver's answer is taken as is and must be
 * positive. An unknown that differs between branches is accepted only when every
 * branch gives it a number and exactly one of those numbers is positive. When some
 * branch leaves it expressed through other unknowns it is deferred until more facts
 * arrive.</p>
 *
 * <p>Applying values can bind angle measures, which can assert further relations and
 * request another solve. Such requests made during a pass are coalesced into extra
 * passes of the same call.</p>
 */
public class EquationSolver implements SolveTrigger {
    private static final Logger log = LoggerFactory.getLogger(EquationSolver.class);

    public static final int DEFAULT_MAX_SOLVE_PASSES = 1_000;

    private final AlgebraSolver algebraSolver;
    private final ConstraintStore constraints;
    private final MeasureLayer measures;
    private final MetricsService metricsService;
    private final String sessionId;
    private final int maxSolvePasses;
    private TargetSink targetSink = expressions -> { };
    private boolean running;
    private boolean rerunRequested;

    public EquationSolver(AlgebraSolver algebraSolver, ConstraintStore constraints, MeasureLayer measures,
                          MetricsService metricsService, String sessionId, int maxSolvePasses) {
        this.algebraSolver = Objects.requireNonNull(algebraSolver, "algebraSolver is required");
        this.constraints = Objects.requireNonNull(constraints, "constraints is required");
        this.measures = Objects.requireNonNull(measures, "measures is required");
        this.metricsService = Objects.requireNonNull(metricsService, "metricsService is required");
        this.sessionId = sessionId;
        if (maxSolvePasses <= 0) {
            throw new IllegalArgumentException("maxSolvePasses must be positive");
        }
        this.maxSolvePasses = maxSolvePasses;
    }

    public void setTargetSink(TargetSink targetSink) {
        this.targetSink = Objects.requireNonNull(targetSink, "targetSink is required");
    }

    /**
     * Runs solve passes until no further pass is requested.
     */
    @Override
    public void solveSystem() {
        solve();
    }

    /**
     * Same as {@link #solveSystem()} but returns the bindings applied by this call.
     * A call made while a pass is already running only schedules another pass and
     * returns an empty map.
     */
    public Map<Unknown, Polynomial> solve() {
        if (running) {
            rerunRequested = true;
            return Map.of();
        }
        running = true;
        Map<Unknown, Polynomial> applied = new LinkedHashMap<>();
        int pass = 0;
        try {
            do {
                rerunRequested = false;
                if (++pass > maxSolvePasses) {
                    throw new IllegalStateException("Solving did not settle within " + maxSolvePasses + " passes");
                }
                try (LogContext ignored = LogContext.forSolve(sessionId, pass)) {
                    applied.putAll(runPass());
                }
            } while (rerunRequested);
        } finally {
            running = false;
            rerunRequested = false;
        }
        targetSink.solveSettled();
        return applied;
    }

    private Map<Unknown, Polynomial> runPass() {
        List<Expression> live = constraints.liveExpressions();
        if (live.isEmpty()) {
            return Map.of();
        }
        List<Polynomial> equations = new ArrayList<>(live.size());
        live.forEach(e -> equations.add(e.getPolynomial()));

        long start = System.nanoTime();
        SolverOutcome outcome = algebraSolver.solve(equations);
        metricsService.recordSolveDuration(outcome.status(), Duration.ofNanos(System.nanoTime() - start));
        log.debug("solve.outcome status={} expressions={} branches={}",
                outcome.status(), live.size(), outcome.branches().size());

        switch (outcome.status()) {
            case NO_SOLUTION:
                throw new SystemInconsistencyException("No solution exists for " + equations);
            case CANNOT_SOLVE:
                return Map.of();
            default:
                break;
        }
        metricsService.recordSolutionBranches(outcome.branches().size());

        Map<Unknown, Polynomial> accepted = acceptBindings(outcome.branches());
        if (!accepted.isEmpty()) {
            log.debug("solve.accepted bindings={}", accepted);
            constraints.substituteAll(accepted);
            measures.substituteUnknowns(accepted);
        }
        targetSink.expandTargets(constraints.liveExpressions());
        return accepted;
    }

    private Map<Unknown, Polynomial> acceptBindings(List<Map<Unknown, Polynomial>> branches) {
        Map<Unknown, Polynomial> unique = new LinkedHashMap<>();
        for (Map.Entry<Unknown, Polynomial> entry : branches.get(0).entrySet()) {
            boolean common = branches.stream()
                    .allMatch(b -> entry.getValue().equals(b.get(entry.getKey())));
            if (common) {
                unique.put(entry.getKey(), entry.getValue());
            }
        }

        Map<Unknown, Polynomial> accepted = new LinkedHashMap<>();
        unique.forEach((unknown, value) -> {
            if (!value.isConstant()) {
                return;
            }
            if (!value.constantValue().isPositive()) {
                throw new SystemInconsistencyException("Measure " + unknown + " is uniquely determined as "
                        + value + " but measures must be positive");
            }
            accepted.put(unknown, value);
        });

        Set<Unknown> varying = new LinkedHashSet<>();
        branches.forEach(b -> varying.addAll(b.keySet()));
        varying.removeAll(unique.keySet());
        for (Unknown unknown : varying) {
            Set<Rational> candidates = new LinkedHashSet<>();
            boolean determined = true;
            for (Map<Unknown, Polynomial> branch : branches) {
                Polynomial value = branch.get(unknown);
                if (value == null || !value.isConstant()) {
                    determined = false;
                    break;
                }
                candidates.add(value.constantValue());
            }
            if (!determined) {
                log.trace("solve.deferred unknown={}", unknown);
                continue;
            }
            List<Rational> positive = candidates.stream().filter(Rational::isPositive).toList();
            if (positive.size() != 1) {
                throw new SystemInconsistencyException("Measure " + unknown + " has candidates " + candidates
                        + ", expected exactly one positive value");
            }
            accepted.put(unknown, Polynomial.constant(positive.get(0)));
        }
        return accepted;
    }
}
