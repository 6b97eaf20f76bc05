package com.geometry.deduction.driver;

import com.geometry.deduction.algebra.Polynomial;
import com.geometry.deduction.algebra.Unknown;
import com.geometry.deduction.constraint.Expression;
import com.geometry.deduction.construction.ConstructionLayer;
import com.geometry.deduction.core.model.ObjectKind;
import com.geometry.deduction.logging.LogContext;
import com.geometry.deduction.measure.MeasurableEntity;
import com.geometry.deduction.measure.Measure;
import com.geometry.deduction.metrics.MetricsService;
import com.geometry.deduction.solver.EquationSolver;
import com.geometry.deduction.solver.TargetSink;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Goal-directed derivation. Each target is run through the rules for its kind,
 * solving after every rule, until its measure becomes a number or the rules run out.
 *
 * <p>Solving can make more entities interesting: whenever an expression mixes the
 * unknown of a target with other unknowns, the holders of those unknowns become
 * targets too. Targets only ever grow; they are derived in the order they were added.</p>
 */
public class GoalDriver implements TargetSink {
    private static final Logger log = LoggerFactory.getLogger(GoalDriver.class);

    private final ConstructionLayer layer;
    private final EquationSolver solver;
    private final Map<ObjectKind, List<DerivationRule>> rules;
    private final List<TypeOneConstruction> typeOneConstructions;
    private final MetricsService metricsService;
    private final String sessionId;

    private final Set<MeasurableEntity> targets = new LinkedHashSet<>();
    private final Deque<MeasurableEntity> pending = new ArrayDeque<>();
    private boolean typeOneApplied;
    private boolean draining;

    public GoalDriver(ConstructionLayer layer, EquationSolver solver, Map<ObjectKind, List<DerivationRule>> rules,
                      List<TypeOneConstruction> typeOneConstructions, MetricsService metricsService, String sessionId) {
        this.layer = Objects.requireNonNull(layer, "layer is required");
        this.solver = Objects.requireNonNull(solver, "solver is required");
        this.rules = Objects.requireNonNull(rules, "rules is required");
        this.typeOneConstructions = List.copyOf(typeOneConstructions);
        this.metricsService = Objects.requireNonNull(metricsService, "metricsService is required");
        this.sessionId = sessionId;
    }

    /**
     * Adds the entity as a target, derives every pending target and returns the
     * entity's measure afterwards: a number if it was determined, otherwise its unknown.
     */
    public Polynomial solve(MeasurableEntity entity) {
        addTarget(entity);
        return ((MeasurableEntity) entity.live()).getMeasure();
    }

    /**
     * @return true if the entity was not already a target
     */
    public boolean addTarget(MeasurableEntity entity) {
        boolean added = enqueue((MeasurableEntity) entity.live());
        derivePending();
        return added;
    }

    /**
     * Derives queued targets until the queue is empty. Does nothing when called
     * from within a derivation.
     */
    public void derivePending() {
        if (draining) {
            return;
        }
        draining = true;
        try {
            if (!pending.isEmpty()) {
                applyTypeOneConstructions();
            }
            while (!pending.isEmpty()) {
                derive((MeasurableEntity) pending.poll().live());
            }
        } finally {
            draining = false;
        }
    }

    /** Live targets in the order they were added. */
    public List<MeasurableEntity> targets() {
        Set<MeasurableEntity> live = new LinkedHashSet<>();
        targets.forEach(t -> live.add((MeasurableEntity) t.live()));
        return Collections.unmodifiableList(new ArrayList<>(live));
    }

    @Override
    public void expandTargets(List<Expression> liveExpressions) {
        boolean grew = true;
        while (grew) {
            grew = false;
            Set<Unknown> targetUnknowns = targetUnknowns();
            if (targetUnknowns.isEmpty()) {
                return;
            }
            for (Expression expression : liveExpressions) {
                if (expression.isSuperseded()) {
                    continue;
                }
                Set<Unknown> unknowns = expression.getPolynomial().unknowns();
                if (Collections.disjoint(unknowns, targetUnknowns)) {
                    continue;
                }
                for (Unknown unknown : unknowns) {
                    for (MeasurableEntity holder : layer.measures().holdersOf(unknown)) {
                        grew |= enqueue(holder);
                    }
                }
            }
        }
    }

    /** Derives targets a solve added outside of any derivation. */
    @Override
    public void solveSettled() {
        derivePending();
    }

    private Set<Unknown> targetUnknowns() {
        Set<Unknown> result = new HashSet<>();
        for (MeasurableEntity target : targets) {
            ((MeasurableEntity) target.live()).currentMeasure()
                    .filter(m -> !m.isNumeric())
                    .map(Measure::unknown)
                    .ifPresent(result::add);
        }
        return result;
    }

    private boolean enqueue(MeasurableEntity entity) {
        MeasurableEntity live = (MeasurableEntity) entity.live();
        for (MeasurableEntity target : targets) {
            if (target.live() == live) {
                return false;
            }
        }
        targets.add(live);
        pending.add(live);
        live.getMeasure();
        metricsService.incrementTargetAdded(live.kind());
        log.debug("target.added kind={} key={}", live.kind().getLabel(), live.getKey());
        return true;
    }

    private void applyTypeOneConstructions() {
        if (typeOneApplied) {
            return;
        }
        typeOneApplied = true;
        for (TypeOneConstruction construction : typeOneConstructions) {
            construction.apply(layer);
        }
    }

    private void derive(MeasurableEntity target) {
        try (LogContext ignored = LogContext.forTarget(sessionId, target.kind().getLabel(), target.getKey())) {
            for (DerivationRule rule : rules.getOrDefault(target.kind(), List.of())) {
                MeasurableEntity live = (MeasurableEntity) target.live();
                if (live.hasNumericMeasure()) {
                    break;
                }
                log.trace("target.rule name={} key={}", rule.name(), live.getKey());
                rule.apply(live);
                solver.solve();
            }
            MeasurableEntity live = (MeasurableEntity) target.live();
            if (live.hasNumericMeasure()) {
                log.info("target.solved kind={} key={} measure={}",
                        live.kind().getLabel(), live.getKey(), live.numericMeasure().orElseThrow());
            } else {
                log.debug("target.unresolved kind={} key={}", live.kind().getLabel(), live.getKey());
            }
        }
    }
}
