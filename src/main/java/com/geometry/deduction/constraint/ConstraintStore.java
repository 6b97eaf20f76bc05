package com.geometry.deduction.constraint;

import com.geometry.deduction.algebra.Polynomial;
import com.geometry.deduction.algebra.Unknown;
import com.geometry.deduction.metrics.MetricsService;
import com.geometry.deduction.metrics.NoOpMetricsService;
import com.geometry.deduction.registry.EntityRegistry;
import com.geometry.deduction.registry.MergeReason;
import com.geometry.deduction.registry.StaleReferenceException;
import com.geometry.deduction.solver.SystemInconsistencyException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Registers asserted relations as {@link Expression}s and applies substitutions to them.
 */
public class ConstraintStore {
    private static final Logger log = LoggerFactory.getLogger(ConstraintStore.class);

    private final EntityRegistry registry;
    private final MetricsService metricsService;
    private SolveTrigger solveTrigger;
    private long nextId;

    public ConstraintStore(EntityRegistry registry) {
        this(registry, new NoOpMetricsService());
    }

    public ConstraintStore(EntityRegistry registry, MetricsService metricsService) {
        this.registry = Objects.requireNonNull(registry, "registry is required");
        this.metricsService = Objects.requireNonNull(metricsService, "metricsService is required");
    }

    /**
     * Enables automatic solving after each newly registered expression.
     * Pass null to switch it off.
     */
    public void setSolveTrigger(SolveTrigger solveTrigger) {
        this.solveTrigger = solveTrigger;
    }

    /**
     * Asserts {@code residual == 0}.
     *
     * @return the registered expression, or the structurally equal one already live;
     *         empty if the residual is identically zero
     * @throws SystemInconsistencyException if the residual is a nonzero constant
     */
    public Optional<Expression> assertZero(Polynomial residual) {
        Polynomial normalized = residual.normalized();
        if (normalized.isZero()) {
            return Optional.empty();
        }
        if (normalized.isConstant()) {
            throw new SystemInconsistencyException("Asserted relation " + residual + " = 0 has no free unknowns");
        }
        for (Expression existing : liveExpressions()) {
            if (existing.rawPolynomial().equals(normalized)) {
                log.trace("constraint.deduplicated key={}", existing.getKey());
                return Optional.of(existing);
            }
        }
        Expression expression = registry.register(
                new Expression(nextKey(), normalized, ExpressionState.UNRESOLVED, null, null));
        metricsService.incrementExpressionAsserted();
        log.debug("constraint.asserted key={} residual={}", expression.getKey(), normalized);
        if (solveTrigger != null) {
            solveTrigger.solveSystem();
        }
        return Optional.of(expression);
    }

    /**
     * Substitutes bindings into an expression.
     *
     * @return the same expression if nothing changed, otherwise its successor
     * @throws StaleReferenceException      if the expression was already superseded
     * @throws SystemInconsistencyException if the result is a nonzero constant
     */
    public Expression substitute(Expression expression, Map<Unknown, Polynomial> bindings) {
        if (expression.isSuperseded()) {
            throw new StaleReferenceException(expression.getKey(),
                    "Cannot substitute into superseded expression, use its successor " + expression.getKey());
        }
        String key = expression.getKey();
        Polynomial before = expression.rawPolynomial();
        Polynomial after = before.substitute(bindings);
        if (after.equals(before)) {
            return expression;
        }
        if (after.isZero()) {
            Expression resolved = new Expression(nextKey(), Polynomial.ZERO, ExpressionState.RESOLVED,
                    expression, bindings);
            registry.replace(expression, resolved, MergeReason.SUBSTITUTION);
            metricsService.incrementExpressionResolved();
            log.debug("constraint.resolved key={} residual={}", key, before);
            return resolved;
        }
        if (after.isConstant()) {
            expression.markContradiction();
            throw new SystemInconsistencyException("Expression " + key + " (" + before
                    + " = 0) reduces to " + after + " after substituting " + bindings);
        }
        Expression successor = registry.register(new Expression(nextKey(), after.normalized(),
                ExpressionState.PARTIALLY_SUBSTITUTED, expression, bindings));
        registry.replace(expression, successor, MergeReason.SUBSTITUTION);
        log.debug("constraint.substituted key={} successor={} residual={}",
                key, successor.getKey(), successor.rawPolynomial());
        return successor;
    }

    /**
     * Substitutes bindings into every live expression.
     */
    public void substituteAll(Map<Unknown, Polynomial> bindings) {
        if (bindings.isEmpty()) {
            return;
        }
        for (Expression expression : liveExpressions()) {
            if (!expression.isSuperseded()) {
                substitute(expression, bindings);
            }
        }
    }

    /** Registered, non-terminal expressions in assertion order. */
    public List<Expression> liveExpressions() {
        return registry.elements(Expression.class);
    }

    private String nextKey() {
        return "E" + (++nextId);
    }
}
