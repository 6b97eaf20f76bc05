package com.geometry.deduction.api;

import com.geometry.deduction.algebra.Polynomial;
import com.geometry.deduction.algebra.Unknown;
import com.geometry.deduction.constraint.ConstraintStore;
import com.geometry.deduction.constraint.Expression;
import com.geometry.deduction.construction.ConstructionLayer;
import com.geometry.deduction.core.model.Angle;
import com.geometry.deduction.core.model.Line;
import com.geometry.deduction.core.model.Point;
import com.geometry.deduction.core.model.Polygon;
import com.geometry.deduction.core.model.Ray;
import com.geometry.deduction.core.model.Segment;
import com.geometry.deduction.core.model.Triangle;
import com.geometry.deduction.driver.DerivationRules;
import com.geometry.deduction.driver.GoalDriver;
import com.geometry.deduction.driver.TriangleEnumeration;
import com.geometry.deduction.driver.TypeOneConstruction;
import com.geometry.deduction.logging.LogContext;
import com.geometry.deduction.measure.MeasurableEntity;
import com.geometry.deduction.measure.MeasureLayer;
import com.geometry.deduction.metrics.MetricsService;
import com.geometry.deduction.metrics.NoOpMetricsService;
import com.geometry.deduction.registry.EntityRegistry;
import com.geometry.deduction.registry.MergeLedger;
import com.geometry.deduction.registry.RegistrySnapshot;
import com.geometry.deduction.solver.AlgebraSolver;
import com.geometry.deduction.solver.EliminationSolver;
import com.geometry.deduction.solver.EquationSolver;
import com.geometry.deduction.theorem.Theorems;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Main entry point for the geometry deduction engine.
 * Owns one registry and everything built on it; sessions share nothing.
 *
 * <h2>Example usage:</h2>
 * <pre>
 * GeometrySession session = GeometrySession.builder().build();
 * Triangle abc = session.triangle("A B C");
 * abc.angleAt(session.point("A")).orElseThrow().setMeasure(60);
 * abc.angleAt(session.point("B")).orElseThrow().setMeasure(50);
 *
 * Polynomial c = session.solve(abc.angleAt(session.point("C")).orElseThrow());  // 70
 * </pre>
 *
 * <p>Not thread-safe. Every call runs its cascades to completion before returning.</p>
 */
public class GeometrySession {
    private static final Logger log = LoggerFactory.getLogger(GeometrySession.class);

    private final SessionOptions options;
    private final String sessionId;
    private final EntityRegistry registry;
    private final ConstraintStore constraints;
    private final ConstructionLayer layer;
    private final EquationSolver solver;
    private final Theorems theorems;
    private final GoalDriver driver;

    private GeometrySession(Builder builder) {
        this.options = builder.options;
        this.sessionId = LogContext.generateSessionId();
        MetricsService metricsService = builder.metricsService != null
                ? builder.metricsService : new NoOpMetricsService();
        AlgebraSolver algebraSolver = builder.algebraSolver != null
                ? builder.algebraSolver
                : new EliminationSolver(options.getMaxSolverBranches(), options.getRootSearchLimit());

        this.registry = new EntityRegistry(options.getMaxCascadeSteps(), metricsService);
        this.constraints = new ConstraintStore(registry, metricsService);
        MeasureLayer measures = new MeasureLayer(constraints);
        this.layer = new ConstructionLayer(registry, measures, constraints);
        this.solver = new EquationSolver(algebraSolver, constraints, measures, metricsService,
                sessionId, options.getMaxSolvePasses());
        if (options.isAutoSolve()) {
            constraints.setSolveTrigger(solver);
        }
        this.theorems = new Theorems(layer, metricsService);

        List<TypeOneConstruction> typeOne = options.isTypeOneConstructions()
                ? List.of(new TriangleEnumeration())
                : List.of();
        this.driver = new GoalDriver(layer, solver, DerivationRules.standard(layer, theorems), typeOne,
                metricsService, sessionId);
        solver.setTargetSink(driver);

        log.info("session.created sessionId={} options={}", sessionId, options);
    }

    public static Builder builder() {
        return new Builder();
    }

    // ========== Construction ==========

    public Point point(String label) {
        return layer.point(label);
    }

    public List<Point> points(String spec) {
        return layer.points(spec);
    }

    public Line line(String spec) {
        return layer.line(spec);
    }

    public Segment segment(String spec) {
        return layer.segment(spec);
    }

    public Ray ray(String spec) {
        return layer.ray(spec);
    }

    public Angle angle(String spec) {
        return layer.angle(spec);
    }

    public Angle angle(String spec, boolean reflex) {
        return layer.angle(spec, reflex);
    }

    public Angle angle(Ray ray1, Ray ray2) {
        return layer.angle(ray1, ray2);
    }

    public Angle angle(Ray ray1, Ray ray2, boolean reflex) {
        return layer.angle(ray1, ray2, reflex);
    }

    public Polygon polygon(String spec) {
        return layer.polygon(spec);
    }

    public Triangle triangle(String spec) {
        return layer.triangle(spec);
    }

    /** Looks an angle up without creating it or any of its parts. */
    public Optional<Angle> findAngle(String spec) {
        return layer.findAngle(spec);
    }

    // ========== Solving ==========

    /**
     * Makes the entity a target and derives until it, and the targets it pulled in,
     * are exhausted.
     *
     * @return the entity's measure: a number if determined, otherwise its unknown
     */
    public Polynomial solve(MeasurableEntity entity) {
        return driver.solve(entity);
    }

    /**
     * Solves the current constraint set once. Targets the solve adds are derived
     * before this returns.
     *
     * @return the values accepted for unknowns
     */
    public Map<Unknown, Polynomial> solveSystem() {
        return solver.solve();
    }

    public Theorems theorems() {
        return theorems;
    }

    public List<MeasurableEntity> targets() {
        return driver.targets();
    }

    public List<Expression> liveExpressions() {
        return constraints.liveExpressions();
    }

    public RegistrySnapshot snapshot() {
        return RegistrySnapshot.of(registry);
    }

    public EntityRegistry registry() {
        return registry;
    }

    public MergeLedger getMergeLedger() {
        return registry.getMergeLedger();
    }

    public SessionOptions getOptions() {
        return options;
    }

    public String getSessionId() {
        return sessionId;
    }

    public static class Builder {
        private SessionOptions options = SessionOptions.defaults();
        private MetricsService metricsService;
        private AlgebraSolver algebraSolver;

        public Builder options(SessionOptions options) {
            if (options == null) {
                throw new IllegalArgumentException("options is required");
            }
            this.options = options;
            return this;
        }

        public Builder metricsService(MetricsService metricsService) {
            this.metricsService = metricsService;
            return this;
        }

        /** Replaces the built-in elimination solver. */
        public Builder algebraSolver(AlgebraSolver algebraSolver) {
            this.algebraSolver = algebraSolver;
            return this;
        }

        public GeometrySession build() {
            return new GeometrySession(this);
        }
    }
}
