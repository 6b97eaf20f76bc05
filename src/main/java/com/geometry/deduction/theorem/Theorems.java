package com.geometry.deduction.theorem;

import com.geometry.deduction.algebra.Polynomial;
import com.geometry.deduction.algebra.Rational;
import com.geometry.deduction.constraint.ConstraintStore;
import com.geometry.deduction.constraint.Expression;
import com.geometry.deduction.construction.ConstructionLayer;
import com.geometry.deduction.core.model.Altitude;
import com.geometry.deduction.core.model.Angle;
import com.geometry.deduction.core.model.AngleBisector;
import com.geometry.deduction.core.model.Line;
import com.geometry.deduction.core.model.Point;
import com.geometry.deduction.core.model.Segment;
import com.geometry.deduction.core.model.Triangle;
import com.geometry.deduction.metrics.MetricsService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Catalogue of constraint generators. Each theorem reads measures of existing
 * entities and asserts relations between them; geometry is only touched through
 * get-or-create lookups.
 *
 * <p>Every method returns the expressions it registered, or found already registered.
 * Relations that reduce to {@code 0 = 0} are not returned.</p>
 */
public class Theorems {
    private static final Logger log = LoggerFactory.getLogger(Theorems.class);

    private final ConstructionLayer layer;
    private final ConstraintStore constraints;
    private final MetricsService metricsService;

    public Theorems(ConstructionLayer layer, MetricsService metricsService) {
        this.layer = Objects.requireNonNull(layer, "layer is required");
        this.constraints = layer.constraints();
        this.metricsService = Objects.requireNonNull(metricsService, "metricsService is required");
    }

    /**
     * Each segment of the line equals the sum of the atomic segments it contains.
     */
    public List<Expression> subsegmentSum(Line line) {
        applied("subsegmentSum", line.getKey());
        List<Expression> result = new ArrayList<>();
        for (Segment segment : line.segmentsWithSubsegments()) {
            Polynomial parts = Polynomial.ZERO;
            for (Segment atomic : segment.atomicSubsegments()) {
                parts = parts.add(atomic.getMeasure());
            }
            assertZero(segment.getMeasure().subtract(parts)).ifPresent(result::add);
        }
        return result;
    }

    /** The given angles add up to 180 degrees. */
    public Optional<Expression> supplementary(List<Angle> angles) {
        applied("supplementary", angles.toString());
        return assertZero(sumOfMeasures(angles).subtract(180));
    }

    /**
     * Neighbouring non-reflex angles formed where another line crosses this one are
     * supplementary. Intersections whose orientation is unknown contribute nothing.
     */
    public List<Expression> straightAngle(Line line) {
        applied("straightAngle", line.getKey());
        List<Expression> result = new ArrayList<>();
        for (Line other : layer.registry().elements(Line.class)) {
            Line live = (Line) line.live();
            if (other == live || other.intersectionPoint(live).isEmpty()) {
                continue;
            }
            List<Angle> angles = live.nonreflexAnglesFormedByIntersection(other);
            if (angles.size() == 2) {
                supplementary(List.of(angles.get(0), angles.get(1))).ifPresent(result::add);
            } else if (angles.size() > 2) {
                for (int i = 0; i < angles.size(); i++) {
                    supplementary(List.of(angles.get(i), angles.get((i + 1) % angles.size())))
                            .ifPresent(result::add);
                }
            }
        }
        return result;
    }

    /**
     * Two non-reflex angles sharing a ray add up to the angle spanned by their outer rays.
     */
    public List<Expression> angleAddition() {
        applied("angleAddition", "all");
        List<Expression> result = new ArrayList<>();
        List<Angle> angles = layer.registry().elements(Angle.class);
        for (Angle first : angles) {
            for (Angle second : angles) {
                if (first == second || first.isSuperseded() || second.isSuperseded()) {
                    continue;
                }
                boolean adjacent = first.getRay2() == second.getRay1();
                boolean explementary = first.getRay1() == second.getRay2();
                boolean nonreflex = first.getReflex().equals(Optional.of(false))
                        && second.getReflex().equals(Optional.of(false));
                if (adjacent && !explementary && nonreflex) {
                    Angle whole = layer.angle(first.getRay1(), second.getRay2());
                    assertZero(first.getMeasure().add(second.getMeasure()).subtract(whole.getMeasure()))
                            .ifPresent(result::add);
                }
            }
        }
        return result;
    }

    /** The vertex angles of a triangle add up to 180 degrees. */
    public Optional<Expression> triangleAngleSum(Triangle triangle) {
        angleAddition();
        applied("triangleAngleSum", triangle.getKey());
        return assertZero(Polynomial.constant(180).subtract(sumOfMeasures(triangle.getAngles())));
    }

    /**
     * Heron's formula, {@code 16 A^2 = (a+b+c)(-a+b+c)(a-b+c)(a+b-c)}. Only asserted
     * while at most one side is unknown.
     */
    public Optional<Expression> heronsFormula(Triangle triangle) {
        applied("heronsFormula", triangle.getKey());
        List<Segment> sides = triangle.getSegments();
        Polynomial a = sides.get(0).getMeasure();
        Polynomial b = sides.get(1).getMeasure();
        Polynomial c = sides.get(2).getMeasure();
        long unknownSides = List.of(a, b, c).stream().filter(p -> !p.isConstant()).count();
        if (unknownSides > 1) {
            log.trace("theorem.skipped name=heronsFormula triangle={} unknownSides={}",
                    triangle.getKey(), unknownSides);
            return Optional.empty();
        }
        Polynomial product = a.add(b).add(c)
                .multiply(b.add(c).subtract(a))
                .multiply(a.subtract(b).add(c))
                .multiply(a.add(b).subtract(c));
        Polynomial area = triangle.getMeasure();
        return assertZero(area.pow(2).scale(16).subtract(product));
    }

    /**
     * Area equals half the altitude times the side it falls on.
     *
     * @throws IllegalArgumentException if the altitude is not currently known for the triangle
     */
    public Optional<Expression> triangleAreaUsingAltitude(Triangle triangle, Altitude altitude) {
        boolean known = triangle.altitudes().stream()
                .anyMatch(a -> a.segment() == altitude.segment() && a.vertex() == altitude.vertex());
        if (!known) {
            throw new IllegalArgumentException(altitude.segment() + " is not an altitude of " + triangle);
        }
        applied("triangleAreaUsingAltitude", triangle.getKey());
        Segment base = triangle.sideOpposite(altitude.vertex());
        Polynomial halfProduct = base.getMeasure().multiply(altitude.segment().getMeasure())
                .divide(Rational.of(2));
        return assertZero(triangle.getMeasure().subtract(halfProduct));
    }

    /**
     * The bisector splits the opposite side in the ratio of the adjacent sides:
     * {@code VP * DQ = VQ * DP}.
     */
    public Optional<Expression> angleBisector(Triangle triangle, AngleBisector bisector) {
        applied("angleBisector", triangle.getKey());
        Point vertex = bisector.vertex();
        Point foot = bisector.foot();
        List<Point> others = new ArrayList<>(triangle.getPoints());
        others.remove(vertex);
        Point p = others.get(0);
        Point q = others.get(1);
        Polynomial vp = layer.segment(vertex, p).getMeasure();
        Polynomial vq = layer.segment(vertex, q).getMeasure();
        Polynomial dp = layer.segment(foot, p).getMeasure();
        Polynomial dq = layer.segment(foot, q).getMeasure();
        return assertZero(vp.multiply(dq).subtract(vq.multiply(dp)));
    }

    /**
     * Legs squared add up to the hypotenuse squared.
     *
     * @throws IllegalArgumentException if no angle of the triangle is known to be right
     */
    public Optional<Expression> pythagorean(Triangle triangle) {
        Point right = triangle.rightAngleVertex().orElseThrow(() -> new IllegalArgumentException(
                "Pythagorean theorem requires a right triangle, got " + triangle));
        applied("pythagorean", triangle.getKey());
        List<Point> others = new ArrayList<>(triangle.getPoints());
        others.remove(right);
        Polynomial leg1 = layer.segment(right, others.get(0)).getMeasure();
        Polynomial leg2 = layer.segment(right, others.get(1)).getMeasure();
        Polynomial hypotenuse = triangle.sideOpposite(right).getMeasure();
        return assertZero(leg1.pow(2).add(leg2.pow(2)).subtract(hypotenuse.pow(2)));
    }

    private static Polynomial sumOfMeasures(List<Angle> angles) {
        Polynomial sum = Polynomial.ZERO;
        for (Angle angle : angles) {
            sum = sum.add(angle.getMeasure());
        }
        return sum;
    }

    private Optional<Expression> assertZero(Polynomial residual) {
        return constraints.assertZero(residual);
    }

    private void applied(String theorem, String subject) {
        metricsService.incrementTheoremApplied(theorem);
        log.debug("theorem.applied name={} subject={}", theorem, subject);
    }
}
