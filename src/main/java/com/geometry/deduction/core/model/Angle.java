package com.geometry.deduction.core.model;

import com.geometry.deduction.algebra.Polynomial;
import com.geometry.deduction.algebra.Rational;
import com.geometry.deduction.constraint.Expression;
import com.geometry.deduction.construction.ConstructionException;
import com.geometry.deduction.construction.ConstructionLayer;
import com.geometry.deduction.measure.MeasurableEntity;
import com.geometry.deduction.measure.MeasureConflictException;
import com.geometry.deduction.registry.ChangeListener;
import com.geometry.deduction.registry.RegisteredObject;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;
import java.util.Optional;

/**
 * An angle swept from its first ray to its second around their shared vertex,
 * measured in degrees. The same two rays in the opposite order form the
 * {@link #explementary()} angle; the two measures add up to 360.
 *
 * <p>The reflex flag is unknown until set, cannot change afterwards, and is always
 * the negation of the explementary's flag once either is known.</p>
 */
public class Angle extends MeasurableEntity implements ChangeListener {
    private static final Logger log = LoggerFactory.getLogger(Angle.class);

    private static final Rational STRAIGHT = Rational.of(180);
    private static final Rational FULL = Rational.of(360);

    /** A pending reflex assignment, or a re-derivation of the angles at the intersection when value is null. */
    private record ReflexTask(Angle angle, Boolean value) {
    }

    private final ConstructionLayer layer;
    private Ray ray1;
    private Ray ray2;
    private Boolean reflex;
    private boolean explementaryPaired;

    public Angle(ConstructionLayer layer, Ray ray1, Ray ray2) {
        super(keyOf(ray1, ray2), layer.measures());
        this.layer = layer;
        this.ray1 = ray1;
        this.ray2 = ray2;
    }

    public static String keyOf(Ray ray1, Ray ray2) {
        return ray1.getPointingTo().getKey() + " " + ray1.getVertex().getKey() + " "
                + ray2.getPointingTo().getKey();
    }

    @Override
    public ObjectKind kind() {
        return ObjectKind.ANGLE;
    }

    @Override
    protected String measurePrefix() {
        return "mAngle";
    }

    public Ray getRay1() {
        return (Ray) self().ray1.live();
    }

    public Ray getRay2() {
        return (Ray) self().ray2.live();
    }

    public Point getVertex() {
        return getRay1().getVertex();
    }

    public Optional<Boolean> getReflex() {
        return Optional.ofNullable(self().reflex);
    }

    public Angle explementary() {
        return layer.angle(getRay2(), getRay1());
    }

    /**
     * Sets the reflex flag. The explementary receives the negation, and the angles formed
     * at the intersection of the two ray lines are re-derived as non-reflex once their
     * orientation is known. Runs on a local worklist until no flag changes.
     *
     * @throws MeasureConflictException if a flag is already set the other way
     */
    public void setReflex(boolean value) {
        Deque<ReflexTask> work = new ArrayDeque<>();
        work.add(new ReflexTask(this, value));
        while (!work.isEmpty()) {
            ReflexTask task = work.poll();
            Angle angle = (Angle) task.angle().live();
            if (task.value() == null) {
                deriveIntersectionAngles(angle, work);
            } else if (angle.reflex == null) {
                angle.reflex = task.value();
                log.debug("angle.reflexSet key={} reflex={}", angle.getKey(), angle.reflex);
                work.add(new ReflexTask(angle.explementary(), !task.value()));
                work.add(new ReflexTask(angle, null));
            } else if (angle.reflex != task.value().booleanValue()) {
                throw new MeasureConflictException(angle.getKey(), "Angle '" + angle.getKey()
                        + "' is already " + (angle.reflex ? "reflex" : "non-reflex"));
            }
        }
    }

    private static void deriveIntersectionAngles(Angle angle, Deque<ReflexTask> work) {
        Line line1 = angle.getRay1().line();
        Line line2 = angle.getRay2().line();
        if (line1 == line2 || line1.intersectionPoint(line2).isEmpty()) {
            return;
        }
        for (Angle candidate : line1.nonreflexCandidates(line2)) {
            work.add(new ReflexTask(candidate, false));
        }
    }

    /**
     * Asserts {@code m + m' - 360 == 0} against the explementary, once per pair.
     */
    public Optional<Expression> pairWithExplementary() {
        Angle live = self();
        if (live.explementaryPaired) {
            return Optional.empty();
        }
        Angle other = live.explementary();
        live.explementaryPaired = true;
        other.explementaryPaired = true;
        return layer.constraints().assertZero(
                live.getMeasure().add(other.getMeasure()).subtract(Polynomial.constant(FULL)));
    }

    @Override
    protected void onMeasureBound(Polynomial value) {
        if (!value.isConstant()) {
            return;
        }
        Rational degrees = value.constantValue();
        if (degrees.signum() <= 0 || degrees.compareTo(FULL) >= 0) {
            throw new MeasureConflictException(getKey(),
                    "Angle '" + getKey() + "' must be between 0 and 360 degrees, got " + degrees);
        }
        int side = degrees.compareTo(STRAIGHT);
        if (side < 0) {
            if (Boolean.TRUE.equals(reflex)) {
                throw new MeasureConflictException(getKey(),
                        "Reflex angle '" + getKey() + "' cannot measure " + degrees);
            }
            setReflex(false);
        } else if (side > 0) {
            if (Boolean.FALSE.equals(reflex)) {
                throw new MeasureConflictException(getKey(),
                        "Non-reflex angle '" + getKey() + "' cannot measure " + degrees);
            }
            setReflex(true);
        } else if (reflex == null) {
            setReflex(false);
        }
        pairWithExplementary();
    }

    @Override
    public void onChange(RegisteredObject source, RegisteredObject replacement) {
        requireLive("re-key angle");
        ray1 = (Ray) ray1.live();
        ray2 = (Ray) ray2.live();
        if (ray1 == ray2) {
            throw new ConstructionException("Angle '" + getKey() + "' collapsed: both rays are now " + ray1.getKey());
        }
        layer.registry().updateKey(this, keyOf(ray1, ray2));
        layer.registry().removeDuplicates(Angle.class);
    }

    @Override
    protected void absorbInto(RegisteredObject survivor) {
        super.absorbInto(survivor);
        Angle target = (Angle) survivor;
        target.explementaryPaired |= explementaryPaired;
        if (reflex != null) {
            target.setReflex(reflex);
        }
    }

    @Override
    protected List<Object> identity() {
        return List.of(ray1.live(), ray2.live());
    }

    private Angle self() {
        return (Angle) live();
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder("Angle(").append(getKey());
        currentMeasure().ifPresent(m -> sb.append(", measure=").append(m));
        getReflex().ifPresent(r -> sb.append(", reflex=").append(r));
        return sb.append(')').toString();
    }
}
