package com.geometry.deduction.measure;

import com.geometry.deduction.algebra.Polynomial;
import com.geometry.deduction.algebra.Rational;
import com.geometry.deduction.registry.RegisteredObject;

import java.util.Objects;
import java.util.Optional;

/**
 * A registered object carrying a {@link Measure}: length for segments, degrees for
 * angles, area for polygons. Reads and writes go through the session's
 * {@link MeasureLayer}.
 */
public abstract class MeasurableEntity extends RegisteredObject {

    private final MeasureLayer measures;
    private Measure measure;

    protected MeasurableEntity(String key, MeasureLayer measures) {
        super(key);
        this.measures = Objects.requireNonNull(measures, "measures is required");
    }

    /** Prefix for unknowns allocated to this entity, for example {@code mSegment}. */
    protected abstract String measurePrefix();

    /**
     * Current measure of the live entity. Allocates a fresh unknown on first read.
     */
    public Polynomial getMeasure() {
        return measures.read(self());
    }

    public void setMeasure(Polynomial value) {
        measures.write(self(), value);
    }

    public void setMeasure(Rational value) {
        setMeasure(Polynomial.constant(value));
    }

    public void setMeasure(long value) {
        setMeasure(Polynomial.constant(value));
    }

    /** Current measure without allocating one. */
    public Optional<Measure> currentMeasure() {
        return Optional.ofNullable(self().measure);
    }

    public boolean hasNumericMeasure() {
        Measure current = self().measure;
        return current != null && current.isNumeric();
    }

    /** Numeric measure, if one is known. */
    public Optional<Rational> numericMeasure() {
        return currentMeasure().filter(Measure::isNumeric).map(Measure::number);
    }

    /**
     * Hook run after a measure is bound to this entity, either by a write or by
     * substitution of a resolved unknown.
     */
    protected void onMeasureBound(Polynomial value) {
    }

    @Override
    protected void absorbInto(RegisteredObject survivor) {
        measures.absorb(this, (MeasurableEntity) survivor);
    }

    protected MeasureLayer measures() {
        return measures;
    }

    Measure rawMeasure() {
        return measure;
    }

    void bind(Measure measure) {
        this.measure = measure;
    }

    private MeasurableEntity self() {
        return (MeasurableEntity) live();
    }
}
