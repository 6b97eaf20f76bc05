package com.geometry.deduction.measure;

import com.geometry.deduction.algebra.Polynomial;
import com.geometry.deduction.algebra.Unknown;
import com.geometry.deduction.constraint.ConstraintStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Binds measures to entities and keeps the index from unknowns to the entities
 * currently holding them.
 *
 * <p>Write policy for {@code entity.measure = v}:</p>
 * <ul>
 *   <li>nothing bound yet and {@code v} is a number or an unknown: bind directly;</li>
 *   <li>both sides numbers: they must be equal;</li>
 *   <li>anything else: assert {@code current - v == 0} as a constraint.</li>
 * </ul>
 */
public class MeasureLayer {
    private static final Logger log = LoggerFactory.getLogger(MeasureLayer.class);

    private final ConstraintStore constraints;
    private final Map<String, Integer> counters = new HashMap<>();
    private final Map<Unknown, Set<MeasurableEntity>> holders = new HashMap<>();
    private long nextOrdinal;

    public MeasureLayer(ConstraintStore constraints) {
        this.constraints = Objects.requireNonNull(constraints, "constraints is required");
    }

    /**
     * Returns the entity's measure, allocating a fresh unknown if none is bound.
     */
    public Polynomial read(MeasurableEntity entity) {
        MeasurableEntity live = (MeasurableEntity) entity.live();
        Measure current = live.rawMeasure();
        if (current == null) {
            Unknown unknown = allocate(live.measurePrefix());
            bind(live, Polynomial.of(unknown));
            return Polynomial.of(unknown);
        }
        return current.value();
    }

    public void write(MeasurableEntity entity, Polynomial value) {
        Objects.requireNonNull(value, "value is required");
        MeasurableEntity live = (MeasurableEntity) entity.live();
        if (value.isConstant() && !value.constantValue().isPositive()) {
            throw new MeasureConflictException(live.getKey(),
                    "Measure of " + describe(live) + " must be positive, got " + value);
        }
        Measure current = live.rawMeasure();
        if (current == null) {
            if (value.isConstant() || value.isUnknown()) {
                bind(live, value);
                return;
            }
            current = new Measure(read(live));
        }
        if (current.isNumeric() && value.isConstant()) {
            if (!current.number().equals(value.constantValue())) {
                throw new MeasureConflictException(live.getKey(), "Cannot set measure of "
                        + describe(live) + " to " + value + ", it is already " + current);
            }
            return;
        }
        if (current.value().equals(value)) {
            return;
        }
        constraints.assertZero(current.value().subtract(value));
    }

    /**
     * Rebinds every live holder of each resolved unknown.
     */
    public void substituteUnknowns(Map<Unknown, Polynomial> bindings) {
        for (Map.Entry<Unknown, Polynomial> binding : bindings.entrySet()) {
            Polynomial value = binding.getValue();
            if (!value.isConstant() && !value.isUnknown()) {
                continue;
            }
            Set<MeasurableEntity> held = holders.remove(binding.getKey());
            if (held == null) {
                continue;
            }
            for (MeasurableEntity holder : new ArrayList<>(held)) {
                Measure current = holder.rawMeasure();
                if (holder.isSuperseded() || current == null || current.isNumeric()
                        || !current.unknown().equals(binding.getKey())) {
                    continue;
                }
                log.debug("measure.rebound key={} unknown={} value={}",
                        holder.getKey(), binding.getKey(), value);
                bind(holder, value);
            }
        }
    }

    /** Live entities whose measure is currently {@code unknown}. */
    public List<MeasurableEntity> holdersOf(Unknown unknown) {
        List<MeasurableEntity> result = new ArrayList<>();
        for (MeasurableEntity holder : holders.getOrDefault(unknown, Set.of())) {
            Measure current = holder.rawMeasure();
            if (!holder.isSuperseded() && current != null && !current.isNumeric()
                    && current.unknown().equals(unknown)) {
                result.add(holder);
            }
        }
        return result;
    }

    /**
     * Moves the measure of a merged-away entity onto its survivor.
     */
    void absorb(MeasurableEntity old, MeasurableEntity survivor) {
        Measure measure = old.rawMeasure();
        if (measure == null) {
            return;
        }
        if (survivor.rawMeasure() == null) {
            bind(survivor, measure.value());
        } else {
            write(survivor, measure.value());
        }
    }

    private void bind(MeasurableEntity entity, Polynomial value) {
        entity.bind(new Measure(value));
        if (value.isUnknown()) {
            holders.computeIfAbsent(value.asUnknown(), u -> new LinkedHashSet<>()).add(entity);
        }
        log.trace("measure.bound key={} value={}", entity.getKey(), value);
        entity.onMeasureBound(value);
    }

    private Unknown allocate(String prefix) {
        int n = counters.merge(prefix, 1, Integer::sum);
        return new Unknown(prefix + n, ++nextOrdinal);
    }

    private static String describe(MeasurableEntity entity) {
        return entity.kind().getLabel() + " '" + entity.getKey() + "'";
    }
}
