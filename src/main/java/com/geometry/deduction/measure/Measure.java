package com.geometry.deduction.measure;

import com.geometry.deduction.algebra.Polynomial;
import com.geometry.deduction.algebra.Rational;
import com.geometry.deduction.algebra.Unknown;

import java.util.Objects;

/**
 * Immutable value bound to one measurable entity: a number or a single unknown.
 * Resolution of the unknown rebinds the entity to a new {@code Measure}.
 */
public record Measure(Polynomial value) {

    public Measure {
        Objects.requireNonNull(value, "value is required");
        if (!value.isConstant() && !value.isUnknown()) {
            throw new IllegalArgumentException("Measure must be a number or an unknown: " + value);
        }
    }

    public boolean isNumeric() {
        return value.isConstant();
    }

    public Rational number() {
        return value.constantValue();
    }

    public Unknown unknown() {
        return value.asUnknown();
    }

    @Override
    public String toString() {
        return value.toString();
    }
}
