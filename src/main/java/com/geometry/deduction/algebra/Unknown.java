package com.geometry.deduction.algebra;

import java.util.Objects;

/**
 * Named symbolic placeholder for an undetermined measure.
 * Unknowns are ordered by their allocation ordinal, which keeps elimination order
 * and printed expressions deterministic.
 *
 * @param name    display name, e.g. {@code mSegment3}
 * @param ordinal allocation order within a session
 */
public record Unknown(String name, long ordinal) implements Comparable<Unknown> {

    public Unknown {
        Objects.requireNonNull(name, "name is required");
        if (name.isBlank()) {
            throw new IllegalArgumentException("Unknown name must not be blank");
        }
    }

    @Override
    public int compareTo(Unknown other) {
        int byOrdinal = Long.compare(ordinal, other.ordinal);
        return byOrdinal != 0 ? byOrdinal : name.compareTo(other.name);
    }

    @Override
    public String toString() {
        return name;
    }
}
