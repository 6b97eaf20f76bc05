package com.geometry.deduction.measure;

import com.geometry.deduction.core.GeometryException;

/**
 * Thrown when a measure assignment contradicts a fact already known about the entity:
 * two different numbers, an angle outside its range, or a reflex flag set both ways.
 */
public class MeasureConflictException extends GeometryException {

    private final String entityKey;

    public MeasureConflictException(String entityKey, String message) {
        super(message);
        this.entityKey = entityKey;
    }

    public String getEntityKey() {
        return entityKey;
    }
}
