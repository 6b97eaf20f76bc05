package com.geometry.deduction.registry;

import com.geometry.deduction.core.GeometryException;

/**
 * Thrown when an internal mutating path is entered through an object that has
 * already been superseded by a merge, instead of through its survivor.
 */
public class StaleReferenceException extends GeometryException {

    private final String staleKey;

    public StaleReferenceException(String staleKey, String message) {
        super(message);
        this.staleKey = staleKey;
    }

    public String getStaleKey() {
        return staleKey;
    }
}
