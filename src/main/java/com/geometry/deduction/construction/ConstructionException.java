package com.geometry.deduction.construction;

import com.geometry.deduction.core.GeometryException;

/**
 * Thrown when a construction request is invalid: bad labels or arity, rays that do
 * not share a vertex, or a request that conflicts with existing geometry.
 */
public class ConstructionException extends GeometryException {

    public ConstructionException(String message) {
        super(message);
    }
}
