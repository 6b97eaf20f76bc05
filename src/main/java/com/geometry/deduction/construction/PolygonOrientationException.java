package com.geometry.deduction.construction;

/**
 * Thrown when a polygon is requested over the vertex set of an existing polygon but
 * in a different cyclic order.
 */
public class PolygonOrientationException extends ConstructionException {

    private final String existingKey;
    private final String requestedKey;

    public PolygonOrientationException(String existingKey, String requestedKey) {
        super("Polygon '" + requestedKey + "' is inconsistent with existing polygon '" + existingKey + "'");
        this.existingKey = existingKey;
        this.requestedKey = requestedKey;
    }

    public String getExistingKey() {
        return existingKey;
    }

    public String getRequestedKey() {
        return requestedKey;
    }
}
