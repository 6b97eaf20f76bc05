package com.geometry.deduction.core;

/**
 * Base class for every error raised by the deduction engine.
 * All engine errors are unchecked and propagate synchronously to the call that
 * triggered the failing construction, measure assignment or solve.
 */
public class GeometryException extends RuntimeException {

    public GeometryException(String message) {
        super(message);
    }

    public GeometryException(String message, Throwable cause) {
        super(message, cause);
    }
}
