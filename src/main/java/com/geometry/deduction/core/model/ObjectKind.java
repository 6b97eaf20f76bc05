package com.geometry.deduction.core.model;

import com.geometry.deduction.constraint.Expression;
import com.geometry.deduction.registry.RegisteredObject;

/**
 * Enumeration of the kinds of objects held by the registry.
 * Each kind has its own key space; {@link #TRIANGLE} is subordinate to {@link #POLYGON}.
 */
public enum ObjectKind {
    POINT("Point", Point.class, null),
    LINE("Line", Line.class, null),
    SEGMENT("Segment", Segment.class, null),
    RAY("Ray", Ray.class, null),
    ANGLE("Angle", Angle.class, null),
    POLYGON("Polygon", Polygon.class, null),
    TRIANGLE("Triangle", Triangle.class, POLYGON),
    EXPRESSION("Expression", Expression.class, null);

    private final String label;
    private final Class<? extends RegisteredObject> type;
    private final ObjectKind parent;

    ObjectKind(String label, Class<? extends RegisteredObject> type, ObjectKind parent) {
        this.label = label;
        this.type = type;
        this.parent = parent;
    }

    public String getLabel() {
        return label;
    }

    public Class<? extends RegisteredObject> getType() {
        return type;
    }

    public ObjectKind getParent() {
        return parent;
    }

    /** True if this kind is {@code other} or one of its subordinate kinds. */
    public boolean isA(ObjectKind other) {
        for (ObjectKind k = this; k != null; k = k.parent) {
            if (k == other) {
                return true;
            }
        }
        return false;
    }

    /** Resolves the exact kind registered for a Java type. */
    public static ObjectKind of(Class<? extends RegisteredObject> type) {
        for (ObjectKind kind : values()) {
            if (kind.type.equals(type)) {
                return kind;
            }
        }
        throw new IllegalArgumentException("Not a registered type: " + type.getName());
    }
}
