package com.geometry.deduction.core.model;

import com.geometry.deduction.registry.RegisteredObject;

/**
 * A point on the Euclidean plane, identified by its label.
 * Points never merge, so a point handle is always live.
 */
public class Point extends RegisteredObject implements Comparable<Point> {

    public Point(String label) {
        super(label);
    }

    @Override
    public ObjectKind kind() {
        return ObjectKind.POINT;
    }

    public String getLabel() {
        return getKey();
    }

    @Override
    public int compareTo(Point other) {
        return getKey().compareTo(other.getKey());
    }

    @Override
    public String toString() {
        return "Point(" + getKey() + ")";
    }
}
