package com.geometry.deduction.core.model;

/**
 * A segment from a triangle vertex to a point inside the opposite side that splits the
 * vertex angle into two angles of equal measure.
 */
public record AngleBisector(Point vertex, Point foot, Segment segment) {
}
