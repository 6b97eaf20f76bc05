package com.geometry.deduction.core.model;

/**
 * A segment from a triangle vertex meeting the line of the opposite side at a right angle.
 *
 * @param vertex  triangle vertex the altitude starts from
 * @param foot    point where it meets the opposite side's line
 * @param segment the altitude itself
 */
public record Altitude(Point vertex, Point foot, Segment segment) {
}
