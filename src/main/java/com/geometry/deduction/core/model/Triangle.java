package com.geometry.deduction.core.model;

import com.geometry.deduction.algebra.Rational;
import com.geometry.deduction.construction.ConstructionLayer;
import com.geometry.deduction.measure.Measure;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * A three-vertex {@link Polygon}. Besides its sides and angles it reports the
 * altitudes and angle bisectors that the registry currently knows of.
 */
public class Triangle extends Polygon {

    private static final Rational RIGHT = Rational.of(90);

    public Triangle(ConstructionLayer layer, List<Point> points, List<Segment> segments, List<Angle> angles) {
        super(layer, points, segments, angles);
    }

    @Override
    public ObjectKind kind() {
        return ObjectKind.TRIANGLE;
    }

    @Override
    protected String measurePrefix() {
        return "aTriangle";
    }

    /** The side not touching {@code vertex}. */
    public Segment sideOpposite(Point vertex) {
        List<Point> others = new ArrayList<>(getPoints());
        if (!others.remove(vertex)) {
            throw new IllegalArgumentException(vertex + " is not a vertex of " + this);
        }
        return layer.segment(others.get(0), others.get(1));
    }

    /** Vertex whose angle is known to be 90 degrees, if any. */
    public Optional<Point> rightAngleVertex() {
        for (Angle angle : getAngles()) {
            if (angle.numericMeasure().filter(RIGHT::equals).isPresent()) {
                return Optional.of(angle.getVertex());
            }
        }
        return Optional.empty();
    }

    /**
     * Altitudes known to the registry. The segment from the vertex to the foot must be
     * registered and one of the angles at the foot, between the vertex and another
     * point of the opposite side's line, must be known to be 90 degrees. The legs of a
     * right triangle are therefore altitudes too.
     */
    public List<Altitude> altitudes() {
        List<Altitude> result = new ArrayList<>();
        List<Point> pts = getPoints();
        for (int i = 0; i < 3; i++) {
            Point vertex = pts.get(i);
            Optional<Line> base = layer.findLineThrough(pts.get((i + 1) % 3), pts.get((i + 2) % 3));
            if (base.isEmpty() || base.get().contains(vertex)) {
                continue;
            }
            for (Point foot : base.get().getPoints()) {
                Optional<Segment> segment = layer.findSegment(vertex, foot);
                if (segment.isPresent() && isRightAngleAt(foot, vertex, base.get())) {
                    result.add(new Altitude(vertex, foot, segment.get()));
                }
            }
        }
        return result;
    }

    public boolean isAltitude(Segment segment) {
        return altitudes().stream().anyMatch(a -> a.segment() == segment);
    }

    private boolean isRightAngleAt(Point foot, Point vertex, Line base) {
        for (Point other : base.getPoints()) {
            if (other == foot) {
                continue;
            }
            if (measuresRight(layer.findAngle(other, foot, vertex))
                    || measuresRight(layer.findAngle(vertex, foot, other))) {
                return true;
            }
        }
        return false;
    }

    private static boolean measuresRight(Optional<Angle> angle) {
        return angle.flatMap(Angle::numericMeasure).filter(RIGHT::equals).isPresent();
    }

    /**
     * Angle bisectors known to the registry: a registered segment from a vertex to a
     * point strictly inside the opposite side, where the two angles it forms at the
     * vertex hold the same measure.
     */
    public List<AngleBisector> angleBisectors() {
        List<AngleBisector> result = new ArrayList<>();
        List<Point> pts = getPoints();
        for (int i = 0; i < 3; i++) {
            Point vertex = pts.get(i);
            Point next = pts.get((i + 1) % 3);
            Point prev = pts.get((i + 2) % 3);
            Optional<Line> base = layer.findLineThrough(prev, next);
            if (base.isEmpty()) {
                continue;
            }
            List<Point> linePoints = base.get().getPoints();
            int from = Math.min(linePoints.indexOf(prev), linePoints.indexOf(next));
            int to = Math.max(linePoints.indexOf(prev), linePoints.indexOf(next));
            for (Point foot : linePoints.subList(from + 1, to)) {
                Optional<Segment> segment = layer.findSegment(vertex, foot);
                Optional<Measure> first = layer.findAngle(prev, vertex, foot).flatMap(Angle::currentMeasure);
                Optional<Measure> second = layer.findAngle(foot, vertex, next).flatMap(Angle::currentMeasure);
                if (segment.isPresent() && first.isPresent() && first.equals(second)) {
                    result.add(new AngleBisector(vertex, foot, segment.get()));
                }
            }
        }
        return result;
    }
}
