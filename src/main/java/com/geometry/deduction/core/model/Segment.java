package com.geometry.deduction.core.model;

import com.geometry.deduction.construction.ConstructionLayer;
import com.geometry.deduction.measure.MeasurableEntity;

import java.util.ArrayList;
import java.util.List;

/**
 * A segment between two points. Its measure is its length.
 */
public class Segment extends MeasurableEntity {

    private final ConstructionLayer layer;
    private final List<Point> points;

    public Segment(ConstructionLayer layer, Point first, Point second) {
        super(first.getKey() + " " + second.getKey(), layer.measures());
        this.layer = layer;
        this.points = List.of(first, second);
    }

    @Override
    public ObjectKind kind() {
        return ObjectKind.SEGMENT;
    }

    @Override
    protected String measurePrefix() {
        return "mSegment";
    }

    /** Endpoints in lexical order. */
    public List<Point> getPoints() {
        return points;
    }

    public boolean hasEndpoint(Point point) {
        return points.contains(point);
    }

    /** The line the segment lies on, created on demand. */
    public Line line() {
        return layer.line(points);
    }

    /** Points of the line between the endpoints, endpoints included, in line order. */
    public List<Point> containedPoints() {
        List<Point> linePoints = line().getPoints();
        int from = linePoints.indexOf(points.get(0));
        int to = linePoints.indexOf(points.get(1));
        if (from > to) {
            int swap = from;
            from = to;
            to = swap;
        }
        return new ArrayList<>(linePoints.subList(from, to + 1));
    }

    /** Segments between consecutive contained points; just this one if none lies inside. */
    public List<Segment> atomicSubsegments() {
        List<Point> contained = containedPoints();
        List<Segment> result = new ArrayList<>();
        for (int i = 0; i < contained.size() - 1; i++) {
            result.add(layer.segment(contained.get(i), contained.get(i + 1)));
        }
        return result;
    }

    @Override
    public String toString() {
        return currentMeasure()
                .map(m -> "Segment(" + getKey() + ", measure=" + m + ")")
                .orElse("Segment(" + getKey() + ")");
    }
}
