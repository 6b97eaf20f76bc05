package com.geometry.deduction.core.model;

import com.geometry.deduction.construction.ConstructionLayer;
import com.geometry.deduction.measure.MeasurableEntity;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * A polygon given by its vertices in cyclic order, starting at the lexically smallest
 * vertex. The direction of traversal is significant. Its measure is its area.
 */
public class Polygon extends MeasurableEntity {

    protected final ConstructionLayer layer;
    private final List<Point> points;
    private final List<Segment> segments;
    private final List<Angle> angles;

    public Polygon(ConstructionLayer layer, List<Point> points, List<Segment> segments, List<Angle> angles) {
        super(Line.keyOf(points), layer.measures());
        this.layer = layer;
        this.points = List.copyOf(points);
        this.segments = List.copyOf(segments);
        this.angles = new ArrayList<>(angles);
    }

    @Override
    public ObjectKind kind() {
        return ObjectKind.POLYGON;
    }

    @Override
    protected String measurePrefix() {
        return "aPolygon";
    }

    public List<Point> getPoints() {
        return points;
    }

    /** Boundary segments, the i-th joining vertex i to vertex i+1. */
    public List<Segment> getSegments() {
        return segments;
    }

    /** Vertex angles, the i-th taken at vertex i+1 from vertex i towards vertex i+2. */
    public List<Angle> getAngles() {
        List<Angle> live = new ArrayList<>(angles.size());
        angles.forEach(a -> live.add((Angle) a.live()));
        return live;
    }

    public Optional<Angle> angleAt(Point vertex) {
        return getAngles().stream().filter(a -> a.getVertex() == vertex).findFirst();
    }

    public boolean hasSide(Segment segment) {
        return segments.contains(segment);
    }

    public boolean hasAngle(Angle angle) {
        Angle live = (Angle) angle.live();
        return getAngles().contains(live);
    }

    @Override
    public String toString() {
        return getClass().getSimpleName() + "(" + getKey() + ")";
    }
}
