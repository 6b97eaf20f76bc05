package com.geometry.deduction.core.model;

import com.geometry.deduction.construction.ConstructionException;
import com.geometry.deduction.construction.ConstructionLayer;
import com.geometry.deduction.registry.RegisteredObject;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * A line through two or more known collinear points, held in their order along the
 * line. The first point is always lexically smaller than the last.
 */
public class Line extends RegisteredObject {

    private final ConstructionLayer layer;
    private List<Point> points;

    public Line(ConstructionLayer layer, List<Point> points) {
        super(keyOf(points));
        this.layer = layer;
        this.points = List.copyOf(points);
    }

    public static String keyOf(List<Point> points) {
        return points.stream().map(Point::getKey).collect(Collectors.joining(" "));
    }

    @Override
    public ObjectKind kind() {
        return ObjectKind.LINE;
    }

    public List<Point> getPoints() {
        return self().points;
    }

    public boolean contains(Point point) {
        return self().points.contains(point);
    }

    public int indexOf(Point point) {
        return self().points.indexOf(point);
    }

    /**
     * Replaces the point sequence after a collinear merge. The key is brought in line
     * separately through the registry so that the rename is broadcast.
     */
    public void updatePoints(List<Point> merged) {
        requireLive("update points");
        this.points = List.copyOf(merged);
    }

    /** The single point shared with {@code other}, if they share exactly one. */
    public Optional<Point> intersectionPoint(Line other) {
        List<Point> common = new ArrayList<>(self().points);
        common.retainAll(other.getPoints());
        return common.size() == 1 ? Optional.of(common.get(0)) : Optional.empty();
    }

    /** Every segment on this line that contains at least one other known point. */
    public List<Segment> segmentsWithSubsegments() {
        List<Point> pts = self().points;
        List<Segment> result = new ArrayList<>();
        for (int k = 2; k < pts.size(); k++) {
            for (int i = 0; i + k < pts.size(); i++) {
                result.add(layer.segment(pts.get(i), pts.get(i + k)));
            }
        }
        return result;
    }

    /**
     * Angles formed around the intersection with {@code other}, taken in one rotational
     * sense: between consecutive rays towards this line's first point, the other line's
     * first point, this line's last point and the other line's last point.
     *
     * @throws ConstructionException if the lines do not share exactly one point
     */
    public List<Angle> anglesFormedByIntersection(Line other) {
        Point intersection = intersectionPoint(other).orElseThrow(() -> new ConstructionException(
                "Lines " + getKey() + " and " + other.getKey() + " have no single intersection point"));
        List<Point> mine = getPoints();
        List<Point> theirs = other.getPoints();
        List<Point> ends = List.of(mine.get(0), theirs.get(0), mine.get(mine.size() - 1),
                theirs.get(theirs.size() - 1));
        List<Ray> rays = new ArrayList<>();
        for (Point end : ends) {
            rays.add(end.equals(intersection) ? null : layer.ray(intersection, end));
        }
        List<Angle> angles = new ArrayList<>();
        for (int i = 0; i < rays.size(); i++) {
            Ray first = rays.get(i);
            Ray second = rays.get((i + 1) % rays.size());
            if (first != null && second != null) {
                angles.add(layer.angle(first, second));
            }
        }
        return angles;
    }

    /**
     * The angles at the intersection that are known to be non-reflex, if the reflex
     * flag of any of them is known. All angles formed in one rotational sense are
     * either non-reflex or reflex together; in the latter case their explementaries
     * are returned. Returns an empty list while no flag is known.
     */
    public List<Angle> nonreflexCandidates(Line other) {
        List<Angle> angles = anglesFormedByIntersection(other);
        boolean anyKnown = angles.stream().anyMatch(a -> a.getReflex().isPresent());
        if (!anyKnown) {
            return List.of();
        }
        boolean anyReflex = angles.stream().anyMatch(a -> a.getReflex().orElse(false));
        if (anyReflex) {
            return angles.stream().map(Angle::explementary).collect(Collectors.toList());
        }
        return angles;
    }

    /**
     * Marks the angles at the intersection with {@code other} as non-reflex when the
     * orientation is known, and returns them.
     */
    public List<Angle> nonreflexAnglesFormedByIntersection(Line other) {
        List<Angle> angles = nonreflexCandidates(other);
        for (Angle angle : angles) {
            angle.setReflex(false);
        }
        return angles.stream().map(a -> (Angle) a.live()).collect(Collectors.toList());
    }

    @Override
    protected List<Object> identity() {
        return new ArrayList<>(points);
    }

    private Line self() {
        return (Line) live();
    }

    @Override
    public String toString() {
        return "Line(" + getKey() + ")";
    }
}
