package com.geometry.deduction.construction;

import com.geometry.deduction.constraint.ConstraintStore;
import com.geometry.deduction.core.model.Angle;
import com.geometry.deduction.core.model.Line;
import com.geometry.deduction.core.model.Point;
import com.geometry.deduction.core.model.Polygon;
import com.geometry.deduction.core.model.Ray;
import com.geometry.deduction.core.model.Segment;
import com.geometry.deduction.core.model.Triangle;
import com.geometry.deduction.measure.MeasureLayer;
import com.geometry.deduction.registry.EntityRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * Get-or-create entry points for every geometric kind.
 *
 * <p>Every request is canonicalized first, so equivalent requests return the same
 * instance. Lines that turn out to share two points are merged, which can re-target
 * rays and re-key or merge angles through the registry's change notifications.</p>
 *
 * <p>Point lists may be given as a single string of labels separated by single spaces,
 * for example {@code "A B C"}.</p>
 */
public class ConstructionLayer {
    private static final Logger log = LoggerFactory.getLogger(ConstructionLayer.class);

    private final EntityRegistry registry;
    private final MeasureLayer measures;
    private final ConstraintStore constraints;

    public ConstructionLayer(EntityRegistry registry, MeasureLayer measures, ConstraintStore constraints) {
        this.registry = Objects.requireNonNull(registry, "registry is required");
        this.measures = Objects.requireNonNull(measures, "measures is required");
        this.constraints = Objects.requireNonNull(constraints, "constraints is required");
    }

    public EntityRegistry registry() {
        return registry;
    }

    public MeasureLayer measures() {
        return measures;
    }

    public ConstraintStore constraints() {
        return constraints;
    }

    // ========== Points ==========

    public Point point(String label) {
        if (label == null || label.isEmpty()) {
            throw new ConstructionException("Empty string is not a valid point label.");
        }
        if (label.chars().anyMatch(Character::isWhitespace)) {
            throw new ConstructionException("Whitespace is not permitted in point label '" + label + "'.");
        }
        Optional<Point> existing = registry.get(Point.class, label);
        if (existing.isPresent()) {
            return existing.get();
        }
        return registry.register(new Point(label));
    }

    /**
     * Resolves a space separated list of labels to distinct points.
     */
    public List<Point> points(String spec) {
        if (spec == null) {
            throw new ConstructionException("Point specification is required");
        }
        List<Point> result = new ArrayList<>();
        for (String label : spec.split(" ", -1)) {
            result.add(point(label));
        }
        return requireDistinct(result);
    }

    // ========== Lines ==========

    public Line line(String spec) {
        return line(points(spec));
    }

    /**
     * Gets or creates the line through the given points, in the given order. Existing
     * lines sharing two or more points are merged with it.
     *
     * @throws CollinearSequenceException if the orderings cannot be reconciled
     */
    public Line line(List<Point> points) {
        List<Point> pts = requireDistinct(new ArrayList<>(points));
        if (pts.size() < 2) {
            throw new ConstructionException("A line requires at least 2 points.");
        }
        List<Point> canonical = canonicalLineOrder(pts);
        Optional<Line> exact = registry.get(Line.class, Line.keyOf(canonical));
        if (exact.isPresent()) {
            return exact.get();
        }

        List<Line> overlapping = new ArrayList<>();
        for (Line existing : registry.elements(Line.class)) {
            if (commonCount(existing.getPoints(), pts) > 1) {
                overlapping.add(existing);
            }
        }

        Line line;
        if (overlapping.isEmpty()) {
            line = registry.register(new Line(this, canonical));
            log.debug("line.created key={}", line.getKey());
        } else {
            List<Point> merged = pts;
            for (Line existing : overlapping) {
                merged = CollinearMerge.merge(existing.getPoints(), merged);
            }
            merged = canonicalLineOrder(merged);
            for (Line existing : overlapping) {
                if (!existing.getPoints().equals(merged)) {
                    existing.updatePoints(merged);
                }
            }
            if (overlapping.size() > 1) {
                registry.removeDuplicates(Line.class);
            }
            line = (Line) registry.updateKey(overlapping.get(0), Line.keyOf(merged));
            log.debug("line.merged key={} merged={}", line.getKey(), overlapping.size());
        }

        List<Point> onLine = line.getPoints();
        for (int i = 0; i < onLine.size(); i++) {
            for (int j = i + 1; j < onLine.size(); j++) {
                segment(onLine.get(i), onLine.get(j));
            }
        }
        return (Line) line.live();
    }

    private static List<Point> canonicalLineOrder(List<Point> pts) {
        if (pts.get(0).compareTo(pts.get(pts.size() - 1)) < 0) {
            return pts;
        }
        List<Point> reversed = new ArrayList<>(pts);
        Collections.reverse(reversed);
        return reversed;
    }

    private static int commonCount(List<Point> a, List<Point> b) {
        int count = 0;
        for (Point p : a) {
            if (b.contains(p)) {
                count++;
            }
        }
        return count;
    }

    /**
     * The outermost known point on the line through {@code vertex} and {@code towards},
     * on the side of {@code towards}. Creates the line if needed.
     */
    public Point canonicalRayDirectionPoint(Point vertex, Point towards) {
        List<Point> onLine = line(List.of(vertex, towards)).getPoints();
        return onLine.indexOf(vertex) < onLine.indexOf(towards)
                ? onLine.get(onLine.size() - 1)
                : onLine.get(0);
    }

    // ========== Segments and rays ==========

    public Segment segment(String spec) {
        return segment(requireArity(points(spec), 2, "segment"));
    }

    public Segment segment(List<Point> points) {
        requireArity(requireDistinct(new ArrayList<>(points)), 2, "segment");
        return segment(points.get(0), points.get(1));
    }

    public Segment segment(Point a, Point b) {
        if (a == b) {
            throw new ConstructionException("A segment requires 2 distinct points.");
        }
        Point first = a.compareTo(b) < 0 ? a : b;
        Point second = first == a ? b : a;
        Optional<Segment> existing = registry.get(Segment.class, first.getKey() + " " + second.getKey());
        if (existing.isPresent()) {
            return existing.get();
        }
        return registry.register(new Segment(this, first, second));
    }

    public Ray ray(String spec) {
        List<Point> pts = requireArity(points(spec), 2, "ray");
        return ray(pts.get(0), pts.get(1));
    }

    /**
     * Gets or creates the ray from {@code vertex} through {@code towards}.
     */
    public Ray ray(Point vertex, Point towards) {
        if (vertex == towards) {
            throw new ConstructionException("A ray requires 2 distinct points.");
        }
        Point far = canonicalRayDirectionPoint(vertex, towards);
        Optional<Ray> existing = registry.get(Ray.class, Ray.keyOf(vertex, far));
        if (existing.isPresent()) {
            return existing.get();
        }
        Ray ray = registry.register(new Ray(this, vertex, far));
        line(List.of(vertex, far)).addChangeListener(ray);
        return ray;
    }

    // ========== Angles ==========

    public Angle angle(String spec) {
        return angle(spec, null);
    }

    /**
     * Gets or creates the angle given by three labels, vertex in the middle.
     *
     * @param reflex known reflex flag, or null
     */
    public Angle angle(String spec, Boolean reflex) {
        List<Point> pts = requireArity(points(spec), 3, "angle");
        return angle(pts.get(0), pts.get(1), pts.get(2), reflex);
    }

    public Angle angle(Point from, Point vertex, Point to) {
        return angle(from, vertex, to, null);
    }

    public Angle angle(Point from, Point vertex, Point to, Boolean reflex) {
        Ray first = ray(vertex, from);
        Ray second = ray(vertex, to);
        return angle((Ray) first.live(), (Ray) second.live(), reflex);
    }

    public Angle angle(Ray ray1, Ray ray2) {
        return angle(ray1, ray2, null);
    }

    /**
     * Gets or creates the angle swept from {@code ray1} to {@code ray2}.
     *
     * @throws ConstructionException if the rays do not share a vertex or are the same ray
     */
    public Angle angle(Ray ray1, Ray ray2, Boolean reflex) {
        Ray first = (Ray) ray1.live();
        Ray second = (Ray) ray2.live();
        if (first.getVertex() != second.getVertex()) {
            throw new ConstructionException("Rays " + first.getKey() + " and " + second.getKey()
                    + " do not share a vertex.");
        }
        if (first == second) {
            throw new ConstructionException("An angle requires two different rays, got " + first.getKey() + " twice.");
        }
        Optional<Angle> existing = registry.get(Angle.class, Angle.keyOf(first, second));
        Angle angle;
        if (existing.isPresent()) {
            angle = existing.get();
        } else {
            angle = registry.register(new Angle(this, first, second));
            first.addChangeListener(angle);
            second.addChangeListener(angle);
        }
        if (reflex != null) {
            angle.setReflex(reflex);
        }
        return (Angle) angle.live();
    }

    // ========== Polygons ==========

    public Polygon polygon(String spec) {
        return polygon(points(spec));
    }

    /**
     * Gets or creates a polygon; three points give a {@link Triangle}.
     *
     * @throws PolygonOrientationException if a polygon over the same vertices has another order
     */
    public Polygon polygon(List<Point> points) {
        List<Point> pts = requireDistinct(new ArrayList<>(points));
        if (pts.size() < 3) {
            throw new ConstructionException("A polygon requires at least 3 points.");
        }
        return pts.size() == 3 ? triangle(pts) : buildPolygon(pts, false);
    }

    public Triangle triangle(String spec) {
        return triangle(points(spec));
    }

    public Triangle triangle(Point a, Point b, Point c) {
        return triangle(List.of(a, b, c));
    }

    public Triangle triangle(List<Point> points) {
        List<Point> pts = requireArity(requireDistinct(new ArrayList<>(points)), 3, "triangle");
        return (Triangle) buildPolygon(pts, true);
    }

    private Polygon buildPolygon(List<Point> pts, boolean triangle) {
        int start = pts.indexOf(Collections.min(pts));
        List<Point> canonical = new ArrayList<>(pts.subList(start, pts.size()));
        canonical.addAll(pts.subList(0, start));
        String key = Line.keyOf(canonical);

        Optional<? extends Polygon> existing = triangle
                ? registry.get(Triangle.class, key)
                : registry.get(Polygon.class, key);
        if (existing.isPresent()) {
            return existing.get();
        }
        for (Polygon other : registry.elementsRecursive(Polygon.class)) {
            if (new HashSet<>(other.getPoints()).equals(new HashSet<>(canonical))) {
                throw new PolygonOrientationException(other.getKey(), key);
            }
        }

        int n = canonical.size();
        List<Segment> segments = new ArrayList<>(n);
        List<Angle> angles = new ArrayList<>(n);
        for (int i = 0; i < n; i++) {
            segments.add(segment(canonical.get(i), canonical.get((i + 1) % n)));
        }
        for (int i = 0; i < n; i++) {
            angles.add(angle(canonical.get(i), canonical.get((i + 1) % n), canonical.get((i + 2) % n)));
        }
        Polygon polygon = triangle
                ? new Triangle(this, canonical, segments, angles)
                : new Polygon(this, canonical, segments, angles);
        registry.register(polygon);
        log.debug("polygon.created kind={} key={}", polygon.kind(), key);
        return polygon;
    }

    // ========== Queries without side effects ==========

    /** The registered line containing both points, if any. */
    public Optional<Line> findLineThrough(Point a, Point b) {
        return registry.elements(Line.class).stream()
                .filter(l -> l.contains(a) && l.contains(b))
                .findFirst();
    }

    public Optional<Segment> findSegment(Point a, Point b) {
        if (a == b) {
            return Optional.empty();
        }
        Point first = a.compareTo(b) < 0 ? a : b;
        Point second = first == a ? b : a;
        return registry.get(Segment.class, first.getKey() + " " + second.getKey());
    }

    public Optional<Ray> findRay(Point vertex, Point towards) {
        return findLineThrough(vertex, towards).flatMap(line -> {
            List<Point> onLine = line.getPoints();
            Point far = onLine.indexOf(vertex) < onLine.indexOf(towards)
                    ? onLine.get(onLine.size() - 1)
                    : onLine.get(0);
            return registry.get(Ray.class, Ray.keyOf(vertex, far));
        });
    }

    /** The registered angle from {@code from} around {@code vertex} to {@code to}, if any. */
    public Optional<Angle> findAngle(Point from, Point vertex, Point to) {
        if (from == vertex || to == vertex || from == to) {
            return Optional.empty();
        }
        Optional<Ray> first = findRay(vertex, from);
        Optional<Ray> second = findRay(vertex, to);
        if (first.isEmpty() || second.isEmpty() || first.get() == second.get()) {
            return Optional.empty();
        }
        return registry.get(Angle.class, Angle.keyOf(first.get(), second.get()));
    }

    public Optional<Angle> findAngle(String spec) {
        List<Point> pts = Arrays.stream(spec.split(" "))
                .map(label -> registry.get(Point.class, label).orElse(null))
                .collect(Collectors.toList());
        if (pts.size() != 3 || pts.contains(null)) {
            return Optional.empty();
        }
        return findAngle(pts.get(0), pts.get(1), pts.get(2));
    }

    // ========== Validation ==========

    private static List<Point> requireDistinct(List<Point> points) {
        if (new HashSet<>(points).size() != points.size()) {
            throw new ConstructionException("Points are not all distinct: " + points);
        }
        return points;
    }

    private static List<Point> requireArity(List<Point> points, int arity, String what) {
        if (points.size() != arity) {
            throw new ConstructionException("A " + what + " requires exactly " + arity + " points, got "
                    + points.size() + ".");
        }
        return points;
    }
}
