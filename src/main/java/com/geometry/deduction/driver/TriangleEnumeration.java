package com.geometry.deduction.driver;

import com.geometry.deduction.construction.ConstructionLayer;
import com.geometry.deduction.core.model.ObjectKind;
import com.geometry.deduction.core.model.Point;
import com.geometry.deduction.core.model.Triangle;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;

/**
 * Registers the triangles hidden inside known ones. For a triangle {@code V P Q},
 * any X past V on ray VP and Y past V on ray VQ joined by a registered segment
 * give the triangle {@code V X Y} with the same orientation. Repeats until no new
 * triangle appears.
 */
public class TriangleEnumeration implements TypeOneConstruction {
    private static final Logger log = LoggerFactory.getLogger(TriangleEnumeration.class);

    @Override
    public String name() {
        return "triangleEnumeration";
    }

    @Override
    public void apply(ConstructionLayer layer) {
        int before = layer.registry().size(ObjectKind.TRIANGLE);
        boolean changed = true;
        while (changed) {
            changed = false;
            for (Triangle triangle : layer.registry().elements(Triangle.class)) {
                if (triangle.isSuperseded()) {
                    continue;
                }
                changed |= enumerateFrom(layer, triangle);
            }
        }
        log.debug("construction.applied name={} trianglesAdded={}",
                name(), layer.registry().size(ObjectKind.TRIANGLE) - before);
    }

    private static boolean enumerateFrom(ConstructionLayer layer, Triangle triangle) {
        boolean changed = false;
        List<Point> pts = triangle.getPoints();
        for (int i = 0; i < 3; i++) {
            Point vertex = pts.get(i);
            List<Point> towardsNext = layer.ray(vertex, pts.get((i + 1) % 3)).pointsBeyondVertex();
            List<Point> towardsPrev = layer.ray(vertex, pts.get((i + 2) % 3)).pointsBeyondVertex();
            for (Point x : towardsNext) {
                for (Point y : towardsPrev) {
                    if (layer.findSegment(x, y).isEmpty()) {
                        continue;
                    }
                    int count = layer.registry().size(ObjectKind.TRIANGLE);
                    layer.triangle(List.of(vertex, x, y));
                    changed |= layer.registry().size(ObjectKind.TRIANGLE) != count;
                }
            }
        }
        return changed;
    }
}
