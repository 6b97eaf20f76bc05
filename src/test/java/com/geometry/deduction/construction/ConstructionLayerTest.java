package com.geometry.deduction.construction;

import com.geometry.deduction.algebra.Polynomial;
import com.geometry.deduction.constraint.ConstraintStore;
import com.geometry.deduction.core.model.Angle;
import com.geometry.deduction.core.model.Line;
import com.geometry.deduction.core.model.ObjectKind;
import com.geometry.deduction.core.model.Point;
import com.geometry.deduction.core.model.Ray;
import com.geometry.deduction.core.model.Segment;
import com.geometry.deduction.core.model.Triangle;
import com.geometry.deduction.measure.MeasureLayer;
import com.geometry.deduction.registry.EntityRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("ConstructionLayer Tests")
class ConstructionLayerTest {

    private EntityRegistry registry;
    private ConstructionLayer layer;

    @BeforeEach
    void setUp() {
        registry = new EntityRegistry();
        ConstraintStore constraints = new ConstraintStore(registry);
        layer = new ConstructionLayer(registry, new MeasureLayer(constraints), constraints);
    }

    @Nested
    @DisplayName("Points")
    class Points {

        @Test
        @DisplayName("Should return the same point for the same label")
        void pointIsIdempotent() {
            Point a = layer.point("A");

            assertSame(a, layer.point("A"));
            assertEquals(1, registry.size(ObjectKind.POINT));
        }

        @ParameterizedTest
        @ValueSource(strings = {"", "A B", "A\tB"})
        @DisplayName("Should reject empty labels and labels with whitespace")
        void rejectsInvalidLabels(String label) {
            assertThrows(ConstructionException.class, () -> layer.point(label));
        }

        @Test
        @DisplayName("Should reject repeated labels in a specification")
        void rejectsRepeatedLabels() {
            assertThrows(ConstructionException.class, () -> layer.points("A B A"));
        }

        @Test
        @DisplayName("Should reject a specification of the wrong arity")
        void rejectsWrongArity() {
            assertThrows(ConstructionException.class, () -> layer.segment("A B C"));
            assertThrows(ConstructionException.class, () -> layer.angle("A B"));
            assertThrows(ConstructionException.class, () -> layer.triangle("A B C D"));
        }
    }

    @Nested
    @DisplayName("Lines")
    class Lines {

        @Test
        @DisplayName("Should return the same line for a reversed specification")
        void reversedLineIsSameLine() {
            Line line = layer.line("A B C");

            assertSame(line, layer.line("C B A"));
            assertEquals("A B C", line.getKey());
        }

        @Test
        @DisplayName("Should create every segment between points of a line")
        void lineCreatesSegments() {
            layer.line("A B C");

            assertEquals(3, registry.size(ObjectKind.SEGMENT));
            assertTrue(layer.findSegment(layer.point("A"), layer.point("C")).isPresent());
        }

        @Test
        @DisplayName("Should merge a line sharing two points with an existing one")
        void mergesOverlappingLine() {
            layer.line("A X B C D");
            Line merged = layer.line("C F E B A");

            assertEquals("A X B E F C D", merged.getKey());
            assertEquals(1, registry.size(ObjectKind.LINE));
        }

        @Test
        @DisplayName("Should merge two disjoint lines joined by a third")
        void mergesThroughBridgingLine() {
            Line first = layer.line("A B C");
            Line second = layer.line("D E F");

            Line merged = layer.line("B C D E");

            assertEquals("A B C D E F", merged.getKey());
            assertEquals(1, registry.size(ObjectKind.LINE));
            assertSame(merged, first.live());
            assertSame(merged, second.live());
        }

        @Test
        @DisplayName("Should reject an ordering that contradicts an existing line")
        void rejectsInconsistentOrder() {
            layer.line("A B C");

            assertThrows(CollinearSequenceException.class, () -> layer.line("B A C"));
        }

        @Test
        @DisplayName("Should not create a line for a bare segment")
        void segmentDoesNotCreateLine() {
            Segment segment = layer.segment("B A");

            assertEquals("A B", segment.getKey());
            assertSame(segment, layer.segment("A B"));
            assertEquals(0, registry.size(ObjectKind.LINE));
        }
    }

    @Nested
    @DisplayName("Rays")
    class Rays {

        @Test
        @DisplayName("Should point rays to the farthest known point")
        void raysAreCanonical() {
            layer.line("A B C");

            Ray ray = layer.ray("A B");

            assertEquals("A C", ray.getKey());
            assertSame(ray, layer.ray("A C"));
        }

        @Test
        @DisplayName("Should re-target a ray when its line grows")
        void rayFollowsLineExtension() {
            Ray ray = layer.ray("A B");

            layer.line("A B C");

            assertEquals("A C", ray.getKey());
            assertSame(ray, layer.ray("A C"));
        }

        @Test
        @DisplayName("Should reject a ray with the same start and direction point")
        void rejectsDegenerateRay() {
            Point a = layer.point("A");

            assertThrows(ConstructionException.class, () -> layer.ray(a, a));
        }
    }

    @Nested
    @DisplayName("Angles")
    class Angles {

        @Test
        @DisplayName("Should re-key an angle when one of its rays is re-targeted")
        void angleFollowsRay() {
            Angle angle = layer.angle("X A B");

            layer.line("A B C");

            assertEquals("X A C", angle.getKey());
            assertSame(angle, layer.angle("X A C"));
        }

        @Test
        @DisplayName("Should merge angles whose rays become identical and keep the measure")
        void mergesAnglesWithMeasure() {
            Angle first = layer.angle("X A B");
            Polynomial measure = first.getMeasure();
            Angle second = layer.angle("X A C");

            layer.line("A B C");

            assertSame(second, first.live());
            assertEquals(measure, layer.angle("X A C").getMeasure());
        }

        @Test
        @DisplayName("Should reject an angle whose rays coincide")
        void rejectsCollapsedAngle() {
            layer.line("A B C");

            assertThrows(ConstructionException.class, () -> layer.angle("B A C"));
        }

        @Test
        @DisplayName("Should reject rays that do not share a vertex")
        void rejectsRaysWithoutCommonVertex() {
            Ray first = layer.ray("A B");
            Ray second = layer.ray("C D");

            assertThrows(ConstructionException.class, () -> layer.angle(first, second));
        }

        @Test
        @DisplayName("Should look up angles without creating anything")
        void findAngleHasNoSideEffects() {
            assertTrue(layer.findAngle("X Y Z").isEmpty());
            assertEquals(0, registry.size(ObjectKind.POINT));

            Angle angle = layer.angle("X Y Z");

            assertEquals(angle, layer.findAngle("X Y Z").orElseThrow());
        }
    }

    @Nested
    @DisplayName("Polygons")
    class Polygons {

        @Test
        @DisplayName("Should return the same triangle for a rotated specification")
        void rotatedTriangleIsSameTriangle() {
            Triangle triangle = layer.triangle("A B C");

            assertSame(triangle, layer.triangle("B C A"));
            assertSame(triangle, layer.triangle("C A B"));
        }

        @Test
        @DisplayName("Should reject the same vertices in the opposite orientation")
        void rejectsOppositeOrientation() {
            layer.triangle("A B C");

            PolygonOrientationException ex =
                    assertThrows(PolygonOrientationException.class, () -> layer.triangle("C B A"));
            assertEquals("A B C", ex.getExistingKey());
            assertEquals("A C B", ex.getRequestedKey());
        }

        @Test
        @DisplayName("Should build sides and vertex angles in order")
        void buildsSidesAndAngles() {
            Triangle triangle = layer.triangle("A B C");

            assertEquals(List.of("A B", "B C", "A C"),
                    triangle.getSegments().stream().map(Segment::getKey).toList());
            assertEquals(List.of("A B C", "B C A", "C A B"),
                    triangle.getAngles().stream().map(Angle::getKey).toList());
        }

        @Test
        @DisplayName("Should reject polygons with fewer than three points")
        void rejectsDegeneratePolygon() {
            assertThrows(ConstructionException.class, () -> layer.polygon("A B"));
        }
    }
}
