package com.geometry.deduction.core.model;

import com.geometry.deduction.algebra.Rational;
import com.geometry.deduction.constraint.ConstraintStore;
import com.geometry.deduction.construction.ConstructionLayer;
import com.geometry.deduction.measure.MeasureConflictException;
import com.geometry.deduction.measure.MeasureLayer;
import com.geometry.deduction.registry.EntityRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("Angle Tests")
class AngleTest {

    private ConstraintStore constraints;
    private ConstructionLayer layer;

    @BeforeEach
    void setUp() {
        EntityRegistry registry = new EntityRegistry();
        constraints = new ConstraintStore(registry);
        layer = new ConstructionLayer(registry, new MeasureLayer(constraints), constraints);
    }

    @Test
    @DisplayName("Should swap the rays for the explementary angle")
    void explementaryOfExplementaryIsSameAngle() {
        Angle angle = layer.angle("A B C");

        Angle explementary = angle.explementary();

        assertEquals("C B A", explementary.getKey());
        assertSame(angle, explementary.explementary());
        assertSame(angle.getVertex(), explementary.getVertex());
    }

    @Test
    @DisplayName("Should derive the reflex flag and pair with the explementary on a numeric measure")
    void numericMeasureSetsReflexAndPairs() {
        Angle angle = layer.angle("A B C");

        angle.setMeasure(60);

        assertEquals(Optional.of(false), angle.getReflex());
        assertEquals(Optional.of(true), angle.explementary().getReflex());
        assertEquals(Optional.of(Rational.of(60)), angle.numericMeasure());
        assertEquals(1, constraints.liveExpressions().size());
        assertTrue(angle.pairWithExplementary().isEmpty());
    }

    @Test
    @DisplayName("Should treat a straight angle as non-reflex")
    void straightAngleIsNonReflex() {
        Angle angle = layer.angle("A B C");

        angle.setMeasure(180);

        assertEquals(Optional.of(false), angle.getReflex());
    }

    @Test
    @DisplayName("Should propagate the negated flag to the explementary")
    void reflexFlagPropagates() {
        Angle angle = layer.angle("A B C", true);

        assertEquals(Optional.of(true), angle.getReflex());
        assertEquals(Optional.of(false), angle.explementary().getReflex());
    }

    @Test
    @DisplayName("Should reject changing a known reflex flag")
    void rejectsFlagChange() {
        Angle angle = layer.angle("A B C", false);

        assertThrows(MeasureConflictException.class, () -> angle.setReflex(true));
    }

    @Test
    @DisplayName("Should reject a measure that contradicts the reflex flag")
    void rejectsMeasureAgainstFlag() {
        Angle angle = layer.angle("A B C", false);

        assertThrows(MeasureConflictException.class, () -> angle.setMeasure(200));
    }

    @ParameterizedTest
    @ValueSource(longs = {0, -30, 360, 400})
    @DisplayName("Should reject measures outside the open range 0 to 360")
    void rejectsOutOfRange(long degrees) {
        Angle angle = layer.angle("A B C");

        assertThrows(MeasureConflictException.class, () -> angle.setMeasure(degrees));
    }
}
