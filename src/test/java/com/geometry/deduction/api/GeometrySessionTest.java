package com.geometry.deduction.api;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.geometry.deduction.algebra.Polynomial;
import com.geometry.deduction.algebra.Rational;
import com.geometry.deduction.core.model.Line;
import com.geometry.deduction.core.model.ObjectKind;
import com.geometry.deduction.core.model.Segment;
import com.geometry.deduction.core.model.Triangle;
import com.geometry.deduction.metrics.MicrometerMetricsService;
import com.geometry.deduction.registry.MergeReason;
import com.geometry.deduction.registry.RegistrySnapshot;
import com.geometry.deduction.solver.AlgebraSolver;
import com.geometry.deduction.solver.SolverOutcome;
import com.geometry.deduction.solver.SystemInconsistencyException;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.Mockito.*;

@DisplayName("GeometrySession Tests")
class GeometrySessionTest {

    private static Polynomial number(long value) {
        return Polynomial.constant(value);
    }

    @Nested
    @DisplayName("Solving goals")
    class SolvingGoals {

        private final GeometrySession session = GeometrySession.builder().build();

        @Test
        @DisplayName("Should find a segment from the lengths along its line")
        void segmentsAlongLine() {
            session.line("A B C D E");
            session.segment("A C").setMeasure(5);
            session.segment("C E").setMeasure(12);
            session.segment("B E").setMeasure(15);

            assertEquals(number(2), session.solve(session.segment("A B")));
        }

        @Test
        @DisplayName("Should find the third angle of a triangle")
        void triangleAngles() {
            session.triangle("A B C");
            session.angle("C A B").setMeasure(60);
            session.angle("A B C").setMeasure(50);

            assertEquals(number(70), session.solve(session.angle("B C A")));
        }

        @Test
        @DisplayName("Should find the supplement of an angle on a line")
        void straightAngle() {
            session.line("A B C");
            session.angle("A B D").setMeasure(70);

            assertEquals(number(110), session.solve(session.angle("D B C")));
        }

        @Test
        @DisplayName("Should relate every angle around two crossing lines")
        void straightAngleAtCrossing() {
            session.line("A B C");
            session.line("D B E");
            session.angle("A B D").setMeasure(70);

            session.theorems().straightAngle(session.line("A B C"));

            assertEquals(Optional.of(Rational.of(110)), session.angle("D B C").numericMeasure());
            assertEquals(Optional.of(Rational.of(70)), session.angle("C B E").numericMeasure());
        }

        @Test
        @DisplayName("Should only pair angles once a line crosses at an interior point")
        void straightAngleNeedsTwoAngles() {
            session.line("F G H");
            session.line("F I J");
            session.angle("H F J", false);

            assertTrue(session.theorems().straightAngle(session.line("F G H")).isEmpty());

            session.line("G L");
            session.angle("L G F").setMeasure(90);
            session.theorems().straightAngle(session.line("F G H"));

            assertEquals(Optional.of(Rational.of(90)), session.angle("H G L").numericMeasure());
        }

        @Test
        @DisplayName("Should find the hypotenuse of a right triangle")
        void hypotenuse() {
            session.triangle("A B C");
            session.angle("B C A").setMeasure(90);
            session.segment("A C").setMeasure(3);
            session.segment("B C").setMeasure(4);

            assertEquals(number(5), session.solve(session.segment("A B")));
        }

        @Test
        @DisplayName("Should find the altitude to the hypotenuse through equal areas")
        void altitudeToHypotenuse() {
            session.line("A D B");
            session.triangle("A B C");
            session.angle("B C A").setMeasure(90);
            session.segment("A C").setMeasure(3);
            session.segment("B C").setMeasure(4);
            Segment cd = session.segment("C D");
            session.angle("A D C").setMeasure(90);

            assertEquals(Polynomial.constant(Rational.of(12, 5)), session.solve(cd));
        }

        @Test
        @DisplayName("Should leave an undetermined measure as its unknown")
        void undetermined() {
            session.triangle("A B C");

            Polynomial result = session.solve(session.segment("A B"));

            assertTrue(result.isUnknown());
            assertTrue(session.targets().contains(session.segment("A B")));
        }

        @Test
        @DisplayName("Should reject a system forcing a non-positive length")
        void nonPositiveLength() {
            session.line("A B C");
            session.segment("A C").setMeasure(5);
            session.segment("A B").setMeasure(7);

            assertThrows(SystemInconsistencyException.class, () -> session.solve(session.segment("B C")));
        }
    }

    @Nested
    @DisplayName("Manual solving")
    class ManualSolving {

        private final GeometrySession session = GeometrySession.builder()
                .options(SessionOptions.manualSolve())
                .build();

        @Test
        @DisplayName("Should keep relations live until the system is solved")
        void solvesOnRequest() {
            Line line = session.line("A B C");
            session.segment("A B").setMeasure(2);
            session.segment("B C").setMeasure(3);
            session.theorems().subsegmentSum(line);

            assertEquals(1, session.liveExpressions().size());
            assertFalse(session.segment("A C").hasNumericMeasure());

            session.solveSystem();

            assertEquals(Optional.of(Rational.of(5)), session.segment("A C").numericMeasure());
            assertTrue(session.liveExpressions().isEmpty());
        }
    }

    @Nested
    @DisplayName("Wiring")
    class Wiring {

        @Test
        @DisplayName("Should reject null options")
        void rejectsNullOptions() {
            assertThrows(IllegalArgumentException.class, () -> GeometrySession.builder().options(null));
        }

        @Test
        @DisplayName("Should give each session its own id")
        void distinctSessionIds() {
            assertNotEquals(GeometrySession.builder().build().getSessionId(),
                    GeometrySession.builder().build().getSessionId());
        }

        @Test
        @DisplayName("Should use a supplied algebra solver")
        void customAlgebraSolver() {
            AlgebraSolver algebraSolver = mock(AlgebraSolver.class);
            when(algebraSolver.solve(anyList())).thenReturn(SolverOutcome.cannotSolve());
            GeometrySession session = GeometrySession.builder()
                    .options(SessionOptions.manualSolve())
                    .algebraSolver(algebraSolver)
                    .build();
            session.theorems().subsegmentSum(session.line("A B C"));

            session.solveSystem();

            verify(algebraSolver).solve(anyList());
            assertEquals(1, session.liveExpressions().size());
        }

        @Test
        @DisplayName("Should report to the supplied metrics service")
        void recordsMetrics() {
            SimpleMeterRegistry meterRegistry = new SimpleMeterRegistry();
            GeometrySession session = GeometrySession.builder()
                    .metricsService(new MicrometerMetricsService(meterRegistry))
                    .build();
            session.triangle("A B C");
            session.angle("B C A").setMeasure(90);
            session.segment("A C").setMeasure(3);
            session.segment("B C").setMeasure(4);

            session.solve(session.segment("A B"));

            Counter points = meterRegistry.find("geometry.entity.created").tag("kind", "POINT").counter();
            Counter pythagorean = meterRegistry.find("geometry.theorem.applied")
                    .tag("theorem", "pythagorean").counter();
            assertNotNull(points);
            assertEquals(3.0, points.count());
            assertNotNull(pythagorean);
            assertTrue(pythagorean.count() >= 1.0);
            assertNotNull(meterRegistry.find("geometry.solve.duration").timer());
        }
    }

    @Nested
    @DisplayName("Inspection")
    class Inspection {

        private final GeometrySession session = GeometrySession.builder()
                .options(SessionOptions.manualSolve())
                .build();

        @Test
        @DisplayName("Should record line merges in the ledger")
        void ledgerRecordsMerges() {
            session.line("A B C");
            session.line("D E F");

            session.line("B C D E");

            assertEquals(1, session.registry().size(ObjectKind.LINE));
            assertFalse(session.getMergeLedger().getRecordsByKind(ObjectKind.LINE).isEmpty());
            assertTrue(session.getMergeLedger().getAllRecords().stream()
                    .anyMatch(r -> r.reason() == MergeReason.DUPLICATE));
        }

        @Test
        @DisplayName("Should snapshot live objects as JSON")
        void snapshotAsJson() throws Exception {
            Triangle triangle = session.triangle("A B C");

            RegistrySnapshot snapshot = session.snapshot();
            JsonNode json = new ObjectMapper().readTree(snapshot.toJson());

            assertEquals(3, snapshot.size(ObjectKind.POINT));
            assertEquals(1, snapshot.size(ObjectKind.TRIANGLE));
            assertEquals(triangle.toString(), json.path("objects").path("Triangle").path("A B C").asText());
        }

        @Test
        @DisplayName("Should look angles up without creating them")
        void findAngle() {
            session.triangle("A B C");

            assertTrue(session.findAngle("A B C").isPresent());
            assertTrue(session.findAngle("A B X").isEmpty());
            assertEquals(3, session.registry().size(ObjectKind.POINT));
        }
    }
}
