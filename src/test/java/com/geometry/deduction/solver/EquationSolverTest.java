package com.geometry.deduction.solver;

import com.geometry.deduction.algebra.Polynomial;
import com.geometry.deduction.algebra.Rational;
import com.geometry.deduction.algebra.Unknown;
import com.geometry.deduction.constraint.ConstraintStore;
import com.geometry.deduction.constraint.Expression;
import com.geometry.deduction.construction.ConstructionLayer;
import com.geometry.deduction.core.model.Segment;
import com.geometry.deduction.measure.MeasureLayer;
import com.geometry.deduction.metrics.MetricsService;
import com.geometry.deduction.registry.EntityRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.List;
import java.util.Map;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
@DisplayName("EquationSolver Tests")
class EquationSolverTest {

    @Mock
    private AlgebraSolver algebraSolver;

    @Mock
    private MetricsService metricsService;

    private ConstraintStore constraints;
    private ConstructionLayer layer;
    private EquationSolver solver;

    @BeforeEach
    void setUp() {
        EntityRegistry registry = new EntityRegistry();
        constraints = new ConstraintStore(registry);
        MeasureLayer measures = new MeasureLayer(constraints);
        layer = new ConstructionLayer(registry, measures, constraints);
        solver = new EquationSolver(algebraSolver, constraints, measures, metricsService, "test-session", 10);
    }

    private Unknown unknownOf(Segment segment) {
        return segment.getMeasure().asUnknown();
    }

    @Nested
    @DisplayName("Accepting values")
    class Accepting {

        @Test
        @DisplayName("Should apply a value common to every branch")
        void appliesUniqueValue() {
            Segment ab = layer.segment("A B");
            Unknown u = unknownOf(ab);
            constraints.assertZero(Polynomial.of(u).subtract(3));
            when(algebraSolver.solve(anyList()))
                    .thenReturn(SolverOutcome.solved(List.of(Map.of(u, Polynomial.constant(3)))));

            Map<Unknown, Polynomial> applied = solver.solve();

            assertEquals(Map.of(u, Polynomial.constant(3)), applied);
            assertEquals(Optional.of(Rational.of(3)), ab.numericMeasure());
            assertTrue(constraints.liveExpressions().isEmpty());
        }

        @Test
        @DisplayName("Should reject a unique non-positive value")
        void rejectsNonPositiveUniqueValue() {
            Unknown u = unknownOf(layer.segment("A B"));
            constraints.assertZero(Polynomial.of(u).add(3));
            when(algebraSolver.solve(anyList()))
                    .thenReturn(SolverOutcome.solved(List.of(Map.of(u, Polynomial.constant(-3)))));

            assertThrows(SystemInconsistencyException.class, () -> solver.solve());
        }

        @Test
        @DisplayName("Should pick the only positive candidate across branches")
        void picksOnlyPositiveCandidate() {
            Segment ab = layer.segment("A B");
            Unknown u = unknownOf(ab);
            constraints.assertZero(Polynomial.of(u).pow(2).subtract(25));
            when(algebraSolver.solve(anyList())).thenReturn(SolverOutcome.solved(List.of(
                    Map.of(u, Polynomial.constant(5)),
                    Map.of(u, Polynomial.constant(-5)))));

            solver.solve();

            assertEquals(Optional.of(Rational.of(5)), ab.numericMeasure());
        }

        @Test
        @DisplayName("Should fail when more than one candidate is positive")
        void failsOnAmbiguousCandidates() {
            Unknown u = unknownOf(layer.segment("A B"));
            constraints.assertZero(Polynomial.of(u).subtract(2).multiply(Polynomial.of(u).subtract(3)));
            when(algebraSolver.solve(anyList())).thenReturn(SolverOutcome.solved(List.of(
                    Map.of(u, Polynomial.constant(2)),
                    Map.of(u, Polynomial.constant(3)))));

            assertThrows(SystemInconsistencyException.class, () -> solver.solve());
        }

        @Test
        @DisplayName("Should defer an unknown some branch leaves symbolic")
        void defersSymbolicUnknown() {
            Segment ab = layer.segment("A B");
            Unknown u = unknownOf(ab);
            Unknown v = unknownOf(layer.segment("C D"));
            constraints.assertZero(Polynomial.of(u).subtract(Polynomial.of(v)));
            when(algebraSolver.solve(anyList())).thenReturn(SolverOutcome.solved(List.of(
                    Map.of(u, Polynomial.constant(4)),
                    Map.of(u, Polynomial.of(v)))));

            Map<Unknown, Polynomial> applied = solver.solve();

            assertTrue(applied.isEmpty());
            assertFalse(ab.hasNumericMeasure());
            assertEquals(1, constraints.liveExpressions().size());
        }
    }

    @Nested
    @DisplayName("Outcomes")
    class Outcomes {

        @Test
        @DisplayName("Should throw when no solution exists")
        void noSolutionIsFatal() {
            Unknown u = unknownOf(layer.segment("A B"));
            constraints.assertZero(Polynomial.of(u).subtract(1));
            when(algebraSolver.solve(anyList())).thenReturn(SolverOutcome.noSolution());

            assertThrows(SystemInconsistencyException.class, () -> solver.solve());
        }

        @Test
        @DisplayName("Should treat cannot-solve as a no-op")
        void cannotSolveIsNoOp() {
            TargetSink sink = mock(TargetSink.class);
            solver.setTargetSink(sink);
            Unknown u = unknownOf(layer.segment("A B"));
            constraints.assertZero(Polynomial.of(u).subtract(1));
            when(algebraSolver.solve(anyList())).thenReturn(SolverOutcome.cannotSolve());

            assertTrue(solver.solve().isEmpty());
            assertEquals(1, constraints.liveExpressions().size());
            verify(sink, never()).expandTargets(anyList());
            verify(metricsService).recordSolveDuration(eq(SolverOutcome.Status.CANNOT_SOLVE), any());
        }

        @Test
        @DisplayName("Should not call the algebra solver without live expressions")
        void skipsEmptySystem() {
            assertTrue(solver.solve().isEmpty());
            verifyNoInteractions(algebraSolver);
        }

        @Test
        @DisplayName("Should hand live expressions to the target sink after a solved pass")
        void expandsTargets() {
            TargetSink sink = mock(TargetSink.class);
            solver.setTargetSink(sink);
            Unknown u = unknownOf(layer.segment("A B"));
            Unknown v = unknownOf(layer.segment("C D"));
            constraints.assertZero(Polynomial.of(u).subtract(Polynomial.of(v)));
            when(algebraSolver.solve(anyList()))
                    .thenReturn(SolverOutcome.solved(List.of(Map.of(u, Polynomial.of(v)))));

            solver.solve();

            verify(sink).expandTargets(constraints.liveExpressions());
            verify(metricsService).recordSolutionBranches(1);
        }
    }

    @Nested
    @DisplayName("Re-entrancy")
    class Reentrancy {

        @Test
        @DisplayName("Should coalesce a nested solve into another pass")
        void coalescesNestedSolve() {
            Unknown u = unknownOf(layer.segment("A B"));
            Unknown v = unknownOf(layer.segment("C D"));
            constraints.assertZero(Polynomial.of(u).subtract(Polynomial.of(v)));
            when(algebraSolver.solve(anyList()))
                    .thenReturn(SolverOutcome.solved(List.of(Map.of(u, Polynomial.of(v)))));
            boolean[] nested = {false};
            solver.setTargetSink(expressions -> {
                if (!nested[0]) {
                    nested[0] = true;
                    assertTrue(solver.solve().isEmpty());
                }
            });

            solver.solve();

            verify(algebraSolver, times(2)).solve(anyList());
        }

        @Test
        @DisplayName("Should tell the sink once the outermost solve has settled")
        void signalsSettledOnce() {
            Unknown u = unknownOf(layer.segment("A B"));
            Unknown v = unknownOf(layer.segment("C D"));
            constraints.assertZero(Polynomial.of(u).subtract(Polynomial.of(v)));
            when(algebraSolver.solve(anyList()))
                    .thenReturn(SolverOutcome.solved(List.of(Map.of(u, Polynomial.of(v)))));
            int[] settled = {0};
            boolean[] nested = {false};
            solver.setTargetSink(new TargetSink() {
                @Override
                public void expandTargets(List<Expression> liveExpressions) {
                    assertEquals(0, settled[0]);
                    if (!nested[0]) {
                        nested[0] = true;
                        solver.solve();
                    }
                }

                @Override
                public void solveSettled() {
                    settled[0]++;
                }
            });

            solver.solve();

            assertEquals(1, settled[0]);
        }

        @Test
        @DisplayName("Should stop after the configured number of passes")
        void boundsPasses() {
            Unknown u = unknownOf(layer.segment("A B"));
            Unknown v = unknownOf(layer.segment("C D"));
            constraints.assertZero(Polynomial.of(u).subtract(Polynomial.of(v)));
            when(algebraSolver.solve(anyList()))
                    .thenReturn(SolverOutcome.solved(List.of(Map.of(u, Polynomial.of(v)))));
            solver.setTargetSink(expressions -> solver.solve());

            assertThrows(IllegalStateException.class, () -> solver.solve());
            verify(algebraSolver, times(10)).solve(anyList());
        }

        @Test
        @DisplayName("Should reject a non-positive pass bound")
        void validatesPassBound() {
            MeasureLayer measures = layer.measures();
            assertThrows(IllegalArgumentException.class,
                    () -> new EquationSolver(algebraSolver, constraints, measures, metricsService, "s", 0));
        }
    }
}
