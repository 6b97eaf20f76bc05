package com.geometry.deduction.solver;

import com.geometry.deduction.algebra.Polynomial;
import com.geometry.deduction.algebra.Rational;
import com.geometry.deduction.algebra.Unknown;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("EliminationSolver Tests")
class EliminationSolverTest {

    private final EliminationSolver solver = new EliminationSolver();
    private final Unknown a = new Unknown("a", 1);
    private final Unknown b = new Unknown("b", 2);
    private final Unknown c = new Unknown("c", 3);
    private final Polynomial pa = Polynomial.of(a);
    private final Polynomial pb = Polynomial.of(b);
    private final Polynomial pc = Polynomial.of(c);

    @Test
    @DisplayName("Should solve a linear system in one branch")
    void linearSystem() {
        // a + b = 5, b + c = 15, c = 12
        SolverOutcome outcome = solver.solve(List.of(pa.add(pb).subtract(5), pb.add(pc).subtract(15), pc.subtract(12)));

        assertTrue(outcome.isSolved());
        assertEquals(1, outcome.branches().size());
        Map<Unknown, Polynomial> branch = outcome.branches().get(0);
        assertEquals(Polynomial.constant(2), branch.get(a));
        assertEquals(Polynomial.constant(3), branch.get(b));
        assertEquals(Polynomial.constant(12), branch.get(c));
    }

    @Test
    @DisplayName("Should branch on the roots of a quadratic")
    void quadraticBranches() {
        // a^2 = 25, b = 2a
        SolverOutcome outcome = solver.solve(List.of(pa.pow(2).subtract(25), pb.subtract(pa.scale(2))));

        assertTrue(outcome.isSolved());
        assertEquals(2, outcome.branches().size());
        Set<Polynomial> bValues = new HashSet<>();
        outcome.branches().forEach(branch -> bValues.add(branch.get(b)));
        assertEquals(Set.of(Polynomial.constant(10), Polynomial.constant(-10)), bValues);
    }

    @Test
    @DisplayName("Should report no solution for contradictory equations")
    void contradiction() {
        SolverOutcome outcome = solver.solve(List.of(pa.subtract(1), pa.subtract(2)));
        assertEquals(SolverOutcome.Status.NO_SOLUTION, outcome.status());
        assertTrue(outcome.branches().isEmpty());
    }

    @Test
    @DisplayName("Should report no solution when a quadratic has no real root")
    void noRealRoot() {
        SolverOutcome outcome = solver.solve(List.of(pa.pow(2).add(1)));
        assertEquals(SolverOutcome.Status.NO_SOLUTION, outcome.status());
    }

    @Test
    @DisplayName("Should report cannot-solve when nothing can be eliminated")
    void cannotSolve() {
        // a*b = 6 alone determines nothing
        SolverOutcome outcome = solver.solve(List.of(pa.multiply(pb).subtract(6)));
        assertEquals(SolverOutcome.Status.CANNOT_SOLVE, outcome.status());
    }

    @Test
    @DisplayName("Should keep partial assignments expressed through other unknowns")
    void partialAssignment() {
        SolverOutcome outcome = solver.solve(List.of(pa.add(pb).subtract(10)));

        assertTrue(outcome.isSolved());
        Map<Unknown, Polynomial> branch = outcome.branches().get(0);
        assertEquals(1, branch.size());
        assertFalse(branch.values().iterator().next().isConstant());
    }

    @Test
    @DisplayName("Should give up when the branch limit is exceeded")
    void branchLimit() {
        EliminationSolver narrow = new EliminationSolver(1, 1_000L);
        SolverOutcome outcome = narrow.solve(List.of(pa.pow(2).subtract(4)));
        assertEquals(SolverOutcome.Status.CANNOT_SOLVE, outcome.status());
    }

    @Test
    @DisplayName("Should leave irrational roots unsolved")
    void irrationalRoot() {
        SolverOutcome outcome = solver.solve(List.of(pa.pow(2).subtract(2)));
        assertEquals(SolverOutcome.Status.CANNOT_SOLVE, outcome.status());
    }

    @Test
    @DisplayName("Should solve the 3-4-5 area system")
    void rightTriangleArea() {
        // area = 6, 16 area^2 = (49 - c^2)(c^2 - 1), area = c * h / 2
        Polynomial area = pa;
        Polynomial hyp = pb;
        Polynomial height = pc;
        Polynomial heron = area.pow(2).scale(16)
                .subtract(Polynomial.constant(49).subtract(hyp.pow(2)).multiply(hyp.pow(2).subtract(1)));
        SolverOutcome outcome = solver.solve(List.of(heron, area.subtract(6),
                area.subtract(hyp.multiply(height).divide(Rational.of(2)))));

        assertTrue(outcome.isSolved());
        Set<Polynomial> heights = new HashSet<>();
        outcome.branches().forEach(branch -> heights.add(branch.get(c)));
        assertTrue(heights.contains(Polynomial.constant(Rational.of(12, 5))));
    }

    @Test
    @DisplayName("Should validate its limits")
    void validatesLimits() {
        assertThrows(IllegalArgumentException.class, () -> new EliminationSolver(0, 10));
        assertThrows(IllegalArgumentException.class, () -> new EliminationSolver(10, 0));
    }
}
