package com.geometry.deduction.solver;

import com.geometry.deduction.algebra.Polynomial;
import com.geometry.deduction.algebra.Rational;
import com.geometry.deduction.algebra.UnivariateRoots;
import com.geometry.deduction.algebra.Unknown;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Default {@link AlgebraSolver}: branch-and-eliminate over exact rationals.
 *
 * <p>Each branch repeatedly</p>
 * <ol>
 *   <li>substitutes its assignment into the equations, dropping satisfied ones and
 *       discarding the branch on a nonzero constant,</li>
 *   <li>eliminates an unknown that occurs linearly with a constant coefficient, keeping
 *       every earlier assignment back-substituted,</li>
 *   <li>otherwise splits on the rational roots of a single-unknown equation.</li>
 * </ol>
 * A branch that can do neither is reported with the assignments found so far.
 */
public class EliminationSolver implements AlgebraSolver {
    private static final Logger log = LoggerFactory.getLogger(EliminationSolver.class);

    private static final int DEFAULT_MAX_BRANCHES = 64;
    private static final long DEFAULT_ROOT_SEARCH_LIMIT = 1_000_000_000_000L;

    private final int maxBranches;
    private final long rootSearchLimit;

    public EliminationSolver() {
        this(DEFAULT_MAX_BRANCHES, DEFAULT_ROOT_SEARCH_LIMIT);
    }

    public EliminationSolver(int maxBranches, long rootSearchLimit) {
        if (maxBranches <= 0) {
            throw new IllegalArgumentException("maxBranches must be positive");
        }
        if (rootSearchLimit <= 0) {
            throw new IllegalArgumentException("rootSearchLimit must be positive");
        }
        this.maxBranches = maxBranches;
        this.rootSearchLimit = rootSearchLimit;
    }

    private record Branch(Map<Unknown, Polynomial> assignment) {
    }

    @Override
    public SolverOutcome solve(List<Polynomial> equations) {
        Deque<Branch> work = new ArrayDeque<>();
        work.push(new Branch(new LinkedHashMap<>()));
        List<Map<Unknown, Polynomial>> finished = new ArrayList<>();
        int opened = 1;

        while (!work.isEmpty()) {
            Branch branch = work.pop();
            List<Polynomial> reduced = reduce(equations, branch.assignment());
            if (reduced == null) {
                continue;
            }
            if (reduced.isEmpty()) {
                finished.add(branch.assignment());
                continue;
            }

            Map<Unknown, Polynomial> eliminated = eliminateLinear(reduced, branch.assignment());
            if (eliminated != null) {
                work.push(new Branch(eliminated));
                continue;
            }

            List<Map<Unknown, Polynomial>> split = splitOnRoots(reduced, branch.assignment());
            if (split == null) {
                log.trace("solver.branch.stuck remaining={}", reduced);
                finished.add(branch.assignment());
                continue;
            }
            opened += split.size() - 1;
            if (opened > maxBranches) {
                log.debug("solver.branch.limit maxBranches={}", maxBranches);
                return SolverOutcome.cannotSolve();
            }
            split.forEach(a -> work.push(new Branch(a)));
        }

        if (finished.isEmpty()) {
            return SolverOutcome.noSolution();
        }
        if (finished.stream().allMatch(Map::isEmpty)) {
            return SolverOutcome.cannotSolve();
        }
        return SolverOutcome.solved(finished);
    }

    /** Returns the nonzero residual equations, or null if the branch is infeasible. */
    private List<Polynomial> reduce(List<Polynomial> equations, Map<Unknown, Polynomial> assignment) {
        List<Polynomial> reduced = new ArrayList<>();
        for (Polynomial equation : equations) {
            Polynomial p = equation.substitute(assignment);
            if (p.isZero()) {
                continue;
            }
            if (p.isConstant()) {
                return null;
            }
            reduced.add(p.normalized());
        }
        return reduced;
    }

    private Map<Unknown, Polynomial> eliminateLinear(List<Polynomial> equations,
                                                     Map<Unknown, Polynomial> assignment) {
        for (Polynomial equation : equations) {
            for (Unknown unknown : equation.unknowns()) {
                if (equation.degreeIn(unknown) != 1) {
                    continue;
                }
                Polynomial coefficient = equation.coefficientOf(unknown, 1);
                if (!coefficient.isConstant()) {
                    continue;
                }
                Polynomial rest = equation.coefficientOf(unknown, 0);
                Polynomial value = rest.negate().divide(coefficient.constantValue());
                return extend(assignment, unknown, value);
            }
        }
        return null;
    }

    private List<Map<Unknown, Polynomial>> splitOnRoots(List<Polynomial> equations,
                                                        Map<Unknown, Polynomial> assignment) {
        for (Polynomial equation : equations) {
            if (equation.unknowns().size() != 1) {
                continue;
            }
            Unknown unknown = equation.unknowns().first();
            UnivariateRoots.Result result = UnivariateRoots.solve(
                    equation.univariateCoefficients(unknown), rootSearchLimit);
            if (!result.complete()) {
                continue;
            }
            List<Map<Unknown, Polynomial>> branches = new ArrayList<>();
            for (Rational root : result.roots()) {
                branches.add(extend(assignment, unknown, Polynomial.constant(root)));
            }
            return branches;
        }
        return null;
    }

    private static Map<Unknown, Polynomial> extend(Map<Unknown, Polynomial> assignment,
                                                   Unknown unknown, Polynomial value) {
        Map<Unknown, Polynomial> next = new LinkedHashMap<>();
        Map<Unknown, Polynomial> single = Map.of(unknown, value);
        assignment.forEach((u, v) -> next.put(u, v.substitute(single)));
        next.put(unknown, value);
        return next;
    }
}
