package com.geometry.deduction.algebra;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.NavigableMap;
import java.util.Objects;
import java.util.SortedSet;
import java.util.TreeMap;
import java.util.TreeSet;

/**
 * Immutable multivariate polynomial with exact rational coefficients.
 * Used for measure values (a number or a single unknown) and for constraint residuals.
 */
public final class Polynomial {

    public static final Polynomial ZERO = new Polynomial(new TreeMap<>());
    public static final Polynomial ONE = constant(Rational.ONE);

    private final NavigableMap<Monomial, Rational> terms;

    private Polynomial(NavigableMap<Monomial, Rational> terms) {
        this.terms = Collections.unmodifiableNavigableMap(terms);
    }

    public static Polynomial constant(Rational value) {
        Objects.requireNonNull(value, "value");
        TreeMap<Monomial, Rational> map = new TreeMap<>();
        if (!value.isZero()) {
            map.put(Monomial.ONE, value);
        }
        return new Polynomial(map);
    }

    public static Polynomial constant(long value) {
        return constant(Rational.of(value));
    }

    public static Polynomial of(Unknown unknown) {
        TreeMap<Monomial, Rational> map = new TreeMap<>();
        map.put(Monomial.of(unknown), Rational.ONE);
        return new Polynomial(map);
    }

    public static Polynomial sum(List<Polynomial> polynomials) {
        Polynomial result = ZERO;
        for (Polynomial p : polynomials) {
            result = result.add(p);
        }
        return result;
    }

    // ========== Arithmetic ==========

    public Polynomial add(Polynomial other) {
        TreeMap<Monomial, Rational> map = new TreeMap<>(terms);
        other.terms.forEach((m, c) -> accumulate(map, m, c));
        return new Polynomial(map);
    }

    public Polynomial add(long value) {
        return add(constant(value));
    }

    public Polynomial subtract(Polynomial other) {
        return add(other.negate());
    }

    public Polynomial subtract(long value) {
        return add(-value);
    }

    public Polynomial negate() {
        return scale(Rational.ONE.negate());
    }

    public Polynomial scale(Rational factor) {
        if (factor.isZero()) {
            return ZERO;
        }
        TreeMap<Monomial, Rational> map = new TreeMap<>();
        terms.forEach((m, c) -> map.put(m, c.multiply(factor)));
        return new Polynomial(map);
    }

    public Polynomial scale(long factor) {
        return scale(Rational.of(factor));
    }

    public Polynomial divide(Rational divisor) {
        return scale(divisor.inverse());
    }

    public Polynomial multiply(Polynomial other) {
        TreeMap<Monomial, Rational> map = new TreeMap<>();
        terms.forEach((m1, c1) -> other.terms.forEach((m2, c2) ->
                accumulate(map, m1.multiply(m2), c1.multiply(c2))));
        return new Polynomial(map);
    }

    public Polynomial pow(int exponent) {
        if (exponent < 0) {
            throw new IllegalArgumentException("Negative exponent: " + exponent);
        }
        Polynomial result = ONE;
        for (int i = 0; i < exponent; i++) {
            result = result.multiply(this);
        }
        return result;
    }

    private static void accumulate(TreeMap<Monomial, Rational> map, Monomial m, Rational c) {
        Rational merged = map.containsKey(m) ? map.get(m).add(c) : c;
        if (merged.isZero()) {
            map.remove(m);
        } else {
            map.put(m, merged);
        }
    }

    // ========== Substitution ==========

    /**
     * Simultaneously replaces unknowns by polynomials. Unknowns absent from the map
     * are kept as they are.
     */
    public Polynomial substitute(Map<Unknown, Polynomial> replacements) {
        if (replacements.isEmpty() || Collections.disjoint(unknowns(), replacements.keySet())) {
            return this;
        }
        Polynomial result = ZERO;
        for (Map.Entry<Monomial, Rational> term : terms.entrySet()) {
            Polynomial product = constant(term.getValue());
            for (Map.Entry<Unknown, Integer> factor : term.getKey().exponents().entrySet()) {
                Polynomial base = replacements.containsKey(factor.getKey())
                        ? replacements.get(factor.getKey())
                        : of(factor.getKey());
                product = product.multiply(base.pow(factor.getValue()));
            }
            result = result.add(product);
        }
        return result;
    }

    public Polynomial substitute(Unknown unknown, Polynomial replacement) {
        return substitute(Map.of(unknown, replacement));
    }

    // ========== Inspection ==========

    public boolean isZero() {
        return terms.isEmpty();
    }

    public boolean isConstant() {
        return terms.isEmpty() || (terms.size() == 1 && terms.firstKey().isConstant());
    }

    /**
     * Returns the constant value.
     *
     * @throws IllegalStateException if the polynomial still has unknowns
     */
    public Rational constantValue() {
        if (!isConstant()) {
            throw new IllegalStateException("Polynomial has free unknowns: " + this);
        }
        return terms.isEmpty() ? Rational.ZERO : terms.firstEntry().getValue();
    }

    /** True for exactly {@code 1 * u}. */
    public boolean isUnknown() {
        if (terms.size() != 1) {
            return false;
        }
        Map.Entry<Monomial, Rational> only = terms.firstEntry();
        return only.getKey().totalDegree() == 1 && only.getValue().equals(Rational.ONE);
    }

    public Unknown asUnknown() {
        if (!isUnknown()) {
            throw new IllegalStateException("Not a single unknown: " + this);
        }
        return terms.firstKey().unknowns().first();
    }

    public SortedSet<Unknown> unknowns() {
        TreeSet<Unknown> result = new TreeSet<>();
        terms.keySet().forEach(m -> result.addAll(m.exponents().keySet()));
        return Collections.unmodifiableSortedSet(result);
    }

    public boolean contains(Unknown unknown) {
        return terms.keySet().stream().anyMatch(m -> m.degree(unknown) > 0);
    }

    public int degreeIn(Unknown unknown) {
        return terms.keySet().stream().mapToInt(m -> m.degree(unknown)).max().orElse(0);
    }

    public int totalDegree() {
        return terms.isEmpty() ? 0 : terms.firstKey().totalDegree();
    }

    /** Coefficient of {@code unknown^power}, itself a polynomial in the other unknowns. */
    public Polynomial coefficientOf(Unknown unknown, int power) {
        TreeMap<Monomial, Rational> map = new TreeMap<>();
        terms.forEach((m, c) -> {
            if (m.degree(unknown) == power) {
                accumulate(map, m.without(unknown), c);
            }
        });
        return new Polynomial(map);
    }

    /**
     * Coefficients of a polynomial in a single unknown, lowest power first.
     *
     * @throws IllegalStateException if other unknowns are present
     */
    public List<Rational> univariateCoefficients(Unknown unknown) {
        int degree = degreeIn(unknown);
        List<Rational> coefficients = new ArrayList<>(degree + 1);
        for (int k = 0; k <= degree; k++) {
            coefficients.add(coefficientOf(unknown, k).constantValue());
        }
        return coefficients;
    }

    public Rational leadingCoefficient() {
        return terms.isEmpty() ? Rational.ZERO : terms.firstEntry().getValue();
    }

    /** Scales so that the leading coefficient is one; zero stays zero. */
    public Polynomial normalized() {
        if (terms.isEmpty() || leadingCoefficient().equals(Rational.ONE)) {
            return this;
        }
        return divide(leadingCoefficient());
    }

    public Map<Monomial, Rational> terms() {
        return terms;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Polynomial)) return false;
        return terms.equals(((Polynomial) o).terms);
    }

    @Override
    public int hashCode() {
        return terms.hashCode();
    }

    @Override
    public String toString() {
        if (terms.isEmpty()) {
            return "0";
        }
        StringBuilder sb = new StringBuilder();
        for (Map.Entry<Monomial, Rational> term : terms.entrySet()) {
            Rational c = term.getValue();
            Monomial m = term.getKey();
            boolean negative = c.signum() < 0;
            Rational magnitude = c.abs();
            if (sb.length() == 0) {
                if (negative) sb.append('-');
            } else {
                sb.append(negative ? " - " : " + ");
            }
            if (m.isConstant()) {
                sb.append(magnitude);
            } else if (magnitude.equals(Rational.ONE)) {
                sb.append(m);
            } else {
                sb.append(magnitude).append('*').append(m);
            }
        }
        return sb.toString();
    }
}
