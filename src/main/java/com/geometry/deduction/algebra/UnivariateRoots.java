package com.geometry.deduction.algebra;

import java.math.BigInteger;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Exact real roots of a polynomial in one unknown.
 *
 * Linear and quadratic factors are solved by formula; higher degrees are reduced by
 * the rational root theorem. A result is {@code complete} when every real root has
 * been found; irrational roots leave it incomplete.
 */
public final class UnivariateRoots {

    /**
     * @param roots    distinct rational roots, in discovery order
     * @param complete whether the polynomial has no other real roots
     */
    public record Result(List<Rational> roots, boolean complete) {
        public Result {
            roots = List.copyOf(roots);
        }
    }

    private UnivariateRoots() {
    }

    /**
     * Finds the roots of {@code sum(coefficients[k] * x^k)}.
     *
     * @param coefficients lowest power first; the last entry must be nonzero
     * @param searchLimit  largest absolute integer coefficient for which divisors are enumerated
     */
    public static Result solve(List<Rational> coefficients, long searchLimit) {
        List<Rational> poly = trim(new ArrayList<>(coefficients));
        if (poly.size() <= 1) {
            // nonzero constant: no roots; zero polynomial is not a valid input
            if (poly.isEmpty() || poly.get(0).isZero()) {
                throw new IllegalArgumentException("Zero polynomial has no finite root set");
            }
            return new Result(List.of(), true);
        }

        Set<Rational> roots = new LinkedHashSet<>();
        while (poly.size() > 1 && poly.get(0).isZero()) {
            roots.add(Rational.ZERO);
            poly.remove(0);
        }

        while (degree(poly) > 2) {
            Rational root = findRationalRoot(poly, searchLimit);
            if (root == null) {
                return new Result(new ArrayList<>(roots), false);
            }
            roots.add(root);
            poly = deflate(poly, root);
        }

        int degree = degree(poly);
        if (degree == 1) {
            roots.add(poly.get(0).negate().divide(poly.get(1)));
        } else if (degree == 2) {
            Rational a = poly.get(2);
            Rational b = poly.get(1);
            Rational c = poly.get(0);
            Rational discriminant = b.multiply(b).subtract(Rational.of(4).multiply(a).multiply(c));
            if (discriminant.signum() >= 0) {
                var root = discriminant.sqrt();
                if (root.isEmpty()) {
                    return new Result(new ArrayList<>(roots), false);
                }
                Rational twoA = Rational.of(2).multiply(a);
                roots.add(b.negate().add(root.get()).divide(twoA));
                roots.add(b.negate().subtract(root.get()).divide(twoA));
            }
        }
        return new Result(new ArrayList<>(roots), true);
    }

    private static Rational findRationalRoot(List<Rational> poly, long searchLimit) {
        List<BigInteger> integral = toIntegerCoefficients(poly);
        BigInteger constant = integral.get(0).abs();
        BigInteger leading = integral.get(integral.size() - 1).abs();
        BigInteger limit = BigInteger.valueOf(searchLimit);
        if (constant.compareTo(limit) > 0 || leading.compareTo(limit) > 0) {
            return null;
        }
        for (BigInteger p : divisors(constant)) {
            for (BigInteger q : divisors(leading)) {
                Rational candidate = new Rational(p, q);
                if (evaluate(poly, candidate).isZero()) return candidate;
                if (evaluate(poly, candidate.negate()).isZero()) return candidate.negate();
            }
        }
        return null;
    }

    private static List<BigInteger> toIntegerCoefficients(List<Rational> poly) {
        BigInteger lcm = BigInteger.ONE;
        for (Rational c : poly) {
            BigInteger den = c.denominator();
            lcm = lcm.divide(lcm.gcd(den)).multiply(den);
        }
        List<BigInteger> result = new ArrayList<>(poly.size());
        for (Rational c : poly) {
            result.add(c.numerator().multiply(lcm.divide(c.denominator())));
        }
        return result;
    }

    private static List<BigInteger> divisors(BigInteger value) {
        List<BigInteger> small = new ArrayList<>();
        List<BigInteger> large = new ArrayList<>();
        long v = value.longValueExact();
        for (long i = 1; i * i <= v; i++) {
            if (v % i == 0) {
                small.add(BigInteger.valueOf(i));
                if (i != v / i) {
                    large.add(0, BigInteger.valueOf(v / i));
                }
            }
        }
        small.addAll(large);
        return small;
    }

    static Rational evaluate(List<Rational> poly, Rational x) {
        Rational result = Rational.ZERO;
        for (int k = poly.size() - 1; k >= 0; k--) {
            result = result.multiply(x).add(poly.get(k));
        }
        return result;
    }

    /** Synthetic division by {@code (x - root)}; the remainder is known to be zero. */
    private static List<Rational> deflate(List<Rational> poly, Rational root) {
        int n = degree(poly);
        Rational[] quotient = new Rational[n];
        Rational carry = Rational.ZERO;
        for (int k = n; k >= 1; k--) {
            carry = carry.multiply(root).add(poly.get(k));
            quotient[k - 1] = carry;
        }
        return trim(new ArrayList<>(List.of(quotient)));
    }

    private static List<Rational> trim(List<Rational> poly) {
        while (!poly.isEmpty() && poly.get(poly.size() - 1).isZero()) {
            poly.remove(poly.size() - 1);
        }
        return poly;
    }

    private static int degree(List<Rational> poly) {
        return poly.size() - 1;
    }
}
