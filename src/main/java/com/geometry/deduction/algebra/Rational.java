package com.geometry.deduction.algebra;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.util.Objects;
import java.util.Optional;

/** Immutable arbitrary-precision rational with normalized sign and gcd reduction. */
public final class Rational implements Comparable<Rational> {
    public static final Rational ZERO = new Rational(BigInteger.ZERO, BigInteger.ONE);
    public static final Rational ONE = new Rational(BigInteger.ONE, BigInteger.ONE);

    private final BigInteger n;        // numerator
    private final BigInteger d;        // denominator > 0

    /** Creates and reduces; denominator must be nonzero. */
    public Rational(BigInteger num, BigInteger den) {
        Objects.requireNonNull(num, "numerator");
        Objects.requireNonNull(den, "denominator");
        if (den.signum() == 0) throw new ArithmeticException("Zero denominator");
        if (den.signum() < 0) { num = num.negate(); den = den.negate(); }
        BigInteger g = num.gcd(den);
        if (g.signum() == 0) g = BigInteger.ONE;
        this.n = num.divide(g);
        this.d = den.divide(g);
    }

    public static Rational of(long k) { return new Rational(BigInteger.valueOf(k), BigInteger.ONE); }
    public static Rational of(long num, long den) { return new Rational(BigInteger.valueOf(num), BigInteger.valueOf(den)); }
    public static Rational of(BigInteger k) { return new Rational(k, BigInteger.ONE); }

    /** Exact conversion of a decimal value, e.g. 2.5 becomes 5/2. */
    public static Rational of(BigDecimal value) {
        Objects.requireNonNull(value, "value");
        if (value.scale() <= 0) {
            return of(value.toBigIntegerExact());
        }
        return new Rational(value.unscaledValue(), BigInteger.TEN.pow(value.scale()));
    }

    /** Parse "a/b" or "a" (whitespace ok). */
    public static Rational parse(String s) {
        String t = s.trim();
        int slash = t.indexOf('/');
        if (slash < 0) return new Rational(new BigInteger(t), BigInteger.ONE);
        BigInteger a = new BigInteger(t.substring(0, slash).trim());
        BigInteger b = new BigInteger(t.substring(slash + 1).trim());
        return new Rational(a, b);
    }

    public BigInteger numerator()   { return n; }
    public BigInteger denominator() { return d; }

    public Rational add(Rational o) {
        if (d.equals(o.d)) {
            return new Rational(n.add(o.n), d);
        }
        return new Rational(n.multiply(o.d).add(o.n.multiply(d)), d.multiply(o.d));
    }

    public Rational subtract(Rational o) {
        return add(o.negate());
    }

    public Rational multiply(Rational o) {
        // (n/d)*(x/y) with cross-cancel
        BigInteger g1 = n.gcd(o.d);
        BigInteger g2 = d.gcd(o.n);
        if (g1.signum() == 0) g1 = BigInteger.ONE;
        if (g2.signum() == 0) g2 = BigInteger.ONE;
        BigInteger a = n.divide(g1);
        BigInteger b = o.n.divide(g2);
        BigInteger c = d.divide(g2);
        BigInteger e = o.d.divide(g1);
        return new Rational(a.multiply(b), c.multiply(e));
    }

    public Rational divide(Rational o) {
        if (o.n.signum() == 0) throw new ArithmeticException("Divide by zero rational");
        return multiply(o.inverse());
    }

    public Rational inverse() {
        if (n.signum() == 0) throw new ArithmeticException("Zero has no inverse");
        return new Rational(d, n);
    }

    public Rational pow(int exponent) {
        if (exponent < 0) return inverse().pow(-exponent);
        return new Rational(n.pow(exponent), d.pow(exponent));
    }

    /** Exact square root when both numerator and denominator are perfect squares. */
    public Optional<Rational> sqrt() {
        if (n.signum() < 0) return Optional.empty();
        BigInteger rn = n.sqrt();
        BigInteger rd = d.sqrt();
        if (!rn.multiply(rn).equals(n) || !rd.multiply(rd).equals(d)) {
            return Optional.empty();
        }
        return Optional.of(new Rational(rn, rd));
    }

    public Rational negate() { return n.signum() == 0 ? ZERO : new Rational(n.negate(), d); }
    public Rational abs()    { return n.signum() < 0 ? negate() : this; }
    public int signum()      { return n.signum(); }
    public boolean isZero()  { return n.signum() == 0; }
    public boolean isPositive() { return n.signum() > 0; }
    public boolean isInteger() { return d.equals(BigInteger.ONE); }

    @Override public int compareTo(Rational o) {
        // a/b ? c/d  <=>  ad ? cb
        return n.multiply(o.d).compareTo(o.n.multiply(d));
    }

    @Override public boolean equals(Object obj) {
        if (this == obj) return true;
        if (!(obj instanceof Rational)) return false;
        Rational o = (Rational) obj;
        return n.equals(o.n) && d.equals(o.d);
    }

    @Override public int hashCode() { return n.hashCode() * 31 + d.hashCode(); }

    /** Integers print as integers, everything else as a/b. */
    @Override public String toString() {
        return d.equals(BigInteger.ONE) ? n.toString() : n + "/" + d;
    }
}
