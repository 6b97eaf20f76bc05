package com.geometry.deduction.algebra;

import java.util.Collections;
import java.util.Iterator;
import java.util.Map;
import java.util.NavigableMap;
import java.util.SortedSet;
import java.util.TreeMap;
import java.util.TreeSet;

/**
 * Product of unknowns raised to positive integer powers. Immutable.
 *
 * Monomials are ordered graded-lexicographically: higher total degree first, then
 * by the exponent of the earliest unknown. The constant monomial sorts last.
 */
public final class Monomial implements Comparable<Monomial> {

    public static final Monomial ONE = new Monomial(new TreeMap<>());

    private final NavigableMap<Unknown, Integer> exponents;
    private final int totalDegree;

    private Monomial(NavigableMap<Unknown, Integer> exponents) {
        this.exponents = Collections.unmodifiableNavigableMap(exponents);
        this.totalDegree = exponents.values().stream().mapToInt(Integer::intValue).sum();
    }

    public static Monomial of(Unknown unknown) {
        return of(unknown, 1);
    }

    public static Monomial of(Unknown unknown, int exponent) {
        if (exponent < 0) {
            throw new IllegalArgumentException("Negative exponent: " + exponent);
        }
        TreeMap<Unknown, Integer> map = new TreeMap<>();
        if (exponent > 0) {
            map.put(unknown, exponent);
        }
        return new Monomial(map);
    }

    public Monomial multiply(Monomial other) {
        TreeMap<Unknown, Integer> map = new TreeMap<>(exponents);
        other.exponents.forEach((u, e) -> map.merge(u, e, Integer::sum));
        return new Monomial(map);
    }

    /** Removes the given unknown entirely. */
    public Monomial without(Unknown unknown) {
        if (!exponents.containsKey(unknown)) {
            return this;
        }
        TreeMap<Unknown, Integer> map = new TreeMap<>(exponents);
        map.remove(unknown);
        return new Monomial(map);
    }

    public int degree(Unknown unknown) {
        return exponents.getOrDefault(unknown, 0);
    }

    public int totalDegree() {
        return totalDegree;
    }

    public boolean isConstant() {
        return exponents.isEmpty();
    }

    public SortedSet<Unknown> unknowns() {
        return Collections.unmodifiableSortedSet(new TreeSet<>(exponents.keySet()));
    }

    public Map<Unknown, Integer> exponents() {
        return exponents;
    }

    @Override
    public int compareTo(Monomial other) {
        if (totalDegree != other.totalDegree) {
            return Integer.compare(other.totalDegree, totalDegree);
        }
        Iterator<Map.Entry<Unknown, Integer>> a = exponents.entrySet().iterator();
        Iterator<Map.Entry<Unknown, Integer>> b = other.exponents.entrySet().iterator();
        while (a.hasNext() && b.hasNext()) {
            Map.Entry<Unknown, Integer> ea = a.next();
            Map.Entry<Unknown, Integer> eb = b.next();
            int byUnknown = ea.getKey().compareTo(eb.getKey());
            if (byUnknown != 0) {
                // the monomial that mentions the earlier unknown comes first
                return byUnknown;
            }
            int byExponent = Integer.compare(eb.getValue(), ea.getValue());
            if (byExponent != 0) {
                return byExponent;
            }
        }
        if (a.hasNext()) return -1;
        if (b.hasNext()) return 1;
        return 0;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Monomial)) return false;
        return exponents.equals(((Monomial) o).exponents);
    }

    @Override
    public int hashCode() {
        return exponents.hashCode();
    }

    @Override
    public String toString() {
        if (exponents.isEmpty()) {
            return "1";
        }
        StringBuilder sb = new StringBuilder();
        exponents.forEach((u, e) -> {
            if (sb.length() > 0) sb.append('*');
            sb.append(u.name());
            if (e > 1) sb.append('^').append(e);
        });
        return sb.toString();
    }
}
