package com.geometry.deduction.construction;

import com.geometry.deduction.core.model.Point;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Merges two orderings of collinear points into one.
 */
final class CollinearMerge {

    private CollinearMerge() {
    }

    /**
     * Merges {@code second} into {@code first}, reversing {@code second} when their
     * common points run the other way.
     *
     * @throws CollinearSequenceException if fewer than two points are shared, if the
     *         shared points are in incompatible orders, or if the merge is ambiguous
     */
    static List<Point> merge(List<Point> first, List<Point> second) {
        List<Point> commonInFirst = first.stream().filter(second::contains).collect(Collectors.toList());
        List<Point> commonInSecond = second.stream().filter(first::contains).collect(Collectors.toList());
        if (commonInFirst.size() < 2) {
            throw new CollinearSequenceException("Sequences have fewer than two points in common.",
                    labels(first), labels(second));
        }
        if (commonInFirst.equals(commonInSecond)) {
            return orderPreservingMerge(first, second);
        }
        List<Point> reversed = new ArrayList<>(second);
        Collections.reverse(reversed);
        Collections.reverse(commonInSecond);
        if (commonInFirst.equals(commonInSecond)) {
            return orderPreservingMerge(first, reversed);
        }
        throw new CollinearSequenceException("Sequences cannot be aligned consistently.",
                labels(first), labels(second));
    }

    // walks both sequences, always consuming the side whose head is not yet due
    private static List<Point> orderPreservingMerge(List<Point> a, List<Point> b) {
        List<Point> merged = new ArrayList<>(a.size() + b.size());
        int i = 0;
        int j = 0;
        while (i < a.size() && j < b.size()) {
            Point x = a.get(i);
            Point y = b.get(j);
            if (x == y) {
                merged.add(x);
                i++;
                j++;
            } else if (b.subList(j, b.size()).contains(x)) {
                merged.add(y);
                j++;
            } else if (a.subList(i, a.size()).contains(y)) {
                merged.add(x);
                i++;
            } else {
                throw new CollinearSequenceException("Order of sequences ambiguous.", labels(a), labels(b));
            }
        }
        merged.addAll(a.subList(i, a.size()));
        merged.addAll(b.subList(j, b.size()));
        return merged;
    }

    private static List<String> labels(List<Point> points) {
        return points.stream().map(Point::getKey).collect(Collectors.toList());
    }
}
