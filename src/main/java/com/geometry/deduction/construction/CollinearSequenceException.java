package com.geometry.deduction.construction;

import java.util.List;

/**
 * Thrown when two point sequences known to lie on one line cannot be merged into a
 * single ordering, either because the common points appear in incompatible orders or
 * because neither sequence tells where the other's next point belongs.
 */
public class CollinearSequenceException extends ConstructionException {

    private final List<String> first;
    private final List<String> second;

    public CollinearSequenceException(String message, List<String> first, List<String> second) {
        super(message + " " + first + " " + second);
        this.first = List.copyOf(first);
        this.second = List.copyOf(second);
    }

    public List<String> getFirst() {
        return first;
    }

    public List<String> getSecond() {
        return second;
    }
}
