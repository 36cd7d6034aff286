package com.autofurigana.domain.furigana.model;

import java.util.Comparator;

/**
 * Half-open range {@code [from, to)} of UTF-16 offsets into the source text.
 *
 * @param from inclusive start
 * @param to   exclusive end, strictly greater than {@code from}
 */
public record Interval(int from, int to) {

    public static final Comparator<Interval> ORDER = Comparator
            .comparingInt(Interval::from)
            .thenComparingInt(Interval::to);

    public Interval {
        if (from < 0 || from >= to) {
            throw new IllegalArgumentException("Invalid interval [" + from + ", " + to + ")");
        }
    }

    public boolean overlaps(Interval other) {
        return overlaps(from, to, other.from, other.to);
    }

    /**
     * Half-open overlap test shared by every arbitration rule.
     */
    public static boolean overlaps(int aFrom, int aTo, int bFrom, int bTo) {
        return aFrom < bTo && bFrom < aTo;
    }
}
