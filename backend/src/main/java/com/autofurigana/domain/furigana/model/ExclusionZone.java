package com.autofurigana.domain.furigana.model;

/**
 * Region that must never be replaced.
 * Unlike {@link Interval} a zone may be empty ({@code from == to}): a collapsed selection (caret)
 * still blocks any candidate that strictly contains it.
 *
 * @param from inclusive start offset
 * @param to   exclusive end offset
 * @param type what produced the zone
 */
public record ExclusionZone(int from, int to, ExclusionType type) {

    public ExclusionZone {
        if (from < 0 || to < from) {
            throw new IllegalArgumentException("Invalid exclusion zone [" + from + ", " + to + ")");
        }
    }

    public static ExclusionZone of(Interval interval, ExclusionType type) {
        return new ExclusionZone(interval.from(), interval.to(), type);
    }

    public static ExclusionZone selection(SelectionRange range) {
        return new ExclusionZone(range.from(), range.to(), ExclusionType.SELECTION);
    }

    public boolean overlaps(Interval interval) {
        return Interval.overlaps(from, to, interval.from(), interval.to());
    }
}
