package com.autofurigana.domain.furigana.model;

/**
 * Member of the final, ordered, non-overlapping output sequence.
 *
 * @param interval source range to replace
 * @param segment  aligned chunks; each pair is an atomic co-replacement
 * @param origin   which rule produced the span
 */
public record ResolvedSpan(Interval interval, AlignedSegment segment, CandidateOrigin origin) {

    public int from() {
        return interval.from();
    }

    public int to() {
        return interval.to();
    }
}
