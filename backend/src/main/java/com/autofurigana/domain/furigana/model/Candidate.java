package com.autofurigana.domain.furigana.model;

/**
 * A replacement proposal before arbitration.
 *
 * @param interval source range the candidate would replace
 * @param segment  aligned chunks to render in place of the range
 * @param origin   whether the candidate came from manual markup or automatic detection
 */
public record Candidate(Interval interval, AlignedSegment segment, CandidateOrigin origin) {

    public static Candidate manual(Interval interval, AlignedSegment segment) {
        return new Candidate(interval, segment, CandidateOrigin.MANUAL);
    }

    public static Candidate automatic(Interval interval, AlignedSegment segment) {
        return new Candidate(interval, segment, CandidateOrigin.AUTOMATIC);
    }

    public boolean isManual() {
        return origin == CandidateOrigin.MANUAL;
    }

    public ResolvedSpan toResolvedSpan() {
        return new ResolvedSpan(interval, segment, origin);
    }
}
