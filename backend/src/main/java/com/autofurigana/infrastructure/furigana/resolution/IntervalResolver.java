package com.autofurigana.infrastructure.furigana.resolution;

import com.autofurigana.domain.furigana.model.Candidate;
import com.autofurigana.domain.furigana.model.ExclusionZone;
import com.autofurigana.domain.furigana.model.Interval;
import com.autofurigana.domain.furigana.model.ResolvedSpan;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Comparator;
import java.util.List;

/**
 * Arbitrates manual and automatic candidates into the final span sequence.
 *
 * <ol>
 *   <li>Any candidate overlapping an exclusion zone is dropped, whatever its origin.</li>
 *   <li>An automatic candidate overlapping any manual candidate is dropped. Manual candidates
 *       removed in step 1 still shadow automatic ones, so nothing is annotated inside markup
 *       that is being edited.</li>
 *   <li>Survivors are sorted by {@code from}, then {@code to}.</li>
 * </ol>
 *
 * Manual candidates come from non-overlapping matches and automatic ones from non-overlapping runs,
 * so the output never overlaps. The input lists are not modified.
 *
 * Overlap lookups go through a sorted {@link OverlapIndex}, so a pass costs
 * O((A + M + E) log(M + E)) however many selections or code zones there are.
 */
@Slf4j
@Component
public class IntervalResolver {

    private static final Comparator<Candidate> CANDIDATE_ORDER =
            Comparator.comparing(Candidate::interval, Interval.ORDER);

    public Resolution resolve(List<Candidate> manual,
                              List<Candidate> automatic,
                              List<ExclusionZone> exclusions) {
        OverlapIndex excluded = OverlapIndex.ofZones(exclusions);
        OverlapIndex shadowing = OverlapIndex.ofCandidates(manual);

        List<Candidate> survivors = new ArrayList<>(manual.size() + automatic.size());
        int droppedByExclusion = 0;
        int droppedByManual = 0;

        for (Candidate candidate : manual) {
            if (excluded.overlaps(candidate.interval())) {
                droppedByExclusion++;
                continue;
            }
            survivors.add(candidate);
        }

        for (Candidate candidate : automatic) {
            if (excluded.overlaps(candidate.interval())) {
                droppedByExclusion++;
                continue;
            }
            if (shadowing.overlaps(candidate.interval())) {
                droppedByManual++;
                continue;
            }
            survivors.add(candidate);
        }

        survivors.sort(CANDIDATE_ORDER);

        List<ResolvedSpan> spans = survivors.stream()
                .map(Candidate::toResolvedSpan)
                .toList();

        log.debug("Resolved {} spans (manual={}, automatic={}, exclusions={}, droppedByExclusion={}, droppedByManual={})",
                spans.size(), manual.size(), automatic.size(), exclusions.size(), droppedByExclusion, droppedByManual);

        return new Resolution(spans, droppedByExclusion, droppedByManual);
    }

    /**
     * Static set of half-open ranges answering "does anything overlap [from, to)?".
     * Ranges are sorted by start with a running maximum of their ends: the ranges starting before
     * {@code to} form a prefix, and one of them overlaps iff the largest end in that prefix exceeds
     * {@code from}. Empty ranges (carets) are handled by the same test.
     */
    static final class OverlapIndex {

        private final int[] froms;
        private final int[] maxTos;

        private OverlapIndex(int[][] ranges) {
            Arrays.sort(ranges, Comparator.comparingInt(range -> range[0]));
            froms = new int[ranges.length];
            maxTos = new int[ranges.length];
            int maxTo = Integer.MIN_VALUE;
            for (int i = 0; i < ranges.length; i++) {
                froms[i] = ranges[i][0];
                maxTo = Math.max(maxTo, ranges[i][1]);
                maxTos[i] = maxTo;
            }
        }

        static OverlapIndex ofZones(List<ExclusionZone> zones) {
            return new OverlapIndex(zones.stream()
                    .map(zone -> new int[]{zone.from(), zone.to()})
                    .toArray(int[][]::new));
        }

        static OverlapIndex ofCandidates(List<Candidate> candidates) {
            return new OverlapIndex(candidates.stream()
                    .map(candidate -> new int[]{candidate.interval().from(), candidate.interval().to()})
                    .toArray(int[][]::new));
        }

        boolean overlaps(Interval interval) {
            int startingBefore = countFromsBelow(interval.to());
            return startingBefore > 0 && maxTos[startingBefore - 1] > interval.from();
        }

        // number of ranges with from < bound
        private int countFromsBelow(int bound) {
            int lo = 0;
            int hi = froms.length;
            while (lo < hi) {
                int mid = (lo + hi) >>> 1;
                if (froms[mid] < bound) {
                    lo = mid + 1;
                } else {
                    hi = mid;
                }
            }
            return lo;
        }
    }

    /**
     * @param spans              ordered, non-overlapping output
     * @param droppedByExclusion candidates removed by an exclusion zone
     * @param droppedByManual    automatic candidates shadowed by a manual one
     */
    public record Resolution(List<ResolvedSpan> spans, int droppedByExclusion, int droppedByManual) {}
}
