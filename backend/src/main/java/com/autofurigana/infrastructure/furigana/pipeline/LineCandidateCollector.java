package com.autofurigana.infrastructure.furigana.pipeline;

import com.autofurigana.domain.furigana.model.AlignedSegment;
import com.autofurigana.domain.furigana.model.Candidate;
import com.autofurigana.domain.furigana.model.Interval;
import com.autofurigana.infrastructure.furigana.preprocessing.CodeRegionScanner;
import com.autofurigana.infrastructure.furigana.preprocessing.CodeRegionScanner.FenceTracker;
import com.autofurigana.infrastructure.furigana.preprocessing.JapaneseSpanDetector;
import com.autofurigana.infrastructure.furigana.preprocessing.ManualOverrideParser;
import com.autofurigana.infrastructure.furigana.preprocessing.ManualOverrideParser.ManualOverride;
import com.autofurigana.infrastructure.furigana.preprocessing.TextLine;
import com.autofurigana.infrastructure.furigana.segmentation.SegmentBuilder;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

/**
 * Gathers candidates and code exclusions for one line into the pass context.
 * Shared by the static and the viewport pipelines so both scan lines identically.
 */
@Component
@RequiredArgsConstructor
public class LineCandidateCollector {

    private final CodeRegionScanner codeRegionScanner;
    private final ManualOverrideParser manualOverrideParser;
    private final JapaneseSpanDetector japaneseSpanDetector;
    private final SegmentBuilder segmentBuilder;

    /**
     * @param fences fence state of the current pass, or {@code null} when code regions are not honoured
     */
    public void collect(TextLine line, FenceTracker fences, FuriganaPipelineContext ctx) {
        ctx.setScannedLineCount(ctx.getScannedLineCount() + 1);

        if (fences != null) {
            if (fences.advance(line)) {
                ctx.getExclusionZones().addAll(codeRegionScanner.fencedLineZone(line));
                return;
            }
            ctx.getExclusionZones().addAll(codeRegionScanner.inlineCodeZones(line));
        }

        for (ManualOverride override : manualOverrideParser.parse(line.text(), ctx.getNotationStyle(), line.from())) {
            ctx.getManualCandidates().add(override.toCandidate());
        }

        for (Interval run : japaneseSpanDetector.detect(line.text(), line.from())) {
            String span = ctx.getText().substring(run.from(), run.to());
            AlignedSegment segment = segmentBuilder.build(span, ctx.getTokenizer());
            if (!segment.isEmpty()) {
                ctx.getAutomaticCandidates().add(Candidate.automatic(run, segment));
            }
        }
    }
}
