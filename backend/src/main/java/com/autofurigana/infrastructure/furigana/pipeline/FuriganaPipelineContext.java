package com.autofurigana.infrastructure.furigana.pipeline;

import com.autofurigana.domain.furigana.model.AnnotationStats;
import com.autofurigana.domain.furigana.model.Candidate;
import com.autofurigana.domain.furigana.model.ExclusionZone;
import com.autofurigana.domain.furigana.model.FuriganaResult;
import com.autofurigana.domain.furigana.model.NotationStyle;
import com.autofurigana.domain.furigana.model.ResolvedSpan;
import com.autofurigana.domain.furigana.model.SelectionRange;
import com.autofurigana.domain.furigana.service.ReadingTokenizer;
import lombok.Data;

import java.util.ArrayList;
import java.util.List;

/**
 * Mutable state of one pipeline pass. Created per call and discarded afterwards.
 */
@Data
public class FuriganaPipelineContext {

    // --- Input ---
    private String text;
    private NotationStyle notationStyle = NotationStyle.NONE;
    private List<SelectionRange> selections = new ArrayList<>();
    private boolean skipCodeRegions = true;

    // --- Collaborators resolved for this pass ---
    private ReadingTokenizer tokenizer;

    // --- Candidates ---
    private List<Candidate> manualCandidates = new ArrayList<>();
    private List<Candidate> automaticCandidates = new ArrayList<>();
    private List<ExclusionZone> exclusionZones = new ArrayList<>();
    private int scannedLineCount;

    // --- Resolution ---
    private List<ResolvedSpan> resolvedSpans = new ArrayList<>();
    private int droppedByExclusion;
    private int droppedByManual;

    private long startedAt = System.currentTimeMillis();

    public boolean isTokenizerReady() {
        return tokenizer != null;
    }

    public AnnotationStats toStats() {
        return new AnnotationStats(
                manualCandidates.size(),
                automaticCandidates.size(),
                exclusionZones.size(),
                droppedByExclusion,
                droppedByManual,
                resolvedSpans.size(),
                scannedLineCount,
                System.currentTimeMillis() - startedAt
        );
    }

    /**
     * Build the final result from the accumulated state.
     */
    public FuriganaResult toFuriganaResult() {
        return new FuriganaResult(text, List.copyOf(resolvedSpans), isTokenizerReady(), toStats());
    }
}
