package com.autofurigana.infrastructure.furigana.pipeline;

import com.autofurigana.domain.furigana.model.ExclusionZone;
import com.autofurigana.domain.furigana.model.FuriganaResult;
import com.autofurigana.domain.furigana.model.Interval;
import com.autofurigana.domain.furigana.model.NotationStyle;
import com.autofurigana.domain.furigana.model.SelectionRange;
import com.autofurigana.infrastructure.furigana.preprocessing.CodeRegionScanner;
import com.autofurigana.infrastructure.furigana.preprocessing.CodeRegionScanner.FenceTracker;
import com.autofurigana.infrastructure.furigana.preprocessing.TextLine;
import com.autofurigana.infrastructure.furigana.resolution.IntervalResolver;
import com.autofurigana.infrastructure.tokenizer.TokenizerProvider;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Incremental (editor) mode: recomputes spans for the visible part of a document.
 *
 * <p>Called again on every document, viewport or selection change; nothing is carried over from a
 * previous call. Only lines touched by a visible range are scanned, each at most once. The fence
 * flag starts closed at the first scanned line, so a viewport that begins inside a fenced block
 * sees its body as ordinary text until the next fence line.</p>
 */
@Component
@RequiredArgsConstructor
public class ViewportFuriganaPipeline {

    private final LineCandidateCollector candidateCollector;
    private final CodeRegionScanner codeRegionScanner;
    private final IntervalResolver intervalResolver;
    private final TokenizerProvider tokenizerProvider;

    /**
     * @param text          the whole document
     * @param visibleRanges visible document ranges, in any order; empty ranges touch one line
     * @param selections    active selections and carets
     * @param style         manual override notation
     */
    public FuriganaResult compute(String text,
                                  List<VisibleRange> visibleRanges,
                                  List<SelectionRange> selections,
                                  NotationStyle style) {
        FuriganaPipelineContext ctx = new FuriganaPipelineContext();
        ctx.setText(text == null ? "" : text);
        ctx.setNotationStyle(style == null ? NotationStyle.NONE : style);
        ctx.setSelections(selections == null ? new ArrayList<>() : new ArrayList<>(selections));
        ctx.setSkipCodeRegions(true);
        ctx.setTokenizer(tokenizerProvider.currentOrStart().orElse(null));

        if (visibleRanges != null && !visibleRanges.isEmpty()) {
            scanVisibleLines(ctx, visibleRanges);
        }

        for (SelectionRange selection : ctx.getSelections()) {
            ctx.getExclusionZones().add(ExclusionZone.selection(selection));
        }

        FuriganaPipeline.resolve(ctx, intervalResolver);
        return ctx.toFuriganaResult();
    }

    private void scanVisibleLines(FuriganaPipelineContext ctx, List<VisibleRange> visibleRanges) {
        List<TextLine> lines = TextLine.split(ctx.getText());
        FenceTracker fences = codeRegionScanner.newPass();
        int documentLength = ctx.getText().length();
        int nextUnscanned = 0;

        List<VisibleRange> ordered = new ArrayList<>(visibleRanges);
        ordered.sort(Comparator.comparingInt(VisibleRange::from).thenComparingInt(VisibleRange::to));

        for (VisibleRange range : ordered) {
            int from = clamp(range.from(), documentLength);
            int to = clamp(range.to(), documentLength);
            int first = Math.max(TextLine.indexAt(lines, from), nextUnscanned);
            int last = TextLine.indexAt(lines, to);
            for (int n = first; n <= last; n++) {
                candidateCollector.collect(lines.get(n), fences, ctx);
            }
            nextUnscanned = Math.max(nextUnscanned, last + 1);
        }
    }

    private static int clamp(int offset, int length) {
        return Math.max(0, Math.min(offset, length));
    }

    /**
     * A visible document range; unlike {@link Interval} it may be empty.
     */
    public record VisibleRange(int from, int to) {

        public VisibleRange {
            if (to < from) {
                throw new IllegalArgumentException("Invalid visible range [" + from + ", " + to + ")");
            }
        }
    }
}
