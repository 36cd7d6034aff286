package com.autofurigana.infrastructure.furigana.pipeline;

import com.autofurigana.domain.furigana.model.ExclusionZone;
import com.autofurigana.domain.furigana.model.FuriganaResult;
import com.autofurigana.domain.furigana.model.NotationStyle;
import com.autofurigana.domain.furigana.model.SelectionRange;
import com.autofurigana.infrastructure.furigana.preprocessing.CodeRegionScanner;
import com.autofurigana.infrastructure.furigana.preprocessing.CodeRegionScanner.FenceTracker;
import com.autofurigana.infrastructure.furigana.preprocessing.TextLine;
import com.autofurigana.infrastructure.furigana.resolution.IntervalResolver;
import com.autofurigana.infrastructure.furigana.resolution.IntervalResolver.Resolution;
import com.autofurigana.infrastructure.tokenizer.TokenizerProvider;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * One-shot conversion of a static text:
 * <p>
 * lines → (code regions, manual overrides, Japanese runs → segments) → resolve → ordered spans
 * </p>
 * Side-effect free; the same input yields the same spans.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class FuriganaPipeline {

    private final LineCandidateCollector candidateCollector;
    private final CodeRegionScanner codeRegionScanner;
    private final IntervalResolver intervalResolver;
    private final TokenizerProvider tokenizerProvider;

    public FuriganaResult annotate(String text, NotationStyle style) {
        return annotate(text, style, List.of(), true);
    }

    /**
     * @param text            source text
     * @param style           manual override notation
     * @param selections      regions to leave untouched, may be empty
     * @param skipCodeRegions whether fenced and inline code is excluded
     */
    public FuriganaResult annotate(String text,
                                   NotationStyle style,
                                   List<SelectionRange> selections,
                                   boolean skipCodeRegions) {
        FuriganaPipelineContext ctx = new FuriganaPipelineContext();
        ctx.setText(text == null ? "" : text);
        ctx.setNotationStyle(style == null ? NotationStyle.NONE : style);
        ctx.setSelections(selections == null ? new ArrayList<>() : new ArrayList<>(selections));
        ctx.setSkipCodeRegions(skipCodeRegions);
        ctx.setTokenizer(tokenizerProvider.currentOrStart().orElse(null));

        // 1. Collect candidates and code exclusions
        collect(ctx);

        // 2. Fold selections into the exclusion set
        for (SelectionRange selection : ctx.getSelections()) {
            ctx.getExclusionZones().add(ExclusionZone.selection(selection));
        }

        // 3. Resolve
        resolve(ctx, intervalResolver);

        if (!ctx.isTokenizerReady()) {
            log.debug("Annotated {} chars without tokenizer (degraded readings)", ctx.getText().length());
        }
        return ctx.toFuriganaResult();
    }

    private void collect(FuriganaPipelineContext ctx) {
        if (ctx.getText().isEmpty()) {
            return;
        }
        FenceTracker fences = ctx.isSkipCodeRegions() ? codeRegionScanner.newPass() : null;
        for (TextLine line : TextLine.split(ctx.getText())) {
            candidateCollector.collect(line, fences, ctx);
        }
    }

    static void resolve(FuriganaPipelineContext ctx, IntervalResolver resolver) {
        Resolution resolution = resolver.resolve(
                ctx.getManualCandidates(), ctx.getAutomaticCandidates(), ctx.getExclusionZones());
        ctx.setResolvedSpans(resolution.spans());
        ctx.setDroppedByExclusion(resolution.droppedByExclusion());
        ctx.setDroppedByManual(resolution.droppedByManual());
        log.debug("Pass stats: {}", ctx.toStats());
    }
}
