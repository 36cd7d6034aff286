package com.autofurigana.application.furigana;

import com.autofurigana.application.furigana.exception.TextTooLongException;
import com.autofurigana.domain.furigana.model.AlignedSegment;
import com.autofurigana.domain.furigana.model.AnnotationStats;
import com.autofurigana.domain.furigana.model.FuriganaResult;
import com.autofurigana.domain.furigana.model.NotationStyle;
import com.autofurigana.domain.furigana.model.SelectionRange;
import com.autofurigana.domain.furigana.service.ReadingTokenizer;
import com.autofurigana.infrastructure.furigana.pipeline.FuriganaPipeline;
import com.autofurigana.infrastructure.furigana.pipeline.ViewportFuriganaPipeline;
import com.autofurigana.infrastructure.furigana.pipeline.ViewportFuriganaPipeline.VisibleRange;
import com.autofurigana.infrastructure.furigana.rendering.RubyMarkupRenderer;
import com.autofurigana.infrastructure.furigana.segmentation.SegmentBuilder;
import com.autofurigana.infrastructure.tokenizer.TokenizerProvider;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.util.List;

@Slf4j
@Service
@RequiredArgsConstructor
public class FuriganaAppService {

    private final FuriganaPipeline furiganaPipeline;
    private final ViewportFuriganaPipeline viewportPipeline;
    private final SegmentBuilder segmentBuilder;
    private final RubyMarkupRenderer rubyMarkupRenderer;
    private final TokenizerProvider tokenizerProvider;
    private final FuriganaSettings settings;

    @Value("${furigana.max-text-length:100000}")
    private int maxTextLength;

    /**
     * Static (reading) mode.
     *
     * @param notationStyle    per-request override of the configured notation, nullable
     * @param waitForTokenizer block until the tokenizer is built instead of degrading
     */
    public FuriganaResult annotate(String text,
                                   String notationStyle,
                                   List<SelectionRange> selections,
                                   boolean skipCodeRegions,
                                   boolean waitForTokenizer) {
        validateLength(text);
        FuriganaSettings.Snapshot snapshot = settings.get();
        if (!snapshot.readingMode()) {
            return disabled(text);
        }
        if (waitForTokenizer) {
            tokenizerProvider.awaitReady();
        }
        return furiganaPipeline.annotate(text, resolveStyle(notationStyle, snapshot), selections, skipCodeRegions);
    }

    /**
     * Incremental (editing) mode.
     */
    public FuriganaResult viewport(String text,
                                   List<VisibleRange> visibleRanges,
                                   List<SelectionRange> selections,
                                   String notationStyle) {
        validateLength(text);
        FuriganaSettings.Snapshot snapshot = settings.get();
        if (!snapshot.editingMode()) {
            return disabled(text);
        }
        return viewportPipeline.compute(text, visibleRanges, selections, resolveStyle(notationStyle, snapshot));
    }

    public AlignedSegment segments(String text, boolean waitForTokenizer) {
        validateLength(text);
        ReadingTokenizer tokenizer = waitForTokenizer
                ? tokenizerProvider.awaitReady()
                : tokenizerProvider.currentOrStart().orElse(null);
        return segmentBuilder.build(text, tokenizer);
    }

    public String renderHtml(FuriganaResult result) {
        return rubyMarkupRenderer.render(result.text(), result.spans());
    }

    public boolean isTokenizerReady() {
        return tokenizerProvider.isReady();
    }

    public void startTokenizer() {
        tokenizerProvider.initialize();
    }

    private NotationStyle resolveStyle(String requested, FuriganaSettings.Snapshot snapshot) {
        return requested != null ? NotationStyle.fromValue(requested) : snapshot.notationStyle();
    }

    private void validateLength(String text) {
        if (text != null && text.length() > maxTextLength) {
            throw new TextTooLongException(
                    String.format("Text must not exceed %d characters (got %d).", maxTextLength, text.length()));
        }
    }

    private FuriganaResult disabled(String text) {
        log.debug("Annotation mode disabled by settings, returning text unchanged");
        return new FuriganaResult(text, List.of(), tokenizerProvider.isReady(),
                new AnnotationStats(0, 0, 0, 0, 0, 0, 0, 0));
    }
}
