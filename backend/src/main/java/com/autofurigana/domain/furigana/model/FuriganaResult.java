package com.autofurigana.domain.furigana.model;

import java.util.List;

/**
 * Output of one pipeline pass.
 *
 * @param text           the source text the offsets refer to
 * @param spans          ordered, non-overlapping spans to render
 * @param tokenizerReady false when automatic readings were produced without a tokenizer (degraded)
 * @param stats          per-pass counters
 */
public record FuriganaResult(
        String text,
        List<ResolvedSpan> spans,
        boolean tokenizerReady,
        AnnotationStats stats
) {}
