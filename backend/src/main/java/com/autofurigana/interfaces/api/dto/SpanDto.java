package com.autofurigana.interfaces.api.dto;

import com.autofurigana.domain.furigana.model.ResolvedSpan;

import java.util.List;

public record SpanDto(
        int from,
        int to,
        String origin,
        List<String> base,
        List<String> readings
) {
    public static SpanDto from(ResolvedSpan span) {
        return new SpanDto(
                span.from(),
                span.to(),
                span.origin().name(),
                span.segment().baseChunks(),
                span.segment().readingChunks());
    }
}
