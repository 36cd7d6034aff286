package com.autofurigana.interfaces.api.dto;

import com.autofurigana.domain.furigana.model.AnnotationStats;
import com.autofurigana.domain.furigana.model.FuriganaResult;
import com.fasterxml.jackson.annotation.JsonInclude;

import java.util.List;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record AnnotateResponse(
        List<SpanDto> spans,
        boolean tokenizerReady,
        AnnotationStats stats,
        String html
) {
    public static AnnotateResponse from(FuriganaResult result, String html) {
        return new AnnotateResponse(
                result.spans().stream().map(SpanDto::from).toList(),
                result.tokenizerReady(),
                result.stats(),
                html);
    }
}
