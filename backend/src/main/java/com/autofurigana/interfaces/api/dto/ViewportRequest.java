package com.autofurigana.interfaces.api.dto;

import com.autofurigana.infrastructure.furigana.pipeline.ViewportFuriganaPipeline.VisibleRange;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.PositiveOrZero;

import java.util.List;

public record ViewportRequest(
        @NotNull(message = "Text is required")
        String text,

        @NotEmpty(message = "At least one visible range is required")
        @Valid
        List<RangeDto> visibleRanges,

        @Valid
        List<SelectionDto> selections,

        String notationStyle
) {
    public record RangeDto(
            @PositiveOrZero(message = "Range start must not be negative")
            int from,

            @PositiveOrZero(message = "Range end must not be negative")
            int to
    ) {}

    public List<VisibleRange> toVisibleRanges() {
        return visibleRanges.stream()
                .map(r -> new VisibleRange(r.from(), r.to()))
                .toList();
    }
}
