package com.autofurigana.interfaces.api.dto;

import com.autofurigana.domain.furigana.model.SelectionRange;
import jakarta.validation.constraints.PositiveOrZero;

import java.util.List;

public record SelectionDto(
        @PositiveOrZero(message = "Selection anchor must not be negative")
        int anchor,

        @PositiveOrZero(message = "Selection head must not be negative")
        int head
) {
    public SelectionRange toDomain() {
        return new SelectionRange(anchor, head);
    }

    public static List<SelectionRange> toSelections(List<SelectionDto> selections) {
        if (selections == null) return List.of();
        return selections.stream().map(SelectionDto::toDomain).toList();
    }
}
