package com.autofurigana.interfaces.api.dto;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotNull;

import java.util.List;

public record AnnotateRequest(
        @NotNull(message = "Text is required")
        String text,

        String notationStyle,

        @Valid
        List<SelectionDto> selections,

        Boolean skipCodeRegions,

        Boolean waitForTokenizer,

        Boolean includeHtml
) {}
