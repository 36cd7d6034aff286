package com.autofurigana.interfaces.api.dto;

import jakarta.validation.constraints.NotNull;

public record SegmentsRequest(
        @NotNull(message = "Text is required")
        String text,

        Boolean waitForTokenizer
) {}
