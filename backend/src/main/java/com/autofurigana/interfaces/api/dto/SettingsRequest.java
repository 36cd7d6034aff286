package com.autofurigana.interfaces.api.dto;

/**
 * Partial update; omitted fields are left unchanged. An unknown notation style maps to none.
 */
public record SettingsRequest(
        Boolean editingMode,

        Boolean readingMode,

        String notationStyle
) {}
