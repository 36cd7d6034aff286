package com.autofurigana.interfaces.api.dto;

import com.autofurigana.application.furigana.FuriganaSettings;

public record SettingsResponse(boolean editingMode, boolean readingMode, String notationStyle) {

    public static SettingsResponse from(FuriganaSettings.Snapshot snapshot) {
        return new SettingsResponse(
                snapshot.editingMode(), snapshot.readingMode(), snapshot.notationStyle().value());
    }
}
