package com.autofurigana.infrastructure.furigana.script;

import org.springframework.stereotype.Component;

/**
 * Converts tokenizer readings into the canonical hiragana form used for comparison and display.
 * Pure and stateless: katakana map onto hiragana by code point offset, everything else passes through.
 */
@Component
public class ReadingNormalizer {

    /** Placeholder some dictionaries emit for "no reading". */
    public static final String NO_READING = "*";

    // ァ..ヶ → ぁ..ゖ, ヽヾ → ゝゞ
    private static final int KATAKANA_START = 0x30A1;
    private static final int KATAKANA_END = 0x30F6;
    private static final int ITERATION_START = 0x30FD;
    private static final int ITERATION_END = 0x30FE;
    private static final int HIRAGANA_OFFSET = 0x60;

    /**
     * Normalize a reading, falling back to the surface when the reading is absent.
     *
     * @param raw      tokenizer reading, possibly {@code null}, empty or {@link #NO_READING}
     * @param fallback the surface form
     * @return hiragana reading, never {@code null}
     */
    public String normalizeReading(String raw, String fallback) {
        if (raw == null || raw.isEmpty() || NO_READING.equals(raw)) {
            return toHiragana(fallback == null ? "" : fallback);
        }
        return toHiragana(raw);
    }

    public String toHiragana(String text) {
        StringBuilder sb = new StringBuilder(text.length());
        text.codePoints().forEach(cp -> sb.appendCodePoint(toHiragana(cp)));
        return sb.toString();
    }

    public int toHiragana(int codePoint) {
        if ((codePoint >= KATAKANA_START && codePoint <= KATAKANA_END)
                || (codePoint >= ITERATION_START && codePoint <= ITERATION_END)) {
            return codePoint - HIRAGANA_OFFSET;
        }
        return codePoint;
    }
}
