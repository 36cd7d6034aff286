package com.autofurigana.domain.furigana.model;

/**
 * One morpheme as produced by the tokenizer.
 *
 * @param surface the surface form exactly as it appears in the input
 * @param reading the dictionary reading (usually katakana), or {@code null} when the tokenizer has none
 */
public record Token(String surface, String reading) {

    /**
     * Token without a reading; the surface doubles as its own reading.
     */
    public static Token unread(String surface) {
        return new Token(surface, null);
    }
}
