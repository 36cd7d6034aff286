package com.autofurigana.domain.furigana.service;

import com.autofurigana.domain.furigana.model.Token;

import java.util.List;

/**
 * Morphological tokenizer port used by the segment builder.
 */
public interface ReadingTokenizer {

    /**
     * Split text into morphemes.
     * The surfaces of the returned tokens, concatenated in order, must reproduce {@code text}.
     *
     * @param text non-null input
     * @return ordered tokens; readings may be absent
     */
    List<Token> tokenize(String text);
}
