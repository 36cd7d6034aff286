package com.autofurigana.infrastructure.tokenizer;

import com.autofurigana.domain.furigana.model.Token;
import com.autofurigana.domain.furigana.service.ReadingTokenizer;
import org.apache.lucene.analysis.ja.JapaneseTokenizer;
import org.apache.lucene.analysis.ja.tokenattributes.ReadingAttribute;
import org.apache.lucene.analysis.tokenattributes.CharTermAttribute;

import java.io.IOException;
import java.io.StringReader;
import java.io.UncheckedIOException;
import java.util.ArrayList;
import java.util.List;

/**
 * {@link ReadingTokenizer} backed by Lucene Kuromoji and its bundled IPADIC dictionary.
 *
 * <p>A Lucene tokenizer instance is stateful and not thread-safe, so each call builds its own;
 * the dictionaries behind it are process-wide singletons loaded on first use.
 * Punctuation is kept so the token surfaces cover the whole input.</p>
 */
public class KuromojiReadingTokenizer implements ReadingTokenizer {

    private static final String WARMUP_TEXT = "日本語の辞書を読み込みます。";

    private final JapaneseTokenizer.Mode mode;

    public KuromojiReadingTokenizer() {
        this(JapaneseTokenizer.Mode.NORMAL);
    }

    public KuromojiReadingTokenizer(JapaneseTokenizer.Mode mode) {
        this.mode = mode;
    }

    /**
     * Build and warm up a tokenizer; this forces the dictionaries to load.
     */
    public static KuromojiReadingTokenizer create() {
        KuromojiReadingTokenizer tokenizer = new KuromojiReadingTokenizer();
        tokenizer.tokenize(WARMUP_TEXT);
        return tokenizer;
    }

    @Override
    public List<Token> tokenize(String text) {
        if (text == null || text.isEmpty()) {
            return List.of();
        }
        List<Token> tokens = new ArrayList<>();
        try (JapaneseTokenizer tokenizer = new JapaneseTokenizer(null, false, mode)) {
            CharTermAttribute term = tokenizer.addAttribute(CharTermAttribute.class);
            ReadingAttribute reading = tokenizer.addAttribute(ReadingAttribute.class);

            tokenizer.setReader(new StringReader(text));
            tokenizer.reset();
            while (tokenizer.incrementToken()) {
                tokens.add(new Token(term.toString(), reading.getReading()));
            }
            tokenizer.end();
        } catch (IOException e) {
            // StringReader never fails; Lucene still declares it.
            throw new UncheckedIOException("Tokenization failed", e);
        }
        return tokens;
    }
}
