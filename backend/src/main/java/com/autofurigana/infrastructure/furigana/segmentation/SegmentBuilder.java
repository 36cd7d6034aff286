package com.autofurigana.infrastructure.furigana.segmentation;

import com.autofurigana.domain.furigana.model.AlignedSegment;
import com.autofurigana.domain.furigana.model.Token;
import com.autofurigana.domain.furigana.service.ReadingTokenizer;
import com.autofurigana.infrastructure.furigana.script.ReadingNormalizer;
import com.autofurigana.infrastructure.furigana.script.ScriptClassifier;
import com.autofurigana.infrastructure.furigana.segmentation.OkuriganaSplitter.OkuriganaSplit;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * Turns a string into one {@link AlignedSegment} by tokenizing it and splitting okurigana per token.
 *
 * <ul>
 *   <li>Token without kanji → one pair {@code (surface, reading)}, kana chunks keep the arrays aligned.</li>
 *   <li>Token with kanji → non-empty prefix pair, core pair, non-empty suffix pair.</li>
 *   <li>No tokenizer → the whole input is a single unread token.</li>
 * </ul>
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class SegmentBuilder {

    private final ScriptClassifier scriptClassifier;
    private final ReadingNormalizer readingNormalizer;
    private final OkuriganaSplitter okuriganaSplitter;

    /**
     * Build without a tokenizer (degraded, one chunk for the whole input).
     */
    public AlignedSegment build(String text) {
        return build(text, null);
    }

    /**
     * @param text      input string
     * @param tokenizer built tokenizer, or {@code null} when it is not available yet
     * @return aligned chunks; empty only for empty input
     */
    public AlignedSegment build(String text, ReadingTokenizer tokenizer) {
        if (text == null || text.isEmpty()) {
            return AlignedSegment.empty();
        }

        List<Token> tokens = tokenizer != null ? tokenizer.tokenize(text) : List.of(Token.unread(text));

        List<String> bases = new ArrayList<>();
        List<String> readings = new ArrayList<>();

        for (Token token : tokens) {
            String surface = token.surface();
            if (surface == null || surface.isEmpty()) {
                continue;
            }
            String reading = readingNormalizer.normalizeReading(token.reading(), surface);

            if (!scriptClassifier.containsKanji(surface)) {
                bases.add(surface);
                readings.add(reading);
                continue;
            }

            OkuriganaSplit split = okuriganaSplitter.split(surface, reading);
            if (!split.prefix().isEmpty()) {
                bases.add(split.prefix().base());
                readings.add(split.prefix().reading());
            }
            if (!split.base().isEmpty()) {
                bases.add(split.base());
                // Atypical readings can be fully consumed by the kana walks; keep the whole reading then.
                readings.add(split.baseReading().isEmpty() ? reading : split.baseReading());
            }
            if (!split.suffix().isEmpty()) {
                bases.add(split.suffix().base());
                readings.add(split.suffix().reading());
            }
        }

        if (bases.isEmpty()) {
            log.debug("Segmentation produced no chunks for '{}', using whole-string fallback", text);
            return AlignedSegment.single(text, readingNormalizer.normalizeReading(null, text));
        }
        return new AlignedSegment(bases, readings);
    }
}
