package com.autofurigana.infrastructure.furigana.script;

import org.springframework.stereotype.Component;

/**
 * Character-class predicates based on fixed Unicode block membership.
 * Kanji: CJK Unified Ideographs, Extension A, compatibility ideographs and the supplementary
 * ideographic planes. Kana: Hiragana and Katakana blocks (the prolonged sound mark ー included).
 */
@Component
public class ScriptClassifier {

    public static final char PROLONGED_SOUND_MARK = 'ー';

    public boolean isKanji(int codePoint) {
        return (codePoint >= 0x3400 && codePoint <= 0x4DBF)
                || (codePoint >= 0x4E00 && codePoint <= 0x9FFF)
                || (codePoint >= 0xF900 && codePoint <= 0xFAFF)
                || (codePoint >= 0x20000 && codePoint <= 0x2FA1F);
    }

    public boolean isKana(int codePoint) {
        return (codePoint >= 0x3040 && codePoint <= 0x30FF) || codePoint == PROLONGED_SOUND_MARK;
    }

    public boolean containsKanji(String text) {
        if (text == null) {
            return false;
        }
        return text.codePoints().anyMatch(this::isKanji);
    }
}
