package com.autofurigana.infrastructure.furigana.preprocessing;

import com.autofurigana.domain.furigana.model.Interval;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Detects maximal runs of Japanese script: Hiragana, Katakana, CJK ideographs and ー.
 * Runs never overlap each other. Not configurable.
 */
@Component
public class JapaneseSpanDetector {

    static final Pattern JAPANESE_RUN = Pattern.compile(
            "[\\u3040-\\u309F\\u30A0-\\u30FF\\u3400-\\u4DBF\\u4E00-\\u9FFF\\uF900-\\uFAFF\\x{20000}-\\x{2FA1F}ー]+");

    /**
     * @param text   text to scan
     * @param offset added to every interval (line start when scanning line by line)
     */
    public List<Interval> detect(String text, int offset) {
        if (text == null || text.isEmpty()) {
            return List.of();
        }
        List<Interval> runs = new ArrayList<>();
        Matcher matcher = JAPANESE_RUN.matcher(text);
        while (matcher.find()) {
            runs.add(new Interval(matcher.start() + offset, matcher.end() + offset));
        }
        return runs;
    }

    public List<Interval> detect(String text) {
        return detect(text, 0);
    }
}
