package com.autofurigana.infrastructure.furigana.preprocessing;

import com.autofurigana.domain.furigana.model.AlignedSegment;
import com.autofurigana.domain.furigana.model.Candidate;
import com.autofurigana.domain.furigana.model.Interval;
import com.autofurigana.domain.furigana.model.NotationStyle;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Parses inline manual overrides such as {@code {漢字|かん|じ}} or {@code [今日|きょう]}.
 *
 * Alignment:
 * - one reading → the whole base is a single chunk
 * - several readings → one chunk per base character, readings assigned by index;
 *   surplus characters reuse the last reading, surplus readings are ignored
 */
@Component
public class ManualOverrideParser {

    private static final Pattern PIPE = Pattern.compile("\\|");

    /**
     * Parse every override in {@code text}. A fresh matcher is used per call.
     *
     * @param text   text to scan
     * @param style  notation; {@link NotationStyle#NONE} never matches
     * @param offset added to every match position (line start when scanning line by line)
     * @return overrides in textual order, never overlapping each other
     */
    public List<ManualOverride> parse(String text, NotationStyle style, int offset) {
        if (text == null || text.isEmpty() || style == null) {
            return List.of();
        }
        Pattern pattern = style.pattern().orElse(null);
        if (pattern == null) {
            return List.of();
        }

        List<ManualOverride> overrides = new ArrayList<>();
        Matcher matcher = pattern.matcher(text);
        while (matcher.find()) {
            String base = matcher.group(NotationStyle.GROUP_BASE);
            List<String> readings = splitReadings(matcher.group(NotationStyle.GROUP_READINGS));
            overrides.add(new ManualOverride(
                    new Interval(matcher.start() + offset, matcher.end() + offset),
                    base,
                    readings,
                    align(base, readings)));
        }
        return overrides;
    }

    public List<ManualOverride> parse(String text, NotationStyle style) {
        return parse(text, style, 0);
    }

    /**
     * Distribute readings over the base.
     */
    public AlignedSegment align(String base, List<String> readings) {
        if (readings.size() <= 1) {
            return AlignedSegment.single(base, readings.isEmpty() ? "" : readings.get(0));
        }

        List<String> chars = base.codePoints()
                .mapToObj(Character::toString)
                .toList();
        String last = readings.get(readings.size() - 1);

        List<String> aligned = new ArrayList<>(chars.size());
        for (int i = 0; i < chars.size(); i++) {
            aligned.add(i < readings.size() ? readings.get(i) : last);
        }
        return new AlignedSegment(chars, aligned);
    }

    // "|かん|じ" → [かん, じ]
    private List<String> splitReadings(String tail) {
        String[] parts = PIPE.split(tail, -1);
        return List.copyOf(Arrays.asList(parts).subList(1, parts.length));
    }

    /**
     * One parsed override.
     *
     * @param interval range of the whole markup, brackets included
     * @param base     text between the opening bracket and the first pipe
     * @param readings pipe-separated readings in order
     * @param segment  aligned chunks derived from base and readings
     */
    public record ManualOverride(Interval interval, String base, List<String> readings, AlignedSegment segment) {

        public Candidate toCandidate() {
            return Candidate.manual(interval, segment);
        }
    }
}
