package com.autofurigana.infrastructure.furigana.preprocessing;

import com.autofurigana.domain.furigana.model.ExclusionType;
import com.autofurigana.domain.furigana.model.ExclusionZone;
import com.autofurigana.domain.furigana.model.Interval;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * Finds Markdown code regions that must stay untouched: fenced blocks and inline backtick spans.
 */
@Component
public class CodeRegionScanner {

    public static final String FENCE_MARKER = "```";
    private static final char BACKTICK = '`';

    /**
     * Start a render pass. The returned tracker holds the "inside fence" flag and must not be reused.
     */
    public FenceTracker newPass() {
        return new FenceTracker();
    }

    /**
     * Backtick pairs on one line, matched left to right. An unpaired trailing backtick yields nothing.
     */
    public List<ExclusionZone> inlineCodeZones(TextLine line) {
        List<ExclusionZone> zones = new ArrayList<>();
        String text = line.text();
        int open = -1;
        for (int i = 0; i < text.length(); i++) {
            if (text.charAt(i) != BACKTICK) {
                continue;
            }
            if (open < 0) {
                open = i;
            } else {
                zones.add(ExclusionZone.of(
                        new Interval(line.from() + open, line.from() + i + 1), ExclusionType.INLINE_CODE));
                open = -1;
            }
        }
        return zones;
    }

    /**
     * Zone covering a whole fenced line. Empty lines inside a fence produce no zone;
     * nothing on them can be annotated anyway.
     */
    public List<ExclusionZone> fencedLineZone(TextLine line) {
        if (line.text().isEmpty()) {
            return List.of();
        }
        return List.of(ExclusionZone.of(new Interval(line.from(), line.to()), ExclusionType.FENCED_CODE));
    }

    /**
     * Per-pass fence state. The flag flips before the line is evaluated, so an opening fence line
     * counts as inside and a closing fence line does not.
     */
    public static final class FenceTracker {

        private boolean insideFence;

        /**
         * Feed the next line in document order.
         *
         * @return true when the line lies inside a fenced block
         */
        public boolean advance(TextLine line) {
            if (line.text().trim().startsWith(FENCE_MARKER)) {
                insideFence = !insideFence;
            }
            return insideFence;
        }

        public boolean isInsideFence() {
            return insideFence;
        }
    }
}
