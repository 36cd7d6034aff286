package com.autofurigana.infrastructure.furigana.preprocessing;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * One line of a document, without its terminator.
 *
 * @param number 1-based line number
 * @param from   offset of the first character in the document
 * @param text   line content
 */
public record TextLine(int number, int from, String text) {

    public int to() {
        return from + text.length();
    }

    /**
     * Split on {@code \n}; a preceding {@code \r} stays part of the line text so offsets remain exact.
     */
    public static List<TextLine> split(String document) {
        if (document == null) {
            return List.of();
        }
        List<TextLine> lines = new ArrayList<>();
        int start = 0;
        int number = 1;
        for (int i = 0; i < document.length(); i++) {
            if (document.charAt(i) == '\n') {
                lines.add(new TextLine(number++, start, document.substring(start, i)));
                start = i + 1;
            }
        }
        lines.add(new TextLine(number, start, document.substring(start)));
        return Collections.unmodifiableList(lines);
    }

    /**
     * Index of the line containing {@code offset}; offsets past the end map to the last line.
     */
    public static int indexAt(List<TextLine> lines, int offset) {
        int lo = 0;
        int hi = lines.size() - 1;
        while (lo < hi) {
            int mid = (lo + hi + 1) >>> 1;
            if (lines.get(mid).from() <= offset) {
                lo = mid;
            } else {
                hi = mid - 1;
            }
        }
        return lo;
    }
}
