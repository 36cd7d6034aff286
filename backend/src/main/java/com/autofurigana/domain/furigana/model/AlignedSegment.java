package com.autofurigana.domain.furigana.model;

import java.util.ArrayList;
import java.util.List;

/**
 * Index-aligned base chunks and reading chunks.
 * {@code baseChunks.get(i)} is annotated by {@code readingChunks.get(i)}; an empty chunk is valid.
 *
 * @param baseChunks    ordered base text chunks
 * @param readingChunks ordered readings, same length as {@code baseChunks}
 */
public record AlignedSegment(List<String> baseChunks, List<String> readingChunks) {

    private static final AlignedSegment EMPTY = new AlignedSegment(List.of(), List.of());

    public AlignedSegment {
        if (baseChunks.size() != readingChunks.size()) {
            throw new IllegalArgumentException("Misaligned segment: " + baseChunks.size()
                    + " base chunks vs " + readingChunks.size() + " reading chunks");
        }
        baseChunks = List.copyOf(baseChunks);
        readingChunks = List.copyOf(readingChunks);
    }

    public static AlignedSegment empty() {
        return EMPTY;
    }

    public static AlignedSegment single(String base, String reading) {
        return new AlignedSegment(List.of(base), List.of(reading));
    }

    public int size() {
        return baseChunks.size();
    }

    public boolean isEmpty() {
        return baseChunks.isEmpty();
    }

    /**
     * Concatenation of all base chunks; equals the annotated source text for automatic segments.
     */
    public String baseText() {
        return String.join("", baseChunks);
    }

    public List<RubyPair> pairs() {
        List<RubyPair> pairs = new ArrayList<>(baseChunks.size());
        for (int i = 0; i < baseChunks.size(); i++) {
            pairs.add(new RubyPair(baseChunks.get(i), readingChunks.get(i)));
        }
        return pairs;
    }

    /**
     * One base chunk with its reading.
     */
    public record RubyPair(String base, String reading) {}
}
