package com.autofurigana.domain.furigana.model;

/**
 * An editor selection. {@code anchor} and {@code head} may come in either order and may be equal (caret).
 */
public record SelectionRange(int anchor, int head) {

    public static SelectionRange caret(int position) {
        return new SelectionRange(position, position);
    }

    public int from() {
        return Math.min(anchor, head);
    }

    public int to() {
        return Math.max(anchor, head);
    }

    public boolean isEmpty() {
        return anchor == head;
    }
}
