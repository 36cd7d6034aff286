package com.autofurigana.application.furigana;

import com.autofurigana.domain.furigana.model.NotationStyle;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.util.concurrent.atomic.AtomicReference;

/**
 * Runtime settings. Defaults come from configuration; updates replace the whole snapshot,
 * and every request reads the snapshot current at its start.
 */
@Slf4j
@Component
public class FuriganaSettings {

    private final AtomicReference<Snapshot> current;

    public FuriganaSettings(@Value("${furigana.editing-mode:true}") boolean editingMode,
                            @Value("${furigana.reading-mode:true}") boolean readingMode,
                            @Value("${furigana.notation-style:curly}") String notationStyle) {
        this.current = new AtomicReference<>(
                new Snapshot(editingMode, readingMode, NotationStyle.fromValue(notationStyle)));
    }

    public Snapshot get() {
        return current.get();
    }

    /**
     * Apply a partial patch; {@code null} fields keep their current value.
     *
     * @return the new snapshot
     */
    public Snapshot update(Boolean editingMode, Boolean readingMode, String notationStyle) {
        Snapshot prev;
        Snapshot next;
        do {
            prev = current.get();
            next = new Snapshot(
                    editingMode != null ? editingMode : prev.editingMode(),
                    readingMode != null ? readingMode : prev.readingMode(),
                    notationStyle != null ? NotationStyle.fromValue(notationStyle) : prev.notationStyle());
        } while (!current.compareAndSet(prev, next));

        if (!prev.equals(next)) {
            log.info("Settings changed: {} -> {}", prev, next);
        }
        return next;
    }

    /**
     * @param editingMode   annotate the editor viewport
     * @param readingMode   annotate static text
     * @param notationStyle manual override notation
     */
    public record Snapshot(boolean editingMode, boolean readingMode, NotationStyle notationStyle) {}
}
