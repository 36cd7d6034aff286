package com.autofurigana.domain.furigana.model;

import java.util.Locale;
import java.util.Optional;
import java.util.regex.Pattern;

/**
 * Bracket notation for inline manual overrides.
 *
 * <p>Grammar per match: {@code OPEN base ('|' reading)+ CLOSE}, where {@code base} and each
 * {@code reading} exclude both bracket characters, the pipe and line breaks.</p>
 *
 * <p>Capture groups (stable contract for any scanner replacing the regex):</p>
 * <ol>
 *   <li>{@link #GROUP_BASE}: the base text</li>
 *   <li>{@link #GROUP_READINGS}: the whole reading tail including its leading pipe, e.g. {@code |かん|じ}</li>
 * </ol>
 */
public enum NotationStyle {
    CURLY("curly", Pattern.compile("\\{([^{}|\\r\\n]+)((?:\\|[^{}|\\r\\n]+)+)}")),
    SQUARE("square", Pattern.compile("\\[([^\\[\\]|\\r\\n]+)((?:\\|[^\\[\\]|\\r\\n]+)+)]")),
    NONE("none", null);

    public static final int GROUP_BASE = 1;
    public static final int GROUP_READINGS = 2;

    private final String value;
    private final Pattern pattern;

    NotationStyle(String value, Pattern pattern) {
        this.value = value;
        this.pattern = pattern;
    }

    public String value() {
        return value;
    }

    /**
     * Compiled grammar, empty for {@link #NONE}. Callers must create their own {@code Matcher}.
     */
    public Optional<Pattern> pattern() {
        return Optional.ofNullable(pattern);
    }

    /**
     * Lenient lookup: unknown or missing values disable manual parsing instead of failing.
     */
    public static NotationStyle fromValue(String raw) {
        if (raw == null) {
            return NONE;
        }
        String key = raw.trim().toLowerCase(Locale.ROOT);
        for (NotationStyle style : values()) {
            if (style.value.equals(key) || style.name().equalsIgnoreCase(key)) {
                return style;
            }
        }
        return NONE;
    }
}
