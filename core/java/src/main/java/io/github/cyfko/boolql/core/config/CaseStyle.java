package io.github.cyfko.boolql.core.config;

import java.util.Locale;

/**
 * Keyword casing used by {@link io.github.cyfko.boolql.core.format.SmartPrettyPrinter}.
 *
 * @since 1.0.0
 */
public enum CaseStyle {
    /** {@code AND}, {@code OR}, {@code NOT}, {@code TRUE}. */
    UPPER,
    /** {@code and}, {@code or}, {@code not}, {@code true}. */
    LOWER,
    /** {@code And}, {@code Or}, {@code Not}, {@code True}. */
    MIXED;

    /**
     * Applies this casing to a keyword.
     *
     * @param keyword the keyword in any case
     * @return the re-cased keyword
     */
    public String apply(String keyword) {
        switch (this) {
            case LOWER:
                return keyword.toLowerCase(Locale.ROOT);
            case MIXED:
                return keyword.isEmpty()
                        ? keyword
                        : keyword.substring(0, 1).toUpperCase(Locale.ROOT) + keyword.substring(1).toLowerCase(Locale.ROOT);
            case UPPER:
            default:
                return keyword.toUpperCase(Locale.ROOT);
        }
    }
}
