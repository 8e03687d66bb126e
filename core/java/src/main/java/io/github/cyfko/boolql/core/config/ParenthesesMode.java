package io.github.cyfko.boolql.core.config;

/**
 * How {@link io.github.cyfko.boolql.core.format.SmartPrettyPrinter} places parentheses.
 *
 * @since 1.0.0
 */
public enum ParenthesesMode {
    /** Wrap every binary expression and every negated negation. */
    ALWAYS,
    /** Only where precedence or left associativity require it; output re-parses to an equal tree. */
    MINIMAL,
    /** Never; the output may read differently from the tree. */
    NEVER
}
