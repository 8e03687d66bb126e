package io.github.cyfko.boolql.core.format;

import io.github.cyfko.boolql.core.model.SourceLocation;

import java.util.ArrayList;
import java.util.List;

/**
 * Renders compiler diagnostics with a source excerpt, in the style of GCC or Clang.
 * <p>
 * The rendering only depends on the error name, its message, its location and the
 * source text, so any caller holding those values can reproduce it:
 * </p>
 * <pre>
 * UnexpectedTokenException: Unexpected token 'RIGHT_PAREN(')')', expected end of expression
 *   --&gt; 2:7
 *        1 | A AND
 * &gt;&gt;&gt;    2 | B OR C)
 *          |       ^
 * </pre>
 *
 * @since 1.0.0
 */
public final class ErrorFormatter {

    /**
     * Context lines shown on each side of the offending line by default.
     */
    public static final int DEFAULT_CONTEXT_LINES = 2;

    private static final String GUTTER_PAD = " ".repeat(8);

    private ErrorFormatter() {}

    /**
     * Formats a diagnostic.
     *
     * @param errorName    label printed before the message, usually the exception's simple name
     * @param message      the raw error message
     * @param location     where the error occurred, may be {@code null}
     * @param source       the complete source text, may be {@code null}
     * @param contextLines lines of context before and after the offending line
     * @return the formatted diagnostic, or the bare message when location or source is missing
     * @throws IllegalArgumentException if {@code contextLines} is negative
     */
    public static String format(String errorName, String message, SourceLocation location, String source, int contextLines) {
        if (contextLines < 0) {
            throw new IllegalArgumentException("contextLines must be >= 0, got: " + contextLines);
        }
        if (location == null || source == null) {
            return String.valueOf(message);
        }

        // lines end at '\n' only, as in the tokenizer; a trailing '\r' is dropped
        String[] lines = source.split("\n", -1);
        for (int i = 0; i < lines.length; i++) {
            if (lines[i].endsWith("\r")) {
                lines[i] = lines[i].substring(0, lines[i].length() - 1);
            }
        }
        int lineIndex = location.line() - 1;
        if (lineIndex >= lines.length) {
            return String.valueOf(message);
        }

        String errorLine = lines[lineIndex];
        int first = Math.max(0, lineIndex - contextLines);
        int last = Math.min(lines.length, lineIndex + contextLines + 1);

        List<String> parts = new ArrayList<>();
        parts.add(errorName + ": " + message);
        parts.add("  --> " + location);

        for (int i = first; i < last; i++) {
            String marker = i == lineIndex ? ">>>" : "   ";
            parts.add(String.format("%s %4d | %s", marker, i + 1, lines[i]));

            if (i == lineIndex) {
                int carets = Math.max(1, errorLine.length() - location.column() + 1);
                parts.add(GUTTER_PAD + " | " + " ".repeat(location.column() - 1) + "^".repeat(carets));
            }
        }

        return String.join("\n", parts);
    }
}
