package io.github.cyfko.boolql.core.config;

import java.util.Objects;

/**
 * Formatting options for {@link io.github.cyfko.boolql.core.format.SmartPrettyPrinter}.
 *
 * <pre>{@code
 * PrettyOptions options = PrettyOptions.builder()
 *     .caseStyle(CaseStyle.LOWER)
 *     .parentheses(ParenthesesMode.ALWAYS)
 *     .build();
 * }</pre>
 *
 * @param caseStyle   keyword casing
 * @param parentheses parenthesization mode
 * @since 1.0.0
 */
public record PrettyOptions(CaseStyle caseStyle, ParenthesesMode parentheses) {

    public PrettyOptions {
        Objects.requireNonNull(caseStyle, "Case style is required");
        Objects.requireNonNull(parentheses, "Parentheses mode is required");
    }

    /**
     * Upper-case keywords, minimal parentheses.
     *
     * @return default options
     */
    public static PrettyOptions defaults() {
        return new PrettyOptions(CaseStyle.UPPER, ParenthesesMode.MINIMAL);
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private CaseStyle _caseStyle = CaseStyle.UPPER;
        private ParenthesesMode _parentheses = ParenthesesMode.MINIMAL;

        private Builder() {}

        public PrettyOptions build() {
            return new PrettyOptions(_caseStyle, _parentheses);
        }

        public Builder caseStyle(CaseStyle caseStyle) { this._caseStyle = caseStyle; return this; }
        public Builder parentheses(ParenthesesMode parentheses) { this._parentheses = parentheses; return this; }
    }
}
