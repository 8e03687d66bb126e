package io.github.cyfko.boolql.core.config;

/**
 * Configuration applied when turning source text into a tree.
 *
 * <h2>Settings</h2>
 * <ul>
 *   <li><strong>maxExpressionLength</strong>: longest accepted source, in characters</li>
 *   <li><strong>maxNestingDepth</strong>: deepest accepted stack of open parentheses and {@code NOT} prefixes</li>
 *   <li><strong>enableComments</strong>: whether {@code #} starts a comment running to the end of the line</li>
 *   <li><strong>trace</strong>: whether the parser logs every grammar rule at {@code FINE}</li>
 * </ul>
 *
 * <h2>Preset Configurations</h2>
 * <pre>{@code
 * // Default (balanced for most use cases)
 * SyntaxPolicy policy = SyntaxPolicy.defaults();
 *
 * // Strict (untrusted input: short expressions, no comments)
 * SyntaxPolicy policy = SyntaxPolicy.strict();
 *
 * // Relaxed (trusted, machine-generated input, no length limit)
 * SyntaxPolicy policy = SyntaxPolicy.relaxed();
 *
 * // Custom
 * SyntaxPolicy policy = SyntaxPolicy.builder()
 *     .maxExpressionLength(20000)
 *     .trace(true)
 *     .build();
 * }</pre>
 *
 * @param policyName          name reported in error messages
 * @param maxExpressionLength maximum character length of the source
 * @param maxNestingDepth     maximum nesting of parentheses and {@code NOT} prefixes
 * @param enableComments      whether end-of-line comments are skipped
 * @param trace               whether grammar rules are logged
 * @since 1.0.0
 */
public record SyntaxPolicy(
    String policyName,
    int maxExpressionLength,
    int maxNestingDepth,
    boolean enableComments,
    boolean trace
) {

    /**
     * Canonical constructor with validation.
     *
     * @throws IllegalArgumentException if the name is blank or a limit is not positive
     */
    public SyntaxPolicy {
        if (policyName == null || policyName.isBlank()) {
            throw new IllegalArgumentException("Policy name is required");
        }
        if (maxExpressionLength <= 0) {
            throw new IllegalArgumentException("maxExpressionLength must be positive, got: " + maxExpressionLength);
        }
        if (maxNestingDepth <= 0) {
            throw new IllegalArgumentException("maxNestingDepth must be positive, got: " + maxNestingDepth);
        }
    }

    /**
     * Default configuration.
     * <ul>
     *   <li>Max Expression Length: 10000 characters</li>
     *   <li>Max Nesting Depth: 100</li>
     *   <li>Comments: ENABLED</li>
     *   <li>Trace: DISABLED</li>
     * </ul>
     *
     * @return default configuration
     */
    public static SyntaxPolicy defaults() {
        return new SyntaxPolicy(PolicyName.DEFAULT_POLICY.name(), 10000, 100, true, false);
    }

    /**
     * Strict configuration for untrusted input.
     * <ul>
     *   <li>Max Expression Length: 1000 characters</li>
     *   <li>Max Nesting Depth: 32</li>
     *   <li>Comments: DISABLED ({@code #} is rejected as an invalid character)</li>
     *   <li>Trace: DISABLED</li>
     * </ul>
     *
     * @return strict configuration
     */
    public static SyntaxPolicy strict() {
        return new SyntaxPolicy(PolicyName.STRICT_POLICY.name(), 1000, 32, false, false);
    }

    /**
     * Relaxed configuration for trusted input.
     * <ul>
     *   <li>Max Expression Length: unlimited ({@link Integer#MAX_VALUE})</li>
     *   <li>Max Nesting Depth: 1000</li>
     *   <li>Comments: ENABLED</li>
     *   <li>Trace: DISABLED</li>
     * </ul>
     *
     * @return relaxed configuration
     */
    public static SyntaxPolicy relaxed() {
        return new SyntaxPolicy(PolicyName.RELAXED_POLICY.name(), Integer.MAX_VALUE, 1000, true, false);
    }

    /**
     * Creates a custom configuration. Builder parameters start from the default preset.
     *
     * @return the {@link Builder} instance
     */
    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private String _policyName = PolicyName.CUSTOM_POLICY.name();
        private int _maxExpressionLength = 10000;
        private int _maxNestingDepth = 100;
        private boolean _enableComments = true;
        private boolean _trace = false;

        private Builder() {}

        public SyntaxPolicy build() {
            return new SyntaxPolicy(_policyName, _maxExpressionLength, _maxNestingDepth, _enableComments, _trace);
        }

        public Builder policyName(String policyName) { this._policyName = policyName; return this; }
        public Builder maxExpressionLength(int maxExpressionLength) { this._maxExpressionLength = maxExpressionLength; return this; }
        public Builder maxNestingDepth(int maxNestingDepth) { this._maxNestingDepth = maxNestingDepth; return this; }
        public Builder enableComments(boolean enableComments) { this._enableComments = enableComments; return this; }
        public Builder trace(boolean trace) { this._trace = trace; return this; }
    }

    public enum PolicyName {
        DEFAULT_POLICY,
        STRICT_POLICY,
        RELAXED_POLICY,
        CUSTOM_POLICY
    }
}
