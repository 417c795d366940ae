package io.github.cyfko.propql.core.config;

/**
 * Configuration of the formula parser limits.
 *
 * <h2>Configurable Limits</h2>
 * <ul>
 *   <li><strong>maxExpressionLength</strong>: Maximum character length of the input text (builder default: 5000)</li>
 *   <li><strong>maxNestingDepth</strong>: Maximum nesting of groups and negations, the implicit
 *       outer group included (builder default: 200)</li>
 * </ul>
 * <p>
 * Parsing, simplification and every other traversal recurse once per nesting level, so the depth
 * limit is what keeps untrusted input from exhausting the call stack.
 * </p>
 * <p>
 * A parser built without an explicit policy applies {@link #unbounded()}: any text produced by
 * the formatter parses back. Limits are opt-in for callers that handle untrusted input.
 * </p>
 *
 * <h2>Preset Configurations</h2>
 * <pre>{@code
 * // No limits (applied when no policy is given)
 * ParserPolicy policy = ParserPolicy.unbounded();
 *
 * // Default (balanced for most use cases)
 * ParserPolicy policy = ParserPolicy.defaults();
 *
 * // Strict (for formulas supplied by untrusted clients)
 * ParserPolicy policy = ParserPolicy.strict();
 *
 * // Relaxed (for internal trusted systems)
 * ParserPolicy policy = ParserPolicy.relaxed();
 *
 * // Custom
 * ParserPolicy policy = ParserPolicy.builder()
 *     .maxExpressionLength(20000)
 *     .maxNestingDepth(400)
 *     .build();
 * }</pre>
 *
 * @param policyName          name reported in limit violation messages
 * @param maxExpressionLength maximum character length of the input text
 * @param maxNestingDepth     maximum nesting depth of groups and negations
 * @author Frank KOSSI
 * @since 1.0.0
 */
public record ParserPolicy(
    String policyName,
    int maxExpressionLength,
    int maxNestingDepth
) {

    /**
     * Canonical constructor with validation.
     *
     * @throws IllegalArgumentException if the name is blank or a limit is not positive
     */
    public ParserPolicy {
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
     * Configuration without any limit, applied by parsers created without a policy.
     *
     * @return unbounded configuration
     */
    public static ParserPolicy unbounded() {
        return new ParserPolicy(PolicyName.UNBOUNDED_POLICY.name(), Integer.MAX_VALUE, Integer.MAX_VALUE);
    }

    /**
     * Default configuration for balanced protection and usability.
     * <ul>
     *   <li>Max Expression Length: 5000 characters</li>
     *   <li>Max Nesting Depth: 200</li>
     * </ul>
     *
     * @return default configuration
     */
    public static ParserPolicy defaults() {
        return new ParserPolicy(PolicyName.DEFAULT_POLICY.name(), 5000, 200);
    }

    /**
     * Strict configuration for formulas coming from untrusted sources.
     * <ul>
     *   <li>Max Expression Length: 1000 characters</li>
     *   <li>Max Nesting Depth: 50</li>
     * </ul>
     *
     * @return strict configuration
     */
    public static ParserPolicy strict() {
        return new ParserPolicy(PolicyName.STRICT_POLICY.name(), 1000, 50);
    }

    /**
     * Relaxed configuration for internal trusted systems.
     * <ul>
     *   <li>Max Expression Length: 10000 characters</li>
     *   <li>Max Nesting Depth: 1000</li>
     * </ul>
     *
     * @return relaxed configuration
     */
    public static ParserPolicy relaxed() {
        return new ParserPolicy(PolicyName.RELAXED_POLICY.name(), 10000, 1000);
    }

    /**
     * Creates a custom configuration with full control over all parameters.
     * <p>
     * Builder parameters are initialized exactly as if created with {@link #defaults()},
     * except for the policy name.
     * </p>
     *
     * @return the {@link Builder} instance
     */
    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private String _policyName = PolicyName.CUSTOM_POLICY.name();
        private int _maxExpressionLength = 5000;
        private int _maxNestingDepth = 200;

        private Builder() {}

        public ParserPolicy build() {
            return new ParserPolicy(_policyName, _maxExpressionLength, _maxNestingDepth);
        }

        public Builder policyName(String policyName) { this._policyName = policyName; return this; }
        public Builder maxExpressionLength(int maxExpressionLength) { this._maxExpressionLength = maxExpressionLength; return this; }
        public Builder maxNestingDepth(int maxNestingDepth) { this._maxNestingDepth = maxNestingDepth; return this; }
    }

    public enum PolicyName {
        UNBOUNDED_POLICY,
        DEFAULT_POLICY,
        STRICT_POLICY,
        RELAXED_POLICY,
        CUSTOM_POLICY
    }
}
