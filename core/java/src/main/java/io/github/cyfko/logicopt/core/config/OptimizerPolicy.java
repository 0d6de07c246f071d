package io.github.cyfko.logicopt.core.config;

import java.time.Duration;

/**
 * Resource limits applied while parsing, optimizing and converting expressions.
 *
 * <h2>Configurable Limits</h2>
 * <ul>
 *   <li><strong>maxExpressionLength</strong>: maximum character length of the expression (default: 10000)</li>
 *   <li><strong>maxParenthesesDepth</strong>: maximum parenthesis nesting depth (default: 50)</li>
 *   <li><strong>maxVariables</strong>: maximum number of distinct variables (default: 100)</li>
 *   <li><strong>maxIterations</strong>: maximum fixed-point iterations of the rewrite engine (default: 50)</li>
 *   <li><strong>maxProcessingTime</strong>: maximum wall-clock time of one optimize call (default: 30 s)</li>
 *   <li><strong>maxDistributionCalls</strong>: maximum calls of one CNF/DNF distribution (default: 10000)</li>
 *   <li><strong>maxDistributionDepth</strong>: maximum nested re-distribution depth (default: 15)</li>
 * </ul>
 *
 * <h2>Preset Configurations</h2>
 * <pre>{@code
 * // Default (balanced for most use cases)
 * OptimizerPolicy policy = OptimizerPolicy.defaults();
 *
 * // Strict (for services exposed to untrusted input)
 * OptimizerPolicy policy = OptimizerPolicy.strict();
 *
 * // Relaxed (for internal trusted batch jobs)
 * OptimizerPolicy policy = OptimizerPolicy.relaxed();
 *
 * // Custom
 * OptimizerPolicy policy = OptimizerPolicy.builder()
 *     .maxIterations(10)
 *     .maxProcessingTime(Duration.ofSeconds(2))
 *     .build();
 * }</pre>
 *
 * @param policyName           name of the policy, reported in limit violation messages
 * @param maxExpressionLength  maximum character length of the expression
 * @param maxParenthesesDepth  maximum parenthesis nesting depth
 * @param maxVariables         maximum number of distinct variables
 * @param maxIterations        maximum number of fixed-point iterations
 * @param maxProcessingTime    maximum processing time of one optimize call
 * @param maxDistributionCalls maximum number of distribution calls per normal-form conversion
 * @param maxDistributionDepth maximum nested re-distribution depth per normal-form conversion
 * @author Frank KOSSI
 * @since 1.0.0
 */
public record OptimizerPolicy(
        String policyName,
        int maxExpressionLength,
        int maxParenthesesDepth,
        int maxVariables,
        int maxIterations,
        Duration maxProcessingTime,
        int maxDistributionCalls,
        int maxDistributionDepth
) {

    /**
     * Canonical constructor with validation.
     *
     * @throws IllegalArgumentException if any limit is invalid
     */
    public OptimizerPolicy {
        if (policyName == null || policyName.isBlank()) {
            throw new IllegalArgumentException("Policy name is required");
        }
        requirePositive("maxExpressionLength", maxExpressionLength);
        requirePositive("maxParenthesesDepth", maxParenthesesDepth);
        requirePositive("maxVariables", maxVariables);
        requirePositive("maxIterations", maxIterations);
        requirePositive("maxDistributionCalls", maxDistributionCalls);
        requirePositive("maxDistributionDepth", maxDistributionDepth);
        if (maxProcessingTime == null || maxProcessingTime.isNegative() || maxProcessingTime.isZero()) {
            throw new IllegalArgumentException("maxProcessingTime must be positive, got: " + maxProcessingTime);
        }
    }

    private static void requirePositive(String name, int value) {
        if (value <= 0) {
            throw new IllegalArgumentException(name + " must be positive, got: " + value);
        }
    }

    /**
     * Default configuration for balanced protection and usability.
     * <ul>
     *   <li>Max Expression Length: 10000 characters</li>
     *   <li>Max Parentheses Depth: 50</li>
     *   <li>Max Variables: 100</li>
     *   <li>Max Iterations: 50</li>
     *   <li>Max Processing Time: 30 seconds</li>
     *   <li>Distribution Budget: 10000 calls, depth 15</li>
     * </ul>
     *
     * @return default configuration
     */
    public static OptimizerPolicy defaults() {
        return new OptimizerPolicy(PolicyName.DEFAULT_POLICY.name(),
                10_000, 50, 100, 50, Duration.ofSeconds(30), 10_000, 15);
    }

    /**
     * Strict configuration for services exposed to untrusted input.
     * <ul>
     *   <li>Max Expression Length: 1000 characters</li>
     *   <li>Max Parentheses Depth: 20</li>
     *   <li>Max Variables: 26</li>
     *   <li>Max Iterations: 25</li>
     *   <li>Max Processing Time: 5 seconds</li>
     *   <li>Distribution Budget: 2000 calls, depth 10</li>
     * </ul>
     *
     * @return strict configuration
     */
    public static OptimizerPolicy strict() {
        return new OptimizerPolicy(PolicyName.STRICT_POLICY.name(),
                1_000, 20, 26, 25, Duration.ofSeconds(5), 2_000, 10);
    }

    /**
     * Relaxed configuration for internal trusted systems.
     * <ul>
     *   <li>Max Expression Length: 50000 characters</li>
     *   <li>Max Parentheses Depth: 100</li>
     *   <li>Max Variables: 500</li>
     *   <li>Max Iterations: 100</li>
     *   <li>Max Processing Time: 120 seconds</li>
     *   <li>Distribution Budget: 50000 calls, depth 20</li>
     * </ul>
     *
     * @return relaxed configuration
     */
    public static OptimizerPolicy relaxed() {
        return new OptimizerPolicy(PolicyName.RELAXED_POLICY.name(),
                50_000, 100, 500, 100, Duration.ofSeconds(120), 50_000, 20);
    }

    /**
     * Creates a custom configuration.
     * <p>
     * Builder parameters are initialized exactly as in {@link #defaults()}.
     * </p>
     *
     * @return the {@link Builder} instance
     */
    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private String _policyName = PolicyName.CUSTOM_POLICY.name();
        private int _maxExpressionLength = 10_000;
        private int _maxParenthesesDepth = 50;
        private int _maxVariables = 100;
        private int _maxIterations = 50;
        private Duration _maxProcessingTime = Duration.ofSeconds(30);
        private int _maxDistributionCalls = 10_000;
        private int _maxDistributionDepth = 15;

        private Builder() {}

        public OptimizerPolicy build() {
            return new OptimizerPolicy(_policyName, _maxExpressionLength, _maxParenthesesDepth, _maxVariables,
                    _maxIterations, _maxProcessingTime, _maxDistributionCalls, _maxDistributionDepth);
        }

        public Builder policyName(String policyName) { this._policyName = policyName; return this; }
        public Builder maxExpressionLength(int maxExpressionLength) { this._maxExpressionLength = maxExpressionLength; return this; }
        public Builder maxParenthesesDepth(int maxParenthesesDepth) { this._maxParenthesesDepth = maxParenthesesDepth; return this; }
        public Builder maxVariables(int maxVariables) { this._maxVariables = maxVariables; return this; }
        public Builder maxIterations(int maxIterations) { this._maxIterations = maxIterations; return this; }
        public Builder maxProcessingTime(Duration maxProcessingTime) { this._maxProcessingTime = maxProcessingTime; return this; }
        public Builder maxDistributionCalls(int maxDistributionCalls) { this._maxDistributionCalls = maxDistributionCalls; return this; }
        public Builder maxDistributionDepth(int maxDistributionDepth) { this._maxDistributionDepth = maxDistributionDepth; return this; }
    }

    public enum PolicyName {
        DEFAULT_POLICY,
        STRICT_POLICY,
        RELAXED_POLICY,
        CUSTOM_POLICY
    }
}
