package io.github.cyfko.logicopt.core.config;

/**
 * Configuration for the optimization result cache.
 *
 * <h2>Configurable Limits</h2>
 * <ul>
 *   <li><strong>cacheEnabled</strong>: Enable result caching (default: true)</li>
 *   <li><strong>cacheSize</strong>: Maximum cache entries (default: 1000)</li>
 * </ul>
 *
 * <h2>Preset Configurations</h2>
 * <pre>{@code
 * CachePolicy config = CachePolicy.defaults();
 * CachePolicy config = CachePolicy.strict();
 * CachePolicy config = CachePolicy.relaxed();
 * CachePolicy config = CachePolicy.none();
 * CachePolicy config = CachePolicy.custom(2000);
 * }</pre>
 *
 * @param cacheEnabled whether results are cached
 * @param cacheSize    maximum number of cached results
 * @author Frank KOSSI
 * @since 1.0.0
 */
public record CachePolicy(
        boolean cacheEnabled,
        int cacheSize
) {

    /**
     * Canonical constructor with validation.
     */
    public CachePolicy {
        if (cacheSize <= 0) {
            throw new IllegalArgumentException("cacheSize must be positive, got: " + cacheSize);
        }
    }

    /**
     * Default configuration: caching enabled with 1000 entries.
     *
     * @return default configuration
     */
    public static CachePolicy defaults() {
        return new CachePolicy(true, 1000);
    }

    /**
     * Strict configuration for services exposed to untrusted input: 500 entries.
     *
     * @return strict configuration
     */
    public static CachePolicy strict() {
        return new CachePolicy(true, 500);
    }

    /**
     * Relaxed configuration for trusted batch processing: 2000 entries.
     *
     * @return relaxed configuration
     */
    public static CachePolicy relaxed() {
        return new CachePolicy(true, 2000);
    }

    /**
     * Caching completely disabled.
     *
     * @return a CachePolicy with caching disabled
     */
    public static CachePolicy none() {
        return new CachePolicy(false, 1);
    }

    public static CachePolicy custom(int cacheSize) {
        return new CachePolicy(true, cacheSize);
    }
}
