package com.ryuqq.composer.adapter.inmemory.cache;

/**
 * Configuration for {@link InMemoryCacheLayer}.
 *
 * @param maximumSize maximum number of READY entries before least-recently-used eviction (0 = unbounded)
 *
 * @author Composer Team
 * @since 1.0.0
 */
public record InMemoryCacheConfig(int maximumSize) {

    /**
     * Compact constructor.
     *
     * @throws IllegalArgumentException if maximumSize is negative
     */
    public InMemoryCacheConfig {
        if (maximumSize < 0) {
            throw new IllegalArgumentException("maximumSize cannot be negative (current: " + maximumSize + ")");
        }
    }

    /**
     * Unbounded cache.
     */
    public static InMemoryCacheConfig defaults() {
        return new InMemoryCacheConfig(0);
    }

    /**
     * Copy with a different maximumSize.
     */
    public InMemoryCacheConfig withMaximumSize(int maximumSize) {
        return new InMemoryCacheConfig(maximumSize);
    }

    public boolean isBounded() {
        return maximumSize > 0;
    }
}
