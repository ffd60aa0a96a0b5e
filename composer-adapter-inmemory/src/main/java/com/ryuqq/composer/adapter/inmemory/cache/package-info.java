/**
 * In-memory CacheLayer adapter.
 *
 * <p><strong>Main Components:</strong></p>
 * <ul>
 *   <li>{@link com.ryuqq.composer.adapter.inmemory.cache.InMemoryCacheLayer}:
 *       Per-key locked memoization cache with lazy TTL and optional LRU bound</li>
 *   <li>{@link com.ryuqq.composer.adapter.inmemory.cache.InMemoryCacheConfig}:
 *       Cache sizing</li>
 * </ul>
 *
 * @see com.ryuqq.composer.core.spi.CacheLayer
 * @author Composer Team
 * @since 1.0.0
 */
package com.ryuqq.composer.adapter.inmemory.cache;
