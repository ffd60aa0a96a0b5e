/**
 * Service Provider Interface (SPI) package.
 *
 * <p>Adapters implement these interfaces to give the core a cache and a rule source.</p>
 *
 * <h2>SPI Interfaces</h2>
 * <ul>
 *   <li>{@link com.ryuqq.composer.core.spi.CacheLayer} - Process-wide memoization with per-key locking</li>
 *   <li>{@link com.ryuqq.composer.core.spi.RuleSource} - Raw rule loading per category</li>
 * </ul>
 *
 * <h2>CacheLayer Implementation Guidelines</h2>
 * <ul>
 *   <li><strong>Single computation:</strong> concurrent misses on one key compute once</li>
 *   <li><strong>Key isolation:</strong> a slow computation must not block other keys</li>
 *   <li><strong>No failure caching:</strong> a failed computation leaves the key absent</li>
 * </ul>
 *
 * <p>{@code composer-testkit} ships a contract test every implementation should pass.</p>
 *
 * @since 1.0.0
 * @author Composer Team
 */
package com.ryuqq.composer.core.spi;
