/**
 * Core domain model package containing value objects and descriptors.
 *
 * <h2>Value Objects</h2>
 * <ul>
 *   <li>{@link com.ryuqq.composer.core.model.ModuleId} - Content module identifier</li>
 *   <li>{@link com.ryuqq.composer.core.model.StateKey} - Shared state key</li>
 *   <li>{@link com.ryuqq.composer.core.model.ModuleDescriptor} - Module declaration (dependencies, produced/consumed keys, policy)</li>
 *   <li>{@link com.ryuqq.composer.core.model.Rule} - Validation rule loaded per category</li>
 * </ul>
 *
 * <p>All types are immutable and validate their input on construction.</p>
 *
 * @since 1.0.0
 * @author Composer Team
 */
package com.ryuqq.composer.core.model;
