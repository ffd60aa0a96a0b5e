/**
 * Content module contract.
 *
 * <p>Modules are stateless singletons. Everything run-specific reaches them through
 * {@link com.ryuqq.composer.core.contract.ModuleContext} and leaves through
 * {@link com.ryuqq.composer.core.contract.ModuleOutput}.</p>
 *
 * @since 1.0.0
 * @author Composer Team
 */
package com.ryuqq.composer.core.contract;
