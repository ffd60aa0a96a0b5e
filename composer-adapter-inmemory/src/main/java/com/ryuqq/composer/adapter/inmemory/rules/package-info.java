/**
 * File-backed RuleSource adapter (JSON rule files read with Jackson).
 *
 * @see com.ryuqq.composer.core.spi.RuleSource
 * @author Composer Team
 * @since 1.0.0
 */
package com.ryuqq.composer.adapter.inmemory.rules;
