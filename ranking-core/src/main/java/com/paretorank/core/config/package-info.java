/**
 * YAML configuration of the ranker.
 *
 * <p>
 * {@link com.paretorank.core.config.RankerConfigLoader} reads a
 * {@link com.paretorank.core.config.RankerConfig} and validates it, failing
 * fast on unknown strategies or out-of-range values.
 * </p>
 *
 * @since 1.0.0
 */
package com.paretorank.core.config;
