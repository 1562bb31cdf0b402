/**
 * Loading of task definitions and policy rules.
 *
 * <p>
 * Queries are read from {@code .sql} files by
 * {@link com.overseer.core.config.TaskLoader}. Policy rules are defined in
 * YAML and loaded by {@link com.overseer.core.config.PolicyLoader} into a
 * {@link com.overseer.core.config.PolicyConfig} instance. Validation is
 * performed automatically after parsing to ensure fail-fast behaviour.
 * </p>
 *
 * @since 1.0.0
 */
package com.overseer.core.config;
