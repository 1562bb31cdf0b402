/**
 * Command-line batch job for Overseer.
 *
 * <p>
 * This package wires the core engine to concrete capabilities: a JDBC query
 * executor, a file-system job cache and a Kafka (or log) alert notifier.
 * </p>
 *
 * <h3>Key Classes</h3>
 * <ul>
 * <li>{@link com.overseer.job.OverseerJob}: main entry point</li>
 * <li>{@link com.overseer.job.JobConfig}: environment-driven
 * configuration</li>
 * <li>{@link com.overseer.job.JdbcQueryExecutor}: pooled JDBC query
 * execution</li>
 * <li>{@link com.overseer.job.KafkaAlertNotifier}: alert publishing</li>
 * </ul>
 *
 * @since 1.0.0
 */
package com.overseer.job;
