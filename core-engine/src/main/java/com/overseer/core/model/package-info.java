/**
 * Domain model classes for Overseer.
 *
 * <p>
 * This package contains the values shared by the Run and Eval phases:
 * </p>
 * <ul>
 * <li>{@link com.overseer.core.model.Task} and
 * {@link com.overseer.core.model.Target} - configured queries and the filter
 * that selects them</li>
 * <li>{@link com.overseer.core.model.QueryResult} and
 * {@link com.overseer.core.model.CacheEntry} - raw results as cached per
 * job</li>
 * <li>{@link com.overseer.core.model.AlertBody} and
 * {@link com.overseer.core.model.Alert} - policy output before and after
 * validation by {@link com.overseer.core.model.AlertFactory}</li>
 * <li>{@link com.overseer.core.model.PolicyRule} - rule configuration
 * POJO</li>
 * </ul>
 *
 * @since 1.0.0
 */
package com.overseer.core.model;
