/**
 * Rule-based policy evaluation over cached query results.
 *
 * <p>
 * All rules implement {@link com.overseer.core.policy.AlertRule} and are
 * instantiated via {@link com.overseer.core.policy.RuleFactory}. Built-in
 * rule types:
 * </p>
 * <ul>
 * <li>{@link com.overseer.core.policy.ThresholdRule} - numeric column above a
 * threshold</li>
 * <li>{@link com.overseer.core.policy.MatchRule} - column equal to a
 * value</li>
 * <li>{@link com.overseer.core.policy.RowCountRule} - too many rows</li>
 * </ul>
 *
 * <h3>Extending</h3>
 * <p>
 * To add a new rule type, implement {@code AlertRule} and register the type
 * string in {@code RuleFactory.create()}. To plug in a different engine
 * altogether, implement {@link com.overseer.core.policy.PolicyEvaluator}.
 * </p>
 *
 * @since 1.0.0
 */
package com.overseer.core.policy;
