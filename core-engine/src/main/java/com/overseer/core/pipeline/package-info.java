/**
 * The two pipeline phases and the capabilities they call out to.
 *
 * <pre>
 *   Run:  TargetSelector -&gt; QueryExecutor -&gt; JobCache.put
 *   Eval: JobCache.entries -&gt; PolicyEvaluator -&gt; AlertFactory -&gt; AlertNotifier
 * </pre>
 *
 * <p>
 * The phases share nothing but the {@link com.overseer.core.cache.JobCache}
 * partition of a job, so they may run in different processes.
 * </p>
 *
 * @since 1.0.0
 */
package com.overseer.core.pipeline;
