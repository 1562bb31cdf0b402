package com.overseer.job;

import com.overseer.core.cache.FileSystemJobCache;
import com.overseer.core.cache.JobCache;
import com.overseer.core.config.PolicyConfig;
import com.overseer.core.config.PolicyLoader;
import com.overseer.core.config.TaskLoader;
import com.overseer.core.error.BatchFailureException;
import com.overseer.core.error.ItemFailure;
import com.overseer.core.error.OverseerException;
import com.overseer.core.model.AlertFactory;
import com.overseer.core.model.JobContext;
import com.overseer.core.model.JobId;
import com.overseer.core.model.Target;
import com.overseer.core.model.Task;
import com.overseer.core.pipeline.AlertNotifier;
import com.overseer.core.pipeline.EvalOrchestrator;
import com.overseer.core.pipeline.EvalReport;
import com.overseer.core.pipeline.RunOrchestrator;
import com.overseer.core.pipeline.RunReport;
import com.overseer.core.policy.RulePolicyEvaluator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.ParameterException;
import picocli.CommandLine.Spec;

import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.Callable;

/**
 * Main entry point for the Overseer batch job.
 *
 * <h3>Commands</h3>
 *
 * <pre>
 *   run       load tasks, select by target, execute queries, cache results
 *   eval      evaluate every cached result of the job, dispatch alerts
 *   pipeline  run, then eval
 *   clear     delete the job's cache partition
 * </pre>
 *
 * <h3>Configuration</h3>
 * <p>
 * All configuration is resolved from environment variables via
 * {@link JobConfig}. {@code OVERSEER_JOB_ID} must be the same for the run and
 * eval invocations of one job.
 * </p>
 *
 * <h3>Exit codes</h3>
 * <p>
 * {@code 0} on success, {@code 1} when the command fails (every per-item
 * failure is logged), {@code 2} on a usage error.
 * </p>
 *
 * @since 1.0.0
 */
@Command(
        name = "overseer",
        version = "1.0.0",
        description = "Run queries now, cache the results, evaluate alert policy later",
        mixinStandardHelpOptions = true,
        footerHeading = "%nConfiguration:%n",
        footer = {
                "  Settings are read from OVERSEER_* and KAFKA_* environment variables.",
                "  OVERSEER_JOB_ID is required and must match between run and eval.",
                ""
        })
public final class OverseerJob implements Callable<Integer> {

    private static final Logger LOG = LoggerFactory.getLogger(OverseerJob.class);

    static final String MDC_JOB_ID = "job_id";

    static final int EXIT_OK = CommandLine.ExitCode.OK;
    static final int EXIT_FAILED = CommandLine.ExitCode.SOFTWARE;
    static final int EXIT_USAGE = CommandLine.ExitCode.USAGE;

    @Spec
    private CommandSpec spec;

    private final Map<String, String> env;

    OverseerJob(Map<String, String> env) {
        this.env = Objects.requireNonNull(env, "env must not be null");
    }

    public static void main(String[] args) {
        System.exit(execute(args, System.getenv()));
    }

    /**
     * Run one command against the given environment.
     *
     * @return process exit code
     */
    static int execute(String[] args, Map<String, String> env) {
        return new CommandLine(new OverseerJob(env))
                .setColorScheme(CommandLine.Help.defaultColorScheme(CommandLine.Help.Ansi.AUTO))
                .execute(args);
    }

    @Override
    public Integer call() {
        throw new ParameterException(spec.commandLine(), "Missing command: run, eval, pipeline or clear");
    }

    // ---------------------------------------------------------------
    // Commands
    // ---------------------------------------------------------------

    @Command(name = "run", description = "Execute the selected tasks and cache their results")
    int run() {
        return runCommand("run", OverseerJob::runPhase);
    }

    @Command(name = "eval", description = "Evaluate the cached results and dispatch alerts")
    int eval() {
        return runCommand("eval", OverseerJob::evalPhase);
    }

    @Command(name = "pipeline", description = "Run, then eval, in one process")
    int pipeline() {
        return runCommand("pipeline", (config, context, cache) -> {
            runPhase(config, context, cache);
            evalPhase(config, context, cache);
        });
    }

    @Command(name = "clear", description = "Delete every cached result of the job")
    int clear() {
        return runCommand("clear", (config, context, cache) -> cache.clear(context.getJobId()));
    }

    @FunctionalInterface
    private interface Phase {
        void apply(JobConfig config, JobContext context, JobCache cache);
    }

    private int runCommand(String command, Phase phase) {
        JobConfig config;
        try {
            config = JobConfig.fromEnvironment(env);
        } catch (IllegalArgumentException | IllegalStateException e) {
            LOG.error("Invalid configuration: {}", e.getMessage());
            return EXIT_FAILED;
        }

        MDC.put(MDC_JOB_ID, config.getJobId());
        try {
            LOG.info("Starting Overseer '{}' with config: {}", command, config);
            JobContext context = new JobContext(JobId.of(config.getJobId()), config.getQueryTimeout());
            JobCache cache = new FileSystemJobCache(Path.of(config.getCacheDir()));
            phase.apply(config, context, cache);
            return EXIT_OK;
        } catch (BatchFailureException e) {
            LOG.error("{} phase failed for {} item(s)", e.getPhase(), e.getFailures().size());
            for (ItemFailure failure : e.getFailures()) {
                LOG.error("  {}", failure, failure.getCause());
            }
            return EXIT_FAILED;
        } catch (OverseerException | IllegalArgumentException | IllegalStateException e) {
            LOG.error("Command '{}' failed: {}", command, e.getMessage(), e);
            return EXIT_FAILED;
        } finally {
            MDC.remove(MDC_JOB_ID);
        }
    }

    // ---------------------------------------------------------------
    // Phases
    // ---------------------------------------------------------------

    static RunReport runPhase(JobConfig config, JobContext context, JobCache cache) {
        List<Task> tasks = TaskLoader.fromDirectory(Path.of(config.getQueryDir()));
        Target target = new Target(config.getTaskTags(), config.getTaskIds());

        try (JdbcQueryExecutor executor = new JdbcQueryExecutor(config.getJdbcUrl(), config.getJdbcUser(),
                config.getJdbcPassword(), config.getParallelism())) {
            RunReport report = new RunOrchestrator(executor, cache, config.getParallelism())
                    .run(context, tasks, target);
            LOG.info("Run complete: {}", report);
            return report;
        }
    }

    static EvalReport evalPhase(JobConfig config, JobContext context, JobCache cache) {
        PolicyConfig policy = PolicyLoader.load(config.getPolicyPath());
        RulePolicyEvaluator evaluator = RulePolicyEvaluator.fromConfig(policy.getRules());

        try (AlertNotifier notifier = createNotifier(config)) {
            EvalReport report = new EvalOrchestrator(cache, evaluator, notifier, new AlertFactory())
                    .eval(context);
            LOG.info("Eval complete: {}", report);
            return report;
        }
    }

    // ---------------------------------------------------------------
    // Helpers
    // ---------------------------------------------------------------

    private static AlertNotifier createNotifier(JobConfig config) {
        if (config.isKafkaEnabled()) {
            LOG.info("Publishing alerts to Kafka topic {}", config.getKafkaAlertTopic());
            return new KafkaAlertNotifier(config);
        }
        LOG.info("No alert topic configured, alerts are written to the log");
        return new LogAlertNotifier();
    }
}
