package com.overseer.core.pipeline;

import com.overseer.core.cache.InMemoryJobCache;
import com.overseer.core.error.BatchFailureException;
import com.overseer.core.error.ErrorKind;
import com.overseer.core.error.OverseerException;
import com.overseer.core.model.CacheEntry;
import com.overseer.core.model.JobContext;
import com.overseer.core.model.JobId;
import com.overseer.core.model.QueryResult;
import com.overseer.core.model.Target;
import com.overseer.core.model.Task;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.stream.Stream;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Unit tests for {@link RunOrchestrator}.
 */
class RunOrchestratorTest {

    private static final JobId JOB = JobId.of("job-1");

    private final Set<String> executed = ConcurrentHashMap.newKeySet();
    private InMemoryJobCache cache;
    private JobContext context;

    @BeforeEach
    void setUp() {
        cache = new InMemoryJobCache();
        context = new JobContext(JOB);
    }

    private static Task task(String id, String... tags) {
        return Task.builder().id(id).tags(List.of(tags)).query("SELECT '" + id + "'").build();
    }

    private QueryExecutor recording() {
        return (ctx, task) -> {
            executed.add(task.getId());
            return new QueryResult(List.of("id"), List.of(Map.of("id", task.getId())));
        };
    }

    private List<String> cachedIds() {
        try (Stream<CacheEntry> entries = cache.entries(JOB)) {
            return entries.map(CacheEntry::getTaskId).toList();
        }
    }

    @Test
    @DisplayName("Should execute and cache only the tasks matching the target")
    void shouldRunSelectedTasks() {
        RunOrchestrator run = new RunOrchestrator(recording(), cache, 4);

        RunReport report = run.run(context, List.of(task("a", "x"), task("b", "y")), Target.ofTags("x"));

        assertThat(report.getCachedTaskIds()).containsExactly("a");
        assertThat(executed).containsExactly("a");
        assertThat(cachedIds()).containsExactly("a");
        assertThat(cache.get(JOB, "a").orElseThrow().getResult().getRows())
                .containsExactly(Map.of("id", "a"));
    }

    @Test
    @DisplayName("Should run every task for an empty target")
    void shouldRunAllForEmptyTarget() {
        RunOrchestrator run = new RunOrchestrator(recording(), cache, 1);

        RunReport report = run.run(context, List.of(task("a"), task("b"), task("c")), Target.all());

        assertThat(report.getCachedTaskIds()).containsExactly("a", "b", "c");
        assertThat(cachedIds()).containsExactly("a", "b", "c");
    }

    @Test
    @DisplayName("Should attempt every task and report each failure")
    void shouldReportPartialFailure() {
        QueryExecutor executor = (ctx, task) -> {
            executed.add(task.getId());
            if (task.getId().equals("b")) {
                throw new IllegalStateException("connection refused");
            }
            return QueryResult.empty();
        };
        RunOrchestrator run = new RunOrchestrator(executor, cache, 2);

        assertThatThrownBy(() -> run.run(context, List.of(task("a"), task("b"), task("c")), Target.all()))
                .isInstanceOfSatisfying(BatchFailureException.class, e -> {
                    assertThat(e.getKind()).isEqualTo(ErrorKind.BATCH_FAILED);
                    assertThat(e.getPhase()).isEqualTo("run");
                    assertThat(e.getFailures()).hasSize(1);
                    assertThat(e.getFailures().get(0).getItemId()).isEqualTo("b");
                    assertThat(e.getFailures().get(0).getKind()).isEqualTo(ErrorKind.TASK_EXECUTION_FAILED);
                    assertThat(e.getFailures().get(0).getCause()).hasMessage("connection refused");
                });
        assertThat(executed).containsExactlyInAnyOrder("a", "b", "c");
        assertThat(cachedIds()).containsExactly("a", "c");
    }

    @Test
    @DisplayName("Should fail a repeated run of the same job without overwriting results")
    void shouldNotOverwriteOnRerun() {
        RunOrchestrator run = new RunOrchestrator(recording(), cache, 2);
        run.run(context, List.of(task("a")), Target.all());

        assertThatThrownBy(() -> run.run(context, List.of(task("a")), Target.all()))
                .isInstanceOfSatisfying(BatchFailureException.class, e -> {
                    assertThat(e.getFailures()).singleElement()
                            .satisfies(f -> assertThat(f.getCause())
                                    .isInstanceOfSatisfying(OverseerException.class,
                                            c -> assertThat(c.getKind()).isEqualTo(ErrorKind.DUPLICATE_CACHE_KEY)));
                });
    }

    @Test
    @DisplayName("Should fail before any query when nothing is selected")
    void shouldFailWhenNothingSelected() {
        RunOrchestrator run = new RunOrchestrator(recording(), cache, 2);

        assertThatThrownBy(() -> run.run(context, List.of(), Target.all()))
                .isInstanceOfSatisfying(OverseerException.class,
                        e -> assertThat(e.getKind()).isEqualTo(ErrorKind.NO_TASKS_SELECTED));
        assertThatThrownBy(() -> run.run(context, List.of(task("a", "x")), Target.ofTags("y")))
                .isInstanceOfSatisfying(OverseerException.class,
                        e -> assertThat(e.getKind()).isEqualTo(ErrorKind.NO_TASKS_SELECTED));
        assertThat(executed).isEmpty();
        assertThat(cachedIds()).isEmpty();
    }

    @Test
    @DisplayName("Should reject duplicate task IDs and invalid targets before any query")
    void shouldValidateBeforeRunning() {
        RunOrchestrator run = new RunOrchestrator(recording(), cache, 2);

        assertThatThrownBy(() -> run.run(context, List.of(task("a"), task("a")), Target.all()))
                .isInstanceOfSatisfying(OverseerException.class,
                        e -> assertThat(e.getKind()).isEqualTo(ErrorKind.DUPLICATE_TASK_ID));
        assertThatThrownBy(() -> run.run(context, List.of(task("a")), Target.ofIds(" ")))
                .isInstanceOfSatisfying(OverseerException.class,
                        e -> assertThat(e.getKind()).isEqualTo(ErrorKind.INVALID_TARGET));
        assertThat(executed).isEmpty();
    }

    @Test
    @DisplayName("Should run tasks concurrently up to the configured parallelism")
    void shouldRunConcurrently() {
        CountDownLatch bothStarted = new CountDownLatch(2);
        QueryExecutor executor = (ctx, task) -> {
            bothStarted.countDown();
            try {
                if (!bothStarted.await(5, TimeUnit.SECONDS)) {
                    throw new IllegalStateException("tasks did not overlap");
                }
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new IllegalStateException(e);
            }
            return QueryResult.empty();
        };
        RunOrchestrator run = new RunOrchestrator(executor, cache, 2);

        RunReport report = run.run(context, List.of(task("a"), task("b")), Target.all());

        assertThat(report.getCachedTaskIds()).containsExactly("a", "b");
    }

    @Test
    @DisplayName("Should fail with CANCELLED when the calling thread is interrupted")
    void shouldHonourInterruption() {
        RunOrchestrator run = new RunOrchestrator(recording(), cache, 2);

        Thread.currentThread().interrupt();
        try {
            assertThatThrownBy(() -> run.run(context, List.of(task("a")), Target.all()))
                    .isInstanceOfSatisfying(OverseerException.class,
                            e -> assertThat(e.getKind()).isEqualTo(ErrorKind.CANCELLED));
        } finally {
            Thread.interrupted();
        }
        assertThat(executed).isEmpty();
    }

    @Test
    @DisplayName("Should reject a parallelism below one")
    void shouldRejectInvalidParallelism() {
        assertThatThrownBy(() -> new RunOrchestrator(recording(), cache, 0))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("parallelism");
    }
}
