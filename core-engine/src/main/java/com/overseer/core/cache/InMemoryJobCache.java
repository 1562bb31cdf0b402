package com.overseer.core.cache;

import com.overseer.core.error.ErrorKind;
import com.overseer.core.error.OverseerException;
import com.overseer.core.model.CacheEntry;
import com.overseer.core.model.JobId;
import com.overseer.core.model.QueryResult;

import java.time.Clock;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.ConcurrentSkipListMap;
import java.util.stream.Stream;

/**
 * Process-local {@link JobCache}.
 *
 * <p>
 * Each partition is a {@link ConcurrentSkipListMap}, so enumeration is sorted
 * by task ID and never blocks concurrent writers. Suitable when Run and Eval
 * share a process, and for tests.
 * </p>
 */
public class InMemoryJobCache implements JobCache {

    private final ConcurrentMap<JobId, ConcurrentSkipListMap<String, CacheEntry>> partitions =
            new ConcurrentHashMap<>();
    private final Clock clock;

    public InMemoryJobCache() {
        this(Clock.systemUTC());
    }

    public InMemoryJobCache(Clock clock) {
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
    }

    @Override
    public CacheEntry put(JobId jobId, String taskId, QueryResult result) {
        Objects.requireNonNull(jobId, "jobId must not be null");
        Objects.requireNonNull(taskId, "taskId must not be null");
        Objects.requireNonNull(result, "result must not be null");

        CacheEntry entry = new CacheEntry(taskId, result, clock.instant());
        CacheEntry existing = partitions
                .computeIfAbsent(jobId, id -> new ConcurrentSkipListMap<>())
                .putIfAbsent(taskId, entry);
        if (existing != null) {
            throw new OverseerException(ErrorKind.DUPLICATE_CACHE_KEY, "cache entry already exists")
                    .with("job_id", jobId)
                    .with("task_id", taskId);
        }
        return entry;
    }

    @Override
    public Optional<CacheEntry> get(JobId jobId, String taskId) {
        Map<String, CacheEntry> partition = partitions.get(jobId);
        return partition == null ? Optional.empty() : Optional.ofNullable(partition.get(taskId));
    }

    @Override
    public Stream<CacheEntry> entries(JobId jobId) {
        Map<String, CacheEntry> partition = partitions.get(jobId);
        if (partition == null) {
            return Stream.empty();
        }
        return partition.values().stream();
    }

    @Override
    public Stream<String> taskIds(JobId jobId) {
        ConcurrentSkipListMap<String, CacheEntry> partition = partitions.get(jobId);
        if (partition == null) {
            return Stream.empty();
        }
        return partition.keySet().stream();
    }

    @Override
    public int clear(JobId jobId) {
        Map<String, CacheEntry> removed = partitions.remove(jobId);
        return removed == null ? 0 : removed.size();
    }
}
