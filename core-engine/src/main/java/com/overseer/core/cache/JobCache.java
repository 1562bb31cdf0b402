package com.overseer.core.cache;

import com.overseer.core.model.CacheEntry;
import com.overseer.core.model.JobId;
import com.overseer.core.model.QueryResult;

import java.util.Optional;
import java.util.stream.Stream;

/**
 * Key-value store of raw query results, partitioned by {@link JobId} and keyed
 * by task ID within a partition.
 *
 * <h3>Contract</h3>
 * <ul>
 * <li>{@link #put} writes an entry at most once; a second put for the same
 * key fails with {@code DUPLICATE_CACHE_KEY}. Redoing a Run requires an
 * explicit {@link #clear}.</li>
 * <li>Reads never block on writers of another job. Sequencing writes and reads
 * of the same job is the caller's responsibility.</li>
 * <li>{@link #entries} returns a fresh, finite stream on every call. Its order
 * is implementation-defined but stable for the same backing storage.</li>
 * </ul>
 *
 * @since 1.0.0
 */
public interface JobCache {

    /**
     * Store the result of a task.
     *
     * @param jobId  partition key
     * @param taskId task key within the partition
     * @param result query result to store
     * @return the stored entry
     */
    CacheEntry put(JobId jobId, String taskId, QueryResult result);

    /**
     * @param jobId  partition key
     * @param taskId task key
     * @return the entry, or empty if none was stored
     */
    Optional<CacheEntry> get(JobId jobId, String taskId);

    /**
     * Enumerate every entry of a partition.
     *
     * <p>
     * Entries are read as the stream is consumed, so a file-backed
     * implementation may fail with {@code CACHE_IO_FAILED} part way through.
     * Callers that must survive a single unreadable entry iterate
     * {@link #taskIds} and call {@link #get} per ID.
     * </p>
     *
     * @param jobId partition key
     * @return lazy stream of entries, empty if the partition does not exist
     */
    Stream<CacheEntry> entries(JobId jobId);

    /**
     * Enumerate the task IDs of a partition, in the same order as
     * {@link #entries}, without reading the stored results.
     *
     * @param jobId partition key
     * @return task IDs, empty if the partition does not exist
     */
    Stream<String> taskIds(JobId jobId);

    /**
     * Remove every entry of a partition.
     *
     * @param jobId partition key
     * @return number of entries removed
     */
    int clear(JobId jobId);
}
