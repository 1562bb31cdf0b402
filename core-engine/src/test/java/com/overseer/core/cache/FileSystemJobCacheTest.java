package com.overseer.core.cache;

import com.overseer.core.error.ErrorKind;
import com.overseer.core.error.OverseerException;
import com.overseer.core.json.JsonMappers;
import com.overseer.core.model.CacheEntry;
import com.overseer.core.model.JobId;
import com.overseer.core.model.QueryResult;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.LinkedHashMap;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.stream.Stream;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Unit tests for {@link FileSystemJobCache}.
 */
class FileSystemJobCacheTest {

    private static final Instant NOW = Instant.parse("2024-05-01T12:00:00Z");
    private static final JobId JOB = JobId.of("nightly-2024-05-01");

    @TempDir
    Path baseDir;

    private FileSystemJobCache cache;

    @BeforeEach
    void setUp() {
        cache = newCache();
    }

    private FileSystemJobCache newCache() {
        return new FileSystemJobCache(baseDir, JsonMappers.create(), Clock.fixed(NOW, ZoneOffset.UTC));
    }

    private static QueryResult logins() {
        Map<String, Object> row = new LinkedHashMap<>();
        row.put("user", "alice");
        row.put("failures", 12);
        row.put("ratio", 0.75);
        row.put("note", null);
        return new QueryResult(List.of("user", "failures", "ratio", "note"), List.of(row));
    }

    @Test
    @DisplayName("Should read back an entry through a new instance over the same directory")
    void shouldSurviveNewInstance() {
        cache.put(JOB, "failed_logins", logins());

        CacheEntry read = newCache().get(JOB, "failed_logins").orElseThrow();

        assertThat(read.getTaskId()).isEqualTo("failed_logins");
        assertThat(read.getStoredAt()).isEqualTo(NOW);
        assertThat(read.getResult()).isEqualTo(logins());
    }

    @Test
    @DisplayName("Should reject a second write for the same key, even from another instance")
    void shouldRejectDuplicateKey() {
        cache.put(JOB, "failed_logins", logins());

        assertThatThrownBy(() -> newCache().put(JOB, "failed_logins", QueryResult.empty()))
                .isInstanceOfSatisfying(OverseerException.class,
                        e -> assertThat(e.getKind()).isEqualTo(ErrorKind.DUPLICATE_CACHE_KEY));
        assertThat(cache.get(JOB, "failed_logins").orElseThrow().getResult()).isEqualTo(logins());
    }

    @Test
    @DisplayName("Should keep IDs with path characters inside the job partition")
    void shouldEncodePathSegments() {
        cache.put(JobId.of("../escape"), "a/b", QueryResult.empty());
        cache.put(JOB, "..", QueryResult.empty());

        Path partition = cache.partitionDir(JobId.of("../escape"));
        assertThat(partition.getParent()).isEqualTo(baseDir);
        assertThat(cache.entryFile(JobId.of("../escape"), "a/b").getParent()).isEqualTo(partition);
        assertThat(cache.get(JobId.of("../escape"), "a/b")).isPresent();
        assertThat(cache.get(JOB, "..")).isPresent();
    }

    @Test
    @DisplayName("Should enumerate entries in task order and isolate jobs")
    void shouldEnumerateByJob() {
        cache.put(JOB, "b", QueryResult.empty());
        cache.put(JOB, "a", QueryResult.empty());
        cache.put(JobId.of("other"), "c", QueryResult.empty());

        try (Stream<CacheEntry> entries = cache.entries(JOB)) {
            assertThat(entries).extracting(CacheEntry::getTaskId).containsExactly("a", "b");
        }
        try (Stream<CacheEntry> entries = cache.entries(JobId.of("never-run"))) {
            assertThat(entries).isEmpty();
        }
    }

    @Test
    @DisplayName("Should report unreadable entries as cache I/O failures")
    void shouldReportCorruptEntries() throws Exception {
        cache.put(JOB, "a", QueryResult.empty());
        Files.writeString(cache.entryFile(JOB, "a"), "{not json");

        assertThatThrownBy(() -> cache.get(JOB, "a"))
                .isInstanceOfSatisfying(OverseerException.class, e -> {
                    assertThat(e.getKind()).isEqualTo(ErrorKind.CACHE_IO_FAILED);
                    assertThat(e.getContext()).containsEntry("task_id", "a");
                });
    }

    @Test
    @DisplayName("Should read entries lazily and list task IDs without reading them")
    void shouldReadEntriesLazily() throws Exception {
        cache.put(JOB, "a", QueryResult.empty());
        cache.put(JOB, "b", QueryResult.empty());
        Files.writeString(cache.entryFile(JOB, "b"), "{not json");

        try (Stream<CacheEntry> entries = cache.entries(JOB)) {
            Iterator<CacheEntry> it = entries.iterator();
            assertThat(it.next().getTaskId()).isEqualTo("a");
            assertThatThrownBy(it::next)
                    .isInstanceOfSatisfying(OverseerException.class,
                            e -> assertThat(e.getKind()).isEqualTo(ErrorKind.CACHE_IO_FAILED));
        }
        assertThat(cache.taskIds(JOB)).containsExactly("a", "b");
    }

    @Test
    @DisplayName("Should remove the partition on clear")
    void shouldClearPartition() {
        cache.put(JOB, "a", QueryResult.empty());
        cache.put(JOB, "b", QueryResult.empty());

        assertThat(cache.clear(JOB)).isEqualTo(2);
        assertThat(Files.exists(cache.partitionDir(JOB))).isFalse();
        assertThat(cache.clear(JOB)).isZero();
        cache.put(JOB, "a", QueryResult.empty());
        assertThat(cache.get(JOB, "a")).isPresent();
    }
}
