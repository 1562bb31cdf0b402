package com.overseer.core.cache;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.overseer.core.error.ErrorKind;
import com.overseer.core.error.OverseerException;
import com.overseer.core.json.JsonMappers;
import com.overseer.core.model.CacheEntry;
import com.overseer.core.model.JobId;
import com.overseer.core.model.QueryResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.OutputStream;
import java.net.URLDecoder;
import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.nio.file.FileAlreadyExistsException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.time.Clock;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.stream.Stream;

/**
 * {@link JobCache} backed by a directory tree, so that the Run and Eval phases
 * can execute in different processes.
 *
 * <h3>Layout</h3>
 *
 * <pre>
 *   &lt;baseDir&gt;/&lt;jobId&gt;/&lt;taskId&gt;.json
 * </pre>
 *
 * <p>
 * Path segments are URL-encoded (dots included) so that any ID maps to a
 * single file name inside the base directory. Files are created with
 * {@link StandardOpenOption#CREATE_NEW}: the file system, not a lock, rejects
 * a second writer for the same key. Entries are enumerated in file-name order
 * and a file is only read when the enumeration reaches it.
 * </p>
 *
 * @since 1.0.0
 */
public class FileSystemJobCache implements JobCache {

    private static final Logger LOG = LoggerFactory.getLogger(FileSystemJobCache.class);
    private static final String SUFFIX = ".json";

    private final Path baseDir;
    private final ObjectMapper mapper;
    private final Clock clock;

    public FileSystemJobCache(Path baseDir) {
        this(baseDir, JsonMappers.create(), Clock.systemUTC());
    }

    public FileSystemJobCache(Path baseDir, ObjectMapper mapper, Clock clock) {
        this.baseDir = Objects.requireNonNull(baseDir, "baseDir must not be null");
        this.mapper = Objects.requireNonNull(mapper, "mapper must not be null");
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
    }

    public Path getBaseDir() {
        return baseDir;
    }

    @Override
    public CacheEntry put(JobId jobId, String taskId, QueryResult result) {
        Objects.requireNonNull(jobId, "jobId must not be null");
        Objects.requireNonNull(taskId, "taskId must not be null");
        Objects.requireNonNull(result, "result must not be null");

        CacheEntry entry = new CacheEntry(taskId, result, clock.instant());
        Path file = entryFile(jobId, taskId);
        try {
            Files.createDirectories(file.getParent());
        } catch (IOException e) {
            throw ioFailure("failed to create job partition", jobId, taskId, e);
        }

        try (OutputStream out = Files.newOutputStream(file,
                StandardOpenOption.CREATE_NEW, StandardOpenOption.WRITE)) {
            mapper.writeValue(out, entry);
        } catch (FileAlreadyExistsException e) {
            throw new OverseerException(ErrorKind.DUPLICATE_CACHE_KEY, "cache entry already exists", e)
                    .with("job_id", jobId)
                    .with("task_id", taskId);
        } catch (IOException e) {
            deleteQuietly(file);
            throw ioFailure("failed to write cache entry", jobId, taskId, e);
        }

        LOG.debug("Cached {} row(s) for job={} task={} at {}", result.size(), jobId, taskId, file);
        return entry;
    }

    @Override
    public Optional<CacheEntry> get(JobId jobId, String taskId) {
        Path file = entryFile(jobId, taskId);
        if (!Files.isRegularFile(file)) {
            return Optional.empty();
        }
        return Optional.of(read(jobId, file));
    }

    @Override
    public Stream<CacheEntry> entries(JobId jobId) {
        return entryFiles(jobId).stream().map(p -> read(jobId, p));
    }

    @Override
    public Stream<String> taskIds(JobId jobId) {
        return entryFiles(jobId).stream().map(FileSystemJobCache::taskIdOf);
    }

    @Override
    public int clear(JobId jobId) {
        Path dir = partitionDir(jobId);
        if (!Files.isDirectory(dir)) {
            return 0;
        }
        List<Path> files;
        try (Stream<Path> listing = Files.list(dir)) {
            files = listing.toList();
        } catch (IOException e) {
            throw ioFailure("failed to list job partition", jobId, null, e);
        }
        int removed = 0;
        try {
            for (Path file : files) {
                if (Files.deleteIfExists(file) && file.getFileName().toString().endsWith(SUFFIX)) {
                    removed++;
                }
            }
            Files.deleteIfExists(dir);
        } catch (IOException e) {
            throw ioFailure("failed to clear job partition", jobId, null, e);
        }
        LOG.info("Cleared {} cache entr(ies) for job={}", removed, jobId);
        return removed;
    }

    // ---------------------------------------------------------------
    // Internal
    // ---------------------------------------------------------------

    /**
     * Entry files of a partition in file-name order. Only the directory is
     * listed here; each file is read when the caller reaches it.
     */
    private List<Path> entryFiles(JobId jobId) {
        Path dir = partitionDir(jobId);
        if (!Files.isDirectory(dir)) {
            return List.of();
        }
        try (Stream<Path> listing = Files.list(dir)) {
            return listing
                    .filter(p -> p.getFileName().toString().endsWith(SUFFIX))
                    .filter(Files::isRegularFile)
                    .sorted()
                    .toList();
        } catch (IOException e) {
            throw ioFailure("failed to list job partition", jobId, null, e);
        }
    }

    private CacheEntry read(JobId jobId, Path file) {
        try {
            return mapper.readValue(file.toFile(), CacheEntry.class);
        } catch (IOException e) {
            throw ioFailure("failed to read cache entry", jobId, taskIdOf(file), e);
        }
    }

    Path partitionDir(JobId jobId) {
        return baseDir.resolve(encode(jobId.getValue()));
    }

    Path entryFile(JobId jobId, String taskId) {
        return partitionDir(jobId).resolve(encode(taskId) + SUFFIX);
    }

    private static String encode(String segment) {
        return URLEncoder.encode(segment, StandardCharsets.UTF_8).replace(".", "%2E");
    }

    private static String taskIdOf(Path file) {
        String name = file.getFileName().toString();
        return URLDecoder.decode(name.substring(0, name.length() - SUFFIX.length()), StandardCharsets.UTF_8);
    }

    private static void deleteQuietly(Path file) {
        try {
            Files.deleteIfExists(file);
        } catch (IOException e) {
            LOG.warn("Failed to remove partial cache file {}: {}", file, e.getMessage());
        }
    }

    private static OverseerException ioFailure(String message, JobId jobId, String taskId, Throwable cause) {
        OverseerException e = new OverseerException(ErrorKind.CACHE_IO_FAILED, message, cause)
                .with("job_id", jobId);
        if (taskId != null) {
            e.with("task_id", taskId);
        }
        return e;
    }
}
