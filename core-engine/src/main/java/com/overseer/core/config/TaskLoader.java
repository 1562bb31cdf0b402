package com.overseer.core.config;

import com.overseer.core.error.ErrorKind;
import com.overseer.core.error.OverseerException;
import com.overseer.core.model.Task;
import com.overseer.core.model.Tasks;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.Reader;
import java.io.StringReader;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.stream.Stream;

/**
 * Loads {@link Task}s from a directory of {@code .sql} files.
 *
 * <h3>File format</h3>
 * <p>
 * Metadata is read from {@code --} comment lines at the top of the file;
 * the first line that is neither blank nor a comment ends the header. The
 * whole file, header included, is the query text.
 * </p>
 *
 * <pre>
 * -- id: failed_logins
 * -- tags: auth, hourly
 * SELECT user, COUNT(*) AS failures FROM logins WHERE ok = false GROUP BY user
 * </pre>
 *
 * <p>
 * Without an {@code id} header the file name minus {@code .sql} is the task
 * ID. Sub-directories are walked recursively and files are loaded in path
 * order.
 * </p>
 *
 * @since 1.0.0
 */
public final class TaskLoader {

    private static final Logger LOG = LoggerFactory.getLogger(TaskLoader.class);

    static final String SQL_SUFFIX = ".sql";

    private TaskLoader() {
        // utility class - not instantiable
    }

    /**
     * Load and validate every task below {@code queryDir}.
     *
     * @param queryDir directory to walk; must not be {@code null}
     * @return tasks in path order
     * @throws OverseerException {@link ErrorKind#INVALID_CONFIGURATION} if the
     *                           directory cannot be read,
     *                           {@link ErrorKind#NO_TASKS_CONFIGURED} if it
     *                           holds no query file,
     *                           {@link ErrorKind#DUPLICATE_TASK_ID} for
     *                           clashing IDs
     */
    public static List<Task> fromDirectory(Path queryDir) {
        Objects.requireNonNull(queryDir, "Query directory must not be null");
        if (!Files.isDirectory(queryDir)) {
            throw new OverseerException(ErrorKind.INVALID_CONFIGURATION, "query directory does not exist")
                    .with("query_dir", queryDir);
        }

        List<Path> files;
        try (Stream<Path> walk = Files.walk(queryDir)) {
            files = walk
                    .filter(Files::isRegularFile)
                    .filter(p -> p.getFileName().toString().endsWith(SQL_SUFFIX))
                    .sorted()
                    .toList();
        } catch (IOException | UncheckedIOException e) {
            throw new OverseerException(ErrorKind.INVALID_CONFIGURATION, "failed to read query directory", e)
                    .with("query_dir", queryDir);
        }

        if (files.isEmpty()) {
            throw new OverseerException(ErrorKind.NO_TASKS_CONFIGURED, "no query files found")
                    .with("query_dir", queryDir);
        }

        List<Task> tasks = new ArrayList<>();
        for (Path file : files) {
            tasks.add(fromFile(file));
        }
        Tasks.validate(tasks);

        LOG.info("Loaded {} task(s) from {}", tasks.size(), queryDir);
        return tasks;
    }

    /**
     * Load a single query file.
     *
     * @param file {@code .sql} file
     * @return the task (not yet validated)
     * @throws OverseerException with {@link ErrorKind#INVALID_CONFIGURATION} if
     *                           the file cannot be read
     */
    public static Task fromFile(Path file) {
        String content;
        try {
            content = Files.readString(file, StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new OverseerException(ErrorKind.INVALID_CONFIGURATION, "failed to read query file", e)
                    .with("file", file);
        }
        String fileName = file.getFileName().toString();
        String defaultId = fileName.substring(0, fileName.length() - SQL_SUFFIX.length());
        return parse(new StringReader(content), defaultId, file.toString());
    }

    /**
     * Parse a query definition.
     *
     * @param reader    query source
     * @param defaultId ID used when the header declares none
     * @param source    description of where the query came from
     * @return the task (not yet validated)
     */
    static Task parse(Reader reader, String defaultId, String source) {
        Task.Builder builder = Task.builder().id(defaultId).source(source);
        StringBuilder query = new StringBuilder();
        boolean inHeader = true;

        try (BufferedReader br = new BufferedReader(reader)) {
            String line;
            while ((line = br.readLine()) != null) {
                query.append(line).append('\n');
                if (!inHeader) {
                    continue;
                }
                String trimmed = line.trim();
                if (trimmed.isEmpty()) {
                    continue;
                }
                if (!trimmed.startsWith("--")) {
                    inHeader = false;
                    continue;
                }
                applyHeader(builder, trimmed.substring(2).trim());
            }
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read query from " + source, e);
        }

        return builder.query(query.toString().strip()).build();
    }

    private static void applyHeader(Task.Builder builder, String comment) {
        int colon = comment.indexOf(':');
        if (colon < 0) {
            return;
        }
        String key = comment.substring(0, colon).trim().toLowerCase(Locale.ROOT);
        String value = comment.substring(colon + 1).trim();
        switch (key) {
            case "id" -> builder.id(value);
            case "tag", "tags" -> {
                for (String tag : value.split(",")) {
                    if (!tag.isBlank()) {
                        builder.tag(tag.trim());
                    }
                }
            }
            default -> {
                // free-form comment
            }
        }
    }
}
