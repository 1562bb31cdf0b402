package com.overseer.core.config;

import com.overseer.core.error.ErrorKind;
import com.overseer.core.error.OverseerException;
import com.overseer.core.model.Task;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.StringReader;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Unit tests for {@link TaskLoader}.
 */
class TaskLoaderTest {

    @TempDir
    Path dir;

    @Test
    @DisplayName("Should read ID and tags from header comments")
    void shouldParseHeader() {
        String sql = """
                -- id: failed_logins
                -- tags: auth, hourly
                -- counts failures per user
                SELECT user, COUNT(*) AS failures
                FROM logins
                -- tags: ignored, not in header
                GROUP BY user
                """;

        Task task = TaskLoader.parse(new StringReader(sql), "file_name", "mem");

        assertThat(task.getId()).isEqualTo("failed_logins");
        assertThat(task.getTags()).containsExactly("auth", "hourly");
        assertThat(task.getQuery()).startsWith("-- id: failed_logins").endsWith("GROUP BY user");
        assertThat(task.getSource()).isEqualTo("mem");
    }

    @Test
    @DisplayName("Should default the ID to the file name")
    void shouldDefaultIdToFileName() throws Exception {
        Files.writeString(dir.resolve("disk_usage.sql"), "SELECT host, pct FROM disks\n");

        List<Task> tasks = TaskLoader.fromDirectory(dir);

        assertThat(tasks).singleElement().satisfies(t -> {
            assertThat(t.getId()).isEqualTo("disk_usage");
            assertThat(t.getTags()).isEmpty();
            assertThat(t.getQuery()).isEqualTo("SELECT host, pct FROM disks");
        });
    }

    @Test
    @DisplayName("Should walk sub-directories in path order and skip other files")
    void shouldWalkRecursively() throws Exception {
        Files.createDirectories(dir.resolve("infra"));
        Files.writeString(dir.resolve("b.sql"), "SELECT 2");
        Files.writeString(dir.resolve("a.sql"), "SELECT 1");
        Files.writeString(dir.resolve("infra/c.sql"), "SELECT 3");
        Files.writeString(dir.resolve("README.md"), "not a query");

        assertThat(TaskLoader.fromDirectory(dir)).extracting(Task::getId).containsExactly("a", "b", "c");
    }

    @Test
    @DisplayName("Should reject duplicate task IDs")
    void shouldRejectDuplicateIds() throws Exception {
        Files.writeString(dir.resolve("one.sql"), "-- id: same\nSELECT 1");
        Files.writeString(dir.resolve("two.sql"), "-- id: same\nSELECT 2");

        assertThatThrownBy(() -> TaskLoader.fromDirectory(dir))
                .isInstanceOfSatisfying(OverseerException.class,
                        e -> assertThat(e.getKind()).isEqualTo(ErrorKind.DUPLICATE_TASK_ID));
    }

    @Test
    @DisplayName("Should fail when no query file exists")
    void shouldFailWithoutQueries() {
        assertThatThrownBy(() -> TaskLoader.fromDirectory(dir))
                .isInstanceOfSatisfying(OverseerException.class,
                        e -> assertThat(e.getKind()).isEqualTo(ErrorKind.NO_TASKS_CONFIGURED));
        assertThatThrownBy(() -> TaskLoader.fromDirectory(dir.resolve("missing")))
                .isInstanceOfSatisfying(OverseerException.class,
                        e -> assertThat(e.getKind()).isEqualTo(ErrorKind.INVALID_CONFIGURATION));
    }

    @Test
    @DisplayName("Should reject an empty query file")
    void shouldRejectEmptyQuery() throws Exception {
        Files.writeString(dir.resolve("blank.sql"), "");

        assertThatThrownBy(() -> TaskLoader.fromDirectory(dir))
                .isInstanceOfSatisfying(OverseerException.class,
                        e -> assertThat(e.getKind()).isEqualTo(ErrorKind.INVALID_CONFIGURATION));
    }
}
