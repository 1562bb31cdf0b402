package com.overseer.job;

import com.overseer.core.error.ErrorKind;
import com.overseer.core.error.OverseerException;
import com.overseer.core.model.JobContext;
import com.overseer.core.model.QueryResult;
import com.overseer.core.model.Task;
import com.overseer.core.pipeline.QueryExecutor;
import com.zaxxer.hikari.HikariConfig;
import com.zaxxer.hikari.HikariDataSource;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.Array;
import java.sql.Clob;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.ResultSetMetaData;
import java.sql.SQLException;
import java.sql.SQLTimeoutException;
import java.sql.Time;
import java.sql.Timestamp;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.ZonedDateTime;
import java.time.temporal.TemporalAccessor;
import java.util.ArrayList;
import java.util.Base64;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * {@link QueryExecutor} that runs each task's SQL against a pooled JDBC
 * data source.
 *
 * <p>
 * Connections are opened read-only. Column values are converted into plain
 * JSON-friendly types: temporals become ISO-8601 strings, LOBs become
 * strings (binary as Base64), SQL arrays become lists.
 * </p>
 *
 * <p>
 * Dates and date-times without an offset are read as UTC and rendered as
 * RFC 3339 instants ({@code 2024-05-01T00:00:00Z}), so any date column can
 * serve as an alert's {@code timestampField}. Times of day keep their local
 * form.
 * </p>
 *
 * @since 1.0.0
 */
public class JdbcQueryExecutor implements QueryExecutor, AutoCloseable {

    private static final Logger LOG = LoggerFactory.getLogger(JdbcQueryExecutor.class);

    private static final int FETCH_SIZE = 1_000;

    private final HikariDataSource dataSource;

    /**
     * Create an executor backed by its own HikariCP pool.
     *
     * @param jdbcUrl  JDBC URL; must not be blank
     * @param username user name, may be blank
     * @param password password, may be blank
     * @param poolSize maximum pool size
     */
    public JdbcQueryExecutor(String jdbcUrl, String username, String password, int poolSize) {
        this(createPool(jdbcUrl, username, password, poolSize));
    }

    JdbcQueryExecutor(HikariDataSource dataSource) {
        this.dataSource = Objects.requireNonNull(dataSource, "dataSource must not be null");
    }

    private static HikariDataSource createPool(String jdbcUrl, String username, String password, int poolSize) {
        if (jdbcUrl == null || jdbcUrl.isBlank()) {
            throw new OverseerException(ErrorKind.INVALID_CONFIGURATION, "JDBC URL is required to run tasks")
                    .with("env", "OVERSEER_JDBC_URL");
        }
        HikariConfig config = new HikariConfig();
        config.setJdbcUrl(jdbcUrl);
        if (username != null && !username.isBlank()) {
            config.setUsername(username);
        }
        if (password != null && !password.isEmpty()) {
            config.setPassword(password);
        }
        config.setMaximumPoolSize(Math.max(1, poolSize));
        config.setMinimumIdle(0);
        config.setReadOnly(true);
        config.setPoolName("overseer-query");
        return new HikariDataSource(config);
    }

    @Override
    public QueryResult execute(JobContext context, Task task) {
        context.checkCancelled();
        int timeoutSeconds = (int) Math.max(1, Math.min(Integer.MAX_VALUE, context.getQueryTimeout().toSeconds()));

        try (Connection connection = dataSource.getConnection();
                PreparedStatement statement = connection.prepareStatement(
                        task.getQuery(), ResultSet.TYPE_FORWARD_ONLY, ResultSet.CONCUR_READ_ONLY)) {
            statement.setQueryTimeout(timeoutSeconds);
            statement.setFetchSize(FETCH_SIZE);

            try (ResultSet rs = statement.executeQuery()) {
                QueryResult result = read(rs);
                LOG.debug("Task {} returned {} row(s)", task.getId(), result.size());
                return result;
            }
        } catch (SQLTimeoutException e) {
            throw new OverseerException(ErrorKind.TASK_EXECUTION_FAILED, "query timed out", e)
                    .with("task_id", task.getId())
                    .with("timeout_seconds", timeoutSeconds);
        } catch (SQLException e) {
            throw new OverseerException(ErrorKind.TASK_EXECUTION_FAILED, "query failed", e)
                    .with("task_id", task.getId())
                    .with("sql_state", e.getSQLState());
        }
    }

    private static QueryResult read(ResultSet rs) throws SQLException {
        ResultSetMetaData meta = rs.getMetaData();
        int columnCount = meta.getColumnCount();
        List<String> columns = new ArrayList<>(columnCount);
        for (int i = 1; i <= columnCount; i++) {
            columns.add(meta.getColumnLabel(i));
        }

        List<Map<String, Object>> rows = new ArrayList<>();
        while (rs.next()) {
            Map<String, Object> row = new LinkedHashMap<>();
            for (int i = 1; i <= columnCount; i++) {
                row.put(columns.get(i - 1), toPlainValue(rs.getObject(i)));
            }
            rows.add(row);
        }
        return new QueryResult(columns, rows);
    }

    static Object toPlainValue(Object value) throws SQLException {
        if (value == null || value instanceof String || value instanceof Number || value instanceof Boolean) {
            return value;
        }
        if (value instanceof Timestamp ts) {
            return ts.toLocalDateTime().toInstant(ZoneOffset.UTC).toString();
        }
        if (value instanceof java.sql.Date date) {
            return date.toLocalDate().atStartOfDay(ZoneOffset.UTC).toInstant().toString();
        }
        if (value instanceof Time time) {
            return time.toLocalTime().toString();
        }
        if (value instanceof OffsetDateTime odt) {
            return odt.toInstant().toString();
        }
        if (value instanceof ZonedDateTime zdt) {
            return zdt.toInstant().toString();
        }
        if (value instanceof LocalDateTime ldt) {
            return ldt.toInstant(ZoneOffset.UTC).toString();
        }
        if (value instanceof LocalDate date) {
            return date.atStartOfDay(ZoneOffset.UTC).toInstant().toString();
        }
        if (value instanceof TemporalAccessor temporal) {
            return temporal.toString();
        }
        if (value instanceof Clob clob) {
            return clob.getSubString(1, (int) clob.length());
        }
        if (value instanceof byte[] bytes) {
            return Base64.getEncoder().encodeToString(bytes);
        }
        if (value instanceof Array array) {
            Object[] elements = (Object[]) array.getArray();
            List<Object> converted = new ArrayList<>(elements.length);
            for (Object element : elements) {
                converted.add(toPlainValue(element));
            }
            return converted;
        }
        if (value instanceof Object[] elements) {
            List<Object> converted = new ArrayList<>(elements.length);
            for (Object element : elements) {
                converted.add(toPlainValue(element));
            }
            return converted;
        }
        return value.toString();
    }

    @Override
    public void close() {
        dataSource.close();
    }
}
