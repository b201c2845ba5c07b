package io.github.yok.stagemerge.db;

import com.google.common.base.Stopwatch;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import lombok.extern.slf4j.Slf4j;

/**
 * JDBC plumbing shared by the transactional and pooled executors.
 *
 * <p>
 * Subclasses only decide which connection a callback runs on. Every statement gets the
 * configured query timeout, and statements slower than the slow-query threshold are logged.
 * </p>
 */
@Slf4j
public abstract class AbstractSqlExecutor implements SqlExecutor {

    /**
     * Work executed against a connection chosen by the executor.
     *
     * @param <T> result type
     */
    @FunctionalInterface
    protected interface ConnectionCallback<T> {
        T doInConnection(Connection connection) throws SQLException;
    }

    private final ExecutorSettings settings;

    protected AbstractSqlExecutor(ExecutorSettings settings) {
        this.settings = settings;
    }

    /**
     * Runs the callback on the connection this executor targets.
     *
     * @param <T> result type
     * @param callback work to run
     * @return callback result
     * @throws SQLException on failure
     */
    protected abstract <T> T withConnection(ConnectionCallback<T> callback) throws SQLException;

    @Override
    public void execute(String sql, boolean withQueryPlan) throws SQLException {
        if (withQueryPlan) {
            List<String> plan = queryForStrings("EXPLAIN " + sql);
            log.info("Execution query plan for statement: {} is {}", sql,
                    String.join(System.lineSeparator(), plan));
        }
        withConnection(connection -> {
            try (Statement stmt = connection.createStatement()) {
                applyTimeout(stmt);
                Stopwatch stopwatch = Stopwatch.createStarted();
                stmt.execute(sql);
                logIfSlow(sql, stopwatch);
            }
            return null;
        });
    }

    @Override
    public int update(String sql, Object... params) throws SQLException {
        return withConnection(connection -> {
            try (PreparedStatement ps = connection.prepareStatement(sql)) {
                applyTimeout(ps);
                bind(ps, params);
                Stopwatch stopwatch = Stopwatch.createStarted();
                int affected = ps.executeUpdate();
                logIfSlow(sql, stopwatch);
                return affected;
            }
        });
    }

    @Override
    public <T> List<T> query(String sql, RowMapper<T> mapper, Object... params)
            throws SQLException {
        return withConnection(connection -> {
            try (PreparedStatement ps = connection.prepareStatement(sql)) {
                applyTimeout(ps);
                bind(ps, params);
                Stopwatch stopwatch = Stopwatch.createStarted();
                List<T> rows = new ArrayList<>();
                try (ResultSet rs = ps.executeQuery()) {
                    while (rs.next()) {
                        rows.add(mapper.mapRow(rs));
                    }
                }
                logIfSlow(sql, stopwatch);
                return rows;
            }
        });
    }

    protected ExecutorSettings getSettings() {
        return settings;
    }

    private void applyTimeout(Statement stmt) throws SQLException {
        long seconds = settings.getStatementTimeout().getSeconds();
        if (seconds > 0) {
            stmt.setQueryTimeout((int) Math.min(seconds, Integer.MAX_VALUE));
        }
    }

    private static void bind(PreparedStatement ps, Object... params) throws SQLException {
        for (int i = 0; i < params.length; i++) {
            ps.setObject(i + 1, params[i]);
        }
    }

    private void logIfSlow(String sql, Stopwatch stopwatch) {
        Duration elapsed = stopwatch.elapsed();
        if (elapsed.compareTo(settings.getSlowQueryThreshold()) > 0) {
            log.warn("Slow query ({} ms > {} ms): {}", elapsed.toMillis(),
                    settings.getSlowQueryThreshold().toMillis(), sql);
        }
    }
}
