package io.github.yok.stagemerge.db;

import java.sql.SQLException;
import java.util.List;

/**
 * Execution target for SQL statements.
 *
 * <p>
 * Some operations run inside the load transaction and some run on a bare pooled connection. Both
 * are expressed through this one capability so callers never branch on which one they hold:
 * </p>
 * <ul>
 * <li>{@link TransactionalSqlExecutor}: one connection, auto-commit off, explicit commit and
 * rollback</li>
 * <li>{@link PooledSqlExecutor}: borrows an auto-commit connection per call</li>
 * </ul>
 */
public interface SqlExecutor {

    /**
     * Executes a statement without parameters.
     *
     * @param sql statement
     * @throws SQLException on execution failure
     */
    default void execute(String sql) throws SQLException {
        execute(sql, false);
    }

    /**
     * Executes a statement, optionally logging the database's query plan for it first.
     *
     * <p>
     * The plan is obtained with {@code EXPLAIN} on the same execution target. Logging the plan
     * never changes the outcome of the statement itself.
     * </p>
     *
     * @param sql statement
     * @param withQueryPlan whether to log the plan before executing
     * @throws SQLException on execution failure (including failure to obtain the plan)
     */
    void execute(String sql, boolean withQueryPlan) throws SQLException;

    /**
     * Executes a parameterized DML statement.
     *
     * @param sql statement with {@code ?} placeholders
     * @param params bind values, in placeholder order
     * @return affected row count
     * @throws SQLException on execution failure
     */
    int update(String sql, Object... params) throws SQLException;

    /**
     * Runs a parameterized query and maps every row.
     *
     * @param <T> mapped type
     * @param sql query with {@code ?} placeholders
     * @param mapper row mapper
     * @param params bind values
     * @return mapped rows in result order
     * @throws SQLException on execution failure
     */
    <T> List<T> query(String sql, RowMapper<T> mapper, Object... params) throws SQLException;

    /**
     * Runs a query and returns the first column of every row as a string.
     *
     * @param sql query with {@code ?} placeholders
     * @param params bind values
     * @return first-column values
     * @throws SQLException on execution failure
     */
    default List<String> queryForStrings(String sql, Object... params) throws SQLException {
        return query(sql, rs -> rs.getString(1), params);
    }

    /**
     * Runs a query expected to return exactly one row and maps it.
     *
     * @param <T> mapped type
     * @param sql query with {@code ?} placeholders
     * @param mapper row mapper
     * @param params bind values
     * @return mapped value
     * @throws SQLException on execution failure, or when the row count is not exactly one
     */
    default <T> T queryForObject(String sql, RowMapper<T> mapper, Object... params)
            throws SQLException {
        List<T> rows = query(sql, mapper, params);
        if (rows.size() != 1) {
            throw new SQLException("Expected exactly one row but got " + rows.size() + ": " + sql);
        }
        return rows.get(0);
    }
}
