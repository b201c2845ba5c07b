package io.github.yok.stagemerge.db;

import java.sql.Connection;
import java.sql.SQLException;
import javax.sql.DataSource;

/**
 * Non-transactional executor: every call borrows an auto-commit connection from the pool and
 * returns it afterwards.
 */
public class PooledSqlExecutor extends AbstractSqlExecutor {

    private final DataSource dataSource;

    /**
     * Creates an executor over a pooled data source.
     *
     * @param dataSource connection pool
     * @param settings statement settings
     */
    public PooledSqlExecutor(DataSource dataSource, ExecutorSettings settings) {
        super(settings);
        this.dataSource = dataSource;
    }

    /**
     * Opens a transactional executor on a fresh connection from the same pool.
     *
     * @return transactional executor; the caller must close it
     * @throws SQLException if a connection cannot be obtained or configured
     */
    public TransactionalSqlExecutor beginTransaction() throws SQLException {
        return TransactionalSqlExecutor.begin(dataSource, getSettings());
    }

    /**
     * Returns the underlying data source.
     *
     * @return data source
     */
    public DataSource getDataSource() {
        return dataSource;
    }

    @Override
    protected <T> T withConnection(ConnectionCallback<T> callback) throws SQLException {
        try (Connection connection = dataSource.getConnection()) {
            if (!connection.getAutoCommit()) {
                connection.setAutoCommit(true);
            }
            return callback.doInConnection(connection);
        }
    }
}
