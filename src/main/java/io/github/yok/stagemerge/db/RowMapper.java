package io.github.yok.stagemerge.db;

import java.sql.ResultSet;
import java.sql.SQLException;

/**
 * Maps the current row of a {@link ResultSet} to a value.
 *
 * @param <T> mapped type
 */
@FunctionalInterface
public interface RowMapper<T> {

    /**
     * Maps the current row. Implementations must not advance the cursor.
     *
     * @param rs result set positioned on a row
     * @return mapped value
     * @throws SQLException on column access error
     */
    T mapRow(ResultSet rs) throws SQLException;
}
