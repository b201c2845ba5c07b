package io.github.yok.stagemerge.core;

import com.google.common.collect.ImmutableSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Outcome of loading {@code identifies} and {@code users}.
 *
 * <p>
 * {@link #getTables()} lists the tables a load was attempted for, in attempt order. A table
 * without an error was loaded successfully.
 * </p>
 */
public class UserTablesLoadResult {

    private final Set<String> tables = new LinkedHashSet<>();

    private final Map<String, LoadTableException> errors = new LinkedHashMap<>();

    void attempted(String table) {
        tables.add(table);
    }

    void failed(LoadTableException error) {
        tables.add(error.getTableName());
        errors.put(error.getTableName(), error);
    }

    public Set<String> getTables() {
        return ImmutableSet.copyOf(tables);
    }

    /**
     * Returns the failure of a table, if any.
     *
     * @param table table name
     * @return failure, or empty when the table succeeded or was not attempted
     */
    public Optional<LoadTableException> errorFor(String table) {
        return Optional.ofNullable(errors.get(table));
    }

    /**
     * Returns whether every attempted table succeeded.
     *
     * @return {@code true} if no table failed
     */
    public boolean isSuccessful() {
        return errors.isEmpty();
    }

    @Override
    public String toString() {
        return "UserTablesLoadResult{tables=" + tables + ", errors=" + errors.keySet() + "}";
    }
}
