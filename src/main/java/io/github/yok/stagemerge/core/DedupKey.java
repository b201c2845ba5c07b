package io.github.yok.stagemerge.core;

import com.google.common.collect.ImmutableList;
import java.util.List;
import java.util.stream.Collectors;
import lombok.NonNull;
import lombok.Value;

/**
 * Defines "same logical row" for a table during merge.
 *
 * <p>
 * {@code primaryKey} is the join column used to delete superseded destination rows.
 * {@code partitionKeys} partitions staging rows when picking the most recent version. Partition
 * columns other than the primary key are added to the delete join, because row identity for such
 * tables spans more than one column.
 * </p>
 */
@Value
public class DedupKey {

    public static final String DEFAULT_KEY = "id";

    public static final DedupKey DEFAULT = new DedupKey(DEFAULT_KEY, List.of(DEFAULT_KEY));

    @NonNull
    String primaryKey;

    @NonNull
    List<String> partitionKeys;

    /**
     * Creates a key; an empty partition list falls back to the primary key alone.
     *
     * @param primaryKey primary key column
     * @param partitionKeys partition columns
     */
    public DedupKey(@NonNull String primaryKey, @NonNull List<String> partitionKeys) {
        this.primaryKey = primaryKey;
        this.partitionKeys = partitionKeys.isEmpty() ? ImmutableList.of(primaryKey)
                : ImmutableList.copyOf(partitionKeys);
    }

    /**
     * Returns the partition columns that must additionally match in the delete join.
     *
     * @return partition columns other than the primary key, in declaration order
     */
    public List<String> additionalJoinColumns() {
        return partitionKeys.stream().filter(column -> !column.equals(primaryKey))
                .collect(Collectors.toList());
    }
}
