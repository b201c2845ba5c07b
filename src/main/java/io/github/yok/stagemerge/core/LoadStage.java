package io.github.yok.stagemerge.core;

/**
 * Stage of a table load at which a failure occurred, reported as the {@code stage} tag.
 */
public enum LoadStage {
    CREATE_STAGING_TABLE("staging_table_creation"),
    COPY_IN_SCHEMA_STAGING_TABLE("staging_table_copy_in_schema"),
    OPEN_LOAD_FILES("load_files_opening"),
    READ_GZIP_LOAD_FILES("load_files_gzip_reading"),
    READ_CSV_LOAD_FILES("load_files_csv_reading"),
    CSV_COLUMN_COUNT_MISMATCH("csv_column_count_mismatch"),
    LOAD_STAGING_TABLE("staging_table_loading"),
    STAGING_TABLE_LOAD_STAGE("staging_table_load_stage"),
    DELETE_DEDUP("dedup_deletion"),
    INSERT_DEDUP("dedup_insertion"),
    DEDUP_STAGE("dedup_stage"),
    USERS_UNION_CREATION("users_identifies_union_creation"),
    USERS_STAGING_CREATION("users_staging_table_creation");

    private final String tag;

    LoadStage(String tag) {
        this.tag = tag;
    }

    /**
     * Returns the telemetry value of this stage.
     *
     * @return stage tag
     */
    public String getTag() {
        return tag;
    }
}
