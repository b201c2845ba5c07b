package io.github.yok.stagemerge.source;

import io.github.yok.stagemerge.core.TableSchema;
import java.io.IOException;
import java.nio.file.Path;
import java.util.List;

/**
 * Upload-side collaborator of a load: schemas and the load files of one upload.
 */
public interface UploadSource {

    /**
     * Returns the schema of a table as carried by the upload.
     *
     * @param table table name
     * @return upload schema; empty when the upload has no data for the table
     */
    TableSchema getTableSchemaInUpload(String table);

    /**
     * Returns the schema of a table as it currently exists in the warehouse.
     *
     * @param table table name
     * @return warehouse schema; empty when the table does not exist
     */
    TableSchema getTableSchemaInWarehouse(String table);

    /**
     * Materializes the load files of a table locally.
     *
     * <p>
     * The caller owns the returned files and deletes them after use.
     * </p>
     *
     * @param table table name
     * @return local paths of gzip CSV load files; may be empty
     * @throws IOException if a file cannot be materialized
     */
    List<Path> downloadLoadFiles(String table) throws IOException;
}
