package io.github.yok.stagemerge.source;

import io.github.yok.stagemerge.config.PathsConfig;
import io.github.yok.stagemerge.core.FetchedSchema;
import io.github.yok.stagemerge.core.TableSchema;
import java.io.Closeable;
import java.io.File;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.io.FileUtils;

/**
 * {@link UploadSource} reading load files from the local {@code data-path}.
 *
 * <p>
 * Load files of table {@code t} are the {@code *.gz} files directly under
 * {@code <data-path>/load/t}, in file name order. They are copied into a temporary directory
 * before each load, since the engine deletes the files it is handed. The upload schema of a table
 * is its current schema in the warehouse.
 * </p>
 */
@Slf4j
public class LocalUploadSource implements UploadSource, Closeable {

    private static final String[] LOAD_FILE_EXTENSIONS = {"gz"};

    private final PathsConfig pathsConfig;

    private final FetchedSchema warehouseSchema;

    private final List<Path> tempDirs = new ArrayList<>();

    /**
     * Creates a source.
     *
     * @param pathsConfig data path configuration
     * @param warehouseSchema schema fetched from the warehouse
     */
    public LocalUploadSource(PathsConfig pathsConfig, FetchedSchema warehouseSchema) {
        this.pathsConfig = pathsConfig;
        this.warehouseSchema = warehouseSchema;
    }

    @Override
    public TableSchema getTableSchemaInUpload(String table) {
        return warehouseSchema.tableSchema(table);
    }

    @Override
    public TableSchema getTableSchemaInWarehouse(String table) {
        return warehouseSchema.tableSchema(table);
    }

    @Override
    public List<Path> downloadLoadFiles(String table) throws IOException {
        File dir = pathsConfig.getTableLoadDir(table).toFile();
        if (!dir.isDirectory()) {
            log.info("Table[{}] No load directory at {}", table, dir);
            return List.of();
        }
        List<File> sources = new ArrayList<>(FileUtils.listFiles(dir, LOAD_FILE_EXTENSIONS, false));
        sources.sort(Comparator.comparing(File::getName));

        Path tempDir = Files.createTempDirectory("stagemerge-" + table + "-");
        tempDirs.add(tempDir);
        List<Path> copies = new ArrayList<>(sources.size());
        for (File source : sources) {
            File copy = tempDir.resolve(source.getName()).toFile();
            FileUtils.copyFile(source, copy);
            copies.add(copy.toPath());
        }
        log.info("Table[{}] Materialized {} load files into {}", table, copies.size(), tempDir);
        return copies;
    }

    /**
     * Deletes the temporary directories created by this source.
     */
    @Override
    public void close() {
        for (Path tempDir : tempDirs) {
            if (!FileUtils.deleteQuietly(tempDir.toFile())) {
                log.warn("Could not delete temporary directory {}", tempDir);
            }
        }
        tempDirs.clear();
    }
}
