package io.github.yok.stagemerge.config;

import java.nio.file.Path;
import java.nio.file.Paths;
import lombok.Data;
import org.apache.commons.lang3.StringUtils;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

/**
 * Configuration class that reads the {@code data-path} property and composes the directory the
 * CLI reads load files from.
 *
 * <p>
 * Load files of table {@code t} are expected as {@code <data-path>/load/t/*.gz}.
 * </p>
 */
@Component
@ConfigurationProperties
@Data
public class PathsConfig {

    // Base path that serves as the application's root data directory
    private String dataPath;

    /**
     * Returns the absolute path for the data loading directory.
     *
     * @return the path to the load directory
     * @throws IllegalStateException if {@code dataPath} has not been set
     */
    public String getLoad() {
        if (StringUtils.isBlank(dataPath)) {
            throw new IllegalStateException(
                    "data-path is not configured. Please set 'data-path' in application.yml.");
        }
        return dataPath.endsWith("/") ? dataPath + "load" : dataPath + "/load";
    }

    /**
     * Returns the directory holding the load files of one table.
     *
     * @param table destination table
     * @return table load directory
     */
    public Path getTableLoadDir(String table) {
        return Paths.get(getLoad(), table);
    }
}
