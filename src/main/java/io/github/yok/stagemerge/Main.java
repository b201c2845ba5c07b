package io.github.yok.stagemerge;

import io.github.yok.stagemerge.config.PathsConfig;
import io.github.yok.stagemerge.config.WarehouseProperties;
import io.github.yok.stagemerge.core.FetchedSchema;
import io.github.yok.stagemerge.core.LoadTableException;
import io.github.yok.stagemerge.core.PostgresWarehouse;
import io.github.yok.stagemerge.core.UserTablesLoadResult;
import io.github.yok.stagemerge.error.ErrorClassifier;
import io.github.yok.stagemerge.source.LocalUploadSource;
import io.github.yok.stagemerge.util.ErrorHandler;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.stream.Collectors;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.CommandLineRunner;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * Provides the application entry point.
 *
 * <p>
 * Argument specification:
 * </p>
 * <ul>
 * <li>{@code --recover} or {@code -r}: only drop staging tables left by a crashed run.</li>
 * <li>{@code --load [t1,t2,…]} or {@code -l [t1,t2,…]}: load the listed tables from
 * {@code <data-path>/load/<table>/*.gz}.</li>
 * <li>{@code --users} or {@code -u}: load {@code identifies}, then merge {@code users}.</li>
 * </ul>
 *
 * <p>
 * Crash recovery always runs first and staging cleanup always runs last. Load failures are
 * reported with the error kind resolved by {@link ErrorClassifier}.
 * </p>
 */
@Slf4j
@SpringBootApplication
@RequiredArgsConstructor
public class Main implements CommandLineRunner {

    private final PathsConfig pathsConfig;
    private final WarehouseProperties warehouseProperties;
    private final PostgresWarehouse warehouse;
    private final ErrorClassifier errorClassifier;

    /**
     * Bootstraps the application.
     *
     * @param args command-line arguments
     */
    public static void main(String[] args) {
        SpringApplication app = new SpringApplication(Main.class);
        app.setAddCommandLineProperties(false);
        app.run(args);
    }

    /**
     * Entry point invoked after Spring Boot starts.
     *
     * @param args command-line arguments array
     */
    @Override
    public void run(String... args) {
        log.info("Application started. Args: {}", Arrays.toString(args));

        // Parse CLI arguments
        List<String> tables = new ArrayList<>();
        boolean users = false;
        boolean recoverOnly = false;
        for (int i = 0; i < args.length; i++) {
            switch (args[i]) {
                case "--recover":
                case "-r":
                    recoverOnly = true;
                    break;
                case "--load":
                case "-l":
                    if (i + 1 < args.length) {
                        tables = Arrays.stream(args[++i].split(",")).map(String::trim)
                                .filter(s -> !s.isEmpty()).collect(Collectors.toList());
                    }
                    break;
                case "--users":
                case "-u":
                    users = true;
                    break;
                default:
                    log.warn("Unknown argument: {}", args[i]);
            }
        }
        if (!recoverOnly && tables.isEmpty() && !users) {
            log.warn("Nothing to load; running crash recovery only");
            recoverOnly = true;
        }

        log.info("Namespace: {}, Tables: {}, Users: {}, Recover only: {}",
                warehouseProperties.getNamespace(), tables, users, recoverOnly);

        List<String> failed;
        try {
            warehouse.testConnection();
            if (!warehouse.crashRecover()) {
                log.warn("Crash recovery could not drop every dangling staging table");
            }
            if (recoverOnly) {
                return;
            }
            failed = load(tables, users);
        } catch (Exception e) {
            ErrorHandler.errorAndExit("Fatal error", e, errorClassifier.classify(e));
            return;
        }
        if (!failed.isEmpty()) {
            ErrorHandler.errorAndExit("Load failed for tables " + failed);
        }
    }

    private List<String> load(List<String> tables, boolean users) throws Exception {
        List<String> failed = new ArrayList<>();
        FetchedSchema schema = warehouse.fetchSchema();
        try (LocalUploadSource upload = new LocalUploadSource(pathsConfig, schema)) {
            for (String table : tables) {
                try {
                    warehouse.loadTable(upload, table);
                    log.info("Table[{}] loaded", table);
                } catch (LoadTableException e) {
                    log.error(ErrorHandler.describe("Table load failed", e,
                            errorClassifier.classify(e)), e);
                    failed.add(table);
                }
            }
            if (users) {
                UserTablesLoadResult result = warehouse.loadUserTables(upload);
                for (String table : result.getTables()) {
                    result.errorFor(table).ifPresentOrElse(e -> {
                        log.error(ErrorHandler.describe("Table load failed", e,
                                errorClassifier.classify(e)), e);
                        failed.add(table);
                    }, () -> log.info("Table[{}] loaded", table));
                }
            }
        } finally {
            warehouse.cleanup();
        }
        return failed;
    }
}
