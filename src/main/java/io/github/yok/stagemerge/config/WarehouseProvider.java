package io.github.yok.stagemerge.config;

/**
 * Enumerates the warehouse dialects the engine can load into.
 *
 * <ul>
 * <li>POSTGRES: PostgreSQL</li>
 * </ul>
 */
public enum WarehouseProvider {
    // PostgreSQL dialect, COPY-based bulk ingest
    POSTGRES
}
