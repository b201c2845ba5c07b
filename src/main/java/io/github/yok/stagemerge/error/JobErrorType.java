package io.github.yok.stagemerge.error;

/**
 * Semantic error kinds reported to the caller for retry and alerting decisions.
 */
public enum JobErrorType {
    // Host, database or relation is missing, or the database cannot accept writes right now
    RESOURCE_NOT_FOUND,
    // Connection refused, authentication failure or missing privileges
    PERMISSION,
    // Destination table would exceed the dialect's maximum column count
    COLUMN_COUNT,
    // No pattern matched
    UNKNOWN
}
