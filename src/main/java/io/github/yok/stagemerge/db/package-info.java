/**
 * SQL execution and warehouse dialect package.
 *
 * <p>
 * {@link io.github.yok.stagemerge.db.SqlExecutor} runs statements either inside a load
 * transaction or on pooled auto-commit connections. Dialects absorb database-specific
 * differences: identifier quoting, type mapping, bulk copy and failure patterns.
 * </p>
 *
 * <p>
 * Database-specific implementations are located in subpackage {@code postgresql}.
 * </p>
 */
package io.github.yok.stagemerge.db;
