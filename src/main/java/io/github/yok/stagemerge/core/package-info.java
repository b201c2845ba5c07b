/**
 * Core load workflow package.
 *
 * <p>
 * Stages load files into ephemeral tables, merges them into destination tables with
 * deduplication, resolves latest user traits from identify events, and sweeps staging tables left
 * by crashed runs. Every load runs in one transaction whose rollback is bounded by a timeout.
 * </p>
 *
 * <p>
 * Database-specific differences (type mapping, bulk copy, identifier rules) are delegated to
 * dialects in {@code db}.
 * </p>
 */
package io.github.yok.stagemerge.core;
