/**
 * Root package of StageMerge.
 *
 * <p>
 * Provides a CLI/library that bulk-loads gzip CSV load files into PostgreSQL warehouse tables
 * through staging tables, with deduplicating merge and crash recovery.
 * </p>
 *
 * <p>
 * Main responsibilities are separated into the following subpackages:
 * </p>
 *
 * <ul>
 * <li>{@code io.github.yok.stagemerge.config}: configuration models and bean wiring</li>
 * <li>{@code io.github.yok.stagemerge.core}: load, merge and recovery workflow</li>
 * <li>{@code io.github.yok.stagemerge.db}: SQL execution and warehouse dialects</li>
 * <li>{@code io.github.yok.stagemerge.parser}: load file decoding</li>
 * <li>{@code io.github.yok.stagemerge.error}: error classification</li>
 * <li>{@code io.github.yok.stagemerge.source}: upload-side collaborators</li>
 * </ul>
 */
package io.github.yok.stagemerge;
