/**
 * Configuration models bound from {@code application.yml}, and the bean wiring of the CLI.
 */
package io.github.yok.stagemerge.config;
