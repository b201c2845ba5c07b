package io.github.yok.stagemerge.util;

import io.github.yok.stagemerge.core.LoadTableException;
import io.github.yok.stagemerge.error.JobErrorType;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.exception.ExceptionUtils;

/**
 * Reports load failures of the CLI.
 *
 * <p>
 * A report names the error kind resolved by the classifier and, when the failure is a
 * {@link LoadTableException}, the table and the load stage that failed:
 * </p>
 *
 * <pre>
 * Fatal error [PERMISSION] table=tracks stage=dedup_deletion: SQLException: permission denied
 * </pre>
 *
 * <p>
 * Reports are logged and echoed to {@code System.err}. Ending the process is left to the caller.
 * Tests can make a report throw {@link IllegalStateException} instead through
 * {@link #disableExitForCurrentThread()}.
 * </p>
 */
@Slf4j
public final class ErrorHandler {

    private static final ThreadLocal<Boolean> EXIT_DISABLED =
            ThreadLocal.withInitial(() -> Boolean.FALSE);

    private ErrorHandler() {}

    public static void disableExitForCurrentThread() {
        EXIT_DISABLED.set(Boolean.TRUE);
    }

    public static void restoreExitForCurrentThread() {
        EXIT_DISABLED.remove();
    }

    /**
     * Formats a classified failure.
     *
     * @param headline leading text, e.g. {@code "Fatal error"}
     * @param cause failure, searched for a {@link LoadTableException} along its cause chain
     * @param kind classification of {@code cause}
     * @return single-line report
     */
    public static String describe(String headline, Throwable cause, JobErrorType kind) {
        StringBuilder sb = new StringBuilder(headline).append(" [").append(kind).append(']');
        LoadTableException failedLoad =
                ExceptionUtils.throwableOfType(cause, LoadTableException.class);
        if (failedLoad != null) {
            sb.append(" table=").append(failedLoad.getTableName());
            if (failedLoad.getStage() != null) {
                sb.append(" stage=").append(failedLoad.getStage().getTag());
            }
        }
        return sb.append(": ").append(ExceptionUtils.getRootCauseMessage(cause)).toString();
    }

    /**
     * Reports a fatal classified failure.
     *
     * @param headline leading text of the report
     * @param cause failure
     * @param kind classification of {@code cause}
     * @throws IllegalStateException if exit is disabled for the current thread
     */
    public static void errorAndExit(String headline, Throwable cause, JobErrorType kind) {
        String report = describe(headline, cause, kind);
        log.error(report, cause);
        if (Boolean.TRUE.equals(EXIT_DISABLED.get())) {
            throw new IllegalStateException(report, cause);
        }
        System.err.println("ERROR: " + report);
    }

    /**
     * Reports a fatal failure that has no single cause, such as a summary of failed tables.
     *
     * @param message report
     * @throws IllegalStateException if exit is disabled for the current thread
     */
    public static void errorAndExit(String message) {
        log.error(message);
        if (Boolean.TRUE.equals(EXIT_DISABLED.get())) {
            throw new IllegalStateException(message);
        }
        System.err.println("ERROR: " + message);
    }
}
