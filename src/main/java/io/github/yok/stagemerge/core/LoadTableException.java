package io.github.yok.stagemerge.core;

import lombok.Getter;

/**
 * Signals that loading a table failed and the enclosing transaction was rolled back.
 *
 * <p>
 * {@link #getStage()} names the step at which the failure happened; it is {@code null} for
 * failures that occurred before the load transaction was opened.
 * </p>
 */
@Getter
public class LoadTableException extends Exception {

    private static final long serialVersionUID = 1L;

    private final String tableName;

    private final LoadStage stage;

    /**
     * Creates an exception.
     *
     * @param tableName table being loaded
     * @param stage failing stage, or {@code null}
     * @param cause underlying failure
     */
    public LoadTableException(String tableName, LoadStage stage, Throwable cause) {
        super(buildMessage(tableName, stage, cause), cause);
        this.tableName = tableName;
        this.stage = stage;
    }

    private static String buildMessage(String tableName, LoadStage stage, Throwable cause) {
        StringBuilder sb = new StringBuilder("Loading table ").append(tableName).append(" failed");
        if (stage != null) {
            sb.append(" at stage ").append(stage.getTag());
        }
        if (cause != null && cause.getMessage() != null) {
            sb.append(": ").append(cause.getMessage());
        }
        return sb.toString();
    }
}
