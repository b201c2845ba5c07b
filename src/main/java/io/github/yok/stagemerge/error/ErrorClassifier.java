package io.github.yok.stagemerge.error;

import com.google.common.collect.ImmutableList;
import java.util.List;
import org.apache.commons.lang3.exception.ExceptionUtils;

/**
 * Maps raw driver failure text to a {@link JobErrorType}.
 *
 * <p>
 * The mapping table is evaluated in order and the first matching entry wins. Patterns overlap
 * (a generic "relation does not exist" must not shadow the more specific resource-state entries
 * listed before it), so callers must supply the table in priority order.
 * </p>
 *
 * <p>
 * The classifier is a pure function: it has no side effects and is never consulted by the load
 * engine itself.
 * </p>
 */
public class ErrorClassifier {

    private final List<JobError> mappings;

    /**
     * Creates a classifier over an ordered mapping table.
     *
     * @param mappings ordered (pattern, kind) entries
     */
    public ErrorClassifier(List<JobError> mappings) {
        this.mappings = ImmutableList.copyOf(mappings);
    }

    /**
     * Classifies a failure message.
     *
     * @param message raw failure text; {@code null} is treated as unclassified
     * @return the kind of the first matching entry, or {@link JobErrorType#UNKNOWN}
     */
    public JobErrorType classify(String message) {
        if (message == null) {
            return JobErrorType.UNKNOWN;
        }
        for (JobError mapping : mappings) {
            if (mapping.matches(message)) {
                return mapping.getType();
            }
        }
        return JobErrorType.UNKNOWN;
    }

    /**
     * Classifies a failure by the messages of its whole cause chain.
     *
     * <p>
     * JDBC drivers often report the interesting text (e.g. an unknown host) on a nested cause, so
     * each throwable in the chain is rendered as {@code ClassName: message} and the chain is
     * classified as one text.
     * </p>
     *
     * @param failure failure to classify
     * @return classified kind
     */
    public JobErrorType classify(Throwable failure) {
        if (failure == null) {
            return JobErrorType.UNKNOWN;
        }
        StringBuilder text = new StringBuilder();
        for (Throwable t : ExceptionUtils.getThrowableList(failure)) {
            text.append(ExceptionUtils.getMessage(t)).append('\n');
        }
        return classify(text.toString());
    }

    /**
     * Returns the mapping table in evaluation order.
     *
     * @return immutable mapping list
     */
    public List<JobError> getMappings() {
        return mappings;
    }
}
