package io.github.yok.stagemerge.error;

import java.util.regex.Pattern;
import lombok.NonNull;
import lombok.Value;

/**
 * Pairs a failure-text pattern with the {@link JobErrorType} it indicates.
 */
@Value
public class JobError {

    // Semantic kind reported when the pattern matches
    @NonNull
    JobErrorType type;

    // Pattern searched for (not fully matched) in the failure text
    @NonNull
    Pattern format;

    /**
     * Creates a mapping from a regular expression.
     *
     * @param type semantic kind
     * @param regex regular expression searched for in failure text
     * @return mapping entry
     */
    public static JobError of(JobErrorType type, String regex) {
        return new JobError(type, Pattern.compile(regex));
    }

    /**
     * Returns whether the pattern occurs anywhere in the given text.
     *
     * @param text failure text
     * @return {@code true} when the pattern is found
     */
    public boolean matches(String text) {
        return format.matcher(text).find();
    }
}
