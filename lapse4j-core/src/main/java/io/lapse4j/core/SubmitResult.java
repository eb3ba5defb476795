package io.lapse4j.core;

/**
 * Outcome of submitting a subject's job. When {@code submitted} is false, {@code taskId} is the
 * task already active for the same subject and kind.
 */
public record SubmitResult(
        boolean submitted,
        String taskId
) {
    public static SubmitResult submittedResult(String taskId) {
        return new SubmitResult(true, taskId);
    }

    public static SubmitResult skipped(String activeTaskId) {
        return new SubmitResult(false, activeTaskId);
    }
}
