package io.lapse4j.core;

/**
 * Result of a cancellation request.
 *
 * found    : a task with the id exists
 * accepted : the task was not terminal, so the request was recorded
 */
public record CancelResult(
        boolean found,
        boolean accepted
) {

    public static CancelResult notFound() {
        return new CancelResult(false, false);
    }

    public static CancelResult alreadyFinished() {
        return new CancelResult(true, false);
    }

    public static CancelResult acceptedResult() {
        return new CancelResult(true, true);
    }
}
