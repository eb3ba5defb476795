package io.lapse4j.core;

/**
 * Thrown from inside a job body to stop at a cancellation check. The task ends as
 * {@link TaskStatus#CANCELLED} without an error.
 */
public class TaskCancelledException extends RuntimeException {

    public TaskCancelledException(String taskId) {
        super("Task " + taskId + " was cancelled");
    }
}
