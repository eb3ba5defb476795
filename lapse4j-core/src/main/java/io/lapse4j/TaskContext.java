package io.lapse4j;

import io.lapse4j.core.TaskCancelledException;

/**
 * Capability handed to a running {@link JobBody}: progress reporting and the cancellation check.
 * Pass it down to whatever code does the actual work.
 */
public interface TaskContext {

    String taskId();

    /**
     * Report item progress. With {@code total > 0} progress becomes {@code 100 * current / total};
     * progress never goes backwards while the task runs.
     */
    void report(long current, long total, String message);

    /**
     * Update the status line only.
     */
    void message(String message);

    /**
     * Non-blocking read of the cancellation flag.
     */
    boolean isCancelled();

    default void throwIfCancelled() {
        if (isCancelled()) {
            throw new TaskCancelledException(taskId());
        }
    }
}
