package io.lapse4j;

import io.lapse4j.core.CancelResult;
import io.lapse4j.core.JobKind;
import io.lapse4j.core.SubmitResult;
import io.lapse4j.core.TaskSnapshot;

import java.util.List;
import java.util.Optional;

/**
 * Registry and runner for asynchronous tasks.
 *
 * <p>Every submitted job gets a task record that can be observed through snapshots and cancelled
 * cooperatively. Snapshots may be read from any thread while tasks run.
 */
public interface TaskManager {
    void start();

    void stop();

    /**
     * Create a pending task and schedule {@code body} on the worker pool. Returns immediately.
     *
     * @return the new task id
     */
    String submit(JobKind kind, String name, JobBody body);

    /**
     * Like {@link #submit(JobKind, String, JobBody)}, but skipped when {@code subjectId} already has a
     * pending or running task of the same kind.
     */
    SubmitResult submitForSubject(JobKind kind, String subjectId, String name, JobBody body);

    /**
     * Request cancellation. A pending task is cancelled at once and its body never runs; a running
     * task only stops when its body observes the request.
     */
    CancelResult cancel(String taskId);

    Optional<TaskSnapshot> get(String taskId);

    /**
     * Pending and running tasks, oldest first.
     */
    List<TaskSnapshot> listActive();

    /**
     * Every retained task, including terminal ones not yet evicted, oldest first.
     */
    List<TaskSnapshot> listAll();

    /**
     * Evict terminal tasks whose retention period has passed.
     *
     * @return number of evicted tasks
     */
    int gc();
}
