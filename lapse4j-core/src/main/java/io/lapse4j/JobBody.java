package io.lapse4j;

/**
 * The work of one task. Runs on a worker thread.
 *
 * <p>Bodies should call {@link TaskContext#isCancelled()} at natural boundaries (per item, per
 * chunk) and return promptly once it is true. Output produced before that point is left in place.
 */
@FunctionalInterface
public interface JobBody {

    /**
     * @return an optional result kept on the task record
     */
    Object run(TaskContext context) throws Exception;
}
