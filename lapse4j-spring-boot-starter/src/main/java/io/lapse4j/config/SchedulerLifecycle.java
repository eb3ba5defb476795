package io.lapse4j.config;

import io.lapse4j.Scheduler;
import io.lapse4j.TaskManager;
import org.springframework.context.SmartLifecycle;

/**
 * Bridges the task manager and scheduler start/stop lifecycle with the Spring container lifecycle.
 * The task manager starts first and stops last, so the scheduler never submits to a stopped pool.
 */
public class SchedulerLifecycle implements SmartLifecycle {
    private final TaskManager taskManager;
    private final Scheduler scheduler;
    private volatile boolean running = false;

    public SchedulerLifecycle(TaskManager taskManager, Scheduler scheduler) {
        this.taskManager = taskManager;
        this.scheduler = scheduler;
    }

    @Override
    public void start() {
        taskManager.start();
        scheduler.start();
        running = true;
    }

    @Override
    public void stop() {
        scheduler.stop();
        taskManager.stop();
        running = false;
    }

    @Override
    public boolean isRunning() {
        return running;
    }

    @Override
    public int getPhase() {
        return Integer.MAX_VALUE;
    }

    @Override
    public boolean isAutoStartup() {
        return true;
    }
}
