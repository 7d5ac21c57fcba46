package io.tempo4j.config;

import io.tempo4j.JobScheduler;
import org.springframework.context.SmartLifecycle;

/**
 * Bridges scheduler start/stop with the Spring container lifecycle.
 *
 * <p>Runs in the last phase, so handlers and the store are fully initialized before the first poll and the
 * scheduler drains before they are torn down.
 */
public class SchedulerLifecycle implements SmartLifecycle {
    private final JobScheduler scheduler;

    public SchedulerLifecycle(JobScheduler scheduler) {
        this.scheduler = scheduler;
    }

    @Override
    public void start() {
        scheduler.start();
    }

    @Override
    public void stop() {
        scheduler.stop();
    }

    @Override
    public boolean isRunning() {
        return scheduler.isRunning();
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
