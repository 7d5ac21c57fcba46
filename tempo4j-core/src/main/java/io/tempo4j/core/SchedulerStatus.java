package io.tempo4j.core;

import java.time.Duration;

public record SchedulerStatus(
        boolean running,
        int activeWorkerCount,
        Duration checkInterval,
        JobStatistics statistics
) {
}
