package io.tempo4j;

import io.tempo4j.core.Job;
import io.tempo4j.core.JobExecution;
import io.tempo4j.core.JobSpec;
import io.tempo4j.core.JobStatus;
import io.tempo4j.core.SchedulerStatus;

import java.util.List;
import java.util.Optional;

/**
 * Main scheduler API.
 *
 * <p>Jobs are stored durably and polled; every state change made here is picked up by the next poll tick.
 * There is no path that runs a job directly, so "trigger now" and regular runs share the same mutual-exclusion
 * and bookkeeping guarantees.
 *
 * <p>Typical usage:
 * <pre>{@code
 * scheduler.start();
 *
 * String id = scheduler.create("nightly-fetch", "paper_fetch")
 *       .cron("0 2 * * *")
 *       .config("query", "transformers")
 *       .timeout(Duration.ofMinutes(30))
 *       .retries(2, Duration.ofMinutes(5))
 *       .save();
 *
 * scheduler.triggerJob(id);
 * scheduler.stop();
 * }</pre>
 */
public interface JobScheduler {
    void start();

    /**
     * Stop polling and wait (bounded) for in-flight executions.
     */
    void stop();

    boolean isRunning();

    JobBuilder create(String name, String jobType);

    /**
     * @return id of the created job
     * @throws io.tempo4j.core.JobConfigurationException if the spec is invalid or the name is taken
     */
    String createJob(JobSpec spec);

    /**
     * Replace the definition of an existing job. Run history and pending retries are kept unless the schedule
     * changes, in which case the next run is recomputed from the new schedule.
     *
     * @return false if no job has this id
     * @throws io.tempo4j.core.JobConfigurationException if the spec is invalid or the name belongs to another job
     */
    boolean updateJob(String jobId, JobSpec spec);

    boolean pauseJob(String jobId);

    boolean resumeJob(String jobId);

    /**
     * Make the job due now; it runs on the next poll tick unless it is already running.
     */
    boolean triggerJob(String jobId);

    boolean deleteJob(String jobId);

    Optional<Job> getJob(String jobId);

    List<Job> listJobs();

    /**
     * @param status  null for any status
     * @param jobType null for any job type
     * @param limit   maximum number of jobs returned
     * @throws IllegalArgumentException if {@code limit} is not positive
     */
    List<Job> listJobs(JobStatus status, String jobType, int limit);

    List<JobExecution> listExecutions(String jobId, int limit);

    SchedulerStatus getStatus();
}
