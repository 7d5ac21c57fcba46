package io.tempo4j.core;

import java.time.Instant;
import java.util.Collection;
import java.util.List;
import java.util.Optional;

/**
 * Durable storage for job definitions and their run history. The store is the only state that survives a
 * restart; the scheduler keeps nothing else it cannot rebuild from here.
 *
 * <p>Implementations must make every single-record write atomic. They do not need to provide cross-process
 * locking: only one scheduler may poll a store at a time.
 */
public interface JobStore {

    // ---- jobs

    List<Job> listActiveJobs();

    List<Job> listJobs();

    /**
     * Jobs ordered by name, optionally filtered.
     *
     * @param status  null for any status
     * @param jobType null for any job type
     * @param limit   maximum number of jobs returned, positive
     */
    List<Job> listJobs(JobStatus status, String jobType, int limit);

    Optional<Job> getJob(String jobId);

    Optional<Job> findJobByName(String name);

    /**
     * @return the id of the stored job
     * @throws JobConfigurationException if a job with the same name already exists
     */
    String createJob(Job job);

    /**
     * Replace a job definition. Returns false when the job no longer exists.
     */
    boolean updateJob(Job job);

    boolean updateStatus(String jobId, JobStatus status, Instant updatedAt);

    boolean updateNextExecution(String jobId, Instant nextExecution, Instant updatedAt);

    /**
     * Write the scheduler-owned fields only, leaving the definition and status untouched.
     */
    boolean updateScheduleState(String jobId, ScheduleState state, Instant updatedAt);

    /**
     * Delete a job together with its execution history.
     */
    boolean deleteJob(String jobId);

    // ---- executions

    String createExecution(JobExecution execution);

    /**
     * Persist the mutable fields of an execution. Records that are already terminal are never changed;
     * in that case the method returns false.
     */
    boolean updateExecution(JobExecution execution);

    /**
     * Most recent first.
     */
    List<JobExecution> listExecutions(String jobId, int limit);

    List<JobExecution> findExecutionsByStatus(Collection<ExecutionStatus> statuses);

    /**
     * Remove terminal executions completed strictly before {@code cutoff}.
     *
     * @return number of deleted records
     */
    long deleteExecutionsCompletedBefore(Instant cutoff);

    JobStatistics statistics();
}
