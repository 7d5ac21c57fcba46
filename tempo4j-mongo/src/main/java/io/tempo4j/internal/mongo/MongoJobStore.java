package io.tempo4j.internal.mongo;

import com.mongodb.client.result.UpdateResult;
import io.tempo4j.core.ExecutionStatus;
import io.tempo4j.core.Job;
import io.tempo4j.core.JobConfigurationException;
import io.tempo4j.core.JobExecution;
import io.tempo4j.core.JobStatistics;
import io.tempo4j.core.JobStatus;
import io.tempo4j.core.JobStore;
import io.tempo4j.core.Schedule;
import io.tempo4j.core.ScheduleState;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.data.domain.Sort;
import org.springframework.data.mongodb.core.MongoTemplate;
import org.springframework.data.mongodb.core.query.Criteria;
import org.springframework.data.mongodb.core.query.Query;
import org.springframework.data.mongodb.core.query.Update;

import java.time.Duration;
import java.time.Instant;
import java.util.Collection;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * MongoDB persistence layer for jobs and their executions.
 *
 * <p>Jobs live in {@code scheduled_jobs}, executions in {@code job_executions}. Durations are stored as
 * milliseconds and the schedule is flattened into {@code cronExpression}/{@code intervalMillis}/{@code timezone}.
 * Uniqueness of job names relies on the {@code ux_job_name} index (see the starter's index config).
 */
public class MongoJobStore implements JobStore {

    private static final List<String> TERMINAL_STATUSES =
            List.of(ExecutionStatus.SUCCESS.name(), ExecutionStatus.FAILED.name());

    private final MongoTemplate mongoTemplate;

    public MongoJobStore(MongoTemplate mongoTemplate) {
        this.mongoTemplate = Objects.requireNonNull(mongoTemplate, "mongoTemplate must not be null");
    }

    // ---- jobs

    @Override
    public List<Job> listActiveJobs() {
        Query q = new Query(Criteria.where("status").is(JobStatus.ACTIVE.name()));
        q.with(Sort.by(Sort.Order.asc("nextExecution"), Sort.Order.asc("name")));
        return mongoTemplate.find(q, JobDocument.class).stream().map(MongoJobStore::toJob).toList();
    }

    @Override
    public List<Job> listJobs() {
        Query q = new Query().with(Sort.by(Sort.Order.asc("name")));
        return mongoTemplate.find(q, JobDocument.class).stream().map(MongoJobStore::toJob).toList();
    }

    @Override
    public List<Job> listJobs(JobStatus status, String jobType, int limit) {
        Query q = new Query();
        if (status != null) {
            q.addCriteria(Criteria.where("status").is(status.name()));
        }
        if (jobType != null) {
            q.addCriteria(Criteria.where("jobType").is(jobType));
        }
        q.with(Sort.by(Sort.Order.asc("name"))).limit(limit);
        return mongoTemplate.find(q, JobDocument.class).stream().map(MongoJobStore::toJob).toList();
    }

    @Override
    public Optional<Job> getJob(String jobId) {
        if (jobId == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(mongoTemplate.findById(jobId, JobDocument.class)).map(MongoJobStore::toJob);
    }

    @Override
    public Optional<Job> findJobByName(String name) {
        if (name == null) {
            return Optional.empty();
        }
        Query q = new Query(Criteria.where("name").is(name));
        return Optional.ofNullable(mongoTemplate.findOne(q, JobDocument.class)).map(MongoJobStore::toJob);
    }

    @Override
    public String createJob(Job job) {
        Objects.requireNonNull(job, "job must not be null");
        try {
            return mongoTemplate.insert(toDocument(job)).getId();
        } catch (DuplicateKeyException e) {
            throw new JobConfigurationException("Job with name '" + job.name() + "' already exists", e);
        }
    }

    @Override
    public boolean updateJob(Job job) {
        Objects.requireNonNull(job, "job must not be null");
        Objects.requireNonNull(job.id(), "job id must not be null");

        JobDocument doc = toDocument(job);
        Update u = new Update()
                .set("name", doc.getName())
                .set("description", doc.getDescription())
                .set("jobType", doc.getJobType())
                .set("cronExpression", doc.getCronExpression())
                .set("intervalMillis", doc.getIntervalMillis())
                .set("timezone", doc.getTimezone())
                .set("status", doc.getStatus() == null ? null : doc.getStatus().name())
                .set("timeoutMillis", doc.getTimeoutMillis())
                .set("retryCount", doc.getRetryCount())
                .set("retryDelayMillis", doc.getRetryDelayMillis())
                .set("config", doc.getConfig())
                .set("updatedAt", doc.getUpdatedAt());
        try {
            return matched(mongoTemplate.updateFirst(byId(job.id()), u, JobDocument.class));
        } catch (DuplicateKeyException e) {
            throw new JobConfigurationException("Job with name '" + job.name() + "' already exists", e);
        }
    }

    @Override
    public boolean updateStatus(String jobId, JobStatus status, Instant updatedAt) {
        Objects.requireNonNull(status, "status must not be null");
        Update u = new Update()
                .set("status", status.name())
                .set("updatedAt", updatedAt);
        return matched(mongoTemplate.updateFirst(byId(jobId), u, JobDocument.class));
    }

    @Override
    public boolean updateNextExecution(String jobId, Instant nextExecution, Instant updatedAt) {
        Update u = new Update()
                .set("nextExecution", nextExecution)
                .set("updatedAt", updatedAt);
        return matched(mongoTemplate.updateFirst(byId(jobId), u, JobDocument.class));
    }

    @Override
    public boolean updateScheduleState(String jobId, ScheduleState state, Instant updatedAt) {
        Objects.requireNonNull(state, "state must not be null");
        Update u = new Update()
                .set("lastExecution", state.lastExecution())
                .set("nextExecution", state.nextExecution())
                .set("retryAttempt", state.retryAttempt())
                .set("retryOf", state.retryOf())
                .set("updatedAt", updatedAt);
        return matched(mongoTemplate.updateFirst(byId(jobId), u, JobDocument.class));
    }

    @Override
    public boolean deleteJob(String jobId) {
        if (jobId == null) {
            return false;
        }
        long deleted = mongoTemplate.remove(byId(jobId), JobDocument.class).getDeletedCount();
        mongoTemplate.remove(new Query(Criteria.where("jobId").is(jobId)), JobExecutionDocument.class);
        return deleted > 0;
    }

    // ---- executions

    @Override
    public String createExecution(JobExecution execution) {
        Objects.requireNonNull(execution, "execution must not be null");
        return mongoTemplate.insert(toDocument(execution)).getId();
    }

    @Override
    public boolean updateExecution(JobExecution execution) {
        Objects.requireNonNull(execution, "execution must not be null");

        Query q = new Query(
                Criteria.where("_id").is(execution.id())
                        // terminal records are immutable
                        .and("status").nin(TERMINAL_STATUSES)
        );
        Update u = new Update()
                .set("status", execution.status().name())
                .set("startedAt", execution.startedAt())
                .set("completedAt", execution.completedAt())
                .set("result", execution.result())
                .set("errorMessage", execution.errorMessage());
        return matched(mongoTemplate.updateFirst(q, u, JobExecutionDocument.class));
    }

    @Override
    public List<JobExecution> listExecutions(String jobId, int limit) {
        Query q = new Query(Criteria.where("jobId").is(jobId))
                .with(Sort.by(Sort.Order.desc("createdAt")))
                .limit(Math.max(1, limit));
        return mongoTemplate.find(q, JobExecutionDocument.class).stream().map(MongoJobStore::toExecution).toList();
    }

    @Override
    public List<JobExecution> findExecutionsByStatus(Collection<ExecutionStatus> statuses) {
        Objects.requireNonNull(statuses, "statuses must not be null");
        if (statuses.isEmpty()) {
            return List.of();
        }
        List<String> names = statuses.stream().map(ExecutionStatus::name).toList();
        Query q = new Query(Criteria.where("status").in(names))
                .with(Sort.by(Sort.Order.asc("createdAt")));
        return mongoTemplate.find(q, JobExecutionDocument.class).stream().map(MongoJobStore::toExecution).toList();
    }

    @Override
    public long deleteExecutionsCompletedBefore(Instant cutoff) {
        Objects.requireNonNull(cutoff, "cutoff must not be null");
        Query q = new Query(
                Criteria.where("status").in(TERMINAL_STATUSES)
                        .and("completedAt").lt(cutoff)
        );
        return mongoTemplate.remove(q, JobExecutionDocument.class).getDeletedCount();
    }

    @Override
    public JobStatistics statistics() {
        long totalJobs = mongoTemplate.count(new Query(), JobDocument.class);
        long activeJobs = countJobs(JobStatus.ACTIVE);
        long pausedJobs = countJobs(JobStatus.PAUSED);

        long totalExecutions = mongoTemplate.count(new Query(), JobExecutionDocument.class);
        long successful = countExecutions(List.of(ExecutionStatus.SUCCESS.name()));
        long failed = countExecutions(List.of(ExecutionStatus.FAILED.name()));
        long inFlight = countExecutions(List.of(ExecutionStatus.PENDING.name(), ExecutionStatus.RUNNING.name()));

        return new JobStatistics(totalJobs, activeJobs, pausedJobs, totalExecutions, successful, failed, inFlight);
    }

    private long countJobs(JobStatus status) {
        return mongoTemplate.count(new Query(Criteria.where("status").is(status.name())), JobDocument.class);
    }

    private long countExecutions(List<String> statuses) {
        return mongoTemplate.count(new Query(Criteria.where("status").in(statuses)), JobExecutionDocument.class);
    }

    private static Query byId(String id) {
        Objects.requireNonNull(id, "id must not be null");
        return new Query(Criteria.where("_id").is(id));
    }

    private static boolean matched(UpdateResult result) {
        return result.getMatchedCount() > 0;
    }

    // ---- mapping

    static JobDocument toDocument(Job job) {
        JobDocument doc = new JobDocument();
        doc.setId(job.id());
        doc.setName(job.name());
        doc.setDescription(job.description());
        doc.setJobType(job.jobType());

        Schedule schedule = job.schedule();
        if (schedule != null) {
            doc.setCronExpression(schedule.cronExpression());
            doc.setIntervalMillis(schedule.interval() == null ? null : schedule.interval().toMillis());
            doc.setTimezone(schedule.timezone());
        }

        doc.setStatus(job.status());
        doc.setTimeoutMillis(job.timeout() == null ? 0 : job.timeout().toMillis());
        doc.setRetryCount(job.retryCount());
        doc.setRetryDelayMillis(job.retryDelay() == null ? 0 : job.retryDelay().toMillis());
        doc.setConfig(job.config());
        doc.setLastExecution(job.lastExecution());
        doc.setNextExecution(job.nextExecution());
        doc.setRetryAttempt(job.retryAttempt());
        doc.setRetryOf(job.retryOf());
        doc.setCreatedAt(job.createdAt());
        doc.setUpdatedAt(job.updatedAt());
        return doc;
    }

    /**
     * Reverse of {@link #toDocument(Job)}. Never validates, so a bad stored schedule surfaces at evaluation time.
     */
    static Job toJob(JobDocument doc) {
        Schedule schedule = new Schedule(
                doc.getCronExpression(),
                doc.getIntervalMillis() == null ? null : Duration.ofMillis(doc.getIntervalMillis()),
                doc.getTimezone()
        );
        return new Job(
                doc.getId(),
                doc.getName(),
                doc.getDescription(),
                doc.getJobType(),
                schedule,
                doc.getStatus() == null ? JobStatus.ACTIVE : doc.getStatus(),
                Duration.ofMillis(doc.getTimeoutMillis()),
                doc.getRetryCount(),
                Duration.ofMillis(doc.getRetryDelayMillis()),
                doc.getConfig(),
                doc.getLastExecution(),
                doc.getNextExecution(),
                doc.getRetryAttempt(),
                doc.getRetryOf(),
                doc.getCreatedAt(),
                doc.getUpdatedAt()
        );
    }

    static JobExecutionDocument toDocument(JobExecution execution) {
        JobExecutionDocument doc = new JobExecutionDocument();
        doc.setId(execution.id());
        doc.setJobId(execution.jobId());
        doc.setStatus(execution.status());
        doc.setRetryAttempt(execution.retryAttempt());
        doc.setTriggeredBy(execution.triggeredBy());
        doc.setCreatedAt(execution.createdAt());
        doc.setStartedAt(execution.startedAt());
        doc.setCompletedAt(execution.completedAt());
        doc.setResult(execution.result());
        doc.setErrorMessage(execution.errorMessage());
        return doc;
    }

    static JobExecution toExecution(JobExecutionDocument doc) {
        return new JobExecution(
                doc.getId(),
                doc.getJobId(),
                doc.getStatus(),
                doc.getRetryAttempt(),
                doc.getTriggeredBy(),
                doc.getCreatedAt(),
                doc.getStartedAt(),
                doc.getCompletedAt(),
                doc.getResult(),
                doc.getErrorMessage()
        );
    }
}
