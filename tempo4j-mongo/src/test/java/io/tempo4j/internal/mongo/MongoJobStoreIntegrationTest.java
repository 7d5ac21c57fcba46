package io.tempo4j.internal.mongo;

import com.mongodb.client.MongoClients;
import io.tempo4j.config.SchedulerProperties;
import io.tempo4j.core.ExecutionStatus;
import io.tempo4j.core.Job;
import io.tempo4j.core.JobConfigurationException;
import io.tempo4j.core.JobExecution;
import io.tempo4j.core.JobHandlerRegistry;
import io.tempo4j.core.JobStatistics;
import io.tempo4j.core.JobStatus;
import io.tempo4j.core.Schedule;
import io.tempo4j.core.ScheduleState;
import io.tempo4j.internal.PollingScheduler;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.data.domain.Sort;
import org.springframework.data.mongodb.core.MongoTemplate;
import org.springframework.data.mongodb.core.index.Index;
import org.testcontainers.containers.MongoDBContainer;
import org.testcontainers.junit.jupiter.Container;
import org.testcontainers.junit.jupiter.Testcontainers;

import java.time.Duration;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.EnumSet;
import java.util.List;
import java.util.Map;
import java.util.concurrent.TimeUnit;
import java.util.function.BooleanSupplier;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

@Testcontainers(disabledWithoutDocker = true)
class MongoJobStoreIntegrationTest {

    @Container
    static final MongoDBContainer MONGO = new MongoDBContainer("mongo:7.0");

    // Mongo stores millisecond precision
    private static final Instant T0 = Instant.now().truncatedTo(ChronoUnit.MILLIS);

    private MongoTemplate mongoTemplate;
    private MongoJobStore jobStore;

    @BeforeEach
    void setUp() {
        mongoTemplate = new MongoTemplate(MongoClients.create(MONGO.getReplicaSetUrl()), "tempo4j_test");
        mongoTemplate.dropCollection(JobDocument.class);
        mongoTemplate.dropCollection(JobExecutionDocument.class);
        mongoTemplate.indexOps(JobDocument.class)
                .ensureIndex(new Index().on("name", Sort.Direction.ASC).unique().named("ux_job_name"));
        jobStore = new MongoJobStore(mongoTemplate);
    }

    @AfterEach
    void tearDown() {
        mongoTemplate.dropCollection(JobDocument.class);
        mongoTemplate.dropCollection(JobExecutionDocument.class);
    }

    @Test
    void jobRoundTripsThroughDocument() {
        Job job = newJob("job-1", "fetch", Schedule.cron("0 */2 * * *", "Asia/Taipei"));

        assertEquals("job-1", jobStore.createJob(job));

        Job loaded = jobStore.getJob("job-1").orElseThrow();
        assertEquals(job, loaded);
        assertEquals(job, jobStore.findJobByName("fetch").orElseThrow());
    }

    @Test
    void duplicateNameIsRejected() {
        jobStore.createJob(newJob("job-1", "fetch", Schedule.everyHours(2)));

        assertThrows(JobConfigurationException.class,
                () -> jobStore.createJob(newJob("job-2", "fetch", Schedule.everyHours(2))));
    }

    @Test
    void targetedUpdatesLeaveOtherFieldsUntouched() {
        jobStore.createJob(newJob("job-1", "fetch", Schedule.everyHours(2)));

        assertTrue(jobStore.updateScheduleState("job-1",
                ScheduleState.retry(T0, T0.plusSeconds(60), 1, "exec-0"), T0.plusSeconds(1)));
        assertTrue(jobStore.updateStatus("job-1", JobStatus.PAUSED, T0.plusSeconds(2)));

        Job loaded = jobStore.getJob("job-1").orElseThrow();
        assertEquals(JobStatus.PAUSED, loaded.status());
        assertEquals(T0, loaded.lastExecution());
        assertEquals(T0.plusSeconds(60), loaded.nextExecution());
        assertEquals(1, loaded.retryAttempt());
        assertEquals("exec-0", loaded.retryOf());
        assertEquals(Duration.ofHours(2), loaded.schedule().interval());
        assertTrue(jobStore.listActiveJobs().isEmpty());

        assertTrue(jobStore.updateScheduleState("job-1", ScheduleState.advanced(T0, null), T0.plusSeconds(3)));
        Job cleared = jobStore.getJob("job-1").orElseThrow();
        assertNull(cleared.nextExecution());
        assertNull(cleared.retryOf());

        assertFalse(jobStore.updateNextExecution("missing", T0, T0));
    }

    @Test
    void updateJobReplacesDefinitionButKeepsScheduleState() {
        jobStore.createJob(newJob("job-1", "fetch", Schedule.everyHours(2)));
        jobStore.updateScheduleState("job-1", ScheduleState.retry(T0, T0.plusSeconds(60), 1, "exec-0"), T0);

        Job edited = new Job("job-1", "fetch-v2", null, "paper_fetch", Schedule.cron("0 3 * * *", null),
                JobStatus.ACTIVE, Duration.ofMillis(1500), 0, Duration.ZERO, Map.of("query", "rag"),
                null, null, 0, null, T0, T0.plusSeconds(5));
        assertTrue(jobStore.updateJob(edited));

        Job loaded = jobStore.getJob("job-1").orElseThrow();
        assertEquals("fetch-v2", loaded.name());
        assertEquals("0 3 * * *", loaded.schedule().cronExpression());
        assertNull(loaded.schedule().interval());
        assertEquals(Duration.ofMillis(1500), loaded.timeout());
        assertEquals(Map.of("query", "rag"), loaded.config());
        assertEquals(T0.plusSeconds(60), loaded.nextExecution());
        assertEquals(1, loaded.retryAttempt());

        jobStore.createJob(newJob("job-2", "other", Schedule.everyHours(1)));
        Job clash = new Job("job-2", "fetch-v2", null, "paper_fetch", Schedule.everyHours(1), JobStatus.ACTIVE,
                Duration.ofMinutes(1), 0, Duration.ZERO, Map.of(), null, null, 0, null, T0, T0);
        assertThrows(JobConfigurationException.class, () -> jobStore.updateJob(clash));
        assertFalse(jobStore.updateJob(newJob("missing", "nobody", Schedule.everyHours(1))));
    }

    @Test
    void listJobsAppliesStatusTypeAndLimitFilters() {
        jobStore.createJob(newJob("job-1", "b-fetch", Schedule.everyHours(1)));
        jobStore.createJob(newJob("job-2", "a-fetch", Schedule.everyHours(1)));
        jobStore.createJob(newJob("job-3", "c-fetch", Schedule.everyHours(1)));
        jobStore.updateStatus("job-3", JobStatus.PAUSED, T0);

        assertEquals(List.of("a-fetch", "b-fetch", "c-fetch"),
                jobStore.listJobs(null, "paper_fetch", 10).stream().map(Job::name).toList());
        assertEquals(List.of("c-fetch"),
                jobStore.listJobs(JobStatus.PAUSED, null, 10).stream().map(Job::name).toList());
        assertEquals(List.of("a-fetch"),
                jobStore.listJobs(JobStatus.ACTIVE, "paper_fetch", 1).stream().map(Job::name).toList());
        assertTrue(jobStore.listJobs(null, "digest", 10).isEmpty());
    }

    @Test
    void terminalExecutionsAreImmutable() {
        jobStore.createJob(newJob("job-1", "fetch", Schedule.everyHours(2)));
        JobExecution pending = new JobExecution("exec-1", "job-1", ExecutionStatus.PENDING, 0, null,
                T0, null, null, null, null);
        jobStore.createExecution(pending);

        JobExecution running = pending.transitionTo(ExecutionStatus.RUNNING, T0, null, null);
        JobExecution done = running.transitionTo(ExecutionStatus.SUCCESS, T0.plusSeconds(2), Map.of("papers", 4), null);
        assertTrue(jobStore.updateExecution(running));
        assertTrue(jobStore.updateExecution(done));

        JobExecution late = running.transitionTo(ExecutionStatus.FAILED, T0.plusSeconds(9), null, "late");
        assertFalse(jobStore.updateExecution(late));

        List<JobExecution> history = jobStore.listExecutions("job-1", 10);
        assertEquals(1, history.size());
        assertEquals(ExecutionStatus.SUCCESS, history.get(0).status());
        assertEquals(Map.of("papers", 4), history.get(0).result());
    }

    @Test
    void executionQueriesAndStatistics() {
        jobStore.createJob(newJob("job-1", "fetch", Schedule.everyHours(2)));
        jobStore.createExecution(execution("e1", ExecutionStatus.SUCCESS, T0.minus(Duration.ofDays(40))));
        jobStore.createExecution(execution("e2", ExecutionStatus.FAILED, T0.minus(Duration.ofDays(1))));
        jobStore.createExecution(execution("e3", ExecutionStatus.RUNNING, T0));

        assertEquals(List.of("e3", "e2", "e1"),
                jobStore.listExecutions("job-1", 10).stream().map(JobExecution::id).toList());
        assertEquals(List.of("e3"),
                jobStore.findExecutionsByStatus(EnumSet.of(ExecutionStatus.PENDING, ExecutionStatus.RUNNING))
                        .stream().map(JobExecution::id).toList());

        JobStatistics stats = jobStore.statistics();
        assertEquals(new JobStatistics(1, 1, 0, 3, 1, 1, 1), stats);

        assertEquals(1, jobStore.deleteExecutionsCompletedBefore(T0.minus(Duration.ofDays(30))));

        assertTrue(jobStore.deleteJob("job-1"));
        assertTrue(jobStore.listExecutions("job-1", 10).isEmpty());
    }

    @Test
    void schedulerRunsJobAgainstMongo() throws Exception {
        JobHandlerRegistry registry = new JobHandlerRegistry()
                .register("echo", (job, config) -> Map.of("echo", config.get("message")));
        SchedulerProperties props = new SchedulerProperties();
        props.setCheckInterval(Duration.ofMillis(200));
        props.setRegisterShutdownHook(false);
        PollingScheduler scheduler = new PollingScheduler(props, jobStore, registry);

        String id = scheduler.create("echo-job", "echo").everyHours(2).config("message", "hi").save();
        scheduler.start();

        boolean reached = waitUntil(8, TimeUnit.SECONDS, () -> scheduler.listExecutions(id, 5).stream()
                .anyMatch(e -> e.status() == ExecutionStatus.SUCCESS));
        scheduler.stop();

        assertTrue(reached);
        JobExecution execution = scheduler.listExecutions(id, 5).get(0);
        assertEquals(Map.of("echo", "hi"), execution.result());

        Job job = scheduler.getJob(id).orElseThrow();
        assertNotNull(job.lastExecution());
        assertEquals(job.lastExecution().plus(Duration.ofHours(2)), job.nextExecution());
    }

    private static Job newJob(String id, String name, Schedule schedule) {
        return new Job(id, name, "desc", "paper_fetch", schedule, JobStatus.ACTIVE,
                Duration.ofMinutes(30), 2, Duration.ofSeconds(60), Map.of("query", "transformers", "max", 10),
                null, T0, 0, null, T0, T0);
    }

    private static JobExecution execution(String id, ExecutionStatus status, Instant at) {
        boolean terminal = status.isTerminal();
        return new JobExecution(id, "job-1", status, 0, null, at, at, terminal ? at : null,
                null, status == ExecutionStatus.FAILED ? "boom" : null);
    }

    private static boolean waitUntil(long timeout, TimeUnit unit, BooleanSupplier condition) throws InterruptedException {
        long deadline = System.nanoTime() + unit.toNanos(timeout);
        while (System.nanoTime() < deadline) {
            if (condition.getAsBoolean()) {
                return true;
            }
            Thread.sleep(100);
        }
        return false;
    }
}
