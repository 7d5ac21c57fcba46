package io.tempo4j.internal;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.json.JsonMapper;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import io.tempo4j.JobHandler;
import io.tempo4j.core.ExecutionStatus;
import io.tempo4j.core.Job;
import io.tempo4j.core.JobExecution;
import io.tempo4j.core.JobHandlerRegistry;
import io.tempo4j.core.JobStatus;
import io.tempo4j.core.Schedule;
import io.tempo4j.core.TriggerEvaluator;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicReference;

import static org.assertj.core.api.Assertions.assertThat;

class JobExecutorTest {

    private static final Instant T0 = Instant.parse("2024-05-01T08:00:00Z");

    private InMemoryJobStore store;
    private MutableClock clock;
    private JobHandlerRegistry registry;
    private ExecutorService handlerPool;
    private TriggerEvaluator evaluator;
    private JobExecutor executor;

    @BeforeEach
    void setUp() {
        store = new InMemoryJobStore();
        clock = new MutableClock(T0);
        registry = new JobHandlerRegistry();
        handlerPool = JobExecutor.newHandlerPool();
        evaluator = new TriggerEvaluator("UTC");
        ObjectMapper objectMapper = JsonMapper.builder().addModule(new JavaTimeModule()).build();
        executor = new JobExecutor(store, new RunTracker(store), registry, evaluator, objectMapper, handlerPool, clock);
    }

    @AfterEach
    void tearDown() {
        handlerPool.shutdownNow();
    }

    @Test
    void successStoresResultAndAdvancesSchedule() {
        registry.register("custom", (job, config) -> Map.of("papers", 3));
        Job job = seed(job("custom", 0, Duration.ofSeconds(5)));

        JobExecution execution = executor.execute(job);

        assertThat(execution.status()).isEqualTo(ExecutionStatus.SUCCESS);
        assertThat(execution.result()).containsEntry("papers", 3);
        assertThat(execution.errorMessage()).isNull();
        assertThat(store.executionsOf(job.id())).containsExactly(execution);

        Job updated = store.job(job.id());
        assertThat(updated.lastExecution()).isEqualTo(T0);
        assertThat(updated.nextExecution()).isEqualTo(T0.plus(Duration.ofHours(1)));
        assertThat(updated.retryAttempt()).isZero();
    }

    @Test
    void scalarResultIsStoredUnderValueKey() {
        registry.register("custom", (job, config) -> "done");
        Job job = seed(job("custom", 0, Duration.ofSeconds(5)));

        JobExecution execution = executor.execute(job);

        assertThat(execution.result()).isEqualTo(Map.of("value", "done"));
    }

    @Test
    void configIsConvertedToHandlerType() {
        AtomicReference<FetchConfig> seen = new AtomicReference<>();
        registry.register(new FetchHandler(seen));
        Job job = seed(job("paper_fetch", 0, Duration.ofSeconds(5), Map.of("query", "transformers", "maxPapers", 5)));

        JobExecution execution = executor.execute(job);

        assertThat(execution.status()).isEqualTo(ExecutionStatus.SUCCESS);
        assertThat(seen.get()).isEqualTo(new FetchConfig("transformers", 5));
        assertThat(execution.result()).containsEntry("query", "transformers").containsEntry("maxPapers", 5);
    }

    @Test
    void handlerFailureSchedulesRetry() {
        registry.register("custom", (job, config) -> {
            throw new IllegalStateException("upstream unavailable");
        });
        Job job = seed(job("custom", 2, Duration.ofSeconds(5)));

        JobExecution execution = executor.execute(job);

        assertThat(execution.status()).isEqualTo(ExecutionStatus.FAILED);
        assertThat(execution.errorMessage()).isEqualTo("upstream unavailable");

        Job updated = store.job(job.id());
        assertThat(updated.retryAttempt()).isEqualTo(1);
        assertThat(updated.retryOf()).isEqualTo(execution.id());
        assertThat(updated.nextExecution()).isEqualTo(T0.plusSeconds(60));
    }

    @Test
    void exceptionWithoutMessageIsDescribedByClassName() {
        registry.register("custom", (job, config) -> {
            throw new UnsupportedOperationException();
        });
        Job job = seed(job("custom", 0, Duration.ofSeconds(5)));

        JobExecution execution = executor.execute(job);

        assertThat(execution.errorMessage()).isEqualTo(UnsupportedOperationException.class.getName());
    }

    @Test
    void failingJobRunsExactlyRetryCountPlusOneTimes() {
        registry.register("custom", (job, config) -> {
            throw new IllegalStateException("always fails");
        });
        Job job = seed(job("custom", 2, Duration.ofSeconds(5)));

        JobExecution first = executor.execute(store.job(job.id()));

        clock.advance(Duration.ofSeconds(60));
        assertThat(evaluator.isDue(store.job(job.id()), clock.instant())).isTrue();
        JobExecution second = executor.execute(store.job(job.id()));

        clock.advance(Duration.ofSeconds(60));
        assertThat(evaluator.isDue(store.job(job.id()), clock.instant())).isTrue();
        JobExecution third = executor.execute(store.job(job.id()));

        List<JobExecution> executions = store.executionsOf(job.id());
        assertThat(executions).extracting(JobExecution::retryAttempt).containsExactly(0, 1, 2);
        assertThat(executions).allMatch(e -> e.status() == ExecutionStatus.FAILED);
        assertThat(first.triggeredBy()).isNull();
        assertThat(second.triggeredBy()).isEqualTo(first.id());
        assertThat(third.triggeredBy()).isEqualTo(second.id());

        Job exhausted = store.job(job.id());
        Instant thirdStart = T0.plusSeconds(120);
        assertThat(exhausted.retryAttempt()).isZero();
        assertThat(exhausted.lastExecution()).isEqualTo(thirdStart);
        assertThat(exhausted.nextExecution()).isEqualTo(thirdStart.plus(Duration.ofHours(1)));

        clock.advance(Duration.ofSeconds(60));
        assertThat(evaluator.isDue(exhausted, clock.instant())).isFalse();
    }

    @Test
    void timeoutFailsExecutionAndLateResultIsNeverRecorded() throws Exception {
        CountDownLatch handlerFinished = new CountDownLatch(1);
        registry.register("custom", (job, config) -> {
            try {
                long deadline = System.nanoTime() + TimeUnit.SECONDS.toNanos(1);
                while (System.nanoTime() < deadline) {
                    try {
                        Thread.sleep(50);
                    } catch (InterruptedException e) {
                        // keep going like a handler that ignores cancellation
                    }
                }
                return Map.of("late", true);
            } finally {
                handlerFinished.countDown();
            }
        });
        Job job = seed(job("custom", 0, Duration.ofMillis(200)));

        long started = System.nanoTime();
        JobExecution execution = executor.execute(job);
        long elapsedMillis = TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - started);

        assertThat(execution.status()).isEqualTo(ExecutionStatus.FAILED);
        assertThat(execution.errorMessage()).contains("timed out");
        assertThat(elapsedMillis).isLessThan(1000);

        assertThat(handlerFinished.await(5, TimeUnit.SECONDS)).isTrue();
        List<JobExecution> stored = store.executionsOf(job.id());
        assertThat(stored).hasSize(1);
        assertThat(stored.get(0).status()).isEqualTo(ExecutionStatus.FAILED);
        assertThat(stored.get(0).result()).isNull();
    }

    @Test
    void unknownJobTypeFailsWithoutRetry() {
        Job job = seed(job("nobody_handles_this", 3, Duration.ofSeconds(5)));

        JobExecution execution = executor.execute(job);

        assertThat(execution.status()).isEqualTo(ExecutionStatus.FAILED);
        assertThat(execution.errorMessage()).contains("nobody_handles_this");

        Job updated = store.job(job.id());
        assertThat(updated.retryAttempt()).isZero();
        assertThat(updated.nextExecution()).isEqualTo(T0.plus(Duration.ofHours(1)));
    }

    @Test
    void malformedConfigFailsWithoutRetry() {
        registry.register(new FetchHandler(new AtomicReference<>()));
        Job job = seed(job("paper_fetch", 3, Duration.ofSeconds(5), Map.of("maxPapers", "lots")));

        JobExecution execution = executor.execute(job);

        assertThat(execution.status()).isEqualTo(ExecutionStatus.FAILED);
        assertThat(execution.errorMessage()).startsWith("Malformed config");
        assertThat(store.job(job.id()).retryAttempt()).isZero();
    }

    @Test
    void storeOutageDoesNotStopExecution() {
        registry.register("custom", (job, config) -> "ok");
        Job job = seed(job("custom", 0, Duration.ofSeconds(5)));
        store.failExecutionWrites = true;

        JobExecution execution = executor.execute(job);

        assertThat(execution.status()).isEqualTo(ExecutionStatus.SUCCESS);
        assertThat(store.executionsOf(job.id())).isEmpty();
        assertThat(store.job(job.id()).lastExecution()).isEqualTo(T0);
    }

    record FetchConfig(String query, int maxPapers) {
    }

    static class FetchHandler implements JobHandler<FetchConfig> {
        private final AtomicReference<FetchConfig> seen;

        FetchHandler(AtomicReference<FetchConfig> seen) {
            this.seen = seen;
        }

        @Override
        public String jobType() {
            return "paper_fetch";
        }

        @Override
        public Class<FetchConfig> configClass() {
            return FetchConfig.class;
        }

        @Override
        public Object execute(Job job, FetchConfig config) {
            seen.set(config);
            return config;
        }
    }

    private Job seed(Job job) {
        store.put(job);
        return job;
    }

    private static Job job(String jobType, int retryCount, Duration timeout) {
        return job(jobType, retryCount, timeout, Map.of());
    }

    private static Job job(String jobType, int retryCount, Duration timeout, Map<String, Object> config) {
        return new Job("job-" + jobType, "job " + jobType, null, jobType, Schedule.everyHours(1), JobStatus.ACTIVE,
                timeout, retryCount, Duration.ofSeconds(60), config,
                null, T0, 0, null, T0, T0);
    }
}
