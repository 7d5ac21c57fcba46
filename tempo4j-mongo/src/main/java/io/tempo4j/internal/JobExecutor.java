package io.tempo4j.internal;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.tempo4j.JobHandler;
import io.tempo4j.core.ExecutionStatus;
import io.tempo4j.core.HandlerNotFoundException;
import io.tempo4j.core.Job;
import io.tempo4j.core.JobConfigurationException;
import io.tempo4j.core.JobExecution;
import io.tempo4j.core.JobHandlerRegistry;
import io.tempo4j.core.JobStore;
import io.tempo4j.core.ScheduleState;
import io.tempo4j.core.TriggerEvaluator;
import io.tempo4j.internal.RunTracker.TransitionMetadata;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Instant;
import java.util.Collections;
import java.util.Map;
import java.util.Objects;
import java.util.UUID;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Runs one attempt of a job: records the execution, invokes the handler under the job's timeout and decides
 * whether a retry gets scheduled.
 *
 * <p>The handler runs on a thread from {@code handlerPool} while the calling thread waits. On timeout the handler
 * is interrupted and abandoned; the execution is finalized immediately and whatever the handler does afterwards
 * is never read.
 */
public class JobExecutor {
    private static final Logger log = LoggerFactory.getLogger(JobExecutor.class);

    private static final TypeReference<Map<String, Object>> MAP_TYPE = new TypeReference<>() {
    };

    private final JobStore jobStore;
    private final RunTracker runTracker;
    private final JobHandlerRegistry jobRegistry;
    private final TriggerEvaluator triggerEvaluator;
    private final ObjectMapper objectMapper;
    private final ExecutorService handlerPool;
    private final Clock clock;

    public JobExecutor(JobStore jobStore,
                       RunTracker runTracker,
                       JobHandlerRegistry jobRegistry,
                       TriggerEvaluator triggerEvaluator,
                       ObjectMapper objectMapper,
                       ExecutorService handlerPool,
                       Clock clock) {
        this.jobStore = Objects.requireNonNull(jobStore, "jobStore must not be null");
        this.runTracker = Objects.requireNonNull(runTracker, "runTracker must not be null");
        this.jobRegistry = Objects.requireNonNull(jobRegistry, "jobRegistry must not be null");
        this.triggerEvaluator = Objects.requireNonNull(triggerEvaluator, "triggerEvaluator must not be null");
        this.objectMapper = Objects.requireNonNull(objectMapper, "objectMapper must not be null");
        this.handlerPool = Objects.requireNonNull(handlerPool, "handlerPool must not be null");
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
    }

    /**
     * Cached pool of daemon threads, so a handler that ignores interruption cannot keep the JVM alive.
     */
    public static ExecutorService newHandlerPool() {
        AtomicInteger counter = new AtomicInteger();
        return Executors.newCachedThreadPool(r -> {
            Thread t = new Thread(r);
            t.setName("tempo.handler-" + counter.incrementAndGet());
            t.setDaemon(true);
            return t;
        });
    }

    public JobExecution execute(Job job) {
        Objects.requireNonNull(job, "job must not be null");

        JobExecution execution = runTracker.open(JobExecution.pending(UUID.randomUUID().toString(), job, now()));

        Instant startedAt = now();
        execution = runTracker.recordTransition(execution, ExecutionStatus.RUNNING, TransitionMetadata.at(startedAt));
        log.info("tempo job started name={} id={} executionId={} attempt={}",
                job.name(), job.id(), execution.id(), execution.retryAttempt());

        // last/next execution advance before the handler runs, so a crash mid-run never re-triggers on restart.
        JobConfigurationException scheduleError = null;
        Instant naturalNext = null;
        try {
            naturalNext = triggerEvaluator.computeNext(job, startedAt);
        } catch (IllegalArgumentException e) {
            scheduleError = new JobConfigurationException("Invalid schedule " + job.schedule() + ": " + e.getMessage(), e);
        }
        persistScheduleState(job, ScheduleState.advanced(startedAt, naturalNext));

        JobHandler<?> handler;
        Object config;
        try {
            if (scheduleError != null) {
                throw scheduleError;
            }
            handler = jobRegistry.getRequired(job.jobType());
            config = convertConfig(job, handler);
        } catch (HandlerNotFoundException | JobConfigurationException e) {
            log.error("tempo job cannot run; no retry scheduled name={} id={} executionId={} msg={}",
                    job.name(), job.id(), execution.id(), e.getMessage());
            return runTracker.recordTransition(execution, ExecutionStatus.FAILED,
                    TransitionMetadata.failed(now(), e.getMessage()));
        }

        Outcome outcome = invoke(job, handler, config);
        if (outcome.succeeded()) {
            JobExecution done = runTracker.recordTransition(execution, ExecutionStatus.SUCCESS,
                    TransitionMetadata.succeeded(now(), outcome.result()));
            log.info("tempo job succeeded name={} id={} executionId={} duration={}",
                    job.name(), job.id(), done.id(), done.duration());
            return done;
        }

        JobExecution failed = runTracker.recordTransition(execution, ExecutionStatus.FAILED,
                TransitionMetadata.failed(now(), outcome.errorMessage()));
        scheduleRetryIfAllowed(job, failed, startedAt);
        return failed;
    }

    private record Outcome(Map<String, Object> result, String errorMessage) {
        static Outcome success(Map<String, Object> result) {
            return new Outcome(result, null);
        }

        static Outcome failure(String errorMessage) {
            return new Outcome(null, errorMessage);
        }

        boolean succeeded() {
            return errorMessage == null;
        }
    }

    private Outcome invoke(Job job, JobHandler<?> handler, Object config) {
        Future<Object> future;
        try {
            future = handlerPool.submit(bind(handler, job, config));
        } catch (RejectedExecutionException e) {
            log.error("tempo handler pool rejected job name={} id={}", job.name(), job.id());
            return Outcome.failure("Handler pool rejected execution: " + e.getMessage());
        }

        try {
            Object raw = future.get(job.timeout().toMillis(), TimeUnit.MILLISECONDS);
            return Outcome.success(normalizeResult(job, raw));
        } catch (TimeoutException e) {
            future.cancel(true);
            log.warn("tempo job timed out name={} id={} timeout={}", job.name(), job.id(), job.timeout());
            return Outcome.failure("Job execution timed out after " + job.timeout().toMillis() + " ms");
        } catch (ExecutionException e) {
            Throwable cause = e.getCause() != null ? e.getCause() : e;
            log.error("tempo job failed name={} id={} msg={}", job.name(), job.id(), cause.getMessage(), cause);
            return Outcome.failure(describe(cause));
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            future.cancel(true);
            log.warn("tempo job interrupted while waiting for handler name={} id={}", job.name(), job.id());
            return Outcome.failure("Job execution interrupted before completion");
        }
    }

    private static <T> Callable<Object> bind(JobHandler<T> handler, Job job, Object config) {
        T typed = handler.configClass().cast(config);
        return () -> handler.execute(job, typed);
    }

    private Object convertConfig(Job job, JobHandler<?> handler) {
        Map<String, Object> raw = job.config() == null ? Map.of() : job.config();
        try {
            return objectMapper.convertValue(raw, handler.configClass());
        } catch (IllegalArgumentException e) {
            throw new JobConfigurationException(
                    "Malformed config for job '" + job.name() + "' (" + handler.configClass().getSimpleName() + "): "
                            + e.getMessage(), e);
        }
    }

    private Map<String, Object> normalizeResult(Job job, Object raw) {
        if (raw == null) {
            return null;
        }
        try {
            JsonNode node = objectMapper.valueToTree(raw);
            if (node.isObject()) {
                return objectMapper.convertValue(node, MAP_TYPE);
            }
            return Collections.singletonMap("value", objectMapper.convertValue(node, Object.class));
        } catch (IllegalArgumentException e) {
            log.warn("tempo job result not serializable; storing its string form name={} id={} type={}",
                    job.name(), job.id(), raw.getClass().getName());
            return Collections.singletonMap("value", String.valueOf(raw));
        }
    }

    private void scheduleRetryIfAllowed(Job job, JobExecution failed, Instant startedAt) {
        if (failed.retryAttempt() < job.retryCount()) {
            int nextAttempt = failed.retryAttempt() + 1;
            Instant retryAt = now().plus(job.retryDelay());
            persistScheduleState(job, ScheduleState.retry(startedAt, retryAt, nextAttempt, failed.id()));
            log.info("tempo scheduled retry {}/{} name={} id={} at={}",
                    nextAttempt, job.retryCount(), job.name(), job.id(), retryAt);
        } else {
            log.warn("tempo job exhausted retries; waiting for next scheduled run name={} id={} attempts={}",
                    job.name(), job.id(), failed.retryAttempt() + 1);
        }
    }

    private void persistScheduleState(Job job, ScheduleState state) {
        try {
            if (!jobStore.updateScheduleState(job.id(), state, now())) {
                log.debug("tempo job vanished before schedule update name={} id={}", job.name(), job.id());
            }
        } catch (RuntimeException e) {
            log.error("tempo updateScheduleState failed name={} id={} msg={}", job.name(), job.id(), e.getMessage(), e);
        }
    }

    private static String describe(Throwable cause) {
        String msg = cause.getMessage();
        if (msg == null || msg.isBlank()) {
            return cause.getClass().getName();
        }
        return msg;
    }

    private Instant now() {
        return clock.instant();
    }
}
