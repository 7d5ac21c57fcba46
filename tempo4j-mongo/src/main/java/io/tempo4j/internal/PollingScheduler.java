package io.tempo4j.internal;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.json.JsonMapper;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import io.tempo4j.JobBuilder;
import io.tempo4j.JobScheduler;
import io.tempo4j.config.SchedulerProperties;
import io.tempo4j.core.ExecutionStatus;
import io.tempo4j.core.Job;
import io.tempo4j.core.JobConfigurationException;
import io.tempo4j.core.JobExecution;
import io.tempo4j.core.JobHandlerRegistry;
import io.tempo4j.core.JobSpec;
import io.tempo4j.core.JobStatistics;
import io.tempo4j.core.JobStatus;
import io.tempo4j.core.JobStore;
import io.tempo4j.core.ScheduleState;
import io.tempo4j.core.SchedulerStatus;
import io.tempo4j.core.TriggerEvaluator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.EnumSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Store-backed job scheduler &amp; runner.
 *
 * <p>A single poller thread wakes every {@code tempo.check-interval}, asks the {@link TriggerEvaluator} which
 * active jobs are due and hands each one to a bounded worker pool. A job id is in flight from dispatch until its
 * worker finishes, and a job that is in flight is never dispatched again, so the same job never runs twice
 * concurrently.
 *
 * <p>Everything the scheduler needs to resume lives in the {@link JobStore}. On start, executions still marked
 * PENDING or RUNNING belong to a previous process and are failed.
 */
public class PollingScheduler implements JobScheduler {
    private static final Logger log = LoggerFactory.getLogger(PollingScheduler.class);

    static final String ABANDONED_MESSAGE = "Execution abandoned: scheduler restarted before completion";

    private final SchedulerProperties props;
    private final JobStore jobStore;
    private final JobHandlerRegistry jobRegistry;
    private final ObjectMapper objectMapper;
    private final Clock clock;

    private final TriggerEvaluator triggerEvaluator;
    private final RunTracker runTracker;

    private final AtomicBoolean started = new AtomicBoolean(false);
    private final ConcurrentHashMap<String, Future<?>> inFlight = new ConcurrentHashMap<>();
    private final AtomicLong pollErrorCount = new AtomicLong();

    private volatile ExecutorService workerPool;
    private ExecutorService handlerPool;
    private volatile JobExecutor executor;

    private Thread pollerThread;
    private Thread shutdownHook;

    public PollingScheduler(SchedulerProperties props, JobStore jobStore, JobHandlerRegistry jobRegistry) {
        this(props, jobStore, jobRegistry, defaultObjectMapper(), Clock.systemUTC());
    }

    public PollingScheduler(SchedulerProperties props,
                            JobStore jobStore,
                            JobHandlerRegistry jobRegistry,
                            ObjectMapper objectMapper,
                            Clock clock) {
        this.props = Objects.requireNonNull(props, "props must not be null");
        this.jobStore = Objects.requireNonNull(jobStore, "jobStore must not be null");
        this.jobRegistry = Objects.requireNonNull(jobRegistry, "jobRegistry must not be null");
        this.objectMapper = Objects.requireNonNull(objectMapper, "objectMapper must not be null");
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
        this.triggerEvaluator = new TriggerEvaluator(props.getDefaultTimezone());
        this.runTracker = new RunTracker(jobStore);
    }

    private static ObjectMapper defaultObjectMapper() {
        return JsonMapper.builder()
                .addModule(new JavaTimeModule())
                .build();
    }

    /**
     * Start polling and executing due jobs. Idempotent.
     */
    @Override
    public void start() {
        if (!started.compareAndSet(false, true)) {
            return;
        }

        try {
            validateProperties();
        } catch (RuntimeException e) {
            started.set(false);
            throw e;
        }

        log.info("Tempo scheduler starting with checkInterval={}, maxConcurrency={}, shutdownTimeout={}, defaultTimezone={}, handlers={}",
                props.getCheckInterval(),
                props.getMaxConcurrency(),
                props.getShutdownTimeout(),
                props.getDefaultTimezone(),
                jobRegistry.registeredTypes());

        if (props.isReconcileOnStartup()) {
            reconcileInterruptedExecutions();
        }

        AtomicInteger workerCounter = new AtomicInteger();
        workerPool = Executors.newFixedThreadPool(props.getMaxConcurrency(), r -> {
            Thread t = new Thread(r);
            t.setName("tempo.worker-" + workerCounter.incrementAndGet());
            t.setDaemon(true);
            return t;
        });
        handlerPool = JobExecutor.newHandlerPool();
        executor = new JobExecutor(jobStore, runTracker, jobRegistry, triggerEvaluator, objectMapper, handlerPool, clock);

        pollerThread = new Thread(this::pollerLoop);
        pollerThread.setName("tempo.poller");
        pollerThread.setDaemon(true);
        pollerThread.start();

        if (props.isRegisterShutdownHook()) {
            shutdownHook = new Thread(this::stop, "tempo.shutdown");
            Runtime.getRuntime().addShutdownHook(shutdownHook);
        }
        log.info("Tempo scheduler started successfully.");
    }

    /**
     * Stop polling and wait up to {@code tempo.shutdown-timeout} for running jobs. Idempotent.
     */
    @Override
    public void stop() {
        if (!started.compareAndSet(true, false)) {
            return;
        }

        log.info("Tempo scheduler stopping...");

        if (pollerThread != null) {
            pollerThread.interrupt();
            pollerThread = null;
        }

        boolean drained = true;
        ExecutorService pool = workerPool;
        if (pool != null) {
            pool.shutdown();
            try {
                drained = pool.awaitTermination(props.getShutdownTimeout().toMillis(), TimeUnit.MILLISECONDS);
                if (!drained) {
                    log.warn("Tempo workers still running after {}; interrupting inFlight={}",
                            props.getShutdownTimeout(), inFlight.keySet());
                    pool.shutdownNow();
                }
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                drained = false;
                pool.shutdownNow();
            } finally {
                workerPool = null;
            }
        }

        if (handlerPool != null) {
            handlerPool.shutdownNow();
            handlerPool = null;
        }
        executor = null;
        // Workers that outlived the timeout remove their own entry when they finish.
        if (drained) {
            inFlight.clear();
        }

        if (shutdownHook != null) {
            Thread hook = shutdownHook;
            shutdownHook = null;
            if (Thread.currentThread() != hook) {
                try {
                    Runtime.getRuntime().removeShutdownHook(hook);
                } catch (IllegalStateException e) {
                    log.debug("Tempo shutdown hook not removed: JVM already shutting down");
                }
            }
        }
        log.info("Tempo scheduler stopped successfully.");
    }

    @Override
    public boolean isRunning() {
        return started.get();
    }

    /**
     * Create a job builder. This does not persist until save() is called.
     */
    @Override
    public JobBuilder create(String name, String jobType) {
        return new SimpleJobBuilder(name, jobType, props, this::createJob);
    }

    @Override
    public String createJob(JobSpec spec) {
        Objects.requireNonNull(spec, "spec must not be null");
        spec.validate();

        if (jobStore.findJobByName(spec.name()).isPresent()) {
            throw new JobConfigurationException("Job with name '" + spec.name() + "' already exists");
        }
        if (!jobRegistry.isRegistered(spec.jobType())) {
            log.warn("Tempo job created for unregistered job type name={} jobType={}; executions will fail until a handler is registered",
                    spec.name(), spec.jobType());
        }

        Instant now = nowInstant();
        Instant firstRun = spec.skipImmediate()
                ? triggerEvaluator.computeNext(spec.schedule(), now)
                : now;
        JobStatus status = spec.initialStatus() != null ? spec.initialStatus() : JobStatus.ACTIVE;

        Job job = new Job(
                UUID.randomUUID().toString(),
                spec.name(),
                spec.description(),
                spec.jobType(),
                spec.schedule(),
                status,
                spec.timeout(),
                spec.retryCount(),
                spec.retryDelay(),
                spec.config() == null ? new LinkedHashMap<>() : new LinkedHashMap<>(spec.config()),
                null,
                firstRun,
                0,
                null,
                now,
                now
        );

        String id = jobStore.createJob(job);
        log.info("Tempo job created name={} id={} jobType={} schedule={} status={} firstRun={}",
                job.name(), id, job.jobType(), job.schedule(), status, firstRun);
        return id;
    }

    @Override
    public boolean updateJob(String jobId, JobSpec spec) {
        Objects.requireNonNull(spec, "spec must not be null");
        spec.validate();

        Optional<Job> found = jobStore.getJob(jobId);
        if (found.isEmpty()) {
            return false;
        }
        Job existing = found.get();

        Optional<Job> sameName = jobStore.findJobByName(spec.name());
        if (sameName.isPresent() && !sameName.get().id().equals(jobId)) {
            throw new JobConfigurationException("Job with name '" + spec.name() + "' already exists");
        }

        Instant now = nowInstant();
        JobStatus status = spec.initialStatus() != null ? spec.initialStatus() : existing.status();
        Job updated = new Job(
                jobId,
                spec.name(),
                spec.description(),
                spec.jobType(),
                spec.schedule(),
                status,
                spec.timeout(),
                spec.retryCount(),
                spec.retryDelay(),
                spec.config() == null ? new LinkedHashMap<>() : new LinkedHashMap<>(spec.config()),
                existing.lastExecution(),
                existing.nextExecution(),
                existing.retryAttempt(),
                existing.retryOf(),
                existing.createdAt(),
                now
        );
        if (!jobStore.updateJob(updated)) {
            return false;
        }

        if (!existing.schedule().equals(spec.schedule())) {
            Instant next = triggerEvaluator.computeNext(spec.schedule(), now);
            jobStore.updateScheduleState(jobId, ScheduleState.advanced(existing.lastExecution(), next), now);
            log.info("Tempo job rescheduled name={} id={} schedule={} nextExecution={}",
                    spec.name(), jobId, spec.schedule(), next);
        }
        log.info("Tempo job updated name={} id={} jobType={} status={}", spec.name(), jobId, spec.jobType(), status);
        return true;
    }

    @Override
    public boolean pauseJob(String jobId) {
        boolean updated = jobStore.updateStatus(jobId, JobStatus.PAUSED, nowInstant());
        if (updated) {
            log.info("Tempo job paused id={}", jobId);
        }
        return updated;
    }

    @Override
    public boolean resumeJob(String jobId) {
        boolean updated = jobStore.updateStatus(jobId, JobStatus.ACTIVE, nowInstant());
        if (updated) {
            log.info("Tempo job resumed id={}", jobId);
        }
        return updated;
    }

    @Override
    public boolean triggerJob(String jobId) {
        Instant now = nowInstant();
        boolean updated = jobStore.updateNextExecution(jobId, now, now);
        if (updated) {
            log.info("Tempo job triggered id={} runningNow={}", jobId, isInFlight(jobId));
        }
        return updated;
    }

    @Override
    public boolean deleteJob(String jobId) {
        boolean deleted = jobStore.deleteJob(jobId);
        if (deleted) {
            log.info("Tempo job deleted id={}", jobId);
        }
        return deleted;
    }

    @Override
    public Optional<Job> getJob(String jobId) {
        return jobStore.getJob(jobId);
    }

    @Override
    public List<Job> listJobs() {
        return jobStore.listJobs();
    }

    @Override
    public List<Job> listJobs(JobStatus status, String jobType, int limit) {
        if (limit <= 0) {
            throw new IllegalArgumentException("limit must be a positive number");
        }
        return jobStore.listJobs(status, jobType, limit);
    }

    @Override
    public List<JobExecution> listExecutions(String jobId, int limit) {
        if (limit <= 0) {
            throw new IllegalArgumentException("limit must be a positive number");
        }
        return jobStore.listExecutions(jobId, limit);
    }

    @Override
    public SchedulerStatus getStatus() {
        pruneFinished();

        JobStatistics statistics;
        try {
            statistics = jobStore.statistics();
        } catch (RuntimeException e) {
            log.error("tempo statistics failed msg={}", e.getMessage(), e);
            statistics = JobStatistics.empty();
        }
        return new SchedulerStatus(started.get(), inFlight.size(), props.getCheckInterval(), statistics);
    }

    long pollErrorCount() {
        return pollErrorCount.get();
    }

    boolean isInFlight(String jobId) {
        Future<?> f = inFlight.get(jobId);
        return f != null && !f.isDone();
    }

    /**
     * Utility: current scheduler time source (useful for tests).
     */
    protected Instant nowInstant() {
        return clock.instant();
    }

    private void validateProperties() {
        Duration interval = Objects.requireNonNull(props.getCheckInterval(), "tempo.checkInterval must not be null");
        if (interval.isZero() || interval.isNegative()) {
            throw new IllegalArgumentException("tempo.checkInterval must be a positive duration");
        }
        if (props.getMaxConcurrency() <= 0) {
            throw new IllegalArgumentException("tempo.maxConcurrency must be a positive number");
        }
        Duration shutdownTimeout = Objects.requireNonNull(props.getShutdownTimeout(), "tempo.shutdownTimeout must not be null");
        if (shutdownTimeout.isNegative()) {
            throw new IllegalArgumentException("tempo.shutdownTimeout must not be negative");
        }
    }

    private void reconcileInterruptedExecutions() {
        List<JobExecution> stale;
        try {
            stale = jobStore.findExecutionsByStatus(EnumSet.of(ExecutionStatus.PENDING, ExecutionStatus.RUNNING));
        } catch (RuntimeException e) {
            log.error("tempo reconcile lookup failed msg={}", e.getMessage(), e);
            return;
        }

        Instant now = nowInstant();
        int abandoned = 0;
        for (JobExecution execution : stale) {
            if (isInFlight(execution.jobId())) {
                log.info("Tempo execution still running from before the restart id={} jobId={}",
                        execution.id(), execution.jobId());
                continue;
            }
            runTracker.abandon(execution, now, ABANDONED_MESSAGE);
            abandoned++;
        }
        if (abandoned > 0) {
            log.warn("Tempo failed {} execution(s) left in flight by a previous run", abandoned);
        }
    }

    private void pollerLoop() {
        while (started.get()) {
            try {
                pollOnce();
            } catch (Exception e) {
                long errors = pollErrorCount.incrementAndGet();
                log.error("tempo pollOnce failed errors={} msg={}", errors, e.getMessage(), e);
            }

            try {
                Thread.sleep(props.getCheckInterval().toMillis());
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                break;
            }
        }
    }

    /**
     * One scheduling pass: dispatch every due job that is not already in flight.
     *
     * @return number of jobs dispatched
     */
    int pollOnce() {
        ExecutorService pool = workerPool;
        JobExecutor jobExecutor = executor;
        if (pool == null || jobExecutor == null) {
            return 0;
        }
        pruneFinished();

        List<Job> jobs = jobStore.listActiveJobs();
        Instant now = nowInstant();
        int dispatched = 0;

        for (Job job : jobs) {
            boolean due;
            try {
                due = triggerEvaluator.isDue(job, now);
            } catch (RuntimeException e) {
                log.error("tempo cannot evaluate schedule name={} id={} schedule={} msg={}",
                        job.name(), job.id(), job.schedule(), e.getMessage());
                continue;
            }
            if (!due) {
                continue;
            }

            if (dispatch(pool, jobExecutor, job)) {
                dispatched++;
            } else {
                log.debug("Tempo job still running; skipping this tick name={} id={}", job.name(), job.id());
            }
        }

        log.debug("Tempo poll finished active={} dispatched={} inFlight={}", jobs.size(), dispatched, inFlight.size());
        return dispatched;
    }

    private boolean dispatch(ExecutorService pool, JobExecutor jobExecutor, Job job) {
        String jobId = job.id();
        boolean[] submitted = {false};
        inFlight.compute(jobId, (id, existing) -> {
            if (existing != null && !existing.isDone()) {
                return existing;
            }
            submitted[0] = true;
            return pool.submit(() -> runJob(id, jobExecutor));
        });
        return submitted[0];
    }

    private void runJob(String jobId, JobExecutor jobExecutor) {
        try {
            Optional<Job> current = jobStore.getJob(jobId);
            if (current.isEmpty()) {
                log.debug("Tempo job deleted before it ran id={}", jobId);
                return;
            }
            Job job = current.get();
            if (!triggerEvaluator.isDue(job, nowInstant())) {
                log.debug("Tempo job no longer due name={} id={} status={}", job.name(), jobId, job.status());
                return;
            }

            JobExecution execution = jobExecutor.execute(job);
            log.debug("Tempo job finished name={} id={} executionId={} status={}",
                    job.name(), jobId, execution.id(), execution.status());
        } catch (RuntimeException e) {
            log.error("tempo worker failed id={} msg={}", jobId, e.getMessage(), e);
        } finally {
            inFlight.remove(jobId);
        }
    }

    private void pruneFinished() {
        inFlight.values().removeIf(Future::isDone);
    }
}
