package io.tempo4j.core;

import io.tempo4j.JobHandler;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

/**
 * Maps job types to their {@link JobHandler}. Handlers are normally registered before the scheduler starts,
 * but registration is thread-safe.
 */
public class JobHandlerRegistry {
    private static final Logger log = LoggerFactory.getLogger(JobHandlerRegistry.class);

    private final ConcurrentMap<String, JobHandler<?>> handlersByType = new ConcurrentHashMap<>();

    public JobHandlerRegistry() {
    }

    public JobHandlerRegistry(List<JobHandler<?>> handlers) {
        Objects.requireNonNull(handlers, "handlers must not be null");
        handlers.forEach(this::register);
    }

    public JobHandlerRegistry register(JobHandler<?> handler) {
        Objects.requireNonNull(handler, "handler must not be null");
        String jobType = handler.jobType();
        if (jobType == null || jobType.isBlank()) {
            throw new IllegalArgumentException("JobHandler jobType must not be blank: " + handler.getClass().getName());
        }

        JobHandler<?> existing = handlersByType.putIfAbsent(jobType, handler);
        if (existing != null) {
            throw new IllegalStateException("Duplicate JobHandler for job type: " + jobType);
        }
        log.info("Registered handler for job type: {}", jobType);
        return this;
    }

    public JobHandlerRegistry register(String jobType, JobHandler.JobFunction function) {
        Objects.requireNonNull(function, "function must not be null");
        return register(JobHandler.of(jobType, function));
    }

    public Optional<JobHandler<?>> resolve(String jobType) {
        if (jobType == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(handlersByType.get(jobType));
    }

    public JobHandler<?> getRequired(String jobType) {
        return resolve(jobType).orElseThrow(() -> new HandlerNotFoundException(jobType));
    }

    public boolean isRegistered(String jobType) {
        return resolve(jobType).isPresent();
    }

    public Set<String> registeredTypes() {
        return new TreeSet<>(handlersByType.keySet());
    }
}
