package io.tempo4j;

import io.tempo4j.core.Job;

import java.util.Map;

/**
 * Performs the actual work of a job type.
 *
 * <p>Handlers run on a dedicated thread and may be abandoned when they exceed the job timeout. Interruption is
 * the only cancellation signal they receive, so long-running handlers should check
 * {@link Thread#isInterrupted()} or use interruptible I/O.
 *
 * @param <T> type the job's config map is converted into before invocation
 */
public interface JobHandler<T> {
    String jobType();

    Class<T> configClass();

    /**
     * @return a result to store on the execution; maps and beans are stored as maps, anything else under "value"
     */
    Object execute(Job job, T config) throws Exception;

    @FunctionalInterface
    interface JobFunction {
        Object apply(Job job, Map<String, Object> config) throws Exception;
    }

    /**
     * Adapts a function taking the raw config map.
     */
    static JobHandler<Map<String, Object>> of(String jobType, JobFunction function) {
        return new JobHandler<>() {
            @Override
            public String jobType() {
                return jobType;
            }

            @Override
            @SuppressWarnings("unchecked")
            public Class<Map<String, Object>> configClass() {
                return (Class<Map<String, Object>>) (Class<?>) Map.class;
            }

            @Override
            public Object execute(Job job, Map<String, Object> config) throws Exception {
                return function.apply(job, config);
            }
        };
    }
}
