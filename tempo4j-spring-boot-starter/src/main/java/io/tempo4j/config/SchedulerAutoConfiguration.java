package io.tempo4j.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.tempo4j.JobHandler;
import io.tempo4j.JobScheduler;
import io.tempo4j.core.JobHandlerRegistry;
import io.tempo4j.core.JobStore;
import io.tempo4j.internal.ExecutionCleanupHandler;
import io.tempo4j.internal.PollingScheduler;
import io.tempo4j.internal.mongo.MongoJobStore;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.SmartInitializingSingleton;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnClass;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.data.mongodb.core.MongoTemplate;

import java.time.Clock;
import java.util.List;

/**
 * Spring Boot auto-configuration entrypoint for the tempo scheduler.
 */
@AutoConfiguration
@ConditionalOnClass({JobScheduler.class, MongoTemplate.class})
@EnableConfigurationProperties(SchedulerProperties.class)
@ConditionalOnProperty(prefix = "tempo", name = "enabled", havingValue = "true", matchIfMissing = true)
public class SchedulerAutoConfiguration {

    @Bean
    @ConditionalOnMissingBean
    protected JobStore tempoJobStore(MongoTemplate mongoTemplate) {
        return new MongoJobStore(mongoTemplate);
    }

    @Bean
    @ConditionalOnMissingBean
    protected SchedulerMongoIndexConfig schedulerMongoIndexConfig(MongoTemplate mongoTemplate) {
        return new SchedulerMongoIndexConfig(mongoTemplate);
    }

    @Bean
    @ConditionalOnMissingBean
    @ConditionalOnProperty(prefix = "tempo", name = "cleanup-handler-enabled", havingValue = "true", matchIfMissing = true)
    public ExecutionCleanupHandler executionCleanupHandler(JobStore jobStore) {
        return new ExecutionCleanupHandler(jobStore);
    }

    @Bean
    @ConditionalOnMissingBean
    public JobHandlerRegistry jobHandlerRegistry(ObjectProvider<List<JobHandler<?>>> handlersProvider) {
        List<JobHandler<?>> handlers = handlersProvider.getIfAvailable(List::of);
        return new JobHandlerRegistry(handlers);
    }

    @Bean
    @ConditionalOnMissingBean
    public JobScheduler jobScheduler(SchedulerProperties props, JobStore jobStore, JobHandlerRegistry registry, ObjectMapper om) {
        return new PollingScheduler(props, jobStore, registry, om, Clock.systemUTC());
    }

    @Bean
    @ConditionalOnMissingBean
    public SchedulerLifecycle schedulerLifecycle(JobScheduler scheduler) {
        return new SchedulerLifecycle(scheduler);
    }

    @Bean
    @ConditionalOnProperty(prefix = "tempo", name = "ensure-indexes-on-startup", havingValue = "true")
    public SmartInitializingSingleton schedulerIndexesInitializer(SchedulerMongoIndexConfig indexConfig) {
        return indexConfig::ensureIndexes;
    }
}
