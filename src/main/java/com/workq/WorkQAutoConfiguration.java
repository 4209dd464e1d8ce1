package com.workq;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.workq.config.WorkQProperties;
import com.workq.core.BackoffPolicy;
import com.workq.core.JobLifecycle;
import com.workq.internal.BackgroundJobServer;
import com.workq.internal.DefaultHandlerRegistry;
import com.workq.internal.JobBackendFactory;
import com.workq.internal.JobCleaner;
import com.workq.internal.JobHandlerBeanRegistrar;
import com.workq.internal.LoggingJobEventListener;
import com.workq.internal.WorkQMetrics;
import com.workq.spi.HandlerRegistry;
import com.workq.spi.JobBackend;
import com.workq.worker.JobEventListener;
import io.micrometer.core.instrument.MeterRegistry;
import org.springframework.beans.factory.ListableBeanFactory;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnClass;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.autoconfigure.jdbc.DataSourceAutoConfiguration;
import org.springframework.boot.autoconfigure.jackson.JacksonAutoConfiguration;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.annotation.EnableScheduling;

import javax.sql.DataSource;
import java.time.Clock;
import java.util.List;
import java.util.stream.Collectors;

@AutoConfiguration(after = {DataSourceAutoConfiguration.class, JacksonAutoConfiguration.class},
        afterName = "org.springframework.boot.actuate.autoconfigure.metrics.CompositeMeterRegistryAutoConfiguration")
@EnableConfigurationProperties(WorkQProperties.class)
public class WorkQAutoConfiguration {

    @Bean
    @ConditionalOnMissingBean(name = "workqObjectMapper")
    public ObjectMapper workqObjectMapper() {
        ObjectMapper mapper = new ObjectMapper();
        mapper.registerModule(new JavaTimeModule());
        return mapper;
    }

    @Bean
    @ConditionalOnMissingBean(name = "workqClock")
    public Clock workqClock() {
        return Clock.systemUTC();
    }

    @Bean
    @ConditionalOnMissingBean
    public BackoffPolicy workqBackoffPolicy(WorkQProperties properties) {
        WorkQProperties.Backoff backoff = properties.getJobs().getBackoff();
        return BackoffPolicy.builder()
                .strategy(backoff.getStrategy())
                .baseDelay(backoff.getBaseDelay())
                .maxDelay(backoff.getMaxDelay())
                .jitter(backoff.isJitter())
                .build();
    }

    @Bean
    @ConditionalOnMissingBean
    public JobLifecycle workqJobLifecycle(Clock workqClock, BackoffPolicy backoffPolicy, WorkQProperties properties) {
        return new JobLifecycle(workqClock, backoffPolicy, properties.getJobs().getDefaultMaxRetries());
    }

    @Bean
    @ConditionalOnMissingBean
    public JobBackend workqJobBackend(WorkQProperties properties, JobLifecycle lifecycle,
            ObjectMapper workqObjectMapper, ObjectProvider<DataSource> dataSource) {
        return new JobBackendFactory(properties, lifecycle, workqObjectMapper, dataSource.getIfAvailable()).create();
    }

    @Bean
    @ConditionalOnMissingBean
    public HandlerRegistry workqHandlerRegistry() {
        return new DefaultHandlerRegistry();
    }

    @Bean
    public JobHandlerBeanRegistrar workqJobHandlerBeanRegistrar(ListableBeanFactory beanFactory,
            HandlerRegistry registry) {
        return new JobHandlerBeanRegistrar(beanFactory, registry);
    }

    @Bean
    @ConditionalOnMissingBean
    public JobClient workqJobClient(JobBackend backend, JobLifecycle lifecycle, ObjectMapper workqObjectMapper) {
        return new JobClient(backend, backend, lifecycle, workqObjectMapper);
    }

    @Bean
    public LoggingJobEventListener workqLoggingJobEventListener() {
        return new LoggingJobEventListener();
    }

    @Bean
    @ConditionalOnProperty(prefix = "workq.background-job-server", name = "enabled", havingValue = "true",
            matchIfMissing = true)
    public BackgroundJobServer workqBackgroundJobServer(JobBackend backend, HandlerRegistry registry,
            JobLifecycle lifecycle, ObjectProvider<JobEventListener> listeners, WorkQProperties properties) {
        List<JobEventListener> ordered = listeners.orderedStream().collect(Collectors.toList());
        return new BackgroundJobServer(backend, registry, lifecycle, ordered, properties);
    }

    @Configuration(proxyBeanMethods = false)
    @EnableScheduling
    @ConditionalOnProperty(prefix = "workq.background-job-server", name = "enabled", havingValue = "true",
            matchIfMissing = true)
    static class RetentionConfiguration {

        @Bean
        public JobCleaner workqJobCleaner(JobBackend backend, WorkQProperties properties, Clock workqClock) {
            return new JobCleaner(backend, properties, workqClock);
        }
    }

    @Configuration(proxyBeanMethods = false)
    @ConditionalOnClass(MeterRegistry.class)
    static class MetricsConfiguration {

        @Bean
        @ConditionalOnBean(MeterRegistry.class)
        public WorkQMetrics workqMetrics(JobBackend backend, MeterRegistry meterRegistry) {
            return new WorkQMetrics(backend, meterRegistry);
        }
    }
}
