package com.workq.internal;

import com.workq.JobHandler;
import com.workq.annotation.Job;
import com.workq.spi.HandlerRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.ListableBeanFactory;
import org.springframework.beans.factory.SmartInitializingSingleton;
import org.springframework.core.annotation.AnnotationUtils;
import org.springframework.util.ClassUtils;

import java.util.Map;

/**
 * Registers every {@link JobHandler} bean annotated with {@link Job @Job} once all singletons exist.
 */
public class JobHandlerBeanRegistrar implements SmartInitializingSingleton {

    private static final Logger log = LoggerFactory.getLogger(JobHandlerBeanRegistrar.class);

    private final ListableBeanFactory beanFactory;
    private final HandlerRegistry registry;

    public JobHandlerBeanRegistrar(ListableBeanFactory beanFactory, HandlerRegistry registry) {
        this.beanFactory = beanFactory;
        this.registry = registry;
    }

    @Override
    public void afterSingletonsInstantiated() {
        Map<String, JobHandler> handlers = beanFactory.getBeansOfType(JobHandler.class);
        int registered = 0;
        for (Map.Entry<String, JobHandler> entry : handlers.entrySet()) {
            Class<?> targetClass = ClassUtils.getUserClass(entry.getValue());
            Job annotation = AnnotationUtils.findAnnotation(targetClass, Job.class);
            if (annotation == null) {
                log.debug("Skipping JobHandler bean {} without @Job annotation", entry.getKey());
                continue;
            }
            String type = annotation.value() == null ? "" : annotation.value().trim();
            if (type.isEmpty()) {
                throw new IllegalStateException("@Job value must not be blank on " + targetClass.getName());
            }
            registry.register(type, entry.getValue());
            registered++;
        }
        log.info("Registered {} job handler(s): {}", registered, registry.listTypes());
    }
}
