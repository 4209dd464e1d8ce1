package com.workq.annotation;

import java.lang.annotation.Documented;
import java.lang.annotation.ElementType;
import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;
import java.lang.annotation.Target;

/**
 * Marks a {@link com.workq.JobHandler} bean as the handler of a job type. Annotated beans are
 * registered automatically once the application context has been refreshed.
 */
@Target(ElementType.TYPE)
@Retention(RetentionPolicy.RUNTIME)
@Documented
public @interface Job {

    /**
     * The job type this handler executes.
     */
    String value();
}
