package com.workq.spi;

import com.workq.JobHandler;

import java.util.Optional;
import java.util.Set;

/**
 * Maps a job type to the handler executing it.
 */
public interface HandlerRegistry {

    /**
     * @throws IllegalStateException if a handler is already registered for the type
     */
    void register(String type, JobHandler handler);

    /**
     * @return {@code true} if a handler was registered for the type
     */
    boolean unregister(String type);

    Optional<JobHandler> resolve(String type);

    Set<String> listTypes();
}
