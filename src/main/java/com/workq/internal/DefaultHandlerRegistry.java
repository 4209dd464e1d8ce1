package com.workq.internal;

import com.workq.JobHandler;
import com.workq.spi.HandlerRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;
import java.util.concurrent.ConcurrentHashMap;

public class DefaultHandlerRegistry implements HandlerRegistry {

    private static final Logger log = LoggerFactory.getLogger(DefaultHandlerRegistry.class);

    private final ConcurrentHashMap<String, JobHandler> handlers = new ConcurrentHashMap<>();

    @Override
    public void register(String type, JobHandler handler) {
        String normalizedType = normalizeType(type);
        Objects.requireNonNull(handler, "handler must not be null");
        JobHandler existing = handlers.putIfAbsent(normalizedType, handler);
        if (existing != null) {
            throw new IllegalStateException("Duplicate job handler registration for type '" + normalizedType
                    + "'. Existing: " + existing.getClass().getName() + ", new: " + handler.getClass().getName());
        }
        log.debug("Registered handler {} for job type {}", handler.getClass().getName(), normalizedType);
    }

    @Override
    public boolean unregister(String type) {
        return type != null && handlers.remove(type.trim()) != null;
    }

    @Override
    public Optional<JobHandler> resolve(String type) {
        return type == null ? Optional.empty() : Optional.ofNullable(handlers.get(type.trim()));
    }

    @Override
    public Set<String> listTypes() {
        return new TreeSet<>(handlers.keySet());
    }

    private static String normalizeType(String type) {
        String normalized = type == null ? "" : type.trim();
        if (normalized.isEmpty()) {
            throw new IllegalArgumentException("Job type must not be blank");
        }
        return normalized;
    }
}
