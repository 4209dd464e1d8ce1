package com.workq.jdbc;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.workq.BackendUnavailableException;
import com.workq.Job;
import org.springframework.dao.DataAccessException;
import org.springframework.transaction.TransactionException;

import java.time.Instant;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.util.function.Supplier;

/**
 * JSON and timestamp conversions shared by the PostgreSQL queue and store.
 */
final class JdbcSupport {

    private final ObjectMapper objectMapper;

    JdbcSupport(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper.copy()
                .registerModule(new JavaTimeModule())
                .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
    }

    String writeJob(Job job) {
        return write(JobDocument.from(job));
    }

    Job readJob(String json) {
        try {
            return objectMapper.readValue(json, JobDocument.class).toJob();
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Unreadable job document: " + json, e);
        }
    }

    String write(Object value) {
        if (value == null) {
            return null;
        }
        try {
            return objectMapper.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Value is not serializable to JSON: " + value.getClass().getName(), e);
        }
    }

    JsonNode readTree(String json) {
        if (json == null) {
            return null;
        }
        try {
            return objectMapper.readTree(json);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Unreadable JSON column value", e);
        }
    }

    <T> T read(String json, Class<T> type) {
        if (json == null) {
            return null;
        }
        try {
            return objectMapper.readValue(json, type);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Unreadable JSON column value", e);
        }
    }

    static OffsetDateTime timestamp(Instant instant) {
        return instant == null ? null : OffsetDateTime.ofInstant(instant, ZoneOffset.UTC);
    }

    static Instant instant(OffsetDateTime timestamp) {
        return timestamp == null ? null : timestamp.toInstant();
    }

    /**
     * Runs a data access call, reporting database faults as {@link BackendUnavailableException}.
     */
    static <T> T translate(String operation, Supplier<T> call) {
        try {
            return call.get();
        } catch (DataAccessException | TransactionException e) {
            throw new BackendUnavailableException("PostgreSQL backend failed to " + operation, e);
        }
    }
}
