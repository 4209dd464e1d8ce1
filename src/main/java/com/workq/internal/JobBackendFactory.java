package com.workq.internal;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.workq.config.WorkQProperties;
import com.workq.core.JobLifecycle;
import com.workq.jdbc.JobSchemaInitializer;
import com.workq.jdbc.PostgresJobBackend;
import com.workq.memory.InMemoryJobBackend;
import com.workq.spi.JobBackend;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.datasource.DataSourceTransactionManager;
import org.springframework.transaction.support.TransactionTemplate;

import javax.sql.DataSource;

/**
 * Creates the {@link JobBackend} selected by {@code workq.backend.type}.
 */
public class JobBackendFactory {

    private static final Logger log = LoggerFactory.getLogger(JobBackendFactory.class);

    private final WorkQProperties properties;
    private final JobLifecycle lifecycle;
    private final ObjectMapper objectMapper;
    private final DataSource dataSource;

    /**
     * @param dataSource required by the {@code jdbc} backend only, may be {@code null}
     */
    public JobBackendFactory(WorkQProperties properties, JobLifecycle lifecycle, ObjectMapper objectMapper,
            DataSource dataSource) {
        this.properties = properties;
        this.lifecycle = lifecycle;
        this.objectMapper = objectMapper;
        this.dataSource = dataSource;
    }

    public JobBackend create() {
        WorkQProperties.BackendType type = properties.getBackend().getType();
        JobBackend backend = switch (type == null ? WorkQProperties.BackendType.MEMORY : type) {
            case MEMORY -> new InMemoryJobBackend(lifecycle);
            case JDBC -> createJdbcBackend();
        };
        log.info("Using {} job backend", backend.name());
        return backend;
    }

    private JobBackend createJdbcBackend() {
        if (dataSource == null) {
            throw new IllegalStateException(
                    "workq.backend.type=jdbc requires a DataSource bean, configure spring.datasource.*");
        }
        WorkQProperties.Database database = properties.getDatabase();
        new JobSchemaInitializer(dataSource, database.getTablePrefix(), database.isSkipCreate(),
                database.isFailOnMigrationError()).initialize();
        JdbcTemplate jdbcTemplate = new JdbcTemplate(dataSource);
        TransactionTemplate transactionTemplate = new TransactionTemplate(new DataSourceTransactionManager(dataSource));
        return new PostgresJobBackend(jdbcTemplate, transactionTemplate, objectMapper, lifecycle,
                database.getTablePrefix());
    }
}
