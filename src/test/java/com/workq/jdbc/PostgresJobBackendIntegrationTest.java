package com.workq.jdbc;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.workq.Job;
import com.workq.JobPriority;
import com.workq.core.JobLifecycle;
import com.workq.spi.JobBackend;
import com.workq.spi.JobBackendContract;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.Test;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.datasource.DataSourceTransactionManager;
import org.springframework.jdbc.datasource.DriverManagerDataSource;
import org.springframework.transaction.support.TransactionTemplate;
import org.testcontainers.containers.PostgreSQLContainer;
import org.testcontainers.junit.jupiter.Container;
import org.testcontainers.junit.jupiter.Testcontainers;

import static org.junit.jupiter.api.Assertions.assertEquals;

@Testcontainers(disabledWithoutDocker = true)
class PostgresJobBackendIntegrationTest extends JobBackendContract {

    @Container
    static final PostgreSQLContainer<?> POSTGRES = new PostgreSQLContainer<>("postgres:17-alpine");

    private static DriverManagerDataSource dataSource;

    @BeforeAll
    static void createSchema() {
        dataSource = new DriverManagerDataSource(POSTGRES.getJdbcUrl(), POSTGRES.getUsername(), POSTGRES.getPassword());
        new JobSchemaInitializer(dataSource, "", false, true).initialize();
    }

    @Override
    protected JobBackend createBackend(JobLifecycle lifecycle) {
        JdbcTemplate jdbcTemplate = new JdbcTemplate(dataSource);
        jdbcTemplate.execute("TRUNCATE workq_jobs, workq_ready, workq_scheduled");
        TransactionTemplate transactionTemplate = new TransactionTemplate(new DataSourceTransactionManager(dataSource));
        return new PostgresJobBackend(jdbcTemplate, transactionTemplate, new ObjectMapper(), lifecycle, "");
    }

    @Test
    void reportsItsName() {
        assertEquals("jdbc", backend.name());
    }

    @Test
    void migrationsAreAppliedOnlyOnce() {
        assertEquals(0, new JobSchemaInitializer(dataSource, "", false, true).initialize());
    }

    @Test
    void separatePrefixesDoNotShareJobs() {
        new JobSchemaInitializer(dataSource, "tenant_a_", false, true).initialize();
        JdbcTemplate jdbcTemplate = new JdbcTemplate(dataSource);
        jdbcTemplate.execute("TRUNCATE tenant_a_workq_jobs, tenant_a_workq_ready, tenant_a_workq_scheduled");
        JobBackend prefixed = new PostgresJobBackend(jdbcTemplate,
                new TransactionTemplate(new DataSourceTransactionManager(dataSource)), new ObjectMapper(), lifecycle,
                "tenant_a_");

        Job job = enqueue("send", JobPriority.NORMAL);

        assertEquals(0, prefixed.size(QUEUE));
        assertEquals(1, backend.size(QUEUE));
        assertEquals(job.getId(), backend.dequeue(QUEUE).orElseThrow().getId());
    }
}
