package com.workq.jdbc;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.io.ByteArrayResource;
import org.springframework.core.io.Resource;
import org.springframework.core.io.support.EncodedResource;
import org.springframework.core.io.support.PathMatchingResourcePatternResolver;
import org.springframework.jdbc.datasource.init.ScriptUtils;
import org.springframework.util.StreamUtils;

import javax.sql.DataSource;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.HexFormat;
import java.util.List;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Applies the versioned WorkQ migration scripts found at {@value #MIGRATION_RESOURCE_PATTERN}.
 * <p>
 * Runs under a PostgreSQL advisory lock so that several nodes starting at once apply each script
 * exactly once. Applied scripts are recorded with a SHA-256 checksum; a script edited after it was
 * applied stops the startup.
 */
public class JobSchemaInitializer {

    private static final Logger log = LoggerFactory.getLogger(JobSchemaInitializer.class);
    private static final Pattern VERSION_FILE_PATTERN = Pattern.compile("^V([0-9]+(?:_[0-9]+)*)__([A-Za-z0-9_\\-]+)\\.sql$");
    static final String MIGRATION_RESOURCE_PATTERN = "classpath*:workq/migration/V*__*.sql";
    private static final long ADVISORY_LOCK_KEY = 7_361_504_218_902_113_017L;

    private final DataSource dataSource;
    private final TableNames tables;
    private final boolean skipCreate;
    private final boolean failOnMigrationError;
    private final PathMatchingResourcePatternResolver resourceResolver = new PathMatchingResourcePatternResolver();

    public JobSchemaInitializer(DataSource dataSource, String tablePrefix, boolean skipCreate,
            boolean failOnMigrationError) {
        this.dataSource = dataSource;
        this.tables = TableNames.of(tablePrefix);
        this.skipCreate = skipCreate;
        this.failOnMigrationError = failOnMigrationError;
    }

    /**
     * @return number of migrations applied by this call
     */
    public int initialize() {
        if (skipCreate) {
            log.info("Skipping WorkQ schema migrations (workq.database.skip-create=true)");
            return 0;
        }
        log.info("Initializing WorkQ database schema using {}", tables.migrations());
        try (Connection connection = dataSource.getConnection()) {
            lock(connection);
            try {
                return migrate(connection);
            } finally {
                unlock(connection);
            }
        } catch (Exception e) {
            String message = "Failed to initialize WorkQ database schema";
            if (failOnMigrationError) {
                throw new IllegalStateException(message, e);
            }
            log.error("{} (continuing because workq.database.fail-on-migration-error=false)", message, e);
            return 0;
        }
    }

    private int migrate(Connection connection) throws SQLException, IOException {
        createHistoryTable(connection);
        List<Migration> migrations = loadMigrations();
        if (migrations.isEmpty()) {
            throw new IllegalStateException("No WorkQ migrations found on classpath pattern " + MIGRATION_RESOURCE_PATTERN);
        }
        Map<String, String> appliedChecksums = loadAppliedChecksums(connection);
        verify(migrations, appliedChecksums);

        int applied = 0;
        for (Migration migration : migrations) {
            if (!appliedChecksums.containsKey(migration.version())) {
                apply(connection, migration);
                applied++;
            }
        }
        if (applied == 0) {
            log.info("WorkQ schema is up to date, {} migration(s) already applied", appliedChecksums.size());
        } else {
            log.info("Applied {} WorkQ migration(s)", applied);
        }
        return applied;
    }

    private void createHistoryTable(Connection connection) throws SQLException {
        String sql = """
                CREATE TABLE IF NOT EXISTS %s (
                    version VARCHAR(64) PRIMARY KEY,
                    description VARCHAR(255) NOT NULL,
                    checksum VARCHAR(64) NOT NULL,
                    installed_on TIMESTAMP WITH TIME ZONE NOT NULL DEFAULT CURRENT_TIMESTAMP,
                    execution_time_ms BIGINT NOT NULL
                )
                """.formatted(tables.migrations());
        try (Statement statement = connection.createStatement()) {
            statement.execute(sql);
        }
    }

    private List<Migration> loadMigrations() throws IOException {
        Resource[] resources = resourceResolver.getResources(MIGRATION_RESOURCE_PATTERN);
        List<Migration> migrations = new ArrayList<>(resources.length);
        Map<String, String> fileByVersion = new HashMap<>();
        for (Resource resource : resources) {
            String fileName = resource.getFilename();
            if (fileName == null) {
                continue;
            }
            Matcher matcher = VERSION_FILE_PATTERN.matcher(fileName);
            if (!matcher.matches()) {
                throw new IllegalStateException("Invalid WorkQ migration filename '" + fileName
                        + "', expected V{version}__{description}.sql");
            }
            String version = matcher.group(1);
            String previous = fileByVersion.putIfAbsent(version, fileName);
            if (previous != null) {
                throw new IllegalStateException("Duplicate WorkQ migration version V" + version + " in files "
                        + previous + " and " + fileName);
            }
            String sql = StreamUtils.copyToString(resource.getInputStream(), StandardCharsets.UTF_8);
            migrations.add(new Migration(version, matcher.group(2).replace('_', ' '), fileName, sql, sha256(sql)));
        }
        migrations.sort(Comparator.comparing(Migration::version, JobSchemaInitializer::compareVersions));
        return migrations;
    }

    private Map<String, String> loadAppliedChecksums(Connection connection) throws SQLException {
        Map<String, String> applied = new HashMap<>();
        try (PreparedStatement statement = connection.prepareStatement(
                "SELECT version, checksum FROM " + tables.migrations());
                ResultSet rs = statement.executeQuery()) {
            while (rs.next()) {
                applied.put(rs.getString("version"), rs.getString("checksum"));
            }
        }
        return applied;
    }

    private static void verify(List<Migration> migrations, Map<String, String> appliedChecksums) {
        Map<String, Migration> byVersion = new HashMap<>();
        migrations.forEach(migration -> byVersion.put(migration.version(), migration));
        for (Map.Entry<String, String> applied : appliedChecksums.entrySet()) {
            Migration migration = byVersion.get(applied.getKey());
            if (migration == null) {
                throw new IllegalStateException("Migration V" + applied.getKey()
                        + " was applied to the database but is missing from the classpath");
            }
            if (!migration.checksum().equals(applied.getValue())) {
                throw new IllegalStateException("Checksum mismatch for migration V" + migration.version()
                        + ", the file changed after it was applied");
            }
        }
    }

    private void apply(Connection connection, Migration migration) throws SQLException {
        boolean autoCommit = connection.getAutoCommit();
        long started = System.nanoTime();
        connection.setAutoCommit(false);
        try {
            byte[] script = tables.render(migration.sql()).getBytes(StandardCharsets.UTF_8);
            ScriptUtils.executeSqlScript(connection,
                    new EncodedResource(new ByteArrayResource(script, migration.fileName()), StandardCharsets.UTF_8));
            long executionMs = Duration.ofNanos(System.nanoTime() - started).toMillis();
            try (PreparedStatement statement = connection.prepareStatement("INSERT INTO " + tables.migrations()
                    + " (version, description, checksum, execution_time_ms) VALUES (?, ?, ?, ?)")) {
                statement.setString(1, migration.version());
                statement.setString(2, migration.description());
                statement.setString(3, migration.checksum());
                statement.setLong(4, executionMs);
                statement.executeUpdate();
            }
            connection.commit();
            log.info("Applied WorkQ migration V{} ({}) in {} ms", migration.version(), migration.description(),
                    executionMs);
        } catch (RuntimeException | SQLException e) {
            try {
                connection.rollback();
            } catch (SQLException rollbackFailure) {
                e.addSuppressed(rollbackFailure);
            }
            throw new IllegalStateException("Failed to apply WorkQ migration V" + migration.version()
                    + " (" + migration.description() + ")", e);
        } finally {
            connection.setAutoCommit(autoCommit);
        }
    }

    private static void lock(Connection connection) throws SQLException {
        try (PreparedStatement statement = connection.prepareStatement("SELECT pg_advisory_lock(?)")) {
            statement.setLong(1, ADVISORY_LOCK_KEY);
            statement.execute();
        }
    }

    private static void unlock(Connection connection) {
        try (PreparedStatement statement = connection.prepareStatement("SELECT pg_advisory_unlock(?)")) {
            statement.setLong(1, ADVISORY_LOCK_KEY);
            statement.execute();
        } catch (SQLException e) {
            log.warn("Failed to release WorkQ schema migration lock", e);
        }
    }

    static int compareVersions(String left, String right) {
        String[] l = left.split("_");
        String[] r = right.split("_");
        for (int i = 0; i < Math.max(l.length, r.length); i++) {
            int lv = i < l.length ? Integer.parseInt(l[i]) : 0;
            int rv = i < r.length ? Integer.parseInt(r[i]) : 0;
            if (lv != rv) {
                return Integer.compare(lv, rv);
            }
        }
        return 0;
    }

    private static String sha256(String input) {
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            return HexFormat.of().formatHex(digest.digest(input.getBytes(StandardCharsets.UTF_8)));
        } catch (Exception e) {
            throw new IllegalStateException("Unable to compute migration checksum", e);
        }
    }

    private record Migration(String version, String description, String fileName, String sql, String checksum) {
    }
}
