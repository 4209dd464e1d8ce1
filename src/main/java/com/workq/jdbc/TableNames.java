package com.workq.jdbc;

import java.util.regex.Pattern;

/**
 * Physical names of the WorkQ tables, honouring {@code workq.database.table-prefix}.
 */
public record TableNames(String prefix) {

    private static final Pattern SAFE_IDENTIFIER = Pattern.compile("[A-Za-z_][A-Za-z0-9_]*");
    private static final Pattern WORKQ_IDENTIFIER = Pattern.compile("\\b(idx_)?workq_");

    public static TableNames of(String configuredPrefix) {
        String trimmed = configuredPrefix == null ? "" : configuredPrefix.trim();
        if (!trimmed.isEmpty() && !SAFE_IDENTIFIER.matcher(trimmed).matches()) {
            throw new IllegalArgumentException("Unsupported WorkQ table-prefix: " + trimmed);
        }
        return new TableNames(trimmed);
    }

    public String jobs() {
        return prefix + "workq_jobs";
    }

    public String ready() {
        return prefix + "workq_ready";
    }

    public String scheduled() {
        return prefix + "workq_scheduled";
    }

    public String migrations() {
        return prefix + "workq_schema_migrations";
    }

    /**
     * Prefixes every {@code workq_} table and index name of a migration script.
     */
    public String render(String sql) {
        if (prefix.isEmpty()) {
            return sql;
        }
        return WORKQ_IDENTIFIER.matcher(sql).replaceAll(match -> prefix + match.group());
    }
}
