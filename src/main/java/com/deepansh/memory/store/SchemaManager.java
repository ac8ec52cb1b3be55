package com.deepansh.memory.store;

import jakarta.annotation.PostConstruct;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.dao.DataAccessException;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Component;
import org.springframework.transaction.support.TransactionTemplate;

import java.util.ArrayList;
import java.util.List;
import java.util.SortedMap;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Brings the store to the target schema version.
 *
 * Rules:
 * 1. Current version = MAX(version) in schema_version, 0 when the log is absent or empty.
 * 2. The whole range current+1..target is checked before anything runs.
 *    A missing number aborts initialization, nothing is applied.
 * 3. Each migration runs in its own transaction together with its
 *    schema_version row. A failure rolls back only that step; earlier
 *    steps stay committed.
 * 4. Statements are idempotent: CREATE ... IF NOT EXISTS, and
 *    ALTER TABLE ... ADD COLUMN is skipped when the column already exists
 *    (SQLite has no IF NOT EXISTS for columns).
 */
@Component
@Slf4j
public class SchemaManager {

    private static final Pattern ADD_COLUMN_PATTERN =
            Pattern.compile("^\\s*ALTER\\s+TABLE\\s+(\\w+)\\s+ADD\\s+COLUMN\\s+(\\w+)",
                    Pattern.CASE_INSENSITIVE);

    private static final String CREATE_VERSION_LOG = """
            CREATE TABLE IF NOT EXISTS schema_version (
              version INTEGER PRIMARY KEY,
              applied_at TEXT NOT NULL DEFAULT (strftime('%Y-%m-%dT%H:%M:%fZ', 'now'))
            )""";

    private final JdbcTemplate jdbcTemplate;
    private final TransactionTemplate transactionTemplate;
    private final SortedMap<Integer, Migration> migrations;
    private final int targetVersion;

    @Autowired
    public SchemaManager(JdbcTemplate jdbcTemplate, TransactionTemplate transactionTemplate) {
        this(jdbcTemplate, transactionTemplate,
                MigrationCatalog.migrations(), MigrationCatalog.CURRENT_VERSION);
    }

    public SchemaManager(JdbcTemplate jdbcTemplate,
                         TransactionTemplate transactionTemplate,
                         SortedMap<Integer, Migration> migrations,
                         int targetVersion) {
        this.jdbcTemplate = jdbcTemplate;
        this.transactionTemplate = transactionTemplate;
        this.migrations = migrations;
        this.targetVersion = targetVersion;
    }

    @PostConstruct
    void initialize() {
        ensureCurrent();
    }

    /**
     * Applies every pending migration in ascending order.
     *
     * @return the schema version after the run
     * @throws SchemaMigrationException on a gap in the sequence or a failing migration
     */
    public int ensureCurrent() {
        jdbcTemplate.execute(CREATE_VERSION_LOG);

        int current = currentVersion();
        if (current >= targetVersion) {
            log.debug("Schema is current [version={}]", current);
            return current;
        }

        List<Migration> pending = resolvePending(current);
        log.info("Migrating store schema [from={}, to={}, steps={}]", current, targetVersion, pending.size());

        for (Migration migration : pending) {
            apply(migration);
        }
        return currentVersion();
    }

    public int currentVersion() {
        Integer tables = jdbcTemplate.queryForObject(
                "SELECT COUNT(*) FROM sqlite_master WHERE type = 'table' AND name = 'schema_version'",
                Integer.class);
        if (tables == null || tables == 0) {
            return 0;
        }
        Integer version = jdbcTemplate.queryForObject("SELECT MAX(version) FROM schema_version", Integer.class);
        return version == null ? 0 : version;
    }

    public List<Integer> appliedVersions() {
        return jdbcTemplate.queryForList("SELECT version FROM schema_version ORDER BY version ASC", Integer.class);
    }

    public int targetVersion() {
        return targetVersion;
    }

    private List<Migration> resolvePending(int current) {
        List<Migration> pending = new ArrayList<>();
        for (int v = current + 1; v <= targetVersion; v++) {
            Migration migration = migrations.get(v);
            if (migration == null) {
                throw new SchemaMigrationException("Missing migration for version " + v
                        + " (store at " + current + ", target " + targetVersion + ")");
            }
            if (migration.version() != v) {
                throw new SchemaMigrationException("Migration registered under " + v
                        + " declares version " + migration.version());
            }
            pending.add(migration);
        }
        return pending;
    }

    private void apply(Migration migration) {
        try {
            transactionTemplate.executeWithoutResult(status -> {
                migration.statements().forEach(this::executeStatement);
                jdbcTemplate.update("INSERT INTO schema_version (version) VALUES (?)", migration.version());
            });
        } catch (DataAccessException e) {
            log.error("Schema migration {} failed, rolled back", migration.version(), e);
            throw new SchemaMigrationException("Migration " + migration.version()
                    + " (" + migration.description() + ") failed: " + e.getMessage(), e);
        }
        log.info("Applied schema migration {} [{}]", migration.version(), migration.description());
    }

    private void executeStatement(String sql) {
        Matcher m = ADD_COLUMN_PATTERN.matcher(sql);
        if (m.find() && columnExists(m.group(1), m.group(2))) {
            log.debug("Column {}.{} already present, skipping", m.group(1), m.group(2));
            return;
        }
        jdbcTemplate.execute(sql);
    }

    private boolean columnExists(String table, String column) {
        List<String> columns = jdbcTemplate.query("PRAGMA table_info(" + table + ")",
                (rs, rowNum) -> rs.getString("name"));
        return columns.stream().anyMatch(column::equalsIgnoreCase);
    }
}
