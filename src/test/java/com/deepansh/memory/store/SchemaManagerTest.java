package com.deepansh.memory.store;

import com.deepansh.memory.support.TestStore;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;
import org.springframework.dao.DataAccessException;

import java.util.SortedMap;
import java.util.TreeMap;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class SchemaManagerTest {

    private TestStore store;

    @BeforeEach
    void setUp() {
        store = TestStore.empty();
    }

    @AfterEach
    void tearDown() {
        store.close();
    }

    private SchemaManager manager(SortedMap<Integer, Migration> migrations, int target) {
        return new SchemaManager(store.jdbcTemplate, store.transactionTemplate, migrations, target);
    }

    private SchemaManager currentManager() {
        return new SchemaManager(store.jdbcTemplate, store.transactionTemplate);
    }

    @Test
    void ensureCurrent_freshStore_appliesEveryMigrationInOrder() {
        int version = currentManager().ensureCurrent();

        assertThat(version).isEqualTo(MigrationCatalog.CURRENT_VERSION);
        assertThat(currentManager().appliedVersions()).containsExactly(1, 2, 3);
    }

    @ParameterizedTest
    @ValueSource(strings = {
            "sessions", "session_events", "promoted_knowledge", "sync_config",
            "agents", "file_importance", "knowledge_usage", "value_metrics", "schema_version"
    })
    void ensureCurrent_freshStore_createsTable(String table) {
        currentManager().ensureCurrent();

        assertThat(store.tableExists(table)).isTrue();
    }

    @ParameterizedTest
    @ValueSource(strings = {
            "idx_events_session", "idx_events_type", "idx_sessions_project", "idx_sessions_branch",
            "idx_sessions_status", "idx_knowledge_project", "idx_knowledge_type", "idx_knowledge_synced",
            "idx_file_importance_project", "idx_file_importance_score", "idx_knowledge_usage_knowledge",
            "idx_knowledge_usage_session", "idx_knowledge_hash", "idx_knowledge_branch"
    })
    void ensureCurrent_freshStore_createsIndex(String index) {
        currentManager().ensureCurrent();

        assertThat(store.indexExists(index)).isTrue();
    }

    @Test
    void ensureCurrent_runTwice_isNoOp() {
        currentManager().ensureCurrent();
        int second = currentManager().ensureCurrent();

        assertThat(second).isEqualTo(3);
        assertThat(currentManager().appliedVersions()).containsExactly(1, 2, 3);
    }

    @Test
    void currentVersion_withoutVersionLog_isZero() {
        assertThat(currentManager().currentVersion()).isZero();
    }

    @Test
    void ensureCurrent_gapInSequence_failsWithoutApplyingAnything() {
        SortedMap<Integer, Migration> withGap = new TreeMap<>();
        withGap.put(1, MigrationCatalog.migrations().get(1));
        withGap.put(3, MigrationCatalog.migrations().get(3));

        assertThatThrownBy(() -> manager(withGap, 3).ensureCurrent())
                .isInstanceOf(SchemaMigrationException.class)
                .hasMessageContaining("version 2");

        assertThat(currentManager().currentVersion()).isZero();
        assertThat(store.tableExists("sessions")).isFalse();
    }

    @Test
    void ensureCurrent_failingMigration_rollsBackOnlyThatStep() {
        SortedMap<Integer, Migration> broken = new TreeMap<>();
        broken.put(1, MigrationCatalog.migrations().get(1));
        broken.put(2, Migration.of(2, "broken",
                "CREATE TABLE IF NOT EXISTS half_done (id TEXT PRIMARY KEY)",
                "CREATE TABLE this is not sql"));

        assertThatThrownBy(() -> manager(broken, 2).ensureCurrent())
                .isInstanceOf(SchemaMigrationException.class)
                .hasMessageContaining("Migration 2")
                .hasCauseInstanceOf(DataAccessException.class);

        assertThat(currentManager().appliedVersions()).containsExactly(1);
        assertThat(store.tableExists("sessions")).isTrue();
        assertThat(store.tableExists("half_done")).isFalse();
    }

    @Test
    void ensureCurrent_fromVersionOne_keepsExistingRowsAndDefaultsNewColumns() {
        manager(MigrationCatalog.migrations().headMap(2), 1).ensureCurrent();
        store.jdbcTemplate.update("""
                INSERT INTO sessions (session_id, project_path, branch, started_at, status)
                VALUES ('s-old', '/proj', 'main', '2026-01-01T00:00:00.000Z', 'completed')""");

        int version = currentManager().ensureCurrent();

        assertThat(version).isEqualTo(3);
        String agentType = store.jdbcTemplate.queryForObject(
                "SELECT agent_type FROM sessions WHERE session_id = 's-old'", String.class);
        assertThat(agentType).isEqualTo("unknown");
    }

    @Test
    void ensureCurrent_columnAlreadyPresent_skipsAddColumn() {
        manager(MigrationCatalog.migrations().headMap(3), 2).ensureCurrent();
        store.jdbcTemplate.execute("ALTER TABLE sessions ADD COLUMN agent_type TEXT NOT NULL DEFAULT 'unknown'");

        int version = currentManager().ensureCurrent();

        assertThat(version).isEqualTo(3);
        assertThat(store.tableExists("agents")).isTrue();
    }

    @Test
    void migratedStore_enforcesForeignKeys() {
        currentManager().ensureCurrent();

        assertThatThrownBy(() -> store.jdbcTemplate.update("""
                INSERT INTO session_events (event_id, session_id, timestamp, event_type, category, detail_json)
                VALUES ('e1', 'no-such-session', '2026-01-01T00:00:00.000Z', 'milestone', 'other', '{}')"""))
                .isInstanceOf(DataAccessException.class);
    }

    @Test
    void migration_versionBelowOne_isRejected() {
        assertThatThrownBy(() -> Migration.of(0, "zero", "SELECT 1"))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
