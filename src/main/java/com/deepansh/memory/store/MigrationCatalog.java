package com.deepansh.memory.store;

import java.util.Collections;
import java.util.SortedMap;
import java.util.TreeMap;

/**
 * The store's schema history, version → statement batch.
 *
 * Append only. Never edit or renumber a migration that has shipped: stores
 * in the wild have its number in schema_version and will not re-run it.
 */
public final class MigrationCatalog {

    public static final int CURRENT_VERSION = 3;

    private static final SortedMap<Integer, Migration> MIGRATIONS = build();

    private MigrationCatalog() {
    }

    public static SortedMap<Integer, Migration> migrations() {
        return MIGRATIONS;
    }

    private static SortedMap<Integer, Migration> build() {
        TreeMap<Integer, Migration> m = new TreeMap<>();

        m.put(1, Migration.of(1, "Sessions and session events",
                """
                CREATE TABLE IF NOT EXISTS sessions (
                  session_id TEXT PRIMARY KEY,
                  project_path TEXT NOT NULL,
                  branch TEXT NOT NULL DEFAULT 'main',
                  started_at TEXT NOT NULL,
                  ended_at TEXT,
                  status TEXT NOT NULL DEFAULT 'active',
                  summary TEXT,
                  git_commit_start TEXT,
                  git_commit_end TEXT,
                  created_at TEXT NOT NULL DEFAULT (strftime('%Y-%m-%dT%H:%M:%fZ', 'now'))
                )""",
                """
                CREATE TABLE IF NOT EXISTS session_events (
                  event_id TEXT PRIMARY KEY,
                  session_id TEXT NOT NULL REFERENCES sessions(session_id),
                  timestamp TEXT NOT NULL,
                  event_type TEXT NOT NULL,
                  category TEXT NOT NULL DEFAULT 'other',
                  detail_json TEXT NOT NULL,
                  created_at TEXT NOT NULL DEFAULT (strftime('%Y-%m-%dT%H:%M:%fZ', 'now'))
                )""",
                "CREATE INDEX IF NOT EXISTS idx_events_session ON session_events(session_id)",
                "CREATE INDEX IF NOT EXISTS idx_events_type ON session_events(event_type)",
                "CREATE INDEX IF NOT EXISTS idx_sessions_project ON sessions(project_path)",
                "CREATE INDEX IF NOT EXISTS idx_sessions_branch ON sessions(project_path, branch)",
                "CREATE INDEX IF NOT EXISTS idx_sessions_status ON sessions(status)"));

        // sync config is a placeholder for remote sync; nothing reads it yet
        m.put(2, Migration.of(2, "Promoted knowledge and sync config",
                """
                CREATE TABLE IF NOT EXISTS promoted_knowledge (
                  knowledge_id TEXT PRIMARY KEY,
                  project_path TEXT NOT NULL,
                  session_id TEXT REFERENCES sessions(session_id),
                  source_event_id TEXT REFERENCES session_events(event_id),
                  title TEXT NOT NULL,
                  content TEXT NOT NULL,
                  knowledge_type TEXT NOT NULL DEFAULT 'decision',
                  tags TEXT NOT NULL DEFAULT '[]',
                  created_at TEXT NOT NULL DEFAULT (strftime('%Y-%m-%dT%H:%M:%fZ', 'now')),
                  synced_at TEXT,
                  remote_knowledge_id TEXT
                )""",
                "CREATE INDEX IF NOT EXISTS idx_knowledge_project ON promoted_knowledge(project_path)",
                "CREATE INDEX IF NOT EXISTS idx_knowledge_type ON promoted_knowledge(knowledge_type)",
                "CREATE INDEX IF NOT EXISTS idx_knowledge_synced ON promoted_knowledge(synced_at)",
                """
                CREATE TABLE IF NOT EXISTS sync_config (
                  project_path TEXT PRIMARY KEY,
                  endpoint TEXT,
                  remote_project_id TEXT,
                  tenant_id TEXT,
                  api_key_env_var TEXT NOT NULL DEFAULT 'MEMORY_SYNC_API_KEY',
                  auto_sync_promoted INTEGER NOT NULL DEFAULT 0,
                  last_synced_at TEXT,
                  created_at TEXT NOT NULL DEFAULT (strftime('%Y-%m-%dT%H:%M:%fZ', 'now'))
                )"""));

        m.put(3, Migration.of(3, "Agents, file importance, knowledge usage, value metrics, dedup columns",
                "ALTER TABLE sessions ADD COLUMN agent_type TEXT NOT NULL DEFAULT 'unknown'",
                "ALTER TABLE sessions ADD COLUMN agent_version TEXT",
                """
                CREATE TABLE IF NOT EXISTS agents (
                  agent_type TEXT PRIMARY KEY,
                  display_name TEXT NOT NULL,
                  first_seen_at TEXT NOT NULL,
                  last_seen_at TEXT NOT NULL,
                  total_sessions INTEGER NOT NULL DEFAULT 0
                )""",
                """
                CREATE TABLE IF NOT EXISTS file_importance (
                  project_path TEXT NOT NULL,
                  file_path TEXT NOT NULL,
                  read_count INTEGER NOT NULL DEFAULT 0,
                  edit_count INTEGER NOT NULL DEFAULT 0,
                  last_accessed_at TEXT NOT NULL,
                  importance_score REAL NOT NULL DEFAULT 0.0,
                  PRIMARY KEY (project_path, file_path)
                )""",
                "CREATE INDEX IF NOT EXISTS idx_file_importance_project ON file_importance(project_path)",
                "CREATE INDEX IF NOT EXISTS idx_file_importance_score ON file_importance(project_path, importance_score DESC)",
                """
                CREATE TABLE IF NOT EXISTS knowledge_usage (
                  usage_id TEXT PRIMARY KEY,
                  knowledge_id TEXT NOT NULL,
                  session_id TEXT NOT NULL,
                  usage_type TEXT NOT NULL,
                  timestamp TEXT NOT NULL
                )""",
                "CREATE INDEX IF NOT EXISTS idx_knowledge_usage_knowledge ON knowledge_usage(knowledge_id)",
                "CREATE INDEX IF NOT EXISTS idx_knowledge_usage_session ON knowledge_usage(session_id)",
                """
                CREATE TABLE IF NOT EXISTS value_metrics (
                  project_path TEXT PRIMARY KEY,
                  total_sessions INTEGER NOT NULL DEFAULT 0,
                  context_reuse_count INTEGER NOT NULL DEFAULT 0,
                  knowledge_surfaced_count INTEGER NOT NULL DEFAULT 0,
                  decisions_recalled_count INTEGER NOT NULL DEFAULT 0,
                  patterns_applied_count INTEGER NOT NULL DEFAULT 0,
                  errors_prevented_count INTEGER NOT NULL DEFAULT 0,
                  estimated_time_saved_secs INTEGER NOT NULL DEFAULT 0,
                  updated_at TEXT NOT NULL
                )""",
                "ALTER TABLE promoted_knowledge ADD COLUMN branch TEXT",
                "ALTER TABLE promoted_knowledge ADD COLUMN content_hash TEXT",
                "ALTER TABLE promoted_knowledge ADD COLUMN usage_count INTEGER NOT NULL DEFAULT 0",
                "ALTER TABLE promoted_knowledge ADD COLUMN superseded_by TEXT",
                "CREATE INDEX IF NOT EXISTS idx_knowledge_hash ON promoted_knowledge(content_hash)",
                "CREATE INDEX IF NOT EXISTS idx_knowledge_branch ON promoted_knowledge(project_path, branch)"));

        return Collections.unmodifiableSortedMap(m);
    }
}
