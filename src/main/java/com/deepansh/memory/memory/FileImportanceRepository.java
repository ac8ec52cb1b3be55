package com.deepansh.memory.memory;

import com.deepansh.memory.model.EventDetail.FileOperation;
import com.deepansh.memory.model.FileImportance;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Repository;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Optional;

import static com.deepansh.memory.store.Timestamps.format;
import static com.deepansh.memory.store.Timestamps.parse;

/**
 * Per-file access counters. Score = (reads + 3 * edits) * 0.5^(days / 7):
 * an edit counts three reads and the score halves every idle week.
 */
@Repository
@Slf4j
@RequiredArgsConstructor
public class FileImportanceRepository {

    static final double EDIT_WEIGHT = 3.0;
    static final double HALF_LIFE_DAYS = 7.0;
    static final double REFRESH_TOLERANCE = 0.01;

    private static final double MILLIS_PER_DAY = 86_400_000.0;

    private static final RowMapper<FileImportance> ROW_MAPPER = (rs, rowNum) -> FileImportance.builder()
            .projectPath(rs.getString("project_path"))
            .filePath(rs.getString("file_path"))
            .readCount(rs.getInt("read_count"))
            .editCount(rs.getInt("edit_count"))
            .lastAccessedAt(parse(rs.getString("last_accessed_at")))
            .importanceScore(rs.getDouble("importance_score"))
            .build();

    private final JdbcTemplate jdbcTemplate;
    private final Clock clock;

    public static double computeImportanceScore(int readCount, int editCount, Instant lastAccessedAt, Instant now) {
        double days = Duration.between(lastAccessedAt, now).toMillis() / MILLIS_PER_DAY;
        double base = readCount + editCount * EDIT_WEIGHT;
        return base * Math.pow(0.5, days / HALF_LIFE_DAYS);
    }

    /** Counts one access. READ bumps reads, WRITE and EDIT bump edits. */
    public FileImportance recordAccess(String projectPath, String filePath, FileOperation operation) {
        Instant now = clock.instant();
        Optional<FileImportance> existing = find(projectPath, filePath);

        boolean read = operation == FileOperation.READ;
        int reads = existing.map(FileImportance::getReadCount).orElse(0) + (read ? 1 : 0);
        int edits = existing.map(FileImportance::getEditCount).orElse(0) + (read ? 0 : 1);
        double score = computeImportanceScore(reads, edits, now, now);

        jdbcTemplate.update("""
                INSERT INTO file_importance
                  (project_path, file_path, read_count, edit_count, last_accessed_at, importance_score)
                VALUES (?, ?, ?, ?, ?, ?)
                ON CONFLICT(project_path, file_path) DO UPDATE SET
                  read_count = excluded.read_count,
                  edit_count = excluded.edit_count,
                  last_accessed_at = excluded.last_accessed_at,
                  importance_score = excluded.importance_score""",
                projectPath, filePath, reads, edits, format(now), score);

        return FileImportance.builder()
                .projectPath(projectPath)
                .filePath(filePath)
                .readCount(reads)
                .editCount(edits)
                .lastAccessedAt(now)
                .importanceScore(score)
                .build();
    }

    public Optional<FileImportance> find(String projectPath, String filePath) {
        return jdbcTemplate.query("SELECT * FROM file_importance WHERE project_path = ? AND file_path = ?",
                ROW_MAPPER, projectPath, filePath).stream().findFirst();
    }

    public List<FileImportance> findTop(String projectPath, int limit) {
        return jdbcTemplate.query("""
                SELECT * FROM file_importance WHERE project_path = ?
                ORDER BY importance_score DESC, file_path ASC LIMIT ?""",
                ROW_MAPPER, projectPath, limit);
    }

    /**
     * Re-applies decay to every file of the project.
     *
     * @return rows whose stored score moved by more than 0.01
     */
    public int refreshScores(String projectPath) {
        Instant now = clock.instant();
        List<FileImportance> rows = jdbcTemplate.query("SELECT * FROM file_importance WHERE project_path = ?",
                ROW_MAPPER, projectPath);
        int updated = 0;
        for (FileImportance row : rows) {
            double fresh = computeImportanceScore(row.getReadCount(), row.getEditCount(), row.getLastAccessedAt(), now);
            if (Math.abs(fresh - row.getImportanceScore()) > REFRESH_TOLERANCE) {
                jdbcTemplate.update("""
                        UPDATE file_importance SET importance_score = ?
                        WHERE project_path = ? AND file_path = ?""",
                        fresh, projectPath, row.getFilePath());
                updated++;
            }
        }
        log.debug("Refreshed file importance [project={}, updated={}/{}]", projectPath, updated, rows.size());
        return updated;
    }
}
