package com.deepansh.memory.core;

import com.deepansh.memory.config.MemoryProperties;
import com.deepansh.memory.memory.AgentRepository;
import com.deepansh.memory.memory.KnowledgeRepository;
import com.deepansh.memory.memory.SessionEventRepository;
import com.deepansh.memory.memory.SessionRepository;
import com.deepansh.memory.memory.ValueMetricsRepository;
import com.deepansh.memory.model.SessionEvent;
import com.deepansh.memory.model.SessionStats;
import com.deepansh.memory.model.StatsPeriod;
import com.deepansh.memory.model.ValueMetrics;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.Optional;

/** Read side: recall of past sessions, project stats and the value report. */
@Service
@Slf4j
@RequiredArgsConstructor
public class HistoryService {

    public static final int MAX_RECALL_LIMIT = 50;

    private final SessionRepository sessionRepository;
    private final SessionEventRepository eventRepository;
    private final KnowledgeRepository knowledgeRepository;
    private final AgentRepository agentRepository;
    private final ValueMetricsRepository valueMetricsRepository;
    private final SessionDigestAssembler digestAssembler;
    private final MemoryProperties properties;
    private final Clock clock;

    /**
     * An event type without a query lists that type's recent events across
     * the project. Anything else searches session summaries and attaches
     * each session's highlights.
     */
    public OperationResult<RecallResult> recall(RecallQuery query) {
        if (query.getProjectPath() == null || query.getProjectPath().isBlank()) {
            return OperationResult.failure("projectPath is required");
        }
        int limit = Math.max(1, Math.min(MAX_RECALL_LIMIT, query.getLimit()));
        boolean hasText = query.getQuery() != null && !query.getQuery().isBlank();

        try {
            if (query.getEventType() != null && !hasText) {
                List<SessionEvent> events =
                        eventRepository.findRecentByProject(query.getProjectPath(), query.getEventType(), limit);
                log.debug("Recall {} events for {}: {}", query.getEventType().value(), query.getProjectPath(), events.size());
                return OperationResult.success(RecallResult.ofEvents(query.getEventType(), events));
            }

            List<SessionDigest> sessions = sessionRepository
                    .search(query.getProjectPath(), query.getQuery(), query.getBranch(), limit)
                    .stream()
                    .map(s -> digestAssembler.digest(s, null, query.getEventType()))
                    .toList();
            log.debug("Recall sessions for {} [query={}]: {}", query.getProjectPath(), query.getQuery(), sessions.size());
            return OperationResult.success(RecallResult.ofSessions(query.getEventType(), sessions));
        } catch (DataAccessException e) {
            log.error("Recall failed for {}", query.getProjectPath(), e);
            return OperationResult.failure("Failed to recall: " + e.getMessage());
        }
    }

    /** Null period means a week. */
    public OperationResult<SessionStats> stats(String projectPath, StatsPeriod period) {
        if (projectPath == null || projectPath.isBlank()) {
            return OperationResult.failure("projectPath is required");
        }
        StatsPeriod resolved = period == null ? StatsPeriod.WEEK : period;
        try {
            Instant since = resolved.since(clock.instant()).orElse(null);
            SessionStats stats = sessionRepository.projectStats(projectPath, since);
            stats.setPeriod(resolved);
            return OperationResult.success(stats);
        } catch (DataAccessException e) {
            log.error("Stats failed for {}", projectPath, e);
            return OperationResult.failure("Failed to get stats: " + e.getMessage());
        }
    }

    /**
     * Value delivered to a project. Empty until the project has metrics,
     * i.e. before its first session. A null rate uses the configured one.
     */
    public OperationResult<Optional<ValueReport>> valueReport(String projectPath, Double hourlyRate) {
        if (projectPath == null || projectPath.isBlank()) {
            return OperationResult.failure("projectPath is required");
        }
        double rate = hourlyRate == null ? properties.getValue().getHourlyRate() : hourlyRate;
        if (rate < 0) {
            return OperationResult.failure("hourlyRate must not be negative");
        }
        try {
            Optional<ValueMetrics> metrics = valueMetricsRepository.find(projectPath);
            if (metrics.isEmpty()) {
                return OperationResult.success(Optional.empty());
            }
            ValueReport report = new ValueReport(
                    metrics.get(),
                    knowledgeRepository.counts(projectPath),
                    valueMetricsRepository.summary(projectPath, rate),
                    agentRepository.findAll());
            return OperationResult.success(Optional.of(report));
        } catch (DataAccessException e) {
            log.error("Value report failed for {}", projectPath, e);
            return OperationResult.failure("Failed to get value metrics: " + e.getMessage());
        }
    }
}
