package com.deepansh.memory.core;

import com.deepansh.memory.config.MemoryProperties;
import com.deepansh.memory.context.RelevanceRanker;
import com.deepansh.memory.context.ScoredKnowledge;
import com.deepansh.memory.memory.AgentRepository;
import com.deepansh.memory.memory.FileImportanceRepository;
import com.deepansh.memory.memory.KnowledgeRepository;
import com.deepansh.memory.memory.KnowledgeUsageRepository;
import com.deepansh.memory.memory.SessionEventRepository;
import com.deepansh.memory.memory.SessionRepository;
import com.deepansh.memory.memory.ValueMetricsRepository;
import com.deepansh.memory.model.AgentIdentity;
import com.deepansh.memory.model.EventDetail;
import com.deepansh.memory.model.FileImportance;
import com.deepansh.memory.model.Session;
import com.deepansh.memory.model.SessionEvent;
import com.deepansh.memory.model.SessionMetrics;
import com.deepansh.memory.model.SessionStatus;
import com.deepansh.memory.model.UsageType;
import com.deepansh.memory.probe.AgentDetector;
import com.deepansh.memory.probe.WorkspaceProbe;
import com.deepansh.memory.store.Timestamps;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.support.TransactionTemplate;
import org.springframework.util.IdGenerator;

import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Drives sessions through their lifecycle.
 *
 * active → completed on end, active → abandoned when a newer session starts
 * for the same project. Both are terminal. Starting a session also assembles
 * the context bundle: ranked recent sessions, ranked knowledge and the most
 * important files of the project.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class SessionLifecycleService {

    private final SessionRepository sessionRepository;
    private final SessionEventRepository eventRepository;
    private final KnowledgeRepository knowledgeRepository;
    private final KnowledgeUsageRepository usageRepository;
    private final FileImportanceRepository fileImportanceRepository;
    private final AgentRepository agentRepository;
    private final ValueMetricsRepository valueMetricsRepository;
    private final SessionDigestAssembler digestAssembler;
    private final RelevanceRanker ranker;
    private final WorkspaceProbe workspaceProbe;
    private final AgentDetector agentDetector;
    private final TransactionTemplate transactionTemplate;
    private final MemoryProperties properties;
    private final Clock clock;
    private final IdGenerator idGenerator;

    public OperationResult<SessionContext> startSession(StartSessionRequest request) {
        if (request.getProjectPath() == null || request.getProjectPath().isBlank()) {
            return OperationResult.failure("projectPath is required");
        }
        String projectPath = request.getProjectPath();

        try {
            String branch = request.getBranch() != null
                    ? request.getBranch()
                    : workspaceProbe.currentBranch(projectPath);
            String commit = request.getGitCommit() != null
                    ? request.getGitCommit()
                    : workspaceProbe.currentCommit(projectPath).orElse(null);
            AgentIdentity agent = resolveAgent(request);

            Instant now = Timestamps.now(clock);
            Session session = Session.builder()
                    .sessionId(idGenerator.generateId().toString())
                    .projectPath(projectPath)
                    .branch(branch)
                    .startedAt(now)
                    .status(SessionStatus.ACTIVE)
                    .gitCommitStart(commit)
                    .agentType(agent.type())
                    .agentVersion(agent.version())
                    .build();

            Integer abandoned = transactionTemplate.execute(status -> {
                int count = sessionRepository.abandonActive(projectPath, now);
                sessionRepository.insert(session);
                return count;
            });
            int abandonedCount = abandoned == null ? 0 : abandoned;
            if (abandonedCount > 0) {
                log.info("Abandoned {} stale session(s) for {}", abandonedCount, projectPath);
            }
            log.info("Session started [id={}, project={}, branch={}, agent={}]",
                    session.getSessionId(), projectPath, branch, agent.type().value());

            agentRepository.upsert(agent.type());
            valueMetricsRepository.incrementSessions(projectPath);

            SessionContext context = assembleContext(session, abandonedCount);
            return OperationResult.success(context);
        } catch (DataAccessException e) {
            log.error("Failed to start session for {}", projectPath, e);
            return OperationResult.failure("Failed to start session: " + e.getMessage());
        }
    }

    /**
     * Completes an active session and returns its metrics. A session that is
     * missing or no longer active is left untouched.
     */
    public OperationResult<SessionMetrics> endSession(EndSessionRequest request) {
        String sessionId = request.getSessionId();
        if (sessionId == null || sessionId.isBlank()) {
            return OperationResult.failure("sessionId is required");
        }

        try {
            Optional<Session> ended = sessionRepository.end(
                    sessionId, Timestamps.now(clock), request.getSummary(), request.getGitCommit());
            if (ended.isEmpty()) {
                log.warn("End refused: session {} not found or already ended", sessionId);
                return OperationResult.failure("Session " + sessionId + " not found or already ended.");
            }

            Optional<SessionMetrics> metrics = sessionRepository.computeMetrics(sessionId);
            if (metrics.isEmpty()) {
                return OperationResult.failure("Session " + sessionId + " ended but metrics could not be computed.");
            }
            log.info("Session completed [id={}, events={}, duration={}s]",
                    sessionId, metrics.get().getEventsTotal(), metrics.get().getDurationSecs());
            return OperationResult.success(metrics.get());
        } catch (DataAccessException e) {
            log.error("Failed to end session {}", sessionId, e);
            return OperationResult.failure("Failed to end session: " + e.getMessage());
        }
    }

    /**
     * Appends an event to an active session. File operations also count
     * towards the file's importance in the session's project.
     */
    public OperationResult<SessionEvent> recordEvent(String sessionId, EventDetail detail) {
        if (sessionId == null || sessionId.isBlank()) {
            return OperationResult.failure("sessionId is required");
        }
        if (detail == null) {
            return OperationResult.failure("detail is required");
        }

        try {
            Optional<Session> found = sessionRepository.findById(sessionId);
            if (found.isEmpty()) {
                return OperationResult.failure("Session " + sessionId + " not found.");
            }
            Session session = found.get();
            if (!session.isActive()) {
                return OperationResult.failure(
                        "Session " + sessionId + " is " + session.getStatus().value() + ", not active.");
            }

            SessionEvent event = SessionEvent.of(
                    idGenerator.generateId().toString(), sessionId, Timestamps.now(clock), detail);

            transactionTemplate.executeWithoutResult(status -> {
                eventRepository.insert(event);
                if (detail instanceof EventDetail.FileOp fileOp) {
                    fileImportanceRepository.recordAccess(session.getProjectPath(), fileOp.path(), fileOp.operation());
                }
            });
            return OperationResult.success(event);
        } catch (DataAccessException e) {
            log.error("Failed to record event for session {}", sessionId, e);
            return OperationResult.failure("Failed to record event: " + e.getMessage());
        }
    }

    private AgentIdentity resolveAgent(StartSessionRequest request) {
        if (request.getAgentType() != null) {
            return new AgentIdentity(request.getAgentType(), request.getAgentVersion());
        }
        AgentIdentity detected = agentDetector.detect();
        if (request.getAgentVersion() != null) {
            return new AgentIdentity(detected.type(), request.getAgentVersion());
        }
        return detected;
    }

    private SessionContext assembleContext(Session session, int abandonedCount) {
        String projectPath = session.getProjectPath();
        String branch = session.getBranch();
        MemoryProperties.Context limits = properties.getContext();

        List<SessionDigest> recent = ranker
                .rankSessions(sessionRepository.findRecentCompleted(projectPath, null, limits.getRecentSessionsFetched()), branch)
                .stream()
                .limit(limits.getRecentSessionsSurfaced())
                .map(scored -> digestAssembler.digest(scored.session(), scored.score()))
                .toList();

        List<ScoredKnowledge> knowledge = ranker
                .rankKnowledge(knowledgeRepository.findByProject(projectPath, null, limits.getKnowledgeFetched()), branch)
                .stream()
                .limit(limits.getKnowledgeSurfaced())
                .toList();

        for (ScoredKnowledge scored : knowledge) {
            usageRepository.record(scored.knowledge().getKnowledgeId(), session.getSessionId(), UsageType.SURFACED);
        }
        if (!knowledge.isEmpty()) {
            valueMetricsRepository.incrementKnowledgeSurfaced(projectPath, knowledge.size());
        }
        if (!recent.isEmpty() || !knowledge.isEmpty()) {
            valueMetricsRepository.incrementContextReuse(projectPath);
        }

        fileImportanceRepository.refreshScores(projectPath);
        List<FileImportance> files = fileImportanceRepository.findTop(projectPath, limits.getImportantFiles());
        log.debug("Context for session {} [sessions={}, knowledge={}, files={}]",
                session.getSessionId(), recent.size(), knowledge.size(), files.size());

        return SessionContext.builder()
                .session(session)
                .abandonedSessions(abandonedCount)
                .recentSessions(recent)
                .knowledge(knowledge)
                .importantFiles(files)
                .build();
    }
}
