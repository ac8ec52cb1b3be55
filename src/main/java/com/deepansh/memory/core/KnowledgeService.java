package com.deepansh.memory.core;

import com.deepansh.memory.context.DeduplicationService;
import com.deepansh.memory.context.DuplicateCandidate;
import com.deepansh.memory.memory.KnowledgeRepository;
import com.deepansh.memory.memory.KnowledgeUsageRepository;
import com.deepansh.memory.memory.SessionRepository;
import com.deepansh.memory.memory.ValueMetricsRepository;
import com.deepansh.memory.model.KnowledgeType;
import com.deepansh.memory.model.KnowledgeUsage;
import com.deepansh.memory.model.PromotedKnowledge;
import com.deepansh.memory.model.Session;
import com.deepansh.memory.model.UsageType;
import com.deepansh.memory.store.Timestamps;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.support.TransactionTemplate;
import org.springframework.util.IdGenerator;

import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Promotion of session findings into durable project knowledge, and
 * bookkeeping of how that knowledge gets used.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class KnowledgeService {

    public static final int DEFAULT_LIST_LIMIT = 20;
    public static final int MAX_LIST_LIMIT = 100;

    private final KnowledgeRepository knowledgeRepository;
    private final KnowledgeUsageRepository usageRepository;
    private final SessionRepository sessionRepository;
    private final ValueMetricsRepository valueMetricsRepository;
    private final DeduplicationService deduplicationService;
    private final TransactionTemplate transactionTemplate;
    private final Clock clock;
    private final IdGenerator idGenerator;

    /**
     * Writes a knowledge item unless it duplicates an existing one.
     *
     * A duplicate is not an error: the outcome carries the best matching
     * item and nothing is written. allowDuplicate skips the check. With
     * supersedes set, the replaced item never counts as a duplicate and is
     * marked superseded once the new item is stored.
     */
    public OperationResult<PromotionOutcome> promote(PromoteKnowledgeRequest request) {
        String invalid = validate(request);
        if (invalid != null) {
            return OperationResult.failure(invalid);
        }
        String projectPath = request.getProjectPath();

        try {
            String branch = null;
            if (request.getSessionId() != null) {
                Optional<Session> source = sessionRepository.findById(request.getSessionId());
                if (source.isEmpty()) {
                    return OperationResult.failure("Session " + request.getSessionId() + " not found.");
                }
                branch = source.get().getBranch();
            }
            String supersedes = request.getSupersedes();
            if (supersedes != null) {
                Optional<PromotedKnowledge> replaced = knowledgeRepository.findById(supersedes);
                if (replaced.isEmpty() || !projectPath.equals(replaced.get().getProjectPath())) {
                    return OperationResult.failure("Knowledge " + supersedes + " not found in " + projectPath + ".");
                }
            }

            if (!request.isAllowDuplicate()) {
                Optional<DuplicateCandidate> best = deduplicationService
                        .findDuplicates(projectPath, request.getTitle(), request.getContent(), supersedes)
                        .stream()
                        .findFirst();
                if (best.isPresent()) {
                    log.warn("Promotion refused, duplicate of {} [{} match, similarity={}]",
                            best.get().existing().getKnowledgeId(),
                            best.get().matchType().value(),
                            String.format("%.2f", best.get().similarity()));
                    return OperationResult.success(PromotionOutcome.duplicate(best.get()));
                }
            }

            PromotedKnowledge knowledge = PromotedKnowledge.builder()
                    .knowledgeId(idGenerator.generateId().toString())
                    .projectPath(projectPath)
                    .sessionId(request.getSessionId())
                    .sourceEventId(request.getSourceEventId())
                    .title(request.getTitle())
                    .content(request.getContent())
                    .knowledgeType(request.getKnowledgeType())
                    .tags(request.getTags() == null ? new ArrayList<>() : new ArrayList<>(request.getTags()))
                    .createdAt(Timestamps.now(clock))
                    .branch(branch)
                    .contentHash(DeduplicationService.contentHash(request.getContent()))
                    .usageCount(0)
                    .build();

            transactionTemplate.executeWithoutResult(status -> {
                knowledgeRepository.insert(knowledge);
                if (supersedes != null) {
                    deduplicationService.markSuperseded(supersedes, knowledge.getKnowledgeId());
                }
            });

            int total = knowledgeRepository.counts(projectPath).total();
            log.info("Promoted knowledge [id={}, project={}, type={}]",
                    knowledge.getKnowledgeId(), projectPath, knowledge.getKnowledgeType().value());
            return OperationResult.success(PromotionOutcome.promoted(knowledge, supersedes, total));
        } catch (DataAccessException e) {
            log.error("Failed to promote knowledge for {}", projectPath, e);
            return OperationResult.failure("Failed to promote knowledge: " + e.getMessage());
        }
    }

    /** Newest first. A null limit means 20; the limit is clamped to 1..100. */
    public OperationResult<List<PromotedKnowledge>> list(String projectPath, KnowledgeType type, Integer limit) {
        if (projectPath == null || projectPath.isBlank()) {
            return OperationResult.failure("projectPath is required");
        }
        int max = limit == null ? DEFAULT_LIST_LIMIT : Math.max(1, Math.min(MAX_LIST_LIMIT, limit));
        try {
            List<PromotedKnowledge> items = knowledgeRepository.findByProject(projectPath, type, max);
            log.debug("Listed {} knowledge item(s) for {}", items.size(), projectPath);
            return OperationResult.success(items);
        } catch (DataAccessException e) {
            log.error("Failed to list knowledge for {}", projectPath, e);
            return OperationResult.failure("Failed to get knowledge: " + e.getMessage());
        }
    }

    /**
     * Records that a session used a knowledge item. Recalling a decision,
     * applying a pattern or applying an error resolution also feeds the
     * project's value metrics.
     */
    public OperationResult<KnowledgeUsage> recordUsage(String knowledgeId, String sessionId, UsageType usageType) {
        if (knowledgeId == null || sessionId == null || usageType == null) {
            return OperationResult.failure("knowledgeId, sessionId and usageType are required");
        }
        try {
            Optional<PromotedKnowledge> found = knowledgeRepository.findById(knowledgeId);
            if (found.isEmpty()) {
                return OperationResult.failure("Knowledge " + knowledgeId + " not found.");
            }
            if (sessionRepository.findById(sessionId).isEmpty()) {
                return OperationResult.failure("Session " + sessionId + " not found.");
            }
            PromotedKnowledge knowledge = found.get();

            KnowledgeUsage usage = transactionTemplate.execute(status -> {
                KnowledgeUsage recorded = usageRepository.record(knowledgeId, sessionId, usageType);
                creditValue(knowledge, usageType);
                return recorded;
            });
            log.info("Knowledge {} {} in session {}", knowledgeId, usageType.value(), sessionId);
            return OperationResult.success(usage);
        } catch (DataAccessException e) {
            log.error("Failed to record usage of knowledge {}", knowledgeId, e);
            return OperationResult.failure("Failed to record knowledge usage: " + e.getMessage());
        }
    }

    private void creditValue(PromotedKnowledge knowledge, UsageType usageType) {
        String projectPath = knowledge.getProjectPath();
        switch (knowledge.getKnowledgeType()) {
            case DECISION -> {
                if (usageType == UsageType.RECALLED) {
                    valueMetricsRepository.incrementDecisionRecall(projectPath, 1);
                }
            }
            case PATTERN -> {
                if (usageType == UsageType.APPLIED) {
                    valueMetricsRepository.incrementPatternApplied(projectPath, 1);
                }
            }
            case ERROR_RESOLVED -> {
                if (usageType == UsageType.APPLIED) {
                    valueMetricsRepository.incrementErrorPrevented(projectPath, 1);
                }
            }
            case MILESTONE -> {
                // milestones carry no time-saving estimate
            }
        }
    }

    private String validate(PromoteKnowledgeRequest request) {
        if (request.getProjectPath() == null || request.getProjectPath().isBlank()) {
            return "projectPath is required";
        }
        if (request.getTitle() == null || request.getTitle().isBlank()) {
            return "title is required";
        }
        if (request.getContent() == null || request.getContent().isBlank()) {
            return "content is required";
        }
        if (request.getKnowledgeType() == null) {
            return "knowledgeType is required";
        }
        return null;
    }
}
