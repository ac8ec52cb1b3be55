package com.deepansh.memory.context;

import com.deepansh.memory.model.PromotedKnowledge;
import com.deepansh.memory.model.Session;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Comparator;
import java.util.List;

/**
 * Orders history by how useful it is to a session on a given branch.
 *
 * <pre>
 * branch   same 1.0 | main/master 0.7 | other 0.3 | none 0.5
 * recency  &lt;1d 1.0 | &lt;7d 0.8 | &lt;30d 0.5 | older 0.3
 * usage    1 + ln(n + 1) * 0.1
 * knowledge score = branch*0.4 + recency*0.4 + (usage-1)*0.2 + 0.2
 * session score   = branch*0.5 + recency*0.5
 * </pre>
 *
 * The static functions take "now" explicitly; the instance methods read it
 * from the injected clock.
 */
@Component
@RequiredArgsConstructor
public class RelevanceRanker {

    private static final double MILLIS_PER_DAY = 86_400_000.0;

    private final Clock clock;

    public static double branchWeight(String itemBranch, String currentBranch) {
        if (itemBranch == null) {
            return 0.5;
        }
        if (itemBranch.equals(currentBranch)) {
            return 1.0;
        }
        if (itemBranch.equals("main") || itemBranch.equals("master")) {
            return 0.7;
        }
        return 0.3;
    }

    public static double recencyWeight(Instant createdAt, Instant now) {
        double days = Duration.between(createdAt, now).toMillis() / MILLIS_PER_DAY;
        if (days < 1) {
            return 1.0;
        }
        if (days < 7) {
            return 0.8;
        }
        if (days < 30) {
            return 0.5;
        }
        return 0.3;
    }

    public static double usageWeight(int usageCount) {
        return 1.0 + Math.log(usageCount + 1) * 0.1;
    }

    public static ScoredKnowledge score(PromotedKnowledge knowledge, String currentBranch, Instant now) {
        double branch = branchWeight(knowledge.getBranch(), currentBranch);
        double recency = recencyWeight(knowledge.getCreatedAt(), now);
        double usage = usageWeight(knowledge.getUsageCount());
        double score = branch * 0.4 + recency * 0.4 + (usage - 1.0) * 0.2 + 0.2;
        return new ScoredKnowledge(knowledge, score, branch, recency);
    }

    public static ScoredSession score(Session session, String currentBranch, Instant now) {
        double branch = branchWeight(session.getBranch(), currentBranch);
        double recency = recencyWeight(session.getStartedAt(), now);
        return new ScoredSession(session, branch * 0.5 + recency * 0.5);
    }

    /** Highest score first; ties keep input order. */
    public static List<ScoredKnowledge> rankKnowledge(List<PromotedKnowledge> items, String currentBranch, Instant now) {
        return items.stream()
                .map(k -> score(k, currentBranch, now))
                .sorted(Comparator.comparingDouble(ScoredKnowledge::score).reversed())
                .toList();
    }

    /** Highest score first; ties keep input order. */
    public static List<ScoredSession> rankSessions(List<Session> sessions, String currentBranch, Instant now) {
        return sessions.stream()
                .map(s -> score(s, currentBranch, now))
                .sorted(Comparator.comparingDouble(ScoredSession::score).reversed())
                .toList();
    }

    public List<ScoredKnowledge> rankKnowledge(List<PromotedKnowledge> items, String currentBranch) {
        return rankKnowledge(items, currentBranch, clock.instant());
    }

    public List<ScoredSession> rankSessions(List<Session> sessions, String currentBranch) {
        return rankSessions(sessions, currentBranch, clock.instant());
    }
}
