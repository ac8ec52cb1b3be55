package com.deepansh.memory.context;

import com.deepansh.memory.memory.KnowledgeRepository;
import com.deepansh.memory.model.PromotedKnowledge;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HexFormat;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.regex.Pattern;

/**
 * Decides whether new knowledge repeats something the project already holds.
 *
 * Two passes, both over non-superseded items of the same project:
 * 1. Exact: SHA-256 of the normalized content. A hit is the only candidate.
 * 2. Title: normalized Levenshtein similarity of titles, kept at >= 0.85.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class DeduplicationService {

    public static final double TITLE_THRESHOLD = 0.85;

    private static final Pattern WHITESPACE = Pattern.compile("\\s+", Pattern.UNICODE_CHARACTER_CLASS);

    private final KnowledgeRepository knowledgeRepository;

    /** Lower-case in the root locale, Unicode whitespace runs collapsed to one space, trimmed. */
    public static String normalizeContent(String content) {
        if (content == null) {
            return "";
        }
        return WHITESPACE.matcher(content.toLowerCase(Locale.ROOT)).replaceAll(" ").trim();
    }

    /** Hex SHA-256 of the normalized content. */
    public static String contentHash(String content) {
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            byte[] hash = digest.digest(normalizeContent(content).getBytes(StandardCharsets.UTF_8));
            return HexFormat.of().formatHex(hash);
        } catch (NoSuchAlgorithmException e) {
            // every JRE ships SHA-256
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }

    public static int levenshteinDistance(String a, String b) {
        int[][] dp = new int[a.length() + 1][b.length() + 1];

        for (int i = 0; i <= a.length(); i++) {
            for (int j = 0; j <= b.length(); j++) {
                if (i == 0) {
                    dp[i][j] = j;
                } else if (j == 0) {
                    dp[i][j] = i;
                } else {
                    int cost = a.charAt(i - 1) == b.charAt(j - 1) ? 0 : 1;
                    dp[i][j] = Math.min(
                            Math.min(dp[i - 1][j] + 1, dp[i][j - 1] + 1),
                            dp[i - 1][j - 1] + cost
                    );
                }
            }
        }

        return dp[a.length()][b.length()];
    }

    /**
     * 1 - distance / longer length, over normalized titles. Equal (or both
     * empty) titles score 1.0.
     */
    public static double titleSimilarity(String first, String second) {
        String a = normalizeContent(first);
        String b = normalizeContent(second);
        if (a.equals(b)) {
            return 1.0;
        }
        int maxLen = Math.max(a.length(), b.length());
        return 1.0 - ((double) levenshteinDistance(a, b) / maxLen);
    }

    /**
     * Candidates in descending similarity. Empty when nothing in the project
     * is close enough.
     */
    public List<DuplicateCandidate> findDuplicates(String projectPath, String title, String content) {
        return findDuplicates(projectPath, title, content, null);
    }

    /**
     * Same as {@link #findDuplicates(String, String, String)}, ignoring the
     * item being replaced in both passes. A null excludeId ignores nothing.
     */
    public List<DuplicateCandidate> findDuplicates(String projectPath, String title, String content,
                                                   String excludeId) {
        Optional<PromotedKnowledge> exact =
                knowledgeRepository.findCurrentByHash(projectPath, contentHash(content), excludeId);
        if (exact.isPresent()) {
            log.debug("Exact duplicate [project={}, existing={}]", projectPath, exact.get().getKnowledgeId());
            return List.of(new DuplicateCandidate(exact.get(), 1.0, MatchType.EXACT));
        }

        List<DuplicateCandidate> candidates = new ArrayList<>();
        for (PromotedKnowledge existing : knowledgeRepository.findAllCurrent(projectPath)) {
            if (existing.getKnowledgeId().equals(excludeId)) {
                continue;
            }
            double similarity = titleSimilarity(title, existing.getTitle());
            if (similarity >= TITLE_THRESHOLD) {
                candidates.add(new DuplicateCandidate(existing, similarity, MatchType.TITLE));
            }
        }
        // List.sort is stable, equal scores keep store order
        candidates.sort(Comparator.comparingDouble(DuplicateCandidate::similarity).reversed());
        log.debug("Title duplicate check [project={}, candidates={}]", projectPath, candidates.size());
        return candidates;
    }

    public boolean markSuperseded(String oldKnowledgeId, String newKnowledgeId) {
        boolean updated = knowledgeRepository.markSuperseded(oldKnowledgeId, newKnowledgeId);
        if (updated) {
            log.info("Knowledge {} superseded by {}", oldKnowledgeId, newKnowledgeId);
        } else {
            log.warn("Cannot supersede knowledge {}: not found", oldKnowledgeId);
        }
        return updated;
    }
}
