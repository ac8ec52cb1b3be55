package com.deepansh.memory.core;

import com.deepansh.memory.context.DuplicateCandidate;
import com.deepansh.memory.model.PromotedKnowledge;

/**
 * Either the newly written item, or the best duplicate that blocked the write.
 */
public record PromotionOutcome(
        Status status,
        PromotedKnowledge knowledge,
        DuplicateCandidate duplicate,
        String supersededId,
        int projectTotal) {

    public enum Status {
        PROMOTED,
        DUPLICATE
    }

    public static PromotionOutcome promoted(PromotedKnowledge knowledge, String supersededId, int projectTotal) {
        return new PromotionOutcome(Status.PROMOTED, knowledge, null, supersededId, projectTotal);
    }

    public static PromotionOutcome duplicate(DuplicateCandidate candidate) {
        return new PromotionOutcome(Status.DUPLICATE, null, candidate, null, 0);
    }

    public boolean isDuplicate() {
        return status == Status.DUPLICATE;
    }
}
