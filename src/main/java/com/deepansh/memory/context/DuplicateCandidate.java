package com.deepansh.memory.context;

import com.deepansh.memory.model.PromotedKnowledge;

/** An existing knowledge item that looks like the one being promoted. */
public record DuplicateCandidate(PromotedKnowledge existing, double similarity, MatchType matchType) {
}
