package com.deepansh.memory.context;

import com.deepansh.memory.model.PromotedKnowledge;

public record ScoredKnowledge(PromotedKnowledge knowledge, double score, double branchWeight, double recencyWeight) {
}
