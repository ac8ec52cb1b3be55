package com.deepansh.memory.context;

import com.deepansh.memory.model.Session;

public record ScoredSession(Session session, double score) {
}
