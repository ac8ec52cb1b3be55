package com.deepansh.memory.core;

import com.deepansh.memory.model.AgentInfo;
import com.deepansh.memory.model.KnowledgeCounts;
import com.deepansh.memory.model.ValueMetrics;
import com.deepansh.memory.model.ValueSummary;

import java.util.List;

public record ValueReport(ValueMetrics metrics, KnowledgeCounts knowledge, ValueSummary summary, List<AgentInfo> agents) {
}
