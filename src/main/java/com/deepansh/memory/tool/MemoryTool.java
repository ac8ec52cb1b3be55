package com.deepansh.memory.tool;

import java.util.Map;

/**
 * Contract every memory tool implements.
 *
 * Arguments arrive as a JSON-like map (strings, numbers, booleans, lists,
 * nested maps) described by {@link #getInputSchema()}.
 *
 * Tools do NOT throw: failures come back as "ERROR: ..." strings so the
 * caller always gets an observation it can show or act on.
 */
public interface MemoryTool {

    /** Unique snake_case name used for dispatch */
    String getName();

    String getDescription();

    /** JSON Schema (as a Map) of the accepted arguments */
    Map<String, Object> getInputSchema();

    /** Runs the tool and returns a text observation. Never throws. */
    String execute(Map<String, Object> arguments);
}
