package com.deepansh.memory.tool;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.function.Function;

/**
 * Typed reads from a tool argument map. Missing or malformed values raise
 * IllegalArgumentException with a message fit for an "ERROR: ..." reply.
 */
public final class ToolArguments {

    private final Map<String, Object> arguments;

    private ToolArguments(Map<String, Object> arguments) {
        this.arguments = arguments == null ? Map.of() : arguments;
    }

    public static ToolArguments of(Map<String, Object> arguments) {
        return new ToolArguments(arguments);
    }

    public String requireString(String key) {
        String value = optionalString(key);
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("'" + key + "' is required");
        }
        return value;
    }

    public String optionalString(String key) {
        Object value = arguments.get(key);
        if (value == null) {
            return null;
        }
        if (value instanceof String s) {
            return s;
        }
        throw new IllegalArgumentException("'" + key + "' must be a string");
    }

    public Integer optionalInt(String key) {
        Object value = arguments.get(key);
        if (value == null) {
            return null;
        }
        if (value instanceof Number n) {
            return n.intValue();
        }
        if (value instanceof String s) {
            try {
                return Integer.parseInt(s.trim());
            } catch (NumberFormatException e) {
                throw new IllegalArgumentException("'" + key + "' must be an integer, got '" + s + "'", e);
            }
        }
        throw new IllegalArgumentException("'" + key + "' must be an integer");
    }

    public Double optionalDouble(String key) {
        Object value = arguments.get(key);
        if (value == null) {
            return null;
        }
        if (value instanceof Number n) {
            return n.doubleValue();
        }
        if (value instanceof String s) {
            try {
                return Double.parseDouble(s.trim());
            } catch (NumberFormatException e) {
                throw new IllegalArgumentException("'" + key + "' must be a number, got '" + s + "'", e);
            }
        }
        throw new IllegalArgumentException("'" + key + "' must be a number");
    }

    public boolean flag(String key) {
        Object value = arguments.get(key);
        if (value == null) {
            return false;
        }
        if (value instanceof Boolean b) {
            return b;
        }
        if (value instanceof String s) {
            return Boolean.parseBoolean(s.trim());
        }
        throw new IllegalArgumentException("'" + key + "' must be a boolean");
    }

    public List<String> stringList(String key) {
        Object value = arguments.get(key);
        if (value == null) {
            return new ArrayList<>();
        }
        if (value instanceof List<?> list) {
            List<String> result = new ArrayList<>(list.size());
            for (Object item : list) {
                result.add(String.valueOf(item));
            }
            return result;
        }
        throw new IllegalArgumentException("'" + key + "' must be an array of strings");
    }

    @SuppressWarnings("unchecked")
    public Map<String, Object> requireObject(String key) {
        Object value = arguments.get(key);
        if (value == null) {
            throw new IllegalArgumentException("'" + key + "' is required");
        }
        if (value instanceof Map<?, ?> map) {
            return (Map<String, Object>) map;
        }
        throw new IllegalArgumentException("'" + key + "' must be an object");
    }

    /** Parses an enum-like value with the given parser; null when absent. */
    public <T> T optionalValue(String key, Function<String, T> parser) {
        String raw = optionalString(key);
        if (raw == null || raw.isBlank()) {
            return null;
        }
        return parser.apply(raw.trim());
    }
}
