package com.deepansh.memory.api;

import com.deepansh.memory.tool.ToolDefinition;
import com.deepansh.memory.tool.ToolRegistry;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.CommandLineRunner;
import org.springframework.stereotype.Component;

import java.util.Map;

/**
 * Command-line entry point: {@code <tool_name> [json-arguments]} runs one
 * tool and prints its observation. {@code tools} lists what is available.
 * Without arguments nothing runs.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class ToolCommandRunner implements CommandLineRunner {

    private static final TypeReference<Map<String, Object>> ARGUMENT_MAP = new TypeReference<>() {};

    private final ToolRegistry toolRegistry;
    private final ObjectMapper objectMapper;

    @Override
    public void run(String... args) {
        if (args.length == 0) {
            log.debug("No tool requested");
            return;
        }
        System.out.println(dispatch(args));
    }

    public String dispatch(String... args) {
        if ("tools".equals(args[0])) {
            StringBuilder sb = new StringBuilder("Available tools:\n");
            for (ToolDefinition definition : toolRegistry.getAllDefinitions()) {
                sb.append("  ").append(definition.getName()).append(": ")
                        .append(definition.getDescription().strip().lines().findFirst().orElse(""))
                        .append("\n");
            }
            return sb.toString().stripTrailing();
        }

        Map<String, Object> arguments;
        try {
            arguments = args.length > 1 ? objectMapper.readValue(args[1], ARGUMENT_MAP) : Map.of();
        } catch (JsonProcessingException e) {
            return "ERROR: Arguments must be a JSON object: " + e.getOriginalMessage();
        }
        return toolRegistry.execute(args[0], arguments);
    }
}
