package com.deepansh.memory.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.nio.file.Path;

/**
 * Strongly-typed configuration for the memory store.
 * Bound from application.yml under the "memory" prefix.
 */
@ConfigurationProperties(prefix = "memory")
@Data
public class MemoryProperties {

    private Store store = new Store();
    private Context context = new Context();
    private Value value = new Value();

    @Data
    public static class Store {
        /** Overridden by SESSION_MEMORY_DIR in application.yml */
        private String directory = System.getProperty("user.home") + "/.session-memory";
        private String fileName = "memory.db";

        public Path resolveFile() {
            return Path.of(directory).resolve(fileName);
        }
    }

    @Data
    public static class Context {
        private int recentSessionsFetched = 10;
        private int recentSessionsSurfaced = 3;
        private int knowledgeFetched = 50;
        private int knowledgeSurfaced = 10;
        private int importantFiles = 5;
    }

    @Data
    public static class Value {
        private double hourlyRate = 50.0;
    }
}
