package com.deepansh.memory;

import com.deepansh.memory.config.MemoryProperties;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;

@SpringBootApplication
@EnableConfigurationProperties(MemoryProperties.class)
public class SessionMemoryApplication {
    public static void main(String[] args) {
        SpringApplication.run(SessionMemoryApplication.class, args);
    }
}
