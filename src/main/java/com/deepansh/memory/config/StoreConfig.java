package com.deepansh.memory.config;

import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.datasource.DataSourceTransactionManager;
import org.springframework.jdbc.datasource.SingleConnectionDataSource;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.support.TransactionTemplate;
import org.springframework.util.AlternativeJdkIdGenerator;
import org.springframework.util.IdGenerator;
import org.sqlite.SQLiteConfig;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.sql.Connection;
import java.sql.SQLException;
import java.time.Clock;

/**
 * Wires the single-file SQLite store.
 *
 * One process owns the store, so a single shared JDBC connection is enough:
 * every repository and every TransactionTemplate sees the same connection,
 * which also keeps an in-memory store (":memory:") consistent across beans.
 */
@Configuration
@Slf4j
public class StoreConfig {

    public static final String IN_MEMORY = ":memory:";

    @Bean(destroyMethod = "destroy")
    public SingleConnectionDataSource dataSource(MemoryProperties properties) {
        Path file = properties.getStore().resolveFile();
        try {
            Files.createDirectories(file.toAbsolutePath().getParent());
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot create store directory for " + file, e);
        }
        log.info("Opening memory store at {}", file.toAbsolutePath());
        return openDataSource(file.toAbsolutePath().toString());
    }

    @Bean
    public JdbcTemplate jdbcTemplate(SingleConnectionDataSource dataSource) {
        return new JdbcTemplate(dataSource);
    }

    @Bean
    public PlatformTransactionManager transactionManager(SingleConnectionDataSource dataSource) {
        return new DataSourceTransactionManager(dataSource);
    }

    @Bean
    public TransactionTemplate transactionTemplate(PlatformTransactionManager transactionManager) {
        return new TransactionTemplate(transactionManager);
    }

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public IdGenerator idGenerator() {
        return new AlternativeJdkIdGenerator();
    }

    /**
     * Opens a SQLite connection with foreign keys enforced and WAL journaling.
     * Pass {@link #IN_MEMORY} for a throwaway store.
     */
    public static SingleConnectionDataSource openDataSource(String location) {
        SQLiteConfig config = new SQLiteConfig();
        config.enforceForeignKeys(true);
        if (!IN_MEMORY.equals(location)) {
            config.setJournalMode(SQLiteConfig.JournalMode.WAL);
        }
        try {
            Connection connection = config.createConnection("jdbc:sqlite:" + location);
            return new SingleConnectionDataSource(connection, true);
        } catch (SQLException e) {
            throw new IllegalStateException("Cannot open SQLite store at " + location, e);
        }
    }
}
