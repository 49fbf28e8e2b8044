package me.golemcore.recall.infrastructure.persistence;

/*
 * Copyright 2026 Aleksei Kuleshov
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 *
 * Contact: alex@kuleshov.tech
 */

import jakarta.annotation.PreDestroy;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.recall.infrastructure.config.RecallProperties;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.datasource.DataSourceTransactionManager;
import org.springframework.stereotype.Component;
import org.springframework.transaction.support.TransactionTemplate;

import java.nio.file.Path;

/**
 * Owning context for the single embedded SQLite database shared by every
 * store.
 *
 * <p>
 * The {@link SqliteDataSource} is created lazily on first use and cached for
 * the life of the process. Stores never see a raw connection: they hand a
 * {@link JdbcWork} to {@link #execute(JdbcWork)} or
 * {@link #inTransaction(JdbcWork)} and receive a {@link JdbcTemplate} bound to
 * the shared connection.
 *
 * <p>
 * All work is serialized on this object. {@link #inTransaction(JdbcWork)} runs
 * through a {@link TransactionTemplate}: it commits when the work returns and
 * rolls back when it throws. {@link #reset()} closes the connection so the
 * next caller reopens it, which gives tests an isolation hook.
 *
 * @since 1.0
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class KnowledgeDatabase implements AutoCloseable {

    public static final String IN_MEMORY = ":memory:";

    private final RecallProperties properties;

    private SqliteDataSource dataSource;
    private JdbcTemplate jdbcTemplate;
    private TransactionTemplate transactionTemplate;

    /**
     * A unit of database work.
     *
     * @param <T>
     *            result type
     */
    @FunctionalInterface
    public interface JdbcWork<T> {
        T apply(JdbcTemplate jdbc);
    }

    /**
     * Run work on the shared connection in auto-commit mode.
     *
     * @throws org.springframework.dao.DataAccessException
     *             if the work or opening the connection fails
     */
    public synchronized <T> T execute(JdbcWork<T> work) {
        open();
        return work.apply(jdbcTemplate);
    }

    /**
     * Run work inside a single transaction. Either every statement of the work
     * commits or none of them does.
     *
     * @throws org.springframework.dao.DataAccessException
     *             if the work fails; the transaction has been rolled back
     */
    public synchronized <T> T inTransaction(JdbcWork<T> work) {
        open();
        return transactionTemplate.execute(status -> work.apply(jdbcTemplate));
    }

    public synchronized boolean isOpen() {
        return dataSource != null && dataSource.isConnected();
    }

    public String getJournalMode() {
        return execute(jdbc -> jdbc.queryForObject("PRAGMA journal_mode", String.class));
    }

    /**
     * Resolved location of the database file, or {@code :memory:}.
     */
    public String getLocation() {
        String file = properties.getStorage().getDatabaseFile();
        if (IN_MEMORY.equals(file)) {
            return IN_MEMORY;
        }
        return resolveBasePath().resolve(file).toString();
    }

    public Path resolveBasePath() {
        return properties.getStorage().resolveBasePath();
    }

    /**
     * Close the connection and forget it. The next operation reopens the
     * database with the current settings.
     */
    public synchronized void reset() {
        closeDataSource();
        log.debug("[KnowledgeDatabase] Connection reset");
    }

    @Override
    @PreDestroy
    public synchronized void close() {
        closeDataSource();
    }

    private void open() {
        if (dataSource != null) {
            return;
        }
        String location = getLocation();
        boolean inMemory = IN_MEMORY.equals(location);
        dataSource = new SqliteDataSource(location,
                inMemory ? null : resolveBasePath(),
                properties.getStorage().isWalEnabled() && !inMemory);
        jdbcTemplate = new JdbcTemplate(dataSource);
        transactionTemplate = new TransactionTemplate(new DataSourceTransactionManager(dataSource));
    }

    private void closeDataSource() {
        if (dataSource == null) {
            return;
        }
        dataSource.resetConnection();
        dataSource = null;
        jdbcTemplate = null;
        transactionTemplate = null;
    }
}
