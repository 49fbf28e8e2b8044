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

import lombok.extern.slf4j.Slf4j;
import org.sqlite.Function;
import org.springframework.jdbc.datasource.SingleConnectionDataSource;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.sql.Connection;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.Properties;

/**
 * Single-connection data source over one SQLite file.
 *
 * <p>
 * The physical connection is opened on first use and never closed by callers
 * ({@code suppressClose}). Opening it creates the parent directory, switches
 * the journal to WAL when requested and registers {@code vec_distance_l2}.
 */
@Slf4j
public class SqliteDataSource extends SingleConnectionDataSource {

    private static final String DRIVER = "org.sqlite.JDBC";

    private final Path directory;
    private final boolean walEnabled;
    private volatile boolean connected;

    /**
     * @param location
     *            database file path, or {@code :memory:}
     * @param directory
     *            directory to create before opening, {@code null} for none
     * @param walEnabled
     *            whether to request write-ahead-log journaling
     */
    public SqliteDataSource(String location, Path directory, boolean walEnabled) {
        super("jdbc:sqlite:" + location, true);
        setDriverClassName(DRIVER);
        this.directory = directory;
        this.walEnabled = walEnabled;
    }

    public boolean isConnected() {
        return connected;
    }

    @Override
    protected Connection getConnectionFromDriverManager(String url, Properties props) throws SQLException {
        if (directory != null) {
            try {
                Files.createDirectories(directory);
            } catch (IOException e) {
                throw new KnowledgeStoreException("Failed to create database directory: " + directory, e);
            }
        }
        return super.getConnectionFromDriverManager(url, props);
    }

    @Override
    protected void prepareConnection(Connection con) throws SQLException {
        super.prepareConnection(con);
        if (walEnabled) {
            try (Statement stmt = con.createStatement();
                    ResultSet rs = stmt.executeQuery("PRAGMA journal_mode = WAL")) {
                log.debug("[KnowledgeDatabase] Journal mode: {}", rs.next() ? rs.getString(1) : "unknown");
            }
        }
        Function.create(con, L2DistanceFunction.NAME, new L2DistanceFunction());
        connected = true;
        log.info("[KnowledgeDatabase] Opened {}", getUrl());
    }

    @Override
    public void resetConnection() {
        super.resetConnection();
        connected = false;
    }
}
