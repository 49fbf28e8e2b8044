package me.golemcore.recall.adapter.outbound.sqlite;

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

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.recall.domain.model.Episode;
import me.golemcore.recall.domain.service.IsoTimestamps;
import me.golemcore.recall.infrastructure.persistence.KnowledgeDatabase;
import me.golemcore.recall.infrastructure.persistence.KnowledgeStoreException;
import me.golemcore.recall.port.outbound.EpisodicLogPort;
import org.springframework.dao.DataAccessException;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Component;

import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * SQLite implementation of {@link EpisodicLogPort}.
 *
 * <p>
 * {@code episodes_fts} is an external-content FTS5 table over
 * {@code episodes}. The {@code episodes_ai} and {@code episodes_ad} triggers
 * mirror every insert and delete into it, so recall never needs a separate
 * re-index step and pruning cleans the shadow index too.
 *
 * <p>
 * Tags are stored as a JSON array. Anything that does not parse as an array
 * reads back as no tags.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class SqliteEpisodicLogAdapter implements EpisodicLogPort {

    private static final List<String> SCHEMA = List.of(
            """
                    CREATE TABLE IF NOT EXISTS episodes (
                      id INTEGER PRIMARY KEY AUTOINCREMENT,
                      sprint_phase TEXT NOT NULL,
                      timestamp TEXT NOT NULL,
                      action TEXT NOT NULL,
                      outcome TEXT NOT NULL,
                      lesson TEXT,
                      tags TEXT NOT NULL DEFAULT '[]'
                    )""",
            "CREATE INDEX IF NOT EXISTS idx_episodes_timestamp ON episodes(timestamp)",
            "CREATE INDEX IF NOT EXISTS idx_episodes_phase ON episodes(sprint_phase)",
            """
                    CREATE VIRTUAL TABLE IF NOT EXISTS episodes_fts USING fts5(
                      action, outcome, lesson, tags,
                      content='episodes',
                      content_rowid='id'
                    )""",
            """
                    CREATE TRIGGER IF NOT EXISTS episodes_ai AFTER INSERT ON episodes BEGIN
                      INSERT INTO episodes_fts(rowid, action, outcome, lesson, tags)
                      VALUES (new.id, new.action, new.outcome, COALESCE(new.lesson, ''), new.tags);
                    END""",
            """
                    CREATE TRIGGER IF NOT EXISTS episodes_ad AFTER DELETE ON episodes BEGIN
                      INSERT INTO episodes_fts(episodes_fts, rowid, action, outcome, lesson, tags)
                      VALUES ('delete', old.id, old.action, old.outcome, COALESCE(old.lesson, ''), old.tags);
                    END""");

    private static final String COLUMNS = "e.id, e.sprint_phase, e.timestamp, e.action, e.outcome, e.lesson, e.tags";
    private static final String INSERT = "INSERT INTO episodes (sprint_phase, timestamp, action, outcome, lesson, tags)"
            + " VALUES (?, ?, ?, ?, ?, ?)";
    private static final String MATCH = "SELECT " + COLUMNS + " FROM episodes e"
            + " WHERE e.id IN (SELECT rowid FROM episodes_fts WHERE episodes_fts MATCH ?)";
    private static final String RECENT = "SELECT " + COLUMNS + " FROM episodes e WHERE e.sprint_phase = ?";
    private static final String NEWEST_FIRST = " ORDER BY e.timestamp DESC, e.id DESC LIMIT ?";

    private final KnowledgeDatabase database;
    private final ObjectMapper objectMapper;

    private final RowMapper<Episode> episodeMapper = (rs, rowNum) -> mapEpisode(rs);

    @Override
    public void initialize() {
        try {
            database.execute(jdbc -> {
                SCHEMA.forEach(jdbc::execute);
                return null;
            });
            log.debug("[Episodic] Tables ready");
        } catch (DataAccessException e) {
            throw new KnowledgeStoreException("Failed to initialize episode tables", e);
        }
    }

    @Override
    public long insert(Episode episode) {
        String tags = writeTags(episode.getTags());
        try {
            Long id = database.inTransaction(jdbc -> {
                jdbc.update(INSERT, episode.getSprintPhase(), IsoTimestamps.format(episode.getTimestamp()),
                        episode.getAction(), episode.getOutcome(), episode.getLesson(), tags);
                return jdbc.queryForObject("SELECT last_insert_rowid()", Long.class);
            });
            if (id == null) {
                throw new KnowledgeStoreException("No id generated for episode");
            }
            return id;
        } catch (DataAccessException e) {
            throw new KnowledgeStoreException("Failed to record episode", e);
        }
    }

    @Override
    public List<Episode> match(String matchExpression, String sprintPhase, int limit) {
        String sql = MATCH + (sprintPhase != null ? " AND e.sprint_phase = ?" : "") + NEWEST_FIRST;
        Object[] args = sprintPhase != null
                ? new Object[] { matchExpression, sprintPhase, limit }
                : new Object[] { matchExpression, limit };
        try {
            return database.execute(jdbc -> jdbc.query(sql, episodeMapper, args));
        } catch (DataAccessException e) {
            log.warn("[Episodic] Recall query failed for '{}': {}", matchExpression, e.getMessage());
            return List.of();
        }
    }

    @Override
    public List<Episode> findRecent(String sprintPhase, int limit) {
        try {
            return database.execute(jdbc -> jdbc.query(RECENT + NEWEST_FIRST, episodeMapper, sprintPhase, limit));
        } catch (DataAccessException e) {
            log.warn("[Episodic] Failed to read recent episodes of {}: {}", sprintPhase, e.getMessage());
            return List.of();
        }
    }

    @Override
    public int deleteOlderThan(Instant cutoff) {
        try {
            return database.inTransaction(
                    jdbc -> jdbc.update("DELETE FROM episodes WHERE timestamp < ?", IsoTimestamps.format(cutoff)));
        } catch (DataAccessException e) {
            throw new KnowledgeStoreException("Failed to prune episodes", e);
        }
    }

    @Override
    public int count() {
        try {
            Integer count = database.execute(
                    jdbc -> jdbc.queryForObject("SELECT count(*) FROM episodes", Integer.class));
            return count != null ? count : 0;
        } catch (DataAccessException e) {
            log.debug("[Episodic] Count unavailable: {}", e.getMessage());
            return 0;
        }
    }

    private Episode mapEpisode(ResultSet rs) throws SQLException {
        return Episode.builder()
                .id(rs.getLong("id"))
                .sprintPhase(rs.getString("sprint_phase"))
                .timestamp(IsoTimestamps.parse(rs.getString("timestamp")).orElse(null))
                .action(rs.getString("action"))
                .outcome(rs.getString("outcome"))
                .lesson(rs.getString("lesson"))
                .tags(parseTags(rs.getString("tags")))
                .build();
    }

    private String writeTags(List<String> tags) {
        try {
            return objectMapper.writeValueAsString(tags != null ? tags : List.of());
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Episode tags are not serializable", e);
        }
    }

    List<String> parseTags(String json) {
        List<String> tags = new ArrayList<>();
        if (json == null || json.isBlank()) {
            return tags;
        }
        try {
            JsonNode tree = objectMapper.readTree(json);
            if (tree == null || !tree.isArray()) {
                return tags;
            }
            for (JsonNode element : tree) {
                if (element.isValueNode() && !element.isNull()) {
                    tags.add(element.asText());
                }
            }
        } catch (JsonProcessingException e) {
            log.debug("[Episodic] Ignoring malformed tags: {}", e.getMessage());
        }
        return tags;
    }
}
