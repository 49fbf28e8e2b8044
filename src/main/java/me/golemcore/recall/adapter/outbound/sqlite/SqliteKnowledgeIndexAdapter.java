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

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.recall.domain.model.KnowledgeEntry;
import me.golemcore.recall.domain.model.LexicalHit;
import me.golemcore.recall.domain.model.PromotionCandidate;
import me.golemcore.recall.infrastructure.persistence.KnowledgeDatabase;
import me.golemcore.recall.infrastructure.persistence.KnowledgeStoreException;
import me.golemcore.recall.port.outbound.KnowledgeIndexPort;
import org.springframework.dao.DataAccessException;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Component;

import java.util.Collection;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * SQLite FTS5 implementation of {@link KnowledgeIndexPort}.
 *
 * <p>
 * {@code knowledge_fts} indexes only the text column; id, source, source id
 * and date ride along unindexed. FTS5 has no UPDATE, so an upsert deletes by
 * id and inserts again. {@code retrieval_counts} tracks how often each entry
 * has been served.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class SqliteKnowledgeIndexAdapter implements KnowledgeIndexPort {

    private static final List<String> SCHEMA = List.of(
            """
                    CREATE VIRTUAL TABLE IF NOT EXISTS knowledge_fts USING fts5(
                      text,
                      id UNINDEXED,
                      source UNINDEXED,
                      source_id UNINDEXED,
                      date UNINDEXED
                    )""",
            """
                    CREATE TABLE IF NOT EXISTS retrieval_counts (
                      entry_id TEXT PRIMARY KEY,
                      count INTEGER NOT NULL DEFAULT 0,
                      last_retrieved_at TEXT
                    )""");

    private static final String INSERT = "INSERT INTO knowledge_fts (text, id, source, source_id, date)"
            + " VALUES (?, ?, ?, ?, ?)";
    private static final String MATCH = """
            SELECT text, id, source, source_id, date, -bm25(knowledge_fts) AS fts_score
            FROM knowledge_fts
            WHERE knowledge_fts MATCH ?
            ORDER BY fts_score DESC
            LIMIT ?""";
    private static final String RECORD_RETRIEVAL = """
            INSERT INTO retrieval_counts (entry_id, count, last_retrieved_at) VALUES (?, 1, ?)
            ON CONFLICT(entry_id) DO UPDATE SET count = count + 1, last_retrieved_at = excluded.last_retrieved_at""";
    private static final String PROMOTION_CANDIDATES = """
            SELECT entry_id, count, last_retrieved_at
            FROM retrieval_counts
            WHERE count >= ?
            ORDER BY count DESC, entry_id""";
    private static final String STALE_ENTRIES = """
            SELECT f.id AS entry_id,
                   COALESCE(r.count, 0) AS count,
                   COALESCE(r.last_retrieved_at, f.date) AS last_retrieved_at
            FROM knowledge_fts f
            LEFT JOIN retrieval_counts r ON r.entry_id = f.id
            WHERE r.entry_id IS NULL
               OR (r.last_retrieved_at < ? AND r.count < 2)
            ORDER BY last_retrieved_at ASC, entry_id
            LIMIT ?""";

    private static final RowMapper<KnowledgeEntry> ENTRY_MAPPER = (rs, rowNum) -> KnowledgeEntry.builder()
            .id(rs.getString("id"))
            .source(rs.getString("source"))
            .sourceId(rs.getInt("source_id"))
            .text(rs.getString("text"))
            .date(rs.getString("date"))
            .build();

    private static final RowMapper<PromotionCandidate> CANDIDATE_MAPPER = (rs, rowNum) -> PromotionCandidate
            .builder()
            .entryId(rs.getString("entry_id"))
            .count(rs.getInt("count"))
            .lastRetrieved(rs.getString("last_retrieved_at"))
            .build();

    private final KnowledgeDatabase database;

    @Override
    public void initialize() {
        try {
            database.execute(jdbc -> {
                SCHEMA.forEach(jdbc::execute);
                return null;
            });
            log.debug("[KnowledgeIndex] Tables ready");
        } catch (DataAccessException e) {
            throw new KnowledgeStoreException("Failed to initialize knowledge index", e);
        }
    }

    @Override
    public int replaceAll(List<KnowledgeEntry> entries) {
        try {
            return database.inTransaction(jdbc -> {
                jdbc.update("DELETE FROM knowledge_fts");
                for (KnowledgeEntry entry : entries) {
                    jdbc.update(INSERT, entryArgs(entry));
                }
                return entries.size();
            });
        } catch (DataAccessException e) {
            throw new KnowledgeStoreException("Failed to rebuild knowledge index", e);
        }
    }

    @Override
    public void upsert(KnowledgeEntry entry) {
        try {
            database.inTransaction(jdbc -> {
                jdbc.update("DELETE FROM knowledge_fts WHERE id = ?", entry.resolveId());
                jdbc.update(INSERT, entryArgs(entry));
                return null;
            });
        } catch (DataAccessException e) {
            throw new KnowledgeStoreException("Failed to upsert knowledge entry " + entry.resolveId(), e);
        }
    }

    @Override
    public int count() {
        try {
            Integer count = database.execute(
                    jdbc -> jdbc.queryForObject("SELECT count(*) FROM knowledge_fts", Integer.class));
            return count != null ? count : 0;
        } catch (DataAccessException e) {
            log.debug("[KnowledgeIndex] Count unavailable: {}", e.getMessage());
            return 0;
        }
    }

    @Override
    public List<KnowledgeEntry> readCorpus() {
        try {
            return database.execute(jdbc -> jdbc.query(
                    "SELECT text, id, source, source_id, date FROM knowledge_fts ORDER BY rowid", ENTRY_MAPPER));
        } catch (DataAccessException e) {
            log.warn("[KnowledgeIndex] Corpus read failed: {}", e.getMessage());
            return List.of();
        }
    }

    @Override
    public List<LexicalHit> match(String matchExpression, int limit) {
        try {
            return database.execute(jdbc -> jdbc.query(MATCH,
                    (rs, rowNum) -> new LexicalHit(ENTRY_MAPPER.mapRow(rs, rowNum), rs.getDouble("fts_score")),
                    matchExpression, limit));
        } catch (DataAccessException e) {
            log.warn("[KnowledgeIndex] FTS5 query failed for '{}': {}", matchExpression, e.getMessage());
            return List.of();
        }
    }

    @Override
    public void recordRetrievals(List<String> entryIds, String retrievedAt) {
        try {
            database.inTransaction(jdbc -> {
                for (String id : entryIds) {
                    jdbc.update(RECORD_RETRIEVAL, id, retrievedAt);
                }
                return null;
            });
        } catch (DataAccessException e) {
            throw new KnowledgeStoreException("Failed to record retrievals", e);
        }
    }

    @Override
    public Map<String, String> findLastRetrievals(Collection<String> entryIds) {
        if (entryIds.isEmpty()) {
            return Map.of();
        }
        Object[] ids = entryIds.toArray();
        String sql = "SELECT entry_id, last_retrieved_at FROM retrieval_counts WHERE entry_id IN ("
                + String.join(",", Collections.nCopies(ids.length, "?")) + ")"
                + " AND last_retrieved_at IS NOT NULL";
        try {
            return database.execute(jdbc -> {
                Map<String, String> retrievals = new HashMap<>();
                jdbc.query(sql, rs -> {
                    retrievals.put(rs.getString("entry_id"), rs.getString("last_retrieved_at"));
                }, ids);
                return retrievals;
            });
        } catch (DataAccessException e) {
            log.warn("[KnowledgeIndex] Retrieval lookup failed: {}", e.getMessage());
            return Map.of();
        }
    }

    @Override
    public List<PromotionCandidate> findPromotionCandidates(int minCount) {
        try {
            return database.execute(jdbc -> jdbc.query(PROMOTION_CANDIDATES, CANDIDATE_MAPPER, minCount));
        } catch (DataAccessException e) {
            log.warn("[KnowledgeIndex] Promotion query failed: {}", e.getMessage());
            return List.of();
        }
    }

    @Override
    public List<PromotionCandidate> findStaleEntries(String cutoff, int limit) {
        try {
            return database.execute(jdbc -> jdbc.query(STALE_ENTRIES, CANDIDATE_MAPPER, cutoff, limit));
        } catch (DataAccessException e) {
            log.warn("[KnowledgeIndex] Stale query failed: {}", e.getMessage());
            return List.of();
        }
    }

    private static Object[] entryArgs(KnowledgeEntry entry) {
        return new Object[] {
                entry.getText() != null ? entry.getText() : "",
                entry.resolveId(),
                entry.getSource(),
                entry.getSourceId(),
                entry.getDate()
        };
    }
}
