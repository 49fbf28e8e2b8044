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
import me.golemcore.recall.domain.model.VectorSearchResult;
import me.golemcore.recall.infrastructure.config.RecallProperties;
import me.golemcore.recall.infrastructure.persistence.KnowledgeDatabase;
import me.golemcore.recall.infrastructure.persistence.KnowledgeStoreException;
import me.golemcore.recall.infrastructure.persistence.L2DistanceFunction;
import me.golemcore.recall.infrastructure.persistence.VectorBlobs;
import me.golemcore.recall.port.outbound.VectorStorePort;
import org.springframework.dao.DataAccessException;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * SQLite implementation of {@link VectorStorePort}.
 *
 * <p>
 * Two tables back the store:
 * <ul>
 * <li>{@code vec_metadata} - auto-increment integer handle to unique string
 * {@code entry_id}</li>
 * <li>{@code vec_items} - float32 embedding blob keyed by handle</li>
 * </ul>
 *
 * <p>
 * Search runs in two phases. The first ranks {@code vec_items} alone with
 * {@code vec_distance_l2} and applies the limit; the second resolves entry ids
 * for exactly the returned handles. Joining the metadata table into the
 * ranking query would let the join decide which rows survive the limit.
 *
 * @see KnowledgeDatabase
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class SqliteVectorStoreAdapter implements VectorStorePort {

    private static final List<String> SCHEMA = List.of(
            """
                    CREATE TABLE IF NOT EXISTS vec_metadata (
                      handle INTEGER PRIMARY KEY AUTOINCREMENT,
                      entry_id TEXT NOT NULL UNIQUE
                    )""",
            """
                    CREATE TABLE IF NOT EXISTS vec_items (
                      handle INTEGER PRIMARY KEY,
                      embedding BLOB NOT NULL
                    )""");

    private static final String SELECT_HANDLE = "SELECT handle FROM vec_metadata WHERE entry_id = ?";
    private static final String INSERT_METADATA = "INSERT INTO vec_metadata (entry_id) VALUES (?)";
    private static final String INSERT_VECTOR = "INSERT INTO vec_items (handle, embedding) VALUES (?, ?)";
    private static final String DELETE_VECTOR = "DELETE FROM vec_items WHERE handle = ?";
    private static final String DELETE_METADATA = "DELETE FROM vec_metadata WHERE handle = ?";
    private static final String KNN_QUERY = "SELECT handle, " + L2DistanceFunction.NAME
            + "(embedding, ?) AS distance FROM vec_items ORDER BY distance, handle LIMIT ?";

    private final KnowledgeDatabase database;
    private final RecallProperties properties;

    private record Candidate(long handle, double distance) {
    }

    @Override
    public void initialize() {
        try {
            database.execute(jdbc -> {
                SCHEMA.forEach(jdbc::execute);
                return null;
            });
            log.debug("[VectorStore] Tables ready");
        } catch (DataAccessException e) {
            throw new KnowledgeStoreException("Failed to initialize vector tables", e);
        }
    }

    @Override
    public void upsert(String id, float[] embedding) {
        requireId(id);
        byte[] blob = encode(embedding);
        try {
            database.inTransaction(jdbc -> {
                Optional<Long> existing = selectHandle(jdbc, id);
                if (existing.isPresent()) {
                    long handle = existing.get();
                    jdbc.update(DELETE_VECTOR, handle);
                    jdbc.update(INSERT_VECTOR, handle, blob);
                    log.debug("[VectorStore] Replaced vector for {} (handle {})", id, handle);
                } else {
                    long handle = insertMetadata(jdbc, id);
                    jdbc.update(INSERT_VECTOR, handle, blob);
                    log.debug("[VectorStore] Inserted vector for {} (handle {})", id, handle);
                }
                return null;
            });
        } catch (DataAccessException e) {
            throw new KnowledgeStoreException("Failed to upsert vector for " + id, e);
        }
    }

    @Override
    public boolean delete(String id) {
        requireId(id);
        try {
            return database.inTransaction(jdbc -> {
                Optional<Long> existing = selectHandle(jdbc, id);
                if (existing.isEmpty()) {
                    return false;
                }
                jdbc.update(DELETE_VECTOR, existing.get());
                jdbc.update(DELETE_METADATA, existing.get());
                return true;
            });
        } catch (DataAccessException e) {
            throw new KnowledgeStoreException("Failed to delete vector for " + id, e);
        }
    }

    @Override
    public List<VectorSearchResult> search(float[] query, int limit) {
        if (query == null) {
            return List.of();
        }
        int effectiveLimit = clampLimit(limit);
        byte[] blob = VectorBlobs.encode(query);
        try {
            return database.execute(jdbc -> {
                List<Candidate> candidates = jdbc.query(KNN_QUERY,
                        (rs, rowNum) -> new Candidate(rs.getLong("handle"), rs.getDouble("distance")),
                        blob, effectiveLimit);
                if (candidates.isEmpty()) {
                    return List.<VectorSearchResult>of();
                }

                Map<Long, String> entryIds = selectEntryIds(jdbc, candidates);
                List<VectorSearchResult> results = new ArrayList<>(candidates.size());
                for (Candidate candidate : candidates) {
                    String entryId = entryIds.get(candidate.handle());
                    if (entryId != null) {
                        results.add(VectorSearchResult.of(entryId, candidate.distance()));
                    }
                }
                log.debug("[VectorStore] KNN returned {} of limit {}", results.size(), effectiveLimit);
                return results;
            });
        } catch (DataAccessException e) {
            log.warn("[VectorStore] Vector search failed: {}", e.getMessage());
            return List.of();
        }
    }

    @Override
    public int replaceAll(Map<String, float[]> embeddings) {
        Map<String, byte[]> encoded = new LinkedHashMap<>();
        for (Map.Entry<String, float[]> entry : embeddings.entrySet()) {
            requireId(entry.getKey());
            encoded.put(entry.getKey(), encode(entry.getValue()));
        }

        try {
            return database.inTransaction(jdbc -> {
                jdbc.update("DELETE FROM vec_items");
                jdbc.update("DELETE FROM vec_metadata");
                for (Map.Entry<String, byte[]> entry : encoded.entrySet()) {
                    long handle = insertMetadata(jdbc, entry.getKey());
                    jdbc.update(INSERT_VECTOR, handle, entry.getValue());
                }
                return encoded.size();
            });
        } catch (DataAccessException e) {
            throw new KnowledgeStoreException("Failed to rebuild vector index", e);
        }
    }

    @Override
    public Optional<Long> findHandle(String id) {
        if (id == null || id.isBlank()) {
            return Optional.empty();
        }
        try {
            return database.execute(jdbc -> selectHandle(jdbc, id));
        } catch (DataAccessException e) {
            log.warn("[VectorStore] Handle lookup failed for {}: {}", id, e.getMessage());
            return Optional.empty();
        }
    }

    @Override
    public int count() {
        try {
            Integer count = database.execute(
                    jdbc -> jdbc.queryForObject("SELECT count(*) FROM vec_items", Integer.class));
            return count != null ? count : 0;
        } catch (DataAccessException e) {
            log.debug("[VectorStore] Count unavailable: {}", e.getMessage());
            return 0;
        }
    }

    private int clampLimit(int limit) {
        return Math.max(1, Math.min(limit, properties.getVector().getMaxSearchLimit()));
    }

    private byte[] encode(float[] embedding) {
        int dimensions = properties.getVector().getDimensions();
        if (embedding == null || embedding.length != dimensions) {
            throw new IllegalArgumentException("Embedding must have " + dimensions + " dimensions, got "
                    + (embedding == null ? "null" : embedding.length));
        }
        return VectorBlobs.encode(embedding);
    }

    private void requireId(String id) {
        if (id == null || id.isBlank()) {
            throw new IllegalArgumentException("Entry id must not be blank");
        }
    }

    private static Optional<Long> selectHandle(JdbcTemplate jdbc, String id) {
        return jdbc.queryForList(SELECT_HANDLE, Long.class, id).stream().findFirst();
    }

    private static long insertMetadata(JdbcTemplate jdbc, String id) {
        jdbc.update(INSERT_METADATA, id);
        Long handle = jdbc.queryForObject("SELECT last_insert_rowid()", Long.class);
        if (handle == null) {
            throw new KnowledgeStoreException("No handle generated for " + id);
        }
        return handle;
    }

    private static Map<Long, String> selectEntryIds(JdbcTemplate jdbc, List<Candidate> candidates) {
        String placeholders = String.join(",", Collections.nCopies(candidates.size(), "?"));
        Object[] handles = candidates.stream().map(Candidate::handle).toArray();
        Map<Long, String> entryIds = new HashMap<>();
        jdbc.query("SELECT handle, entry_id FROM vec_metadata WHERE handle IN (" + placeholders + ")",
                rs -> {
                    entryIds.put(rs.getLong("handle"), rs.getString("entry_id"));
                }, handles);
        return entryIds;
    }
}
