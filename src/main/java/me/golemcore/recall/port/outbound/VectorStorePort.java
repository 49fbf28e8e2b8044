package me.golemcore.recall.port.outbound;

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

import me.golemcore.recall.domain.model.VectorSearchResult;

import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Port for durable nearest-neighbour search over embeddings keyed by string
 * entry ids.
 *
 * <p>
 * Each entry id maps to a monotonic integer handle; the vector itself is
 * stored under the handle.
 */
public interface VectorStorePort {

    /**
     * Create the vector and metadata tables if absent. Idempotent.
     */
    void initialize();

    /**
     * Insert or replace the embedding for an entry. An existing entry keeps its
     * handle.
     */
    void upsert(String id, float[] embedding);

    /**
     * Remove the entry and its vector.
     *
     * @return {@code true} if the entry existed
     */
    boolean delete(String id);

    /**
     * Nearest neighbours of the query, most similar first. Failures yield an
     * empty list.
     *
     * @param query
     *            query embedding
     * @param limit
     *            maximum results, clamped by the implementation
     */
    List<VectorSearchResult> search(float[] query, int limit);

    /**
     * Atomically replace every stored vector with the given entries.
     *
     * @param embeddings
     *            entry id to embedding, in insertion order
     * @return number of entries stored
     */
    int replaceAll(Map<String, float[]> embeddings);

    Optional<Long> findHandle(String id);

    /**
     * Number of stored vectors, or 0 when the table is unavailable.
     */
    int count();
}
