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

import me.golemcore.recall.domain.model.KnowledgeEntry;
import me.golemcore.recall.domain.model.LexicalHit;
import me.golemcore.recall.domain.model.PromotionCandidate;

import java.util.Collection;
import java.util.List;
import java.util.Map;

/**
 * Port for the lexical knowledge index and its retrieval tracking.
 */
public interface KnowledgeIndexPort {

    void initialize();

    /**
     * Clear the index and insert the entries in one transaction.
     *
     * @return number of entries indexed
     */
    int replaceAll(List<KnowledgeEntry> entries);

    /**
     * Delete any entry with the same id, then insert.
     */
    void upsert(KnowledgeEntry entry);

    int count();

    /**
     * Full corpus read used to rebuild derived indexes.
     */
    List<KnowledgeEntry> readCorpus();

    /**
     * Full-text match ranked by BM25.
     *
     * @param matchExpression
     *            sanitized FTS5 MATCH expression
     * @param limit
     *            maximum rows
     */
    List<LexicalHit> match(String matchExpression, int limit);

    /**
     * Increment the retrieval count of each entry and stamp its last retrieval.
     */
    void recordRetrievals(List<String> entryIds, String retrievedAt);

    /**
     * Last retrieval timestamp per entry id, for the ids that have one.
     */
    Map<String, String> findLastRetrievals(Collection<String> entryIds);

    List<PromotionCandidate> findPromotionCandidates(int minCount);

    List<PromotionCandidate> findStaleEntries(String cutoff, int limit);
}
