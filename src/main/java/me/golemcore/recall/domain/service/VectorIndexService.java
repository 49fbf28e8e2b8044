package me.golemcore.recall.domain.service;

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
import me.golemcore.recall.domain.model.VecStats;
import me.golemcore.recall.domain.model.VectorSearchResult;
import me.golemcore.recall.domain.model.Vocabulary;
import me.golemcore.recall.port.outbound.EmbeddingPort;
import me.golemcore.recall.port.outbound.KnowledgeIndexPort;
import me.golemcore.recall.port.outbound.VectorStorePort;
import org.springframework.stereotype.Service;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Vector similarity layer over the knowledge corpus.
 *
 * <p>
 * Combines the embedding function, the vector store and the lexical corpus:
 * <ul>
 * <li>{@link #indexAllKnowledge()} - rebuild the vocabulary and every embedding
 * from the full corpus</li>
 * <li>{@link #indexEntry(String, String)} - incremental upsert using the
 * vocabulary currently in memory</li>
 * <li>{@link #search(float[], int)} / {@link #searchText(String, int)} -
 * nearest-neighbour lookup, best effort</li>
 * </ul>
 *
 * @see EmbeddingPort
 * @see VectorStorePort
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class VectorIndexService {

    private final EmbeddingPort embeddingPort;
    private final VectorStorePort vectorStorePort;
    private final KnowledgeIndexPort knowledgeIndexPort;

    public void initialize() {
        vectorStorePort.initialize();
    }

    /**
     * Rebuild the vocabulary from the full corpus and re-embed every entry.
     *
     * <p>
     * The corpus is embedded with a candidate vocabulary. The clear and
     * reinsert of vectors is one transaction, and the candidate is published
     * only after it commits, so a failure leaves both the previous vectors and
     * the previous vocabulary in place.
     *
     * @return number of entries indexed, 0 when the corpus is empty
     */
    public int indexAllKnowledge() {
        List<KnowledgeEntry> corpus = knowledgeIndexPort.readCorpus();
        if (corpus.isEmpty()) {
            log.info("[VectorIndex] Corpus is empty, nothing to index");
            return 0;
        }

        List<String> texts = corpus.stream().map(KnowledgeEntry::getText).toList();
        Vocabulary candidate = embeddingPort.fitVocabulary(texts);
        List<float[]> vectors = embeddingPort.embedBatch(candidate, texts);

        Map<String, float[]> embeddings = new LinkedHashMap<>();
        for (int i = 0; i < corpus.size(); i++) {
            embeddings.put(corpus.get(i).resolveId(), vectors.get(i));
        }

        int indexed = vectorStorePort.replaceAll(embeddings);
        embeddingPort.publishVocabulary(candidate);
        log.info("[VectorIndex] Indexed {} entries with {}", indexed, embeddingPort.getModel());
        return indexed;
    }

    /**
     * Embed a single text with the current vocabulary and upsert it.
     *
     * @throws IllegalStateException
     *             if no vocabulary has been built
     */
    public void indexEntry(String id, String text) {
        upsertEmbedding(id, embeddingPort.embed(text));
    }

    public void upsertEmbedding(String id, float[] embedding) {
        vectorStorePort.upsert(id, embedding);
    }

    public boolean deleteEmbedding(String id) {
        return vectorStorePort.delete(id);
    }

    public List<VectorSearchResult> search(float[] embedding, int limit) {
        return vectorStorePort.search(embedding, limit);
    }

    /**
     * Embed the query and search. Returns an empty list when the vocabulary is
     * not ready.
     */
    public List<VectorSearchResult> searchText(String query, int limit) {
        if (query == null || query.isBlank()) {
            return List.of();
        }
        if (!embeddingPort.isVocabularyReady()) {
            log.warn("[VectorIndex] Vocabulary not built, vector search skipped");
            return List.of();
        }
        return search(embeddingPort.embed(query), limit);
    }

    /**
     * Embed text with the current vocabulary.
     */
    public float[] embed(String text) {
        return embeddingPort.embed(text);
    }

    public VecStats getVecStats() {
        return new VecStats(vectorStorePort.count(), embeddingPort.getDimension());
    }

    /**
     * Whether the vector table holds at least one vector.
     */
    public boolean isVecAvailable() {
        return vectorStorePort.count() > 0;
    }

    public boolean isVocabularyReady() {
        return embeddingPort.isVocabularyReady();
    }
}
