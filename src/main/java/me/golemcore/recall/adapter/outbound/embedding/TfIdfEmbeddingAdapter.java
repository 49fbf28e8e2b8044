package me.golemcore.recall.adapter.outbound.embedding;

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
import me.golemcore.recall.domain.model.Vocabulary;
import me.golemcore.recall.domain.service.TextTokenizer;
import me.golemcore.recall.infrastructure.config.RecallProperties;
import me.golemcore.recall.port.outbound.EmbeddingPort;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Self-contained TF-IDF bag-of-words embedding. No network call, no external
 * model.
 *
 * <p>
 * The vocabulary is the top-N terms of a corpus by document frequency, where N
 * is the embedding dimension. Each term owns one dimension, weighted by
 * {@code termFrequency × idf}, and the vector is L2-normalized. Text sharing no
 * term with the vocabulary embeds to the zero vector.
 *
 * <p>
 * The vocabulary is an immutable snapshot behind an atomic reference, so a
 * rebuild never exposes a half-updated term list to concurrent readers. A
 * fitted vocabulary stays a private candidate until it is published.
 *
 * <p>
 * Configuration:
 * <ul>
 * <li>{@code recall.vector.dimensions} - embedding and maximum vocabulary
 * size</li>
 * </ul>
 *
 * @see me.golemcore.recall.domain.service.VectorIndexService
 * @see me.golemcore.recall.port.outbound.EmbeddingPort
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class TfIdfEmbeddingAdapter implements EmbeddingPort {

    private static final String MODEL = "tfidf-bow";

    private final RecallProperties properties;

    private final AtomicReference<Vocabulary> vocabulary = new AtomicReference<>();

    @Override
    public void buildVocabulary(List<String> documents) {
        if (documents == null || documents.isEmpty()) {
            log.warn("[Embedding] Empty corpus, keeping current vocabulary (ready={})", isVocabularyReady());
            return;
        }
        publishVocabulary(fitVocabulary(documents));
    }

    @Override
    public Vocabulary fitVocabulary(List<String> documents) {
        if (documents == null || documents.isEmpty()) {
            throw new IllegalArgumentException("Cannot fit a vocabulary to an empty corpus");
        }

        // LinkedHashMap keeps first-seen order, which breaks frequency ties
        Map<String, Integer> docFreq = new LinkedHashMap<>();
        for (String doc : documents) {
            for (String term : new LinkedHashSet<>(TextTokenizer.embeddingTokens(doc))) {
                docFreq.merge(term, 1, Integer::sum);
            }
        }

        List<Map.Entry<String, Integer>> selected = docFreq.entrySet().stream()
                .sorted((a, b) -> Integer.compare(b.getValue(), a.getValue()))
                .limit(getDimension())
                .toList();

        int totalDocs = documents.size();
        List<String> terms = new ArrayList<>(selected.size());
        Map<String, Double> idfWeights = new LinkedHashMap<>();
        for (Map.Entry<String, Integer> entry : selected) {
            terms.add(entry.getKey());
            idfWeights.put(entry.getKey(), Math.log((double) Math.max(1, totalDocs) / entry.getValue()));
        }

        log.debug("[Embedding] Vocabulary fitted: {} terms seen, {} kept, {} documents",
                docFreq.size(), terms.size(), totalDocs);
        return new Vocabulary(terms, idfWeights, totalDocs);
    }

    @Override
    public void publishVocabulary(Vocabulary candidate) {
        if (candidate == null) {
            throw new IllegalArgumentException("Vocabulary must not be null");
        }
        vocabulary.set(candidate);
        log.info("[Embedding] Vocabulary published: {} terms, {} documents",
                candidate.size(), candidate.documentCount());
    }

    @Override
    public float[] embed(String text) {
        Vocabulary current = vocabulary.get();
        if (current == null) {
            throw new IllegalStateException("Vocabulary not built. Call buildVocabulary() first.");
        }
        return embed(current, text);
    }

    @Override
    public float[] embed(Vocabulary snapshot, String text) {
        Map<String, Integer> termFreq = new HashMap<>();
        for (String token : TextTokenizer.embeddingTokens(text)) {
            termFreq.merge(token, 1, Integer::sum);
        }

        float[] embedding = new float[getDimension()];
        List<String> terms = snapshot.terms();
        double norm = 0;
        for (int i = 0; i < terms.size(); i++) {
            String term = terms.get(i);
            Integer tf = termFreq.get(term);
            if (tf == null) {
                continue;
            }
            float weight = (float) (tf * snapshot.idf(term));
            embedding[i] = weight;
            norm += (double) weight * weight;
        }

        norm = Math.sqrt(norm);
        if (norm > 0) {
            for (int i = 0; i < embedding.length; i++) {
                embedding[i] = (float) (embedding[i] / norm);
            }
        }
        return embedding;
    }

    @Override
    public boolean isVocabularyReady() {
        return vocabulary.get() != null;
    }

    /**
     * Current vocabulary snapshot, or {@code null} before the first build.
     */
    public Vocabulary getVocabulary() {
        return vocabulary.get();
    }

    @Override
    public int getDimension() {
        return properties.getVector().getDimensions();
    }

    @Override
    public String getModel() {
        return MODEL;
    }

    @Override
    public boolean isAvailable() {
        return isVocabularyReady();
    }
}
