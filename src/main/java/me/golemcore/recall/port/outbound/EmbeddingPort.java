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

import me.golemcore.recall.domain.model.Vocabulary;

import java.util.List;

/**
 * Port for generating text embeddings (dense vector representations). Used for
 * semantic similarity search over the knowledge base.
 *
 * <p>
 * The representation is a {@link Vocabulary} learned from the corpus. Fitting
 * a vocabulary has no side effects; it only becomes the one used by
 * {@link #embed(String)} once published. A rebuild can therefore embed the
 * whole corpus with a candidate vocabulary and publish it only after the
 * vectors are stored.
 */
public interface EmbeddingPort {

    /**
     * Fit a vocabulary to a corpus snapshot without publishing it.
     *
     * @param documents
     *            corpus texts, not empty
     * @return the candidate vocabulary
     * @throws IllegalArgumentException
     *             if the corpus is empty
     */
    Vocabulary fitVocabulary(List<String> documents);

    /**
     * Make a vocabulary the current one.
     */
    void publishVocabulary(Vocabulary vocabulary);

    /**
     * Fit and publish in one step. An empty corpus leaves any previously built
     * vocabulary untouched.
     *
     * @param documents
     *            corpus texts
     */
    void buildVocabulary(List<String> documents);

    /**
     * Generate embedding for a single text with the current vocabulary.
     *
     * @param text
     *            the text to embed
     * @return vector of {@link #getDimension()} floats
     * @throws IllegalStateException
     *             if no vocabulary has been published yet
     */
    float[] embed(String text);

    /**
     * Generate embedding for a single text with the given vocabulary.
     */
    float[] embed(Vocabulary vocabulary, String text);

    /**
     * Generate embeddings for multiple texts with the given vocabulary.
     *
     * @param vocabulary
     *            vocabulary to embed with, published or not
     * @param texts
     *            list of texts to embed
     * @return list of vector representations, in input order
     */
    default List<float[]> embedBatch(Vocabulary vocabulary, List<String> texts) {
        return texts.stream()
                .map(text -> embed(vocabulary, text))
                .toList();
    }

    /**
     * Whether {@link #embed(String)} can be called.
     */
    boolean isVocabularyReady();

    /**
     * Get the embedding dimension.
     *
     * @return vector dimension (768 for the TF-IDF embedding)
     */
    int getDimension();

    /**
     * Get the model name.
     *
     * @return model identifier
     */
    String getModel();

    /**
     * Check if the embedding service is available.
     */
    boolean isAvailable();
}
