package me.golemcore.recall.domain.model;

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

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Immutable TF-IDF vocabulary snapshot: ordered terms and their inverse
 * document frequency weights.
 *
 * <p>
 * The position of a term in {@link #terms()} is its embedding dimension.
 *
 * @param terms
 *            ordered terms, most frequent first
 * @param idfWeights
 *            {@code term -> ln(max(1, documentCount) / df)}
 * @param documentCount
 *            number of documents the vocabulary was built from
 */
public record Vocabulary(List<String> terms, Map<String, Double> idfWeights, int documentCount) {

    public Vocabulary {
        terms = List.copyOf(terms);
        idfWeights = Collections.unmodifiableMap(new LinkedHashMap<>(idfWeights));
    }

    public int size() {
        return terms.size();
    }

    public double idf(String term) {
        Double weight = idfWeights.get(term);
        return weight != null ? weight : 0.0;
    }
}
