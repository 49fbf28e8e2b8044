package me.golemcore.recall.adapter.outbound.vector;

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
import me.golemcore.recall.domain.model.VectorSearchResult;
import me.golemcore.recall.domain.service.VectorIndexService;
import me.golemcore.recall.port.outbound.SemanticSearchPort;

import java.util.List;

/**
 * Semantic search backed by the TF-IDF vector index. Available once the
 * vocabulary is built and at least one vector is stored.
 *
 * @see VectorIndexService
 */
@RequiredArgsConstructor
public class VectorSemanticSearchAdapter implements SemanticSearchPort {

    private final VectorIndexService vectorIndexService;

    @Override
    public List<VectorSearchResult> search(String text, int limit) {
        return vectorIndexService.searchText(text, limit);
    }

    @Override
    public boolean isAvailable() {
        return vectorIndexService.isVocabularyReady() && vectorIndexService.isVecAvailable();
    }
}
