package me.golemcore.recall.infrastructure.config;

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

import lombok.extern.slf4j.Slf4j;
import me.golemcore.recall.adapter.outbound.vector.NoOpSemanticSearchAdapter;
import me.golemcore.recall.adapter.outbound.vector.VectorSemanticSearchAdapter;
import me.golemcore.recall.domain.service.VectorIndexService;
import me.golemcore.recall.port.outbound.SemanticSearchPort;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Chooses the semantic search capability once, at startup, from
 * {@code recall.vector.enabled}.
 */
@Configuration
@Slf4j
public class SemanticSearchConfiguration {

    @Bean
    public SemanticSearchPort semanticSearchPort(RecallProperties properties, VectorIndexService vectorIndexService) {
        if (properties.getVector().isEnabled()) {
            log.info("[SemanticSearch] Vector similarity enabled");
            return new VectorSemanticSearchAdapter(vectorIndexService);
        }
        log.info("[SemanticSearch] Vector similarity disabled, lexical ranking only");
        return new NoOpSemanticSearchAdapter();
    }
}
