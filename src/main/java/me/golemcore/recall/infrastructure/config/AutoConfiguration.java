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

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.recall.domain.service.EpisodicMemoryService;
import me.golemcore.recall.domain.service.KnowledgeGraphService;
import me.golemcore.recall.domain.service.KnowledgeSearchService;
import me.golemcore.recall.domain.service.VectorIndexService;
import me.golemcore.recall.infrastructure.persistence.KnowledgeDatabase;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

/**
 * Spring configuration that prepares every store on application startup.
 *
 * <p>
 * This configuration:
 * <ul>
 * <li>Provides the shared {@link Clock} and {@link ObjectMapper} beans</li>
 * <li>Creates the vector, graph, episode and knowledge index tables</li>
 * <li>Prunes expired episodes and fills an empty knowledge index</li>
 * <li>Optionally rebuilds the vector index
 * ({@code recall.vector.index-on-startup})</li>
 * </ul>
 *
 * <p>
 * A store that fails to initialize is logged and skipped; retrieval from it
 * degrades to empty results instead of preventing startup.
 *
 * @since 1.0
 */
@Configuration
@RequiredArgsConstructor
@Slf4j
public class AutoConfiguration {

    private final RecallProperties properties;
    private final KnowledgeDatabase knowledgeDatabase;
    private final VectorIndexService vectorIndexService;
    private final KnowledgeGraphService knowledgeGraphService;
    private final EpisodicMemoryService episodicMemoryService;
    private final KnowledgeSearchService knowledgeSearchService;

    @Bean
    public static Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public static ObjectMapper objectMapper() {
        ObjectMapper mapper = new ObjectMapper();
        mapper.registerModule(new JavaTimeModule());
        mapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        mapper.disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);
        return mapper;
    }

    @PostConstruct
    public void init() {
        log.info("GolemCore Recall starting...");
        log.info("Database: {}", knowledgeDatabase.getLocation());
        log.info("Knowledge Dir: {}", properties.getStorage().resolveKnowledgeDir());
        log.info("Vector Search: {} ({} dimensions)",
                properties.getVector().isEnabled() ? "enabled" : "disabled",
                properties.getVector().getDimensions());

        runStep("vector store", vectorIndexService::initialize);
        runStep("knowledge graph", knowledgeGraphService::initialize);
        runStep("episodic log", episodicMemoryService::initialize);
        runStep("knowledge index", knowledgeSearchService::initIndex);

        if (properties.getVector().isEnabled() && properties.getVector().isIndexOnStartup()) {
            runStep("vector index rebuild", () -> {
                int indexed = vectorIndexService.indexAllKnowledge();
                log.info("Vector index ready: {} entries", indexed);
            });
        }

        log.info("GolemCore Recall started successfully");
    }

    private void runStep(String name, Runnable step) {
        try {
            step.run();
        } catch (RuntimeException e) {
            log.warn("Initialization of {} failed: {}", name, e.getMessage());
        }
    }
}
