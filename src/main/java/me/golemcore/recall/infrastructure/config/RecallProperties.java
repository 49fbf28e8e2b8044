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

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.nio.file.Path;
import java.nio.file.Paths;

/**
 * Centralized configuration properties for the retrieval engine, bound from
 * application.properties.
 *
 * <p>
 * All configuration is organized under the {@code recall.*} prefix:
 * <ul>
 * <li>{@link StorageProperties} - database file and knowledge source
 * location</li>
 * <li>{@link VectorProperties} - embedding dimensions and vector search
 * limits</li>
 * <li>{@link GraphProperties} - traversal and keyword lookup defaults</li>
 * <li>{@link EpisodicProperties} - episode retention and recall limits</li>
 * <li>{@link SearchProperties} - lexical ranking, decay and promotion</li>
 * </ul>
 *
 * @since 1.0
 */
@Component
@ConfigurationProperties(prefix = "recall")
@Data
public class RecallProperties {

    private StorageProperties storage = new StorageProperties();
    private VectorProperties vector = new VectorProperties();
    private GraphProperties graph = new GraphProperties();
    private EpisodicProperties episodic = new EpisodicProperties();
    private SearchProperties search = new SearchProperties();

    // ==================== STORAGE ====================

    @Data
    public static class StorageProperties {
        private String basePath = "${user.home}/.golemcore/recall";
        /**
         * Database file name relative to the base path, or {@code :memory:}.
         */
        private String databaseFile = "knowledge.db";
        private String knowledgeDir = "knowledge";
        private boolean walEnabled = true;

        /**
         * Absolute base path with {@code ${user.home}} expanded.
         */
        public Path resolveBasePath() {
            return Paths.get(basePath.replace("${user.home}", System.getProperty("user.home")))
                    .toAbsolutePath().normalize();
        }

        public Path resolveKnowledgeDir() {
            return resolveBasePath().resolve(knowledgeDir);
        }
    }

    // ==================== RETRIEVAL ====================

    @Data
    public static class VectorProperties {
        private boolean enabled = true;
        private int dimensions = 768;
        private int maxSearchLimit = 100;
        private boolean indexOnStartup = false;
    }

    @Data
    public static class GraphProperties {
        private int defaultTraversalDepth = 2;
        private int keywordMatchLimit = 10;
    }

    @Data
    public static class EpisodicProperties {
        private int retentionDays = 90;
        private int recallLimit = 10;
        private int recentLimit = 20;
    }

    @Data
    public static class SearchProperties {
        private int maxResults = 10;
        private double ftsWeight = 1.0;
        private double vectorWeight = 0.0;
        private double timeDecayHalfLifeDays = 30;
        private double timeDecayFloor = 0.2;
        private int promotionThreshold = 3;
        private int staleDays = 60;
        private int staleLimit = 20;
    }
}
