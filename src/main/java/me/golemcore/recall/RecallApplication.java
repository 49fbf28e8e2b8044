package me.golemcore.recall;

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

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.autoconfigure.jdbc.DataSourceAutoConfiguration;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

/**
 * Main application class for GolemCore Recall.
 *
 * <p>
 * Recall gives coding agents durable, queryable memory across work sessions:
 * prior decisions, lessons, bug patterns and sprint history. Knowledge is
 * served back through three complementary retrieval strategies.
 *
 * <h2>Retrieval Strategies</h2>
 * <ul>
 * <li><b>Lexical</b> - FTS5 BM25 search over the knowledge index, with time
 * decay and retrieval tracking</li>
 * <li><b>Vector</b> - self-contained TF-IDF embeddings with exact
 * nearest-neighbour search</li>
 * <li><b>Graph</b> - typed nodes and weighted relationships with bounded
 * breadth-first traversal</li>
 * <li><b>Episodic</b> - append-only journal of sprint actions and outcomes with
 * keyword recall</li>
 * </ul>
 *
 * <h2>Architecture</h2>
 * <p>
 * Hexagonal architecture (Ports & Adapters):
 *
 * <pre>
 * Domain Layer       → VectorIndexService, KnowledgeGraphService,
 *                      EpisodicMemoryService, KnowledgeSearchService
 * Ports              → EmbeddingPort, VectorStorePort, KnowledgeGraphPort, ...
 * Infrastructure     → SQLite adapters, TF-IDF embedding, JSON knowledge source
 * </pre>
 *
 * <h2>Configuration</h2>
 * <p>
 * All configuration via {@code application.properties} under {@code recall.*}
 * prefix.
 *
 * @since 1.0
 */
@SpringBootApplication(exclude = DataSourceAutoConfiguration.class)
@ConfigurationPropertiesScan
public class RecallApplication {

    public static void main(String[] args) {
        SpringApplication.run(RecallApplication.class, args);
    }

}
