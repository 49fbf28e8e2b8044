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

import me.golemcore.recall.domain.model.GraphEdge;
import me.golemcore.recall.domain.model.GraphNode;
import me.golemcore.recall.domain.model.GraphStats;
import me.golemcore.recall.domain.model.Neighbor;

import java.util.List;
import java.util.Optional;

/**
 * Port for persisting typed nodes and directed weighted edges.
 */
public interface KnowledgeGraphPort {

    void initialize();

    /**
     * Insert the node, or replace label and properties of an existing node with
     * the same id.
     */
    void addNode(GraphNode node);

    /**
     * Upsert nodes in a single transaction.
     */
    void addNodes(List<GraphNode> nodes);

    Optional<GraphNode> getNode(String id);

    List<GraphNode> getNodesByType(String type);

    int getNodeCount();

    /**
     * Insert the edge, or overwrite the weight of the edge with the same
     * {@code (source, target, relationship)}.
     */
    void addEdge(GraphEdge edge);

    /**
     * Upsert edges in a single transaction.
     */
    void addEdges(List<GraphEdge> edges);

    int getEdgeCount();

    /**
     * Outgoing and incoming one-hop neighbours. Edges whose other endpoint has
     * no node are skipped.
     */
    List<Neighbor> getNeighbors(String id);

    /**
     * Outgoing one-hop neighbours only.
     */
    List<Neighbor> getOutgoing(String id);

    /**
     * Nodes whose label contains any keyword, case-insensitively.
     */
    List<GraphNode> findNodesByKeywords(List<String> keywords, int maxResults);

    GraphStats getGraphStats();

    /**
     * Delete every node and edge.
     */
    void clearGraph();
}
