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
import me.golemcore.recall.domain.model.GraphEdge;
import me.golemcore.recall.domain.model.GraphNode;
import me.golemcore.recall.domain.model.GraphStats;
import me.golemcore.recall.domain.model.Neighbor;
import me.golemcore.recall.domain.model.TraversalHit;
import me.golemcore.recall.infrastructure.config.RecallProperties;
import me.golemcore.recall.port.outbound.KnowledgeGraphPort;
import org.springframework.stereotype.Service;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Knowledge graph operations: node and edge upserts, one-hop neighbours and
 * bounded breadth-first traversal.
 *
 * <p>
 * Traversal follows outgoing edges only. Every node is reported once, at the
 * depth where it was first discovered; the start node is never reported.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class KnowledgeGraphService {

    private final KnowledgeGraphPort graphPort;
    private final RecallProperties properties;

    public void initialize() {
        graphPort.initialize();
    }

    public void addNode(GraphNode node) {
        requireNode(node);
        graphPort.addNode(node);
    }

    public void addNodes(List<GraphNode> nodes) {
        if (nodes == null || nodes.isEmpty()) {
            return;
        }
        nodes.forEach(this::requireNode);
        graphPort.addNodes(nodes);
    }

    public Optional<GraphNode> getNode(String id) {
        if (id == null || id.isBlank()) {
            return Optional.empty();
        }
        return graphPort.getNode(id);
    }

    public List<GraphNode> getNodesByType(String type) {
        return graphPort.getNodesByType(type);
    }

    public void addEdge(GraphEdge edge) {
        requireEdge(edge);
        graphPort.addEdge(edge);
    }

    public void addEdge(String source, String target, String relationship, double weight) {
        addEdge(GraphEdge.builder()
                .source(source)
                .target(target)
                .relationship(relationship)
                .weight(weight)
                .build());
    }

    public void addEdges(List<GraphEdge> edges) {
        if (edges == null || edges.isEmpty()) {
            return;
        }
        edges.forEach(this::requireEdge);
        graphPort.addEdges(edges);
    }

    public List<Neighbor> getNeighbors(String id) {
        return graphPort.getNeighbors(id);
    }

    public List<TraversalHit> traverseBFS(String startId) {
        return traverseBFS(startId, properties.getGraph().getDefaultTraversalDepth());
    }

    public List<TraversalHit> traverseBFS(String startId, int maxDepth) {
        return traverseBFS(startId, maxDepth, Integer.MAX_VALUE);
    }

    /**
     * Breadth-first traversal along outgoing edges.
     *
     * @param startId
     *            node to start from, excluded from the result
     * @param maxDepth
     *            deepest level reported; nodes beyond it are not discovered
     * @param maxNodes
     *            maximum number of hits; emission stops as soon as it is reached
     * @return hits in discovery order
     */
    public List<TraversalHit> traverseBFS(String startId, int maxDepth, int maxNodes) {
        List<TraversalHit> hits = new ArrayList<>();
        if (startId == null || maxDepth < 1 || maxNodes < 1) {
            return hits;
        }

        Set<String> visited = new HashSet<>();
        visited.add(startId);
        Deque<Frontier> queue = new ArrayDeque<>();
        queue.add(new Frontier(startId, 0));

        while (!queue.isEmpty()) {
            Frontier current = queue.poll();
            if (current.depth() >= maxDepth) {
                continue;
            }
            for (Neighbor neighbor : graphPort.getOutgoing(current.nodeId())) {
                GraphNode node = neighbor.getNode();
                if (!visited.add(node.getId())) {
                    continue;
                }
                int depth = current.depth() + 1;
                hits.add(TraversalHit.builder()
                        .node(node)
                        .depth(depth)
                        .via(neighbor.getEdge() != null ? neighbor.getEdge().getRelationship() : null)
                        .build());
                if (hits.size() >= maxNodes) {
                    log.debug("[Graph] Traversal from {} capped at {} nodes", startId, maxNodes);
                    return hits;
                }
                queue.add(new Frontier(node.getId(), depth));
            }
        }
        return hits;
    }

    public List<GraphNode> findNodesByKeywords(List<String> keywords) {
        return findNodesByKeywords(keywords, properties.getGraph().getKeywordMatchLimit());
    }

    public List<GraphNode> findNodesByKeywords(List<String> keywords, int maxResults) {
        if (keywords == null || maxResults < 1) {
            return List.of();
        }
        List<String> usable = keywords.stream()
                .filter(keyword -> keyword != null && !keyword.isBlank())
                .map(String::trim)
                .toList();
        if (usable.isEmpty()) {
            return List.of();
        }
        return graphPort.findNodesByKeywords(usable, maxResults);
    }

    public int getNodeCount() {
        return graphPort.getNodeCount();
    }

    public int getEdgeCount() {
        return graphPort.getEdgeCount();
    }

    public GraphStats getGraphStats() {
        return graphPort.getGraphStats();
    }

    public void clearGraph() {
        graphPort.clearGraph();
        log.info("[Graph] Cleared");
    }

    private void requireNode(GraphNode node) {
        if (node == null || node.getId() == null || node.getId().isBlank()) {
            throw new IllegalArgumentException("Node id must not be blank");
        }
        if (node.getType() == null || node.getType().isBlank()) {
            throw new IllegalArgumentException("Node type must not be blank: " + node.getId());
        }
    }

    private void requireEdge(GraphEdge edge) {
        if (edge == null || isBlank(edge.getSource()) || isBlank(edge.getTarget())
                || isBlank(edge.getRelationship())) {
            throw new IllegalArgumentException("Edge source, target and relationship must not be blank");
        }
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }

    private record Frontier(String nodeId, int depth) {
    }
}
