package me.golemcore.recall.adapter.outbound.sqlite;

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

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.recall.domain.model.GraphEdge;
import me.golemcore.recall.domain.model.GraphNode;
import me.golemcore.recall.domain.model.GraphStats;
import me.golemcore.recall.domain.model.Neighbor;
import me.golemcore.recall.infrastructure.persistence.KnowledgeDatabase;
import me.golemcore.recall.infrastructure.persistence.KnowledgeStoreException;
import me.golemcore.recall.port.outbound.KnowledgeGraphPort;
import org.springframework.dao.DataAccessException;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Component;

import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * SQLite implementation of {@link KnowledgeGraphPort}.
 *
 * <p>
 * Nodes live in {@code knowledge_nodes} with properties serialized as a JSON
 * object. Edges live in {@code knowledge_edges} with a composite primary key
 * {@code (source, target, relationship)} and secondary indexes on source and
 * target. Both tables upsert with {@code ON CONFLICT}.
 *
 * <p>
 * SQLite's {@code lower()} folds ASCII only, so each node also stores
 * {@code label_folded}, the label lowercased in Java, and keyword lookups
 * match against that column.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class SqliteKnowledgeGraphAdapter implements KnowledgeGraphPort {

    private static final List<String> SCHEMA = List.of(
            """
                    CREATE TABLE IF NOT EXISTS knowledge_nodes (
                      id TEXT PRIMARY KEY,
                      type TEXT NOT NULL,
                      label TEXT NOT NULL,
                      label_folded TEXT NOT NULL DEFAULT '',
                      properties TEXT NOT NULL DEFAULT '{}',
                      created_at TEXT NOT NULL DEFAULT (strftime('%Y-%m-%dT%H:%M:%fZ', 'now'))
                    )""",
            """
                    CREATE TABLE IF NOT EXISTS knowledge_edges (
                      source TEXT NOT NULL,
                      target TEXT NOT NULL,
                      relationship TEXT NOT NULL,
                      weight REAL NOT NULL DEFAULT 1.0,
                      created_at TEXT NOT NULL DEFAULT (strftime('%Y-%m-%dT%H:%M:%fZ', 'now')),
                      PRIMARY KEY (source, target, relationship)
                    )""",
            "CREATE INDEX IF NOT EXISTS idx_edges_source ON knowledge_edges(source)",
            "CREATE INDEX IF NOT EXISTS idx_edges_target ON knowledge_edges(target)",
            "CREATE INDEX IF NOT EXISTS idx_nodes_type ON knowledge_nodes(type)");

    private static final String UPSERT_NODE = """
            INSERT INTO knowledge_nodes (id, type, label, label_folded, properties) VALUES (?, ?, ?, ?, ?)
            ON CONFLICT(id) DO UPDATE SET label = excluded.label, label_folded = excluded.label_folded,
              properties = excluded.properties""";
    private static final String UPSERT_EDGE = """
            INSERT INTO knowledge_edges (source, target, relationship, weight) VALUES (?, ?, ?, ?)
            ON CONFLICT(source, target, relationship) DO UPDATE SET weight = excluded.weight""";
    private static final String NODE_COLUMNS = "n.id, n.type, n.label, n.properties";
    private static final String OUTGOING = "SELECT " + NODE_COLUMNS
            + ", e.source, e.target, e.relationship, e.weight FROM knowledge_edges e"
            + " JOIN knowledge_nodes n ON n.id = e.target WHERE e.source = ? ORDER BY e.rowid";
    private static final String INCOMING = "SELECT " + NODE_COLUMNS
            + ", e.source, e.target, e.relationship, e.weight FROM knowledge_edges e"
            + " JOIN knowledge_nodes n ON n.id = e.source WHERE e.target = ? ORDER BY e.rowid";

    private static final TypeReference<LinkedHashMap<String, Object>> PROPERTIES_TYPE = new TypeReference<>() {
    };

    private final KnowledgeDatabase database;
    private final ObjectMapper objectMapper;

    private final RowMapper<GraphNode> nodeMapper = (rs, rowNum) -> mapNode(rs);

    @Override
    public void initialize() {
        try {
            database.execute(jdbc -> {
                SCHEMA.forEach(jdbc::execute);
                addFoldedLabelColumn(jdbc);
                return null;
            });
            log.debug("[Graph] Tables ready");
        } catch (DataAccessException e) {
            throw new KnowledgeStoreException("Failed to initialize graph tables", e);
        }
    }

    @Override
    public void addNode(GraphNode node) {
        addNodes(List.of(node));
    }

    @Override
    public void addNodes(List<GraphNode> nodes) {
        try {
            database.inTransaction(jdbc -> {
                for (GraphNode node : nodes) {
                    String label = node.getLabel() != null ? node.getLabel() : "";
                    jdbc.update(UPSERT_NODE, node.getId(), node.getType(), label, fold(label),
                            writeProperties(node.getProperties()));
                }
                return null;
            });
        } catch (DataAccessException e) {
            throw new KnowledgeStoreException("Failed to upsert " + nodes.size() + " nodes", e);
        }
    }

    @Override
    public Optional<GraphNode> getNode(String id) {
        try {
            return database.execute(jdbc -> jdbc.query(
                    "SELECT " + NODE_COLUMNS + " FROM knowledge_nodes n WHERE n.id = ?", nodeMapper, id))
                    .stream()
                    .findFirst();
        } catch (DataAccessException e) {
            log.warn("[Graph] Failed to read node {}: {}", id, e.getMessage());
            return Optional.empty();
        }
    }

    @Override
    public List<GraphNode> getNodesByType(String type) {
        try {
            return database.execute(jdbc -> jdbc.query(
                    "SELECT " + NODE_COLUMNS + " FROM knowledge_nodes n WHERE n.type = ? ORDER BY n.rowid",
                    nodeMapper, type));
        } catch (DataAccessException e) {
            log.warn("[Graph] Failed to read nodes of type {}: {}", type, e.getMessage());
            return List.of();
        }
    }

    @Override
    public int getNodeCount() {
        return countRows("knowledge_nodes");
    }

    @Override
    public void addEdge(GraphEdge edge) {
        addEdges(List.of(edge));
    }

    @Override
    public void addEdges(List<GraphEdge> edges) {
        try {
            database.inTransaction(jdbc -> {
                for (GraphEdge edge : edges) {
                    jdbc.update(UPSERT_EDGE, edge.getSource(), edge.getTarget(), edge.getRelationship(),
                            edge.getWeight());
                }
                return null;
            });
        } catch (DataAccessException e) {
            throw new KnowledgeStoreException("Failed to upsert " + edges.size() + " edges", e);
        }
    }

    @Override
    public int getEdgeCount() {
        return countRows("knowledge_edges");
    }

    @Override
    public List<Neighbor> getNeighbors(String id) {
        try {
            return database.execute(jdbc -> {
                List<Neighbor> neighbors = new ArrayList<>(
                        jdbc.query(OUTGOING, neighborMapper(Neighbor.Direction.OUTGOING), id));
                neighbors.addAll(jdbc.query(INCOMING, neighborMapper(Neighbor.Direction.INCOMING), id));
                return neighbors;
            });
        } catch (DataAccessException e) {
            log.warn("[Graph] Failed to read neighbours of {}: {}", id, e.getMessage());
            return List.of();
        }
    }

    @Override
    public List<Neighbor> getOutgoing(String id) {
        try {
            return database.execute(jdbc -> jdbc.query(OUTGOING, neighborMapper(Neighbor.Direction.OUTGOING), id));
        } catch (DataAccessException e) {
            log.warn("[Graph] Failed to read outgoing edges of {}: {}", id, e.getMessage());
            return List.of();
        }
    }

    @Override
    public List<GraphNode> findNodesByKeywords(List<String> keywords, int maxResults) {
        if (keywords.isEmpty()) {
            return List.of();
        }
        StringBuilder sql = new StringBuilder("SELECT " + NODE_COLUMNS + " FROM knowledge_nodes n WHERE ");
        List<Object> args = new ArrayList<>();
        for (String keyword : keywords) {
            if (!args.isEmpty()) {
                sql.append(" OR ");
            }
            sql.append("n.label_folded LIKE ? ESCAPE '\\'");
            args.add("%" + escapeLike(fold(keyword)) + "%");
        }
        sql.append(" ORDER BY n.rowid LIMIT ?");
        args.add(maxResults);

        try {
            return database.execute(jdbc -> jdbc.query(sql.toString(), nodeMapper, args.toArray()));
        } catch (DataAccessException e) {
            log.warn("[Graph] Keyword lookup failed: {}", e.getMessage());
            return List.of();
        }
    }

    @Override
    public GraphStats getGraphStats() {
        try {
            return database.execute(jdbc -> {
                Map<String, Integer> nodeTypes = new LinkedHashMap<>();
                jdbc.query("SELECT type, count(*) AS total FROM knowledge_nodes GROUP BY type ORDER BY type",
                        rs -> {
                            nodeTypes.put(rs.getString("type"), rs.getInt("total"));
                        });
                return new GraphStats(count(jdbc, "knowledge_nodes"), count(jdbc, "knowledge_edges"), nodeTypes);
            });
        } catch (DataAccessException e) {
            log.warn("[Graph] Stats unavailable: {}", e.getMessage());
            return new GraphStats(0, 0, Map.of());
        }
    }

    @Override
    public void clearGraph() {
        try {
            database.inTransaction(jdbc -> {
                jdbc.update("DELETE FROM knowledge_edges");
                jdbc.update("DELETE FROM knowledge_nodes");
                return null;
            });
        } catch (DataAccessException e) {
            throw new KnowledgeStoreException("Failed to clear graph", e);
        }
    }

    // Tables created before label_folded existed get the column and a backfill.
    private void addFoldedLabelColumn(JdbcTemplate jdbc) {
        List<String> columns = jdbc.queryForList(
                "SELECT name FROM pragma_table_info('knowledge_nodes')", String.class);
        if (columns.contains("label_folded")) {
            return;
        }
        jdbc.execute("ALTER TABLE knowledge_nodes ADD COLUMN label_folded TEXT NOT NULL DEFAULT ''");
        List<Map<String, Object>> rows = jdbc.queryForList("SELECT id, label FROM knowledge_nodes");
        for (Map<String, Object> row : rows) {
            jdbc.update("UPDATE knowledge_nodes SET label_folded = ? WHERE id = ?",
                    fold(String.valueOf(row.get("label"))), row.get("id"));
        }
        log.info("[Graph] Added label_folded to {} existing nodes", rows.size());
    }

    private RowMapper<Neighbor> neighborMapper(Neighbor.Direction direction) {
        return (rs, rowNum) -> {
            GraphEdge edge = GraphEdge.builder()
                    .source(rs.getString("source"))
                    .target(rs.getString("target"))
                    .relationship(rs.getString("relationship"))
                    .weight(rs.getDouble("weight"))
                    .build();
            return new Neighbor(mapNode(rs), edge, direction);
        };
    }

    private GraphNode mapNode(ResultSet rs) throws SQLException {
        return GraphNode.builder()
                .id(rs.getString("id"))
                .type(rs.getString("type"))
                .label(rs.getString("label"))
                .properties(readProperties(rs.getString("properties")))
                .build();
    }

    private int countRows(String table) {
        try {
            return database.execute(jdbc -> count(jdbc, table));
        } catch (DataAccessException e) {
            log.debug("[Graph] Count of {} unavailable: {}", table, e.getMessage());
            return 0;
        }
    }

    private static int count(JdbcTemplate jdbc, String table) {
        Integer count = jdbc.queryForObject("SELECT count(*) FROM " + table, Integer.class);
        return count != null ? count : 0;
    }

    private String writeProperties(Map<String, Object> properties) {
        if (properties == null || properties.isEmpty()) {
            return "{}";
        }
        try {
            return objectMapper.writeValueAsString(properties);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Node properties are not serializable", e);
        }
    }

    private Map<String, Object> readProperties(String json) {
        if (json == null || json.isBlank()) {
            return new LinkedHashMap<>();
        }
        try {
            JsonNode tree = objectMapper.readTree(json);
            if (tree == null || !tree.isObject()) {
                return new LinkedHashMap<>();
            }
            return objectMapper.convertValue(tree, PROPERTIES_TYPE);
        } catch (JsonProcessingException | IllegalArgumentException e) {
            log.debug("[Graph] Ignoring malformed node properties: {}", e.getMessage());
            return new LinkedHashMap<>();
        }
    }

    private static String fold(String text) {
        return text.toLowerCase(Locale.ROOT);
    }

    private static String escapeLike(String keyword) {
        return keyword.replace("\\", "\\\\").replace("%", "\\%").replace("_", "\\_");
    }
}
