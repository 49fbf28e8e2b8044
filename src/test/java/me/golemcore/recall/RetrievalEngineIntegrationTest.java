package me.golemcore.recall;

import me.golemcore.recall.adapter.outbound.embedding.TfIdfEmbeddingAdapter;
import me.golemcore.recall.adapter.outbound.sqlite.SqliteEpisodicLogAdapter;
import me.golemcore.recall.adapter.outbound.sqlite.SqliteKnowledgeGraphAdapter;
import me.golemcore.recall.adapter.outbound.sqlite.SqliteKnowledgeIndexAdapter;
import me.golemcore.recall.adapter.outbound.sqlite.SqliteVectorStoreAdapter;
import me.golemcore.recall.adapter.outbound.storage.JsonKnowledgeSourceAdapter;
import me.golemcore.recall.adapter.outbound.vector.VectorSemanticSearchAdapter;
import me.golemcore.recall.domain.model.Episode;
import me.golemcore.recall.domain.model.GraphNode;
import me.golemcore.recall.domain.model.KnowledgeEntry;
import me.golemcore.recall.domain.model.KnowledgeSearchOptions;
import me.golemcore.recall.domain.model.KnowledgeSearchResult;
import me.golemcore.recall.domain.model.TraversalHit;
import me.golemcore.recall.domain.model.VectorSearchResult;
import me.golemcore.recall.domain.service.EpisodicMemoryService;
import me.golemcore.recall.domain.service.KnowledgeGraphService;
import me.golemcore.recall.domain.service.KnowledgeSearchService;
import me.golemcore.recall.domain.service.VectorIndexService;
import me.golemcore.recall.infrastructure.config.RecallProperties;
import me.golemcore.recall.infrastructure.persistence.KnowledgeDatabase;
import me.golemcore.recall.infrastructure.persistence.KnowledgeStoreException;
import me.golemcore.recall.testsupport.TestDatabases;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

/**
 * Wires the real SQLite adapters and services together against a temporary
 * database file.
 */
class RetrievalEngineIntegrationTest {

    private static final Instant NOW = Instant.parse("2026-07-01T09:00:00Z");

    @TempDir
    Path tempDir;

    private RecallProperties properties;
    private KnowledgeDatabase database;
    private SqliteKnowledgeIndexAdapter knowledgeIndex;
    private TfIdfEmbeddingAdapter embedding;
    private VectorIndexService vectorIndexService;
    private KnowledgeGraphService graphService;
    private EpisodicMemoryService episodicService;
    private KnowledgeSearchService searchService;

    @BeforeEach
    void setUp() {
        properties = TestDatabases.properties(tempDir);
        database = TestDatabases.database(properties);
        ObjectMapper objectMapper = TestDatabases.objectMapper();
        Clock clock = Clock.fixed(NOW, ZoneOffset.UTC);

        knowledgeIndex = new SqliteKnowledgeIndexAdapter(database);
        embedding = new TfIdfEmbeddingAdapter(properties);
        vectorIndexService = new VectorIndexService(embedding,
                new SqliteVectorStoreAdapter(database, properties), knowledgeIndex);
        graphService = new KnowledgeGraphService(new SqliteKnowledgeGraphAdapter(database, objectMapper), properties);
        episodicService = new EpisodicMemoryService(new SqliteEpisodicLogAdapter(database, objectMapper),
                properties, clock);
        searchService = new KnowledgeSearchService(knowledgeIndex,
                new JsonKnowledgeSourceAdapter(properties, objectMapper, clock),
                new VectorSemanticSearchAdapter(vectorIndexService), properties, clock);

        vectorIndexService.initialize();
        graphService.initialize();
        episodicService.initialize();
        knowledgeIndex.initialize();
    }

    @AfterEach
    void tearDown() {
        database.close();
    }

    @Test
    void shouldRankSprintDocumentFirst() {
        List<String> documents = List.of(
                "sprint planning code review",
                "database migration schema design",
                "authentication security tokens");
        embedding.buildVocabulary(documents);
        for (int i = 0; i < documents.size(); i++) {
            vectorIndexService.upsertEmbedding("doc-" + i, vectorIndexService.embed(documents.get(i)));
        }

        List<VectorSearchResult> results = vectorIndexService.search(vectorIndexService.embed("sprint code"), 3);

        assertEquals(3, results.size());
        assertEquals("doc-0", results.get(0).getId());
        assertTrue(results.get(0).getDistance() < results.get(1).getDistance());
    }

    @Test
    void shouldIndexAllKnowledgeFromLexicalCorpus() throws IOException {
        Path knowledgeDir = Files.createDirectories(properties.getStorage().resolveKnowledgeDir());
        Files.writeString(knowledgeDir.resolve("lessons.json"), """
                {"lessons": [
                  {"id": 1, "situation": "Flaky integration tests", "learning": "pin the clock in tests",
                   "date": "2026-06-30T00:00:00.000Z"},
                  {"id": 2, "situation": "Slow database migration", "learning": "batch schema changes",
                   "date": "2026-06-30T00:00:00.000Z"}
                ]}""");
        searchService.initIndex();

        assertEquals(2, vectorIndexService.indexAllKnowledge());

        assertEquals(2, vectorIndexService.getVecStats().count());
        assertTrue(vectorIndexService.isVecAvailable());
        assertEquals("lesson-2", vectorIndexService.searchText("schema migration", 1).get(0).getId());

        List<KnowledgeSearchResult> hybrid = searchService.search(KnowledgeSearchOptions.builder()
                .query("flaky tests").vectorWeight(0.5).build());
        assertEquals("lesson-1", hybrid.get(0).getId());
        assertTrue(hybrid.get(0).getVectorScore() > 0);
    }

    @Test
    void shouldKeepVocabularyAndVectorsWhenRebuildIsRejected() {
        knowledgeIndex.replaceAll(List.of(
                KnowledgeEntry.builder().source("lesson").sourceId(1).text("alpha beta").build(),
                KnowledgeEntry.builder().source("lesson").sourceId(2).text("gamma delta").build()));
        assertEquals(2, vectorIndexService.indexAllKnowledge());
        List<String> termsBefore = embedding.getVocabulary().terms();

        knowledgeIndex.replaceAll(List.of(
                KnowledgeEntry.builder().source("lesson").sourceId(3).text("zeta omega").build(),
                KnowledgeEntry.builder().source("lesson").sourceId(4).text("kappa lambda").build()));
        database.execute(jdbc -> {
            jdbc.execute("CREATE TRIGGER reject_vectors BEFORE INSERT ON vec_items"
                    + " BEGIN SELECT RAISE(ABORT, 'rejected'); END");
            return null;
        });

        assertThrows(KnowledgeStoreException.class, () -> vectorIndexService.indexAllKnowledge());

        assertEquals(termsBefore, embedding.getVocabulary().terms());
        assertEquals(2, vectorIndexService.getVecStats().count());
        assertEquals("lesson-1", vectorIndexService.searchText("alpha", 1).get(0).getId());
    }

    @Test
    void shouldReturnZeroWhenCorpusIsEmpty() {
        assertEquals(0, vectorIndexService.indexAllKnowledge());
        assertEquals(0, vectorIndexService.getVecStats().count());
    }

    @Test
    void shouldTraverseGraphByDepth() {
        graphService.addNodes(List.of(node("A"), node("B"), node("C"), node("D")));
        graphService.addEdge("A", "B", "produced", 1.0);
        graphService.addEdge("B", "C", "mentions", 1.0);
        graphService.addEdge("A", "D", "produced", 1.0);

        assertEquals(Set.of("B", "D", "C"), ids(graphService.traverseBFS("A", 2)));
        assertEquals(Set.of("B", "D"), ids(graphService.traverseBFS("A", 1)));
    }

    @Test
    void shouldRecallEpisodeWithinPhase() {
        Episode recorded = episodicService.recordEpisode("Phase 1", "Chose SQLite", "Fast");

        List<Episode> recalled = episodicService.recallEpisodes("sqlite");

        assertEquals(1, recalled.size());
        assertEquals(recorded.getId(), recalled.get(0).getId());
        assertTrue(episodicService.recallEpisodes("sqlite", 10, "Phase 2").isEmpty());
        assertEquals(1, episodicService.recallEpisodes("sqlite", 10, "").size());
        assertTrue(episodicService.recallEpisodes("! @ # $").isEmpty());
    }

    @Test
    void shouldPruneExpiredEpisodesOnInitialize() {
        EpisodicMemoryService past = new EpisodicMemoryService(
                new SqliteEpisodicLogAdapter(database, TestDatabases.objectMapper()), properties,
                Clock.fixed(NOW.minusSeconds(86_400L * 120), ZoneOffset.UTC));
        past.recordEpisode("Phase 0", "Old experiment", "Abandoned");
        episodicService.recordEpisode("Phase 1", "New experiment", "Shipped");

        episodicService.initialize();

        assertEquals(1, episodicService.countEpisodes());
        assertTrue(episodicService.recallEpisodes("old").isEmpty());
    }

    private static GraphNode node(String id) {
        return GraphNode.builder().id(id).type("step").label(id).build();
    }

    private static Set<String> ids(List<TraversalHit> hits) {
        return hits.stream().map(hit -> hit.getNode().getId()).collect(Collectors.toSet());
    }
}
