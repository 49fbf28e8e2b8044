package me.golemcore.recall.domain.service;

import me.golemcore.recall.domain.model.KnowledgeEntry;
import me.golemcore.recall.domain.model.KnowledgeSearchOptions;
import me.golemcore.recall.domain.model.KnowledgeSearchResult;
import me.golemcore.recall.domain.model.LexicalHit;
import me.golemcore.recall.domain.model.VectorSearchResult;
import me.golemcore.recall.infrastructure.config.RecallProperties;
import me.golemcore.recall.port.outbound.KnowledgeIndexPort;
import me.golemcore.recall.port.outbound.KnowledgeSourcePort;
import me.golemcore.recall.port.outbound.SemanticSearchPort;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.anyCollection;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class KnowledgeSearchServiceTest {

    private static final Instant NOW = Instant.parse("2026-06-01T00:00:00Z");

    private KnowledgeIndexPort knowledgeIndexPort;
    private KnowledgeSourcePort knowledgeSourcePort;
    private SemanticSearchPort semanticSearchPort;
    private RecallProperties properties;
    private KnowledgeSearchService service;

    @BeforeEach
    void setUp() {
        knowledgeIndexPort = mock(KnowledgeIndexPort.class);
        knowledgeSourcePort = mock(KnowledgeSourcePort.class);
        semanticSearchPort = mock(SemanticSearchPort.class);
        properties = new RecallProperties();
        service = new KnowledgeSearchService(knowledgeIndexPort, knowledgeSourcePort, semanticSearchPort,
                properties, Clock.fixed(NOW, ZoneOffset.UTC));
        when(knowledgeIndexPort.findLastRetrievals(anyCollection())).thenReturn(Map.of());
    }

    @Test
    void shouldSanitizeFtsSyntax() {
        assertEquals("\"foo\" OR \"bar\" OR \"baz\"", KnowledgeSearchService.sanitizeQuery("foo* -bar (baz)"));
        assertEquals("\"title\" OR \"sqlite\"", KnowledgeSearchService.sanitizeQuery("title:SQLite"));
        assertEquals("\"and\" OR \"not\"", KnowledgeSearchService.sanitizeQuery("AND NOT and"));
        assertEquals("", KnowledgeSearchService.sanitizeQuery("\"*^():-"));
    }

    @Test
    void shouldReturnNothingForBlankOrSyntaxOnlyQueries() {
        assertTrue(service.search("   ").isEmpty());
        assertTrue(service.search("***").isEmpty());
        assertTrue(service.search((String) null).isEmpty());

        verify(knowledgeIndexPort, never()).match(anyString(), anyInt());
    }

    @Test
    void shouldFetchThreeTimesMaxResultsAndTrim() {
        when(knowledgeIndexPort.match(anyString(), anyInt())).thenReturn(List.of(
                hit("lesson", 1, 5.0, "2026-06-01T00:00:00.000Z"),
                hit("lesson", 2, 4.0, "2026-06-01T00:00:00.000Z"),
                hit("lesson", 3, 3.0, "2026-06-01T00:00:00.000Z")));

        List<KnowledgeSearchResult> results = service.search(KnowledgeSearchOptions.builder()
                .query("cache").maxResults(2).build());

        verify(knowledgeIndexPort).match("\"cache\"", 6);
        assertEquals(List.of("lesson-1", "lesson-2"), results.stream().map(KnowledgeSearchResult::getId).toList());
        assertEquals(5.0, results.get(0).getFtsScore(), 1e-9);
        assertNull(results.get(0).getVectorScore());
    }

    @Test
    void shouldDecayOldEntriesAndReorder() {
        when(knowledgeIndexPort.match(anyString(), anyInt())).thenReturn(List.of(
                hit("lesson", 1, 5.0, "2026-05-02T00:00:00.000Z"),
                hit("lesson", 2, 4.0, "2026-06-01T00:00:00.000Z")));

        List<KnowledgeSearchResult> results = service.search("cache");

        assertEquals("lesson-2", results.get(0).getId());
        assertEquals(4.0, results.get(0).getCombinedScore(), 1e-9);
        assertEquals(5.0 * Math.exp(-0.693), results.get(1).getFtsScore(), 1e-9);
    }

    @Test
    void shouldFloorDecayForAncientEntries() {
        when(knowledgeIndexPort.match(anyString(), anyInt())).thenReturn(List.of(
                hit("pattern", 1, 10.0, "2020-01-01")));

        assertEquals(2.0, service.search("cache").get(0).getFtsScore(), 1e-9);
    }

    @Test
    void shouldGiveFullWeightToFutureAndUnparsableDates() {
        when(knowledgeIndexPort.match(anyString(), anyInt())).thenReturn(List.of(
                hit("lesson", 1, 3.0, "2027-01-01T00:00:00.000Z"),
                hit("lesson", 2, 2.0, "someday")));

        List<KnowledgeSearchResult> results = service.search("cache");

        assertEquals(3.0, results.get(0).getFtsScore(), 1e-9);
        assertEquals(2.0, results.get(1).getFtsScore(), 1e-9);
    }

    @Test
    void shouldMeasureAgeFromLastRetrievalWhenMoreRecent() {
        when(knowledgeIndexPort.match(anyString(), anyInt())).thenReturn(List.of(
                hit("lesson", 1, 5.0, "2025-01-01T00:00:00.000Z")));
        when(knowledgeIndexPort.findLastRetrievals(anyCollection()))
                .thenReturn(Map.of("lesson-1", "2026-06-01T00:00:00.000Z"));

        assertEquals(5.0, service.search("cache").get(0).getFtsScore(), 1e-9);
    }

    @Test
    void shouldBlendVectorScoresWhenWeighted() {
        when(knowledgeIndexPort.match(anyString(), anyInt())).thenReturn(List.of(
                hit("lesson", 1, 2.0, "2026-06-01T00:00:00.000Z"),
                hit("lesson", 2, 1.5, "2026-06-01T00:00:00.000Z")));
        when(semanticSearchPort.isAvailable()).thenReturn(true);
        when(semanticSearchPort.search("cache eviction", 30))
                .thenReturn(List.of(VectorSearchResult.of("lesson-2", 0.0)));

        List<KnowledgeSearchResult> results = service.search(KnowledgeSearchOptions.builder()
                .query("cache eviction").vectorWeight(1.0).build());

        assertEquals("lesson-2", results.get(0).getId());
        assertEquals(1.0, results.get(0).getVectorScore(), 1e-9);
        assertEquals(2.5, results.get(0).getCombinedScore(), 1e-9);
        assertEquals(0.0, results.get(1).getVectorScore(), 1e-9);
    }

    @Test
    void shouldFallBackToLexicalWhenSemanticSearchFails() {
        when(knowledgeIndexPort.match(anyString(), anyInt())).thenReturn(List.of(
                hit("lesson", 1, 2.0, "2026-06-01T00:00:00.000Z")));
        when(semanticSearchPort.isAvailable()).thenReturn(true);
        when(semanticSearchPort.search(anyString(), anyInt())).thenThrow(new IllegalStateException("boom"));

        List<KnowledgeSearchResult> results = service.search(KnowledgeSearchOptions.builder()
                .query("cache").vectorWeight(0.5).build());

        assertEquals(1, results.size());
        assertNull(results.get(0).getVectorScore());
        assertEquals(2.0, results.get(0).getCombinedScore(), 1e-9);
    }

    @Test
    void shouldNotConsultSemanticSearchWithoutVectorWeight() {
        when(knowledgeIndexPort.match(anyString(), anyInt())).thenReturn(List.of(
                hit("lesson", 1, 2.0, "2026-06-01T00:00:00.000Z")));

        service.search("cache");

        verify(semanticSearchPort, never()).search(anyString(), anyInt());
    }

    @Test
    void shouldRebuildFromSourceWhenIndexIsEmpty() {
        List<KnowledgeEntry> entries = List.of(KnowledgeEntry.builder().source("lesson").sourceId(1).build());
        when(knowledgeIndexPort.count()).thenReturn(0);
        when(knowledgeSourcePort.loadEntries()).thenReturn(entries);
        when(knowledgeIndexPort.replaceAll(entries)).thenReturn(1);

        service.initIndex();

        verify(knowledgeIndexPort).initialize();
        verify(knowledgeIndexPort).replaceAll(entries);
    }

    @Test
    void shouldKeepExistingIndexOnInit() {
        when(knowledgeIndexPort.count()).thenReturn(12);

        service.initIndex();

        verify(knowledgeSourcePort, never()).loadEntries();
        verify(knowledgeIndexPort, never()).replaceAll(anyList());
    }

    @Test
    void shouldStampRetrievalsWithCurrentTime() {
        service.recordRetrievals(List.of("lesson-1"));
        service.recordRetrievals(List.of());

        verify(knowledgeIndexPort).recordRetrievals(List.of("lesson-1"), "2026-06-01T00:00:00.000Z");
        verify(knowledgeIndexPort, never()).recordRetrievals(List.of(), "2026-06-01T00:00:00.000Z");
    }

    @Test
    void shouldUseConfiguredPromotionAndStaleSettings() {
        service.getPromotionCandidates();
        service.getStaleEntries();

        verify(knowledgeIndexPort).findPromotionCandidates(3);
        verify(knowledgeIndexPort).findStaleEntries("2026-04-02T00:00:00.000Z", 20);
    }

    @Test
    void shouldReportFtsAvailability() {
        when(knowledgeIndexPort.count()).thenReturn(0, 5);

        assertFalse(service.isFtsAvailable());
        assertTrue(service.isFtsAvailable());
    }

    @Test
    void shouldComputeDecayCurve() {
        double halfLife = 30;

        assertEquals(1.0, service.timeDecay(Optional.of(NOW), NOW, halfLife), 1e-9);
        assertEquals(Math.exp(-0.693), service.timeDecay(Optional.of(NOW.minusSeconds(30L * 86_400)), NOW, halfLife),
                1e-9);
        assertEquals(0.2, service.timeDecay(Optional.of(NOW.minusSeconds(365L * 86_400)), NOW, halfLife), 1e-9);
        assertEquals(1.0, service.timeDecay(Optional.empty(), NOW, halfLife), 1e-9);
    }

    private static LexicalHit hit(String source, int sourceId, double relevance, String date) {
        return new LexicalHit(KnowledgeEntry.builder()
                .id(KnowledgeEntry.idFor(source, sourceId))
                .source(source)
                .sourceId(sourceId)
                .text(source + " " + sourceId)
                .date(date)
                .build(), relevance);
    }
}
