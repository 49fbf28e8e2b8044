package me.golemcore.recall.infrastructure.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import me.golemcore.recall.domain.service.EpisodicMemoryService;
import me.golemcore.recall.domain.service.KnowledgeGraphService;
import me.golemcore.recall.domain.service.KnowledgeSearchService;
import me.golemcore.recall.domain.service.VectorIndexService;
import me.golemcore.recall.infrastructure.persistence.KnowledgeDatabase;
import me.golemcore.recall.infrastructure.persistence.KnowledgeStoreException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class AutoConfigurationTest {

    private RecallProperties properties;
    private KnowledgeDatabase knowledgeDatabase;
    private VectorIndexService vectorIndexService;
    private KnowledgeGraphService knowledgeGraphService;
    private EpisodicMemoryService episodicMemoryService;
    private KnowledgeSearchService knowledgeSearchService;
    private AutoConfiguration configuration;

    @BeforeEach
    void setUp() {
        properties = new RecallProperties();
        knowledgeDatabase = mock(KnowledgeDatabase.class);
        vectorIndexService = mock(VectorIndexService.class);
        knowledgeGraphService = mock(KnowledgeGraphService.class);
        episodicMemoryService = mock(EpisodicMemoryService.class);
        knowledgeSearchService = mock(KnowledgeSearchService.class);
        when(knowledgeDatabase.getLocation()).thenReturn("/tmp/knowledge.db");
        configuration = new AutoConfiguration(properties, knowledgeDatabase, vectorIndexService,
                knowledgeGraphService, episodicMemoryService, knowledgeSearchService);
    }

    @Test
    void shouldInitializeEveryStore() {
        configuration.init();

        verify(vectorIndexService).initialize();
        verify(knowledgeGraphService).initialize();
        verify(episodicMemoryService).initialize();
        verify(knowledgeSearchService).initIndex();
        verify(vectorIndexService, never()).indexAllKnowledge();
    }

    @Test
    void shouldContinueWhenOneStoreFails() {
        doThrow(new KnowledgeStoreException("disk full")).when(knowledgeGraphService).initialize();

        configuration.init();

        verify(episodicMemoryService).initialize();
        verify(knowledgeSearchService).initIndex();
    }

    @Test
    void shouldIndexVectorsOnStartupWhenConfigured() {
        properties.getVector().setIndexOnStartup(true);

        configuration.init();

        verify(vectorIndexService).indexAllKnowledge();
    }

    @Test
    void shouldSkipStartupIndexingWhenVectorsDisabled() {
        properties.getVector().setIndexOnStartup(true);
        properties.getVector().setEnabled(false);

        configuration.init();

        verify(vectorIndexService, never()).indexAllKnowledge();
    }

    @Test
    void shouldProvideObjectMapperWithJavaTime() throws Exception {
        ObjectMapper mapper = AutoConfiguration.objectMapper();

        assertEquals("\"2026-01-01T00:00:00Z\"", mapper.writeValueAsString(Instant.parse("2026-01-01T00:00:00Z")));
        assertEquals(Map.of("a", 1), mapper.readValue("{\"a\":1,\"b\":2}", Probe.class).asMap());
        assertNotNull(AutoConfiguration.clock());
    }

    static class Probe {
        public int a;

        Map<String, Integer> asMap() {
            return Map.of("a", a);
        }
    }
}
