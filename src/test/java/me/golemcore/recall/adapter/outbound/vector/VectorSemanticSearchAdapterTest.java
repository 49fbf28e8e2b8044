package me.golemcore.recall.adapter.outbound.vector;

import me.golemcore.recall.domain.model.VectorSearchResult;
import me.golemcore.recall.domain.service.VectorIndexService;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

class VectorSemanticSearchAdapterTest {

    private VectorIndexService vectorIndexService;
    private VectorSemanticSearchAdapter adapter;

    @BeforeEach
    void setUp() {
        vectorIndexService = mock(VectorIndexService.class);
        adapter = new VectorSemanticSearchAdapter(vectorIndexService);
    }

    @Test
    void shouldRequireVocabularyAndStoredVectors() {
        when(vectorIndexService.isVocabularyReady()).thenReturn(false, true, true);
        when(vectorIndexService.isVecAvailable()).thenReturn(false, true);

        assertFalse(adapter.isAvailable());
        assertFalse(adapter.isAvailable());
        assertTrue(adapter.isAvailable());
    }

    @Test
    void shouldDelegateTextSearch() {
        List<VectorSearchResult> expected = List.of(VectorSearchResult.of("lesson-1", 0.1));
        when(vectorIndexService.searchText("cache", 4)).thenReturn(expected);

        assertEquals(expected, adapter.search("cache", 4));
    }

    @Test
    void shouldNeverServeFromNoOp() {
        NoOpSemanticSearchAdapter noOp = new NoOpSemanticSearchAdapter();

        assertFalse(noOp.isAvailable());
        assertTrue(noOp.search("cache", 4).isEmpty());
    }
}
