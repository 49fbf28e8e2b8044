package me.golemcore.recall.adapter.outbound.embedding;

import me.golemcore.recall.domain.model.Vocabulary;
import me.golemcore.recall.infrastructure.config.RecallProperties;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class TfIdfEmbeddingAdapterTest {

    private static final List<String> CORPUS = List.of(
            "sprint planning code review",
            "database migration schema design",
            "authentication security tokens");

    private RecallProperties properties;
    private TfIdfEmbeddingAdapter adapter;

    @BeforeEach
    void setUp() {
        properties = new RecallProperties();
        adapter = new TfIdfEmbeddingAdapter(properties);
    }

    @Test
    void shouldFailToEmbedBeforeVocabularyIsBuilt() {
        assertFalse(adapter.isVocabularyReady());
        IllegalStateException error = assertThrows(IllegalStateException.class, () -> adapter.embed("sprint"));
        assertTrue(error.getMessage().contains("Vocabulary not built"));
    }

    @Test
    void shouldProduceUnitLengthVectors() {
        adapter.buildVocabulary(CORPUS);

        for (String text : List.of("sprint code", "database schema schema", "security tokens review design")) {
            float[] embedding = adapter.embed(text);
            assertEquals(768, embedding.length);
            assertEquals(1.0, sumOfSquares(embedding), 1e-5);
        }
    }

    @Test
    void shouldReturnZeroVectorWhenNoTermMatches() {
        adapter.buildVocabulary(CORPUS);

        float[] embedding = adapter.embed("completely unrelated words");

        assertEquals(0.0, sumOfSquares(embedding), 0.0);
    }

    @Test
    void shouldKeepVocabularyWhenCorpusIsEmpty() {
        adapter.buildVocabulary(CORPUS);
        Vocabulary before = adapter.getVocabulary();

        adapter.buildVocabulary(List.of());
        adapter.buildVocabulary(null);

        assertSame(before, adapter.getVocabulary());
        assertTrue(adapter.isVocabularyReady());
    }

    @Test
    void shouldCountDocumentFrequencyOncePerDocument() {
        adapter.buildVocabulary(List.of("cache cache cache miss", "cache hit", "queue"));
        Vocabulary vocabulary = adapter.getVocabulary();

        assertEquals("cache", vocabulary.terms().get(0));
        assertEquals(Math.log(3.0 / 2.0), vocabulary.idf("cache"), 1e-9);
        assertEquals(Math.log(3.0), vocabulary.idf("miss"), 1e-9);
        assertEquals(3, vocabulary.documentCount());
    }

    @Test
    void shouldBreakFrequencyTiesByFirstAppearance() {
        adapter.buildVocabulary(List.of("zeta alpha", "mid"));

        assertEquals(List.of("zeta", "alpha", "mid"), adapter.getVocabulary().terms());
    }

    @Test
    void shouldCapVocabularyAtConfiguredDimensions() {
        properties.getVector().setDimensions(4);
        List<String> documents = new ArrayList<>();
        for (int i = 0; i < 10; i++) {
            documents.add("term" + i + " common");
        }

        adapter.buildVocabulary(documents);

        assertEquals(4, adapter.getVocabulary().size());
        assertEquals("common", adapter.getVocabulary().terms().get(0));
        assertEquals(4, adapter.embed("common term1").length);
    }

    @Test
    void shouldWeightRepeatedTermsByFrequency() {
        adapter.buildVocabulary(CORPUS);
        Vocabulary vocabulary = adapter.getVocabulary();
        int sprint = vocabulary.terms().indexOf("sprint");
        int code = vocabulary.terms().indexOf("code");

        float[] embedding = adapter.embed("sprint sprint code");

        assertEquals(2.0, embedding[sprint] / embedding[code], 1e-5);
    }

    @Test
    void shouldFitCandidateWithoutReplacingCurrentVocabulary() {
        adapter.buildVocabulary(CORPUS);
        Vocabulary current = adapter.getVocabulary();

        Vocabulary candidate = adapter.fitVocabulary(List.of("zeta omega", "kappa lambda"));

        assertSame(current, adapter.getVocabulary());
        assertEquals(List.of("zeta", "omega", "kappa", "lambda"), candidate.terms());
    }

    @Test
    void shouldEmbedBatchWithUnpublishedVocabulary() {
        Vocabulary candidate = adapter.fitVocabulary(CORPUS);

        List<float[]> vectors = adapter.embedBatch(candidate, List.of("sprint planning", "security tokens"));

        assertFalse(adapter.isVocabularyReady());
        assertEquals(2, vectors.size());
        assertEquals(1.0, sumOfSquares(vectors.get(0)), 1e-5);
        assertEquals(1.0, sumOfSquares(vectors.get(1)), 1e-5);

        adapter.publishVocabulary(candidate);

        assertArrayEquals(vectors.get(0), adapter.embed("sprint planning"));
    }

    @Test
    void shouldRejectFittingEmptyCorpus() {
        assertThrows(IllegalArgumentException.class, () -> adapter.fitVocabulary(List.of()));
        assertThrows(IllegalArgumentException.class, () -> adapter.publishVocabulary(null));
    }

    @Test
    void shouldReportModelAndAvailability() {
        assertEquals("tfidf-bow", adapter.getModel());
        assertEquals(768, adapter.getDimension());
        assertFalse(adapter.isAvailable());

        adapter.buildVocabulary(CORPUS);

        assertTrue(adapter.isAvailable());
    }

    private static double sumOfSquares(float[] vector) {
        double sum = 0;
        for (float value : vector) {
            sum += (double) value * value;
        }
        return sum;
    }
}
