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
import me.golemcore.recall.domain.model.KnowledgeEntry;
import me.golemcore.recall.domain.model.KnowledgeSearchOptions;
import me.golemcore.recall.domain.model.KnowledgeSearchResult;
import me.golemcore.recall.domain.model.LexicalHit;
import me.golemcore.recall.domain.model.PromotionCandidate;
import me.golemcore.recall.domain.model.VectorSearchResult;
import me.golemcore.recall.infrastructure.config.RecallProperties;
import me.golemcore.recall.port.outbound.KnowledgeIndexPort;
import me.golemcore.recall.port.outbound.KnowledgeSourcePort;
import me.golemcore.recall.port.outbound.SemanticSearchPort;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Lexical knowledge search with BM25 ranking, time decay and retrieval
 * tracking.
 *
 * <p>
 * Scoring of each candidate:
 *
 * <pre>
 * ftsScore      = bm25 relevance × max(floor, e^(-0.693 × ageDays / halfLife))
 * combinedScore = ftsScore × ftsWeight + vectorScore × vectorWeight
 * </pre>
 *
 * The age is measured from the more recent of the entry date and its last
 * retrieval, so knowledge that keeps being used stays fresh. The vector term
 * contributes only when {@code vectorWeight > 0} and the semantic search
 * capability is available.
 *
 * <p>
 * Retrieval counts drive promotion (entries retrieved often) and archival
 * (entries nobody retrieves).
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class KnowledgeSearchService {

    private static final Pattern FTS_METACHARACTERS = Pattern.compile("[\"*\\-^():]");
    private static final Pattern WHITESPACE = Pattern.compile("\\s+");
    private static final double LN2 = 0.693;
    private static final int CANDIDATE_MULTIPLIER = 3;
    private static final double MILLIS_PER_DAY = 86_400_000d;

    private final KnowledgeIndexPort knowledgeIndexPort;
    private final KnowledgeSourcePort knowledgeSourcePort;
    private final SemanticSearchPort semanticSearchPort;
    private final RecallProperties properties;
    private final Clock clock;

    /**
     * Create the index if needed and populate it when empty.
     */
    public void initIndex() {
        knowledgeIndexPort.initialize();
        int count = knowledgeIndexPort.count();
        if (count == 0) {
            int rebuilt = rebuildIndex();
            log.info("[KnowledgeSearch] Index was empty, rebuilt with {} entries", rebuilt);
        } else {
            log.info("[KnowledgeSearch] Index loaded with {} entries", count);
        }
    }

    /**
     * Clear the index and repopulate it from the knowledge source in one
     * transaction.
     *
     * @return number of indexed entries
     */
    public int rebuildIndex() {
        List<KnowledgeEntry> entries = knowledgeSourcePort.loadEntries();
        int count = knowledgeIndexPort.replaceAll(entries);
        log.info("[KnowledgeSearch] Index rebuilt: {} entries", count);
        return count;
    }

    public void upsertEntry(KnowledgeEntry entry) {
        if (entry == null || entry.getSource() == null || entry.getSource().isBlank()) {
            throw new IllegalArgumentException("Entry source must not be blank");
        }
        knowledgeIndexPort.upsert(entry);
    }

    public List<KnowledgeSearchResult> search(String query) {
        return search(KnowledgeSearchOptions.builder().query(query).build());
    }

    public List<KnowledgeSearchResult> search(KnowledgeSearchOptions options) {
        if (options == null || options.getQuery() == null || options.getQuery().isBlank()) {
            return List.of();
        }
        String expression = sanitizeQuery(options.getQuery());
        if (expression.isEmpty()) {
            return List.of();
        }

        RecallProperties.SearchProperties defaults = properties.getSearch();
        int maxResults = options.getMaxResults() != null ? options.getMaxResults() : defaults.getMaxResults();
        double ftsWeight = options.getFtsWeight() != null ? options.getFtsWeight() : defaults.getFtsWeight();
        double vectorWeight = options.getVectorWeight() != null ? options.getVectorWeight()
                : defaults.getVectorWeight();
        double halfLife = options.getTimeDecayHalfLifeDays() != null ? options.getTimeDecayHalfLifeDays()
                : defaults.getTimeDecayHalfLifeDays();
        if (maxResults < 1) {
            return List.of();
        }

        int candidateLimit = maxResults * CANDIDATE_MULTIPLIER;
        List<LexicalHit> hits = knowledgeIndexPort.match(expression, candidateLimit);
        if (hits.isEmpty()) {
            return List.of();
        }

        Map<String, String> lastRetrievals = knowledgeIndexPort.findLastRetrievals(
                hits.stream().map(hit -> hit.entry().resolveId()).toList());
        Map<String, Double> vectorScores = vectorWeight > 0
                ? semanticScores(options.getQuery(), candidateLimit)
                : Map.of();
        Instant now = Instant.now(clock);

        List<KnowledgeSearchResult> results = new ArrayList<>(hits.size());
        for (LexicalHit hit : hits) {
            KnowledgeEntry entry = hit.entry();
            String id = entry.resolveId();
            double decay = timeDecay(freshest(entry.getDate(), lastRetrievals.get(id)), now, halfLife);
            double ftsScore = hit.relevance() * decay;
            Double vectorScore = vectorScores.isEmpty() ? null : vectorScores.getOrDefault(id, 0.0);
            double combined = ftsScore * ftsWeight + (vectorScore != null ? vectorScore * vectorWeight : 0);

            results.add(KnowledgeSearchResult.builder()
                    .id(id)
                    .source(entry.getSource())
                    .sourceId(entry.getSourceId())
                    .text(entry.getText())
                    .date(entry.getDate())
                    .ftsScore(ftsScore)
                    .vectorScore(vectorScore)
                    .combinedScore(combined)
                    .build());
        }

        results.sort(Comparator.comparingDouble(KnowledgeSearchResult::getCombinedScore).reversed());
        List<KnowledgeSearchResult> top = results.size() > maxResults
                ? new ArrayList<>(results.subList(0, maxResults))
                : results;
        log.debug("[KnowledgeSearch] '{}': {} matches, {} returned", options.getQuery(), hits.size(), top.size());
        return top;
    }

    /**
     * Count one retrieval for each id and stamp the current time.
     */
    public void recordRetrievals(List<String> entryIds) {
        if (entryIds == null || entryIds.isEmpty()) {
            return;
        }
        knowledgeIndexPort.recordRetrievals(entryIds, IsoTimestamps.format(Instant.now(clock)));
    }

    /**
     * Entries retrieved at least {@code recall.search.promotion-threshold}
     * times, most retrieved first.
     */
    public List<PromotionCandidate> getPromotionCandidates() {
        return knowledgeIndexPort.findPromotionCandidates(properties.getSearch().getPromotionThreshold());
    }

    /**
     * Entries never retrieved, or rarely retrieved and not since the stale
     * cutoff. Oldest first.
     */
    public List<PromotionCandidate> getStaleEntries() {
        RecallProperties.SearchProperties search = properties.getSearch();
        Instant cutoff = Instant.now(clock).minus(Duration.ofDays(search.getStaleDays()));
        return knowledgeIndexPort.findStaleEntries(IsoTimestamps.format(cutoff), search.getStaleLimit());
    }

    public boolean isFtsAvailable() {
        return knowledgeIndexPort.count() > 0;
    }

    public int countEntries() {
        return knowledgeIndexPort.count();
    }

    /**
     * Strip FTS5 syntax characters, then quote every remaining token and OR them
     * together.
     *
     * @return MATCH expression, or an empty string when nothing is left
     */
    static String sanitizeQuery(String raw) {
        String stripped = FTS_METACHARACTERS.matcher(raw).replaceAll(" ").trim();
        if (stripped.isEmpty()) {
            return "";
        }
        Set<String> tokens = new LinkedHashSet<>();
        for (String token : WHITESPACE.split(stripped.toLowerCase(Locale.ROOT))) {
            if (!token.isEmpty()) {
                tokens.add("\"" + token + "\"");
            }
        }
        return String.join(" OR ", tokens);
    }

    double timeDecay(Optional<Instant> date, Instant now, double halfLifeDays) {
        if (date.isEmpty() || halfLifeDays <= 0) {
            return 1.0;
        }
        double ageDays = (now.toEpochMilli() - date.get().toEpochMilli()) / MILLIS_PER_DAY;
        if (ageDays < 0) {
            return 1.0;
        }
        return Math.max(properties.getSearch().getTimeDecayFloor(), Math.exp(-LN2 * ageDays / halfLifeDays));
    }

    private Optional<Instant> freshest(String entryDate, String lastRetrieved) {
        Optional<Instant> created = IsoTimestamps.parse(entryDate);
        Optional<Instant> retrieved = IsoTimestamps.parse(lastRetrieved);
        if (created.isEmpty()) {
            return retrieved;
        }
        if (retrieved.isEmpty()) {
            return created;
        }
        return Optional.of(created.get().isAfter(retrieved.get()) ? created.get() : retrieved.get());
    }

    private Map<String, Double> semanticScores(String query, int limit) {
        if (!semanticSearchPort.isAvailable()) {
            return Map.of();
        }
        try {
            Map<String, Double> scores = new HashMap<>();
            for (VectorSearchResult result : semanticSearchPort.search(query, limit)) {
                scores.put(result.getId(), result.getScore());
            }
            return scores;
        } catch (RuntimeException e) {
            log.warn("[KnowledgeSearch] Semantic scoring failed, using lexical only: {}", e.getMessage());
            return Map.of();
        }
    }
}
