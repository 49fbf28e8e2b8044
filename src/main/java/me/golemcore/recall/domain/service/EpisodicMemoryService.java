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
import me.golemcore.recall.domain.model.Episode;
import me.golemcore.recall.infrastructure.config.RecallProperties;
import me.golemcore.recall.port.outbound.EpisodicLogPort;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.List;

/**
 * Append-only journal of sprint actions and their outcomes.
 *
 * <p>
 * Recall tokenizes the cue (tokens of two characters or more), ORs the tokens
 * into a full-text expression and returns matches newest first. A cue with no
 * usable token returns nothing rather than everything.
 *
 * <p>
 * Episodes older than {@code recall.episodic.retention-days} are deleted when
 * the log is initialized.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class EpisodicMemoryService {

    private final EpisodicLogPort episodicLogPort;
    private final RecallProperties properties;
    private final Clock clock;

    /**
     * Create the tables if needed and prune expired episodes.
     */
    public void initialize() {
        episodicLogPort.initialize();
        pruneExpired();
    }

    /**
     * Delete episodes that fell out of the retention window.
     *
     * @return number of deleted episodes
     */
    public int pruneExpired() {
        Instant cutoff = Instant.now(clock).minus(Duration.ofDays(properties.getEpisodic().getRetentionDays()));
        int deleted = episodicLogPort.deleteOlderThan(cutoff);
        if (deleted > 0) {
            log.info("[Episodic] Pruned {} episodes older than {}", deleted, cutoff);
        }
        return deleted;
    }

    public Episode recordEpisode(String sprintPhase, String action, String outcome) {
        return recordEpisode(sprintPhase, action, outcome, null, List.of());
    }

    /**
     * Append an episode stamped with the current time.
     *
     * @return the stored episode with its assigned id
     */
    public Episode recordEpisode(String sprintPhase, String action, String outcome, String lesson,
            List<String> tags) {
        requireText(sprintPhase, "sprintPhase");
        requireText(action, "action");
        requireText(outcome, "outcome");

        Episode episode = Episode.builder()
                .sprintPhase(sprintPhase)
                .timestamp(Instant.now(clock).truncatedTo(ChronoUnit.MILLIS))
                .action(action)
                .outcome(outcome)
                .lesson(lesson)
                .tags(tags != null ? new ArrayList<>(tags) : new ArrayList<>())
                .build();

        long id = episodicLogPort.insert(episode);
        episode.setId(id);
        log.debug("[Episodic] Recorded episode {} in {}", id, sprintPhase);
        return episode;
    }

    public List<Episode> recallEpisodes(String query) {
        return recallEpisodes(query, properties.getEpisodic().getRecallLimit(), null);
    }

    public List<Episode> recallEpisodes(String query, int limit) {
        return recallEpisodes(query, limit, null);
    }

    /**
     * Keyword recall, newest first.
     *
     * @param sprintPhase
     *            optional phase filter, {@code null} or blank for every phase
     */
    public List<Episode> recallEpisodes(String query, int limit, String sprintPhase) {
        List<String> tokens = TextTokenizer.recallTokens(query);
        if (tokens.isEmpty() || limit < 1) {
            return List.of();
        }
        String phase = sprintPhase != null && !sprintPhase.isBlank() ? sprintPhase : null;
        return episodicLogPort.match(TextTokenizer.toOrExpression(tokens), phase, limit);
    }

    public List<Episode> getRecentEpisodes(String sprintPhase) {
        return getRecentEpisodes(sprintPhase, properties.getEpisodic().getRecentLimit());
    }

    public List<Episode> getRecentEpisodes(String sprintPhase, int limit) {
        if (limit < 1) {
            return List.of();
        }
        return episodicLogPort.findRecent(sprintPhase, limit);
    }

    public int countEpisodes() {
        return episodicLogPort.count();
    }

    private static void requireText(String value, String name) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException(name + " must not be blank");
        }
    }
}
