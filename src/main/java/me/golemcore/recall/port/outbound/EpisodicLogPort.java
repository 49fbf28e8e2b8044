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

import me.golemcore.recall.domain.model.Episode;

import java.time.Instant;
import java.util.List;

/**
 * Port for the append-only episode journal and its full-text shadow index.
 */
public interface EpisodicLogPort {

    void initialize();

    /**
     * Append an episode.
     *
     * @return assigned id
     */
    long insert(Episode episode);

    /**
     * Full-text match against action, outcome, lesson and tags, newest first.
     *
     * @param matchExpression
     *            FTS5 MATCH expression
     * @param sprintPhase
     *            optional phase filter, {@code null} for all phases
     * @param limit
     *            maximum results
     */
    List<Episode> match(String matchExpression, String sprintPhase, int limit);

    List<Episode> findRecent(String sprintPhase, int limit);

    /**
     * Hard-delete episodes recorded before the cutoff.
     *
     * @return number of deleted episodes
     */
    int deleteOlderThan(Instant cutoff);

    int count();
}
