package me.golemcore.recall.adapter.outbound.storage;

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

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.recall.domain.model.KnowledgeEntry;
import me.golemcore.recall.domain.service.IsoTimestamps;
import me.golemcore.recall.infrastructure.config.RecallProperties;
import me.golemcore.recall.port.outbound.KnowledgeSourcePort;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.StringJoiner;

/**
 * Loads knowledge entries from the JSON files in the knowledge directory.
 *
 * <p>
 * Recognized files, each mapped to one entry source:
 * <ul>
 * <li>{@code patterns.json} - {@code patterns[]}: name, description,
 * example</li>
 * <li>{@code lessons.json} - {@code lessons[]}: situation, learning</li>
 * <li>{@code decisions.json} - {@code decisions[]}: title, context, rationale,
 * alternatives</li>
 * <li>{@code deferred.json} - {@code items[]}: title, reason, effort</li>
 * </ul>
 *
 * <p>
 * Missing files are skipped and corrupt files are skipped with a warning.
 * Records without a date are stamped with the current time.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class JsonKnowledgeSourceAdapter implements KnowledgeSourcePort {

    private static final List<SourceFile> SOURCES = List.of(
            new SourceFile("patterns.json", "patterns", "pattern", List.of("name", "description", "example")),
            new SourceFile("lessons.json", "lessons", "lesson", List.of("situation", "learning")),
            new SourceFile("decisions.json", "decisions", "decision",
                    List.of("title", "context", "rationale", "alternatives")),
            new SourceFile("deferred.json", "items", "deferred", List.of("title", "reason", "effort")));

    private final RecallProperties properties;
    private final ObjectMapper objectMapper;
    private final Clock clock;

    @Override
    public List<KnowledgeEntry> loadEntries() {
        Path dir = properties.getStorage().resolveKnowledgeDir();
        String now = IsoTimestamps.format(Instant.now(clock));
        List<KnowledgeEntry> entries = new ArrayList<>();
        for (SourceFile source : SOURCES) {
            entries.addAll(load(dir.resolve(source.fileName()), source, now));
        }
        log.debug("[KnowledgeSource] Loaded {} entries from {}", entries.size(), dir);
        return entries;
    }

    private List<KnowledgeEntry> load(Path file, SourceFile source, String now) {
        if (!Files.isRegularFile(file)) {
            return List.of();
        }
        JsonNode root;
        try {
            root = objectMapper.readTree(file.toFile());
        } catch (IOException e) {
            log.warn("[KnowledgeSource] Skipping corrupt file {}: {}", file, e.getMessage());
            return List.of();
        }

        JsonNode records = root != null ? root.path(source.arrayField()) : null;
        if (records == null || !records.isArray()) {
            return List.of();
        }

        List<KnowledgeEntry> entries = new ArrayList<>();
        for (JsonNode record : records) {
            if (!record.isObject()) {
                continue;
            }
            StringJoiner text = new StringJoiner(" ");
            for (String field : source.textFields()) {
                text.add(textOf(record.get(field)));
            }
            String date = textOf(record.get("date"));
            entries.add(KnowledgeEntry.builder()
                    .source(source.entrySource())
                    .sourceId(record.path("id").asInt(0))
                    .text(text.toString().trim())
                    .date(date.isEmpty() ? now : date)
                    .build());
        }
        return entries;
    }

    private static String textOf(JsonNode node) {
        if (node == null || node.isNull() || node.isMissingNode()) {
            return "";
        }
        return node.isValueNode() ? node.asText() : node.toString();
    }

    private record SourceFile(String fileName, String arrayField, String entrySource, List<String> textFields) {
    }
}
