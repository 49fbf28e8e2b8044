package me.golemcore.recall.domain.model;

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

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * A searchable knowledge record (pattern, lesson, decision, deferred item)
 * held by the lexical index.
 *
 * <p>
 * The {@code id} is the stable join key shared with the vector store and is
 * derived from the source and its numeric id, e.g. {@code lesson-12}.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class KnowledgeEntry {

    private String id;
    private String source;
    private int sourceId;
    private String text;
    private String date;

    public static String idFor(String source, int sourceId) {
        return source + "-" + sourceId;
    }

    /**
     * Returns the explicit id, or the id derived from source and sourceId.
     */
    public String resolveId() {
        return id != null && !id.isBlank() ? id : idFor(source, sourceId);
    }
}
