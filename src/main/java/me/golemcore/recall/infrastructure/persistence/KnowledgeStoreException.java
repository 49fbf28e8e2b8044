package me.golemcore.recall.infrastructure.persistence;

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

/**
 * Raised when the embedded database rejects a write or cannot be opened.
 *
 * <p>
 * Read paths never surface this exception: searches and availability checks
 * degrade to empty results instead.
 */
public class KnowledgeStoreException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    public KnowledgeStoreException(String message) {
        super(message);
    }

    public KnowledgeStoreException(String message, Throwable cause) {
        super(message, cause);
    }
}
