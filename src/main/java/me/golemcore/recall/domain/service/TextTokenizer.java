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

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Shared tokenization for embeddings and keyword recall.
 *
 * <p>
 * Text is lowercased, every run of characters outside {@code [a-z0-9]} becomes
 * a separator, and tokens shorter than the length floor are dropped.
 */
public final class TextTokenizer {

    public static final int EMBEDDING_MIN_LENGTH = 3;
    public static final int RECALL_MIN_LENGTH = 2;

    private static final Pattern SEPARATOR = Pattern.compile("[^a-z0-9]+");

    private TextTokenizer() {
    }

    public static List<String> tokenize(String text, int minLength) {
        List<String> tokens = new ArrayList<>();
        if (text == null || text.isEmpty()) {
            return tokens;
        }
        for (String token : SEPARATOR.split(text.toLowerCase(Locale.ROOT))) {
            if (token.length() >= minLength) {
                tokens.add(token);
            }
        }
        return tokens;
    }

    /**
     * Tokens considered by the TF-IDF vocabulary (three characters or more).
     */
    public static List<String> embeddingTokens(String text) {
        return tokenize(text, EMBEDDING_MIN_LENGTH);
    }

    /**
     * Tokens considered by episodic recall (two characters or more).
     */
    public static List<String> recallTokens(String text) {
        return tokenize(text, RECALL_MIN_LENGTH);
    }

    /**
     * Joins tokens into an FTS5 OR expression. Callers must pass tokens produced
     * by this class, which never contain FTS5 syntax.
     */
    public static String toOrExpression(List<String> tokens) {
        return String.join(" OR ", tokens);
    }
}
