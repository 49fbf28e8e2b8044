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

import org.sqlite.Function;

import java.sql.SQLException;

/**
 * Application-defined SQL function {@code vec_distance_l2(a, b)} returning the
 * Euclidean distance between two float32 vector blobs.
 *
 * <p>
 * Registered on every connection opened by {@link KnowledgeDatabase}, so
 * nearest-neighbour queries can rank the vector table in plain SQL:
 *
 * <pre>
 * SELECT handle, vec_distance_l2(embedding, ?) AS distance
 * FROM vec_items ORDER BY distance LIMIT ?
 * </pre>
 */
public class L2DistanceFunction extends Function {

    public static final String NAME = "vec_distance_l2";

    @Override
    protected void xFunc() throws SQLException {
        if (args() != 2) {
            throw new SQLException(NAME + " expects 2 arguments, got " + args());
        }
        byte[] left = value_blob(0);
        byte[] right = value_blob(1);
        if (left == null || right == null) {
            result();
            return;
        }
        try {
            result(VectorBlobs.l2Distance(left, right));
        } catch (IllegalArgumentException e) {
            throw new SQLException(NAME + ": " + e.getMessage(), e);
        }
    }
}
