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

import java.nio.ByteBuffer;
import java.nio.ByteOrder;

/**
 * Binary codec for float32 vectors stored as SQLite blobs.
 *
 * <p>
 * Layout is little-endian IEEE-754 float32, four bytes per dimension, which
 * is the same layout sqlite-vec uses for {@code float[N]} columns.
 */
public final class VectorBlobs {

    private VectorBlobs() {
    }

    public static byte[] encode(float[] vector) {
        ByteBuffer buffer = ByteBuffer.allocate(vector.length * Float.BYTES).order(ByteOrder.LITTLE_ENDIAN);
        for (float value : vector) {
            buffer.putFloat(value);
        }
        return buffer.array();
    }

    public static float[] decode(byte[] blob) {
        if (blob == null) {
            throw new IllegalArgumentException("Vector blob is null");
        }
        if (blob.length % Float.BYTES != 0) {
            throw new IllegalArgumentException("Vector blob length " + blob.length + " is not a multiple of 4");
        }
        ByteBuffer buffer = ByteBuffer.wrap(blob).order(ByteOrder.LITTLE_ENDIAN);
        float[] vector = new float[blob.length / Float.BYTES];
        for (int i = 0; i < vector.length; i++) {
            vector[i] = buffer.getFloat();
        }
        return vector;
    }

    /**
     * Euclidean distance between two encoded vectors of equal length.
     *
     * @throws IllegalArgumentException
     *             if the blobs encode vectors of different dimensions
     */
    public static double l2Distance(byte[] left, byte[] right) {
        float[] a = decode(left);
        float[] b = decode(right);
        if (a.length != b.length) {
            throw new IllegalArgumentException(
                    "Dimension mismatch: " + a.length + " vs " + b.length);
        }
        double sum = 0;
        for (int i = 0; i < a.length; i++) {
            double diff = (double) a[i] - b[i];
            sum += diff * diff;
        }
        return Math.sqrt(sum);
    }
}
