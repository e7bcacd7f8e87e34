/*
 * Copyright (c) 2025 Original Author(s), PhonePe India Pvt. Ltd.
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 * http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package com.phonepe.memoria.core.capability.heuristic;

import com.google.common.base.Preconditions;
import com.google.common.hash.HashFunction;
import com.google.common.hash.Hashing;
import com.phonepe.memoria.core.capability.EmbeddingCapability;
import com.phonepe.memoria.core.utils.TextUtils;
import com.phonepe.memoria.core.utils.VectorUtils;

import java.nio.charset.StandardCharsets;

/**
 * Feature hashed bag of words embedding. Texts sharing content words land close together, which is enough for
 * offline use and tests. Deterministic across processes.
 */
public class HashingEmbeddingCapability implements EmbeddingCapability {
    public static final int DEFAULT_DIMENSION = 256;

    private static final HashFunction HASH = Hashing.murmur3_32_fixed();

    private final int dimension;

    public HashingEmbeddingCapability() {
        this(DEFAULT_DIMENSION);
    }

    public HashingEmbeddingCapability(int dimension) {
        Preconditions.checkArgument(dimension > 0, "Dimension must be positive");
        this.dimension = dimension;
    }

    @Override
    public float[] embed(String input) {
        final var vector = new float[dimension];
        for (var token : TextUtils.contentTokens(input)) {
            final var hash = HASH.hashString(token, StandardCharsets.UTF_8).asInt();
            final var bucket = Math.floorMod(hash, dimension);
            vector[bucket] += (hash & 0x40000000) == 0 ? 1.0f : -1.0f;
        }
        return VectorUtils.l2Normalize(vector);
    }

    @Override
    public int dimension() {
        return dimension;
    }
}
