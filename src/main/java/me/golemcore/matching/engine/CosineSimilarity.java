package me.golemcore.matching.engine;

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

import me.golemcore.matching.domain.exception.DimensionMismatchException;
import me.golemcore.matching.domain.model.EmbeddingVector;
import org.springframework.stereotype.Component;

import java.util.Objects;

/**
 * Cosine similarity between two embedding vectors.
 *
 * <p>
 * The result is clamped to [-1, 1] so rounding never leaks outside the range.
 * A zero-magnitude vector has no direction and scores 0 against anything.
 *
 * @since 1.0
 */
@Component
public class CosineSimilarity {

    /**
     * Calculates cosine similarity of {@code a} and {@code b}.
     *
     * @throws DimensionMismatchException
     *             if the vectors differ in length
     */
    public double similarity(EmbeddingVector a, EmbeddingVector b) {
        Objects.requireNonNull(a, "left vector must not be null");
        Objects.requireNonNull(b, "right vector must not be null");
        if (a.dimension() != b.dimension()) {
            throw new DimensionMismatchException(a.dimension(), b.dimension());
        }

        double dotProduct = 0;
        double normA = 0;
        double normB = 0;

        for (int i = 0; i < a.dimension(); i++) {
            double x = a.get(i);
            double y = b.get(i);
            dotProduct += x * y;
            normA += x * x;
            normB += y * y;
        }

        if (normA == 0 || normB == 0) {
            return 0;
        }

        // a single square root keeps sim(a, a) exactly 1
        double cosine = dotProduct / Math.sqrt(normA * normB);
        return Math.max(-1.0, Math.min(1.0, cosine));
    }
}
