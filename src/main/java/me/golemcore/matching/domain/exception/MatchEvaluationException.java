package me.golemcore.matching.domain.exception;

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

import me.golemcore.matching.domain.model.ScoreCategory;

/**
 * Aborts a detailed evaluation when one score category cannot be computed
 * correctly (for example because of a {@link DimensionMismatchException}).
 *
 * @since 1.0
 */
public class MatchEvaluationException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    private final transient ScoreCategory category;

    public MatchEvaluationException(ScoreCategory category, String candidateId, String positionId,
            Throwable cause) {
        super(String.format("Failed to score category '%s' for candidate=%s, position=%s: %s",
                category.getKey(), candidateId, positionId, cause.getMessage()), cause);
        this.category = category;
    }

    public ScoreCategory getCategory() {
        return category;
    }
}
