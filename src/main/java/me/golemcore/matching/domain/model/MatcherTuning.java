package me.golemcore.matching.domain.model;

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

import lombok.Builder;
import lombok.Value;

/**
 * Numeric knobs of the section and experience matchers and of the fast
 * screening stage.
 *
 * @since 1.0
 */
@Value
@Builder
public class MatcherTuning {

    /**
     * Weight of a critical required item relative to an ordinary item.
     */
    @Builder.Default
    double criticalWeight = 2.0;

    /**
     * Distance below a threshold within which an unmatched item (or screened
     * profile) is reported as a near miss.
     */
    @Builder.Default
    double nearMissMargin = 0.05;

    /**
     * Shortfall ratio of the required minimum years above which the candidate is
     * flagged as significantly lacking.
     */
    @Builder.Default
    double lackingRatio = 0.3;

    @Builder.Default
    double levelMismatchReduction = 0.25;

    /**
     * Share of narrative similarity blended into the experience score; zero
     * keeps the score purely rule based.
     */
    @Builder.Default
    double narrativeBlend = 0.0;

    @Builder.Default
    double screeningMinSimilarity = 0.3;

    @Builder.Default
    int screeningDefaultLimit = 50;
}
