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

import me.golemcore.matching.domain.model.AggregateScore;
import me.golemcore.matching.domain.model.PenaltyKind;
import me.golemcore.matching.domain.model.ScoreCategory;
import me.golemcore.matching.domain.model.WeightConfig;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.Map;

/**
 * Combines category scores into the final percentage.
 *
 * <p>
 * {@code overall = sum(weight * clamp01(score))}, minus the sum of penalties,
 * floored at 0 and capped at 1, then scaled to percent and rounded half-up to
 * one decimal. Categories absent from the score map contribute 0.
 *
 * @since 1.0
 */
@Component
public class ScoreAggregator {

    public AggregateScore aggregate(Map<ScoreCategory, Double> scores, WeightConfig weights,
            Map<PenaltyKind, Double> penalties) {
        double weightedSum = 0.0;
        for (ScoreCategory category : ScoreCategory.values()) {
            Double score = scores.get(category);
            if (score != null) {
                weightedSum += weights.weightOf(category) * clamp01(score);
            }
        }

        double penaltyTotal = penalties.values().stream().mapToDouble(Double::doubleValue).sum();
        double fraction = Math.min(1.0, Math.max(0.0, weightedSum - penaltyTotal));
        return new AggregateScore(weightedSum, penaltyTotal, fraction, toPercentage(fraction));
    }

    static double toPercentage(double fraction) {
        return BigDecimal.valueOf(fraction * 100.0).setScale(1, RoundingMode.HALF_UP).doubleValue();
    }

    private static double clamp01(double value) {
        return Math.max(0.0, Math.min(1.0, value));
    }
}
