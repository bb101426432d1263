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
import lombok.Data;

import java.time.Instant;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Detailed, explainable result of one candidate/position evaluation.
 *
 * <p>
 * Created fresh on every call and never retained by the engine. Everything
 * except {@code calculatedAt} is a pure function of the inputs and the
 * configuration snapshot.
 *
 * @since 1.0
 */
@Data
@Builder
public class MatchResult {

    private String candidateId;
    private String positionId;

    /**
     * Overall score as a percentage in [0,100], one decimal.
     */
    private double overallScore;

    private String grade;

    @Builder.Default
    private Map<ScoreCategory, CategoryScore> categoryScores = new EnumMap<>(ScoreCategory.class);

    private SectionResult required;
    private SectionResult preferred;
    private ExperienceResult experience;

    /**
     * Deductions actually applied, after capping, on a 0-1 scale.
     */
    @Builder.Default
    private Map<PenaltyKind, Double> penalties = new EnumMap<>(PenaltyKind.class);

    @Builder.Default
    private Set<MatchFlag> flags = EnumSet.noneOf(MatchFlag.class);

    @Builder.Default
    private List<ItemMatch> nearMisses = new ArrayList<>();

    private String weightPreset;
    private long configVersion;
    private String algorithmVersion;
    private Instant calculatedAt;

    public double categoryScore(ScoreCategory category) {
        CategoryScore score = categoryScores.get(category);
        return score != null ? score.score() : 0.0;
    }

    public double totalPenalty() {
        return penalties.values().stream().mapToDouble(Double::doubleValue).sum();
    }
}
