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

import java.util.EnumSet;
import java.util.Set;

/**
 * Experience fit and the evidence behind it.
 */
@Data
@Builder
public class ExperienceResult {

    /**
     * Category score fed to the aggregator.
     */
    private double score;

    /**
     * Rule-based fit before any narrative blending.
     */
    private double fitScore;

    /**
     * Description-vs-experience/projects similarity, null when vectors are
     * missing.
     */
    private Double narrativeSimilarity;

    private Double requiredMinYears;
    private Double requiredMaxYears;
    private double candidateYears;
    private ExperienceLevel requiredLevel;
    private ExperienceLevel candidateLevel;
    private boolean candidateLevelDerived;

    @Builder.Default
    private Set<MismatchFlag> flags = EnumSet.noneOf(MismatchFlag.class);

    private String details;

    public boolean hasFlag(MismatchFlag flag) {
        return flags.contains(flag);
    }
}
