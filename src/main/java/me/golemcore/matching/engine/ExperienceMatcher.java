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

import me.golemcore.matching.domain.model.CandidateProfile;
import me.golemcore.matching.domain.model.EmbeddingVector;
import me.golemcore.matching.domain.model.ExperienceLevel;
import me.golemcore.matching.domain.model.ExperienceResult;
import me.golemcore.matching.domain.model.MatcherTuning;
import me.golemcore.matching.domain.model.MismatchFlag;
import me.golemcore.matching.domain.model.PositionProfile;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.EnumSet;
import java.util.Locale;
import java.util.Objects;
import java.util.Set;

/**
 * Scores how well a candidate's experience fits the position's required range
 * and tier.
 *
 * <p>
 * The fit starts at 1.0. A shortfall below the required minimum subtracts its
 * ratio to the minimum; a tier more than one step away from the required tier
 * subtracts {@code levelMismatchReduction}. Years above the maximum never
 * penalize. The score never drops below 0.
 *
 * <p>
 * Narrative similarity (position description against candidate experience and
 * projects, weighted 0.7/0.3) is always reported and blended into the score
 * with {@code narrativeBlend}.
 *
 * @since 1.0
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class ExperienceMatcher {

    private static final double EXPERIENCE_NARRATIVE_WEIGHT = 0.7;
    private static final double PROJECTS_NARRATIVE_WEIGHT = 0.3;

    private final CosineSimilarity cosineSimilarity;

    public ExperienceResult match(PositionProfile position, CandidateProfile candidate, MatcherTuning tuning) {
        Objects.requireNonNull(position, "position must not be null");
        Objects.requireNonNull(candidate, "candidate must not be null");
        Objects.requireNonNull(tuning, "tuning must not be null");

        double years = candidate.getExperienceYears() != null ? Math.max(0.0, candidate.getExperienceYears()) : 0.0;
        boolean derived = candidate.getExperienceLevel() == null;
        ExperienceLevel candidateLevel = derived ? ExperienceLevel.fromYears(years) : candidate.getExperienceLevel();
        ExperienceLevel requiredLevel = position.getExperienceLevel();
        Double min = position.getMinExperienceYears();
        Double max = position.getMaxExperienceYears();

        Set<MismatchFlag> flags = EnumSet.noneOf(MismatchFlag.class);
        double fit = 1.0;

        if (min != null && min > 0 && years < min) {
            double shortfall = (min - years) / min;
            fit = Math.max(0.0, fit - shortfall);
            if (shortfall > tuning.getLackingRatio()) {
                flags.add(MismatchFlag.SIGNIFICANTLY_LACKING);
            }
        }

        if (requiredLevel != null && candidateLevel.distanceTo(requiredLevel) > 1) {
            flags.add(MismatchFlag.LEVEL_MISMATCH);
            fit = Math.max(0.0, fit - tuning.getLevelMismatchReduction());
        }

        Double narrative = narrativeSimilarity(position, candidate);
        double score = fit;
        if (narrative != null && tuning.getNarrativeBlend() > 0) {
            double blend = tuning.getNarrativeBlend();
            score = (1 - blend) * fit + blend * Math.max(0.0, narrative);
        }

        ExperienceResult result = ExperienceResult.builder()
                .score(score)
                .fitScore(fit)
                .narrativeSimilarity(narrative)
                .requiredMinYears(min)
                .requiredMaxYears(max)
                .candidateYears(years)
                .requiredLevel(requiredLevel)
                .candidateLevel(candidateLevel)
                .candidateLevelDerived(derived)
                .flags(flags)
                .details(describe(years, candidateLevel, min, max, requiredLevel))
                .build();

        log.debug("[ExperienceMatcher] {}: score={} flags={}", result.getDetails(),
                String.format("%.3f", score), flags);
        return result;
    }

    private Double narrativeSimilarity(PositionProfile position, CandidateProfile candidate) {
        EmbeddingVector description = position.getDescriptionVector();
        if (description == null) {
            return null;
        }
        EmbeddingVector experience = candidate.getExperienceVector();
        EmbeddingVector projects = candidate.getProjectsVector();

        if (experience != null && projects != null) {
            return EXPERIENCE_NARRATIVE_WEIGHT * cosineSimilarity.similarity(description, experience)
                    + PROJECTS_NARRATIVE_WEIGHT * cosineSimilarity.similarity(description, projects);
        }
        if (experience != null) {
            return cosineSimilarity.similarity(description, experience);
        }
        if (projects != null) {
            return cosineSimilarity.similarity(description, projects);
        }
        return null;
    }

    private static String describe(double years, ExperienceLevel candidateLevel, Double min, Double max,
            ExperienceLevel requiredLevel) {
        StringBuilder sb = new StringBuilder();
        sb.append(String.format(Locale.ROOT, "Candidate has %.1f years (%s)", years,
                candidateLevel.name().toLowerCase(Locale.ROOT)));
        if (min == null && max == null && requiredLevel == null) {
            return sb.append("; no experience requirement").toString();
        }
        sb.append("; position requires");
        if (min != null && max != null) {
            sb.append(String.format(Locale.ROOT, " %.1f-%.1f years", min, max));
        } else if (min != null) {
            sb.append(String.format(Locale.ROOT, " %.1f+ years", min));
        } else if (max != null) {
            sb.append(String.format(Locale.ROOT, " up to %.1f years", max));
        }
        if (requiredLevel != null) {
            sb.append(" (").append(requiredLevel.name().toLowerCase(Locale.ROOT)).append(')');
        }
        return sb.toString();
    }
}
