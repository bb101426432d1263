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
import me.golemcore.matching.domain.model.ExperienceResult;
import me.golemcore.matching.domain.model.MismatchFlag;
import me.golemcore.matching.domain.model.PenaltyKind;
import me.golemcore.matching.domain.model.PenaltyRules;
import me.golemcore.matching.domain.model.PositionProfile;
import me.golemcore.matching.domain.model.SectionResult;
import me.golemcore.matching.domain.model.SkillToken;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.Collection;
import java.util.EnumMap;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Turns mismatch signals into deductions.
 *
 * <p>
 * Experience-origin penalties share a cap: when their sum exceeds
 * {@code experiencePenaltyCap} each is scaled down proportionally so the total
 * equals the cap. Other kinds are applied at their configured magnitude.
 *
 * @since 1.0
 */
@Component
@Slf4j
public class PenaltyEngine {

    public Map<PenaltyKind, Double> evaluate(ExperienceResult experience, SectionResult required,
            PositionProfile position, CandidateProfile candidate, PenaltyRules rules) {
        Map<PenaltyKind, Double> triggered = new EnumMap<>(PenaltyKind.class);

        if (experience != null) {
            if (experience.hasFlag(MismatchFlag.LEVEL_MISMATCH)) {
                trigger(triggered, PenaltyKind.EXPERIENCE_LEVEL_MISMATCH, rules);
            }
            if (experience.hasFlag(MismatchFlag.SIGNIFICANTLY_LACKING)) {
                trigger(triggered, PenaltyKind.EXPERIENCE_SIGNIFICANTLY_LACKING, rules);
            }
        }

        if (isDisjoint(position.getDomainTags(), candidate.getDomainTags())) {
            trigger(triggered, PenaltyKind.DOMAIN_MISMATCH, rules);
        }
        if (isDisjoint(position.getRoleTags(), candidate.getRoleTags())) {
            trigger(triggered, PenaltyKind.ROLE_MISMATCH, rules);
        }

        if (required != null && !required.getItems().isEmpty()) {
            if (required.getUnmatchedRatio() > rules.getRequiredMissingRatioTrigger()) {
                trigger(triggered, PenaltyKind.REQUIRED_SKILL_MISSING, rules);
            }
            if (required.hasCriticalMissing()) {
                trigger(triggered, PenaltyKind.REQUIRED_SKILL_CRITICAL_MISSING, rules);
            }
        }

        applyExperienceCap(triggered, rules.getExperiencePenaltyCap());

        if (!triggered.isEmpty()) {
            log.debug("[PenaltyEngine] Applied penalties: {}", triggered);
        }
        return triggered;
    }

    private static void trigger(Map<PenaltyKind, Double> triggered, PenaltyKind kind, PenaltyRules rules) {
        double magnitude = rules.magnitudeOf(kind);
        if (magnitude > 0) {
            triggered.put(kind, magnitude);
        }
    }

    private static void applyExperienceCap(Map<PenaltyKind, Double> triggered, double cap) {
        double experienceTotal = triggered.entrySet().stream()
                .filter(e -> e.getKey().isExperienceOrigin())
                .mapToDouble(Map.Entry::getValue)
                .sum();
        if (experienceTotal <= cap) {
            return;
        }
        double scale = cap / experienceTotal;
        triggered.replaceAll((kind, value) -> kind.isExperienceOrigin() ? value * scale : value);
        log.debug("[PenaltyEngine] Experience penalties {} capped at {}", String.format("%.3f", experienceTotal),
                cap);
    }

    private static boolean isDisjoint(Collection<String> required, Collection<String> offered) {
        if (required == null || required.isEmpty()) {
            return false;
        }
        Set<String> wanted = normalize(required);
        if (wanted.isEmpty()) {
            return false;
        }
        Set<String> have = offered != null ? normalize(offered) : Set.of();
        return wanted.stream().noneMatch(have::contains);
    }

    private static Set<String> normalize(Collection<String> tags) {
        return tags.stream()
                .filter(t -> t != null && !t.isBlank())
                .map(SkillToken::normalize)
                .collect(Collectors.toSet());
    }
}
