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
import me.golemcore.matching.domain.model.EducationLevel;
import me.golemcore.matching.domain.model.PositionProfile;
import me.golemcore.matching.domain.model.SkillToken;
import org.springframework.stereotype.Component;

import java.util.Set;
import java.util.stream.Collectors;

/**
 * Scores the education and certification categories.
 *
 * <p>
 * Education: 1.0 without a requirement or when the candidate meets it,
 * otherwise the ratio of the candidate's level to the required one (0 when
 * unknown). Certifications: 1.0 without a requirement, otherwise the share of
 * required certifications the candidate holds, compared case-insensitively.
 *
 * @since 1.0
 */
@Component
public class CredentialMatcher {

    public double educationScore(PositionProfile position, CandidateProfile candidate) {
        EducationLevel required = position.getRequiredEducation();
        if (required == null || required == EducationLevel.NONE) {
            return 1.0;
        }
        EducationLevel actual = candidate.getEducationLevel();
        if (actual == null) {
            return 0.0;
        }
        if (actual.compareTo(required) >= 0) {
            return 1.0;
        }
        return (double) actual.ordinal() / required.ordinal();
    }

    public double certificationScore(PositionProfile position, CandidateProfile candidate) {
        Set<String> required = normalize(position.getRequiredCertifications());
        if (required.isEmpty()) {
            return 1.0;
        }
        Set<String> held = normalize(candidate.getCertifications());
        long matched = required.stream().filter(held::contains).count();
        return (double) matched / required.size();
    }

    private static Set<String> normalize(Set<String> values) {
        if (values == null) {
            return Set.of();
        }
        return values.stream()
                .filter(v -> v != null && !v.isBlank())
                .map(SkillToken::normalize)
                .collect(Collectors.toSet());
    }
}
