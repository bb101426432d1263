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

import java.util.LinkedHashSet;
import java.util.Set;

/**
 * Position side of a match, mirroring {@link CandidateProfile}.
 */
@Data
@Builder
public class PositionProfile {

    private String id;
    private String title;

    private EmbeddingVector overallVector;
    private EmbeddingVector requiredVector;
    private EmbeddingVector preferredVector;
    private EmbeddingVector descriptionVector;

    @Builder.Default
    private SectionRequirement required = SectionRequirement.empty(RequirementPriority.REQUIRED);

    @Builder.Default
    private SectionRequirement preferred = SectionRequirement.empty(RequirementPriority.PREFERRED);

    private Double minExperienceYears;
    private Double maxExperienceYears;
    private ExperienceLevel experienceLevel;

    @Builder.Default
    private Set<String> domainTags = new LinkedHashSet<>();

    @Builder.Default
    private Set<String> roleTags = new LinkedHashSet<>();

    private EducationLevel requiredEducation;

    @Builder.Default
    private Set<String> requiredCertifications = new LinkedHashSet<>();
}
