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

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Candidate side of a match: section vectors produced by the embedding
 * provider plus structured facts produced by the extractor.
 *
 * <p>
 * A null {@code experienceLevel} means the tier was not extracted; the
 * experience matcher then derives it from {@code experienceYears}.
 */
@Data
@Builder
public class CandidateProfile {

    private String id;

    /**
     * Whole-profile vector, compared in the fast screening stage.
     */
    private EmbeddingVector overallVector;

    private EmbeddingVector skillsVector;
    private EmbeddingVector experienceVector;
    private EmbeddingVector projectsVector;

    @Builder.Default
    private List<ProfileSentence> sentences = new ArrayList<>();

    @Builder.Default
    private List<CandidateSkill> skills = new ArrayList<>();

    private Double experienceYears;
    private ExperienceLevel experienceLevel;

    @Builder.Default
    private Set<String> domainTags = new LinkedHashSet<>();

    @Builder.Default
    private Set<String> roleTags = new LinkedHashSet<>();

    private EducationLevel educationLevel;

    @Builder.Default
    private Set<String> certifications = new LinkedHashSet<>();
}
