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

/**
 * One item of a position requirement section.
 *
 * <p>
 * For {@link RequirementKind#SKILL} items {@code text} is the skill name and
 * {@code vector} embeds its narrative context; for
 * {@link RequirementKind#SENTENCE} items {@code vector} embeds the sentence
 * itself.
 */
@Data
@Builder
public class RequirementItem {

    private String id;
    private String text;

    @Builder.Default
    private RequirementKind kind = RequirementKind.SENTENCE;

    /**
     * Only meaningful for required items; critical items weigh more and trigger
     * the critical-missing penalty.
     */
    private boolean critical;

    private EmbeddingVector vector;

    public static RequirementItem skill(String name, EmbeddingVector contextVector) {
        return RequirementItem.builder().text(name).kind(RequirementKind.SKILL).vector(contextVector).build();
    }

    public static RequirementItem sentence(String text, EmbeddingVector vector) {
        return RequirementItem.builder().text(text).kind(RequirementKind.SENTENCE).vector(vector).build();
    }
}
