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
import java.util.List;

/**
 * Ordered requirement items of one priority.
 */
@Data
@Builder
public class SectionRequirement {

    private RequirementPriority priority;

    @Builder.Default
    private List<RequirementItem> items = new ArrayList<>();

    public static SectionRequirement empty(RequirementPriority priority) {
        return SectionRequirement.builder().priority(priority).build();
    }

    public static SectionRequirement of(RequirementPriority priority, List<RequirementItem> items) {
        return SectionRequirement.builder().priority(priority).items(new ArrayList<>(items)).build();
    }

    public boolean isEmpty() {
        return items == null || items.isEmpty();
    }
}
