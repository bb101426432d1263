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

import com.fasterxml.jackson.annotation.JsonIgnore;
import lombok.Builder;
import lombok.Data;

import java.util.ArrayList;
import java.util.List;

/**
 * Outcome of matching one requirement section.
 *
 * <p>
 * {@code score} is the matched share of item weight. An empty requirement
 * section scores 1.0; a non-empty one against a candidate without any skill or
 * sentence items scores 0.0 and sets {@code candidateSectionMissing}.
 *
 * @since 1.0
 */
@Data
@Builder
public class SectionResult {

    private RequirementPriority priority;
    private double score;

    @Builder.Default
    private List<ItemMatch> items = new ArrayList<>();

    private boolean candidateSectionMissing;

    public List<String> getMatched() {
        return items.stream().filter(ItemMatch::isMatched).map(ItemMatch::getText).toList();
    }

    public List<String> getMissing() {
        return items.stream().filter(i -> !i.isMatched()).map(ItemMatch::getText).toList();
    }

    /**
     * Human-readable matched/total item count, e.g. {@code "3/5"}.
     */
    public String getMatchRate() {
        long matched = items.stream().filter(ItemMatch::isMatched).count();
        return matched + "/" + items.size();
    }

    @JsonIgnore
    public double getUnmatchedRatio() {
        if (items.isEmpty()) {
            return 0.0;
        }
        long missing = items.stream().filter(i -> !i.isMatched()).count();
        return (double) missing / items.size();
    }

    @JsonIgnore
    public boolean hasCriticalMissing() {
        return items.stream().anyMatch(i -> i.isCritical() && !i.isMatched());
    }

    @JsonIgnore
    public List<ItemMatch> getNearMisses() {
        return items.stream().filter(ItemMatch::isNearMiss).toList();
    }
}
