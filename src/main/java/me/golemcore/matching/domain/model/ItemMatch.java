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
 * Evidence for one requirement item: whether it matched, how, against which
 * candidate item, and under which threshold.
 *
 * @since 1.0
 */
@Data
@Builder
public class ItemMatch {

    private String itemId;
    private String text;
    private RequirementKind kind;
    private boolean critical;
    private double weight;

    private boolean matched;

    @Builder.Default
    private MatchType matchType = MatchType.NONE;

    /**
     * Best similarity found against any candidate item; 1.0 for lexical matches.
     */
    private double bestSimilarity;

    private String matchedCandidateItem;
    private double thresholdUsed;

    /**
     * Canonical technology token the threshold was resolved for, if any.
     */
    private String token;
    private String conflictGroup;

    /**
     * True when similarity cleared the threshold but the conflict veto rejected
     * the match.
     */
    private boolean vetoed;

    private boolean nearMiss;

    /**
     * Why the item could not be evaluated, when it degraded to unmatched.
     */
    private String failureReason;

    public static ItemMatch unmatched(String itemId, String text, RequirementKind kind, boolean critical,
            double weight, String failureReason) {
        return ItemMatch.builder()
                .itemId(itemId)
                .text(text)
                .kind(kind)
                .critical(critical)
                .weight(weight)
                .matched(false)
                .failureReason(failureReason)
                .build();
    }
}
