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
 * Ranked shortlist produced by the fast screening stage.
 *
 * <p>
 * {@code hits} are sorted by similarity descending (profile id breaks ties) and
 * cut at the requested limit. {@code nearMisses} fell just below the minimum
 * similarity. {@code rejected} counts profiles that could not be compared
 * (missing vector or dimension mismatch).
 */
@Data
@Builder
public class ScreeningResult {

    @Builder.Default
    private List<ScreeningHit> hits = new ArrayList<>();

    @Builder.Default
    private List<ScreeningHit> nearMisses = new ArrayList<>();

    private int screened;
    private int rejected;
    private double minSimilarity;
    private long configVersion;
}
