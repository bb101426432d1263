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

import java.util.Locale;

/**
 * Score categories combined by the aggregator.
 */
public enum ScoreCategory {

    REQUIRED("required"),

    PREFERRED("preferred"),

    EXPERIENCE("experience"),

    /**
     * Whole-profile cosine similarity, the only category the fast stage computes.
     */
    OVERALL("overall"),

    EDUCATION("education"),

    CERTIFICATION("certification");

    private final String key;

    ScoreCategory(String key) {
        this.key = key;
    }

    public String getKey() {
        return key;
    }

    public static ScoreCategory fromKey(String key) {
        String normalized = key == null ? "" : key.trim().toLowerCase(Locale.ROOT);
        for (ScoreCategory category : values()) {
            if (category.key.equals(normalized)) {
                return category;
            }
        }
        throw new IllegalArgumentException("Unknown score category: " + key);
    }
}
