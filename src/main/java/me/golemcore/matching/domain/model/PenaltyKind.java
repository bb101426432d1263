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
 * Kinds of score deduction. Experience-origin kinds share a collective cap.
 */
public enum PenaltyKind {

    EXPERIENCE_LEVEL_MISMATCH("experience_level_mismatch", true),

    EXPERIENCE_SIGNIFICANTLY_LACKING("experience_significantly_lacking", true),

    DOMAIN_MISMATCH("domain_mismatch", false),

    ROLE_MISMATCH("role_mismatch", false),

    REQUIRED_SKILL_MISSING("required_skill_missing", false),

    REQUIRED_SKILL_CRITICAL_MISSING("required_skill_critical_missing", false);

    private final String key;
    private final boolean experienceOrigin;

    PenaltyKind(String key, boolean experienceOrigin) {
        this.key = key;
        this.experienceOrigin = experienceOrigin;
    }

    public String getKey() {
        return key;
    }

    public boolean isExperienceOrigin() {
        return experienceOrigin;
    }

    /**
     * Accepts snake_case and kebab-case keys, case-insensitively.
     */
    public static PenaltyKind fromKey(String key) {
        String normalized = key == null ? "" : key.trim().toLowerCase(Locale.ROOT).replace('-', '_');
        for (PenaltyKind kind : values()) {
            if (kind.key.equals(normalized)) {
                return kind;
            }
        }
        throw new IllegalArgumentException("Unknown penalty kind: " + key);
    }
}
