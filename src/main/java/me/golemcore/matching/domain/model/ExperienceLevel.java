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
 * Experience tiers, ordered junior &lt; mid &lt; senior.
 *
 * <p>
 * Year bands are used when a candidate's tier was not extracted: junior below
 * 3 years, mid from 3 to below 7, senior from 7.
 */
public enum ExperienceLevel {

    JUNIOR(0, 3),

    MID(3, 7),

    SENIOR(7, Double.POSITIVE_INFINITY);

    private final double minYears;
    private final double maxYears;

    ExperienceLevel(double minYears, double maxYears) {
        this.minYears = minYears;
        this.maxYears = maxYears;
    }

    public double getMinYears() {
        return minYears;
    }

    public double getMaxYears() {
        return maxYears;
    }

    public int distanceTo(ExperienceLevel other) {
        return Math.abs(ordinal() - other.ordinal());
    }

    public static ExperienceLevel fromYears(double years) {
        for (ExperienceLevel level : values()) {
            if (years >= level.minYears && years < level.maxYears) {
                return level;
            }
        }
        return JUNIOR;
    }

    /**
     * Lenient parser for extracted tier labels ("Senior", "mid-level",
     * "middle"). Returns null for blank or unrecognized input.
     */
    public static ExperienceLevel parse(String raw) {
        if (raw == null || raw.isBlank()) {
            return null;
        }
        String value = raw.trim().toLowerCase(Locale.ROOT);
        if (value.startsWith("junior") || value.startsWith("entry") || value.startsWith("intern")) {
            return JUNIOR;
        }
        if (value.startsWith("mid")) {
            return MID;
        }
        if (value.startsWith("senior") || value.startsWith("lead") || value.startsWith("principal")
                || value.startsWith("staff")) {
            return SENIOR;
        }
        return null;
    }
}
