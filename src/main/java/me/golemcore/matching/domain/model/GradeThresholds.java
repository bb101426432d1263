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

import me.golemcore.matching.domain.exception.InvalidConfigurationException;

import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Ordered grade bands, strictly descending by minimum score.
 *
 * <p>
 * The bands must cover [0,1] without gaps: the first minimum is at most 1, the
 * last one is exactly 0, and labels are unique. Since a band extends up to the
 * next higher minimum, these conditions make the bands contiguous and
 * exhaustive.
 *
 * @since 1.0
 */
public final class GradeThresholds {

    private final List<GradeBand> bands;

    public GradeThresholds(List<GradeBand> bands) {
        if (bands == null || bands.isEmpty()) {
            throw new InvalidConfigurationException("Grade thresholds must define at least one band");
        }
        Set<String> labels = new HashSet<>();
        double previous = Double.POSITIVE_INFINITY;
        for (GradeBand band : bands) {
            if (band.label() == null || band.label().isBlank()) {
                throw new InvalidConfigurationException("Grade band label must not be blank");
            }
            if (!labels.add(band.label())) {
                throw new InvalidConfigurationException("Duplicate grade band label: " + band.label());
            }
            if (Double.isNaN(band.minScore()) || band.minScore() < 0.0 || band.minScore() > 1.0) {
                throw new InvalidConfigurationException("Grade band '" + band.label()
                        + "' minimum must be in [0,1], was " + band.minScore());
            }
            if (band.minScore() >= previous) {
                throw new InvalidConfigurationException(
                        "Grade bands must be strictly descending by minimum score at '" + band.label() + "'");
            }
            previous = band.minScore();
        }
        if (previous != 0.0) {
            throw new InvalidConfigurationException(
                    "Lowest grade band must start at 0 so that every score is graded, was " + previous);
        }
        this.bands = List.copyOf(bands);
    }

    public List<GradeBand> getBands() {
        return bands;
    }
}
