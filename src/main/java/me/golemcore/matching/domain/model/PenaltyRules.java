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

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;

/**
 * Deduction magnitudes per penalty kind plus the collective cap on
 * experience-origin penalties. All values are on a 0-1 score scale.
 *
 * @since 1.0
 */
public final class PenaltyRules {

    private final Map<PenaltyKind, Double> magnitudes;
    private final double experiencePenaltyCap;
    private final double requiredMissingRatioTrigger;

    public PenaltyRules(Map<PenaltyKind, Double> magnitudes, double experiencePenaltyCap,
            double requiredMissingRatioTrigger) {
        EnumMap<PenaltyKind, Double> copy = new EnumMap<>(PenaltyKind.class);
        for (PenaltyKind kind : PenaltyKind.values()) {
            Double magnitude = magnitudes != null ? magnitudes.get(kind) : null;
            double value = magnitude != null ? magnitude : 0.0;
            requireUnit(kind.getKey(), value);
            copy.put(kind, value);
        }
        requireUnit("experience-penalty-cap", experiencePenaltyCap);
        requireUnit("required-missing-ratio-trigger", requiredMissingRatioTrigger);
        this.magnitudes = Collections.unmodifiableMap(copy);
        this.experiencePenaltyCap = experiencePenaltyCap;
        this.requiredMissingRatioTrigger = requiredMissingRatioTrigger;
    }

    public double magnitudeOf(PenaltyKind kind) {
        return magnitudes.get(kind);
    }

    public Map<PenaltyKind, Double> getMagnitudes() {
        return magnitudes;
    }

    public double getExperiencePenaltyCap() {
        return experiencePenaltyCap;
    }

    public double getRequiredMissingRatioTrigger() {
        return requiredMissingRatioTrigger;
    }

    private static void requireUnit(String name, double value) {
        if (Double.isNaN(value) || value < 0.0 || value > 1.0) {
            throw new InvalidConfigurationException("Penalty setting '" + name + "' must be in [0,1], was " + value);
        }
    }
}
