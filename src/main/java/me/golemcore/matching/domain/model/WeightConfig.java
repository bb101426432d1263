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
 * Category weights of one policy preset. Weights are non-negative and sum to
 * 1.0 within {@link #TOLERANCE}; categories that are not listed weigh zero.
 *
 * @since 1.0
 */
public final class WeightConfig {

    public static final double TOLERANCE = 1e-6;

    private final String presetName;
    private final Map<ScoreCategory, Double> weights;

    public WeightConfig(String presetName, Map<ScoreCategory, Double> weights) {
        this.presetName = presetName;
        EnumMap<ScoreCategory, Double> copy = new EnumMap<>(ScoreCategory.class);
        double sum = 0.0;
        for (ScoreCategory category : ScoreCategory.values()) {
            Double weight = weights != null ? weights.get(category) : null;
            double value = weight != null ? weight : 0.0;
            if (Double.isNaN(value) || value < 0.0) {
                throw new InvalidConfigurationException("Weight for '" + category.getKey()
                        + "' in preset '" + presetName + "' must be non-negative, was " + value);
            }
            copy.put(category, value);
            sum += value;
        }
        if (Math.abs(sum - 1.0) > TOLERANCE) {
            throw new InvalidConfigurationException(String.format(
                    "Weights of preset '%s' must sum to 1.0, was %.6f", presetName, sum));
        }
        this.weights = Collections.unmodifiableMap(copy);
    }

    /**
     * Builds a config from string category keys as they appear in properties.
     */
    public static WeightConfig fromKeys(String presetName, Map<String, Double> weightsByKey) {
        EnumMap<ScoreCategory, Double> mapped = new EnumMap<>(ScoreCategory.class);
        if (weightsByKey != null) {
            weightsByKey.forEach((key, value) -> {
                try {
                    mapped.put(ScoreCategory.fromKey(key), value);
                } catch (IllegalArgumentException e) {
                    throw new InvalidConfigurationException(
                            "Preset '" + presetName + "' has unknown category '" + key + "'", e);
                }
            });
        }
        return new WeightConfig(presetName, mapped);
    }

    public String getPresetName() {
        return presetName;
    }

    public double weightOf(ScoreCategory category) {
        return weights.get(category);
    }

    public Map<ScoreCategory, Double> getWeights() {
        return weights;
    }
}
