package me.golemcore.matching.infrastructure.config;

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

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Configuration properties of the matching engine, bound from
 * application.properties.
 *
 * <p>
 * All settings live under the {@code matching.*} prefix:
 * <ul>
 * <li>{@link WeightsProperties} - category weight presets and the active
 * one</li>
 * <li>{@link PenaltiesProperties} - penalty magnitudes and the experience
 * cap</li>
 * <li>{@link GradesProperties} - grade bands</li>
 * <li>{@link MatcherProperties} - section/experience matcher tunables</li>
 * <li>{@link ScreeningProperties} - fast screening stage</li>
 * <li>{@link TablesProperties} - threshold and synonym table resources</li>
 * <li>{@link EmbeddingProperties} - embedding provider used for
 * indexing</li>
 * </ul>
 *
 * <p>
 * Defaults are set here so a bare instance describes the stock deployment.
 * Penalty keys may be written in kebab-case ({@code domain-mismatch}) or with
 * bracket notation ({@code [domain_mismatch]}).
 *
 * @since 1.0
 */
@Component
@ConfigurationProperties(prefix = "matching")
@Data
public class MatchingProperties {

    public static final String PRESET_SECTIONAL = "sectional";
    public static final String PRESET_DYNAMIC_THRESHOLD = "dynamic-threshold";

    private WeightsProperties weights = new WeightsProperties();
    private PenaltiesProperties penalties = new PenaltiesProperties();
    private GradesProperties grades = new GradesProperties();
    private MatcherProperties matcher = new MatcherProperties();
    private ScreeningProperties screening = new ScreeningProperties();
    private TablesProperties tables = new TablesProperties();
    private EmbeddingProperties embedding = new EmbeddingProperties();

    @Data
    public static class WeightsProperties {
        private String activePreset = PRESET_SECTIONAL;
        private Map<String, Map<String, Double>> presets = defaultPresets();

        private static Map<String, Map<String, Double>> defaultPresets() {
            Map<String, Map<String, Double>> presets = new LinkedHashMap<>();

            Map<String, Double> sectional = new LinkedHashMap<>();
            sectional.put("required", 0.40);
            sectional.put("experience", 0.30);
            sectional.put("overall", 0.20);
            sectional.put("preferred", 0.08);
            sectional.put("education", 0.015);
            sectional.put("certification", 0.005);
            presets.put(PRESET_SECTIONAL, sectional);

            Map<String, Double> dynamic = new LinkedHashMap<>();
            dynamic.put("required", 0.60);
            dynamic.put("preferred", 0.20);
            dynamic.put("experience", 0.10);
            dynamic.put("overall", 0.10);
            dynamic.put("education", 0.0);
            dynamic.put("certification", 0.0);
            presets.put(PRESET_DYNAMIC_THRESHOLD, dynamic);

            return presets;
        }
    }

    @Data
    public static class PenaltiesProperties {
        private Map<String, Double> magnitudes = defaultMagnitudes();
        private double experiencePenaltyCap = 0.15;
        private double requiredMissingRatioTrigger = 0.5;

        private static Map<String, Double> defaultMagnitudes() {
            Map<String, Double> magnitudes = new LinkedHashMap<>();
            magnitudes.put("experience_level_mismatch", 0.25);
            magnitudes.put("experience_significantly_lacking", 0.20);
            magnitudes.put("domain_mismatch", 0.20);
            magnitudes.put("role_mismatch", 0.15);
            magnitudes.put("required_skill_missing", 0.15);
            magnitudes.put("required_skill_critical_missing", 0.25);
            return magnitudes;
        }
    }

    @Data
    public static class GradesProperties {
        private List<BandProperties> bands = defaultBands();

        private static List<BandProperties> defaultBands() {
            List<BandProperties> bands = new ArrayList<>();
            bands.add(new BandProperties("excellent", 0.85));
            bands.add(new BandProperties("good", 0.70));
            bands.add(new BandProperties("fair", 0.55));
            bands.add(new BandProperties("caution", 0.40));
            bands.add(new BandProperties("poor", 0.0));
            return bands;
        }
    }

    @Data
    public static class BandProperties {
        private String label;
        private double min;

        public BandProperties() {
        }

        public BandProperties(String label, double min) {
            this.label = label;
            this.min = min;
        }
    }

    @Data
    public static class MatcherProperties {
        private double criticalWeight = 2.0;
        private double nearMissMargin = 0.05;
        private double lackingRatio = 0.3;
        private double levelMismatchReduction = 0.25;
        private double narrativeBlend = 0.0;
    }

    @Data
    public static class ScreeningProperties {
        private double minSimilarity = 0.3;
        private int defaultLimit = 50;

        /**
         * Worker threads for the fast stage; 0 means available processors.
         */
        private int parallelism = 0;
    }

    @Data
    public static class TablesProperties {
        private String thresholds = "matching/skill-thresholds.json";
        private String synonyms = "matching/skill-synonyms.json";
    }

    @Data
    public static class EmbeddingProperties {
        private String apiKey;
        private String baseUrl;
        private String model = "text-embedding-3-small";
        private int dimension = 1536;
    }
}
