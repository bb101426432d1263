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

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JavaType;
import com.fasterxml.jackson.databind.ObjectMapper;
import jakarta.annotation.PostConstruct;
import lombok.Data;
import lombok.NoArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.matching.domain.exception.InvalidConfigurationException;
import me.golemcore.matching.domain.model.ConflictGroup;
import me.golemcore.matching.domain.model.GradeBand;
import me.golemcore.matching.domain.model.GradeThresholds;
import me.golemcore.matching.domain.model.MatcherTuning;
import me.golemcore.matching.domain.model.MatchingConfiguration;
import me.golemcore.matching.domain.model.PenaltyKind;
import me.golemcore.matching.domain.model.PenaltyRules;
import me.golemcore.matching.domain.model.SynonymTable;
import me.golemcore.matching.domain.model.ThresholdTable;
import me.golemcore.matching.domain.model.WeightConfig;
import org.springframework.core.io.DefaultResourceLoader;
import org.springframework.core.io.Resource;
import org.springframework.core.io.ResourceLoader;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.io.InputStream;
import java.time.Clock;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeSet;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Loads, validates and publishes the matching configuration snapshot.
 *
 * <p>
 * Weights, penalties, grade bands and tunables come from
 * {@link MatchingProperties}; the threshold and synonym tables are JSON
 * resources ({@code classpath:} by default, {@code file:} locations are
 * accepted). Every load builds a complete {@link MatchingConfiguration} with
 * the next version number before publishing it.
 *
 * <p>
 * A failed load at startup aborts the context. A failed {@link #reload()}
 * keeps the current snapshot and rethrows to the caller.
 *
 * @since 1.0
 */
@Service
@Slf4j
public class MatchingConfigService {

    private final MatchingProperties properties;
    private final ObjectMapper objectMapper;
    private final Clock clock;
    private final ResourceLoader resourceLoader = new DefaultResourceLoader();

    private final AtomicReference<MatchingConfiguration> current = new AtomicReference<>();
    private final AtomicLong versions = new AtomicLong();

    public MatchingConfigService(MatchingProperties properties, ObjectMapper objectMapper, Clock clock) {
        this.properties = properties;
        this.objectMapper = objectMapper;
        this.clock = clock;
    }

    @PostConstruct
    public void init() {
        MatchingConfiguration loaded = load();
        current.set(loaded);
        log.info("[MatchingConfig] Loaded v{}: preset={}, {} thresholds, {} conflict groups, {} synonyms",
                loaded.getVersion(), loaded.getWeights().getPresetName(), loaded.getThresholds().getEntries().size(),
                loaded.getThresholds().getGroups().size(), loaded.getSynonyms().size());
    }

    /**
     * Current snapshot. Callers capture it once per evaluation.
     */
    public MatchingConfiguration current() {
        MatchingConfiguration snapshot = current.get();
        if (snapshot == null) {
            throw new IllegalStateException("Matching configuration not loaded");
        }
        return snapshot;
    }

    /**
     * Rebuilds the snapshot from properties and table resources and swaps it in.
     *
     * @return the new snapshot
     * @throws InvalidConfigurationException
     *             if the new configuration is invalid; the previous snapshot
     *             stays active
     */
    public MatchingConfiguration reload() {
        MatchingConfiguration next;
        try {
            next = load();
        } catch (InvalidConfigurationException e) {
            MatchingConfiguration previous = current.get();
            log.warn("[MatchingConfig] Reload failed, keeping v{}: {}",
                    previous != null ? previous.getVersion() : 0, e.getMessage());
            throw e;
        }
        MatchingConfiguration previous = current.getAndSet(next);
        log.info("[MatchingConfig] Reloaded v{} -> v{}", previous != null ? previous.getVersion() : 0,
                next.getVersion());
        return next;
    }

    private MatchingConfiguration load() {
        WeightConfig weights = buildWeights();
        PenaltyRules penalties = buildPenalties();
        GradeThresholds grades = buildGrades();
        MatcherTuning tuning = buildTuning();
        ThresholdTable thresholds = buildThresholds(readTable(properties.getTables().getThresholds(),
                ThresholdFile.class));
        SynonymTable synonyms = buildSynonyms(properties.getTables().getSynonyms());

        return MatchingConfiguration.builder()
                .version(versions.incrementAndGet())
                .loadedAt(clock.instant())
                .weights(weights)
                .thresholds(thresholds)
                .synonyms(synonyms)
                .penalties(penalties)
                .grades(grades)
                .tuning(tuning)
                .build();
    }

    private WeightConfig buildWeights() {
        String active = properties.getWeights().getActivePreset();
        Map<String, Double> preset = properties.getWeights().getPresets().get(active);
        if (preset == null) {
            throw new InvalidConfigurationException("Unknown weight preset '" + active + "', available: "
                    + properties.getWeights().getPresets().keySet());
        }
        return WeightConfig.fromKeys(active, preset);
    }

    private PenaltyRules buildPenalties() {
        MatchingProperties.PenaltiesProperties config = properties.getPenalties();
        Map<PenaltyKind, Double> magnitudes = new EnumMap<>(PenaltyKind.class);
        config.getMagnitudes().forEach((key, value) -> {
            PenaltyKind kind;
            try {
                kind = PenaltyKind.fromKey(key);
            } catch (IllegalArgumentException e) {
                throw new InvalidConfigurationException("Unknown penalty kind '" + key + "'", e);
            }
            if (value == null) {
                throw new InvalidConfigurationException("Penalty '" + key + "' has no magnitude");
            }
            magnitudes.put(kind, value);
        });
        return new PenaltyRules(magnitudes, config.getExperiencePenaltyCap(), config.getRequiredMissingRatioTrigger());
    }

    private GradeThresholds buildGrades() {
        List<GradeBand> bands = new ArrayList<>();
        for (MatchingProperties.BandProperties band : properties.getGrades().getBands()) {
            bands.add(new GradeBand(band.getLabel(), band.getMin()));
        }
        return new GradeThresholds(bands);
    }

    private MatcherTuning buildTuning() {
        MatchingProperties.MatcherProperties matcher = properties.getMatcher();
        MatchingProperties.ScreeningProperties screening = properties.getScreening();
        requireUnit("matcher.near-miss-margin", matcher.getNearMissMargin());
        requireUnit("matcher.lacking-ratio", matcher.getLackingRatio());
        requireUnit("matcher.level-mismatch-reduction", matcher.getLevelMismatchReduction());
        requireUnit("matcher.narrative-blend", matcher.getNarrativeBlend());
        if (matcher.getCriticalWeight() < 1.0) {
            throw new InvalidConfigurationException("matcher.critical-weight must be >= 1, got "
                    + matcher.getCriticalWeight());
        }
        if (screening.getMinSimilarity() < -1.0 || screening.getMinSimilarity() > 1.0) {
            throw new InvalidConfigurationException("screening.min-similarity must be in [-1,1], got "
                    + screening.getMinSimilarity());
        }
        if (screening.getDefaultLimit() <= 0) {
            throw new InvalidConfigurationException("screening.default-limit must be positive");
        }
        return MatcherTuning.builder()
                .criticalWeight(matcher.getCriticalWeight())
                .nearMissMargin(matcher.getNearMissMargin())
                .lackingRatio(matcher.getLackingRatio())
                .levelMismatchReduction(matcher.getLevelMismatchReduction())
                .narrativeBlend(matcher.getNarrativeBlend())
                .screeningMinSimilarity(screening.getMinSimilarity())
                .screeningDefaultLimit(screening.getDefaultLimit())
                .build();
    }

    private ThresholdTable buildThresholds(ThresholdFile file) {
        if (file.getDefaultThreshold() == null) {
            throw new InvalidConfigurationException("Threshold table has no 'default' threshold");
        }
        try {
            Map<String, ConflictGroup> groups = new LinkedHashMap<>();
            if (file.getGroups() != null) {
                file.getGroups().forEach((name, group) -> {
                    TreeSet<String> tokens = group.getTokens() != null ? new TreeSet<>(group.getTokens())
                            : new TreeSet<>();
                    groups.put(name, new ConflictGroup(name, tokens, group.getDefaultThreshold()));
                });
            }
            return new ThresholdTable(file.getDefaultThreshold(), file.getThresholds(), groups);
        } catch (IllegalArgumentException e) {
            throw new InvalidConfigurationException("Invalid threshold table: " + e.getMessage(), e);
        }
    }

    private SynonymTable buildSynonyms(String location) {
        Map<String, List<String>> raw = readTable(location, new TypeReference<Map<String, List<String>>>() {
        });
        return new SynonymTable(raw);
    }

    private <T> T readTable(String location, Class<T> type) {
        return readTable(location, objectMapper.getTypeFactory().constructType(type));
    }

    private <T> T readTable(String location, TypeReference<T> type) {
        return readTable(location, objectMapper.getTypeFactory().constructType(type));
    }

    private <T> T readTable(String location, JavaType type) {
        Resource resource = resourceLoader.getResource(location);
        if (!resource.exists()) {
            throw new InvalidConfigurationException("Table resource not found: " + location);
        }
        try (InputStream is = resource.getInputStream()) {
            T value = objectMapper.readValue(is, type);
            if (value == null) {
                throw new InvalidConfigurationException("Table resource is empty: " + location);
            }
            return value;
        } catch (IOException e) {
            throw new InvalidConfigurationException("Failed to read table " + location + ": " + e.getMessage(), e);
        }
    }

    private static void requireUnit(String name, double value) {
        if (value < 0.0 || value > 1.0) {
            throw new InvalidConfigurationException(name + " must be in [0,1], got " + value);
        }
    }

    /**
     * Threshold table file: global default, conflict groups and explicit
     * per-token thresholds.
     */
    @Data
    @NoArgsConstructor
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class ThresholdFile {
        @JsonProperty("default")
        private Double defaultThreshold;
        private Map<String, GroupEntry> groups = new LinkedHashMap<>();
        private Map<String, Double> thresholds = new LinkedHashMap<>();
    }

    @Data
    @NoArgsConstructor
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class GroupEntry {
        @JsonProperty("default")
        private Double defaultThreshold;
        private List<String> tokens = new ArrayList<>();
    }
}
