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
import lombok.Getter;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.TreeMap;
import java.util.regex.Pattern;

/**
 * Immutable, versioned snapshot of every table the engine reads.
 *
 * <p>
 * A snapshot is built completely before it is published and never changes
 * afterwards. Hot reload replaces the snapshot reference; evaluations capture
 * one snapshot at their start and use it throughout.
 *
 * <p>
 * The technology vocabulary (every surface form the detector recognizes,
 * mapped to its canonical token) is derived once here from the threshold and
 * synonym tables. Longer surface forms come first. Their whole-word patterns
 * are compiled with the snapshot and dropped with it.
 *
 * @since 1.0
 */
@Getter
public final class MatchingConfiguration {

    private final long version;
    private final Instant loadedAt;
    private final WeightConfig weights;
    private final ThresholdTable thresholds;
    private final SynonymTable synonyms;
    private final PenaltyRules penalties;
    private final GradeThresholds grades;
    private final MatcherTuning tuning;
    private final Map<String, String> vocabulary;
    private final Map<String, Pattern> vocabularyPatterns;

    @Builder
    private MatchingConfiguration(long version, Instant loadedAt, WeightConfig weights, ThresholdTable thresholds,
            SynonymTable synonyms, PenaltyRules penalties, GradeThresholds grades, MatcherTuning tuning) {
        this.version = version;
        this.loadedAt = loadedAt != null ? loadedAt : Instant.EPOCH;
        this.weights = Objects.requireNonNull(weights, "weights must not be null");
        this.thresholds = Objects.requireNonNull(thresholds, "thresholds must not be null");
        this.synonyms = synonyms != null ? synonyms : SynonymTable.empty();
        this.penalties = Objects.requireNonNull(penalties, "penalties must not be null");
        this.grades = Objects.requireNonNull(grades, "grades must not be null");
        this.tuning = tuning != null ? tuning : MatcherTuning.builder().build();
        this.vocabulary = buildVocabulary(this.thresholds, this.synonyms);
        this.vocabularyPatterns = compilePatterns(this.vocabulary);
    }

    /**
     * Whole-word pattern for a surface form. Vocabulary forms use the pattern
     * compiled with this snapshot; other forms get a fresh, uncached pattern.
     */
    public Pattern wordPattern(String form) {
        Pattern pattern = vocabularyPatterns.get(form);
        return pattern != null ? pattern : SkillToken.wordPattern(form);
    }

    private static Map<String, Pattern> compilePatterns(Map<String, String> vocabulary) {
        Map<String, Pattern> patterns = new LinkedHashMap<>();
        vocabulary.keySet().forEach(form -> patterns.put(form, SkillToken.wordPattern(form)));
        return Collections.unmodifiableMap(patterns);
    }

    private static Map<String, String> buildVocabulary(ThresholdTable thresholds, SynonymTable synonyms) {
        Map<String, String> forms = new TreeMap<>();
        for (String token : thresholds.knownTokens()) {
            forms.put(token, synonyms.canonicalOf(token).orElse(token));
        }
        synonyms.getAliasesByCanonical().keySet().forEach(canonical -> forms.put(canonical, canonical));
        forms.putAll(synonyms.getCanonicalByAlias());

        Map<String, String> ordered = new LinkedHashMap<>();
        forms.entrySet().stream()
                .sorted((a, b) -> {
                    int byLength = Integer.compare(b.getKey().length(), a.getKey().length());
                    return byLength != 0 ? byLength : a.getKey().compareTo(b.getKey());
                })
                .forEach(e -> ordered.put(e.getKey(), e.getValue()));
        return Collections.unmodifiableMap(ordered);
    }
}
