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
import java.util.HashMap;
import java.util.Map;
import java.util.Optional;
import java.util.SortedSet;
import java.util.TreeMap;
import java.util.TreeSet;

/**
 * Read-only table of per-token similarity thresholds and conflict groups.
 *
 * <p>
 * Every threshold (explicit entries, group defaults and the global default)
 * must lie in [0,1] and a token may belong to at most one conflict group. Both
 * invariants are checked on construction.
 *
 * @since 1.0
 */
public final class ThresholdTable {

    private final double defaultThreshold;
    private final Map<String, Double> entries;
    private final Map<String, ConflictGroup> groups;
    private final Map<String, String> groupByToken;

    public ThresholdTable(double defaultThreshold, Map<String, Double> entries, Map<String, ConflictGroup> groups) {
        requireProbability("default", defaultThreshold);
        this.defaultThreshold = defaultThreshold;

        Map<String, Double> normalizedEntries = new TreeMap<>();
        if (entries != null) {
            entries.forEach((token, threshold) -> {
                if (threshold == null) {
                    throw new InvalidConfigurationException("Threshold for token '" + token + "' is missing");
                }
                requireProbability(token, threshold);
                normalizedEntries.put(SkillToken.normalize(token), threshold);
            });
        }
        this.entries = Collections.unmodifiableMap(normalizedEntries);

        Map<String, ConflictGroup> groupMap = new TreeMap<>();
        Map<String, String> membership = new HashMap<>();
        if (groups != null) {
            for (ConflictGroup group : groups.values()) {
                if (group.defaultThreshold() != null) {
                    requireProbability("group " + group.name(), group.defaultThreshold());
                }
                for (String token : group.tokens()) {
                    String previous = membership.putIfAbsent(token, group.name());
                    if (previous != null && !previous.equals(group.name())) {
                        throw new InvalidConfigurationException("Token '" + token
                                + "' belongs to more than one conflict group: " + previous + ", " + group.name());
                    }
                }
                groupMap.put(group.name(), group);
            }
        }
        this.groups = Collections.unmodifiableMap(groupMap);
        this.groupByToken = Collections.unmodifiableMap(membership);
    }

    public double getDefaultThreshold() {
        return defaultThreshold;
    }

    public Optional<Double> explicitThreshold(String canonicalToken) {
        return Optional.ofNullable(entries.get(canonicalToken));
    }

    public Optional<ConflictGroup> groupOf(String canonicalToken) {
        String name = groupByToken.get(canonicalToken);
        return name == null ? Optional.empty() : Optional.of(groups.get(name));
    }

    public Map<String, ConflictGroup> getGroups() {
        return groups;
    }

    public Map<String, Double> getEntries() {
        return entries;
    }

    /**
     * Tokens the table knows about, either through an explicit entry or a group
     * membership.
     */
    public SortedSet<String> knownTokens() {
        SortedSet<String> tokens = new TreeSet<>(entries.keySet());
        tokens.addAll(groupByToken.keySet());
        return Collections.unmodifiableSortedSet(tokens);
    }

    private static void requireProbability(String name, double value) {
        if (Double.isNaN(value) || value < 0.0 || value > 1.0) {
            throw new InvalidConfigurationException("Threshold '" + name + "' must be in [0,1], was " + value);
        }
    }
}
