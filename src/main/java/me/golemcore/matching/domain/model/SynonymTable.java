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

import java.util.Collection;
import java.util.Collections;
import java.util.Map;
import java.util.Optional;
import java.util.SortedSet;
import java.util.TreeMap;
import java.util.TreeSet;

/**
 * Static synonym table: canonical skill → accepted aliases, with a reverse
 * alias index. Keys and aliases are stored in normalized form.
 *
 * @since 1.0
 */
public final class SynonymTable {

    private final Map<String, SortedSet<String>> aliasesByCanonical;
    private final Map<String, String> canonicalByAlias;

    public SynonymTable(Map<String, ? extends Collection<String>> synonyms) {
        Map<String, SortedSet<String>> forward = new TreeMap<>();
        Map<String, String> reverse = new TreeMap<>();
        if (synonyms != null) {
            synonyms.forEach((rawCanonical, rawAliases) -> {
                String canonical = SkillToken.normalize(rawCanonical);
                if (canonical.isEmpty()) {
                    throw new InvalidConfigurationException("Synonym table contains a blank canonical token");
                }
                SortedSet<String> aliases = forward.computeIfAbsent(canonical, k -> new TreeSet<>());
                if (rawAliases != null) {
                    for (String rawAlias : rawAliases) {
                        String alias = SkillToken.normalize(rawAlias);
                        if (alias.isEmpty() || alias.equals(canonical)) {
                            continue;
                        }
                        String previous = reverse.putIfAbsent(alias, canonical);
                        if (previous != null && !previous.equals(canonical)) {
                            throw new InvalidConfigurationException("Alias '" + alias
                                    + "' is declared for both '" + previous + "' and '" + canonical + "'");
                        }
                        aliases.add(alias);
                    }
                }
            });
        }
        for (String canonical : forward.keySet()) {
            String owner = reverse.get(canonical);
            if (owner != null) {
                throw new InvalidConfigurationException("Token '" + canonical
                        + "' is both a canonical entry and an alias of '" + owner + "'");
            }
        }
        forward.replaceAll((k, v) -> Collections.unmodifiableSortedSet(v));
        this.aliasesByCanonical = Collections.unmodifiableMap(forward);
        this.canonicalByAlias = Collections.unmodifiableMap(reverse);
    }

    public static SynonymTable empty() {
        return new SynonymTable(Map.of());
    }

    /**
     * Canonical form for a normalized surface string, if the table knows it
     * either as a canonical entry or as an alias.
     */
    public Optional<String> canonicalOf(String normalized) {
        if (aliasesByCanonical.containsKey(normalized)) {
            return Optional.of(normalized);
        }
        return Optional.ofNullable(canonicalByAlias.get(normalized));
    }

    public SortedSet<String> aliasesOf(String canonical) {
        SortedSet<String> aliases = aliasesByCanonical.get(canonical);
        return aliases != null ? aliases : Collections.emptySortedSet();
    }

    public Map<String, SortedSet<String>> getAliasesByCanonical() {
        return aliasesByCanonical;
    }

    public Map<String, String> getCanonicalByAlias() {
        return canonicalByAlias;
    }

    public int size() {
        return aliasesByCanonical.size();
    }
}
