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

import java.util.Collections;
import java.util.SortedSet;
import java.util.TreeSet;

/**
 * Named set of technologies treated as mutually exclusive for match-veto
 * purposes (for example a JVM stack against a Python stack).
 *
 * @param name
 *            group name
 * @param tokens
 *            canonical member tokens
 * @param defaultThreshold
 *            threshold for members without an explicit entry, or null to fall
 *            through to the global default
 * @since 1.0
 */
public record ConflictGroup(String name, SortedSet<String> tokens, Double defaultThreshold) {

    public ConflictGroup {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("Conflict group name must not be blank");
        }
        SortedSet<String> normalized = new TreeSet<>();
        if (tokens != null) {
            for (String token : tokens) {
                if (token != null && !token.isBlank()) {
                    normalized.add(SkillToken.normalize(token));
                }
            }
        }
        tokens = Collections.unmodifiableSortedSet(normalized);
    }

    public boolean contains(String canonicalToken) {
        return tokens.contains(canonicalToken);
    }
}
