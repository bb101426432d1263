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
import java.util.Locale;
import java.util.Set;
import java.util.SortedSet;
import java.util.TreeSet;
import java.util.regex.Pattern;

/**
 * Canonical skill identity plus the aliases accepted for it.
 *
 * <p>
 * Canonical identity is the case- and whitespace-normalized form produced by
 * {@link #normalize(String)}. Aliases are normalized the same way and kept
 * sorted so the token renders identically on every evaluation.
 *
 * @since 1.0
 */
public record SkillToken(String canonical, SortedSet<String> aliases) {

    public SkillToken {
        if (canonical == null || canonical.isBlank()) {
            throw new IllegalArgumentException("Skill token must not be blank");
        }
        canonical = normalize(canonical);
        SortedSet<String> normalized = new TreeSet<>();
        if (aliases != null) {
            for (String alias : aliases) {
                if (alias != null && !alias.isBlank()) {
                    normalized.add(normalize(alias));
                }
            }
        }
        normalized.remove(canonical);
        aliases = Collections.unmodifiableSortedSet(normalized);
    }

    public static SkillToken of(String canonical) {
        return new SkillToken(canonical, new TreeSet<>());
    }

    public static SkillToken of(String canonical, Set<String> aliases) {
        return new SkillToken(canonical, new TreeSet<>(aliases));
    }

    /**
     * All surface forms of this token: the canonical form followed by aliases.
     */
    public Set<String> surfaceForms() {
        SortedSet<String> forms = new TreeSet<>(aliases);
        forms.add(canonical);
        return Collections.unmodifiableSortedSet(forms);
    }

    /**
     * Lower-cases, trims and collapses inner whitespace.
     */
    public static String normalize(String raw) {
        if (raw == null) {
            return "";
        }
        return raw.trim().replaceAll("\\s+", " ").toLowerCase(Locale.ROOT);
    }

    /**
     * Case-sensitive pattern matching {@code form} as a whole word, so "java"
     * is not found inside "javascript". Callers lower-case the text first.
     */
    public static Pattern wordPattern(String form) {
        return Pattern.compile("(?<![\\p{L}\\p{N}])" + Pattern.quote(form) + "(?![\\p{L}\\p{N}])");
    }
}
