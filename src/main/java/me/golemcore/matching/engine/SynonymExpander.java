package me.golemcore.matching.engine;

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

import me.golemcore.matching.domain.model.SkillToken;
import me.golemcore.matching.domain.model.SynonymTable;
import org.springframework.stereotype.Component;

import java.util.Locale;
import java.util.Objects;

/**
 * Maps raw skill strings onto canonical {@link SkillToken}s using the synonym
 * table of the active configuration.
 *
 * <p>
 * Lookups are case-insensitive and accept an alias as input. Unknown strings
 * pass through as their own canonical form without aliases.
 *
 * <p>
 * Stateless. Word-boundary patterns for {@link #mentions(String, SkillToken)}
 * are compiled per call since required tokens come from free text.
 *
 * @since 1.0
 */
@Component
public class SynonymExpander {

    /**
     * Resolves {@code raw} to its canonical token.
     *
     * @throws IllegalArgumentException
     *             if {@code raw} is null or blank
     */
    public SkillToken expand(String raw, SynonymTable synonyms) {
        if (raw == null || raw.isBlank()) {
            throw new IllegalArgumentException("Skill must not be blank");
        }
        Objects.requireNonNull(synonyms, "synonyms must not be null");

        String normalized = SkillToken.normalize(raw);
        String canonical = synonyms.canonicalOf(normalized).orElse(normalized);
        return new SkillToken(canonical, synonyms.aliasesOf(canonical));
    }

    /**
     * True when both tokens share a canonical form or one is a declared alias of
     * the other.
     */
    public boolean matchesLexically(SkillToken a, SkillToken b) {
        if (a.canonical().equals(b.canonical())) {
            return true;
        }
        return a.aliases().contains(b.canonical()) || b.aliases().contains(a.canonical());
    }

    /**
     * True when the canonical form or any alias of {@code token} occurs in
     * {@code text} as a whole word.
     */
    public boolean mentions(String text, SkillToken token) {
        if (text == null || text.isBlank()) {
            return false;
        }
        String haystack = text.toLowerCase(Locale.ROOT);
        for (String form : token.surfaceForms()) {
            if (haystack.contains(form) && SkillToken.wordPattern(form).matcher(haystack).find()) {
                return true;
            }
        }
        return false;
    }
}
