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

import me.golemcore.matching.domain.model.ConflictGroup;
import me.golemcore.matching.domain.model.SkillToken;
import me.golemcore.matching.domain.model.ThresholdTable;
import me.golemcore.matching.domain.model.TokenPolicy;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.Optional;

/**
 * Resolves per-token similarity thresholds and applies the conflict-group
 * veto.
 *
 * <p>
 * Resolution order is explicit entry, then the default of the token's conflict
 * group, then the global default.
 *
 * <p>
 * The veto rejects a semantic match between a required token and a candidate
 * item whose dominant token belongs to a different conflict group (say, a
 * Python framework offered for a Java requirement), unless the required token
 * or one of its aliases also appears in the candidate item text.
 *
 * @since 1.0
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class ThresholdResolver {

    private final SynonymExpander synonymExpander;

    public TokenPolicy resolve(String canonicalToken, ThresholdTable table) {
        if (canonicalToken == null || canonicalToken.isBlank()) {
            return globalDefault(table);
        }
        String token = SkillToken.normalize(canonicalToken);
        Optional<ConflictGroup> group = table.groupOf(token);
        String groupName = group.map(ConflictGroup::name).orElse(null);

        Optional<Double> explicit = table.explicitThreshold(token);
        if (explicit.isPresent()) {
            return new TokenPolicy(token, explicit.get(), groupName, TokenPolicy.Source.EXPLICIT);
        }
        if (group.isPresent() && group.get().defaultThreshold() != null) {
            return new TokenPolicy(token, group.get().defaultThreshold(), groupName,
                    TokenPolicy.Source.GROUP_DEFAULT);
        }
        return new TokenPolicy(token, table.getDefaultThreshold(), groupName, TokenPolicy.Source.GLOBAL_DEFAULT);
    }

    /**
     * Policy used when no technology token can be identified.
     */
    public TokenPolicy globalDefault(ThresholdTable table) {
        return new TokenPolicy(null, table.getDefaultThreshold(), null, TokenPolicy.Source.GLOBAL_DEFAULT);
    }

    /**
     * Decides whether a match that cleared the threshold must be rejected.
     *
     * @param required
     *            resolved policy of the required token
     * @param requiredToken
     *            required token with aliases, used for the lexical override
     * @param candidateDominantToken
     *            canonical dominant token of the candidate item, if any
     * @param candidateText
     *            text of the candidate item
     * @param table
     *            threshold table holding the conflict groups
     */
    public boolean isVetoed(TokenPolicy required, SkillToken requiredToken, Optional<String> candidateDominantToken,
            String candidateText, ThresholdTable table) {
        if (required.conflictGroup() == null || candidateDominantToken.isEmpty()) {
            return false;
        }
        Optional<ConflictGroup> candidateGroup = table.groupOf(candidateDominantToken.get());
        if (candidateGroup.isEmpty() || candidateGroup.get().name().equals(required.conflictGroup())) {
            return false;
        }
        if (requiredToken != null && synonymExpander.mentions(candidateText, requiredToken)) {
            log.debug("[ThresholdResolver] Conflict {} vs {} overridden by lexical mention of '{}'",
                    required.conflictGroup(), candidateGroup.get().name(), requiredToken.canonical());
            return false;
        }
        log.debug("[ThresholdResolver] Veto: '{}' ({}) vs candidate token '{}' ({})",
                required.token(), required.conflictGroup(), candidateDominantToken.get(),
                candidateGroup.get().name());
        return true;
    }
}
