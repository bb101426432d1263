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

import me.golemcore.matching.domain.model.CandidateProfile;
import me.golemcore.matching.domain.model.CandidateSkill;
import me.golemcore.matching.domain.model.ItemMatch;
import me.golemcore.matching.domain.model.MatchType;
import me.golemcore.matching.domain.model.MatchingConfiguration;
import me.golemcore.matching.domain.model.ProfileSentence;
import me.golemcore.matching.domain.model.RequirementItem;
import me.golemcore.matching.domain.model.RequirementKind;
import me.golemcore.matching.domain.model.RequirementPriority;
import me.golemcore.matching.domain.model.SectionRequirement;
import me.golemcore.matching.domain.model.SectionResult;
import me.golemcore.matching.domain.model.SkillToken;
import me.golemcore.matching.domain.model.TokenPolicy;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.Optional;

/**
 * Matches the items of one requirement section against a candidate's skills
 * and sentences.
 *
 * <p>
 * Matching per item:
 * <ol>
 * <li><b>SKILL</b> - canonical or alias equality with any candidate skill is a
 * lexical match. Otherwise the item's context vector is compared with every
 * candidate skill's context vector and the best similarity must reach the
 * token threshold without being vetoed.</li>
 * <li><b>SENTENCE</b> - the item vector is compared with every candidate
 * sentence. The threshold is that of the dominant technology in the item text
 * (global default when there is none).</li>
 * </ol>
 *
 * <p>
 * Section score is the matched share of item weight. Critical required items
 * weigh {@code criticalWeight}, everything else 1.0. An empty section scores
 * 1.0.
 *
 * <p>
 * A skill item against a candidate without skills, or a sentence item
 * against a candidate without embedded sentences, is unmatched. When every
 * item fails that way the candidate section counts as missing.
 *
 * <p>
 * Malformed items degrade to unmatched with a failure reason. A dimension
 * mismatch is not a malformed item: it propagates so the caller can abort the
 * evaluation.
 *
 * @since 1.0
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class SectionalMatcher {

    static final String NO_CANDIDATE_SKILLS = "candidate has no skills";
    static final String NO_CANDIDATE_SENTENCES = "candidate has no sentences";

    private final CosineSimilarity cosineSimilarity;
    private final SynonymExpander synonymExpander;
    private final ThresholdResolver thresholdResolver;
    private final TechnologyDetector technologyDetector;

    public SectionResult match(SectionRequirement requirement, CandidateProfile candidate,
            MatchingConfiguration config) {
        Objects.requireNonNull(candidate, "candidate must not be null");
        Objects.requireNonNull(config, "config must not be null");

        RequirementPriority priority = requirement != null && requirement.getPriority() != null
                ? requirement.getPriority()
                : RequirementPriority.REQUIRED;

        if (requirement == null || requirement.isEmpty()) {
            return SectionResult.builder().priority(priority).score(1.0).build();
        }

        List<RequirementItem> items = requirement.getItems();
        List<ItemMatch> matches = new ArrayList<>(items.size());
        boolean hasSkills = candidate.getSkills().stream()
                .anyMatch(skill -> skill != null && skill.getName() != null && !skill.getName().isBlank());
        boolean hasSentences = candidate.getSentences().stream()
                .anyMatch(sentence -> sentence != null && sentence.getVector() != null);

        for (int i = 0; i < items.size(); i++) {
            RequirementItem item = items.get(i);
            String itemId = itemId(item, priority, i);
            double weight = weightOf(item, priority, config);
            boolean wellFormed = item != null && item.getText() != null && !item.getText().isBlank();

            if (wellFormed && kindOf(item) == RequirementKind.SKILL && !hasSkills) {
                matches.add(ItemMatch.unmatched(itemId, item.getText(), RequirementKind.SKILL, item.isCritical(),
                        weight, NO_CANDIDATE_SKILLS));
                continue;
            }
            if (wellFormed && kindOf(item) == RequirementKind.SENTENCE && !hasSentences) {
                matches.add(ItemMatch.unmatched(itemId, item.getText(), RequirementKind.SENTENCE,
                        item.isCritical(), weight, NO_CANDIDATE_SENTENCES));
                continue;
            }

            ItemMatch match = matchItem(item, itemId, weight, candidate, config);
            log.debug("[SectionalMatcher] {} '{}': matched={} type={} best={} threshold={}{}",
                    priority, match.getText(), match.isMatched(), match.getMatchType(),
                    String.format("%.3f", match.getBestSimilarity()),
                    String.format("%.2f", match.getThresholdUsed()),
                    match.getFailureReason() != null ? " reason=" + match.getFailureReason() : "");
            matches.add(match);
        }

        // the candidate lacks the section when every item failed for want of it
        boolean sectionMissing = matches.stream().allMatch(m -> NO_CANDIDATE_SKILLS.equals(m.getFailureReason())
                || NO_CANDIDATE_SENTENCES.equals(m.getFailureReason()));

        double totalWeight = matches.stream().mapToDouble(ItemMatch::getWeight).sum();
        double matchedWeight = matches.stream().filter(ItemMatch::isMatched).mapToDouble(ItemMatch::getWeight).sum();
        double score = totalWeight > 0 ? matchedWeight / totalWeight : 0.0;

        SectionResult result = SectionResult.builder()
                .priority(priority)
                .score(score)
                .items(matches)
                .candidateSectionMissing(sectionMissing)
                .build();
        log.debug("[SectionalMatcher] {} section: {} matched, score {}", priority, result.getMatchRate(),
                String.format("%.3f", result.getScore()));
        return result;
    }

    private ItemMatch matchItem(RequirementItem item, String itemId, double weight, CandidateProfile candidate,
            MatchingConfiguration config) {
        if (item == null) {
            return ItemMatch.unmatched(itemId, null, null, false, weight, "item is null");
        }
        if (item.getText() == null || item.getText().isBlank()) {
            return ItemMatch.unmatched(itemId, item.getText(), kindOf(item), item.isCritical(), weight,
                    "blank item text");
        }
        if (kindOf(item) == RequirementKind.SKILL) {
            return matchSkill(item, itemId, weight, candidate, config);
        }
        return matchSentence(item, itemId, weight, candidate, config);
    }

    private ItemMatch matchSkill(RequirementItem item, String itemId, double weight, CandidateProfile candidate,
            MatchingConfiguration config) {
        SkillToken token = synonymExpander.expand(item.getText(), config.getSynonyms());
        TokenPolicy policy = thresholdResolver.resolve(token.canonical(), config.getThresholds());

        ItemMatch.ItemMatchBuilder builder = ItemMatch.builder()
                .itemId(itemId)
                .text(item.getText())
                .kind(RequirementKind.SKILL)
                .critical(item.isCritical())
                .weight(weight)
                .token(token.canonical())
                .conflictGroup(policy.conflictGroup())
                .thresholdUsed(policy.threshold());

        for (CandidateSkill skill : candidate.getSkills()) {
            if (skill == null || skill.getName() == null || skill.getName().isBlank()) {
                continue;
            }
            SkillToken offered = synonymExpander.expand(skill.getName(), config.getSynonyms());
            if (synonymExpander.matchesLexically(token, offered)) {
                return builder.matched(true)
                        .matchType(MatchType.LEXICAL)
                        .bestSimilarity(1.0)
                        .matchedCandidateItem(skill.getName())
                        .build();
            }
        }

        if (item.getVector() == null) {
            return builder.failureReason("missing context vector").build();
        }

        CandidateSkill best = null;
        SkillToken bestToken = null;
        double bestSimilarity = Double.NEGATIVE_INFINITY;
        int skipped = 0;
        for (CandidateSkill skill : candidate.getSkills()) {
            if (skill == null || skill.getName() == null || skill.getName().isBlank()
                    || skill.getContextVector() == null) {
                skipped++;
                continue;
            }
            double similarity = cosineSimilarity.similarity(item.getVector(), skill.getContextVector());
            if (similarity > bestSimilarity) {
                bestSimilarity = similarity;
                best = skill;
                bestToken = synonymExpander.expand(skill.getName(), config.getSynonyms());
            }
        }
        if (skipped > 0) {
            log.debug("[SectionalMatcher] Skipped {} malformed candidate skill(s)", skipped);
        }
        if (best == null) {
            return builder.failureReason("no comparable candidate skills").build();
        }

        String candidateText = best.getContextText() != null
                ? best.getName() + " " + best.getContextText()
                : best.getName();
        return decide(builder, policy, token, bestSimilarity, best.getName(),
                Optional.of(bestToken.canonical()), candidateText, config);
    }

    private ItemMatch matchSentence(RequirementItem item, String itemId, double weight, CandidateProfile candidate,
            MatchingConfiguration config) {
        Optional<String> dominant = technologyDetector.dominantToken(item.getText(), config);
        TokenPolicy policy = dominant
                .map(token -> thresholdResolver.resolve(token, config.getThresholds()))
                .orElseGet(() -> thresholdResolver.globalDefault(config.getThresholds()));
        SkillToken token = dominant.map(t -> synonymExpander.expand(t, config.getSynonyms())).orElse(null);

        ItemMatch.ItemMatchBuilder builder = ItemMatch.builder()
                .itemId(itemId)
                .text(item.getText())
                .kind(RequirementKind.SENTENCE)
                .critical(item.isCritical())
                .weight(weight)
                .token(token != null ? token.canonical() : null)
                .conflictGroup(policy.conflictGroup())
                .thresholdUsed(policy.threshold());

        if (item.getVector() == null) {
            return builder.failureReason("missing item vector").build();
        }

        ProfileSentence best = null;
        double bestSimilarity = Double.NEGATIVE_INFINITY;
        for (ProfileSentence sentence : candidate.getSentences()) {
            if (sentence == null || sentence.getVector() == null) {
                continue;
            }
            double similarity = cosineSimilarity.similarity(item.getVector(), sentence.getVector());
            if (similarity > bestSimilarity) {
                bestSimilarity = similarity;
                best = sentence;
            }
        }
        if (best == null) {
            return builder.failureReason("no comparable candidate sentences").build();
        }

        Optional<String> candidateDominant = technologyDetector.dominantToken(best.getText(), config);
        return decide(builder, policy, token, bestSimilarity, best.id(), candidateDominant, best.getText(), config);
    }

    private ItemMatch decide(ItemMatch.ItemMatchBuilder builder, TokenPolicy policy, SkillToken token,
            double bestSimilarity, String candidateItem, Optional<String> candidateDominant, String candidateText,
            MatchingConfiguration config) {
        builder.bestSimilarity(bestSimilarity).matchedCandidateItem(candidateItem);

        if (bestSimilarity >= policy.threshold()) {
            if (thresholdResolver.isVetoed(policy, token, candidateDominant, candidateText,
                    config.getThresholds())) {
                return builder.vetoed(true).failureReason("conflict group veto").build();
            }
            return builder.matched(true).matchType(MatchType.SEMANTIC).build();
        }

        boolean nearMiss = bestSimilarity >= policy.threshold() - config.getTuning().getNearMissMargin();
        return builder.nearMiss(nearMiss).build();
    }

    private double weightOf(RequirementItem item, RequirementPriority priority, MatchingConfiguration config) {
        if (item != null && item.isCritical() && priority == RequirementPriority.REQUIRED) {
            return config.getTuning().getCriticalWeight();
        }
        return 1.0;
    }

    private static String itemId(RequirementItem item, RequirementPriority priority, int index) {
        if (item != null && item.getId() != null && !item.getId().isBlank()) {
            return item.getId();
        }
        return priority.name().toLowerCase(Locale.ROOT) + "#" + index;
    }

    private static RequirementKind kindOf(RequirementItem item) {
        if (item == null) {
            return null;
        }
        return item.getKind() != null ? item.getKind() : RequirementKind.SENTENCE;
    }
}
