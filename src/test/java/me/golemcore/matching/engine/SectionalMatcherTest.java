package me.golemcore.matching.engine;

import me.golemcore.matching.domain.exception.DimensionMismatchException;
import me.golemcore.matching.domain.model.CandidateProfile;
import me.golemcore.matching.domain.model.CandidateSkill;
import me.golemcore.matching.domain.model.EmbeddingVector;
import me.golemcore.matching.domain.model.ItemMatch;
import me.golemcore.matching.domain.model.MatchType;
import me.golemcore.matching.domain.model.MatchingConfiguration;
import me.golemcore.matching.domain.model.ProfileSection;
import me.golemcore.matching.domain.model.ProfileSentence;
import me.golemcore.matching.domain.model.RequirementItem;
import me.golemcore.matching.domain.model.RequirementKind;
import me.golemcore.matching.domain.model.RequirementPriority;
import me.golemcore.matching.domain.model.SectionRequirement;
import me.golemcore.matching.domain.model.SectionResult;
import me.golemcore.matching.testsupport.TestConfigurations;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static me.golemcore.matching.testsupport.TestConfigurations.at;
import static me.golemcore.matching.testsupport.TestConfigurations.axis;
import static org.junit.jupiter.api.Assertions.*;

class SectionalMatcherTest {

    private SectionalMatcher matcher;
    private MatchingConfiguration config;

    @BeforeEach
    void setUp() {
        SynonymExpander expander = new SynonymExpander();
        matcher = new SectionalMatcher(new CosineSimilarity(), expander, new ThresholdResolver(expander),
                new TechnologyDetector());
        config = TestConfigurations.config();
    }

    // ===== Empty and missing sections =====

    @Test
    void shouldScoreEmptyRequirementAsPerfect() {
        SectionResult result = matcher.match(SectionRequirement.empty(RequirementPriority.PREFERRED),
                candidateWithSkills(CandidateSkill.of("java")), config);

        assertEquals(1.0, result.getScore());
        assertTrue(result.getItems().isEmpty());
        assertEquals(RequirementPriority.PREFERRED, result.getPriority());
        assertFalse(result.isCandidateSectionMissing());
    }

    @Test
    void shouldScoreEmptyRequirementAsPerfectForEmptyCandidate() {
        SectionResult result = matcher.match(SectionRequirement.empty(RequirementPriority.PREFERRED),
                CandidateProfile.builder().id("c1").build(), config);

        assertEquals(1.0, result.getScore());
    }

    @Test
    void shouldFlagMissingCandidateSection() {
        SectionRequirement required = required(RequirementItem.skill("Java", axis()));

        SectionResult result = matcher.match(required, CandidateProfile.builder().id("c1").build(), config);

        assertEquals(0.0, result.getScore());
        assertTrue(result.isCandidateSectionMissing());
        assertEquals(List.of("Java"), result.getMissing());
    }

    @Test
    void shouldFlagMissingSkillsForSkillRequirements() {
        CandidateProfile sentencesOnly = CandidateProfile.builder()
                .id("c1")
                .sentences(new ArrayList<>(List.of(sentence(0, "Built payment services in Java", axis()))))
                .build();

        SectionResult result = matcher.match(required(RequirementItem.skill("Java", axis())), sentencesOnly, config);

        assertEquals(0.0, result.getScore());
        assertTrue(result.isCandidateSectionMissing());
        assertEquals(SectionalMatcher.NO_CANDIDATE_SKILLS, result.getItems().get(0).getFailureReason());
    }

    @Test
    void shouldFlagMissingSentencesForSentenceRequirements() {
        RequirementItem item = RequirementItem.sentence("Five years building payment platforms", axis());

        SectionResult result = matcher.match(required(item), candidateWithSkills(CandidateSkill.of("java")),
                config);

        assertEquals(0.0, result.getScore());
        assertTrue(result.isCandidateSectionMissing());
        assertEquals(SectionalMatcher.NO_CANDIDATE_SENTENCES, result.getItems().get(0).getFailureReason());
    }

    @Test
    void shouldNotFlagSectionWhenOnlySomeItemsLackCandidateSection() {
        SectionRequirement mixed = required(
                RequirementItem.skill("Java", axis()),
                RequirementItem.sentence("Five years building payment platforms", axis()));

        SectionResult result = matcher.match(mixed, candidateWithSkills(CandidateSkill.of("java")), config);

        assertEquals(0.5, result.getScore());
        assertFalse(result.isCandidateSectionMissing());
    }

    @Test
    void shouldIgnoreSentencesWithoutVectorsWhenCheckingSection() {
        CandidateProfile unembedded = CandidateProfile.builder()
                .id("c1")
                .sentences(new ArrayList<>(List.of(sentence(0, "Built payment services in Java", null))))
                .build();
        RequirementItem item = RequirementItem.sentence("Five years building payment platforms", axis());

        SectionResult result = matcher.match(required(item), unembedded, config);

        assertTrue(result.isCandidateSectionMissing());
    }

    // ===== Skill items =====

    @Test
    void shouldMatchAliasLexically() {
        SectionResult result = matcher.match(required(RequirementItem.skill("Kubernetes", axis())),
                candidateWithSkills(CandidateSkill.of("k8s")), config);

        ItemMatch item = result.getItems().get(0);
        assertTrue(item.isMatched());
        assertEquals(MatchType.LEXICAL, item.getMatchType());
        assertEquals(1.0, item.getBestSimilarity());
        assertEquals("k8s", item.getMatchedCandidateItem());
        assertEquals(1.0, result.getScore());
    }

    @Test
    void shouldMatchSemanticallyAboveTokenThreshold() {
        CandidateSkill containers = CandidateSkill.builder().name("Containers").contextVector(at(0.75)).build();

        SectionResult result = matcher.match(required(RequirementItem.skill("Docker", axis())),
                candidateWithSkills(containers), config);

        ItemMatch item = result.getItems().get(0);
        assertTrue(item.isMatched());
        assertEquals(MatchType.SEMANTIC, item.getMatchType());
        assertEquals(0.75, item.getBestSimilarity(), 1e-6);
        assertEquals(0.7, item.getThresholdUsed());
        assertEquals("docker", item.getToken());
    }

    @Test
    void shouldReportNearMissJustBelowThreshold() {
        CandidateSkill containers = CandidateSkill.builder().name("Containers").contextVector(at(0.67)).build();

        SectionResult result = matcher.match(required(RequirementItem.skill("Docker", axis())),
                candidateWithSkills(containers), config);

        ItemMatch item = result.getItems().get(0);
        assertFalse(item.isMatched());
        assertTrue(item.isNearMiss());
        assertEquals(1, result.getNearMisses().size());
        assertEquals(0.0, result.getScore());
    }

    @Test
    void shouldNotReportNearMissFarBelowThreshold() {
        CandidateSkill containers = CandidateSkill.builder().name("Containers").contextVector(at(0.5)).build();

        ItemMatch item = matcher.match(required(RequirementItem.skill("Docker", axis())),
                candidateWithSkills(containers), config).getItems().get(0);

        assertFalse(item.isMatched());
        assertFalse(item.isNearMiss());
    }

    @Test
    void shouldVetoCrossGroupSemanticMatch() {
        CandidateSkill django = CandidateSkill.builder()
                .name("Django")
                .contextText("Web apps in Django")
                .contextVector(at(0.95))
                .build();

        ItemMatch item = matcher.match(required(RequirementItem.skill("Java", axis())),
                candidateWithSkills(django), config).getItems().get(0);

        assertFalse(item.isMatched());
        assertTrue(item.isVetoed());
        assertFalse(item.isNearMiss());
        assertEquals("jvm-stack", item.getConflictGroup());
        assertEquals(0.95, item.getBestSimilarity(), 1e-6);
    }

    @Test
    void shouldLiftVetoWhenCandidateTextMentionsRequiredToken() {
        CandidateSkill django = CandidateSkill.builder()
                .name("Django")
                .contextText("Django admin in front of Java microservices")
                .contextVector(at(0.95))
                .build();

        ItemMatch item = matcher.match(required(RequirementItem.skill("Java", axis())),
                candidateWithSkills(django), config).getItems().get(0);

        assertTrue(item.isMatched());
        assertFalse(item.isVetoed());
        assertEquals(MatchType.SEMANTIC, item.getMatchType());
    }

    @Test
    void shouldWeighCriticalRequiredItemsDouble() {
        RequirementItem java = RequirementItem.builder()
                .text("Java")
                .kind(RequirementKind.SKILL)
                .critical(true)
                .vector(axis())
                .build();
        RequirementItem docker = RequirementItem.skill("Docker", axis());

        SectionResult result = matcher.match(required(java, docker), candidateWithSkills(CandidateSkill.of("java")),
                config);

        assertEquals(2.0 / 3.0, result.getScore(), 1e-9);
        assertEquals("1/2", result.getMatchRate());
        assertFalse(result.hasCriticalMissing());
    }

    @Test
    void shouldReportCriticalMissing() {
        RequirementItem java = RequirementItem.builder()
                .text("Java")
                .kind(RequirementKind.SKILL)
                .critical(true)
                .vector(axis())
                .build();

        SectionResult result = matcher.match(required(java), candidateWithSkills(CandidateSkill.of("python")),
                config);

        assertTrue(result.hasCriticalMissing());
        assertEquals(0.0, result.getScore());
    }

    // ===== Sentence items =====

    @Test
    void shouldMatchSentenceAgainstBestCandidateSentence() {
        RequirementItem item = RequirementItem.sentence("Experience building microservices with Spring Boot",
                axis());
        CandidateProfile candidate = CandidateProfile.builder()
                .id("c1")
                .sentences(new ArrayList<>(List.of(
                        sentence(0, "Organised the yearly team offsite and budget", at(0.1)),
                        sentence(1, "Designed Spring Boot services for card payments", at(0.86)))))
                .build();

        ItemMatch match = matcher.match(required(item), candidate, config).getItems().get(0);

        assertTrue(match.isMatched());
        assertEquals(MatchType.SEMANTIC, match.getMatchType());
        assertEquals("experience#1", match.getMatchedCandidateItem());
        assertEquals("spring boot", match.getToken());
        assertEquals(0.8, match.getThresholdUsed());
    }

    @Test
    void shouldUseGlobalDefaultForSentenceWithoutTechnology() {
        RequirementItem item = RequirementItem.sentence("Comfortable mentoring junior engineers", axis());
        CandidateProfile candidate = CandidateProfile.builder()
                .id("c1")
                .sentences(new ArrayList<>(List.of(sentence(0, "Mentored four junior engineers to promotion",
                        at(0.62)))))
                .build();

        ItemMatch match = matcher.match(required(item), candidate, config).getItems().get(0);

        assertTrue(match.isMatched());
        assertEquals(0.6, match.getThresholdUsed());
        assertNull(match.getToken());
    }

    @Test
    void shouldVetoSentenceFromConflictingStack() {
        RequirementItem item = RequirementItem.sentence("Strong background in Java backend development", axis());
        CandidateProfile candidate = CandidateProfile.builder()
                .id("c1")
                .sentences(new ArrayList<>(List.of(sentence(0, "Wrote Python backends with Flask for years",
                        at(0.9)))))
                .build();

        ItemMatch match = matcher.match(required(item), candidate, config).getItems().get(0);

        assertFalse(match.isMatched());
        assertTrue(match.isVetoed());
    }

    // ===== Malformed input =====

    @Test
    void shouldDegradeBlankItemToUnmatched() {
        RequirementItem blank = RequirementItem.sentence("  ", axis());

        ItemMatch item = matcher.match(required(blank), candidateWithSkills(CandidateSkill.of("java")), config)
                .getItems().get(0);

        assertFalse(item.isMatched());
        assertEquals("blank item text", item.getFailureReason());
    }

    @Test
    void shouldDegradeSkillWithoutVectorToUnmatched() {
        ItemMatch item = matcher.match(required(RequirementItem.skill("Docker", null)),
                candidateWithSkills(CandidateSkill.of("java")), config).getItems().get(0);

        assertFalse(item.isMatched());
        assertEquals("missing context vector", item.getFailureReason());
    }

    @Test
    void shouldSkipMalformedCandidateSkills() {
        CandidateSkill broken = CandidateSkill.builder().name(" ").contextVector(at(0.99)).build();
        CandidateSkill noVector = CandidateSkill.of("Containers");

        ItemMatch item = matcher.match(required(RequirementItem.skill("Docker", axis())),
                candidateWithSkills(broken, noVector), config).getItems().get(0);

        assertFalse(item.isMatched());
        assertEquals("no comparable candidate skills", item.getFailureReason());
    }

    @Test
    void shouldPropagateDimensionMismatch() {
        CandidateSkill skill = CandidateSkill.builder()
                .name("Containers")
                .contextVector(EmbeddingVector.of(1.0, 0.0, 0.0))
                .build();

        assertThrows(DimensionMismatchException.class,
                () -> matcher.match(required(RequirementItem.skill("Docker", axis())), candidateWithSkills(skill),
                        config));
    }

    private static SectionRequirement required(RequirementItem... items) {
        return SectionRequirement.of(RequirementPriority.REQUIRED, List.of(items));
    }

    private static CandidateProfile candidateWithSkills(CandidateSkill... skills) {
        return CandidateProfile.builder().id("c1").skills(new ArrayList<>(List.of(skills))).build();
    }

    private static ProfileSentence sentence(int index, String text, EmbeddingVector vector) {
        return ProfileSentence.builder()
                .section(ProfileSection.EXPERIENCE)
                .index(index)
                .text(text)
                .vector(vector)
                .build();
    }
}
