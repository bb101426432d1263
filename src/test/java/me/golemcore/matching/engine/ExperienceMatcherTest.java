package me.golemcore.matching.engine;

import me.golemcore.matching.domain.model.CandidateProfile;
import me.golemcore.matching.domain.model.ExperienceLevel;
import me.golemcore.matching.domain.model.ExperienceResult;
import me.golemcore.matching.domain.model.MatcherTuning;
import me.golemcore.matching.domain.model.MismatchFlag;
import me.golemcore.matching.domain.model.PositionProfile;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import static me.golemcore.matching.testsupport.TestConfigurations.at;
import static me.golemcore.matching.testsupport.TestConfigurations.axis;
import static org.junit.jupiter.api.Assertions.*;

class ExperienceMatcherTest {

    private ExperienceMatcher matcher;
    private MatcherTuning tuning;

    @BeforeEach
    void setUp() {
        matcher = new ExperienceMatcher(new CosineSimilarity());
        tuning = MatcherTuning.builder().build();
    }

    // ===== Years =====

    @Test
    void shouldScoreFullFitWhenRequirementMet() {
        ExperienceResult result = matcher.match(position(3.0, null, ExperienceLevel.MID), candidate(5.0, null),
                tuning);

        assertEquals(1.0, result.getScore());
        assertTrue(result.getFlags().isEmpty());
        assertEquals(ExperienceLevel.MID, result.getCandidateLevel());
        assertTrue(result.isCandidateLevelDerived());
    }

    @Test
    void shouldReduceScoreByShortfallRatio() {
        ExperienceResult result = matcher.match(position(5.0, null, null), candidate(4.0, null), tuning);

        assertEquals(0.8, result.getScore(), 1e-9);
        assertFalse(result.hasFlag(MismatchFlag.SIGNIFICANTLY_LACKING));
    }

    @Test
    void shouldFlagSignificantlyLackingBelowSeventyPercent() {
        ExperienceResult result = matcher.match(position(10.0, null, null), candidate(5.0, null), tuning);

        assertEquals(0.5, result.getScore(), 1e-9);
        assertTrue(result.hasFlag(MismatchFlag.SIGNIFICANTLY_LACKING));
    }

    @Test
    void shouldNotFlagExactlySeventyPercent() {
        ExperienceResult result = matcher.match(position(10.0, null, null), candidate(7.0, null), tuning);

        assertFalse(result.hasFlag(MismatchFlag.SIGNIFICANTLY_LACKING));
    }

    @Test
    void shouldTreatMissingYearsAsZero() {
        ExperienceResult result = matcher.match(position(3.0, null, null), candidate(null, null), tuning);

        assertEquals(0.0, result.getScore());
        assertTrue(result.hasFlag(MismatchFlag.SIGNIFICANTLY_LACKING));
        assertEquals(ExperienceLevel.JUNIOR, result.getCandidateLevel());
    }

    @Test
    void shouldNeverPenalizeYearsAboveMaximum() {
        ExperienceResult result = matcher.match(position(2.0, 5.0, null), candidate(12.0, null), tuning);

        assertEquals(1.0, result.getScore());
        assertTrue(result.getFlags().isEmpty());
    }

    // ===== Levels =====

    @Test
    void shouldFlagLevelMismatchTwoTiersApart() {
        ExperienceResult result = matcher.match(position(null, null, ExperienceLevel.SENIOR),
                candidate(8.0, ExperienceLevel.JUNIOR), tuning);

        assertEquals(0.75, result.getScore(), 1e-9);
        assertTrue(result.hasFlag(MismatchFlag.LEVEL_MISMATCH));
        assertFalse(result.isCandidateLevelDerived());
    }

    @Test
    void shouldAcceptAdjacentTier() {
        ExperienceResult result = matcher.match(position(null, null, ExperienceLevel.SENIOR),
                candidate(5.0, ExperienceLevel.MID), tuning);

        assertFalse(result.hasFlag(MismatchFlag.LEVEL_MISMATCH));
        assertEquals(1.0, result.getScore());
    }

    @Test
    void shouldDeriveCandidateLevelFromYears() {
        ExperienceResult result = matcher.match(position(null, null, ExperienceLevel.JUNIOR), candidate(8.0, null),
                tuning);

        assertEquals(ExperienceLevel.SENIOR, result.getCandidateLevel());
        assertTrue(result.hasFlag(MismatchFlag.LEVEL_MISMATCH));
    }

    @Test
    void shouldCombineBothReductionsAndFloorAtZero() {
        ExperienceResult result = matcher.match(position(10.0, null, ExperienceLevel.SENIOR),
                candidate(1.0, null), tuning);

        assertEquals(0.0, result.getScore(), 1e-9);
        assertTrue(result.hasFlag(MismatchFlag.LEVEL_MISMATCH));
        assertTrue(result.hasFlag(MismatchFlag.SIGNIFICANTLY_LACKING));
    }

    // ===== Narrative =====

    @Test
    void shouldReportNarrativeWithoutChangingScoreByDefault() {
        PositionProfile position = position(3.0, null, null);
        position.setDescriptionVector(axis());
        CandidateProfile candidate = candidate(5.0, null);
        candidate.setExperienceVector(at(0.8));
        candidate.setProjectsVector(at(0.5));

        ExperienceResult result = matcher.match(position, candidate, tuning);

        assertEquals(0.71, result.getNarrativeSimilarity(), 1e-6);
        assertEquals(1.0, result.getScore());
    }

    @Test
    void shouldBlendNarrativeWhenConfigured() {
        PositionProfile position = position(3.0, null, null);
        position.setDescriptionVector(axis());
        CandidateProfile candidate = candidate(5.0, null);
        candidate.setExperienceVector(at(0.8));
        candidate.setProjectsVector(at(0.5));

        ExperienceResult result = matcher.match(position, candidate,
                MatcherTuning.builder().narrativeBlend(0.5).build());

        assertEquals(0.855, result.getScore(), 1e-6);
        assertEquals(1.0, result.getFitScore());
    }

    @Test
    void shouldUseSingleNarrativeVectorWhenOtherMissing() {
        PositionProfile position = position(null, null, null);
        position.setDescriptionVector(axis());
        CandidateProfile candidate = candidate(5.0, null);
        candidate.setProjectsVector(at(0.4));

        assertEquals(0.4, matcher.match(position, candidate, tuning).getNarrativeSimilarity(), 1e-6);
    }

    @Test
    void shouldLeaveNarrativeEmptyWithoutDescription() {
        assertNull(matcher.match(position(3.0, null, null), candidate(5.0, null), tuning).getNarrativeSimilarity());
    }

    private static PositionProfile position(Double min, Double max, ExperienceLevel level) {
        return PositionProfile.builder()
                .id("p1")
                .minExperienceYears(min)
                .maxExperienceYears(max)
                .experienceLevel(level)
                .build();
    }

    private static CandidateProfile candidate(Double years, ExperienceLevel level) {
        return CandidateProfile.builder()
                .id("c1")
                .experienceYears(years)
                .experienceLevel(level)
                .build();
    }
}
