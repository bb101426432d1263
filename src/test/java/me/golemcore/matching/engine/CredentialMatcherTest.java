package me.golemcore.matching.engine;

import me.golemcore.matching.domain.model.CandidateProfile;
import me.golemcore.matching.domain.model.EducationLevel;
import me.golemcore.matching.domain.model.PositionProfile;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.LinkedHashSet;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class CredentialMatcherTest {

    private CredentialMatcher matcher;

    @BeforeEach
    void setUp() {
        matcher = new CredentialMatcher();
    }

    // ===== Education =====

    @Test
    void shouldScoreFullWithoutEducationRequirement() {
        assertEquals(1.0, matcher.educationScore(position(null), candidate(null)));
    }

    @Test
    void shouldScoreFullWhenEducationMetOrExceeded() {
        assertEquals(1.0, matcher.educationScore(position(EducationLevel.BACHELOR), candidate(EducationLevel.MASTER)));
        assertEquals(1.0,
                matcher.educationScore(position(EducationLevel.BACHELOR), candidate(EducationLevel.BACHELOR)));
    }

    @Test
    void shouldScorePartialBelowRequiredEducation() {
        double score = matcher.educationScore(position(EducationLevel.MASTER), candidate(EducationLevel.BACHELOR));

        assertEquals(3.0 / 4.0, score, 1e-9);
    }

    @Test
    void shouldScoreZeroForUnknownEducation() {
        assertEquals(0.0, matcher.educationScore(position(EducationLevel.BACHELOR), candidate(null)));
    }

    // ===== Certifications =====

    @Test
    void shouldScoreFullWithoutCertificationRequirement() {
        assertEquals(1.0, matcher.certificationScore(position(null), candidate(null)));
    }

    @Test
    void shouldScoreShareOfHeldCertifications() {
        PositionProfile position = position(null);
        position.setRequiredCertifications(new LinkedHashSet<>(List.of("AWS Solutions Architect", "CKA")));
        CandidateProfile candidate = candidate(null);
        candidate.setCertifications(new LinkedHashSet<>(List.of("cka", "PMP")));

        assertEquals(0.5, matcher.certificationScore(position, candidate), 1e-9);
    }

    private static PositionProfile position(EducationLevel required) {
        return PositionProfile.builder().id("p1").requiredEducation(required).build();
    }

    private static CandidateProfile candidate(EducationLevel level) {
        return CandidateProfile.builder().id("c1").educationLevel(level).build();
    }
}
