package me.golemcore.matching.engine;

import me.golemcore.matching.domain.model.GradeThresholds;
import me.golemcore.matching.testsupport.TestConfigurations;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class GradeClassifierTest {

    private GradeClassifier classifier;
    private GradeThresholds grades;

    @BeforeEach
    void setUp() {
        classifier = new GradeClassifier();
        grades = TestConfigurations.grades();
    }

    @Test
    void shouldIncludeLowerBoundOfBand() {
        assertEquals("excellent", classifier.classify(85.0, grades));
        assertEquals("good", classifier.classify(70.0, grades));
        assertEquals("fair", classifier.classify(55.0, grades));
        assertEquals("caution", classifier.classify(40.0, grades));
    }

    @Test
    void shouldFallIntoLowerBandJustBelowBoundary() {
        assertEquals("good", classifier.classify(84.9, grades));
        assertEquals("fair", classifier.classify(69.9, grades));
        assertEquals("poor", classifier.classify(39.9, grades));
    }

    @Test
    void shouldCoverWholeRange() {
        assertEquals("excellent", classifier.classify(100.0, grades));
        assertEquals("good", classifier.classify(81.0, grades));
        assertEquals("poor", classifier.classify(0.0, grades));
    }
}
