package me.golemcore.matching.infrastructure.config;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import me.golemcore.matching.domain.model.CategoryScore;
import me.golemcore.matching.domain.model.MatchResult;
import me.golemcore.matching.domain.model.ScoreCategory;
import me.golemcore.matching.domain.model.SectionResult;
import me.golemcore.matching.testsupport.TestConfigurations;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.EnumMap;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

class AutoConfigurationTest {

    @Test
    void shouldSerializeMatchResultWithIsoTimestamps() throws Exception {
        ObjectMapper mapper = AutoConfiguration.objectMapper();
        Map<ScoreCategory, CategoryScore> scores = new EnumMap<>(ScoreCategory.class);
        scores.put(ScoreCategory.REQUIRED, new CategoryScore(0.9, 0.6));
        MatchResult result = MatchResult.builder()
                .candidateId("c1")
                .positionId("p1")
                .overallScore(81.0)
                .grade("good")
                .categoryScores(scores)
                .required(SectionResult.builder().score(0.9).build())
                .calculatedAt(Instant.parse("2026-05-01T12:00:00Z"))
                .build();

        JsonNode json = mapper.readTree(mapper.writeValueAsString(result));

        assertEquals("2026-05-01T12:00:00Z", json.get("calculatedAt").asText());
        assertEquals(81.0, json.get("overallScore").asDouble());
        assertEquals(0.6, json.get("categoryScores").get("REQUIRED").get("weight").asDouble());
        assertEquals("0/0", json.get("required").get("matchRate").asText());
        assertFalse(json.get("required").has("unmatchedRatio"));
    }

    @Test
    void shouldLogStartupSummaryFromCurrentSnapshot() {
        MatchingConfigService configService = mock(MatchingConfigService.class);
        when(configService.current()).thenReturn(TestConfigurations.config());
        AutoConfiguration configuration = new AutoConfiguration(new MatchingProperties(), configService);

        assertDoesNotThrow(configuration::init);
        verify(configService).current();
    }

    @Test
    void shouldProvideUtcClock() {
        assertEquals("Z", AutoConfiguration.clock().getZone().getId());
    }
}
