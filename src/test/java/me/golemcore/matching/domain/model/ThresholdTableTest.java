package me.golemcore.matching.domain.model;

import me.golemcore.matching.domain.exception.InvalidConfigurationException;
import org.junit.jupiter.api.Test;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.TreeSet;

import static org.junit.jupiter.api.Assertions.*;

class ThresholdTableTest {

    @Test
    void shouldNormalizeExplicitEntries() {
        ThresholdTable table = new ThresholdTable(0.6, Map.of("  Spring   Boot ", 0.82), Map.of());

        assertEquals(Optional.of(0.82), table.explicitThreshold("spring boot"));
        assertTrue(table.explicitThreshold("Spring Boot").isEmpty());
    }

    @Test
    void shouldIndexGroupMembership() {
        Map<String, ConflictGroup> groups = new LinkedHashMap<>();
        groups.put("jvm", new ConflictGroup("jvm", new TreeSet<>(List.of("Java", "Kotlin")), 0.8));

        ThresholdTable table = new ThresholdTable(0.6, Map.of("docker", 0.7), groups);

        assertEquals("jvm", table.groupOf("kotlin").orElseThrow().name());
        assertTrue(table.groupOf("docker").isEmpty());
        assertEquals(List.of("docker", "java", "kotlin"), List.copyOf(table.knownTokens()));
    }

    @Test
    void shouldRejectTokenInTwoGroups() {
        Map<String, ConflictGroup> groups = new LinkedHashMap<>();
        groups.put("jvm", new ConflictGroup("jvm", new TreeSet<>(List.of("java", "scala")), null));
        groups.put("functional", new ConflictGroup("functional", new TreeSet<>(List.of("scala", "haskell")), null));

        InvalidConfigurationException ex = assertThrows(InvalidConfigurationException.class,
                () -> new ThresholdTable(0.6, Map.of(), groups));
        assertTrue(ex.getMessage().contains("scala"));
    }

    @Test
    void shouldRejectThresholdOutsideUnitRange() {
        assertThrows(InvalidConfigurationException.class, () -> new ThresholdTable(1.1, Map.of(), Map.of()));
        assertThrows(InvalidConfigurationException.class,
                () -> new ThresholdTable(0.6, Map.of("java", -0.1), Map.of()));
        Map<String, ConflictGroup> groups = Map.of("jvm",
                new ConflictGroup("jvm", new TreeSet<>(List.of("java")), 2.0));
        assertThrows(InvalidConfigurationException.class, () -> new ThresholdTable(0.6, Map.of(), groups));
    }

    @Test
    void shouldRejectMissingEntryValue() {
        Map<String, Double> entries = new LinkedHashMap<>();
        entries.put("java", null);

        assertThrows(InvalidConfigurationException.class, () -> new ThresholdTable(0.6, entries, Map.of()));
    }
}
