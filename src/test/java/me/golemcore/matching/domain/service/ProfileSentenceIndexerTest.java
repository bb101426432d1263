package me.golemcore.matching.domain.service;

import me.golemcore.matching.domain.model.EmbeddingVector;
import me.golemcore.matching.domain.model.ProfileSection;
import me.golemcore.matching.domain.model.ProfileSentence;
import me.golemcore.matching.domain.model.RequirementItem;
import me.golemcore.matching.domain.model.RequirementKind;
import me.golemcore.matching.domain.model.RequirementPriority;
import me.golemcore.matching.domain.model.SectionRequirement;
import me.golemcore.matching.port.outbound.EmbeddingPort;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

class ProfileSentenceIndexerTest {

    private static final String FIRST = "Built payment services in Java.";
    private static final String SECOND = "Migrated them to Kubernetes clusters.";

    private EmbeddingPort embeddingPort;
    private ProfileSentenceIndexer indexer;

    @BeforeEach
    void setUp() {
        embeddingPort = mock(EmbeddingPort.class);
        indexer = new ProfileSentenceIndexer(new SentenceSplitter(), embeddingPort);
    }

    @Test
    void shouldEmbedSentencesInOneBatch() {
        when(embeddingPort.embedBatch(List.of(FIRST, SECOND))).thenReturn(CompletableFuture.completedFuture(
                List.of(new float[] { 1f, 0f }, new float[] { 0f, 1f })));

        List<ProfileSentence> sentences = indexer.index(ProfileSection.EXPERIENCE, FIRST + " " + SECOND);

        assertEquals(2, sentences.size());
        assertEquals("experience#0", sentences.get(0).id());
        assertEquals(SECOND, sentences.get(1).getText());
        assertEquals(EmbeddingVector.of(0f, 1f), sentences.get(1).getVector());
        verify(embeddingPort, never()).embed(any());
    }

    @Test
    void shouldFallBackToSingleEmbeddingsWhenBatchFails() {
        when(embeddingPort.embedBatch(anyList()))
                .thenReturn(CompletableFuture.failedFuture(new IllegalStateException("rate limited")));
        when(embeddingPort.embed(FIRST)).thenReturn(CompletableFuture.completedFuture(new float[] { 1f, 0f }));
        when(embeddingPort.embed(SECOND)).thenReturn(CompletableFuture.completedFuture(new float[] { 0f, 1f }));

        List<ProfileSentence> sentences = indexer.index(ProfileSection.PROJECTS, FIRST + " " + SECOND);

        assertEquals(2, sentences.size());
        assertEquals("projects#1", sentences.get(1).id());
    }

    @Test
    void shouldSkipSentenceThatCannotBeEmbedded() {
        when(embeddingPort.embedBatch(anyList()))
                .thenReturn(CompletableFuture.failedFuture(new IllegalStateException("unavailable")));
        when(embeddingPort.embed(FIRST))
                .thenReturn(CompletableFuture.failedFuture(new IllegalStateException("timeout")));
        when(embeddingPort.embed(SECOND)).thenReturn(CompletableFuture.completedFuture(new float[] { 0f, 1f }));

        List<ProfileSentence> sentences = indexer.index(ProfileSection.EXPERIENCE, FIRST + " " + SECOND);

        assertEquals(1, sentences.size());
        assertEquals(1, sentences.get(0).getIndex());
        assertEquals(SECOND, sentences.get(0).getText());
    }

    @Test
    void shouldFallBackWhenBatchSizeDiffers() {
        when(embeddingPort.embedBatch(anyList()))
                .thenReturn(CompletableFuture.completedFuture(List.of(new float[] { 1f, 0f })));
        when(embeddingPort.embed(any())).thenReturn(CompletableFuture.completedFuture(new float[] { 0.5f, 0.5f }));

        List<ProfileSentence> sentences = indexer.index(ProfileSection.SKILLS, FIRST + " " + SECOND);

        assertEquals(2, sentences.size());
        verify(embeddingPort, times(2)).embed(any());
    }

    @Test
    void shouldIndexSectionsInMapOrder() {
        when(embeddingPort.embedBatch(eq(List.of(FIRST))))
                .thenReturn(CompletableFuture.completedFuture(List.<float[]>of(new float[] { 1f, 0f })));
        when(embeddingPort.embedBatch(eq(List.of(SECOND))))
                .thenReturn(CompletableFuture.completedFuture(List.<float[]>of(new float[] { 0f, 1f })));
        Map<ProfileSection, String> sections = new LinkedHashMap<>();
        sections.put(ProfileSection.PROJECTS, SECOND);
        sections.put(ProfileSection.EXPERIENCE, FIRST);

        List<ProfileSentence> sentences = indexer.indexSections(sections);

        assertEquals(List.of("projects#0", "experience#0"), sentences.stream().map(ProfileSentence::id).toList());
    }

    @Test
    void shouldBuildSentenceRequirementsFromLines() {
        when(embeddingPort.embedBatch(anyList())).thenReturn(CompletableFuture.completedFuture(
                List.of(new float[] { 1f, 0f }, new float[] { 0f, 1f })));

        SectionRequirement section = indexer.indexRequirements(RequirementPriority.REQUIRED,
                List.of("Five years of backend development", "Experience operating Kafka clusters"));

        assertEquals(RequirementPriority.REQUIRED, section.getPriority());
        assertEquals(List.of("required#0", "required#1"),
                section.getItems().stream().map(RequirementItem::getId).toList());
        assertEquals(RequirementKind.SENTENCE, section.getItems().get(0).getKind());
    }

    @Test
    void shouldReturnEmptySectionForNoLines() {
        SectionRequirement section = indexer.indexRequirements(RequirementPriority.PREFERRED, List.of());

        assertTrue(section.isEmpty());
        verifyNoInteractions(embeddingPort);
    }
}
