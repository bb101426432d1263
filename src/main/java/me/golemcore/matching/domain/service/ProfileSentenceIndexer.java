package me.golemcore.matching.domain.service;

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

import me.golemcore.matching.domain.model.EmbeddingVector;
import me.golemcore.matching.domain.model.ProfileSection;
import me.golemcore.matching.domain.model.ProfileSentence;
import me.golemcore.matching.domain.model.RequirementItem;
import me.golemcore.matching.domain.model.RequirementKind;
import me.golemcore.matching.domain.model.RequirementPriority;
import me.golemcore.matching.domain.model.SectionRequirement;
import me.golemcore.matching.port.outbound.EmbeddingPort;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.CompletionException;

/**
 * Turns narrative text into embedded sentences for the sectional matcher.
 *
 * <p>
 * Sentences are embedded in one batch; if the batch fails every sentence is
 * embedded individually, and a sentence that still fails is skipped with a
 * warning. Sentence indexes keep their position in the split text, so a
 * skipped sentence leaves a gap.
 *
 * @since 1.0
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class ProfileSentenceIndexer {

    private final SentenceSplitter sentenceSplitter;
    private final EmbeddingPort embeddingPort;

    /**
     * Index one section of a candidate profile.
     */
    public List<ProfileSentence> index(ProfileSection section, String text) {
        List<String> sentences = sentenceSplitter.split(text);
        List<EmbeddingVector> vectors = embedAll(sentences);

        List<ProfileSentence> indexed = new ArrayList<>();
        for (int i = 0; i < sentences.size(); i++) {
            if (vectors.get(i) == null) {
                continue;
            }
            indexed.add(ProfileSentence.builder()
                    .section(section)
                    .index(i)
                    .text(sentences.get(i))
                    .vector(vectors.get(i))
                    .build());
        }
        log.debug("[Indexer] {}: indexed {}/{} sentence(s)", section, indexed.size(), sentences.size());
        return indexed;
    }

    /**
     * Index several sections; the result keeps section order of the map.
     */
    public List<ProfileSentence> indexSections(Map<ProfileSection, String> sections) {
        List<ProfileSentence> all = new ArrayList<>();
        sections.forEach((section, text) -> all.addAll(index(section, text)));
        return all;
    }

    /**
     * Build a sentence-level requirement section from free-text requirement
     * lines (one requirement per entry, long entries are split further).
     */
    public SectionRequirement indexRequirements(RequirementPriority priority, List<String> lines) {
        if (lines == null || lines.isEmpty()) {
            return SectionRequirement.empty(priority);
        }
        List<String> sentences = sentenceSplitter.split(String.join("\n", lines));
        List<EmbeddingVector> vectors = embedAll(sentences);

        List<RequirementItem> items = new ArrayList<>();
        String prefix = priority.name().toLowerCase(Locale.ROOT);
        for (int i = 0; i < sentences.size(); i++) {
            if (vectors.get(i) == null) {
                continue;
            }
            items.add(RequirementItem.builder()
                    .id(prefix + "#" + i)
                    .text(sentences.get(i))
                    .kind(RequirementKind.SENTENCE)
                    .vector(vectors.get(i))
                    .build());
        }
        log.debug("[Indexer] {} requirements: indexed {}/{} sentence(s)", priority, items.size(), sentences.size());
        return SectionRequirement.of(priority, items);
    }

    private List<EmbeddingVector> embedAll(List<String> sentences) {
        List<EmbeddingVector> vectors = new ArrayList<>(sentences.size());
        if (sentences.isEmpty()) {
            return vectors;
        }

        try {
            List<float[]> batch = embeddingPort.embedBatch(sentences).join();
            if (batch.size() != sentences.size()) {
                throw new IllegalStateException("Embedding batch returned " + batch.size() + " vectors for "
                        + sentences.size() + " sentences");
            }
            for (float[] vector : batch) {
                vectors.add(EmbeddingVector.of(vector));
            }
            return vectors;
        } catch (CompletionException | IllegalStateException e) {
            log.warn("[Indexer] Batch embedding failed, falling back to individual embedding: {}", e.getMessage());
        }

        vectors.clear();
        for (String sentence : sentences) {
            try {
                vectors.add(EmbeddingVector.of(embeddingPort.embed(sentence).join()));
            } catch (CompletionException e) {
                log.warn("[Indexer] Failed to embed sentence, skipping: {}", e.getMessage());
                vectors.add(null);
            }
        }
        return vectors;
    }
}
