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

import me.golemcore.matching.domain.exception.DimensionMismatchException;
import me.golemcore.matching.domain.exception.MatchEvaluationException;
import me.golemcore.matching.domain.model.AggregateScore;
import me.golemcore.matching.domain.model.CandidateProfile;
import me.golemcore.matching.domain.model.CategoryScore;
import me.golemcore.matching.domain.model.EmbeddingVector;
import me.golemcore.matching.domain.model.ExperienceResult;
import me.golemcore.matching.domain.model.ItemMatch;
import me.golemcore.matching.domain.model.MatchFlag;
import me.golemcore.matching.domain.model.MatchResult;
import me.golemcore.matching.domain.model.MatchingConfiguration;
import me.golemcore.matching.domain.model.PenaltyKind;
import me.golemcore.matching.domain.model.PositionProfile;
import me.golemcore.matching.domain.model.ScoreCategory;
import me.golemcore.matching.domain.model.ScreeningHit;
import me.golemcore.matching.domain.model.ScreeningResult;
import me.golemcore.matching.domain.model.SectionResult;
import me.golemcore.matching.infrastructure.config.MatchingConfigService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.function.Function;
import java.util.function.Supplier;

/**
 * Default {@link MatchOrchestrator}.
 *
 * <p>
 * Screening splits the profile list into chunks, scores them on the
 * {@link ScreeningWorkerPool}, then filters, sorts and limits the gathered
 * hits. Near misses are sorted and limited the same way. Profiles without a
 * vector or with a vector of the wrong dimension are counted as rejected
 * instead of failing the screen.
 *
 * <p>
 * Detailed evaluation captures the configuration snapshot once and runs the
 * section, experience and credential matchers, the penalty engine, the
 * aggregator and the grade classifier. A dimension mismatch in any category
 * aborts with a {@link MatchEvaluationException} naming that category.
 *
 * @since 1.0
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class DefaultMatchOrchestrator implements MatchOrchestrator {

    static final String ALGORITHM_VERSION_PREFIX = "v2.0-";
    private static final int SCREENING_CHUNK_SIZE = 256;

    private static final Comparator<ScreeningHit> BY_SIMILARITY = Comparator
            .comparingDouble(ScreeningHit::similarity).reversed()
            .thenComparing(ScreeningHit::profileId, Comparator.nullsLast(Comparator.naturalOrder()));

    private final MatchingConfigService configService;
    private final CosineSimilarity cosineSimilarity;
    private final SectionalMatcher sectionalMatcher;
    private final ExperienceMatcher experienceMatcher;
    private final CredentialMatcher credentialMatcher;
    private final PenaltyEngine penaltyEngine;
    private final ScoreAggregator scoreAggregator;
    private final GradeClassifier gradeClassifier;
    private final MatchTimestampSource timestampSource;
    private final ScreeningWorkerPool workerPool;

    // ===== Fast stage =====

    @Override
    public ScreeningResult screenCandidates(PositionProfile position, List<CandidateProfile> candidates, int limit) {
        Objects.requireNonNull(position, "position must not be null");
        Objects.requireNonNull(candidates, "candidates must not be null");
        return screen(position.getOverallVector(), candidates, CandidateProfile::getId,
                CandidateProfile::getOverallVector, limit, "position " + position.getId());
    }

    @Override
    public ScreeningResult screenCandidates(PositionProfile position, List<CandidateProfile> candidates) {
        return screenCandidates(position, candidates, configService.current().getTuning().getScreeningDefaultLimit());
    }

    @Override
    public ScreeningResult screenPositions(CandidateProfile candidate, List<PositionProfile> positions, int limit) {
        Objects.requireNonNull(candidate, "candidate must not be null");
        Objects.requireNonNull(positions, "positions must not be null");
        return screen(candidate.getOverallVector(), positions, PositionProfile::getId,
                PositionProfile::getOverallVector, limit, "candidate " + candidate.getId());
    }

    @Override
    public ScreeningResult screenPositions(CandidateProfile candidate, List<PositionProfile> positions) {
        return screenPositions(candidate, positions, configService.current().getTuning().getScreeningDefaultLimit());
    }

    private <T> ScreeningResult screen(EmbeddingVector query, List<T> profiles, Function<T, String> idOf,
            Function<T, EmbeddingVector> vectorOf, int limit, String subject) {
        if (limit <= 0) {
            throw new IllegalArgumentException("limit must be positive, got " + limit);
        }
        MatchingConfiguration config = configService.current();
        double minSimilarity = config.getTuning().getScreeningMinSimilarity();
        double nearMissFloor = minSimilarity - config.getTuning().getNearMissMargin();

        if (query == null) {
            log.warn("[Orchestrator] Cannot screen for {}: no overall vector", subject);
            return ScreeningResult.builder()
                    .screened(profiles.size())
                    .rejected(profiles.size())
                    .minSimilarity(minSimilarity)
                    .configVersion(config.getVersion())
                    .build();
        }

        long start = System.currentTimeMillis();
        List<CompletableFuture<ChunkResult>> futures = new ArrayList<>();
        for (int from = 0; from < profiles.size(); from += SCREENING_CHUNK_SIZE) {
            List<T> chunk = profiles.subList(from, Math.min(profiles.size(), from + SCREENING_CHUNK_SIZE));
            futures.add(workerPool.submit(() -> scoreChunk(query, chunk, idOf, vectorOf)));
        }

        List<ScreeningHit> hits = new ArrayList<>();
        List<ScreeningHit> nearMisses = new ArrayList<>();
        int rejected = 0;
        for (CompletableFuture<ChunkResult> future : futures) {
            ChunkResult chunk = future.join();
            rejected += chunk.rejected();
            for (ScreeningHit hit : chunk.hits()) {
                if (hit.similarity() >= minSimilarity) {
                    hits.add(hit);
                } else if (hit.similarity() >= nearMissFloor) {
                    nearMisses.add(hit);
                }
            }
        }

        hits.sort(BY_SIMILARITY);
        nearMisses.sort(BY_SIMILARITY);
        List<ScreeningHit> limited = new ArrayList<>(hits.subList(0, Math.min(limit, hits.size())));
        List<ScreeningHit> limitedNearMisses = new ArrayList<>(
                nearMisses.subList(0, Math.min(limit, nearMisses.size())));

        if (rejected > 0) {
            log.warn("[Orchestrator] Screening for {} rejected {} malformed profile(s)", subject, rejected);
        }
        log.info("[Orchestrator] Screened {} profile(s) for {}: {} above {}, returning {} "
                + "({} of {} near misses) in {}ms", profiles.size(), subject, hits.size(), minSimilarity,
                limited.size(), limitedNearMisses.size(), nearMisses.size(), System.currentTimeMillis() - start);

        return ScreeningResult.builder()
                .hits(limited)
                .nearMisses(limitedNearMisses)
                .screened(profiles.size())
                .rejected(rejected)
                .minSimilarity(minSimilarity)
                .configVersion(config.getVersion())
                .build();
    }

    private <T> ChunkResult scoreChunk(EmbeddingVector query, List<T> chunk, Function<T, String> idOf,
            Function<T, EmbeddingVector> vectorOf) {
        List<ScreeningHit> scored = new ArrayList<>(chunk.size());
        int rejected = 0;
        for (T profile : chunk) {
            if (profile == null) {
                rejected++;
                continue;
            }
            EmbeddingVector vector = vectorOf.apply(profile);
            if (vector == null) {
                log.debug("[Orchestrator] Rejected {}: no overall vector", idOf.apply(profile));
                rejected++;
                continue;
            }
            try {
                scored.add(new ScreeningHit(idOf.apply(profile), cosineSimilarity.similarity(vector, query)));
            } catch (DimensionMismatchException e) {
                log.debug("[Orchestrator] Rejected {}: {}", idOf.apply(profile), e.getMessage());
                rejected++;
            }
        }
        return new ChunkResult(scored, rejected);
    }

    private record ChunkResult(List<ScreeningHit> hits, int rejected) {
    }

    // ===== Detailed stage =====

    @Override
    public MatchResult evaluate(CandidateProfile candidate, PositionProfile position) {
        return evaluate(candidate, position, configService.current());
    }

    @Override
    public MatchResult evaluate(CandidateProfile candidate, PositionProfile position, MatchingConfiguration config) {
        Objects.requireNonNull(candidate, "candidate must not be null");
        Objects.requireNonNull(position, "position must not be null");
        Objects.requireNonNull(config, "config must not be null");

        String candidateId = candidate.getId();
        String positionId = position.getId();
        log.debug("[Orchestrator] Evaluating candidate={} position={} (config v{})", candidateId, positionId,
                config.getVersion());

        SectionResult required = scoreCategory(ScoreCategory.REQUIRED, candidateId, positionId,
                () -> sectionalMatcher.match(position.getRequired(), candidate, config));
        SectionResult preferred = scoreCategory(ScoreCategory.PREFERRED, candidateId, positionId,
                () -> sectionalMatcher.match(position.getPreferred(), candidate, config));
        ExperienceResult experience = scoreCategory(ScoreCategory.EXPERIENCE, candidateId, positionId,
                () -> experienceMatcher.match(position, candidate, config.getTuning()));

        Set<MatchFlag> flags = EnumSet.noneOf(MatchFlag.class);
        double overall;
        if (candidate.getOverallVector() == null || position.getOverallVector() == null) {
            flags.add(MatchFlag.OVERALL_VECTOR_MISSING);
            overall = 0.0;
        } else {
            overall = scoreCategory(ScoreCategory.OVERALL, candidateId, positionId,
                    () -> cosineSimilarity.similarity(candidate.getOverallVector(), position.getOverallVector()));
        }
        if (required.isCandidateSectionMissing()) {
            flags.add(MatchFlag.REQUIRED_SECTION_MISSING);
        }
        if (preferred.isCandidateSectionMissing()) {
            flags.add(MatchFlag.PREFERRED_SECTION_MISSING);
        }

        Map<ScoreCategory, Double> scores = new EnumMap<>(ScoreCategory.class);
        scores.put(ScoreCategory.REQUIRED, required.getScore());
        scores.put(ScoreCategory.PREFERRED, preferred.getScore());
        scores.put(ScoreCategory.EXPERIENCE, experience.getScore());
        scores.put(ScoreCategory.OVERALL, overall);
        scores.put(ScoreCategory.EDUCATION, credentialMatcher.educationScore(position, candidate));
        scores.put(ScoreCategory.CERTIFICATION, credentialMatcher.certificationScore(position, candidate));

        Map<PenaltyKind, Double> penalties = penaltyEngine.evaluate(experience, required, position, candidate,
                config.getPenalties());
        AggregateScore aggregate = scoreAggregator.aggregate(scores, config.getWeights(), penalties);
        String grade = gradeClassifier.classify(aggregate.percentage(), config.getGrades());

        Map<ScoreCategory, CategoryScore> categoryScores = new EnumMap<>(ScoreCategory.class);
        scores.forEach((category, score) -> categoryScores.put(category,
                new CategoryScore(score, config.getWeights().weightOf(category))));

        List<ItemMatch> nearMisses = new ArrayList<>(required.getNearMisses());
        nearMisses.addAll(preferred.getNearMisses());

        MatchResult result = MatchResult.builder()
                .candidateId(candidateId)
                .positionId(positionId)
                .overallScore(aggregate.percentage())
                .grade(grade)
                .categoryScores(categoryScores)
                .required(required)
                .preferred(preferred)
                .experience(experience)
                .penalties(penalties)
                .flags(flags)
                .nearMisses(nearMisses)
                .weightPreset(config.getWeights().getPresetName())
                .configVersion(config.getVersion())
                .algorithmVersion(ALGORITHM_VERSION_PREFIX + config.getWeights().getPresetName())
                .calculatedAt(timestampSource.next())
                .build();

        log.info("[Orchestrator] candidate={} position={}: {}% ({}), required {}, preferred {}, penalties {}",
                candidateId, positionId, result.getOverallScore(), grade, required.getMatchRate(),
                preferred.getMatchRate(), String.format("%.3f", aggregate.penaltyTotal()));
        return result;
    }

    private <T> T scoreCategory(ScoreCategory category, String candidateId, String positionId, Supplier<T> scorer) {
        try {
            return scorer.get();
        } catch (DimensionMismatchException e) {
            log.warn("[Orchestrator] {} scoring failed for candidate={} position={}: {}", category.getKey(),
                    candidateId, positionId, e.getMessage());
            throw new MatchEvaluationException(category, candidateId, positionId, e);
        }
    }
}
