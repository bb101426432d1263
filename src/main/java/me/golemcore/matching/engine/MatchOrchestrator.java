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
import me.golemcore.matching.domain.model.MatchResult;
import me.golemcore.matching.domain.model.MatchingConfiguration;
import me.golemcore.matching.domain.model.PositionProfile;
import me.golemcore.matching.domain.model.ScreeningResult;

import java.util.List;

/**
 * Entry points of the matching engine.
 *
 * <p>
 * Two independent stages share the same primitives:
 * <ol>
 * <li><b>Fast screening</b> - whole-profile cosine similarity only, used to
 * shortlist thousands of profiles</li>
 * <li><b>Detailed evaluation</b> - section matching, experience fit,
 * penalties, aggregation and grading for one pair</li>
 * </ol>
 *
 * <p>
 * Both stages are side-effect free. The screening similarity of a pair equals
 * the {@code overall} category score of its detailed evaluation.
 *
 * @since 1.0
 */
public interface MatchOrchestrator {

    /**
     * Ranks candidates for a position.
     *
     * @param limit
     *            maximum number of hits, must be positive
     */
    ScreeningResult screenCandidates(PositionProfile position, List<CandidateProfile> candidates, int limit);

    /**
     * Ranks candidates for a position using the configured default limit.
     */
    ScreeningResult screenCandidates(PositionProfile position, List<CandidateProfile> candidates);

    /**
     * Ranks positions for a candidate.
     */
    ScreeningResult screenPositions(CandidateProfile candidate, List<PositionProfile> positions, int limit);

    ScreeningResult screenPositions(CandidateProfile candidate, List<PositionProfile> positions);

    /**
     * Evaluates one pair against the current configuration snapshot.
     */
    MatchResult evaluate(CandidateProfile candidate, PositionProfile position);

    /**
     * Evaluates one pair against an explicit configuration.
     *
     * @throws me.golemcore.matching.domain.exception.MatchEvaluationException
     *             if a category cannot be scored (vector dimension mismatch)
     */
    MatchResult evaluate(CandidateProfile candidate, PositionProfile position, MatchingConfiguration config);
}
