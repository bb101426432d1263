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

import me.golemcore.matching.domain.model.GradeBand;
import me.golemcore.matching.domain.model.GradeThresholds;
import org.springframework.stereotype.Component;

/**
 * Maps a percentage onto a grade label. The lower bound of every band is
 * inclusive.
 */
@Component
public class GradeClassifier {

    private static final double EPSILON = 1e-9;

    public String classify(double percentage, GradeThresholds thresholds) {
        double score = percentage / 100.0;
        for (GradeBand band : thresholds.getBands()) {
            if (score + EPSILON >= band.minScore()) {
                return band.label();
            }
        }
        // last band minimum is 0 so only negative input gets here
        return thresholds.getBands().get(thresholds.getBands().size() - 1).label();
    }
}
