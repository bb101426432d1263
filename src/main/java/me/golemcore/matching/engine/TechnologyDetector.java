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

import me.golemcore.matching.domain.model.MatchingConfiguration;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.HashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.regex.Matcher;

/**
 * Finds the dominant technology token mentioned in a piece of text.
 *
 * <p>
 * The vocabulary is every surface form known to the configuration (threshold
 * table tokens, synonym canonicals and aliases). Longer forms are matched
 * first and their spans masked, so "spring boot" is not also counted as
 * "spring". The canonical with most occurrences wins; ties go to the earliest
 * first occurrence, then to the longest surface form.
 *
 * @since 1.0
 */
@Component
@Slf4j
public class TechnologyDetector {

    public Optional<String> dominantToken(String text, MatchingConfiguration config) {
        if (text == null || text.isBlank()) {
            return Optional.empty();
        }

        char[] working = text.toLowerCase(Locale.ROOT).toCharArray();
        Map<String, Tally> tallies = new HashMap<>();

        for (Map.Entry<String, String> entry : config.getVocabulary().entrySet()) {
            String form = entry.getKey();
            Matcher matcher = config.wordPattern(form).matcher(new String(working));
            while (matcher.find()) {
                Tally tally = tallies.computeIfAbsent(entry.getValue(), k -> new Tally());
                tally.record(matcher.start(), form.length());
                for (int i = matcher.start(); i < matcher.end(); i++) {
                    working[i] = ' ';
                }
            }
        }

        Optional<String> dominant = tallies.entrySet().stream()
                .sorted((a, b) -> {
                    int byCount = Integer.compare(b.getValue().count, a.getValue().count);
                    if (byCount != 0) {
                        return byCount;
                    }
                    int byPosition = Integer.compare(a.getValue().firstPosition, b.getValue().firstPosition);
                    if (byPosition != 0) {
                        return byPosition;
                    }
                    int byLength = Integer.compare(b.getValue().longestForm, a.getValue().longestForm);
                    return byLength != 0 ? byLength : a.getKey().compareTo(b.getKey());
                })
                .map(Map.Entry::getKey)
                .findFirst();

        log.trace("[TechnologyDetector] Dominant token: {} (candidates: {})", dominant.orElse("none"),
                tallies.keySet());
        return dominant;
    }

    private static final class Tally {
        private int count;
        private int firstPosition = Integer.MAX_VALUE;
        private int longestForm;

        void record(int position, int formLength) {
            count++;
            firstPosition = Math.min(firstPosition, position);
            longestForm = Math.max(longestForm, formLength);
        }
    }
}
