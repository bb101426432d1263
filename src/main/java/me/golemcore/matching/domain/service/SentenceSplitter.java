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

import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Pattern;

/**
 * Rule-based sentence splitter for narrative profile text.
 *
 * <p>
 * Splits after {@code .}, {@code !}, {@code ?} or a newline, collapses
 * whitespace, and keeps only sentences of 20 to 300 characters that contain a
 * space and no underscore. Shorter fragments are headings or bullets without
 * content; longer ones are usually unsplit tables; underscores mark
 * identifiers and template placeholders.
 */
@Component
public class SentenceSplitter {

    static final int MIN_LENGTH = 20;
    static final int MAX_LENGTH = 300;

    private static final Pattern BOUNDARY = Pattern.compile("(?<=[.!?])\\s+|\\s*\n\\s*");
    private static final Pattern WHITESPACE = Pattern.compile("\\s+");

    public List<String> split(String text) {
        List<String> sentences = new ArrayList<>();
        if (text == null || text.isBlank()) {
            return sentences;
        }
        for (String raw : BOUNDARY.split(text)) {
            String sentence = WHITESPACE.matcher(raw.strip()).replaceAll(" ");
            if (sentence.length() >= MIN_LENGTH && sentence.length() <= MAX_LENGTH
                    && sentence.indexOf(' ') >= 0 && sentence.indexOf('_') < 0) {
                sentences.add(sentence);
            }
        }
        return sentences;
    }
}
