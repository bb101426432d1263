package me.golemcore.matching.domain.model;

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

import java.util.Optional;

/**
 * Resolved matching policy for one canonical token: the similarity threshold to
 * accept a semantic match and the conflict group the token belongs to.
 *
 * @since 1.0
 */
public record TokenPolicy(String token, double threshold, String conflictGroup, Source source) {

    /**
     * Where the threshold came from.
     */
    public enum Source {
        EXPLICIT, GROUP_DEFAULT, GLOBAL_DEFAULT
    }

    public Optional<String> group() {
        return Optional.ofNullable(conflictGroup);
    }
}
