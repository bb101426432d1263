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

import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Instant;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Hands out strictly increasing result timestamps.
 *
 * <p>
 * Two evaluations finishing within the same clock tick (or a clock stepping
 * backwards) still get ordered values: the next value is the later of the
 * clock reading and the previous value plus one nanosecond.
 */
@Component
@RequiredArgsConstructor
public class MatchTimestampSource {

    private final Clock clock;
    private final AtomicReference<Instant> last = new AtomicReference<>(Instant.MIN);

    public Instant next() {
        return last.updateAndGet(previous -> {
            Instant now = clock.instant();
            return now.isAfter(previous) ? now : previous.plusNanos(1);
        });
    }
}
