/*
 * Copyright 2025 Mark Andrew Ray-Smith Cityline Ltd
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
 */

package dev.mars.arena.core.model;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Root document of {@code votes.json}: one {@link ContestLedger} per contest.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-02-02
 * @version 1.0
 */
public record VotesFile(int version, Map<String, ContestLedger> contests, Instant updatedAt) {

    public static final int CURRENT_VERSION = 2;

    public VotesFile {
        contests = Collections.unmodifiableMap(new LinkedHashMap<>(contests));
    }

    public static VotesFile empty(Instant now) {
        return new VotesFile(CURRENT_VERSION, Map.of(), now);
    }

    public Optional<ContestLedger> contest(String contestId) {
        return Optional.ofNullable(contests.get(contestId));
    }

    /**
     * Returns a copy with the given contest replaced and both timestamps set to {@code now}.
     */
    public VotesFile withContest(String contestId, RatingState state, Instant now) {
        Map<String, ContestLedger> next = new LinkedHashMap<>(contests);
        next.put(contestId, new ContestLedger(state, now));
        return new VotesFile(CURRENT_VERSION, next, now);
    }
}
