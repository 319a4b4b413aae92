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

package dev.mars.arena.ledger;

import java.time.Instant;
import java.util.List;

/**
 * Summary figures of one contest.
 *
 * @param contestId   canonical contest id
 * @param logoCount   number of active logos
 * @param matchCount  matches in the retained history
 * @param lastMatchAt time of the newest match, null when none
 * @param leaderboard top logos by rating
 */
public record ContestMetrics(
        String contestId,
        int logoCount,
        int matchCount,
        Instant lastMatchAt,
        List<LeaderboardEntry> leaderboard) {

    public ContestMetrics {
        leaderboard = List.copyOf(leaderboard);
    }
}
