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

package dev.mars.arena.ledger.reconcile;

import dev.mars.arena.ledger.LeaderboardEntry;

import java.time.Instant;
import java.util.List;

/**
 * Outcome of replaying a contest's audit log against its persisted ledger.
 *
 * @param contestId           canonical contest id
 * @param dryRun              whether the caller asked for a report only
 * @param applied             whether the replayed state was written to the ledger
 * @param totalMatches        votes replayed since the most recent reset
 * @param skippedEvents       vote events that could not be replayed
 * @param changesDetected     true when {@code differences} is not empty
 * @param lastMatchAt         newest replayed match, null when none
 * @param differences         per-logo drift between ledger and replay
 * @param invariantViolations persisted logos whose matches differ from wins plus losses
 * @param proposedLeaderboard leaderboard of the replayed state
 */
public record RecalculationResult(
        String contestId,
        boolean dryRun,
        boolean applied,
        int totalMatches,
        int skippedEvents,
        boolean changesDetected,
        Instant lastMatchAt,
        List<Difference> differences,
        List<String> invariantViolations,
        List<LeaderboardEntry> proposedLeaderboard) {

    public RecalculationResult {
        differences = List.copyOf(differences);
        invariantViolations = List.copyOf(invariantViolations);
        proposedLeaderboard = List.copyOf(proposedLeaderboard);
    }
}
