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

package dev.mars.arena.tools.merge;

import java.time.Instant;
import java.util.List;

/**
 * Outcome of merging one contest.
 *
 * @param contestId              contest id
 * @param matchesApplied         unique matches replayed
 * @param duplicatesSkipped      matches seen in more than one export, or twice in one
 * @param historyRetained        history records kept after the history cap
 * @param earliestMatch          timestamp of the oldest replayed match, null when none
 * @param latestMatch            timestamp of the newest replayed match, null when none
 * @param missingHistoryEstimate matches implied by the exported counters but absent from every history
 * @param warnings               contest-level warnings
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-02-06
 * @version 1.0
 */
public record ContestMergeSummary(
        String contestId,
        int matchesApplied,
        int duplicatesSkipped,
        int historyRetained,
        Instant earliestMatch,
        Instant latestMatch,
        int missingHistoryEstimate,
        List<String> warnings) {

    public ContestMergeSummary {
        warnings = List.copyOf(warnings);
    }
}
