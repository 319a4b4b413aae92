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

import dev.mars.arena.core.model.VotesFile;

import java.nio.file.Path;
import java.util.List;

/**
 * Result of an offline merge.
 *
 * @param merged   the merged votes file, one ledger per contest
 * @param contests per-contest summaries in merge order
 * @param warnings warnings not tied to one contest, such as unreadable exports
 * @param written  files written; empty on a dry run
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-02-06
 * @version 1.0
 */
public record MergeReport(
        VotesFile merged,
        List<ContestMergeSummary> contests,
        List<String> warnings,
        List<Path> written) {

    public MergeReport {
        contests = List.copyOf(contests);
        warnings = List.copyOf(warnings);
        written = List.copyOf(written);
    }

    public int totalMatches() {
        return contests.stream().mapToInt(ContestMergeSummary::matchesApplied).sum();
    }

    public int totalDuplicates() {
        return contests.stream().mapToInt(ContestMergeSummary::duplicatesSkipped).sum();
    }
}
