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

import dev.mars.arena.core.rating.RatingEngine;

import java.nio.file.Path;
import java.util.Objects;
import java.util.Set;

/**
 * Options of one offline merge run.
 *
 * @param inputDir      directory scanned for {@code *.json} vote exports
 * @param outputPath    merged votes file; with {@code perContest} the stem of the per-contest files
 * @param logosPath     logo catalog used to align each contest's roster, null for none
 * @param contestFilter contests to merge; empty merges every contest found
 * @param maxHistory    history records kept per contest; zero or negative keeps all
 * @param dryRun        compute and report without writing
 * @param verbose       log per-file and per-contest detail at INFO
 * @param perContest    write one file per contest instead of a single merged file
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-02-06
 * @version 1.0
 */
public record MergeOptions(
        Path inputDir,
        Path outputPath,
        Path logosPath,
        Set<String> contestFilter,
        int maxHistory,
        boolean dryRun,
        boolean verbose,
        boolean perContest) {

    public static final String DEFAULT_OUTPUT_NAME = "merged-votes.json";

    /** Catalog of the server's default data directory; a missing file only produces a warning. */
    public static final Path DEFAULT_LOGOS_PATH = Path.of("server", "runtime-data", "logos.json");

    public MergeOptions {
        Objects.requireNonNull(inputDir, "inputDir");
        if (outputPath == null) {
            outputPath = inputDir.resolve(DEFAULT_OUTPUT_NAME);
        }
        contestFilter = contestFilter == null ? Set.of() : Set.copyOf(contestFilter);
    }

    /**
     * Options merging every contest in {@code inputDir} into {@code <inputDir>/merged-votes.json}.
     */
    public static MergeOptions defaults(Path inputDir) {
        return new MergeOptions(inputDir, null, null, Set.of(), RatingEngine.HISTORY_LIMIT, false, false, false);
    }

    public boolean includes(String contestId) {
        return contestFilter.isEmpty() || contestFilter.contains(contestId);
    }
}
