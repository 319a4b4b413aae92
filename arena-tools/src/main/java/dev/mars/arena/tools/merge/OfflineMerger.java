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

import dev.mars.arena.core.codec.DecodeResult;
import dev.mars.arena.core.codec.LogoCatalogCodec;
import dev.mars.arena.core.codec.RejectedRecord;
import dev.mars.arena.core.codec.VotesFileCodec;
import dev.mars.arena.core.exceptions.MergeException;
import dev.mars.arena.core.model.ContestLedger;
import dev.mars.arena.core.model.LogoEntry;
import dev.mars.arena.core.model.MatchRecord;
import dev.mars.arena.core.model.RatingEntry;
import dev.mars.arena.core.model.RatingState;
import dev.mars.arena.core.model.VotesFile;
import dev.mars.arena.core.rating.RatingEngine;
import dev.mars.arena.core.storage.AtomicFileWriter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;

/**
 * Merges independently captured vote exports into one ledger per contest.
 *
 * <p>Every {@code *.json} file of the input directory is decoded (legacy single-contest files
 * as the default contest), the match histories of each contest are pooled and deduplicated by
 * {@link MatchRecord#dedupeKey()}, and the unique matches are replayed in
 * {@link MatchRecord#REPLAY_ORDER} from a blank state. The exported ratings themselves are
 * ignored: the replay is the only source of truth, which makes a merge of the same inputs
 * produce the same output regardless of file order.</p>
 *
 * <p>Runs synchronously; it is meant for the command line, not for a live server.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-02-06
 * @version 1.0
 */
public class OfflineMerger {

    private static final Logger LOG = LoggerFactory.getLogger(OfflineMerger.class);

    private final VotesFileCodec codec;
    private final LogoCatalogCodec logoCodec;
    private final RatingEngine engine;
    private final AtomicFileWriter writer;
    private final Clock clock;

    public OfflineMerger(VotesFileCodec codec, LogoCatalogCodec logoCodec, RatingEngine engine,
                         AtomicFileWriter writer, Clock clock) {
        this.codec = Objects.requireNonNull(codec, "codec");
        this.logoCodec = Objects.requireNonNull(logoCodec, "logoCodec");
        this.engine = Objects.requireNonNull(engine, "engine");
        this.writer = Objects.requireNonNull(writer, "writer");
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    /**
     * Pooled matches of one contest across all exports.
     */
    private static final class Aggregation {
        private final Map<String, MatchRecord> matches = new LinkedHashMap<>();
        private Instant latestUpdatedAt;
        private int duplicates;
        private int inferredMatches;
    }

    /**
     * Runs a merge.
     *
     * @throws MergeException if the input directory holds no readable contests or the output cannot be written
     */
    public MergeReport merge(MergeOptions options) throws MergeException {
        List<String> warnings = new ArrayList<>();
        List<Path> sources = listSources(options);
        if (sources.isEmpty()) {
            throw new MergeException("No vote JSON files found in " + options.inputDir());
        }
        detail(options, "Merging {} vote file(s) from {}", sources.size(), options.inputDir());

        Map<String, Aggregation> aggregations = new LinkedHashMap<>();
        for (Path source : sources) {
            aggregate(source, options, aggregations, warnings);
        }
        if (aggregations.isEmpty()) {
            throw new MergeException("No contests found in provided vote files.");
        }

        Map<String, List<String>> rosters = loadRosters(options, warnings);

        Instant now = clock.instant();
        Map<String, ContestLedger> contests = new LinkedHashMap<>();
        List<ContestMergeSummary> summaries = new ArrayList<>();
        for (Map.Entry<String, Aggregation> entry : aggregations.entrySet()) {
            String contestId = entry.getKey();
            Aggregation aggregation = entry.getValue();
            List<String> rosterIds = rosters.getOrDefault(contestId, List.of());

            List<String> contestWarnings = new ArrayList<>();
            RatingState state = replay(contestId, aggregation, rosterIds, options.maxHistory(), contestWarnings);
            Instant updatedAt = aggregation.latestUpdatedAt != null ? aggregation.latestUpdatedAt : now;
            contests.put(contestId, new ContestLedger(state, updatedAt));
            summaries.add(summarize(contestId, aggregation, state, contestWarnings));
        }

        VotesFile merged = new VotesFile(VotesFile.CURRENT_VERSION, contests, now);
        List<Path> written = options.dryRun() ? List.of() : write(merged, options);

        MergeReport report = new MergeReport(merged, summaries, warnings, written);
        LOG.info("Merged {} contest(s): {} unique match(es), {} duplicate(s) skipped{}",
                summaries.size(), report.totalMatches(), report.totalDuplicates(),
                options.dryRun() ? " (dry run)" : "");
        return report;
    }

    // =========================================================================
    // Input
    // =========================================================================

    private List<Path> listSources(MergeOptions options) throws MergeException {
        Path inputDir = options.inputDir();
        if (!Files.isDirectory(inputDir)) {
            throw new MergeException(inputDir + " is not a directory");
        }
        List<Path> sources = new ArrayList<>();
        try (DirectoryStream<Path> stream = Files.newDirectoryStream(inputDir)) {
            for (Path path : stream) {
                String name = path.getFileName().toString();
                if (Files.isRegularFile(path)
                        && name.toLowerCase(Locale.ROOT).endsWith(".json")
                        && !isOwnOutput(path, options)) {
                    sources.add(path);
                }
            }
        } catch (IOException e) {
            throw new MergeException("Failed to list " + inputDir + ": " + e.getMessage(), e);
        }
        sources.sort(Comparator.comparing(path -> path.getFileName().toString()));
        return sources;
    }

    /**
     * True for files a previous run of the same merge wrote into the input directory.
     */
    private static boolean isOwnOutput(Path path, MergeOptions options) {
        Path output = options.outputPath().toAbsolutePath().normalize();
        Path candidate = path.toAbsolutePath().normalize();
        if (!Objects.equals(candidate.getParent(), output.getParent())) {
            return false;
        }
        String name = candidate.getFileName().toString();
        if (name.equals(output.getFileName().toString())) {
            return true;
        }
        return options.perContest() && name.startsWith(stem(output) + ".");
    }

    private void aggregate(Path source, MergeOptions options, Map<String, Aggregation> aggregations,
                           List<String> warnings) {
        DecodeResult<VotesFile> decoded;
        try {
            decoded = codec.decode(Files.readAllBytes(source), clock.instant());
        } catch (IOException e) {
            warnings.add("Failed to process " + source + ": " + e.getMessage());
            LOG.warn("Skipping {}: {}", source, e.getMessage());
            return;
        }

        if (decoded.hasRejections()) {
            for (RejectedRecord rejected : decoded.rejected()) {
                warnings.add(source.getFileName() + ": dropped " + rejected);
            }
        }
        detail(options, "Read {} ({} contest(s){}, {} rejected record(s))", source.getFileName(),
                decoded.value().contests().size(), decoded.legacy() ? ", legacy format" : "",
                decoded.rejected().size());

        for (Map.Entry<String, ContestLedger> contest : decoded.value().contests().entrySet()) {
            String contestId = contest.getKey();
            if (!options.includes(contestId)) {
                continue;
            }
            Aggregation aggregation = aggregations.computeIfAbsent(contestId, id -> new Aggregation());
            ContestLedger ledger = contest.getValue();

            if (aggregation.latestUpdatedAt == null || ledger.updatedAt().isAfter(aggregation.latestUpdatedAt)) {
                aggregation.latestUpdatedAt = ledger.updatedAt();
            }
            for (RatingEntry entry : ledger.state().entries().values()) {
                aggregation.inferredMatches = Math.max(aggregation.inferredMatches, entry.matches());
            }

            int added = 0;
            for (MatchRecord match : ledger.state().history()) {
                if (aggregation.matches.putIfAbsent(match.dedupeKey(), match) != null) {
                    aggregation.duplicates++;
                } else {
                    added++;
                }
            }
            detail(options, "  {}: {} match(es) in history, {} new", contestId,
                    ledger.state().history().size(), added);
        }
    }

    /**
     * Active roster ids per contest, or no rosters when no catalog is given or it cannot be read.
     */
    private Map<String, List<String>> loadRosters(MergeOptions options, List<String> warnings) {
        Map<String, List<String>> rosters = new LinkedHashMap<>();
        Path logosPath = options.logosPath();
        if (logosPath == null) {
            return rosters;
        }
        if (!Files.exists(logosPath)) {
            warnings.add("Logo catalog " + logosPath + " not found. Continuing without roster alignment.");
            return rosters;
        }
        try {
            for (LogoEntry logo : logoCodec.read(logosPath)) {
                if (logo.isActive()) {
                    rosters.computeIfAbsent(logo.contestId(), id -> new ArrayList<>()).add(logo.id());
                }
            }
        } catch (IOException e) {
            warnings.add("Failed to load logos from " + logosPath + ": " + e.getMessage()
                    + ". Continuing without roster alignment.");
            LOG.warn("Failed to load logos from {}", logosPath, e);
            return new LinkedHashMap<>();
        }
        return rosters;
    }

    // =========================================================================
    // Replay
    // =========================================================================

    private RatingState replay(String contestId, Aggregation aggregation, List<String> rosterIds,
                               int maxHistory, List<String> warnings) {
        List<MatchRecord> matches = new ArrayList<>(aggregation.matches.values());
        matches.sort(MatchRecord.REPLAY_ORDER);

        RatingState state = engine.blankState(rosterIds);
        for (MatchRecord match : matches) {
            state = engine.applyMatch(state, match, maxHistory);
        }
        state = engine.ensureEntries(state, rosterIds);

        if (matches.isEmpty()) {
            warnings.add("No matches found for contest " + contestId + ".");
        }
        int missing = aggregation.inferredMatches - matches.size();
        if (missing > 0) {
            warnings.add("Contest " + contestId + " may have lost " + missing
                    + " matches because history files were truncated. Final ratings recomputed from the "
                    + matches.size() + " available matches.");
        }
        return state;
    }

    private static ContestMergeSummary summarize(String contestId, Aggregation aggregation, RatingState state,
                                                 List<String> warnings) {
        Instant earliest = null;
        Instant latest = null;
        for (MatchRecord match : aggregation.matches.values()) {
            Instant at = Instant.ofEpochMilli(match.timestamp());
            if (earliest == null || at.isBefore(earliest)) {
                earliest = at;
            }
            if (latest == null || at.isAfter(latest)) {
                latest = at;
            }
        }
        int missing = Math.max(0, aggregation.inferredMatches - aggregation.matches.size());
        return new ContestMergeSummary(contestId, aggregation.matches.size(), aggregation.duplicates,
                state.history().size(), earliest, latest, missing, warnings);
    }

    // =========================================================================
    // Output
    // =========================================================================

    private List<Path> write(VotesFile merged, MergeOptions options) throws MergeException {
        List<Path> written = new ArrayList<>();
        Path output = options.outputPath();
        try {
            if (options.perContest()) {
                for (Map.Entry<String, ContestLedger> contest : merged.contests().entrySet()) {
                    Path target = perContestPath(output, contest.getKey());
                    VotesFile single = new VotesFile(merged.version(),
                            Map.of(contest.getKey(), contest.getValue()), merged.updatedAt());
                    writer.write(target, codec.encode(single));
                    written.add(target);
                }
            } else {
                writer.write(output, codec.encode(merged));
                written.add(output);
            }
        } catch (IOException e) {
            throw new MergeException("Failed to write merged votes to " + output + ": " + e.getMessage(), e);
        }
        for (Path path : written) {
            LOG.info("Merged votes written to {}", path);
        }
        return written;
    }

    /**
     * {@code <dir>/<stem>.<contestId>.json} for an output path {@code <dir>/<stem>.json}.
     */
    public static Path perContestPath(Path output, String contestId) {
        Path absolute = output.toAbsolutePath();
        return absolute.resolveSibling(stem(absolute) + "." + contestId + ".json");
    }

    private static String stem(Path path) {
        String name = path.getFileName().toString();
        int dot = name.lastIndexOf('.');
        return dot > 0 ? name.substring(0, dot) : name;
    }

    private static void detail(MergeOptions options, String format, Object... args) {
        if (options.verbose()) {
            LOG.info(format, args);
        } else {
            LOG.debug(format, args);
        }
    }
}
