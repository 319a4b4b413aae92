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

package dev.mars.arena.tools.cli;

import com.fasterxml.jackson.databind.ObjectMapper;
import dev.mars.arena.core.codec.JsonSupport;
import dev.mars.arena.core.codec.LogoCatalogCodec;
import dev.mars.arena.core.codec.VotesFileCodec;
import dev.mars.arena.core.exceptions.ArenaException;
import dev.mars.arena.core.rating.RatingEngine;
import dev.mars.arena.core.storage.AtomicFileWriter;
import dev.mars.arena.tools.merge.ContestMergeSummary;
import dev.mars.arena.tools.merge.MergeOptions;
import dev.mars.arena.tools.merge.MergeReport;
import dev.mars.arena.tools.merge.OfflineMerger;

import java.io.PrintStream;
import java.nio.file.Path;
import java.time.Clock;
import java.util.LinkedHashSet;
import java.util.Set;

/**
 * Command line entry point for the offline vote merge.
 *
 * <pre>
 * java -jar arena-tools.jar --input exports/ [--output merged.json] [--logos logos.json]
 *      [--contest id]... [--max-history n] [--dry-run] [--verbose] [--per-contest]
 * </pre>
 *
 * <p>Exit codes: 0 on success, 1 when the merge fails, 2 on invalid arguments.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-02-06
 * @version 1.0
 */
public class MergeVotesCli {

    public static final int EXIT_OK = 0;
    public static final int EXIT_FAILURE = 1;
    public static final int EXIT_USAGE = 2;

    private static final String DEFAULT_CONTEST_ID = "badge-arena";

    private final PrintStream out;
    private final PrintStream err;

    public MergeVotesCli(PrintStream out, PrintStream err) {
        this.out = out;
        this.err = err;
    }

    public static void main(String[] args) {
        int code = new MergeVotesCli(System.out, System.err).run(args);
        if (code != EXIT_OK) {
            System.exit(code);
        }
    }

    /**
     * Thrown for arguments that cannot be turned into {@link MergeOptions}.
     */
    static final class UsageException extends Exception {
        UsageException(String message) {
            super(message);
        }
    }

    /**
     * Parses arguments, runs the merge and prints its summary.
     *
     * @return the process exit code
     */
    public int run(String[] args) {
        MergeOptions options;
        try {
            options = parseArgs(args);
        } catch (UsageException e) {
            err.println("Error: " + e.getMessage());
            printUsage(err);
            return EXIT_USAGE;
        }
        if (options == null) {
            printUsage(out);
            return EXIT_OK;
        }

        ObjectMapper mapper = JsonSupport.newObjectMapper();
        OfflineMerger merger = new OfflineMerger(
                new VotesFileCodec(mapper, DEFAULT_CONTEST_ID),
                new LogoCatalogCodec(mapper, DEFAULT_CONTEST_ID),
                new RatingEngine(),
                new AtomicFileWriter(true),
                Clock.systemUTC());
        try {
            printReport(merger.merge(options), options);
            return EXIT_OK;
        } catch (ArenaException e) {
            err.println("Error: " + e.getMessage());
            return EXIT_FAILURE;
        }
    }

    /**
     * Turns arguments into options. Accepts {@code --flag value} and {@code --flag=value}.
     *
     * @return the options, or null when help was requested
     */
    static MergeOptions parseArgs(String[] args) throws UsageException {
        Path input = null;
        Path output = null;
        Path logos = MergeOptions.DEFAULT_LOGOS_PATH;
        Set<String> contests = new LinkedHashSet<>();
        int maxHistory = RatingEngine.HISTORY_LIMIT;
        boolean dryRun = false;
        boolean verbose = false;
        boolean perContest = false;

        for (int i = 0; i < args.length; i++) {
            String arg = args[i];
            String flag = arg;
            String inline = null;
            int eq = arg.indexOf('=');
            if (arg.startsWith("--") && eq > 0) {
                flag = arg.substring(0, eq);
                inline = arg.substring(eq + 1);
            }

            switch (flag) {
                case "--input":
                    input = Path.of(inline != null ? inline : next(args, ++i, flag));
                    break;
                case "--output":
                    output = Path.of(inline != null ? inline : next(args, ++i, flag));
                    break;
                case "--logos":
                    logos = Path.of(inline != null ? inline : next(args, ++i, flag));
                    break;
                case "--contest": {
                    String contest = (inline != null ? inline : next(args, ++i, flag)).trim();
                    if (!contest.isEmpty()) {
                        contests.add(contest);
                    }
                    break;
                }
                case "--max-history": {
                    String raw = inline != null ? inline : next(args, ++i, flag);
                    try {
                        maxHistory = Integer.parseInt(raw.trim());
                    } catch (NumberFormatException e) {
                        throw new UsageException("Invalid --max-history value: " + raw);
                    }
                    break;
                }
                case "--dry-run":
                case "--dryrun":
                    dryRun = true;
                    break;
                case "--verbose":
                    verbose = true;
                    break;
                case "--per-contest":
                    perContest = true;
                    break;
                case "--help":
                case "-h":
                    return null;
                default:
                    throw new UsageException("Unknown argument: " + arg);
            }
        }

        if (input == null || input.toString().isBlank()) {
            throw new UsageException("Missing required --input <directory> argument.");
        }
        return new MergeOptions(input, output, logos, contests, maxHistory, dryRun, verbose, perContest);
    }

    private static String next(String[] args, int index, String flag) throws UsageException {
        if (index >= args.length || args[index].startsWith("--")) {
            throw new UsageException(flag + " requires a value");
        }
        return args[index];
    }

    private void printReport(MergeReport report, MergeOptions options) {
        for (ContestMergeSummary summary : report.contests()) {
            out.println("Contest " + summary.contestId() + ": applied " + summary.matchesApplied()
                    + " matches; skipped " + summary.duplicatesSkipped() + " duplicates.");
            if (summary.earliestMatch() != null) {
                out.println("  Time range: " + summary.earliestMatch() + " - " + summary.latestMatch());
            }
            if (summary.historyRetained() < summary.matchesApplied()) {
                out.println("  History trimmed to " + summary.historyRetained() + " most recent matches.");
            }
            for (String warning : summary.warnings()) {
                err.println("  Warning: " + warning);
            }
        }
        for (String warning : report.warnings()) {
            err.println("Warning: " + warning);
        }

        if (options.dryRun()) {
            out.println("[dry-run] Skipping write of merged votes file");
        } else {
            for (Path path : report.written()) {
                out.println("Merged votes written to " + path);
            }
        }
    }

    static void printUsage(PrintStream stream) {
        stream.println("Usage: merge-votes --input <directory> [options]");
        stream.println();
        stream.println("Options:");
        stream.println("  --input <directory>     Directory containing vote JSON files to merge (required)");
        stream.println("  --output <path>         Merged votes file (default: <input>/" + MergeOptions.DEFAULT_OUTPUT_NAME
                + "; the server ledger is only replaced when named here)");
        stream.println("  --logos <path>          logos.json used to align contest rosters (default: "
                + MergeOptions.DEFAULT_LOGOS_PATH + ", skipped with a warning when missing)");
        stream.println("  --contest <id>          Only merge this contest (repeatable)");
        stream.println("  --max-history <count>   History kept per contest (default: " + RatingEngine.HISTORY_LIMIT
                + ", 0 or negative keeps all)");
        stream.println("  --per-contest           Write <output-stem>.<contestId>.json per contest");
        stream.println("  --dry-run               Compute results without writing output");
        stream.println("  --verbose               Log per-file and per-contest detail");
        stream.println("  --help, -h              Show this message");
    }
}
