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

import dev.mars.arena.core.model.MatchRecord;
import dev.mars.arena.core.model.RatingEntry;
import dev.mars.arena.core.model.RatingState;
import dev.mars.arena.core.rating.RatingEngine;
import dev.mars.arena.ledger.ContestLoader;
import dev.mars.arena.ledger.ContestView;
import dev.mars.arena.ledger.LeaderboardEntry;
import dev.mars.arena.ledger.LedgerSequencer;
import dev.mars.arena.ledger.VotesRepository;
import dev.mars.arena.ledger.audit.AuditEvent;
import dev.mars.arena.ledger.audit.AuditLog;
import dev.mars.arena.ledger.audit.VoteRecorded;
import dev.mars.arena.ledger.audit.VotesReset;
import dev.mars.arena.ledger.observability.LedgerMetrics;
import io.vertx.core.Future;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Recomputes a contest's ratings from the audit log and compares them with the ledger.
 *
 * <p>The replay starts from an empty state and applies every {@link VoteRecorded} event with
 * its recorded timestamp and voter, so it follows exactly the path the live ledger took. A
 * {@link VotesReset} event blanks the replay just as it blanked the ledger. The result is
 * aligned with the active roster before being compared.</p>
 *
 * <p>Drift is always reported. The ledger is only rewritten when the caller passes
 * {@code dryRun=false}, and then with a forced backup on either side of the write.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-02-05
 * @version 1.0
 */
public class Reconciler {

    private static final Logger LOG = LoggerFactory.getLogger(Reconciler.class);

    private final ContestLoader loader;
    private final VotesRepository repository;
    private final AuditLog auditLog;
    private final RatingEngine engine;
    private final LedgerSequencer sequencer;
    private final Clock clock;
    private final LedgerMetrics metrics;
    private final int leaderboardSize;

    public Reconciler(ContestLoader loader, VotesRepository repository, AuditLog auditLog, RatingEngine engine,
                      LedgerSequencer sequencer, Clock clock, LedgerMetrics metrics, int leaderboardSize) {
        this.loader = Objects.requireNonNull(loader, "loader");
        this.repository = Objects.requireNonNull(repository, "repository");
        this.auditLog = Objects.requireNonNull(auditLog, "auditLog");
        this.engine = Objects.requireNonNull(engine, "engine");
        this.sequencer = Objects.requireNonNull(sequencer, "sequencer");
        this.clock = Objects.requireNonNull(clock, "clock");
        this.metrics = Objects.requireNonNull(metrics, "metrics");
        this.leaderboardSize = leaderboardSize;
    }

    /**
     * Replays the contest's audit events and diffs the outcome against the persisted entries.
     *
     * @param contestId contest id, null or blank for the active contest
     * @param dryRun    report only when true; persist the replayed state when false
     */
    public Future<RecalculationResult> recalculate(String contestId, boolean dryRun) {
        return sequencer.submit(() -> loader.load(contestId)
                .compose(view -> auditLog.readForContest(view.contestId())
                        .compose(events -> reconcile(view, events, dryRun))));
    }

    private Future<RecalculationResult> reconcile(ContestView view, List<AuditEvent> events, boolean dryRun) {
        Replay replay = replay(view.contestId(), events);
        List<String> rosterIds = view.rosterIds();
        RatingState recomputed = engine.pruneEntries(engine.ensureEntries(replay.state(), rosterIds), rosterIds);
        RatingState persisted = view.aligned();

        List<Difference> differences = diff(persisted.entries(), recomputed.entries());
        List<String> violations = new ArrayList<>();
        for (Map.Entry<String, RatingEntry> entry : persisted.entries().entrySet()) {
            if (!entry.getValue().isConsistent()) {
                violations.add(entry.getKey());
            }
        }

        boolean changesDetected = !differences.isEmpty();
        metrics.recordDrift(view.contestId(), differences.size());
        if (changesDetected) {
            LOG.warn("Contest {} drifted from its audit log: {} logo(s) differ (dryRun={})",
                    view.contestId(), differences.size(), dryRun);
        }
        if (!violations.isEmpty()) {
            LOG.warn("Contest {} has entries where matches != wins + losses: {}", view.contestId(), violations);
        }

        RecalculationResult result = new RecalculationResult(
                view.contestId(),
                dryRun,
                !dryRun,
                replay.matches(),
                replay.skipped(),
                changesDetected,
                replay.lastMatchAt(),
                differences,
                violations,
                LeaderboardEntry.rank(recomputed.entries(), view.rosterById(), leaderboardSize));

        if (dryRun) {
            return Future.succeededFuture(result);
        }
        return repository.snapshot()
                .compose(backup -> repository.save(
                        view.file().withContest(view.contestId(), recomputed, clock.instant()), true))
                .map(v -> {
                    LOG.info("Contest {} rewritten from audit log: {} match(es) replayed, {} logo(s) corrected",
                            view.contestId(), replay.matches(), differences.size());
                    return result;
                });
    }

    private record Replay(RatingState state, int matches, int skipped, Instant lastMatchAt) {
    }

    private Replay replay(String contestId, List<AuditEvent> events) {
        RatingState state = RatingState.empty();
        int matches = 0;
        int skipped = 0;
        long lastMatch = Long.MIN_VALUE;

        for (AuditEvent event : events) {
            if (event instanceof VoteRecorded vote) {
                if (vote.winner() == null || vote.loser() == null
                        || vote.winner().id() == null || vote.loser().id() == null) {
                    LOG.warn("Skipping vote event {} in {}: missing participant", vote.id(), contestId);
                    skipped++;
                    continue;
                }
                try {
                    MatchRecord record = new MatchRecord(vote.winner().id(), vote.loser().id(),
                            vote.matchTimestamp(), vote.voterHash());
                    state = engine.applyMatch(state, record, RatingEngine.HISTORY_LIMIT);
                } catch (IllegalArgumentException e) {
                    LOG.warn("Skipping vote event {} in {}: {}", vote.id(), contestId, e.getMessage());
                    skipped++;
                    continue;
                }
                matches++;
                lastMatch = Math.max(lastMatch, vote.matchTimestamp());
            } else if (event instanceof VotesReset reset) {
                LOG.debug("Replay of {} reset at {} ({} match(es) discarded)",
                        contestId, reset.occurredAt(), reset.previousMatchCount());
                state = RatingState.empty();
                matches = 0;
                lastMatch = Long.MIN_VALUE;
            } else {
                throw new IllegalStateException("Unhandled audit event type: " + event.getClass().getName());
            }
        }
        return new Replay(state, matches, skipped,
                lastMatch == Long.MIN_VALUE ? null : Instant.ofEpochMilli(lastMatch));
    }

    private static List<Difference> diff(Map<String, RatingEntry> persisted, Map<String, RatingEntry> recomputed) {
        Set<String> ids = new LinkedHashSet<>(persisted.keySet());
        ids.addAll(recomputed.keySet());

        List<Difference> differences = new ArrayList<>();
        for (String id : ids) {
            RatingEntry before = persisted.getOrDefault(id, RatingEntry.defaults());
            RatingEntry after = recomputed.getOrDefault(id, RatingEntry.defaults());
            Difference difference = Difference.between(id, before, after);
            if (difference != null) {
                differences.add(difference);
            }
        }
        return differences;
    }
}
