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

import dev.mars.arena.core.exceptions.VoteValidationException;
import dev.mars.arena.core.model.LogoEntry;
import dev.mars.arena.core.model.MatchRecord;
import dev.mars.arena.core.model.Matchup;
import dev.mars.arena.core.model.RatingEntry;
import dev.mars.arena.core.model.RatingState;
import dev.mars.arena.core.rating.RatingEngine;
import dev.mars.arena.ledger.audit.AuditLog;
import dev.mars.arena.ledger.audit.ParticipantSnapshot;
import dev.mars.arena.ledger.audit.VoteRecorded;
import dev.mars.arena.ledger.audit.VotesReset;
import dev.mars.arena.ledger.observability.LedgerMetrics;
import io.vertx.core.Future;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.UUID;

/**
 * Owns the canonical per-contest rating state.
 *
 * <p>Every operation resolves the contest, lines its ledger up with the active roster and, where
 * it changes anything, persists through {@link VotesRepository} and records the change in the
 * {@link AuditLog}. Operations are queued on a {@link LedgerSequencer} so read-modify-write
 * sequences never overlap within the process.</p>
 *
 * <p>Data discarding writes (a reset, or pruning logos that left the roster) are preceded by a
 * forced backup of the current file.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-02-04
 * @version 1.0
 */
public class VoteStore {

    private static final Logger LOG = LoggerFactory.getLogger(VoteStore.class);

    private final ContestLoader loader;
    private final VotesRepository repository;
    private final AuditLog auditLog;
    private final RatingEngine engine;
    private final LedgerSequencer sequencer;
    private final Clock clock;
    private final LedgerMetrics metrics;
    private final int leaderboardSize;

    public VoteStore(ContestLoader loader, VotesRepository repository, AuditLog auditLog, RatingEngine engine,
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

    // =========================================================================
    // Queries
    // =========================================================================

    /**
     * Returns the contest's rating state with an entry for every active logo and nothing else.
     * The aligned state is persisted when it differs from what was stored.
     *
     * @param contestId contest id, null or blank for the active contest
     */
    public Future<RatingState> getLedger(String contestId) {
        return sequencer.submit(() -> alignedView(contestId)).map(ContestView::aligned);
    }

    /**
     * Derives logo count, match count, last match time and the top of the leaderboard.
     */
    public Future<ContestMetrics> getMetrics(String contestId) {
        return sequencer.submit(() -> alignedView(contestId)).map(view -> {
            RatingState state = view.aligned();
            MatchRecord latest = state.latestMatch();
            return new ContestMetrics(
                    view.contestId(),
                    view.roster().size(),
                    state.matchCount(),
                    latest != null ? Instant.ofEpochMilli(latest.timestamp()) : null,
                    LeaderboardEntry.rank(state.entries(), view.rosterById(), leaderboardSize));
        });
    }

    /**
     * Proposes the next pair to vote on, avoiding {@code previous} where possible.
     *
     * @return the pairing, empty when the contest has fewer than two active logos
     */
    public Future<Optional<Matchup>> nextMatchup(String contestId, Matchup previous) {
        return sequencer.submit(() -> alignedView(contestId)).map(view ->
                Optional.ofNullable(engine.produceMatchup(view.rosterIds(), view.aligned().entries(), previous)));
    }

    // =========================================================================
    // Mutations
    // =========================================================================

    /**
     * Applies one vote and records it in the audit log.
     *
     * @return the contest state after the vote
     */
    public Future<RatingState> recordVote(String winnerId, String loserId, String voterHash, String contestId) {
        if (winnerId == null || winnerId.isBlank()) {
            return Future.failedFuture(new VoteValidationException(contestId, "winnerId is required"));
        }
        if (loserId == null || loserId.isBlank()) {
            return Future.failedFuture(new VoteValidationException(contestId, "loserId is required"));
        }
        if (winnerId.equals(loserId)) {
            return Future.failedFuture(new VoteValidationException(contestId,
                    "A logo cannot be voted against itself: " + winnerId));
        }

        return sequencer.submit(() -> loader.load(contestId).<RatingState>compose(view -> {
            Map<String, LogoEntry> roster = view.rosterById();
            for (String id : new String[]{winnerId, loserId}) {
                if (!roster.containsKey(id)) {
                    return Future.failedFuture(new VoteValidationException(view.contestId(),
                            "Logo " + id + " is not an active entry of contest " + view.contestId()));
                }
            }

            RatingState before = view.aligned();
            RatingState after = engine.applyMatch(before, winnerId, loserId, voterHash);
            MatchRecord match = after.latestMatch();
            Instant now = clock.instant();

            VoteRecorded event = new VoteRecorded(
                    UUID.randomUUID().toString(),
                    now,
                    view.contestId(),
                    match.voterHash(),
                    match.timestamp(),
                    after.history().size(),
                    snapshot(winnerId, roster, before, after),
                    snapshot(loserId, roster, before, after));

            return backupIfPruned(view)
                    .compose(v -> repository.save(view.file().withContest(view.contestId(), after, now), false))
                    .compose(v -> auditLog.append(event))
                    .map(v -> {
                        metrics.recordVote(view.contestId());
                        LOG.debug("Vote recorded in {}: {} beat {} ({} -> {})", view.contestId(), winnerId, loserId,
                                before.entryOrDefault(winnerId).rating(), after.entries().get(winnerId).rating());
                        return after;
                    });
        }));
    }

    /**
     * Blanks a contest: every active logo back to {1500, 0, 0, 0} and no history.
     *
     * @param initiator identity of the requester, may be null
     * @return the blank state
     */
    public Future<RatingState> resetContestVotes(String contestId, String initiator) {
        return sequencer.submit(() -> loader.load(contestId).compose(view -> {
            int previousMatchCount = view.aligned().history().size();
            RatingState blank = engine.blankState(view.rosterIds());
            Instant now = clock.instant();
            VotesReset event = new VotesReset(
                    UUID.randomUUID().toString(),
                    now,
                    view.contestId(),
                    MatchRecord.normalizeVoterHash(initiator),
                    VotesReset.MANUAL_RESET,
                    previousMatchCount);

            // The reset event is durable before the ledger is blanked; a failed append leaves the contest intact.
            return repository.snapshot()
                    .compose(backup -> auditLog.append(event))
                    .compose(v -> repository.save(view.file().withContest(view.contestId(), blank, now), true))
                    .map(v -> {
                        metrics.recordReset(view.contestId());
                        LOG.info("Contest {} reset by {}: {} match(es) discarded",
                                view.contestId(), event.initiator() != null ? event.initiator() : "(unknown)",
                                previousMatchCount);
                        return blank;
                    });
        }));
    }

    public Path ledgerFile() {
        return repository.file();
    }

    // =========================================================================
    // Helpers
    // =========================================================================

    /**
     * Loads the contest and writes back the aligned state when aligning changed it. Must run on the sequencer.
     */
    private Future<ContestView> alignedView(String contestId) {
        return loader.load(contestId).<ContestView>compose(view -> {
            if (!view.needsWrite()) {
                return Future.succeededFuture(view);
            }
            LOG.debug("Persisting roster alignment for contest {} ({} entries)",
                    view.contestId(), view.aligned().entries().size());
            return backupIfPruned(view)
                    .compose(v -> repository.save(
                            view.file().withContest(view.contestId(), view.aligned(), clock.instant()), false))
                    .map(v -> view);
        });
    }

    private Future<Void> backupIfPruned(ContestView view) {
        if (!view.pruned()) {
            return Future.succeededFuture();
        }
        LOG.info("Contest {} lost roster entries, taking a backup before pruning", view.contestId());
        return repository.snapshot().mapEmpty();
    }

    private static ParticipantSnapshot snapshot(String id, Map<String, LogoEntry> roster,
                                                RatingState before, RatingState after) {
        RatingEntry previous = before.entryOrDefault(id);
        return ParticipantSnapshot.of(id, roster.get(id), previous, after.entries().get(id));
    }
}
