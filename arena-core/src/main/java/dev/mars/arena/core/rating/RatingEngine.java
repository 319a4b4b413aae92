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

package dev.mars.arena.core.rating;

import dev.mars.arena.core.model.MatchRecord;
import dev.mars.arena.core.model.Matchup;
import dev.mars.arena.core.model.RatingEntry;
import dev.mars.arena.core.model.RatingState;

import java.time.Clock;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Elo rating engine for pairwise logo votes.
 *
 * <p>The engine performs no I/O and never mutates its input: every operation returns a new
 * {@link RatingState}, or the very same instance when nothing changed so callers can skip
 * redundant persistence with a reference comparison.</p>
 *
 * <h2>Update rule</h2>
 * <pre>
 *   E_a = 1 / (1 + 10^((R_b - R_a) / 400))
 *   R_winner' = R_winner + K * (1 - E_winner)
 *   R_loser'  = R_loser  + K * (0 - E_loser)
 * </pre>
 * <p>Since {@code E_winner + E_loser == 1} the two deltas always cancel.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-02-02
 * @version 1.0
 */
public final class RatingEngine {

    public static final double K_FACTOR = 32.0;
    public static final int HISTORY_LIMIT = 1000;

    private static final Comparator<Map.Entry<String, RatingEntry>> PRIMARY_ORDER =
            Comparator.<Map.Entry<String, RatingEntry>>comparingInt(e -> e.getValue().matches())
                    .thenComparingDouble(e -> e.getValue().rating());

    private final Clock clock;

    public RatingEngine() {
        this(Clock.systemUTC());
    }

    public RatingEngine(Clock clock) {
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    /**
     * Expected score of a player rated {@code ratingA} against one rated {@code ratingB}.
     */
    public static double expectedScore(double ratingA, double ratingB) {
        return 1.0 / (1.0 + Math.pow(10.0, (ratingB - ratingA) / 400.0));
    }

    // =========================================================================
    // Match application
    // =========================================================================

    /**
     * Applies a vote cast now, keeping at most {@link #HISTORY_LIMIT} history records.
     *
     * @param state     current state
     * @param winnerId  id of the winning entity
     * @param loserId   id of the losing entity
     * @param voterHash optional voter fingerprint, trimmed and blank mapped to null
     * @return the updated state
     * @throws IllegalArgumentException if an id is blank or both ids are equal
     */
    public RatingState applyMatch(RatingState state, String winnerId, String loserId, String voterHash) {
        requireParticipants(winnerId, loserId);
        MatchRecord record = new MatchRecord(winnerId, loserId, clock.millis(), voterHash);
        return applyMatch(state, record, HISTORY_LIMIT);
    }

    /**
     * Applies a previously recorded match using its own timestamp. Used by replay and merge.
     *
     * @param historyLimit maximum history length to keep; zero or negative keeps everything
     */
    public RatingState applyMatch(RatingState state, MatchRecord record, int historyLimit) {
        requireParticipants(record.winnerId(), record.loserId());

        RatingEntry winner = state.entryOrDefault(record.winnerId());
        RatingEntry loser = state.entryOrDefault(record.loserId());

        double expectedWinner = expectedScore(winner.rating(), loser.rating());
        double expectedLoser = expectedScore(loser.rating(), winner.rating());

        Map<String, RatingEntry> entries = new LinkedHashMap<>(state.entries());
        entries.put(record.winnerId(), winner.win(winner.rating() + K_FACTOR * (1.0 - expectedWinner)));
        entries.put(record.loserId(), loser.loss(loser.rating() + K_FACTOR * (0.0 - expectedLoser)));

        List<MatchRecord> history = new ArrayList<>(state.history().size() + 1);
        history.add(record);
        history.addAll(state.history());
        if (historyLimit > 0 && history.size() > historyLimit) {
            history = history.subList(0, historyLimit);
        }
        return new RatingState(entries, history);
    }

    // =========================================================================
    // Roster alignment
    // =========================================================================

    /**
     * Adds a default entry for every roster id lacking one.
     *
     * @return the same instance when every roster id already had an entry
     */
    public RatingState ensureEntries(RatingState state, Collection<String> rosterIds) {
        Map<String, RatingEntry> entries = null;
        for (String id : rosterIds) {
            if (!state.entries().containsKey(id) && (entries == null || !entries.containsKey(id))) {
                if (entries == null) {
                    entries = new LinkedHashMap<>(state.entries());
                }
                entries.put(id, RatingEntry.defaults());
            }
        }
        return entries == null ? state : new RatingState(entries, state.history());
    }

    /**
     * Removes entries and history records that reference ids outside the roster.
     *
     * @return the same instance when nothing referenced a removed id
     */
    public RatingState pruneEntries(RatingState state, Collection<String> rosterIds) {
        Set<String> roster = new HashSet<>(rosterIds);

        Map<String, RatingEntry> entries = new LinkedHashMap<>(state.entries());
        boolean entriesChanged = entries.keySet().removeIf(id -> !roster.contains(id));

        List<MatchRecord> history = new ArrayList<>(state.history().size());
        for (MatchRecord record : state.history()) {
            if (roster.contains(record.winnerId()) && roster.contains(record.loserId())) {
                history.add(record);
            }
        }
        boolean historyChanged = history.size() != state.history().size();

        if (!entriesChanged && !historyChanged) {
            return state;
        }
        return new RatingState(entries, history);
    }

    /**
     * Builds the state a contest starts from: a default entry per roster id and no history.
     */
    public RatingState blankState(Collection<String> rosterIds) {
        return ensureEntries(RatingState.empty(), rosterIds);
    }

    // =========================================================================
    // Matchmaking
    // =========================================================================

    /**
     * Picks the next pair to compare.
     *
     * <p>The least exposed entity (fewest matches, then lowest rating) becomes the primary and
     * is paired with the challenger closest in rating, ties going to the challenger with fewer
     * matches and then to the one listed first in the roster. A pairing equal to {@code previous} in either orientation is skipped; when every
     * pairing equals it the first pairing considered is returned.</p>
     *
     * @param rosterIds active entity ids
     * @param entries   current rating entries, missing ids count as defaults
     * @param previous  the pairing shown last, may be null
     * @return the next pairing, or {@code null} when fewer than two entities are available
     */
    public Matchup produceMatchup(List<String> rosterIds, Map<String, RatingEntry> entries, Matchup previous) {
        List<String> distinct = new ArrayList<>(new LinkedHashSet<>(rosterIds));
        if (distinct.size() < 2) {
            return null;
        }

        List<Map.Entry<String, RatingEntry>> candidates = new ArrayList<>(distinct.size());
        for (String id : distinct) {
            RatingEntry entry = entries.get(id);
            candidates.add(Map.entry(id, entry != null ? entry : RatingEntry.defaults()));
        }
        List<Map.Entry<String, RatingEntry>> inRosterOrder = List.copyOf(candidates);
        candidates.sort(PRIMARY_ORDER);

        Matchup fallback = null;
        for (Map.Entry<String, RatingEntry> primary : candidates) {
            double primaryRating = primary.getValue().rating();
            // Stable sort: full ties keep roster order.
            List<Map.Entry<String, RatingEntry>> challengers = new ArrayList<>(inRosterOrder);
            challengers.removeIf(e -> e.getKey().equals(primary.getKey()));
            challengers.sort(Comparator
                    .<Map.Entry<String, RatingEntry>>comparingDouble(
                            e -> Math.abs(e.getValue().rating() - primaryRating))
                    .thenComparingInt(e -> e.getValue().matches()));

            for (Map.Entry<String, RatingEntry> challenger : challengers) {
                Matchup candidate = new Matchup(primary.getKey(), challenger.getKey());
                if (fallback == null) {
                    fallback = candidate;
                }
                if (!candidate.samePairAs(previous)) {
                    return candidate;
                }
            }
        }
        return fallback;
    }

    private static void requireParticipants(String winnerId, String loserId) {
        if (winnerId == null || winnerId.isBlank()) {
            throw new IllegalArgumentException("winnerId is required");
        }
        if (loserId == null || loserId.isBlank()) {
            throw new IllegalArgumentException("loserId is required");
        }
        if (winnerId.equals(loserId)) {
            throw new IllegalArgumentException("winnerId and loserId must differ: " + winnerId);
        }
    }
}
