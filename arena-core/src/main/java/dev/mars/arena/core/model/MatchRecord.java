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

package dev.mars.arena.core.model;

import java.util.Comparator;
import java.util.Objects;

/**
 * A single recorded pairwise result.
 *
 * @param winnerId  id of the winning entity
 * @param loserId   id of the losing entity
 * @param timestamp epoch millis at which the vote was cast
 * @param voterHash opaque voter fingerprint, {@code null} when unknown
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-02-02
 * @version 1.0
 */
public record MatchRecord(String winnerId, String loserId, long timestamp, String voterHash) {

    /**
     * Deterministic replay order: timestamp, winner, loser, then voter hash (null as empty).
     */
    public static final Comparator<MatchRecord> REPLAY_ORDER = Comparator
            .comparingLong(MatchRecord::timestamp)
            .thenComparing(MatchRecord::winnerId)
            .thenComparing(MatchRecord::loserId)
            .thenComparing(record -> record.voterHash() == null ? "" : record.voterHash());

    public MatchRecord {
        Objects.requireNonNull(winnerId, "winnerId");
        Objects.requireNonNull(loserId, "loserId");
        voterHash = normalizeVoterHash(voterHash);
    }

    /**
     * Trims a voter hash, mapping null or blank input to {@code null}.
     */
    public static String normalizeVoterHash(String voterHash) {
        if (voterHash == null) {
            return null;
        }
        String trimmed = voterHash.trim();
        return trimmed.isEmpty() ? null : trimmed;
    }

    public boolean involves(String entityId) {
        return winnerId.equals(entityId) || loserId.equals(entityId);
    }

    /**
     * Key used to detect the same vote appearing in more than one export.
     */
    public String dedupeKey() {
        return timestamp + "|" + winnerId + "|" + loserId + "|" + (voterHash == null ? "" : voterHash);
    }
}
