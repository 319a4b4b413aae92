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

package dev.mars.arena.ledger.audit;

import com.fasterxml.jackson.annotation.JsonTypeName;

import java.time.Instant;

/**
 * A vote applied to a contest ledger.
 *
 * @param id                 unique event id
 * @param occurredAt         when the event was written
 * @param contestId          contest the vote belongs to
 * @param voterHash          voter fingerprint, may be null
 * @param matchTimestamp     epoch millis stored on the match record
 * @param matchHistoryLength history length after the vote was applied
 * @param winner             winner before/after
 * @param loser              loser before/after
 */
@JsonTypeName(VoteRecorded.TYPE)
public record VoteRecorded(
        String id,
        Instant occurredAt,
        String contestId,
        String voterHash,
        long matchTimestamp,
        int matchHistoryLength,
        ParticipantSnapshot winner,
        ParticipantSnapshot loser) implements AuditEvent {

    public static final String TYPE = "vote-recorded";
}
