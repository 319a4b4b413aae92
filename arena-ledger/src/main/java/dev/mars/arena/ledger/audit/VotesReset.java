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
 * A contest ledger blanked back to default ratings.
 *
 * @param id                 unique event id
 * @param occurredAt         when the reset happened
 * @param contestId          contest that was reset
 * @param initiator          identity of whoever requested the reset, may be null
 * @param reason             reset reason, {@value #MANUAL_RESET} for administrator resets
 * @param previousMatchCount history length discarded by the reset
 */
@JsonTypeName(VotesReset.TYPE)
public record VotesReset(
        String id,
        Instant occurredAt,
        String contestId,
        String initiator,
        String reason,
        int previousMatchCount) implements AuditEvent {

    public static final String TYPE = "votes-reset";
    public static final String MANUAL_RESET = "manual-reset";
}
