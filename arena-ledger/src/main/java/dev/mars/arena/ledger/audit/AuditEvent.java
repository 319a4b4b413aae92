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

import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;

import java.time.Instant;

/**
 * Sealed interface for every event written to the vote audit log.
 *
 * <p>Each event carries a unique id, the instant it occurred and the contest it belongs to.
 * The {@code type} property of the JSON form discriminates the variants:</p>
 * <ul>
 *   <li>{@code vote-recorded} - {@link VoteRecorded}</li>
 *   <li>{@code votes-reset} - {@link VotesReset}</li>
 * </ul>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-02-03
 * @version 1.0
 */
@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, include = JsonTypeInfo.As.PROPERTY, property = "type")
@JsonSubTypes({
        @JsonSubTypes.Type(value = VoteRecorded.class, name = VoteRecorded.TYPE),
        @JsonSubTypes.Type(value = VotesReset.class, name = VotesReset.TYPE)
})
public sealed interface AuditEvent permits VoteRecorded, VotesReset {

    String id();

    Instant occurredAt();

    String contestId();
}
