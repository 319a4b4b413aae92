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

import java.util.List;

/**
 * Events read from the audit log plus the lines that could not be decoded.
 *
 * @param events   decoded events in file order
 * @param rejected undecodable lines
 */
public record AuditLogSnapshot(List<AuditEvent> events, List<RejectedLine> rejected) {

    public AuditLogSnapshot {
        events = List.copyOf(events);
        rejected = List.copyOf(rejected);
    }

    /**
     * A line of the log that failed to decode.
     *
     * @param lineNumber 1-based line number
     * @param reason     decoder message
     */
    public record RejectedLine(long lineNumber, String reason) {
    }
}
