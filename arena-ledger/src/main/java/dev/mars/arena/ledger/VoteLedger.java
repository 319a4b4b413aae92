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

import dev.mars.arena.ledger.audit.AuditLog;
import dev.mars.arena.ledger.backup.BackupManager;
import dev.mars.arena.ledger.reconcile.Reconciler;

/**
 * The wired ledger components exposed to the HTTP layer.
 *
 * @param voteStore  ledger reads, votes and resets
 * @param reconciler audit log replay
 * @param auditLog   the vote event log
 * @param backups    backup snapshots of the ledger file
 */
public record VoteLedger(VoteStore voteStore, Reconciler reconciler, AuditLog auditLog, BackupManager backups) {
}
