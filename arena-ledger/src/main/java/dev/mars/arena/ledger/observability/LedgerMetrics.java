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

package dev.mars.arena.ledger.observability;

import io.opentelemetry.api.GlobalOpenTelemetry;
import io.opentelemetry.api.common.AttributeKey;
import io.opentelemetry.api.common.Attributes;
import io.opentelemetry.api.metrics.LongCounter;
import io.opentelemetry.api.metrics.Meter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * OpenTelemetry metrics for the vote ledger.
 *
 * <p>Provides the following metrics:
 * <ul>
 *   <li>arena.votes.recorded (counter) - Votes applied and persisted, per contest</li>
 *   <li>arena.votes.reset (counter) - Contest resets, per contest</li>
 *   <li>arena.backups.written (counter) - Backup snapshots written, per prefix</li>
 *   <li>arena.backups.skipped (counter) - Backups skipped by throttling or copy failure, per prefix and reason</li>
 *   <li>arena.backups.restored (counter) - Primary files restored from a backup</li>
 *   <li>arena.reconcile.drift (counter) - Entities whose replayed entry differs from the ledger</li>
 * </ul>
 *
 * <p>Without an OpenTelemetry SDK registered globally every counter is a no-op.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @version 1.0
 * @since 2026-02-03
 */
public class LedgerMetrics {

    private static final Logger logger = LoggerFactory.getLogger(LedgerMetrics.class);
    private static final String METER_NAME = "badge-arena-ledger";

    private static LedgerMetrics instance;

    private final LongCounter votesRecordedCounter;
    private final LongCounter votesResetCounter;
    private final LongCounter backupsWrittenCounter;
    private final LongCounter backupsSkippedCounter;
    private final LongCounter backupsRestoredCounter;
    private final LongCounter driftCounter;

    private static final AttributeKey<String> CONTEST_KEY = AttributeKey.stringKey("contest.id");
    private static final AttributeKey<String> PREFIX_KEY = AttributeKey.stringKey("backup.prefix");
    private static final AttributeKey<String> REASON_KEY = AttributeKey.stringKey("reason");

    private LedgerMetrics() {
        Meter meter = GlobalOpenTelemetry.getMeter(METER_NAME);

        votesRecordedCounter = meter.counterBuilder("arena.votes.recorded")
                .setDescription("Total number of votes applied to a contest ledger")
                .setUnit("1")
                .build();

        votesResetCounter = meter.counterBuilder("arena.votes.reset")
                .setDescription("Total number of contest vote resets")
                .setUnit("1")
                .build();

        backupsWrittenCounter = meter.counterBuilder("arena.backups.written")
                .setDescription("Total number of backup snapshots written")
                .setUnit("1")
                .build();

        backupsSkippedCounter = meter.counterBuilder("arena.backups.skipped")
                .setDescription("Total number of backups skipped")
                .setUnit("1")
                .build();

        backupsRestoredCounter = meter.counterBuilder("arena.backups.restored")
                .setDescription("Total number of primary files restored from backup")
                .setUnit("1")
                .build();

        driftCounter = meter.counterBuilder("arena.reconcile.drift")
                .setDescription("Entities whose replayed rating differs from the persisted ledger")
                .setUnit("1")
                .build();

        logger.info("LedgerMetrics initialized");
    }

    /**
     * Gets the singleton LedgerMetrics instance.
     */
    public static synchronized LedgerMetrics getInstance() {
        if (instance == null) {
            instance = new LedgerMetrics();
        }
        return instance;
    }

    public void recordVote(String contestId) {
        votesRecordedCounter.add(1, Attributes.of(CONTEST_KEY, contestId));
    }

    public void recordReset(String contestId) {
        votesResetCounter.add(1, Attributes.of(CONTEST_KEY, contestId));
    }

    public void recordBackupWritten(String prefix) {
        backupsWrittenCounter.add(1, Attributes.of(PREFIX_KEY, prefix));
    }

    /**
     * Records a skipped backup.
     *
     * @param prefix backup prefix
     * @param reason "throttled" or "failed"
     */
    public void recordBackupSkipped(String prefix, String reason) {
        backupsSkippedCounter.add(1, Attributes.of(PREFIX_KEY, prefix, REASON_KEY, reason));
    }

    public void recordRestore(String prefix) {
        backupsRestoredCounter.add(1, Attributes.of(PREFIX_KEY, prefix));
    }

    public void recordDrift(String contestId, int entities) {
        if (entities > 0) {
            driftCounter.add(entities, Attributes.of(CONTEST_KEY, contestId));
        }
    }
}
