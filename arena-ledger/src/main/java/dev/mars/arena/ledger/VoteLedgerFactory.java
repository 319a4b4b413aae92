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

import com.fasterxml.jackson.databind.ObjectMapper;
import dev.mars.arena.core.codec.JsonSupport;
import dev.mars.arena.core.codec.LogoCatalogCodec;
import dev.mars.arena.core.codec.VotesFileCodec;
import dev.mars.arena.core.rating.RatingEngine;
import dev.mars.arena.core.storage.AtomicFileWriter;
import dev.mars.arena.ledger.audit.AuditLog;
import dev.mars.arena.ledger.backup.BackupManager;
import dev.mars.arena.ledger.backup.BackupPolicy;
import dev.mars.arena.ledger.backup.BackupThrottler;
import dev.mars.arena.ledger.config.LedgerConfig;
import dev.mars.arena.ledger.observability.LedgerMetrics;
import dev.mars.arena.ledger.reconcile.Reconciler;
import dev.mars.arena.ledger.roster.ContestRegistry;
import dev.mars.arena.ledger.roster.FileContestRegistry;
import dev.mars.arena.ledger.roster.FileLogoCatalog;
import dev.mars.arena.ledger.roster.LogoCatalog;
import io.vertx.core.Vertx;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.time.Clock;

/**
 * Factory wiring a {@link VoteLedger} over a data directory.
 *
 * <p>Layout of the data directory:</p>
 * <ul>
 *   <li>{@code votes.json} - per-contest ledgers</li>
 *   <li>{@code vote-events.ndjson} - audit log</li>
 *   <li>{@code backups/votes/} - ledger snapshots</li>
 *   <li>{@code logos.json}, {@code contests.json} - catalog and registry files, read only</li>
 * </ul>
 *
 * <p>The {@link VoteStore} and {@link Reconciler} share one {@link LedgerSequencer}; the
 * {@link BackupThrottler} should be shared by every ledger created in the same process.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @version 1.0
 * @since 2026-02-05
 */
public final class VoteLedgerFactory {

    private static final Logger LOG = LoggerFactory.getLogger(VoteLedgerFactory.class);

    private VoteLedgerFactory() {
        // Utility class
    }

    /**
     * Creates a ledger from configuration using the file-backed catalog and registry.
     */
    public static VoteLedger create(Vertx vertx, LedgerConfig config) {
        return create(vertx, config, Clock.systemUTC(), new BackupThrottler());
    }

    public static VoteLedger create(Vertx vertx, LedgerConfig config, Clock clock, BackupThrottler throttler) {
        ObjectMapper mapper = JsonSupport.newObjectMapper();
        Path dataDir = config.getDataDir();
        LogoCatalog catalog = new FileLogoCatalog(vertx, dataDir.resolve(FileLogoCatalog.FILE_NAME),
                new LogoCatalogCodec(mapper, config.getDefaultContestId()));
        ContestRegistry registry = new FileContestRegistry(vertx, dataDir.resolve(FileContestRegistry.FILE_NAME),
                mapper, config.getDefaultContestId());
        return create(vertx, config, clock, throttler, catalog, registry, mapper);
    }

    /**
     * Creates a ledger with caller-supplied collaborators.
     *
     * @param vertx     the Vert.x instance running blocking file I/O
     * @param config    ledger configuration
     * @param clock     time source for match timestamps, events and backups
     * @param throttler process-wide backup throttler
     * @param catalog   active roster source
     * @param registry  contest id resolution
     */
    public static VoteLedger create(Vertx vertx, LedgerConfig config, Clock clock, BackupThrottler throttler,
                                    LogoCatalog catalog, ContestRegistry registry) {
        return create(vertx, config, clock, throttler, catalog, registry, JsonSupport.newObjectMapper());
    }

    static VoteLedger create(Vertx vertx, LedgerConfig config, Clock clock, BackupThrottler throttler,
                             LogoCatalog catalog, ContestRegistry registry, ObjectMapper mapper) {
        Path dataDir = config.getDataDir();
        LedgerMetrics metrics = LedgerMetrics.getInstance();
        AtomicFileWriter writer = new AtomicFileWriter(config.isFsyncEnabled());
        BackupPolicy policy = new BackupPolicy(config.getBackupMinIntervalMs(), config.getBackupMaxRetained());

        BackupManager backups = new BackupManager(dataDir.resolve("backups"), throttler, policy, writer, clock, metrics);
        VotesFileCodec codec = new VotesFileCodec(mapper, config.getDefaultContestId());
        VotesRepository repository = new VotesRepository(vertx, dataDir.resolve(VotesRepository.FILE_NAME),
                codec, writer, backups, clock, metrics);
        AuditLog auditLog = new AuditLog(vertx, dataDir.resolve(AuditLog.FILE_NAME), mapper,
                config.isFsyncEnabled());

        RatingEngine engine = new RatingEngine(clock);
        LedgerSequencer sequencer = new LedgerSequencer();
        ContestLoader loader = new ContestLoader(registry, catalog, repository, engine);

        VoteStore voteStore = new VoteStore(loader, repository, auditLog, engine, sequencer, clock, metrics,
                config.getLeaderboardSize());
        Reconciler reconciler = new Reconciler(loader, repository, auditLog, engine, sequencer, clock, metrics,
                config.getLeaderboardSize());

        LOG.info("Vote ledger created: dataDir={}, fsync={}, backupInterval={}ms, backupsRetained={}",
                dataDir.toAbsolutePath(), config.isFsyncEnabled(), policy.minIntervalMs(), policy.maxRetained());
        return new VoteLedger(voteStore, reconciler, auditLog, backups);
    }
}
