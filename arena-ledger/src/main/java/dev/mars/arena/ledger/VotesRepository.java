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

import com.fasterxml.jackson.databind.JsonNode;
import dev.mars.arena.core.codec.DecodeResult;
import dev.mars.arena.core.codec.RejectedRecord;
import dev.mars.arena.core.codec.VotesFileCodec;
import dev.mars.arena.core.exceptions.LedgerCorruptedException;
import dev.mars.arena.core.model.VotesFile;
import dev.mars.arena.core.storage.AtomicFileWriter;
import dev.mars.arena.ledger.backup.BackupManager;
import dev.mars.arena.ledger.observability.LedgerMetrics;
import io.vertx.core.Future;
import io.vertx.core.Vertx;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.util.Objects;
import java.util.Optional;

/**
 * Loads and saves {@code votes.json} on Vert.x worker threads.
 *
 * <h2>Load</h2>
 * <ul>
 *   <li>Missing file: an empty votes file</li>
 *   <li>Unparsable bytes (including an empty or truncated file): the newest parsable backup is
 *       restored over the primary file and read instead; without one the load fails with
 *       {@link LedgerCorruptedException}</li>
 *   <li>Valid JSON of the wrong shape: snapshotted to the backups and replaced by an empty votes
 *       file, with a warning</li>
 *   <li>Legacy single-contest layout: converted into the default contest and written back</li>
 * </ul>
 *
 * <h2>Save</h2>
 * <p>Atomic write through {@link AtomicFileWriter}, then a backup snapshot. An unforced backup
 * that fails is logged and counted without failing the save; a forced one propagates.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-02-04
 * @version 1.0
 */
public class VotesRepository {

    private static final Logger LOG = LoggerFactory.getLogger(VotesRepository.class);

    public static final String FILE_NAME = "votes.json";
    public static final String BACKUP_PREFIX = "votes";

    private final Vertx vertx;
    private final Path file;
    private final VotesFileCodec codec;
    private final AtomicFileWriter writer;
    private final BackupManager backups;
    private final Clock clock;
    private final LedgerMetrics metrics;

    public VotesRepository(Vertx vertx, Path file, VotesFileCodec codec, AtomicFileWriter writer,
                           BackupManager backups, Clock clock, LedgerMetrics metrics) {
        this.vertx = Objects.requireNonNull(vertx, "vertx");
        this.file = Objects.requireNonNull(file, "file");
        this.codec = Objects.requireNonNull(codec, "codec");
        this.writer = Objects.requireNonNull(writer, "writer");
        this.backups = Objects.requireNonNull(backups, "backups");
        this.clock = Objects.requireNonNull(clock, "clock");
        this.metrics = Objects.requireNonNull(metrics, "metrics");
    }

    public Path file() {
        return file;
    }

    public Future<VotesFile> load() {
        return vertx.executeBlocking(this::loadBlocking, false);
    }

    public Future<Void> save(VotesFile votes, boolean forceBackup) {
        return vertx.executeBlocking(() -> {
            saveBlocking(votes, forceBackup);
            return null;
        }, false);
    }

    /**
     * Takes a forced backup of the current primary file, if there is one. Used before any
     * write that discards data.
     */
    public Future<Optional<Path>> snapshot() {
        return vertx.executeBlocking(() -> backups.backup(file, BACKUP_PREFIX, true), false);
    }

    // =========================================================================
    // Blocking implementation
    // =========================================================================

    private VotesFile loadBlocking() throws IOException, LedgerCorruptedException {
        if (!Files.exists(file)) {
            LOG.debug("No votes file at {}, starting empty", file);
            return VotesFile.empty(clock.instant());
        }

        JsonNode root;
        try {
            root = codec.parse(Files.readAllBytes(file));
        } catch (IOException parseError) {
            LOG.warn("Votes file {} is unreadable ({}), attempting restore from backup",
                    file, parseError.getMessage());
            if (!backups.restoreLatestBackup(BACKUP_PREFIX, file, this::isParsable)) {
                throw new LedgerCorruptedException(file, parseError);
            }
            root = codec.parse(Files.readAllBytes(file));
        }

        DecodeResult<VotesFile> result = codec.decode(root, clock.instant());
        for (RejectedRecord rejected : result.rejected()) {
            LOG.warn("Votes file {}: rejected {}", file.getFileName(), rejected);
        }

        if (!root.isObject()) {
            LOG.warn("Votes file {} does not hold a votes document, falling back to a fresh ledger", file);
            backups.backup(file, BACKUP_PREFIX, true);
        } else if (result.legacy()) {
            LOG.info("Converting legacy votes file {} into contest '{}'", file, codec.defaultContestId());
            backups.backup(file, BACKUP_PREFIX, true);
            writer.write(file, codec.encode(result.value()));
        }
        return result.value();
    }

    private void saveBlocking(VotesFile votes, boolean forceBackup) throws IOException {
        writer.write(file, codec.encode(votes));
        try {
            backups.backup(file, BACKUP_PREFIX, forceBackup);
        } catch (IOException e) {
            if (forceBackup) {
                throw e;
            }
            LOG.warn("Backup of {} failed, continuing without snapshot: {}", file, e.getMessage());
            metrics.recordBackupSkipped(BACKUP_PREFIX, "failed");
        }
    }

    private boolean isParsable(byte[] content) {
        try {
            return codec.parse(content).isObject();
        } catch (IOException e) {
            return false;
        }
    }
}
