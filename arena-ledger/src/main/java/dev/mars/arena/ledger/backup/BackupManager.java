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

package dev.mars.arena.ledger.backup;

import dev.mars.arena.core.storage.AtomicFileWriter;
import dev.mars.arena.ledger.observability.LedgerMetrics;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.time.Clock;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.UUID;
import java.util.function.Predicate;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Point-in-time snapshots of ledger files under {@code backups/<prefix>/}.
 *
 * <p>Backup files are named {@code <epochMillis>-<uuid>.json}; the embedded timestamp orders
 * them for retention and restore. Snapshots are themselves written through
 * {@link AtomicFileWriter}, so a crash never leaves a truncated backup behind.</p>
 *
 * <p>All methods perform blocking I/O.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-02-03
 * @version 1.0
 */
public class BackupManager {

    private static final Logger LOG = LoggerFactory.getLogger(BackupManager.class);
    private static final Pattern BACKUP_NAME = Pattern.compile("^(\\d+)-[^.]+\\.json$");

    private final Path backupRoot;
    private final BackupThrottler throttler;
    private final BackupPolicy policy;
    private final AtomicFileWriter writer;
    private final Clock clock;
    private final LedgerMetrics metrics;

    public BackupManager(Path backupRoot, BackupThrottler throttler, BackupPolicy policy,
                         AtomicFileWriter writer, Clock clock, LedgerMetrics metrics) {
        this.backupRoot = Objects.requireNonNull(backupRoot, "backupRoot");
        this.throttler = Objects.requireNonNull(throttler, "throttler");
        this.policy = Objects.requireNonNull(policy, "policy");
        this.writer = Objects.requireNonNull(writer, "writer");
        this.clock = Objects.requireNonNull(clock, "clock");
        this.metrics = Objects.requireNonNull(metrics, "metrics");
    }

    /**
     * A backup file and the timestamp embedded in its name.
     */
    public record BackupFile(Path path, long timestamp) {
    }

    /**
     * Copies {@code source} into the prefix directory unless throttled.
     *
     * @param source file to snapshot
     * @param prefix backup family, e.g. {@code votes}
     * @param force  bypass throttling
     * @return the written backup, or empty when throttled or when {@code source} does not exist
     * @throws IOException if the copy fails
     */
    public Optional<Path> backup(Path source, String prefix, boolean force) throws IOException {
        if (!Files.exists(source)) {
            LOG.debug("Skipping backup of {}: file does not exist", source);
            return Optional.empty();
        }

        List<BackupFile> existing = listBackups(prefix);
        if (!existing.isEmpty()) {
            throttler.seedIfAbsent(prefix, existing.get(0).timestamp());
        }

        long now = clock.millis();
        if (!force && throttler.isThrottled(prefix, now, policy.minIntervalMs())) {
            LOG.debug("Backup of {} throttled (prefix={}, last={})",
                    source, prefix, throttler.lastBackupAt(prefix).orElse(-1L));
            metrics.recordBackupSkipped(prefix, "throttled");
            return Optional.empty();
        }

        Path target = backupRoot.resolve(prefix).resolve(now + "-" + UUID.randomUUID() + ".json");
        writer.write(target, Files.readAllBytes(source));
        throttler.record(prefix, now);
        metrics.recordBackupWritten(prefix);
        LOG.debug("Backup written: {} (forced={})", target, force);

        pruneBackups(prefix);
        return Optional.of(target);
    }

    /**
     * Lists backups for a prefix, newest first.
     */
    public List<BackupFile> listBackups(String prefix) throws IOException {
        Path dir = backupRoot.resolve(prefix);
        List<BackupFile> backups = new ArrayList<>();
        if (!Files.isDirectory(dir)) {
            return backups;
        }
        try (DirectoryStream<Path> stream = Files.newDirectoryStream(dir)) {
            for (Path path : stream) {
                Matcher matcher = BACKUP_NAME.matcher(path.getFileName().toString());
                if (matcher.matches() && Files.isRegularFile(path)) {
                    backups.add(new BackupFile(path, Long.parseLong(matcher.group(1))));
                }
            }
        }
        backups.sort(Comparator.comparingLong(BackupFile::timestamp)
                .thenComparing(b -> b.path().getFileName().toString())
                .reversed());
        return backups;
    }

    /**
     * Restores the newest backup whose content passes {@code validator} over {@code destination}.
     *
     * @return true if a backup was restored
     */
    public boolean restoreLatestBackup(String prefix, Path destination, Predicate<byte[]> validator)
            throws IOException {
        for (BackupFile backup : listBackups(prefix)) {
            byte[] content;
            try {
                content = Files.readAllBytes(backup.path());
            } catch (NoSuchFileException e) {
                LOG.warn("Backup {} disappeared before it could be read", backup.path());
                continue;
            }
            if (!validator.test(content)) {
                LOG.warn("Backup {} failed validation, trying an older one", backup.path());
                continue;
            }
            writer.write(destination, content);
            metrics.recordRestore(prefix);
            LOG.info("Restored {} from backup {}", destination, backup.path());
            return true;
        }
        LOG.warn("No valid backup available to restore {} (prefix={})", destination, prefix);
        return false;
    }

    private void pruneBackups(String prefix) throws IOException {
        if (policy.maxRetained() <= 0) {
            return;
        }
        List<BackupFile> backups = listBackups(prefix);
        for (int i = policy.maxRetained(); i < backups.size(); i++) {
            Path stale = backups.get(i).path();
            Files.deleteIfExists(stale);
            LOG.debug("Pruned backup {}", stale);
        }
    }
}
