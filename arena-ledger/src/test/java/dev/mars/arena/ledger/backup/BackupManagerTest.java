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
import dev.mars.arena.ledger.LedgerTestSupport.MutableClock;
import dev.mars.arena.ledger.observability.LedgerMetrics;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for {@link BackupManager}: throttling, retention and restore.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @version 1.0
 * @since 2026-02-05
 */
@DisplayName("BackupManager Tests")
class BackupManagerTest {

    private static final String PREFIX = "votes";

    @TempDir
    Path dir;

    private MutableClock clock;
    private Path source;

    @BeforeEach
    void setUp() throws Exception {
        clock = new MutableClock(Instant.parse("2026-02-05T12:00:00Z"));
        source = dir.resolve("votes.json");
        Files.writeString(source, "{\"version\":2}");
    }

    private BackupManager manager(BackupThrottler throttler, BackupPolicy policy) {
        return new BackupManager(dir.resolve("backups"), throttler, policy,
                new AtomicFileWriter(false), clock, LedgerMetrics.getInstance());
    }

    private BackupManager manager() {
        return manager(new BackupThrottler(), new BackupPolicy(60_000L, 120));
    }

    @Nested
    @DisplayName("Backup")
    class BackupTests {

        @Test
        @DisplayName("backup copies the source into the prefix directory")
        void backup_copiesSource() throws Exception {
            Optional<Path> written = manager().backup(source, PREFIX, false);

            assertTrue(written.isPresent());
            assertEquals(dir.resolve("backups").resolve(PREFIX), written.get().getParent());
            assertTrue(written.get().getFileName().toString()
                    .startsWith(clock.millis() + "-"));
            assertArrayEquals(Files.readAllBytes(source), Files.readAllBytes(written.get()));
        }

        @Test
        @DisplayName("missing source produces no backup")
        void missingSource_isSkipped() throws Exception {
            assertTrue(manager().backup(dir.resolve("absent.json"), PREFIX, true).isEmpty());
            assertTrue(manager().listBackups(PREFIX).isEmpty());
        }

        @Test
        @DisplayName("unforced backups inside the interval are throttled")
        void unforcedBackup_isThrottled() throws Exception {
            BackupManager backups = manager();
            assertTrue(backups.backup(source, PREFIX, false).isPresent());

            clock.advance(Duration.ofSeconds(30));
            assertTrue(backups.backup(source, PREFIX, false).isEmpty());

            clock.advance(Duration.ofSeconds(31));
            assertTrue(backups.backup(source, PREFIX, false).isPresent());
            assertEquals(2, backups.listBackups(PREFIX).size());
        }

        @Test
        @DisplayName("forced backups bypass throttling")
        void forcedBackup_bypassesThrottling() throws Exception {
            BackupManager backups = manager();
            backups.backup(source, PREFIX, false);

            assertTrue(backups.backup(source, PREFIX, true).isPresent());
            assertEquals(2, backups.listBackups(PREFIX).size());
        }

        @Test
        @DisplayName("throttling is seeded from backups already on disk")
        void throttler_isSeededFromDisk() throws Exception {
            manager().backup(source, PREFIX, false);

            // A fresh throttler, as after a restart.
            BackupManager restarted = manager();
            clock.advance(Duration.ofSeconds(10));

            assertTrue(restarted.backup(source, PREFIX, false).isEmpty());
        }

        @Test
        @DisplayName("prefixes are throttled independently")
        void prefixes_areIndependent() throws Exception {
            BackupManager backups = manager();
            backups.backup(source, PREFIX, false);

            assertTrue(backups.backup(source, "merged", false).isPresent());
        }

        @Test
        @DisplayName("only the newest backups are retained")
        void retention_keepsNewest() throws Exception {
            BackupManager backups = manager(new BackupThrottler(), new BackupPolicy(0L, 3));
            for (int i = 0; i < 5; i++) {
                backups.backup(source, PREFIX, false);
                clock.advance(Duration.ofSeconds(1));
            }

            List<BackupManager.BackupFile> kept = backups.listBackups(PREFIX);
            assertEquals(3, kept.size());
            assertEquals(clock.millis() - 1000, kept.get(0).timestamp());
            assertEquals(clock.millis() - 3000, kept.get(2).timestamp());
        }

        @Test
        @DisplayName("files not named like backups are ignored")
        void foreignFiles_areIgnored() throws Exception {
            BackupManager backups = manager();
            backups.backup(source, PREFIX, false);
            Files.writeString(dir.resolve("backups").resolve(PREFIX).resolve("notes.txt"), "hello");
            Files.writeString(dir.resolve("backups").resolve(PREFIX).resolve("123.json.tmp"), "{}");

            assertEquals(1, backups.listBackups(PREFIX).size());
        }
    }

    @Nested
    @DisplayName("Restore")
    class RestoreTests {

        @Test
        @DisplayName("restore uses the newest backup that validates")
        void restore_skipsInvalidBackups() throws Exception {
            BackupManager backups = manager();
            Path prefixDir = dir.resolve("backups").resolve(PREFIX);
            Files.createDirectories(prefixDir);
            Files.writeString(prefixDir.resolve("1000-a.json"), "old-good");
            Files.writeString(prefixDir.resolve("2000-b.json"), "newer-good");
            Files.writeString(prefixDir.resolve("3000-c.json"), "newest-bad");

            boolean restored = backups.restoreLatestBackup(PREFIX, source,
                    bytes -> new String(bytes, StandardCharsets.UTF_8).endsWith("good"));

            assertTrue(restored);
            assertEquals("newer-good", Files.readString(source));
        }

        @Test
        @DisplayName("restore reports false when nothing validates")
        void restore_withoutValidBackup() throws Exception {
            BackupManager backups = manager();
            backups.backup(source, PREFIX, true);
            Files.writeString(source, "corrupt");

            assertFalse(backups.restoreLatestBackup(PREFIX, source, bytes -> false));
            assertEquals("corrupt", Files.readString(source));
        }
    }
}
