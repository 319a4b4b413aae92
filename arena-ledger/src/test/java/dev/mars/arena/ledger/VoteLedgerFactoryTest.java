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

import com.fasterxml.jackson.core.Version;
import dev.mars.arena.core.model.RatingState;
import dev.mars.arena.ledger.LedgerTestSupport.MutableClock;
import dev.mars.arena.ledger.backup.BackupThrottler;
import dev.mars.arena.ledger.roster.FileContestRegistry;
import dev.mars.arena.ledger.roster.FileLogoCatalog;
import io.vertx.core.Vertx;
import io.vertx.junit5.VertxExtension;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.Set;

import static dev.mars.arena.ledger.LedgerTestSupport.await;
import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for {@link VoteLedgerFactory} wiring over file-backed catalog and registry files.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-02-05
 */
@ExtendWith(VertxExtension.class)
@DisplayName("VoteLedgerFactory Tests")
class VoteLedgerFactoryTest {

    @TempDir
    Path dataDir;

    @Test
    @DisplayName("file-backed ledger resolves the active contest and records votes")
    void fileBackedLedger_recordsVotes(Vertx vertx) throws Exception {
        Files.writeString(dataDir.resolve(FileLogoCatalog.FILE_NAME), """
                {"logos": [
                  {"id": "A", "contestId": "autumn", "name": "Acorn"},
                  {"id": "B", "contestId": "autumn", "name": "Birch"},
                  {"id": "C", "contestId": "autumn", "name": "Cedar", "removedAt": "2026-01-01T00:00:00Z"}
                ]}
                """);
        Files.writeString(dataDir.resolve(FileContestRegistry.FILE_NAME), """
                {"activeContestId": "autumn", "contests": [{"id": "badge-arena"}, {"id": "autumn"}]}
                """);
        VoteLedger ledger = VoteLedgerFactory.create(vertx, LedgerTestSupport.config(dataDir),
                new MutableClock(Instant.parse("2026-02-05T12:00:00Z")), new BackupThrottler());

        await(ledger.voteStore().recordVote("A", "B", null, null));
        RatingState state = await(ledger.voteStore().getLedger("autumn"));

        assertEquals(Set.of("A", "B"), state.entries().keySet());
        assertEquals(1516.0, state.entries().get("A").rating(), 1e-9);
        assertEquals(1, await(ledger.auditLog().readForContest("autumn")).size());
        assertTrue(Files.exists(dataDir.resolve(VotesRepository.FILE_NAME)));
    }

    @Test
    @DisplayName("Jackson core, databind and the time module resolve to one version")
    void jacksonModules_shareOneVersion() {
        Version databind = com.fasterxml.jackson.databind.cfg.PackageVersion.VERSION;

        assertEquals(databind, com.fasterxml.jackson.core.json.PackageVersion.VERSION);
        assertEquals(databind, com.fasterxml.jackson.datatype.jsr310.PackageVersion.VERSION);
    }
}
