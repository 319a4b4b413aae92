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

package dev.mars.arena.ledger.roster;

import dev.mars.arena.core.codec.JsonSupport;
import dev.mars.arena.core.exceptions.ContestNotFoundException;
import io.vertx.core.Vertx;
import io.vertx.junit5.VertxExtension;
import io.vertx.junit5.VertxTestContext;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for {@link FileContestRegistry}.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @version 1.0
 * @since 2026-02-05
 */
@ExtendWith(VertxExtension.class)
@DisplayName("FileContestRegistry Tests")
class FileContestRegistryTest {

    @TempDir
    Path dir;

    private FileContestRegistry registry(Vertx vertx) {
        return new FileContestRegistry(vertx, dir.resolve(FileContestRegistry.FILE_NAME),
                JsonSupport.newObjectMapper(), "badge-arena");
    }

    private void writeRegistry() throws Exception {
        Files.writeString(dir.resolve(FileContestRegistry.FILE_NAME), """
                {"activeContestId": "autumn",
                 "contests": [{"id": "badge-arena"}, {"id": "autumn"}]}
                """);
    }

    @Test
    @DisplayName("without a registry file the default contest is active")
    void missingFile_usesDefault(Vertx vertx, VertxTestContext ctx) {
        registry(vertx).resolve(null).onComplete(ctx.succeeding(id -> ctx.verify(() -> {
            assertEquals("badge-arena", id);
            ctx.completeNow();
        })));
    }

    @Test
    @DisplayName("blank id resolves to the active contest")
    void blankId_resolvesActive(Vertx vertx, VertxTestContext ctx) throws Exception {
        writeRegistry();

        registry(vertx).resolve("  ").onComplete(ctx.succeeding(id -> ctx.verify(() -> {
            assertEquals("autumn", id);
            ctx.completeNow();
        })));
    }

    @Test
    @DisplayName("known ids are trimmed and returned")
    void knownId_isReturned(Vertx vertx, VertxTestContext ctx) throws Exception {
        writeRegistry();

        registry(vertx).resolve(" badge-arena ").onComplete(ctx.succeeding(id -> ctx.verify(() -> {
            assertEquals("badge-arena", id);
            ctx.completeNow();
        })));
    }

    @Test
    @DisplayName("unknown ids fail with ContestNotFoundException")
    void unknownId_fails(Vertx vertx, VertxTestContext ctx) throws Exception {
        writeRegistry();

        registry(vertx).resolve("winter").onComplete(ctx.failing(error -> ctx.verify(() -> {
            assertInstanceOf(ContestNotFoundException.class, error);
            assertEquals("Contest winter not found.", error.getMessage());
            ctx.completeNow();
        })));
    }
}
