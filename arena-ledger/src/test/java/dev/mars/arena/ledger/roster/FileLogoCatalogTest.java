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
import dev.mars.arena.core.codec.LogoCatalogCodec;
import dev.mars.arena.core.model.LogoEntry;
import io.vertx.core.Vertx;
import io.vertx.junit5.VertxExtension;
import io.vertx.junit5.VertxTestContext;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for {@link FileLogoCatalog}.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @version 1.0
 * @since 2026-02-05
 */
@ExtendWith(VertxExtension.class)
@DisplayName("FileLogoCatalog Tests")
class FileLogoCatalogTest {

    private static final String DEFAULT = "badge-arena";

    private final LogoCatalogCodec codec = new LogoCatalogCodec(JsonSupport.newObjectMapper(), DEFAULT);

    @TempDir
    Path dir;

    @Test
    @DisplayName("activeLogos filters by contest and removal")
    void activeLogos_filters(Vertx vertx, VertxTestContext ctx) throws Exception {
        Path file = dir.resolve(FileLogoCatalog.FILE_NAME);
        Files.writeString(file, """
                [
                  {"id": "A"},
                  {"id": "B", "removedAt": "2026-01-01T00:00:00Z"},
                  {"id": "C", "contestId": "autumn"},
                  {"id": "D"}
                ]
                """);
        FileLogoCatalog catalog = new FileLogoCatalog(vertx, file, codec);

        catalog.activeLogos(DEFAULT).onComplete(ctx.succeeding(logos -> ctx.verify(() -> {
            assertEquals(List.of("A", "D"), logos.stream().map(LogoEntry::id).toList());
            ctx.completeNow();
        })));
    }

    @Test
    @DisplayName("unparsable catalog fails the future")
    void unparsableCatalog_fails(Vertx vertx, VertxTestContext ctx) throws Exception {
        Path file = dir.resolve(FileLogoCatalog.FILE_NAME);
        Files.writeString(file, "{not json");
        FileLogoCatalog catalog = new FileLogoCatalog(vertx, file, codec);

        catalog.activeLogos(DEFAULT).onComplete(ctx.failingThenComplete());
    }
}
