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

import dev.mars.arena.core.codec.LogoCatalogCodec;
import dev.mars.arena.core.model.LogoEntry;
import io.vertx.core.Future;
import io.vertx.core.Vertx;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Read-only view of the catalog's {@code logos.json}, re-read on every call so catalog edits
 * take effect without a restart. A missing file is an empty roster, an unreadable one fails
 * the future.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-02-03
 * @version 1.0
 */
public class FileLogoCatalog implements LogoCatalog {

    public static final String FILE_NAME = "logos.json";

    private final Vertx vertx;
    private final Path file;
    private final LogoCatalogCodec codec;

    public FileLogoCatalog(Vertx vertx, Path file, LogoCatalogCodec codec) {
        this.vertx = vertx;
        this.file = file;
        this.codec = codec;
    }

    @Override
    public Future<List<LogoEntry>> activeLogos(String contestId) {
        return vertx.executeBlocking(() -> {
            List<LogoEntry> active = new ArrayList<>();
            for (LogoEntry logo : codec.read(file)) {
                if (logo.isActive() && logo.contestId().equals(contestId)) {
                    active.add(logo);
                }
            }
            return active;
        }, false);
    }
}
