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

import dev.mars.arena.core.exceptions.ContestNotFoundException;
import dev.mars.arena.core.model.LogoEntry;
import dev.mars.arena.ledger.backup.BackupThrottler;
import dev.mars.arena.ledger.config.LedgerConfig;
import dev.mars.arena.ledger.roster.ContestRegistry;
import dev.mars.arena.ledger.roster.LogoCatalog;
import io.vertx.core.Future;
import io.vertx.core.Vertx;

import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Properties;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.TimeUnit;

/**
 * Shared fixtures for ledger tests: a settable clock, an in-memory roster and blocking awaits.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @version 1.0
 * @since 2026-02-05
 */
public final class LedgerTestSupport {

    public static final String CONTEST = "badge-arena";

    private LedgerTestSupport() {
    }

    public static <T> T await(Future<T> future) throws Exception {
        return future.toCompletionStage().toCompletableFuture().get(10, TimeUnit.SECONDS);
    }

    public static LogoEntry logo(String id) {
        return logo(id, CONTEST);
    }

    public static LogoEntry logo(String id, String contestId) {
        return new LogoEntry(id, contestId, "Logo " + id, "logo-" + id.toLowerCase(), "/images/" + id + ".png", null);
    }

    public static LedgerConfig config(Path dataDir) {
        Properties properties = new Properties();
        properties.setProperty("arena.data.dir", dataDir.toString());
        properties.setProperty("arena.storage.fsync", "false");
        properties.setProperty("arena.backup.min-interval-ms", "60000");
        properties.setProperty("arena.backup.max-retained", "120");
        return LedgerConfig.fromProperties(properties);
    }

    public static VoteLedger newLedger(Vertx vertx, Path dataDir, MutableClock clock, InMemoryRoster roster) {
        return VoteLedgerFactory.create(vertx, config(dataDir), clock, new BackupThrottler(), roster, roster);
    }

    /**
     * Clock whose instant only moves when a test advances it.
     */
    public static final class MutableClock extends Clock {

        private volatile Instant now;

        public MutableClock(Instant start) {
            this.now = start;
        }

        public void advance(Duration duration) {
            now = now.plus(duration);
        }

        @Override
        public ZoneId getZone() {
            return ZoneOffset.UTC;
        }

        @Override
        public Clock withZone(ZoneId zone) {
            return this;
        }

        @Override
        public Instant instant() {
            return now;
        }
    }

    /**
     * Roster and contest registry held in memory; contests are known once they have been set.
     */
    public static final class InMemoryRoster implements LogoCatalog, ContestRegistry {

        private final Map<String, List<LogoEntry>> logos = new ConcurrentHashMap<>();

        public InMemoryRoster() {
            logos.put(CONTEST, List.of());
        }

        public InMemoryRoster set(String contestId, LogoEntry... entries) {
            logos.put(contestId, List.of(entries));
            return this;
        }

        public Set<String> contests() {
            return logos.keySet();
        }

        @Override
        public Future<List<LogoEntry>> activeLogos(String contestId) {
            List<LogoEntry> active = new ArrayList<>();
            for (LogoEntry entry : logos.getOrDefault(contestId, List.of())) {
                if (entry.isActive()) {
                    active.add(entry);
                }
            }
            return Future.succeededFuture(active);
        }

        @Override
        public Future<String> resolve(String contestId) {
            if (contestId == null || contestId.isBlank()) {
                return Future.succeededFuture(CONTEST);
            }
            if (!logos.containsKey(contestId)) {
                return Future.failedFuture(new ContestNotFoundException(contestId));
            }
            return Future.succeededFuture(contestId);
        }
    }
}
