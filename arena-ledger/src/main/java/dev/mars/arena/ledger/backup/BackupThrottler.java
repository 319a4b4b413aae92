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

import java.util.Map;
import java.util.OptionalLong;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Remembers when each backup prefix was last written so bursts of writes produce a bounded
 * number of snapshots.
 *
 * <p>One instance is created per process and shared by every {@link BackupManager} writing
 * into the same backup directory. The state is in memory only; two processes sharing a data
 * directory throttle independently.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-02-03
 * @version 1.0
 */
public final class BackupThrottler {

    private final Map<String, Long> lastBackupAt = new ConcurrentHashMap<>();

    public OptionalLong lastBackupAt(String prefix) {
        Long value = lastBackupAt.get(prefix);
        return value == null ? OptionalLong.empty() : OptionalLong.of(value);
    }

    /**
     * Seeds the last backup time from disk unless this process already knows a value.
     */
    public void seedIfAbsent(String prefix, long timestamp) {
        lastBackupAt.putIfAbsent(prefix, timestamp);
    }

    public boolean isThrottled(String prefix, long now, long minIntervalMs) {
        Long last = lastBackupAt.get(prefix);
        return last != null && minIntervalMs > 0 && now - last < minIntervalMs;
    }

    public void record(String prefix, long timestamp) {
        lastBackupAt.merge(prefix, timestamp, Math::max);
    }
}
