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

package dev.mars.arena.core.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Immutable rating snapshot of one contest: an entry per entity plus the match history,
 * newest first. Every rating engine operation returns a new value.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-02-02
 * @version 1.0
 */
public record RatingState(Map<String, RatingEntry> entries, List<MatchRecord> history) {

    private static final RatingState EMPTY = new RatingState(Map.of(), List.of());

    public RatingState {
        entries = Collections.unmodifiableMap(new LinkedHashMap<>(entries));
        history = List.copyOf(history);
    }

    public static RatingState empty() {
        return EMPTY;
    }

    public RatingEntry entryOrDefault(String entityId) {
        RatingEntry entry = entries.get(entityId);
        return entry != null ? entry : RatingEntry.defaults();
    }

    public int matchCount() {
        return history.size();
    }

    /**
     * Returns the most recent match, or {@code null} when no match has been recorded.
     */
    public MatchRecord latestMatch() {
        return history.isEmpty() ? null : history.get(0);
    }
}
