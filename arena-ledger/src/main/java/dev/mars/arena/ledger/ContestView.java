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

import dev.mars.arena.core.model.LogoEntry;
import dev.mars.arena.core.model.RatingState;
import dev.mars.arena.core.model.VotesFile;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * A contest's persisted ledger lined up with its active roster.
 *
 * @param contestId canonical contest id
 * @param roster    active logos
 * @param file      the votes file the ledger was read from
 * @param persisted state as stored, empty when the contest has no ledger yet
 * @param aligned   {@code persisted} after ensuring and pruning against the roster
 * @param pruned    true when aligning removed entries or history
 */
public record ContestView(
        String contestId,
        List<LogoEntry> roster,
        VotesFile file,
        RatingState persisted,
        RatingState aligned,
        boolean pruned) {

    public List<String> rosterIds() {
        return idsOf(roster);
    }

    public static List<String> idsOf(List<LogoEntry> logos) {
        List<String> ids = new ArrayList<>(logos.size());
        for (LogoEntry logo : logos) {
            ids.add(logo.id());
        }
        return ids;
    }

    public Map<String, LogoEntry> rosterById() {
        Map<String, LogoEntry> byId = new HashMap<>();
        for (LogoEntry logo : roster) {
            byId.put(logo.id(), logo);
        }
        return byId;
    }

    /**
     * True when aligning produced a new value that should be written back.
     */
    public boolean needsWrite() {
        return aligned != persisted;
    }
}
