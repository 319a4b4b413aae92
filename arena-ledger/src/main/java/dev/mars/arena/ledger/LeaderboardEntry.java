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
import dev.mars.arena.core.model.RatingEntry;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;

/**
 * One row of a contest leaderboard: rating counters joined with catalog details.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-02-04
 * @version 1.0
 */
public record LeaderboardEntry(
        String logoId,
        String name,
        String codename,
        String image,
        double rating,
        int wins,
        int losses,
        int matches) {

    private static final Comparator<LeaderboardEntry> RANKING = Comparator
            .comparingDouble(LeaderboardEntry::rating).reversed()
            .thenComparing(Comparator.comparingInt(LeaderboardEntry::matches).reversed())
            .thenComparing(LeaderboardEntry::logoId);

    /**
     * Ranks rostered entries by rating, highest first, keeping at most {@code limit} rows.
     * Entries without a roster logo are left out.
     */
    public static List<LeaderboardEntry> rank(Map<String, RatingEntry> entries, Map<String, LogoEntry> roster,
                                              int limit) {
        List<LeaderboardEntry> rows = new ArrayList<>();
        for (Map.Entry<String, RatingEntry> entry : entries.entrySet()) {
            LogoEntry logo = roster.get(entry.getKey());
            if (logo == null) {
                continue;
            }
            RatingEntry rating = entry.getValue();
            rows.add(new LeaderboardEntry(logo.id(), logo.name(), logo.codename(), logo.image(),
                    rating.rating(), rating.wins(), rating.losses(), rating.matches()));
        }
        rows.sort(RANKING);
        return limit > 0 && rows.size() > limit ? List.copyOf(rows.subList(0, limit)) : List.copyOf(rows);
    }
}
