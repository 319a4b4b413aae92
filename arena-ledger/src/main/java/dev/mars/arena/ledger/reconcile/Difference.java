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

package dev.mars.arena.ledger.reconcile;

import dev.mars.arena.core.model.RatingEntry;

/**
 * How one logo's persisted entry differs from its replayed entry.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-02-05
 * @version 1.0
 */
public record Difference(
        String logoId,
        double ratingBefore,
        double ratingAfter,
        double ratingDelta,
        int winsBefore,
        int winsAfter,
        int winsDelta,
        int lossesBefore,
        int lossesAfter,
        int lossesDelta,
        int matchesBefore,
        int matchesAfter,
        int matchesDelta) {

    /**
     * Ratings closer than this are treated as equal.
     */
    public static final double RATING_TOLERANCE = 1e-9;

    /**
     * Compares a persisted entry with its replayed counterpart.
     *
     * @return the difference, or {@code null} when every delta is zero
     */
    public static Difference between(String logoId, RatingEntry before, RatingEntry after) {
        double ratingDelta = after.rating() - before.rating();
        int winsDelta = after.wins() - before.wins();
        int lossesDelta = after.losses() - before.losses();
        int matchesDelta = after.matches() - before.matches();
        if (Math.abs(ratingDelta) <= RATING_TOLERANCE && winsDelta == 0 && lossesDelta == 0 && matchesDelta == 0) {
            return null;
        }
        return new Difference(logoId,
                before.rating(), after.rating(), ratingDelta,
                before.wins(), after.wins(), winsDelta,
                before.losses(), after.losses(), lossesDelta,
                before.matches(), after.matches(), matchesDelta);
    }
}
