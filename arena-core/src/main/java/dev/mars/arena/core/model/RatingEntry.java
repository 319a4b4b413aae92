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

/**
 * Rating and match counters for a single entity within a contest.
 *
 * <p>{@code matches == wins + losses} holds for every entry produced by the rating engine.
 * It is checked by reconciliation rather than enforced here, so entries decoded from
 * older or hand-edited files may violate it.</p>
 *
 * @param rating  Elo rating
 * @param wins    number of matches won
 * @param losses  number of matches lost
 * @param matches number of matches played
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-02-02
 * @version 1.0
 */
public record RatingEntry(double rating, int wins, int losses, int matches) {

    public static final double DEFAULT_RATING = 1500.0;

    private static final RatingEntry DEFAULT = new RatingEntry(DEFAULT_RATING, 0, 0, 0);

    /**
     * Returns the entry every entity starts from: {1500, 0, 0, 0}.
     */
    public static RatingEntry defaults() {
        return DEFAULT;
    }

    public RatingEntry win(double newRating) {
        return new RatingEntry(newRating, wins + 1, losses, matches + 1);
    }

    public RatingEntry loss(double newRating) {
        return new RatingEntry(newRating, wins, losses + 1, matches + 1);
    }

    public boolean isConsistent() {
        return matches == wins + losses;
    }
}
