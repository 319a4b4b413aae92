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

import java.util.Objects;

/**
 * A proposed pairing. Equality of pairings is unordered, see {@link #pairKey()}.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-02-02
 * @version 1.0
 */
public record Matchup(String primaryId, String challengerId) {

    public Matchup {
        Objects.requireNonNull(primaryId, "primaryId");
        Objects.requireNonNull(challengerId, "challengerId");
    }

    /**
     * Sorted ids joined by {@code |}, identical for both orientations of the pair.
     */
    public String pairKey() {
        return pairKey(primaryId, challengerId);
    }

    public static String pairKey(String a, String b) {
        return a.compareTo(b) <= 0 ? a + "|" + b : b + "|" + a;
    }

    public boolean samePairAs(Matchup other) {
        return other != null && pairKey().equals(other.pairKey());
    }
}
