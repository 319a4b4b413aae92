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

package dev.mars.arena.ledger.audit;

import dev.mars.arena.core.model.LogoEntry;
import dev.mars.arena.core.model.RatingEntry;

/**
 * Before/after view of one participant of a recorded vote.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-02-03
 * @version 1.0
 */
public record ParticipantSnapshot(
        String id,
        String name,
        String codename,
        double ratingBefore,
        double ratingAfter,
        int winsBefore,
        int winsAfter,
        int lossesBefore,
        int lossesAfter,
        int matchesBefore,
        int matchesAfter) {

    public static ParticipantSnapshot of(String id, LogoEntry logo, RatingEntry before, RatingEntry after) {
        return new ParticipantSnapshot(
                id,
                logo != null ? logo.name() : null,
                logo != null ? logo.codename() : null,
                before.rating(), after.rating(),
                before.wins(), after.wins(),
                before.losses(), after.losses(),
                before.matches(), after.matches());
    }
}
