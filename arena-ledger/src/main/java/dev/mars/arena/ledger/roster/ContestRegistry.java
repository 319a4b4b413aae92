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

import io.vertx.core.Future;

/**
 * Resolves contest identifiers supplied by callers.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-02-03
 * @version 1.0
 */
@FunctionalInterface
public interface ContestRegistry {

    /**
     * Resolves a contest id to its canonical id.
     *
     * @param contestId requested id; null or blank selects the active contest
     * @return the canonical id, or a future failed with
     *         {@link dev.mars.arena.core.exceptions.ContestNotFoundException}
     */
    Future<String> resolve(String contestId);
}
