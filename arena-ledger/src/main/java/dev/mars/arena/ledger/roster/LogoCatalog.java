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

import dev.mars.arena.core.model.LogoEntry;
import io.vertx.core.Future;

import java.util.List;

/**
 * Source of the active logo roster of a contest. The ledger only reads it.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-02-03
 * @version 1.0
 */
@FunctionalInterface
public interface LogoCatalog {

    /**
     * Returns the logos of {@code contestId} that have not been removed, in catalog order.
     */
    Future<List<LogoEntry>> activeLogos(String contestId);
}
