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

import dev.mars.arena.core.model.ContestLedger;
import dev.mars.arena.core.model.RatingState;
import dev.mars.arena.core.rating.RatingEngine;
import dev.mars.arena.ledger.roster.ContestRegistry;
import dev.mars.arena.ledger.roster.LogoCatalog;
import io.vertx.core.Future;

import java.util.List;

/**
 * Resolves a contest, fetches its roster and reads its ledger aligned with that roster.
 * Performs no writes.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-02-04
 * @version 1.0
 */
public class ContestLoader {

    private final ContestRegistry registry;
    private final LogoCatalog catalog;
    private final VotesRepository repository;
    private final RatingEngine engine;

    public ContestLoader(ContestRegistry registry, LogoCatalog catalog, VotesRepository repository,
                         RatingEngine engine) {
        this.registry = registry;
        this.catalog = catalog;
        this.repository = repository;
        this.engine = engine;
    }

    public Future<ContestView> load(String contestId) {
        return registry.resolve(contestId)
                .compose(id -> catalog.activeLogos(id)
                        .compose(roster -> repository.load()
                                .map(file -> {
                                    RatingState persisted = file.contest(id)
                                            .map(ContestLedger::state)
                                            .orElse(RatingState.empty());
                                    List<String> rosterIds = ContestView.idsOf(roster);
                                    RatingState ensured = engine.ensureEntries(persisted, rosterIds);
                                    RatingState aligned = engine.pruneEntries(ensured, rosterIds);
                                    return new ContestView(id, List.copyOf(roster), file,
                                            persisted, aligned, aligned != ensured);
                                })));
    }
}
