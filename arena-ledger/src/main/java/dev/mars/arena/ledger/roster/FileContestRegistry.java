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

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import dev.mars.arena.core.exceptions.ContestNotFoundException;
import io.vertx.core.Future;
import io.vertx.core.Vertx;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashSet;
import java.util.Set;

/**
 * Contest registry backed by {@code contests.json}: {@code {activeContestId, contests: [{id, ...}]}}.
 *
 * <p>When the file is missing the registry knows only the default contest, which is then also
 * the active one.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-02-03
 * @version 1.0
 */
public class FileContestRegistry implements ContestRegistry {

    private static final Logger LOG = LoggerFactory.getLogger(FileContestRegistry.class);

    public static final String FILE_NAME = "contests.json";

    private final Vertx vertx;
    private final Path file;
    private final ObjectMapper mapper;
    private final String defaultContestId;

    public FileContestRegistry(Vertx vertx, Path file, ObjectMapper mapper, String defaultContestId) {
        this.vertx = vertx;
        this.file = file;
        this.mapper = mapper;
        this.defaultContestId = defaultContestId;
    }

    private record Registry(String activeContestId, Set<String> contestIds) {
    }

    @Override
    public Future<String> resolve(String contestId) {
        return vertx.executeBlocking(() -> {
            Registry registry = readRegistry();
            if (contestId == null || contestId.isBlank()) {
                return registry.activeContestId();
            }
            String requested = contestId.trim();
            if (!registry.contestIds().contains(requested)) {
                throw new ContestNotFoundException(requested);
            }
            return requested;
        }, false);
    }

    private Registry readRegistry() throws IOException {
        if (!Files.exists(file)) {
            return new Registry(defaultContestId, Set.of(defaultContestId));
        }
        JsonNode root = mapper.readTree(file.toFile());
        Set<String> ids = new LinkedHashSet<>();
        JsonNode contests = root != null ? root.get("contests") : null;
        if (contests != null && contests.isArray()) {
            for (JsonNode contest : contests) {
                JsonNode id = contest.get("id");
                if (id != null && id.isTextual() && !id.asText().isBlank()) {
                    ids.add(id.asText().trim());
                }
            }
        }
        if (ids.isEmpty()) {
            LOG.warn("Contest registry {} lists no contests, using default contest {}", file, defaultContestId);
            return new Registry(defaultContestId, Set.of(defaultContestId));
        }

        JsonNode active = root.get("activeContestId");
        String activeId = active != null && active.isTextual() ? active.asText().trim() : "";
        if (!ids.contains(activeId)) {
            activeId = ids.iterator().next();
        }
        return new Registry(activeId, ids);
    }
}
