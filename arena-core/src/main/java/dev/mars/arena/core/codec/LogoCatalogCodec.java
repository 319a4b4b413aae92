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

package dev.mars.arena.core.codec;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import dev.mars.arena.core.model.LogoEntry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Reads the logo catalog ({@code logos.json}).
 *
 * <p>Accepts {@code {"logos": [...]}} or a bare array. Logos without a contest belong to the
 * default contest; a logo without a codename gets one derived from its name. Entries without an
 * id are skipped with a warning.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-02-03
 * @version 1.0
 */
public final class LogoCatalogCodec {

    private static final Logger LOG = LoggerFactory.getLogger(LogoCatalogCodec.class);

    private final ObjectMapper mapper;
    private final String defaultContestId;

    public LogoCatalogCodec(ObjectMapper mapper, String defaultContestId) {
        this.mapper = mapper;
        this.defaultContestId = defaultContestId;
    }

    /**
     * Reads every logo of a catalog file, removed ones included. A missing file is an empty catalog.
     *
     * @throws IOException if the file cannot be read or is not JSON
     */
    public List<LogoEntry> read(Path file) throws IOException {
        if (!Files.exists(file)) {
            LOG.debug("Logo catalog {} does not exist, roster is empty", file);
            return List.of();
        }
        JsonNode root = mapper.readTree(file.toFile());
        JsonNode logosNode = root != null && root.isArray() ? root : (root != null ? root.get("logos") : null);
        if (logosNode == null || !logosNode.isArray()) {
            LOG.warn("Logo catalog {} has no logos array", file);
            return List.of();
        }

        List<LogoEntry> logos = new ArrayList<>();
        for (int i = 0; i < logosNode.size(); i++) {
            LogoEntry logo = toLogo(logosNode.get(i));
            if (logo != null) {
                logos.add(logo);
            } else {
                LOG.warn("Skipping logo {}[{}]: missing id", file.getFileName(), i);
            }
        }
        return logos;
    }

    private LogoEntry toLogo(JsonNode node) {
        String id = trimmed(node.get("id"));
        if (id == null) {
            return null;
        }
        String contestId = trimmed(node.get("contestId"));
        String name = trimmed(node.get("name"));
        String codename = trimmed(node.get("codename"));
        if (codename == null && name != null) {
            codename = name.toLowerCase(Locale.ROOT).replaceAll("[^a-z0-9]+", "-").replaceAll("(^-|-$)", "");
        }
        return new LogoEntry(
                id,
                contestId != null ? contestId : defaultContestId,
                name != null ? name : id,
                codename,
                trimmed(node.get("image")),
                parseRemovedAt(id, node.get("removedAt")));
    }

    private static Instant parseRemovedAt(String id, JsonNode node) {
        String value = trimmed(node);
        if (value == null) {
            return null;
        }
        try {
            return Instant.parse(value);
        } catch (DateTimeParseException e) {
            LOG.warn("Logo {} has an unparsable removedAt '{}', treating it as active", id, value);
            return null;
        }
    }

    private static String trimmed(JsonNode node) {
        if (node == null || !node.isTextual()) {
            return null;
        }
        String value = node.asText().trim();
        return value.isEmpty() ? null : value;
    }
}
