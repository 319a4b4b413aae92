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
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import dev.mars.arena.core.model.ContestLedger;
import dev.mars.arena.core.model.MatchRecord;
import dev.mars.arena.core.model.RatingEntry;
import dev.mars.arena.core.model.RatingState;
import dev.mars.arena.core.model.VotesFile;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.time.Instant;
import java.time.OffsetDateTime;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.OptionalLong;
import java.util.regex.Pattern;

/**
 * Reads and writes the {@code votes.json} document.
 *
 * <p>Two layouts are accepted on input:</p>
 * <ul>
 *   <li><b>current</b> - {@code {version, contests: {id: {state, updatedAt}}, updatedAt}}</li>
 *   <li><b>legacy</b> - {@code {state, updatedAt}} or a bare {@code {entries, history}}, converted
 *       into the default contest</li>
 * </ul>
 *
 * <p>Decoding never throws for malformed content inside a syntactically valid document. Every
 * entry or match that fails validation is dropped and reported as a {@link RejectedRecord}.
 * Only unparsable bytes raise an exception, see {@link #parse(byte[])}.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-02-02
 * @version 1.0
 */
public final class VotesFileCodec {

    private static final Pattern EPOCH_MILLIS = Pattern.compile("-?\\d{1,18}");

    private final ObjectMapper mapper;
    private final String defaultContestId;

    public VotesFileCodec(ObjectMapper mapper, String defaultContestId) {
        this.mapper = Objects.requireNonNull(mapper, "mapper");
        this.defaultContestId = Objects.requireNonNull(defaultContestId, "defaultContestId");
    }

    public String defaultContestId() {
        return defaultContestId;
    }

    // =========================================================================
    // Parsing
    // =========================================================================

    /**
     * Parses raw bytes into a JSON tree.
     *
     * @throws IOException if the bytes are not a complete JSON document, including an empty file
     */
    public JsonNode parse(byte[] bytes) throws IOException {
        JsonNode root = mapper.readTree(bytes);
        if (root == null || root.isMissingNode()) {
            throw new IOException("Empty JSON document");
        }
        return root;
    }

    public DecodeResult<VotesFile> decode(byte[] bytes, Instant now) throws IOException {
        return decode(parse(bytes), now);
    }

    public DecodeResult<VotesFile> decode(JsonNode root, Instant now) {
        List<RejectedRecord> rejected = new ArrayList<>();

        if (root == null || !root.isObject()) {
            rejected.add(new RejectedRecord("$", "document root is not an object"));
            return new DecodeResult<>(VotesFile.empty(now), rejected, false);
        }

        Instant updatedAt = parseInstant(root.get("updatedAt")).orElse(now);
        JsonNode contestsNode = root.get("contests");

        if (root.path("version").isNumber() && contestsNode != null && contestsNode.isObject()) {
            Map<String, ContestLedger> contests = new LinkedHashMap<>();
            Iterator<Map.Entry<String, JsonNode>> fields = contestsNode.fields();
            while (fields.hasNext()) {
                Map.Entry<String, JsonNode> field = fields.next();
                String location = "contests." + field.getKey();
                JsonNode contestNode = field.getValue();
                if (!contestNode.isObject()) {
                    rejected.add(new RejectedRecord(location, "contest ledger is not an object"));
                    continue;
                }
                RatingState state = decodeState(contestNode.get("state"), location + ".state", rejected);
                Instant contestUpdatedAt = parseInstant(contestNode.get("updatedAt")).orElse(now);
                contests.put(field.getKey(), new ContestLedger(state, contestUpdatedAt));
            }
            return new DecodeResult<>(new VotesFile(VotesFile.CURRENT_VERSION, contests, updatedAt), rejected, false);
        }

        JsonNode stateNode = root.has("state") ? root.get("state") : root;
        RatingState state = decodeState(stateNode, "state", rejected);
        Map<String, ContestLedger> contests = Map.of(defaultContestId, new ContestLedger(state, updatedAt));
        return new DecodeResult<>(new VotesFile(VotesFile.CURRENT_VERSION, contests, updatedAt), rejected, true);
    }

    /**
     * Decodes a rating state, dropping invalid entries and matches into {@code rejected}.
     * A missing or non-object node decodes to an empty state.
     */
    public RatingState decodeState(JsonNode node, String location, List<RejectedRecord> rejected) {
        if (node == null || node.isNull()) {
            return RatingState.empty();
        }
        if (!node.isObject()) {
            rejected.add(new RejectedRecord(location, "state is not an object"));
            return RatingState.empty();
        }

        Map<String, RatingEntry> entries = new LinkedHashMap<>();
        JsonNode entriesNode = node.get("entries");
        if (entriesNode != null && entriesNode.isObject()) {
            Iterator<Map.Entry<String, JsonNode>> fields = entriesNode.fields();
            while (fields.hasNext()) {
                Map.Entry<String, JsonNode> field = fields.next();
                RatingEntry entry = decodeEntry(field.getValue());
                if (entry != null) {
                    entries.put(field.getKey(), entry);
                } else {
                    rejected.add(new RejectedRecord(location + ".entries." + field.getKey(),
                            "entry needs numeric rating, wins, losses and matches"));
                }
            }
        }

        List<MatchRecord> history = new ArrayList<>();
        JsonNode historyNode = node.get("history");
        if (historyNode != null && historyNode.isArray()) {
            for (int i = 0; i < historyNode.size(); i++) {
                String recordLocation = location + ".history[" + i + "]";
                String problem = decodeMatch(historyNode.get(i), history);
                if (problem != null) {
                    rejected.add(new RejectedRecord(recordLocation, problem));
                }
            }
        }
        return new RatingState(entries, history);
    }

    private static RatingEntry decodeEntry(JsonNode node) {
        if (node == null || !node.isObject()) {
            return null;
        }
        Double rating = number(node.get("rating"));
        Double wins = number(node.get("wins"));
        Double losses = number(node.get("losses"));
        Double matches = number(node.get("matches"));
        if (rating == null || wins == null || losses == null || matches == null) {
            return null;
        }
        return new RatingEntry(rating, wins.intValue(), losses.intValue(), matches.intValue());
    }

    /**
     * Appends the decoded match to {@code history}, returning a rejection reason on failure.
     */
    private static String decodeMatch(JsonNode node, List<MatchRecord> history) {
        if (node == null || !node.isObject()) {
            return "match is not an object";
        }
        String winnerId = text(node.get("winnerId"));
        String loserId = text(node.get("loserId"));
        if (winnerId == null || loserId == null) {
            return "match needs winnerId and loserId";
        }
        if (winnerId.equals(loserId)) {
            return "winnerId equals loserId";
        }
        OptionalLong timestamp = parseTimestamp(node.get("timestamp"));
        if (timestamp.isEmpty()) {
            return "match timestamp is missing or unparsable";
        }
        JsonNode hashNode = node.get("voterHash");
        String voterHash = hashNode != null && hashNode.isTextual() ? hashNode.asText() : null;
        history.add(new MatchRecord(winnerId, loserId, timestamp.getAsLong(), voterHash));
        return null;
    }

    // =========================================================================
    // Encoding
    // =========================================================================

    /**
     * Serializes a votes file as indented UTF-8 JSON with a trailing newline.
     */
    public byte[] encode(VotesFile file) throws IOException {
        ObjectNode root = mapper.createObjectNode();
        root.put("version", file.version());
        ObjectNode contests = root.putObject("contests");
        for (Map.Entry<String, ContestLedger> contest : file.contests().entrySet()) {
            ObjectNode ledgerNode = contests.putObject(contest.getKey());
            ledgerNode.set("state", encodeState(contest.getValue().state()));
            ledgerNode.put("updatedAt", contest.getValue().updatedAt().toString());
        }
        root.put("updatedAt", file.updatedAt().toString());

        String json = mapper.writerWithDefaultPrettyPrinter().writeValueAsString(root);
        return (json + "\n").getBytes(StandardCharsets.UTF_8);
    }

    public ObjectNode encodeState(RatingState state) {
        ObjectNode node = mapper.createObjectNode();
        ObjectNode entries = node.putObject("entries");
        for (Map.Entry<String, RatingEntry> entry : state.entries().entrySet()) {
            ObjectNode entryNode = entries.putObject(entry.getKey());
            entryNode.put("rating", entry.getValue().rating());
            entryNode.put("wins", entry.getValue().wins());
            entryNode.put("losses", entry.getValue().losses());
            entryNode.put("matches", entry.getValue().matches());
        }
        ArrayNode history = node.putArray("history");
        for (MatchRecord record : state.history()) {
            ObjectNode recordNode = history.addObject();
            recordNode.put("winnerId", record.winnerId());
            recordNode.put("loserId", record.loserId());
            recordNode.put("timestamp", record.timestamp());
            if (record.voterHash() != null) {
                recordNode.put("voterHash", record.voterHash());
            } else {
                recordNode.putNull("voterHash");
            }
        }
        return node;
    }

    // =========================================================================
    // Value coercion
    // =========================================================================

    /**
     * Parses a match timestamp given either as epoch millis or as an ISO-8601 string.
     */
    public static OptionalLong parseTimestamp(JsonNode node) {
        if (node == null || node.isNull()) {
            return OptionalLong.empty();
        }
        if (node.isNumber()) {
            double value = node.asDouble();
            return Double.isFinite(value) ? OptionalLong.of((long) value) : OptionalLong.empty();
        }
        if (node.isTextual()) {
            String text = node.asText().trim();
            if (text.isEmpty()) {
                return OptionalLong.empty();
            }
            if (EPOCH_MILLIS.matcher(text).matches()) {
                return OptionalLong.of(Long.parseLong(text));
            }
            return parseIsoMillis(text);
        }
        return OptionalLong.empty();
    }

    private static Optional<Instant> parseInstant(JsonNode node) {
        OptionalLong millis = parseTimestamp(node);
        return millis.isPresent()
                ? Optional.of(Instant.ofEpochMilli(millis.getAsLong()))
                : Optional.empty();
    }

    private static OptionalLong parseIsoMillis(String text) {
        try {
            return OptionalLong.of(Instant.parse(text).toEpochMilli());
        } catch (DateTimeParseException e) {
            try {
                return OptionalLong.of(OffsetDateTime.parse(text).toInstant().toEpochMilli());
            } catch (DateTimeParseException ignored) {
                return OptionalLong.empty();
            }
        }
    }

    private static Double number(JsonNode node) {
        if (node == null || node.isNull()) {
            return null;
        }
        if (node.isNumber()) {
            double value = node.asDouble();
            return Double.isFinite(value) ? value : null;
        }
        if (node.isTextual()) {
            try {
                double value = Double.parseDouble(node.asText().trim());
                return Double.isFinite(value) ? value : null;
            } catch (NumberFormatException e) {
                return null;
            }
        }
        return null;
    }

    private static String text(JsonNode node) {
        if (node == null || !node.isTextual()) {
            return null;
        }
        String value = node.asText();
        return value.isBlank() ? null : value;
    }
}
