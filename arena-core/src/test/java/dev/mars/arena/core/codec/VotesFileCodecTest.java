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

import dev.mars.arena.core.model.MatchRecord;
import dev.mars.arena.core.model.RatingEntry;
import dev.mars.arena.core.model.RatingState;
import dev.mars.arena.core.model.VotesFile;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.time.Instant;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for {@link VotesFileCodec}.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @version 1.0
 * @since 2026-02-02
 */
@DisplayName("VotesFileCodec Tests")
class VotesFileCodecTest {

    private static final Instant NOW = Instant.parse("2026-02-02T10:00:00Z");

    private final VotesFileCodec codec = new VotesFileCodec(JsonSupport.newObjectMapper(), "badge-arena");

    private DecodeResult<VotesFile> decode(String json) throws IOException {
        return codec.decode(json.getBytes(StandardCharsets.UTF_8), NOW);
    }

    @Nested
    @DisplayName("Current layout")
    class CurrentLayoutTests {

        @Test
        @DisplayName("decodes contests, entries and history")
        void decodesContests() throws IOException {
            DecodeResult<VotesFile> result = decode("""
                    {
                      "version": 2,
                      "contests": {
                        "spring": {
                          "state": {
                            "entries": {"a": {"rating": 1516, "wins": 1, "losses": 0, "matches": 1},
                                        "b": {"rating": 1484, "wins": 0, "losses": 1, "matches": 1}},
                            "history": [{"winnerId": "a", "loserId": "b", "timestamp": 1000, "voterHash": " v1 "}]
                          },
                          "updatedAt": "2026-01-01T00:00:00Z"
                        }
                      },
                      "updatedAt": "2026-01-02T00:00:00Z"
                    }
                    """);

            assertFalse(result.legacy());
            assertFalse(result.hasRejections());
            VotesFile file = result.value();
            assertEquals(Instant.parse("2026-01-02T00:00:00Z"), file.updatedAt());
            RatingState state = file.contest("spring").orElseThrow().state();
            assertEquals(new RatingEntry(1516, 1, 0, 1), state.entries().get("a"));
            assertEquals(new MatchRecord("a", "b", 1000L, "v1"), state.history().get(0));
            assertEquals(Instant.parse("2026-01-01T00:00:00Z"), file.contest("spring").orElseThrow().updatedAt());
        }

        @Test
        @DisplayName("malformed entries and matches are reported, not silently dropped")
        void malformedRecords_areReported() throws IOException {
            DecodeResult<VotesFile> result = decode("""
                    {"version": 2, "contests": {"c": {"state": {
                      "entries": {"a": {"rating": 1500, "wins": 0, "losses": 0, "matches": 0},
                                  "bad": {"rating": "x"}},
                      "history": [
                        {"winnerId": "a", "loserId": "b", "timestamp": "2026-01-01T00:00:00Z"},
                        {"winnerId": "a", "timestamp": 5},
                        {"winnerId": "a", "loserId": "b", "timestamp": "yesterday"},
                        42
                      ]}}}}
                    """);

            RatingState state = result.value().contest("c").orElseThrow().state();
            assertEquals(List.of("a"), List.copyOf(state.entries().keySet()));
            assertEquals(1, state.history().size());
            assertEquals(Instant.parse("2026-01-01T00:00:00Z").toEpochMilli(), state.history().get(0).timestamp());
            assertEquals(4, result.rejected().size());
            assertEquals("contests.c.state.entries.bad", result.rejected().get(0).location());
            assertEquals("contests.c.state.history[1]", result.rejected().get(1).location());
        }
    }

    @Nested
    @DisplayName("Legacy and schema errors")
    class LegacyTests {

        @Test
        @DisplayName("wrapped legacy state converts into the default contest")
        void wrappedLegacy_convertsToDefaultContest() throws IOException {
            DecodeResult<VotesFile> result = decode("""
                    {"state": {"entries": {"a": {"rating": 1490, "wins": 0, "losses": 1, "matches": 1}},
                               "history": []},
                     "updatedAt": "2025-12-31T00:00:00Z"}
                    """);

            assertTrue(result.legacy());
            assertEquals(Map.of("a", new RatingEntry(1490, 0, 1, 1)),
                    result.value().contest("badge-arena").orElseThrow().state().entries());
        }

        @Test
        @DisplayName("bare legacy state converts into the default contest")
        void bareLegacy_convertsToDefaultContest() throws IOException {
            DecodeResult<VotesFile> result = decode("""
                    {"entries": {}, "history": [{"winnerId": "a", "loserId": "b", "timestamp": 7}]}
                    """);

            assertTrue(result.legacy());
            assertEquals(1, result.value().contest("badge-arena").orElseThrow().state().history().size());
        }

        @Test
        @DisplayName("non-object root decodes to an empty file with a rejection")
        void nonObjectRoot_decodesEmpty() throws IOException {
            DecodeResult<VotesFile> result = decode("[1, 2, 3]");

            assertTrue(result.value().contests().isEmpty());
            assertEquals(1, result.rejected().size());
        }

        @Test
        @DisplayName("unparsable or empty bytes raise an IOException")
        void unparsable_throws() {
            assertThrows(IOException.class, () -> decode("{\"version\": 2, \"contests\": {"));
            assertThrows(IOException.class, () -> decode(""));
        }

        @Test
        @DisplayName("a complete document followed by more JSON raises an IOException")
        void trailingContent_throws() {
            assertThrows(IOException.class,
                    () -> decode("{\"version\":2,\"contests\":{}} {\"version\": 2, \"contests\": {"));
            assertThrows(IOException.class, () -> decode("{\"version\":2,\"contests\":{}} 42"));
        }

        @Test
        @DisplayName("trailing whitespace is accepted")
        void trailingWhitespace_isAccepted() throws IOException {
            assertFalse(decode("{\"version\":2,\"contests\":{}}\n\n  ").hasRejections());
        }
    }

    @Test
    @DisplayName("encode writes indented JSON with a trailing newline that decodes back")
    void encode_writesTrailingNewline() throws IOException {
        RatingState state = new RatingState(
                Map.of("a", new RatingEntry(1516.0, 1, 0, 1)),
                List.of(new MatchRecord("a", "b", 99L, null)));
        VotesFile file = VotesFile.empty(NOW).withContest("c", state, NOW);

        byte[] bytes = codec.encode(file);
        String json = new String(bytes, StandardCharsets.UTF_8);

        assertTrue(json.endsWith("}\n"));
        assertTrue(json.contains("\"voterHash\" : null"));
        assertEquals(file, codec.decode(bytes, Instant.EPOCH).value());
    }
}
