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

import dev.mars.arena.core.model.LogoEntry;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for {@link LogoCatalogCodec}.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @version 1.0
 * @since 2026-02-05
 */
@DisplayName("LogoCatalogCodec Tests")
class LogoCatalogCodecTest {

    private static final String DEFAULT = "badge-arena";

    private final LogoCatalogCodec codec = new LogoCatalogCodec(JsonSupport.newObjectMapper(), DEFAULT);

    @TempDir
    Path dir;

    @Test
    @DisplayName("read fills defaults and keeps removed logos")
    void read_fillsDefaults() throws Exception {
        Path file = dir.resolve("logos.json");
        Files.writeString(file, """
                {"logos": [
                  {"id": "A", "name": "Night Owl", "image": "/img/a.png"},
                  {"id": "B", "contestId": "autumn", "name": "B", "codename": "bee"},
                  {"id": "C", "removedAt": "2026-01-01T00:00:00Z"},
                  {"id": "D", "removedAt": "yesterday"},
                  {"name": "no id"}
                ]}
                """);

        List<LogoEntry> logos = codec.read(file);

        assertEquals(4, logos.size());
        LogoEntry a = logos.get(0);
        assertEquals(DEFAULT, a.contestId());
        assertEquals("night-owl", a.codename());
        assertEquals("/img/a.png", a.image());
        assertTrue(a.isActive());
        assertEquals("autumn", logos.get(1).contestId());
        assertEquals("bee", logos.get(1).codename());
        assertEquals("C", logos.get(2).name());
        assertEquals(Instant.parse("2026-01-01T00:00:00Z"), logos.get(2).removedAt());
        assertNull(logos.get(3).removedAt());
        assertTrue(logos.get(3).isActive());
    }

    @Test
    @DisplayName("an unparsable removedAt leaves the logo active")
    void unparsableRemovedAt_isActive() throws Exception {
        Path file = dir.resolve("logos.json");
        Files.writeString(file, """
                [{"id": "A", "removedAt": "not-a-date"}, {"id": "B", "removedAt": "2026-03-01T12:00:00Z"}]
                """);

        List<LogoEntry> logos = codec.read(file);

        assertTrue(logos.get(0).isActive());
        assertFalse(logos.get(1).isActive());
    }

    @Test
    @DisplayName("a bare array is accepted")
    void bareArray_isAccepted() throws Exception {
        Path file = dir.resolve("logos.json");
        Files.writeString(file, "[{\"id\": \"A\"}, {\"id\": \"B\"}]");

        assertEquals(2, codec.read(file).size());
    }

    @Test
    @DisplayName("missing file is an empty catalog")
    void missingFile_isEmpty() throws Exception {
        assertTrue(codec.read(dir.resolve("absent.json")).isEmpty());
    }

    @Test
    @DisplayName("an object without a logos array is an empty catalog")
    void noLogosArray_isEmpty() throws Exception {
        Path file = dir.resolve("logos.json");
        Files.writeString(file, "{\"items\": []}");

        assertTrue(codec.read(file).isEmpty());
    }

    @Test
    @DisplayName("unparsable catalog throws")
    void unparsable_throws() throws Exception {
        Path file = dir.resolve("logos.json");
        Files.writeString(file, "{not json");

        assertThrows(IOException.class, () -> codec.read(file));
    }
}
