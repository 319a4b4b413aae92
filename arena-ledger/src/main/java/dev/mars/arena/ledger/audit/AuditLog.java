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

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.ObjectWriter;
import dev.mars.arena.core.storage.StorageException;
import io.vertx.core.Future;
import io.vertx.core.Vertx;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedReader;
import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.channels.FileChannel;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;

/**
 * Append-only, newline-delimited JSON log of every rating change ({@code vote-events.ndjson}).
 *
 * <p>Each event is serialized to a single line and appended with one write on a channel opened
 * in append mode, so concurrent appends never interleave within a line. The file is never
 * rewritten: reads stream it from the first line, and lines that fail to decode (such as a tail
 * torn by a crash) are returned in {@link AuditLogSnapshot#rejected()} instead of being dropped
 * silently.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-02-03
 * @version 1.0
 */
public class AuditLog {

    private static final Logger LOG = LoggerFactory.getLogger(AuditLog.class);

    public static final String FILE_NAME = "vote-events.ndjson";

    private static final Comparator<AuditEvent> OCCURRENCE_ORDER = Comparator.comparing(AuditEvent::occurredAt);

    private final Vertx vertx;
    private final Path file;
    private final ObjectMapper mapper;
    private final ObjectWriter eventWriter;
    private final boolean fsyncEnabled;
    private final Object appendLock = new Object();

    public AuditLog(Vertx vertx, Path file, ObjectMapper mapper, boolean fsyncEnabled) {
        this.vertx = Objects.requireNonNull(vertx, "vertx");
        this.file = Objects.requireNonNull(file, "file");
        this.mapper = Objects.requireNonNull(mapper, "mapper");
        this.eventWriter = mapper.writerFor(AuditEvent.class);
        this.fsyncEnabled = fsyncEnabled;
    }

    public Path file() {
        return file;
    }

    /**
     * Appends one event as a single line.
     */
    public Future<Void> append(AuditEvent event) {
        return vertx.executeBlocking(() -> {
            byte[] line = (eventWriter.writeValueAsString(event) + "\n").getBytes(StandardCharsets.UTF_8);
            Files.createDirectories(file.toAbsolutePath().getParent());

            synchronized (appendLock) {
                try (FileChannel ch = FileChannel.open(file,
                        StandardOpenOption.CREATE,
                        StandardOpenOption.WRITE,
                        StandardOpenOption.APPEND)) {
                    ByteBuffer buf = ByteBuffer.wrap(line);
                    while (buf.hasRemaining()) {
                        ch.write(buf);
                    }
                    if (fsyncEnabled) {
                        ch.force(false);
                    }
                } catch (IOException e) {
                    throw new StorageException("Failed to append audit event " + event.id() + " to " + file, e);
                }
            }

            LOG.debug("Audit event appended: type={}, id={}, contest={}",
                    event.getClass().getSimpleName(), event.id(), event.contestId());
            return null;
        }, false);
    }

    /**
     * Reads every event in file order.
     */
    public Future<AuditLogSnapshot> readAll() {
        return vertx.executeBlocking(this::readBlocking, false);
    }

    /**
     * Reads the events of one contest in occurrence order. Events sharing an instant keep their file order.
     */
    public Future<List<AuditEvent>> readForContest(String contestId) {
        return readAll().map(snapshot -> {
            List<AuditEvent> events = new ArrayList<>();
            for (AuditEvent event : snapshot.events()) {
                if (contestId.equals(event.contestId())) {
                    events.add(event);
                }
            }
            events.sort(OCCURRENCE_ORDER);
            return events;
        });
    }

    private AuditLogSnapshot readBlocking() throws IOException {
        if (!Files.exists(file)) {
            return new AuditLogSnapshot(List.of(), List.of());
        }

        List<AuditEvent> events = new ArrayList<>();
        List<AuditLogSnapshot.RejectedLine> rejected = new ArrayList<>();
        long lineNumber = 0;
        try (BufferedReader reader = Files.newBufferedReader(file, StandardCharsets.UTF_8)) {
            String line;
            while ((line = reader.readLine()) != null) {
                lineNumber++;
                if (line.isBlank()) {
                    continue;
                }
                try {
                    events.add(mapper.readValue(line, AuditEvent.class));
                } catch (JsonProcessingException e) {
                    rejected.add(new AuditLogSnapshot.RejectedLine(lineNumber, e.getOriginalMessage()));
                }
            }
        }

        if (!rejected.isEmpty()) {
            LOG.warn("Audit log {} has {} undecodable line(s), first at line {}: {}",
                    file, rejected.size(), rejected.get(0).lineNumber(), rejected.get(0).reason());
        }
        LOG.debug("Read {} audit event(s) from {}", events.size(), file);
        return new AuditLogSnapshot(events, rejected);
    }
}
