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

package dev.mars.arena.core.storage;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.channels.FileChannel;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.nio.file.StandardOpenOption;
import java.util.UUID;

/**
 * Crash-safe whole-file writer.
 *
 * <p>A write never exposes a partially written destination:</p>
 * <ol>
 *   <li>Write the payload to {@code <file>.<uuid>.tmp} in the same directory</li>
 *   <li>Fsync the temp file</li>
 *   <li>Atomically rename it over the destination</li>
 *   <li>Fsync the destination and then its directory</li>
 * </ol>
 * <p>A crash before step 3 leaves the previous file intact; a stray temp file is removed
 * when the rename did not happen. Directory fsync is skipped on Windows and a failure there
 * is only logged, the rename itself having already succeeded.</p>
 *
 * <p>This class performs blocking I/O and must be called from a worker thread.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @version 1.0
 * @since 2026-02-02
 */
public final class AtomicFileWriter {

    private static final Logger LOG = LoggerFactory.getLogger(AtomicFileWriter.class);

    private final boolean fsyncEnabled;

    public AtomicFileWriter(boolean fsyncEnabled) {
        this.fsyncEnabled = fsyncEnabled;
    }

    public boolean isFsyncEnabled() {
        return fsyncEnabled;
    }

    /**
     * Atomically replaces {@code target} with {@code data}, creating parent directories as needed.
     *
     * @throws IOException if any step before or including the rename fails
     */
    public void write(Path target, byte[] data) throws IOException {
        Path absolute = target.toAbsolutePath();
        Path dir = absolute.getParent();
        Files.createDirectories(dir);

        Path tmp = dir.resolve(absolute.getFileName() + "." + UUID.randomUUID() + ".tmp");
        boolean renamed = false;
        try {
            // Step 1-2: write and fsync the temp file
            try (FileChannel ch = FileChannel.open(tmp,
                    StandardOpenOption.CREATE_NEW,
                    StandardOpenOption.WRITE)) {
                ByteBuffer buf = ByteBuffer.wrap(data);
                while (buf.hasRemaining()) {
                    ch.write(buf);
                }
                if (fsyncEnabled) {
                    ch.force(true);
                }
            }

            // Step 3: atomic rename
            Files.move(tmp, absolute,
                    StandardCopyOption.REPLACE_EXISTING,
                    StandardCopyOption.ATOMIC_MOVE);
            renamed = true;

            // Step 4: fsync destination and directory
            if (fsyncEnabled) {
                fsyncFile(absolute);
                syncDirectory(dir);
            }
            LOG.debug("Atomically wrote {} ({} bytes)", absolute, data.length);
        } finally {
            if (!renamed) {
                deleteQuietly(tmp);
            }
        }
    }

    /**
     * Fsyncs an existing regular file.
     */
    public void fsyncFile(Path file) throws IOException {
        try (FileChannel ch = FileChannel.open(file, StandardOpenOption.READ)) {
            ch.force(true);
        }
    }

    private void syncDirectory(Path dir) {
        if (System.getProperty("os.name").toLowerCase().contains("win")) {
            // Windows doesn't support directory fsync
            return;
        }
        try (FileChannel dirChannel = FileChannel.open(dir, StandardOpenOption.READ)) {
            dirChannel.force(true);
        } catch (IOException e) {
            LOG.warn("Directory fsync failed for {}: {}", dir, e.getMessage());
        }
    }

    private static void deleteQuietly(Path tmp) {
        try {
            Files.deleteIfExists(tmp);
        } catch (IOException e) {
            LOG.warn("Failed to remove temp file {}: {}", tmp, e.getMessage());
        }
    }
}
