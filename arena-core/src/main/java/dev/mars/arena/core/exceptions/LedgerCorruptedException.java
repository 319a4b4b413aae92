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

package dev.mars.arena.core.exceptions;

import java.nio.file.Path;

/**
 * Exception thrown when the primary ledger file cannot be parsed and no backup
 * could be restored in its place. The cause is the original parse error.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-02-02
 * @version 1.0
 */
public class LedgerCorruptedException extends ArenaException {

    private final Path file;

    public LedgerCorruptedException(Path file, Throwable cause) {
        super("Ledger file " + file + " is corrupted and no backup could be restored", cause);
        this.file = file;
    }

    public Path getFile() {
        return file;
    }
}
