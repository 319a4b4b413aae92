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

import java.util.List;

/**
 * Typed outcome of decoding loosely structured JSON: the accepted value plus every record
 * that was rejected along the way.
 *
 * @param value    decoded value
 * @param rejected records that failed validation, in document order
 * @param legacy   true when the input used the single-contest layout and was converted
 * @param <T>      decoded type
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-02-02
 * @version 1.0
 */
public record DecodeResult<T>(T value, List<RejectedRecord> rejected, boolean legacy) {

    public DecodeResult {
        rejected = List.copyOf(rejected);
    }

    public boolean hasRejections() {
        return !rejected.isEmpty();
    }
}
