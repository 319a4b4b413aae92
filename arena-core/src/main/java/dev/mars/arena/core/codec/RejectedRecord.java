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

/**
 * A record dropped while decoding, with where it was found and why.
 *
 * @param location JSON path of the rejected record, e.g. {@code contests.badge-arena.history[3]}
 * @param reason   human readable reason
 */
public record RejectedRecord(String location, String reason) {

    @Override
    public String toString() {
        return location + ": " + reason;
    }
}
