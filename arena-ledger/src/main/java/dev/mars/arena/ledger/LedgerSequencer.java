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

package dev.mars.arena.ledger;

import io.vertx.core.Future;
import io.vertx.core.Promise;

import java.util.function.Supplier;

/**
 * Serializes asynchronous read-modify-write sequences on the ledger file.
 *
 * <p>Each submitted task starts only after the previous one has completed, successfully or not,
 * so two votes can never both read the same pre-vote state. All contests live in one
 * {@code votes.json}, hence a single queue per file rather than one per contest.</p>
 *
 * <p>A task must not submit to the same sequencer and wait for the result; that would wait on
 * itself.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-02-04
 * @version 1.0
 */
public final class LedgerSequencer {

    private Future<Void> tail = Future.succeededFuture();

    public synchronized <T> Future<T> submit(Supplier<Future<T>> task) {
        Promise<T> promise = Promise.promise();
        Future<Void> previous = tail;
        tail = promise.future().transform(ar -> Future.<Void>succeededFuture());

        previous.onComplete(ignored -> {
            Future<T> result;
            try {
                result = task.get();
            } catch (RuntimeException e) {
                result = Future.failedFuture(e);
            }
            result.onComplete(promise);
        });
        return promise.future();
    }
}
