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
import io.vertx.core.Vertx;
import io.vertx.junit5.VertxExtension;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static dev.mars.arena.ledger.LedgerTestSupport.await;
import static org.awaitility.Awaitility.await;
import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for {@link LedgerSequencer}.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @version 1.0
 * @since 2026-02-05
 */
@ExtendWith(VertxExtension.class)
@DisplayName("LedgerSequencer Tests")
class LedgerSequencerTest {

    @Test
    @DisplayName("a task does not start until the previous one completes")
    void tasks_runOneAtATime() throws Exception {
        LedgerSequencer sequencer = new LedgerSequencer();
        Promise<String> first = Promise.promise();
        AtomicInteger secondStarted = new AtomicInteger();

        Future<String> a = sequencer.submit(first::future);
        Future<String> b = sequencer.submit(() -> {
            secondStarted.incrementAndGet();
            return Future.succeededFuture("second");
        });

        assertEquals(0, secondStarted.get());
        assertFalse(b.isComplete());

        first.complete("first");

        assertEquals("first", await(a));
        assertEquals("second", await(b));
        assertEquals(1, secondStarted.get());
    }

    @Test
    @DisplayName("a failed task does not block the queue")
    void failure_doesNotBlockQueue() throws Exception {
        LedgerSequencer sequencer = new LedgerSequencer();

        Future<String> failed = sequencer.submit(() -> Future.failedFuture(new IllegalStateException("boom")));
        Future<String> thrown = sequencer.submit(() -> {
            throw new IllegalArgumentException("thrown");
        });
        Future<String> next = sequencer.submit(() -> Future.succeededFuture("ok"));

        assertEquals("ok", await(next));
        assertTrue(failed.failed());
        assertInstanceOf(IllegalArgumentException.class, thrown.cause());
    }

    @Test
    @DisplayName("blocking tasks submitted concurrently complete in submission order")
    void blockingTasks_completeInOrder(Vertx vertx) {
        LedgerSequencer sequencer = new LedgerSequencer();
        List<Integer> order = Collections.synchronizedList(new ArrayList<>());

        for (int i = 0; i < 20; i++) {
            int n = i;
            sequencer.submit(() -> vertx.executeBlocking(() -> {
                Thread.sleep(n % 3);
                order.add(n);
                return n;
            }, false));
        }

        await().atMost(10, TimeUnit.SECONDS).until(() -> order.size() == 20);
        for (int i = 0; i < 20; i++) {
            assertEquals(i, order.get(i).intValue());
        }
    }
}
