/*
 * Licensed to the Apache Software Foundation (ASF) under one
 * or more contributor license agreements.  See the NOTICE file
 * distributed with this work for additional information
 * regarding copyright ownership.  The ASF licenses this file
 * to you under the Apache License, Version 2.0 (the
 * "License"); you may not use this file except in compliance
 * with the License.  You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package org.apache.strata.checkpoint;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CountDownLatch;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/** Test for {@link AsyncTaskRunner}. */
class AsyncTaskRunnerTest {

    private AsyncTaskRunner runner;

    @BeforeEach
    void before() {
        runner = new AsyncTaskRunner("test-async-io");
    }

    @AfterEach
    void after() {
        runner.close();
    }

    @Test
    void testTasksRunInSubmissionOrder() {
        List<String> order = Collections.synchronizedList(new ArrayList<>());
        CompletableFuture<Void> save =
                runner.submit(AsyncTaskRunner.Slot.SAVE, () -> order.add("save"));
        CompletableFuture<Void> remove =
                runner.submit(AsyncTaskRunner.Slot.REMOVE, () -> order.add("remove"));

        AsyncTaskRunner.await(remove);
        AsyncTaskRunner.await(save);
        assertThat(order).containsExactly("save", "remove");
    }

    @Test
    void testBusySlotRejected() throws Exception {
        CountDownLatch release = new CountDownLatch(1);
        CompletableFuture<Void> blocked =
                runner.submit(AsyncTaskRunner.Slot.SAVE, () -> awaitQuietly(release));

        assertThatThrownBy(() -> runner.submit(AsyncTaskRunner.Slot.SAVE, () -> {}))
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("SAVE");
        assertThat(runner.current(AsyncTaskRunner.Slot.SAVE)).isSameAs(blocked);

        release.countDown();
        AsyncTaskRunner.await(blocked);
        AsyncTaskRunner.await(runner.submit(AsyncTaskRunner.Slot.SAVE, () -> {}));
    }

    @Test
    void testFailureRaisedOnAwait() {
        CompletableFuture<Void> future =
                runner.submit(
                        AsyncTaskRunner.Slot.REMOVE,
                        () -> {
                            throw new UncheckedIOException(
                                    "Failed to remove step_1/done", new IOException("disk"));
                        });

        assertThatThrownBy(() -> AsyncTaskRunner.await(future))
                .isInstanceOf(UncheckedIOException.class)
                .hasMessageContaining("step_1/done");

        // a failed task frees its slot
        AsyncTaskRunner.await(runner.submit(AsyncTaskRunner.Slot.REMOVE, () -> {}));
    }

    @Test
    void testSubmitAfterClose() {
        runner.close();
        CompletableFuture<Void> future = runner.submit(AsyncTaskRunner.Slot.SAVE, () -> {});
        assertThatThrownBy(() -> AsyncTaskRunner.await(future))
                .isInstanceOf(RuntimeException.class);
    }

    private static void awaitQuietly(CountDownLatch latch) {
        try {
            latch.await();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }
}
