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

import org.apache.strata.utils.FutureUtils;
import org.apache.strata.utils.ThreadPoolUtils;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.annotation.Nullable;

import java.io.Closeable;
import java.util.EnumMap;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;

import static org.apache.strata.utils.Preconditions.checkState;

/**
 * 单线程的后台任务执行器,每种任务一个槽位。
 *
 * <p>保存和删除任务在同一个守护线程上按提交顺序执行。每个槽位同时最多有一个未完成的任务,向未完成的槽位
 * 提交任务是协调错误。任务失败被 future 捕获,直到调用 {@link #await(CompletableFuture)} 时才在调用线程上抛出。
 */
public class AsyncTaskRunner implements Closeable {

    private static final Logger LOG = LoggerFactory.getLogger(AsyncTaskRunner.class);

    /** 任务槽位。 */
    public enum Slot {
        SAVE,
        REMOVE
    }

    private final ExecutorService executor;
    private final EnumMap<Slot, CompletableFuture<Void>> slots = new EnumMap<>(Slot.class);

    public AsyncTaskRunner(String name) {
        this.executor = ThreadPoolUtils.createSingleThreadExecutor(name);
    }

    /**
     * 提交任务。
     *
     * @throws IllegalStateException 槽位中的上一个任务尚未结束
     */
    public synchronized CompletableFuture<Void> submit(Slot slot, Runnable task) {
        CompletableFuture<Void> previous = slots.get(slot);
        checkState(
                previous == null || previous.isDone(),
                "A %s task is still in flight, it must be awaited before submitting another.",
                slot);

        CompletableFuture<Void> future;
        try {
            future = CompletableFuture.runAsync(task, executor);
        } catch (RejectedExecutionException e) {
            future = FutureUtils.completedExceptionally(e);
        }
        slots.put(slot, future);
        return future;
    }

    /** 槽位中最近提交的任务,可能已经结束。 */
    @Nullable
    public synchronized CompletableFuture<Void> current(Slot slot) {
        return slots.get(slot);
    }

    /**
     * 等待任务结束,失败时在调用线程上重新抛出原始异常。
     *
     * <p>运行时异常和错误原样抛出,其余异常包装为 {@link RuntimeException}。
     */
    public static void await(CompletableFuture<?> future) {
        try {
            future.get();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new RuntimeException("Interrupted while waiting for a background task.", e);
        } catch (ExecutionException e) {
            Throwable cause = FutureUtils.stripException(e);
            if (cause instanceof RuntimeException) {
                throw (RuntimeException) cause;
            } else if (cause instanceof Error) {
                throw (Error) cause;
            }
            throw new RuntimeException(cause);
        }
    }

    /** 不再接受新任务,等待已提交的任务执行完。 */
    @Override
    public void close() {
        executor.shutdown();
        try {
            if (!executor.awaitTermination(Long.MAX_VALUE, TimeUnit.MILLISECONDS)) {
                LOG.warn("Background checkpoint tasks did not terminate.");
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            executor.shutdownNow();
        }
    }
}
