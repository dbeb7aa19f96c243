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

import org.apache.strata.annotation.VisibleForTesting;
import org.apache.strata.collective.Barrier;
import org.apache.strata.storage.CheckpointMarker;
import org.apache.strata.storage.CheckpointStorage;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.annotation.Nullable;

import java.io.Closeable;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.concurrent.CompletableFuture;

import static org.apache.strata.storage.CheckpointStorage.CHECKPOINT_MARKER;
import static org.apache.strata.storage.CheckpointStorage.DONE_MARKER;
import static org.apache.strata.utils.Preconditions.checkArgument;
import static org.apache.strata.utils.Preconditions.checkNotNull;
import static org.apache.strata.utils.Preconditions.checkState;

/**
 * 检查点保存周期的状态机,每个 rank 持有一个实例。
 *
 * <p>一个周期由 {@link #begin} 开始,{@link #addSaveTask} 收集载荷,{@link #end} 结束。所有 rank 以相同的
 * 顺序调用这些方法,对存储的可见修改都由命名屏障排序:
 *
 * <ul>
 *   <li>{@code done} 标记只在所有 rank 写完该检查点的全部文件之后,由协调 rank 写入
 *   <li>删除检查点时先清除 {@code done} 标记,所有 rank 通过屏障之后才删除载荷文件
 *   <li>目录由协调 rank 在所有 rank 删除完文件之后删除
 * </ul>
 *
 * <p>同步模式下 {@link #end} 返回时检查点已经完成并执行了保留策略。异步模式下载荷在后台线程写入,周期在下一次
 * {@link #begin}、{@link #waitSave} 或 {@link #close} 时结束,后台任务的失败也在那时抛出。
 *
 * <p>崩溃时磁盘上可能留下没有 {@code done} 标记的检查点:位于第一个已完成检查点之前的是被中断的删除,会被
 * {@link RetentionPolicy} 清理;之后的是被中断的保存,会被保留。
 */
public class CheckpointIOState implements Closeable {

    private static final Logger LOG = LoggerFactory.getLogger(CheckpointIOState.class);

    private final Barrier barrier;
    private final boolean coordinator;
    private final boolean asyncSave;
    @Nullable private final AsyncTaskRunner runner;

    // relative paths written by this rank, in every cycle so far
    private final Set<String> relativePaths = new LinkedHashSet<>();
    private final List<SaveItem> saveItems = new ArrayList<>();

    private LifecycleState state = LifecycleState.IDLE;
    @Nullable private CheckpointStorage storage;
    @Nullable private String currentTag;
    @Nullable private Integer numKept;

    private boolean savePending;
    @Nullable private CompletableFuture<Void> saveFuture;

    @Nullable private List<String> removeTags;
    @Nullable private CompletableFuture<Void> removeFuture;

    /**
     * @param barrier 所有 rank 共享的屏障
     * @param coordinator 本 rank 是否负责写标记和删除目录
     * @param asyncSave 是否在后台写入载荷
     */
    public CheckpointIOState(Barrier barrier, boolean coordinator, boolean asyncSave) {
        this.barrier = checkNotNull(barrier, "barrier");
        this.coordinator = coordinator;
        this.asyncSave = asyncSave;
        this.runner = asyncSave ? new AsyncTaskRunner("checkpoint-async-io") : null;
    }

    @Nullable
    public String currentTag() {
        return currentTag;
    }

    @VisibleForTesting
    LifecycleState state() {
        return state;
    }

    @VisibleForTesting
    Set<String> relativePaths() {
        return Collections.unmodifiableSet(relativePaths);
    }

    /**
     * 开始保存一个检查点。异步模式下先排空上一个周期。
     *
     * @throws IllegalStateException 上一个周期没有调用 {@link #end}
     */
    public void begin(CheckpointStorage storage, String tag) {
        checkNotNull(storage, "storage");
        checkArgument(tag != null && !tag.isEmpty(), "Checkpoint tag must not be empty.");

        if (asyncSave && state == LifecycleState.SAVING) {
            waitSave(true);
        }
        checkState(
                state == LifecycleState.IDLE,
                "Cannot begin checkpoint %s while checkpoint %s is %s.",
                tag,
                currentTag,
                state);

        this.storage = storage;
        this.currentTag = tag;
        this.state = LifecycleState.BEGUN;

        if (coordinator) {
            LOG.info("{} saving of checkpoint {} began", asyncSave ? "async" : "synced", tag);
            long createTime = nextCreateTime(storage);
            storage.createDir(tag);
            storage.saveText(
                    CheckpointMarker.create(createTime).toJson(), tag + "/" + CHECKPOINT_MARKER);
        }
    }

    /** 创建时间严格大于已有的检查点,同一毫秒内开始的检查点仍按开始顺序排列。 */
    private static long nextCreateTime(CheckpointStorage storage) {
        long now = System.currentTimeMillis();
        Long latest = storage.latestCheckpointCreateTime();
        if (latest == null || latest < now) {
            return now;
        }
        return latest == Long.MAX_VALUE ? latest : latest + 1;
    }

    /**
     * 添加一个载荷。
     *
     * @param payload 可序列化的载荷,异步模式下写入发生在后台,调用方不能再修改它
     * @param path 形如 {@code <tag>/<relative-path>} 的路径
     * @throws IllegalArgumentException 路径不在当前检查点下
     */
    public void addSaveTask(Object payload, String path) {
        checkState(
                state == LifecycleState.BEGUN,
                "Save tasks can only be added between begin and end, current state is %s.",
                state);
        checkNotNull(payload, "payload");
        String prefix = currentTag + "/";
        checkArgument(
                path != null && path.startsWith(prefix) && path.length() > prefix.length(),
                "Checkpoint file %s is not under checkpoint %s.",
                path,
                currentTag);

        relativePaths.add(path.substring(prefix.length()));
        if (asyncSave) {
            saveItems.add(new SaveItem(payload, path));
        } else {
            checkNotNull(storage).saveObject(payload, path);
        }
    }

    /**
     * 结束当前周期。
     *
     * @param numKept 保留的已完成检查点数量,null 或 -1 表示全部保留
     */
    public void end(@Nullable Integer numKept) {
        checkState(
                state == LifecycleState.BEGUN,
                "Cannot end checkpoint %s in state %s.",
                currentTag,
                state);
        RetentionPolicy.checkNumKept(numKept);
        CheckpointStorage storage = checkNotNull(this.storage);
        this.numKept = numKept;
        this.state = LifecycleState.SAVING;

        if (asyncSave) {
            savePending = true;
            if (!saveItems.isEmpty()) {
                List<SaveItem> items = new ArrayList<>(saveItems);
                saveItems.clear();
                saveFuture =
                        checkNotNull(runner)
                                .submit(AsyncTaskRunner.Slot.SAVE, () -> bulkSave(storage, items));
            }
            if (coordinator) {
                LOG.info("async saving of checkpoint {} requested", currentTag);
            }
            return;
        }

        barrier.rendezvous("saving checkpoint done");
        if (coordinator) {
            LOG.info("synced saving of checkpoint {} completed", currentTag);
            storage.saveText("1", currentTag + "/" + DONE_MARKER);
        }
        barrier.rendezvous("mark checkpoint as done");
        state = LifecycleState.DONE_MARKED;

        submitRemove(numKept, false);
        state = LifecycleState.IDLE;
    }

    /**
     * 排空异步保存:等待后台写入,写入 {@code done} 标记,等待上一次删除,再对新的检查点列表执行保留策略。
     * 同步模式下什么都不做。
     *
     * @param asyncRemove 是否在后台删除
     */
    public void waitSave(boolean asyncRemove) {
        if (!asyncSave) {
            return;
        }

        if (state == LifecycleState.SAVING) {
            if (saveFuture != null) {
                AsyncTaskRunner.await(saveFuture);
                saveFuture = null;
            }
            barrier.rendezvous("async saving checkpoint done");
            if (savePending && coordinator) {
                checkNotNull(storage).saveText("1", currentTag + "/" + DONE_MARKER);
            }
            barrier.rendezvous("mark checkpoint as done");
            if (coordinator) {
                LOG.info("async saving of checkpoint {} completed", currentTag);
            }
            savePending = false;
            state = LifecycleState.DONE_MARKED;
        } else if (removeFuture == null) {
            // nothing in flight
            return;
        }

        waitRemove();
        submitRemove(numKept, asyncRemove);
        state = LifecycleState.IDLE;
    }

    /** 同步排空所有后台工作。 */
    public void waitAll() {
        waitSave(false);
    }

    /** 对存储中的检查点执行保留策略。 */
    public void submitRemove(@Nullable Integer numKept, boolean asyncRemove) {
        submitRemove(numKept, asyncRemove, null);
    }

    /**
     * 删除检查点。
     *
     * @param numKept 保留数量
     * @param asyncRemove 是否在后台删除文件
     * @param tags 要删除的检查点,为空时由保留策略决定
     */
    public void submitRemove(
            @Nullable Integer numKept, boolean asyncRemove, @Nullable List<String> tags) {
        CheckpointStorage storage = this.storage;
        if (storage == null) {
            return;
        }
        checkState(
                removeFuture == null,
                "Previous removal of %s must be awaited before submitting another.",
                removeTags);

        List<String> toRemove =
                tags != null && !tags.isEmpty()
                        ? new ArrayList<>(tags)
                        : RetentionPolicy.determineRemoveTags(storage, numKept);
        barrier.rendezvous("determine remove tags done");

        if (toRemove.isEmpty()) {
            if (coordinator) {
                LOG.info("no checkpoints to remove.");
            }
            return;
        }
        state = LifecycleState.RETIRING;

        if (coordinator) {
            LOG.info("removing previous checkpoint in {}", toRemove);
            List<String> cleared = new ArrayList<>();
            for (String tag : toRemove) {
                String done = tag + "/" + DONE_MARKER;
                if (storage.fileExists(done)) {
                    storage.removeFile(done);
                    cleared.add(tag);
                }
            }
            LOG.info("done tags in {} cleared", cleared);
        }
        barrier.rendezvous("done markers cleared");

        List<String> files = filesOf(toRemove);
        if (asyncRemove) {
            removeTags = toRemove;
            removeFuture =
                    checkNotNull(runner)
                            .submit(AsyncTaskRunner.Slot.REMOVE, () -> storage.removeFiles(files));
            if (coordinator) {
                LOG.info("async removal of {} requested", toRemove);
            }
        } else {
            storage.removeFiles(files);
            barrier.rendezvous("remove files done");
            if (coordinator) {
                storage.removeDirs(toRemove);
                LOG.info("removed checkpoints {}", toRemove);
            }
            barrier.rendezvous("wait for all workers to come from deletion");
        }
    }

    /** 等待后台删除结束并删除目录。没有进行中的删除时只经过最后的屏障。 */
    public void waitRemove() {
        if (removeFuture != null) {
            AsyncTaskRunner.await(removeFuture);
            List<String> tags = checkNotNull(removeTags);
            removeFuture = null;
            removeTags = null;
            barrier.rendezvous("remove files done");
            if (coordinator) {
                checkNotNull(storage).removeDirs(tags);
                LOG.info("async removal of {} completed", tags);
            }
        }
        barrier.rendezvous("wait for all workers to come from deletion");
    }

    /** 同步排空并关闭后台线程。 */
    @Override
    public void close() {
        try {
            waitAll();
        } finally {
            if (runner != null) {
                runner.close();
            }
        }
    }

    private List<String> filesOf(Collection<String> tags) {
        List<String> files = new ArrayList<>(tags.size() * relativePaths.size());
        for (String tag : tags) {
            for (String relativePath : relativePaths) {
                files.add(tag + "/" + relativePath);
            }
        }
        return files;
    }

    private static void bulkSave(CheckpointStorage storage, List<SaveItem> items) {
        for (SaveItem item : items) {
            storage.saveObject(item.payload(), item.path());
        }
    }
}
