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

import org.apache.strata.CheckpointOptions;
import org.apache.strata.annotation.Public;
import org.apache.strata.collective.ProcessGroup;
import org.apache.strata.fs.Path;
import org.apache.strata.options.Options;
import org.apache.strata.parallel.ParallelLayout;
import org.apache.strata.state.OptimizerStateAdapter;
import org.apache.strata.state.StateAdapter;
import org.apache.strata.storage.CheckpointStorage;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.annotation.Nullable;

import java.io.Closeable;
import java.util.List;
import java.util.Map;

import static org.apache.strata.utils.Preconditions.checkArgument;
import static org.apache.strata.utils.Preconditions.checkNotNull;
import static org.apache.strata.utils.Preconditions.checkState;

/**
 * 检查点的保存和加载入口,每个 rank 持有一个实例,所有 rank 以相同的顺序调用。
 *
 * <h2>保存</h2>
 *
 * <ul>
 *   <li>模型写入 {@code <tag>/model/<shard-key>},数据并行组内分摊写入
 *   <li>优化器写入 {@code <tag>/optim/<shard-key>};ZeRO-1 优化器每个数据并行 rank 写自己的文件
 *   <li>调度器和用户内容只由协调 rank 写入 {@code scheduler.pt} 和 {@code user_content.pt}
 * </ul>
 *
 * <p>异步模式下 {@link #saveCheckpoint} 在载荷入队后返回,检查点在下一次保存、{@link #finalizeCheckpoint()}
 * 或 {@link #close()} 时完成。训练结束前必须调用 {@link #close()},否则最后一个检查点不会被标记为完成。
 *
 * <h2>加载</h2>
 *
 * <p>不指定检查点时加载最新的已完成检查点。检查点的格式(拆分或整体)由磁盘上的文件决定,与当前配置无关。
 *
 * <pre>{@code
 * try (Checkpointer checkpointer = new Checkpointer(processGroup, layout, options)) {
 *     checkpointer.saveCheckpoint("/ckpt", "step_100", SaveRequest.builder().model(model).build());
 *     Object step = checkpointer.loadCheckpoint("/ckpt", null, LoadRequest.builder().model(model).build());
 * }
 * }</pre>
 */
@Public
public class Checkpointer implements Closeable {

    private static final Logger LOG = LoggerFactory.getLogger(Checkpointer.class);

    private static final String MODEL_DIR = "model";
    private static final String OPTIMIZER_DIR = "optim";
    private static final String SCHEDULER_FILE = "scheduler.pt";
    private static final String USER_CONTENT_FILE = "user_content.pt";

    private final ProcessGroup processGroup;
    private final ParallelLayout layout;
    private final Options options;
    private final CheckpointOptions checkpointOptions;
    private final boolean coordinator;
    private final CheckpointIOState ioState;

    public Checkpointer(ProcessGroup processGroup, ParallelLayout layout, Options options) {
        this.processGroup = checkNotNull(processGroup, "processGroup");
        this.layout = checkNotNull(layout, "layout");
        this.options = checkNotNull(options, "options");
        this.checkpointOptions = new CheckpointOptions(options);
        int coordinatorRank = checkpointOptions.coordinatorRank();
        checkArgument(
                coordinatorRank >= 0 && coordinatorRank < processGroup.worldSize(),
                "Coordinator rank %s is out of world size %s.",
                coordinatorRank,
                processGroup.worldSize());
        this.coordinator = processGroup.rank() == coordinatorRank;
        this.ioState =
                new CheckpointIOState(processGroup, coordinator, checkpointOptions.asyncSave());
    }

    /**
     * 保存一个检查点。
     *
     * @param dir 检查点根目录
     * @param tag 检查点名称,在根目录下唯一
     * @param request 要保存的载荷
     */
    public void saveCheckpoint(String dir, String tag, SaveRequest request) {
        checkNotNull(request, "request");
        CheckpointStorage storage = CheckpointStorage.create(dir, options);
        boolean sharded = checkpointOptions.shardedTensors();
        int numWorkers = checkpointOptions.numWorkers();

        if (coordinator) {
            storage.createDir(".");
        }
        ioState.begin(storage, tag);

        StateAdapter model = request.model();
        if (model != null) {
            if (coordinator) {
                storage.createDir(tag + "/" + MODEL_DIR);
            }
            TensorShardIO.save(
                    storage,
                    layout.shardPath(tag + "/" + MODEL_DIR, true, true, false),
                    model.snapshotState(),
                    ioState,
                    layout.dataParallelGroups(),
                    sharded,
                    numWorkers,
                    processGroup);
        }

        OptimizerStateAdapter optimizer = request.optimizer();
        if (optimizer != null) {
            if (coordinator) {
                storage.createDir(tag + "/" + OPTIMIZER_DIR);
            }
            boolean zero1 =
                    optimizer.shardedAcrossDataParallel() || checkpointOptions.zero1Optimizer();
            TensorShardIO.save(
                    storage,
                    layout.shardPath(tag + "/" + OPTIMIZER_DIR, true, true, zero1),
                    optimizer.snapshotState(),
                    ioState,
                    zero1 ? null : layout.dataParallelGroups(),
                    sharded,
                    numWorkers,
                    processGroup);
        }

        if (coordinator) {
            StateAdapter scheduler = request.scheduler();
            if (scheduler != null) {
                ioState.addSaveTask(
                        TensorArena.copyTensors(scheduler.snapshotState()),
                        tag + "/" + SCHEDULER_FILE);
            }
            if (request.userContent() != null) {
                ioState.addSaveTask(request.userContent(), tag + "/" + USER_CONTENT_FILE);
            }
        }

        ioState.end(checkpointOptions.numKept());
    }

    /**
     * 加载一个检查点。
     *
     * @param dir 检查点根目录
     * @param tag 检查点名称,null 表示最新的已完成检查点
     * @param request 要恢复的载荷
     * @return 保存时的用户内容,没有时为 null
     * @throws CheckpointNotExistException 检查点不存在
     */
    @Nullable
    public Object loadCheckpoint(String dir, @Nullable String tag, LoadRequest request) {
        checkNotNull(request, "request");
        CheckpointStorage storage = CheckpointStorage.create(dir, options);

        if (tag == null) {
            List<String> completed = storage.listCompletedCheckpointTags();
            if (completed.isEmpty()) {
                throw new CheckpointNotExistException(
                        String.format("No completed checkpoint found in %s.", dir));
            }
            tag = completed.get(completed.size() - 1);
        } else if (!storage.fileExists(tag)) {
            throw new CheckpointNotExistException(
                    String.format("Checkpoint %s does not exist in %s.", tag, dir));
        }

        boolean sharded = storage.isCheckpointSharded(tag);
        int numWorkers = checkpointOptions.numWorkers();
        if (coordinator) {
            LOG.info("loading checkpoint from {}", new Path(dir, tag));
        }

        StateAdapter model = request.model();
        if (model != null) {
            boolean strict =
                    request.strict() != null ? request.strict() : checkpointOptions.loadStrict();
            TensorShardIO.load(
                    storage,
                    layout.shardPath(tag + "/" + MODEL_DIR, true, true, false),
                    layout.dataParallelGroups(),
                    sharded,
                    numWorkers,
                    processGroup,
                    state -> model.restoreState(asState(state, MODEL_DIR), strict));
        }

        OptimizerStateAdapter optimizer = request.optimizer();
        if (optimizer != null) {
            String optimizerDir = tag + "/" + OPTIMIZER_DIR;
            // a second data parallel shard only exists for ZeRO-1 checkpoints
            String secondShard = ParallelLayout.shardPath(optimizerDir, 1, 0, 0);
            boolean zero1 =
                    optimizer.shardedAcrossDataParallel()
                            || checkpointOptions.zero1Optimizer()
                            || storage.fileExists(secondShard);
            TensorShardIO.load(
                    storage,
                    layout.shardPath(optimizerDir, true, true, zero1),
                    zero1 ? null : layout.dataParallelGroups(),
                    sharded,
                    numWorkers,
                    processGroup,
                    state -> optimizer.restoreState(asState(state, OPTIMIZER_DIR), false));
        }

        StateAdapter scheduler = request.scheduler();
        if (scheduler != null) {
            scheduler.restoreState(
                    asState(storage.loadObject(tag + "/" + SCHEDULER_FILE), SCHEDULER_FILE),
                    false);
        }

        Object userContent = null;
        String userContentFile = tag + "/" + USER_CONTENT_FILE;
        if (storage.fileExists(userContentFile)) {
            userContent = storage.loadObject(userContentFile);
        }

        processGroup.rendezvous("load all checkpoints done");
        return userContent;
    }

    /** 根目录下是否有已完成的检查点。 */
    public boolean hasCheckpoint(String dir) {
        return hasCheckpoint(dir, options);
    }

    public static boolean hasCheckpoint(String dir, Options options) {
        return !CheckpointStorage.create(dir, options).listCompletedCheckpointTags().isEmpty();
    }

    /** 等待所有后台保存和删除完成。 */
    public void finalizeCheckpoint() {
        ioState.waitAll();
    }

    /** 当前保存周期的状态机。 */
    public CheckpointIOState ioState() {
        return ioState;
    }

    @Override
    public void close() {
        ioState.close();
    }

    @SuppressWarnings("unchecked")
    private static Map<String, Object> asState(Object loaded, String payload) {
        checkState(
                loaded instanceof Map,
                "Checkpoint payload %s is not a state map but %s.",
                payload,
                loaded == null ? null : loaded.getClass().getName());
        return (Map<String, Object>) loaded;
    }
}
