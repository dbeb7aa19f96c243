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

package org.apache.strata;

import org.apache.strata.options.ConfigOption;
import org.apache.strata.options.Options;

import static org.apache.strata.options.ConfigOptions.key;

/**
 * 检查点的配置选项类。
 *
 * <p>该类定义了保存、加载与清理检查点的全部配置,包括:
 * <ul>
 *   <li>保存方式: checkpoint.async-save、checkpoint.sharded-tensors、checkpoint.num-workers
 *   <li>保留策略: checkpoint.num-kept
 *   <li>协调配置: checkpoint.coordinator-rank、checkpoint.delete-thread-num
 *   <li>载荷布局: checkpoint.zero1-optimizer、checkpoint.load.strict
 * </ul>
 *
 * <h2>使用示例</h2>
 * <pre>{@code
 * Options options = new Options();
 * options.set(CheckpointOptions.ASYNC_SAVE, true);
 * options.set(CheckpointOptions.NUM_KEPT, 2);
 *
 * Checkpointer checkpointer = new Checkpointer(processGroup, layout, options);
 * }</pre>
 */
public class CheckpointOptions {

    /** 是否在后台线程中保存检查点 */
    public static final ConfigOption<Boolean> ASYNC_SAVE =
            key("checkpoint.async-save")
                    .booleanType()
                    .defaultValue(false)
                    .withDescription(
                            "Whether to write checkpoint files in a background thread. The done"
                                    + " marker is written at the next synchronization point.");

    /** 保留的已完成检查点数量 */
    public static final ConfigOption<Integer> NUM_KEPT =
            key("checkpoint.num-kept")
                    .intType()
                    .noDefaultValue()
                    .withDescription(
                            "Number of completed checkpoints to keep. Unset or -1 keeps all"
                                    + " checkpoints; incomplete checkpoints older than the first"
                                    + " completed one are always removed.");

    /** 是否按张量拆分文件 */
    public static final ConfigOption<Boolean> SHARDED_TENSORS =
            key("checkpoint.sharded-tensors")
                    .booleanType()
                    .defaultValue(false)
                    .withDeprecatedKeys("checkpoint.use-xser")
                    .withDescription(
                            "Whether to write every tensor into its own file next to the payload"
                                    + " structure, splitting the writes among replicated ranks.");

    /** 非拆分模式下每个节点同时读写的 rank 数 */
    public static final ConfigOption<Integer> NUM_WORKERS =
            key("checkpoint.num-workers")
                    .intType()
                    .defaultValue(8)
                    .withDescription(
                            "Number of ranks on one node that save or load at the same time when"
                                    + " tensors are not sharded, between 1 and 32.");

    /** 负责标记文件和目录删除的 rank */
    public static final ConfigOption<Integer> COORDINATOR_RANK =
            key("checkpoint.coordinator-rank")
                    .intType()
                    .defaultValue(0)
                    .withDescription(
                            "The rank that writes markers and removes checkpoint directories.");

    /** 批量删除文件的线程数 */
    public static final ConfigOption<Integer> DELETE_THREAD_NUM =
            key("checkpoint.delete-thread-num")
                    .intType()
                    .defaultValue(Runtime.getRuntime().availableProcessors())
                    .withDescription("The maximum number of concurrent file deletions.");

    /** 优化器状态是否在数据并行维度上切分 */
    public static final ConfigOption<Boolean> ZERO1_OPTIMIZER =
            key("checkpoint.zero1-optimizer")
                    .booleanType()
                    .defaultValue(false)
                    .withDescription(
                            "Whether a raw optimizer state mapping is sharded across data parallel"
                                    + " ranks, so every data parallel rank writes its own file.");

    /** 加载模型状态时是否严格匹配 */
    public static final ConfigOption<Boolean> LOAD_STRICT =
            key("checkpoint.load.strict")
                    .booleanType()
                    .defaultValue(true)
                    .withDescription("Whether the model state must match exactly when loading.");

    private final Options options;

    public CheckpointOptions(Options options) {
        this.options = options;
    }

    public boolean asyncSave() {
        return options.get(ASYNC_SAVE);
    }

    /** 返回 null 表示保留全部。 */
    public Integer numKept() {
        return options.get(NUM_KEPT);
    }

    public boolean shardedTensors() {
        return options.get(SHARDED_TENSORS);
    }

    public int numWorkers() {
        int numWorkers = options.get(NUM_WORKERS);
        if (numWorkers < 1 || numWorkers > 32) {
            throw new IllegalArgumentException(
                    String.format(
                            "%s must be between 1 and 32, but is %s.",
                            NUM_WORKERS.key(), numWorkers));
        }
        return numWorkers;
    }

    public int coordinatorRank() {
        return options.get(COORDINATOR_RANK);
    }

    public int deleteThreadNum() {
        return options.get(DELETE_THREAD_NUM);
    }

    public boolean zero1Optimizer() {
        return options.get(ZERO1_OPTIMIZER);
    }

    public boolean loadStrict() {
        return options.get(LOAD_STRICT);
    }
}
