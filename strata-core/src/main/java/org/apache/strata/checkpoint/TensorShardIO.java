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

import org.apache.strata.collective.ProcessGroup;
import org.apache.strata.storage.CheckpointStorage;
import org.apache.strata.tensor.InternalTensorReference;
import org.apache.strata.tensor.Tensor;
import org.apache.strata.tensor.TensorInfo;
import org.apache.strata.tensor.TensorReference;
import org.apache.strata.utils.BinPacking;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.annotation.Nullable;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.function.Consumer;

import static org.apache.strata.utils.Preconditions.checkArgument;
import static org.apache.strata.utils.Preconditions.checkState;

/**
 * 载荷的读写,利用数据并行组内的冗余分摊 I/O。
 *
 * <p>两种格式:
 *
 * <ul>
 *   <li>拆分格式:每个张量写成单独的 {@code <path>.tensors/tensor_<id>.pt},结构中的张量替换为
 *       {@link TensorReference},张量的形状和类型写入 {@code <path>.info.pt}。组内各 rank 按字节数分摊写入,
 *       加载时每个张量只由组内一个 rank 读取,再用组内 all-reduce 分发。
 *   <li>整体格式:整个载荷写成一个文件,组内只有第一个 rank 写入。为控制节点内的并发,本地 rank 按
 *       {@code num-workers} 分批(wave)读写。
 * </ul>
 */
public final class TensorShardIO {

    private static final Logger LOG = LoggerFactory.getLogger(TensorShardIO.class);

    private TensorShardIO() {}

    /** rank 在所属组中的位置和组的大小。 */
    public static final class GroupInfo {
        private final int rankInGroup;
        private final int groupSize;

        GroupInfo(int rankInGroup, int groupSize) {
            this.rankInGroup = rankInGroup;
            this.groupSize = groupSize;
        }

        public int rankInGroup() {
            return rankInGroup;
        }

        public int groupSize() {
            return groupSize;
        }
    }

    /**
     * 查找 rank 所属的组。
     *
     * @throws IllegalStateException rank 不在任何组中
     */
    public static GroupInfo groupInfo(List<List<Integer>> groups, int rank) {
        for (List<Integer> group : groups) {
            int index = group.indexOf(rank);
            if (index >= 0) {
                return new GroupInfo(index, group.size());
            }
        }
        throw new IllegalStateException(
                String.format("global rank %s is not in groups %s", rank, groups));
    }

    /** 按字节数把张量分到 {@code binNumber} 个组内 rank。 */
    public static List<List<Integer>> assignTensorsToBins(List<Tensor> tensors, int binNumber) {
        List<Long> weights = new ArrayList<>(tensors.size());
        for (Tensor tensor : tensors) {
            weights.add(tensor.byteSize());
        }
        return BinPacking.packForFixedBinNumberStable(weights, binNumber);
    }

    public static String tensorsFolder(String path) {
        return path + ".tensors";
    }

    public static String tensorFile(String folder, int id) {
        return folder + "/tensor_" + id + ".pt";
    }

    public static String tensorInfoFile(String path) {
        return path + ".info.pt";
    }

    /**
     * 以拆分格式保存载荷。
     *
     * @param groups 持有相同载荷的 rank 组,null 表示本 rank 写全部张量
     */
    public static void saveSharded(
            CheckpointStorage storage,
            String path,
            Object state,
            CheckpointIOState ioState,
            @Nullable List<List<Integer>> groups,
            int rank) {
        String folder = tensorsFolder(path);
        storage.createSharedDir(folder);
        GroupInfo info = groups == null ? null : groupInfo(groups, rank);

        Object rewritten =
                TensorArena.transform(
                        state,
                        value -> value instanceof Tensor,
                        leaves -> {
                            List<Tensor> tensors = new ArrayList<>(leaves.size());
                            for (Object leaf : leaves) {
                                tensors.add((Tensor) leaf);
                            }
                            Set<Integer> mine = null;
                            if (info != null) {
                                mine =
                                        new HashSet<>(
                                                assignTensorsToBins(tensors, info.groupSize)
                                                        .get(info.rankInGroup));
                            }

                            List<Object> references = new ArrayList<>(tensors.size());
                            for (int id = 0; id < tensors.size(); id++) {
                                Tensor tensor = tensors.get(id);
                                if (mine == null || mine.contains(id)) {
                                    long start = System.nanoTime();
                                    Tensor copy = tensor.copy();
                                    if (LOG.isDebugEnabled()) {
                                        LOG.debug(
                                                "Copied tensor {} of {} bytes in {} us.",
                                                id,
                                                tensor.byteSize(),
                                                (System.nanoTime() - start) / 1000);
                                    }
                                    ioState.addSaveTask(copy, tensorFile(folder, id));
                                }
                                references.add(
                                        new InternalTensorReference(
                                                id, tensor.shape(), tensor.dtype()));
                            }
                            return references;
                        });

        if (info == null || info.rankInGroup == 0) {
            Map<Integer, TensorInfo> tensorInfo = new HashMap<>();
            Object structure =
                    TensorArena.transform(
                            rewritten,
                            value -> value instanceof InternalTensorReference,
                            leaves -> {
                                List<Object> references = new ArrayList<>(leaves.size());
                                for (Object leaf : leaves) {
                                    InternalTensorReference reference =
                                            (InternalTensorReference) leaf;
                                    tensorInfo.put(reference.id(), reference.info());
                                    references.add(reference.toReference());
                                }
                                return references;
                            });
            ioState.addSaveTask(structure, path);
            ioState.addSaveTask(tensorInfo, tensorInfoFile(path));
        }
    }

    /**
     * 加载拆分格式的载荷。
     *
     * <p>有组且有元数据表时,编号为 {@code id} 的张量由组内第 {@code id % groupSize} 个 rank 读取,其余 rank
     * 分配全零张量,最后在组内求和。没有元数据表的旧检查点由每个 rank 读取全部张量。
     */
    @SuppressWarnings("unchecked")
    public static Object loadSharded(
            CheckpointStorage storage,
            String path,
            @Nullable List<List<Integer>> groups,
            ProcessGroup processGroup) {
        Object structure = storage.loadObject(path);
        String infoFile = tensorInfoFile(path);
        Map<Integer, TensorInfo> tensorInfo =
                storage.fileExists(infoFile)
                        ? (Map<Integer, TensorInfo>) storage.loadObject(infoFile)
                        : null;
        String folder = tensorsFolder(path);
        GroupInfo info =
                groups == null || tensorInfo == null
                        ? null
                        : groupInfo(groups, processGroup.rank());

        return TensorArena.transform(
                structure,
                value -> value instanceof TensorReference,
                leaves -> {
                    List<Tensor> tensors = new ArrayList<>(leaves.size());
                    for (Object leaf : leaves) {
                        int id = ((TensorReference) leaf).id();
                        if (info == null || id % info.groupSize == info.rankInGroup) {
                            tensors.add((Tensor) storage.loadObject(tensorFile(folder, id)));
                        } else {
                            TensorInfo meta = tensorInfo.get(id);
                            checkState(
                                    meta != null,
                                    "Tensor %s is missing from %s.",
                                    id,
                                    infoFile);
                            tensors.add(meta.additiveIdentity());
                        }
                    }
                    if (info != null && !tensors.isEmpty()) {
                        processGroup.allReduceSum(tensors, groups);
                    }
                    return tensors;
                });
    }

    /**
     * 以整体格式保存载荷。组内只有第一个 rank 写入,本地 rank 按 {@code numWorkers} 分批。
     *
     * @param groups 持有相同载荷的 rank 组,null 表示每个 rank 都写
     */
    public static void saveWhole(
            String path,
            Object state,
            CheckpointIOState ioState,
            @Nullable List<List<Integer>> groups,
            int numWorkers,
            ProcessGroup processGroup) {
        checkArgument(numWorkers > 0, "Number of workers must be positive, but is %s.", numWorkers);
        boolean writer = groups == null || groupInfo(groups, processGroup.rank()).rankInGroup == 0;
        int localRank = processGroup.localRank();
        for (int wave = 0; wave < waves(processGroup.localWorldSize(), numWorkers); wave++) {
            if (writer && localRank / numWorkers == wave) {
                LOG.debug("worker {} saving checkpoint {}", localRank, path);
                ioState.addSaveTask(TensorArena.copyTensors(state), path);
            }
        }
    }

    /** 以整体格式加载载荷。每一批结束时经过一个屏障,所有批次结束后再经过一个屏障。 */
    public static void loadWhole(
            CheckpointStorage storage,
            String path,
            int numWorkers,
            ProcessGroup processGroup,
            Consumer<Object> target) {
        checkArgument(numWorkers > 0, "Number of workers must be positive, but is %s.", numWorkers);
        int localRank = processGroup.localRank();
        for (int wave = 0; wave < waves(processGroup.localWorldSize(), numWorkers); wave++) {
            if (localRank / numWorkers == wave) {
                LOG.debug("worker {} loading checkpoint {}", localRank, path);
                target.accept(storage.loadObject(path));
            }
            processGroup.rendezvous("worker-" + wave + ": checkpoint loaded");
        }
        processGroup.rendezvous("load checkpoint done");
    }

    /** 按配置的格式保存。 */
    public static void save(
            CheckpointStorage storage,
            String path,
            Object state,
            CheckpointIOState ioState,
            @Nullable List<List<Integer>> groups,
            boolean sharded,
            int numWorkers,
            ProcessGroup processGroup) {
        if (sharded) {
            saveSharded(storage, path, state, ioState, groups, processGroup.rank());
        } else {
            saveWhole(path, state, ioState, groups, numWorkers, processGroup);
        }
    }

    /** 按检查点的格式加载,结果交给 {@code target}。 */
    public static void load(
            CheckpointStorage storage,
            String path,
            @Nullable List<List<Integer>> groups,
            boolean sharded,
            int numWorkers,
            ProcessGroup processGroup,
            Consumer<Object> target) {
        if (sharded) {
            target.accept(loadSharded(storage, path, groups, processGroup));
        } else {
            loadWhole(storage, path, numWorkers, processGroup, target);
        }
    }

    private static int waves(int localWorldSize, int numWorkers) {
        return (localWorldSize + numWorkers - 1) / numWorkers;
    }
}
