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

package org.apache.strata.collective;

import org.apache.strata.annotation.VisibleForTesting;
import org.apache.strata.tensor.Tensor;

import org.apache.paimon.shade.guava30.com.google.common.collect.ImmutableList;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.annotation.Nullable;
import javax.annotation.concurrent.ThreadSafe;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import static org.apache.strata.utils.Preconditions.checkArgument;
import static org.apache.strata.utils.Preconditions.checkState;

/**
 * 同一个 JVM 中以线程承载多个 rank 时使用的 {@link ProcessGroup}。
 *
 * <p>{@link #create(int, int)} 为每个 rank 返回一个句柄,句柄共享同一个协调对象。屏障按代(generation)
 * 推进:同一代中先到达的 rank 决定屏障名称,后到达的 rank 名称不一致时,该代以
 * {@link IllegalStateException} 失败,所有等待中的 rank 都会收到该异常,而不是永久挂起。
 *
 * <h2>使用示例</h2>
 * <pre>{@code
 * List<LocalProcessGroup> ranks = LocalProcessGroup.create(4, 2);
 * // 每个线程使用 ranks.get(i)
 * }</pre>
 */
@ThreadSafe
public class LocalProcessGroup implements ProcessGroup {

    private static final Logger LOG = LoggerFactory.getLogger(LocalProcessGroup.class);

    private final Shared shared;
    private final int rank;

    private LocalProcessGroup(Shared shared, int rank) {
        this.shared = shared;
        this.rank = rank;
    }

    /**
     * 创建所有 rank 的句柄。
     *
     * @param worldSize rank 总数
     * @param localWorldSize 每个节点的 rank 数,节点内编号为 {@code rank % localWorldSize}
     * @return 下标即 rank 的句柄列表
     */
    public static List<LocalProcessGroup> create(int worldSize, int localWorldSize) {
        checkArgument(worldSize > 0, "World size must be positive, but is %s.", worldSize);
        checkArgument(
                localWorldSize > 0 && worldSize % localWorldSize == 0,
                "Local world size %s must divide world size %s.",
                localWorldSize,
                worldSize);
        Shared shared = new Shared(worldSize, localWorldSize);
        List<LocalProcessGroup> groups = new ArrayList<>(worldSize);
        for (int rank = 0; rank < worldSize; rank++) {
            groups.add(new LocalProcessGroup(shared, rank));
        }
        return groups;
    }

    @Override
    public int rank() {
        return rank;
    }

    @Override
    public int worldSize() {
        return shared.worldSize;
    }

    @Override
    public int localRank() {
        return rank % shared.localWorldSize;
    }

    @Override
    public int localWorldSize() {
        return shared.localWorldSize;
    }

    @Override
    public void rendezvous(String name) {
        shared.rendezvous(rank, name);
    }

    @Override
    public void allReduceSum(List<Tensor> tensors, @Nullable List<List<Integer>> groups) {
        List<Integer> group = groupOf(groups);
        shared.allReduceSum(group, group.indexOf(rank), tensors);
    }

    private List<Integer> groupOf(@Nullable List<List<Integer>> groups) {
        if (groups == null) {
            ImmutableList.Builder<Integer> all = ImmutableList.builder();
            for (int r = 0; r < shared.worldSize; r++) {
                all.add(r);
            }
            return all.build();
        }
        for (List<Integer> group : groups) {
            if (group.contains(rank)) {
                return ImmutableList.copyOf(group);
            }
        }
        throw new IllegalStateException(
                String.format("global rank %s is not in groups %s", rank, groups));
    }

    @VisibleForTesting
    long barrierGeneration() {
        synchronized (shared) {
            return shared.generation;
        }
    }

    // ------------------------------------------------------------------------

    /** 所有句柄共享的协调状态,以自身为锁。 */
    private static final class Shared {

        private final int worldSize;
        private final int localWorldSize;

        private long generation;
        private int arrived;
        @Nullable private String currentName;
        private long failedGeneration = -1;
        @Nullable private IllegalStateException failure;

        private final Map<List<Integer>, Reduction> reductions = new HashMap<>();

        private Shared(int worldSize, int localWorldSize) {
            this.worldSize = worldSize;
            this.localWorldSize = localWorldSize;
        }

        private synchronized void rendezvous(int rank, String name) {
            long myGeneration = generation;
            if (arrived == 0) {
                currentName = name;
            } else if (!name.equals(currentName)) {
                failure =
                        new IllegalStateException(
                                String.format(
                                        "Rank %s arrived at barrier '%s' while other ranks are waiting at '%s'.",
                                        rank, name, currentName));
                failedGeneration = myGeneration;
                advance();
                throw failure;
            }

            arrived++;
            if (arrived == worldSize) {
                LOG.debug("All {} ranks passed barrier '{}'.", worldSize, name);
                advance();
                return;
            }

            while (generation == myGeneration) {
                waitForOthers();
            }
            if (failedGeneration == myGeneration) {
                throw failure;
            }
        }

        private void advance() {
            arrived = 0;
            currentName = null;
            generation++;
            notifyAll();
        }

        private synchronized void allReduceSum(
                List<Integer> group, int rankInGroup, List<Tensor> tensors) {
            Reduction reduction = reductions.get(group);
            if (reduction == null) {
                reduction = new Reduction(group.size());
                reductions.put(group, reduction);
            }
            reduction.contribute(rankInGroup, tensors);

            if (reduction.isComplete()) {
                reductions.remove(group);
                reduction.reduce();
                notifyAll();
            } else {
                while (!reduction.isDone()) {
                    waitForOthers();
                }
            }
            reduction.copyResultTo(tensors);
        }

        private void waitForOthers() {
            try {
                wait();
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new RuntimeException("Interrupted while waiting for other ranks.", e);
            }
        }
    }

    /** 一次组内求和。 */
    private static final class Reduction {

        private final List<List<Tensor>> contributions;
        private int received;
        @Nullable private List<Tensor> result;
        @Nullable private IllegalStateException failure;

        private Reduction(int groupSize) {
            this.contributions = new ArrayList<>(groupSize);
            for (int i = 0; i < groupSize; i++) {
                contributions.add(null);
            }
        }

        private void contribute(int rankInGroup, List<Tensor> tensors) {
            checkState(
                    contributions.get(rankInGroup) == null,
                    "Rank %s of the group contributed twice to one reduction.",
                    rankInGroup);
            contributions.set(rankInGroup, tensors);
            received++;
        }

        private boolean isComplete() {
            return received == contributions.size();
        }

        private boolean isDone() {
            return result != null || failure != null;
        }

        private void reduce() {
            List<Tensor> first = contributions.get(0);
            List<Tensor> sum = new ArrayList<>(first.size());
            try {
                for (Tensor tensor : first) {
                    sum.add(tensor.copy());
                }
                // sum in rank order so every member sees identical bytes
                for (int i = 1; i < contributions.size(); i++) {
                    List<Tensor> other = contributions.get(i);
                    checkState(
                            other.size() == sum.size(),
                            "Ranks of one group reduce different numbers of tensors: %s and %s.",
                            sum.size(),
                            other.size());
                    for (int j = 0; j < sum.size(); j++) {
                        sum.get(j).addInPlace(other.get(j));
                    }
                }
                result = sum;
            } catch (IllegalArgumentException | IllegalStateException e) {
                failure = new IllegalStateException("All-reduce failed: " + e.getMessage(), e);
            }
        }

        private void copyResultTo(List<Tensor> tensors) {
            if (failure != null) {
                throw failure;
            }
            for (int i = 0; i < tensors.size(); i++) {
                byte[] source = result.get(i).data();
                System.arraycopy(source, 0, tensors.get(i).data(), 0, source.length);
            }
        }
    }
}
