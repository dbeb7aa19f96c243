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

package org.apache.strata.parallel;

import org.apache.strata.annotation.Public;

import org.apache.paimon.shade.guava30.com.google.common.collect.ImmutableList;

import javax.annotation.Nullable;

import java.util.List;

import static org.apache.strata.utils.Preconditions.checkArgument;
import static org.apache.strata.utils.Preconditions.checkNotNull;

/**
 * 一个 rank 在数据并行、张量并行和流水线并行三个维度上的坐标,以及数据并行组的划分。
 *
 * <p>数据并行组内的 rank 持有相同的模型状态,保存时组内分摊写入,加载时组内分摊读取。分片文件名由坐标决定:
 *
 * <pre>{@code
 * layout.shardPath("step_1/model", true, true, false)
 * // step_1/model/dp_rank_00_tp_rank_01_pp_rank_00.pt
 * }</pre>
 */
@Public
public final class ParallelLayout {

    private final int dataParallelRank;
    private final int tensorParallelRank;
    private final int pipelineParallelRank;
    @Nullable private final List<List<Integer>> dataParallelGroups;

    /**
     * @param dataParallelGroups 数据并行组,null 表示没有冗余,每个 rank 的状态都不同
     */
    public ParallelLayout(
            int dataParallelRank,
            int tensorParallelRank,
            int pipelineParallelRank,
            @Nullable List<List<Integer>> dataParallelGroups) {
        checkArgument(
                dataParallelRank >= 0 && tensorParallelRank >= 0 && pipelineParallelRank >= 0,
                "Parallel ranks must not be negative.");
        this.dataParallelRank = dataParallelRank;
        this.tensorParallelRank = tensorParallelRank;
        this.pipelineParallelRank = pipelineParallelRank;
        this.dataParallelGroups = dataParallelGroups == null ? null : copy(dataParallelGroups);
    }

    /** 只有一个 rank、没有并行时的布局。 */
    public static ParallelLayout single() {
        return new ParallelLayout(0, 0, 0, null);
    }

    public int dataParallelRank() {
        return dataParallelRank;
    }

    public int tensorParallelRank() {
        return tensorParallelRank;
    }

    public int pipelineParallelRank() {
        return pipelineParallelRank;
    }

    @Nullable
    public List<List<Integer>> dataParallelGroups() {
        return dataParallelGroups;
    }

    /**
     * 分片文件的相对路径。
     *
     * @param prefix 目录前缀,例如 {@code step_1/model}
     * @param tp 是否带上张量并行坐标,否则为 0
     * @param pp 是否带上流水线并行坐标,否则为 0
     * @param dp 是否带上数据并行坐标,否则为 0
     */
    public String shardPath(String prefix, boolean tp, boolean pp, boolean dp) {
        checkNotNull(prefix, "prefix");
        return shardPath(
                prefix,
                dp ? dataParallelRank : 0,
                tp ? tensorParallelRank : 0,
                pp ? pipelineParallelRank : 0);
    }

    /** 给定坐标的分片文件相对路径。 */
    public static String shardPath(String prefix, int dp, int tp, int pp) {
        return String.format("%s/dp_rank_%02d_tp_rank_%02d_pp_rank_%02d.pt", prefix, dp, tp, pp);
    }

    private static List<List<Integer>> copy(List<List<Integer>> groups) {
        ImmutableList.Builder<List<Integer>> builder = ImmutableList.builder();
        for (List<Integer> group : groups) {
            builder.add(ImmutableList.copyOf(group));
        }
        return builder.build();
    }

    @Override
    public String toString() {
        return String.format(
                "ParallelLayout{dp=%s, tp=%s, pp=%s, dpGroups=%s}",
                dataParallelRank, tensorParallelRank, pipelineParallelRank, dataParallelGroups);
    }
}
