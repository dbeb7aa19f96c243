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

package org.apache.strata.utils;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.function.Function;

import static org.apache.strata.utils.Preconditions.checkArgument;

/**
 * 装箱工具。
 *
 * <ul>
 *   <li>{@link #packForOrdered}: 保持输入顺序,按目标重量切分成若干批次,用于批量删除文件
 *   <li>{@link #packForFixedBinNumberStable}: 把带权重的项目分配到固定数量的箱子,各进程独立计算得到
 *       相同结果,用于在同一 rank 组内分配张量写入
 * </ul>
 */
public class BinPacking {
    private BinPacking() {}

    /**
     * 按顺序装箱:累计重量超过目标重量时开启新箱子。
     *
     * @param items 待装箱项目
     * @param weightFunc 权重函数
     * @param targetWeight 每箱的目标重量
     * @return 保持原顺序的分箱结果
     */
    public static <T> List<List<T>> packForOrdered(
            Iterable<T> items, Function<T, Long> weightFunc, long targetWeight) {
        List<List<T>> packed = new ArrayList<>();

        List<T> binItems = new ArrayList<>();
        long binWeight = 0L;

        for (T item : items) {
            long weight = weightFunc.apply(item);
            // close the current bin once it is full, unless it is still empty
            if (binWeight + weight > targetWeight && binItems.size() > 0) {
                packed.add(binItems);
                binItems = new ArrayList<>();
                binWeight = 0;
            }

            binWeight += weight;
            binItems.add(item);
        }

        if (binItems.size() > 0) {
            packed.add(binItems);
        }
        return packed;
    }

    /**
     * 固定箱子数量的确定性装箱。
     *
     * <p>算法:
     * <ol>
     *   <li>按权重升序稳定排序,权重相同的项目保持原下标顺序
     *   <li>依次把项目放入当前总重量最小的箱子,总重量相同时选下标最小的箱子
     * </ol>
     *
     * <p>结果只依赖于权重列表和箱子数量,所有进程对同一输入得到相同的分配。
     *
     * @param weights 每个项目的权重
     * @param binNumber 箱子数量,必须大于 0
     * @return 恰好 {@code binNumber} 个箱子,每个箱子是项目下标的列表(可能为空)
     */
    public static List<List<Integer>> packForFixedBinNumberStable(
            List<Long> weights, int binNumber) {
        checkArgument(binNumber > 0, "Bin number must be positive, but is %s.", binNumber);

        List<Integer> sorted = new ArrayList<>(weights.size());
        for (int i = 0; i < weights.size(); i++) {
            sorted.add(i);
        }
        // List.sort is a stable merge sort
        sorted.sort((a, b) -> Long.compare(weights.get(a), weights.get(b)));

        List<List<Integer>> bins = new ArrayList<>(binNumber);
        long[] binWeights = new long[binNumber];
        for (int i = 0; i < binNumber; i++) {
            bins.add(new ArrayList<>());
        }

        for (int index : sorted) {
            int target = 0;
            for (int bin = 1; bin < binNumber; bin++) {
                if (binWeights[bin] < binWeights[target]) {
                    target = bin;
                }
            }
            bins.get(target).add(index);
            binWeights[target] += weights.get(index);
        }

        for (int i = 0; i < binNumber; i++) {
            bins.set(i, Collections.unmodifiableList(bins.get(i)));
        }
        return bins;
    }
}
