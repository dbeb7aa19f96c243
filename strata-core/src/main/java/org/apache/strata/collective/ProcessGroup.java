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

import org.apache.strata.annotation.Public;
import org.apache.strata.tensor.Tensor;

import javax.annotation.Nullable;

import java.util.List;

/**
 * 一个 rank 看到的进程组。
 *
 * <p>除了屏障之外,还提供本 rank 的全局编号、节点内编号,以及按组求和的 all-reduce。检查点加载时用
 * all-reduce 代替广播:组内只有一个 rank 读入张量,其余 rank 提供全零张量,求和后每个 rank 都得到该张量。
 */
@Public
public interface ProcessGroup extends Barrier {

    /** 全局 rank。 */
    int rank();

    int worldSize();

    /** 节点内的 rank。 */
    int localRank();

    /** 每个节点上的 rank 数。 */
    int localWorldSize();

    /**
     * 在本 rank 所在的组内对张量逐元素求和,结果原地写回。
     *
     * <p>同组的所有 rank 必须以相同的顺序、相同的形状和类型调用。
     *
     * @param tensors 本 rank 提供的张量
     * @param groups rank 的划分,null 表示所有 rank 构成一个组
     * @throws IllegalStateException 本 rank 不在任何组中,或组内各 rank 提供的张量不一致
     */
    void allReduceSum(List<Tensor> tensors, @Nullable List<List<Integer>> groups);
}
