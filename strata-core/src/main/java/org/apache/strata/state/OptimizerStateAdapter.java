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

package org.apache.strata.state;

import org.apache.strata.annotation.Public;

/** 优化器状态。ZeRO-1 优化器的状态在数据并行维度上切分,每个数据并行 rank 写自己的文件。 */
@Public
public interface OptimizerStateAdapter extends StateAdapter {

    /** 状态是否在数据并行 rank 之间切分。 */
    boolean shardedAcrossDataParallel();
}
