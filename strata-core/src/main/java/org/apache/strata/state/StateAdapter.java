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

import java.util.Map;

/**
 * 可以被保存到检查点并从检查点恢复的状态。
 *
 * <p>快照是由 {@code Map}、{@code List}、{@link org.apache.strata.tensor.Tensor} 和可序列化的叶子值组成的树。
 * 模型、优化器和调度器都通过该接口接入检查点,不支持的载荷类型在编译期就被排除。
 */
@Public
public interface StateAdapter {

    /** 返回当前状态的快照,保存过程不会修改返回的结构之外的任何状态。 */
    Map<String, Object> snapshotState();

    /**
     * 用加载的快照恢复状态。
     *
     * @param state 检查点中的快照
     * @param strict 为 true 时快照的键必须与当前状态完全一致
     */
    void restoreState(Map<String, Object> state, boolean strict);
}
