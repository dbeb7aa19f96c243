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

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;

/**
 * 包装一个原始的可变映射。
 *
 * <p>快照直接返回被包装的映射;恢复时把加载的条目逐个写回映射。严格模式下,加载的键集合与现有键集合不一致时
 * 抛出 {@link IllegalArgumentException}(映射为空时不检查)。
 *
 * <p>包装优化器状态时通过 {@link #forOptimizer(Map, boolean)} 指定是否为 ZeRO-1 切分。
 */
public class MapStateAdapter implements OptimizerStateAdapter {

    private static final Logger LOG = LoggerFactory.getLogger(MapStateAdapter.class);

    private final Map<String, Object> state;
    private final boolean shardedAcrossDataParallel;

    public MapStateAdapter(Map<String, Object> state) {
        this(state, false);
    }

    private MapStateAdapter(Map<String, Object> state, boolean shardedAcrossDataParallel) {
        this.state = state;
        this.shardedAcrossDataParallel = shardedAcrossDataParallel;
    }

    public static MapStateAdapter forOptimizer(
            Map<String, Object> state, boolean shardedAcrossDataParallel) {
        return new MapStateAdapter(state, shardedAcrossDataParallel);
    }

    public Map<String, Object> state() {
        return state;
    }

    @Override
    public Map<String, Object> snapshotState() {
        return state;
    }

    @Override
    public void restoreState(Map<String, Object> loaded, boolean strict) {
        if (strict && !state.isEmpty() && !state.keySet().equals(loaded.keySet())) {
            Set<String> missing = new HashSet<>(state.keySet());
            missing.removeAll(loaded.keySet());
            Set<String> unexpected = new HashSet<>(loaded.keySet());
            unexpected.removeAll(state.keySet());
            throw new IllegalArgumentException(
                    String.format(
                            "Error(s) in loading state: missing keys %s, unexpected keys %s.",
                            missing, unexpected));
        }
        LOG.debug("Restoring {} entries.", loaded.size());
        state.putAll(new LinkedHashMap<>(loaded));
    }

    @Override
    public boolean shardedAcrossDataParallel() {
        return shardedAcrossDataParallel;
    }
}
