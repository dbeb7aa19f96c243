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

import org.junit.jupiter.api.Test;

import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/** Test for {@link MapStateAdapter}. */
class MapStateAdapterTest {

    @Test
    void testRestoreIntoEmptyMap() {
        Map<String, Object> state = new HashMap<>();
        MapStateAdapter adapter = new MapStateAdapter(state);

        adapter.restoreState(entries("step", 3), true);
        assertThat(state).containsEntry("step", 3);
        assertThat(adapter.snapshotState()).isSameAs(state);
        assertThat(adapter.shardedAcrossDataParallel()).isFalse();
    }

    @Test
    void testStrictKeyCheck() {
        MapStateAdapter adapter = new MapStateAdapter(entries("step", 1));

        assertThatThrownBy(() -> adapter.restoreState(entries("epoch", 2), true))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("missing keys [step]")
                .hasMessageContaining("unexpected keys [epoch]");

        adapter.restoreState(entries("epoch", 2), false);
        assertThat(adapter.state()).containsEntry("step", 1).containsEntry("epoch", 2);
    }

    @Test
    void testOptimizerSharding() {
        assertThat(MapStateAdapter.forOptimizer(new HashMap<>(), true).shardedAcrossDataParallel())
                .isTrue();
    }

    private static Map<String, Object> entries(String key, Object value) {
        Map<String, Object> map = new LinkedHashMap<>();
        map.put(key, value);
        return map;
    }
}
