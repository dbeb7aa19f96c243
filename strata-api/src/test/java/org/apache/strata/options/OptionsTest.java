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

package org.apache.strata.options;

import org.apache.strata.CheckpointOptions;

import org.junit.jupiter.api.Test;

import java.util.HashMap;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/** Test for {@link Options} and {@link CheckpointOptions}. */
class OptionsTest {

    @Test
    void testDefaults() {
        CheckpointOptions options = new CheckpointOptions(new Options());

        assertThat(options.asyncSave()).isFalse();
        assertThat(options.numKept()).isNull();
        assertThat(options.shardedTensors()).isFalse();
        assertThat(options.numWorkers()).isEqualTo(8);
        assertThat(options.coordinatorRank()).isEqualTo(0);
        assertThat(options.loadStrict()).isTrue();
        assertThat(options.deleteThreadNum()).isPositive();
    }

    @Test
    void testTypedValuesFromStrings() {
        Map<String, String> map = new HashMap<>();
        map.put("checkpoint.async-save", "TRUE");
        map.put("checkpoint.num-kept", " 3 ");
        map.put("checkpoint.num-workers", "4");
        CheckpointOptions options = new CheckpointOptions(Options.fromMap(map));

        assertThat(options.asyncSave()).isTrue();
        assertThat(options.numKept()).isEqualTo(3);
        assertThat(options.numWorkers()).isEqualTo(4);
    }

    @Test
    void testDeprecatedKey() {
        Options options = new Options();
        options.setString("checkpoint.use-xser", "true");

        assertThat(options.get(CheckpointOptions.SHARDED_TENSORS)).isTrue();
        assertThat(options.contains(CheckpointOptions.SHARDED_TENSORS)).isTrue();

        options.set(CheckpointOptions.SHARDED_TENSORS, false);
        assertThat(options.get(CheckpointOptions.SHARDED_TENSORS)).isFalse();
    }

    @Test
    void testInvalidValues() {
        Options options = new Options();
        options.setString("checkpoint.async-save", "maybe");
        assertThatThrownBy(() -> options.get(CheckpointOptions.ASYNC_SAVE))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("checkpoint.async-save");

        options.set(CheckpointOptions.NUM_WORKERS, 64);
        assertThatThrownBy(() -> new CheckpointOptions(options).numWorkers())
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("between 1 and 32");
    }

    @Test
    void testEnumConversion() {
        ConfigOption<TestMode> option =
                ConfigOptions.key("mode").enumType(TestMode.class).defaultValue(TestMode.SYNC);
        Options options = new Options();
        assertThat(options.get(option)).isEqualTo(TestMode.SYNC);

        options.setString("mode", "async");
        assertThat(options.get(option)).isEqualTo(TestMode.ASYNC);
    }

    private enum TestMode {
        SYNC,
        ASYNC
    }
}
