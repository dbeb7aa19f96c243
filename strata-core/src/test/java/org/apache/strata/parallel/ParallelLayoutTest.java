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

import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/** Test for {@link ParallelLayout}. */
class ParallelLayoutTest {

    @Test
    void testShardPath() {
        ParallelLayout layout = new ParallelLayout(3, 1, 2, null);

        assertThat(layout.shardPath("step_1/model", true, true, false))
                .isEqualTo("step_1/model/dp_rank_00_tp_rank_01_pp_rank_02.pt");
        assertThat(layout.shardPath("step_1/optim", true, true, true))
                .isEqualTo("step_1/optim/dp_rank_03_tp_rank_01_pp_rank_02.pt");
        assertThat(ParallelLayout.single().shardPath("s", false, false, false))
                .isEqualTo("s/dp_rank_00_tp_rank_00_pp_rank_00.pt");
    }

    @Test
    void testGroupsCopied() {
        List<List<Integer>> groups = new ArrayList<>();
        groups.add(new ArrayList<>(Arrays.asList(0, 1)));
        ParallelLayout layout = new ParallelLayout(0, 0, 0, groups);

        groups.get(0).add(2);
        assertThat(layout.dataParallelGroups()).containsExactly(Arrays.asList(0, 1));
        assertThatThrownBy(() -> layout.dataParallelGroups().add(Arrays.asList(5)))
                .isInstanceOf(UnsupportedOperationException.class);
    }

    @Test
    void testNegativeRank() {
        assertThatThrownBy(() -> new ParallelLayout(-1, 0, 0, null))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
