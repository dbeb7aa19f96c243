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

import org.apache.strata.tensor.Tensor;
import org.apache.strata.testutils.MultiRankRunner;

import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/** Test for {@link LocalProcessGroup}. */
class LocalProcessGroupTest {

    @Test
    void testRankNumbering() {
        List<LocalProcessGroup> groups = LocalProcessGroup.create(4, 2);
        assertThat(groups).hasSize(4);
        assertThat(groups.get(3).rank()).isEqualTo(3);
        assertThat(groups.get(3).localRank()).isEqualTo(1);
        assertThat(groups.get(2).localRank()).isEqualTo(0);
        assertThat(groups.get(0).worldSize()).isEqualTo(4);
        assertThat(groups.get(0).localWorldSize()).isEqualTo(2);

        assertThatThrownBy(() -> LocalProcessGroup.create(3, 2))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void testBarrierWaitsForAllRanks() throws Exception {
        AtomicInteger arrived = new AtomicInteger();
        List<Integer> seen =
                MultiRankRunner.run(
                        3,
                        pg -> {
                            arrived.incrementAndGet();
                            pg.rendezvous("first");
                            int count = arrived.get();
                            pg.rendezvous("second");
                            return count;
                        });
        assertThat(seen).containsExactly(3, 3, 3);
    }

    @Test
    void testBarrierGenerationAdvances() throws Exception {
        List<LocalProcessGroup> groups = LocalProcessGroup.create(2, 2);
        MultiRankRunner.run(
                groups,
                pg -> {
                    pg.rendezvous("a");
                    pg.rendezvous("b");
                    return null;
                });
        assertThat(groups.get(0).barrierGeneration()).isEqualTo(2);
    }

    @Test
    void testBarrierNameMismatch() {
        assertThatThrownBy(
                        () ->
                                MultiRankRunner.run(
                                        2,
                                        pg -> {
                                            pg.rendezvous(pg.rank() == 0 ? "save" : "load");
                                            return null;
                                        }))
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("while other ranks are waiting at");
    }

    @Test
    void testAllReduceSumWithinGroups() throws Exception {
        List<List<Integer>> groups = Arrays.asList(Arrays.asList(0, 1), Arrays.asList(2, 3));
        List<Tensor> results =
                MultiRankRunner.run(
                        4,
                        pg -> {
                            Tensor tensor = Tensor.fromBytes(new byte[] {(byte) pg.rank(), 1});
                            pg.allReduceSum(Collections.singletonList(tensor), groups);
                            return tensor;
                        });

        assertThat(results.get(0).data()).containsExactly(1, 2);
        assertThat(results.get(1).data()).containsExactly(1, 2);
        assertThat(results.get(2).data()).containsExactly(5, 2);
        assertThat(results.get(3).data()).containsExactly(5, 2);
    }

    @Test
    void testAllReduceSumOverWorld() throws Exception {
        List<Tensor> results =
                MultiRankRunner.run(
                        3,
                        pg -> {
                            Tensor tensor =
                                    Tensor.fromLongs(new long[] {2}, new long[] {pg.rank(), 10});
                            pg.allReduceSum(Collections.singletonList(tensor), null);
                            return tensor;
                        });

        for (Tensor tensor : results) {
            assertThat(tensor)
                    .isEqualTo(Tensor.fromLongs(new long[] {2}, new long[] {3, 30}));
        }
    }

    @Test
    void testRankNotInGroups() {
        LocalProcessGroup pg = LocalProcessGroup.create(3, 3).get(2);
        List<List<Integer>> groups = Collections.singletonList(Arrays.asList(0, 1));
        assertThatThrownBy(
                        () ->
                                pg.allReduceSum(
                                        Collections.singletonList(
                                                Tensor.fromBytes(new byte[] {1})),
                                        groups))
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("global rank 2 is not in groups");
    }
}
