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

package org.apache.strata.checkpoint;

import org.apache.strata.fs.Path;
import org.apache.strata.fs.local.LocalFileIO;
import org.apache.strata.parallel.ParallelLayout;
import org.apache.strata.storage.FileSystemCheckpointStorage;
import org.apache.strata.tensor.DataType;
import org.apache.strata.tensor.Tensor;
import org.apache.strata.testutils.MultiRankRunner;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/** Test for {@link TensorShardIO}. */
class TensorShardIOTest {

    private static final List<List<Integer>> GROUPS =
            Arrays.asList(Arrays.asList(0, 1), Arrays.asList(2, 3));

    @TempDir java.nio.file.Path tempDir;

    private CountingStorage storage;

    @BeforeEach
    void before() {
        storage = new CountingStorage(new Path(tempDir.toString()));
    }

    @Test
    void testGroupInfo() {
        TensorShardIO.GroupInfo info = TensorShardIO.groupInfo(GROUPS, 3);
        assertThat(info.rankInGroup()).isEqualTo(1);
        assertThat(info.groupSize()).isEqualTo(2);

        assertThatThrownBy(() -> TensorShardIO.groupInfo(GROUPS, 4))
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("global rank 4 is not in groups");
    }

    @Test
    void testAssignTensorsToBins() {
        List<Tensor> tensors =
                Arrays.asList(
                        Tensor.fromBytes(new byte[10]),
                        Tensor.fromBytes(new byte[20]),
                        Tensor.fromBytes(new byte[30]));
        List<List<Integer>> bins = TensorShardIO.assignTensorsToBins(tensors, 2);
        assertThat(bins).hasSize(2);
        assertThat(bins.get(0)).containsExactly(0, 2);
        assertThat(bins.get(1)).containsExactly(1);

        // more bins than tensors leaves some bins empty
        assertThat(TensorShardIO.assignTensorsToBins(tensors, 4).get(3)).isEmpty();
    }

    @Test
    void testShardedSaveWritesDisjointFiles() throws Exception {
        List<Set<String>> written = saveSharded(GROUPS);

        String folder = "model/dp_rank_00_tp_rank_00_pp_rank_00.pt";
        assertThat(written.get(0))
                .containsExactlyInAnyOrder(
                        folder + ".tensors/tensor_0.pt",
                        folder + ".tensors/tensor_2.pt",
                        folder,
                        folder + ".info.pt");
        assertThat(written.get(1)).containsExactly(folder + ".tensors/tensor_1.pt");
        assertThat(storage.isCheckpointSharded("step_1")).isTrue();
    }

    @Test
    void testShardedLoadReadsEachTensorOnce() throws Exception {
        saveSharded(GROUPS);

        List<Object> loaded =
                MultiRankRunner.run(
                        4, pg -> TensorShardIO.loadSharded(storage, path(pg.rank()), GROUPS, pg));

        for (int rank = 0; rank < 4; rank++) {
            assertThat(loaded.get(rank)).isEqualTo(state(rank / 2));
        }
        assertThat(storage.tensorReads).hasSize(6);
        for (AtomicInteger reads : storage.tensorReads.values()) {
            assertThat(reads.get()).isEqualTo(1);
        }
    }

    @Test
    void testShardedLoadWithoutTensorInfo() throws Exception {
        saveSharded(GROUPS);
        storage.removeFile(path(0) + ".info.pt");

        List<Object> loaded =
                MultiRankRunner.run(
                        4, pg -> TensorShardIO.loadSharded(storage, path(pg.rank()), GROUPS, pg));

        assertThat(loaded.get(0)).isEqualTo(state(0));
        assertThat(loaded.get(1)).isEqualTo(state(0));
        // every rank of the first group reads every tensor
        assertThat(storage.tensorReads.get(tensorFile(1, 0)).get()).isEqualTo(2);
        assertThat(storage.tensorReads.get(tensorFile(2, 1)).get()).isEqualTo(1);
    }

    @Test
    void testShardedLoadKeepsSignedZeros() throws Exception {
        List<List<Integer>> groups = Collections.singletonList(Arrays.asList(0, 1));
        String path = ParallelLayout.shardPath("step_1/model", 0, 0, 0);
        MultiRankRunner.run(
                2,
                pg -> {
                    CheckpointIOState ioState = new CheckpointIOState(pg, pg.rank() == 0, false);
                    ioState.begin(storage, "step_1");
                    TensorShardIO.saveSharded(
                            storage, path, signedZeros(), ioState, groups, pg.rank());
                    ioState.end(null);
                    return null;
                });

        List<Object> loaded =
                MultiRankRunner.run(
                        2, pg -> TensorShardIO.loadSharded(storage, path, groups, pg));

        Map<String, Object> expected = signedZeros();
        for (Object state : loaded) {
            assertThat(state).isEqualTo(expected);
            Tensor weight = (Tensor) ((Map<?, ?>) state).get("float32");
            assertThat(Float.floatToRawIntBits((float) weight.getDouble(0)))
                    .isEqualTo(Float.floatToRawIntBits(-0f));
        }
    }

    @Test
    void testShardedSaveWithoutGroups() throws Exception {
        List<Set<String>> written =
                MultiRankRunner.run(
                        2,
                        pg -> {
                            CheckpointIOState ioState =
                                    new CheckpointIOState(pg, pg.rank() == 0, false);
                            ioState.begin(storage, "step_1");
                            TensorShardIO.saveSharded(
                                    storage,
                                    optimizerPath(pg.rank()),
                                    state(pg.rank()),
                                    ioState,
                                    null,
                                    pg.rank());
                            ioState.end(null);
                            return ioState.relativePaths();
                        });
        // three tensors, the structure and the tensor info
        assertThat(written.get(1)).hasSize(5);

        List<Object> loaded =
                MultiRankRunner.run(
                        2,
                        pg ->
                                TensorShardIO.loadSharded(
                                        storage, optimizerPath(pg.rank()), null, pg));
        assertThat(loaded.get(0)).isEqualTo(state(0));
        assertThat(loaded.get(1)).isEqualTo(state(1));
    }

    @Test
    void testWholeSaveOnlyFirstRankOfGroupWrites() throws Exception {
        List<Set<String>> written =
                MultiRankRunner.run(
                        4,
                        2,
                        pg -> {
                            CheckpointIOState ioState =
                                    new CheckpointIOState(pg, pg.rank() == 0, false);
                            ioState.begin(storage, "step_1");
                            TensorShardIO.saveWhole(
                                    path(pg.rank()), state(pg.rank() / 2), ioState, GROUPS, 1, pg);
                            ioState.end(null);
                            return ioState.relativePaths();
                        });

        assertThat(written.get(0)).hasSize(1);
        assertThat(written.get(1)).isEmpty();
        assertThat(written.get(2)).hasSize(1);
        assertThat(written.get(3)).isEmpty();
        assertThat(storage.isCheckpointSharded("step_1")).isFalse();

        List<Object> loaded = new ArrayList<>();
        for (int i = 0; i < 4; i++) {
            loaded.add(null);
        }
        MultiRankRunner.run(
                4,
                2,
                pg -> {
                    TensorShardIO.loadWhole(
                            storage,
                            path(pg.rank()),
                            1,
                            pg,
                            state -> loaded.set(pg.rank(), state));
                    return null;
                });
        assertThat(loaded.get(1)).isEqualTo(state(0));
        assertThat(loaded.get(3)).isEqualTo(state(1));
    }

    @Test
    void testSavedTensorsAreSnapshots() {
        Map<String, Object> state = state(0);
        Tensor tensor = (Tensor) state.get("a");

        Object copy = TensorArena.copyTensors(state);
        tensor.data()[0] = 42;

        assertThat(((Tensor) ((Map<?, ?>) copy).get("a")).data()[0]).isEqualTo((byte) 0);
    }

    private List<Set<String>> saveSharded(List<List<Integer>> groups) throws Exception {
        return MultiRankRunner.run(
                4,
                pg -> {
                    CheckpointIOState ioState = new CheckpointIOState(pg, pg.rank() == 0, false);
                    ioState.begin(storage, "step_1");
                    TensorShardIO.saveSharded(
                            storage,
                            path(pg.rank()),
                            state(pg.rank() / 2),
                            ioState,
                            groups,
                            pg.rank());
                    ioState.end(null);
                    return ioState.relativePaths();
                });
    }

    private static String path(int rank) {
        return ParallelLayout.shardPath("step_1/model", 0, rank / 2, 0);
    }

    private static String optimizerPath(int rank) {
        return ParallelLayout.shardPath("step_1/optim", rank, 0, 0);
    }

    private static String tensorFile(int id, int group) {
        return TensorShardIO.tensorFile(TensorShardIO.tensorsFolder(path(group * 2)), id);
    }

    /** The state held by every rank of one data parallel group. */
    private static Map<String, Object> state(int group) {
        Map<String, Object> state = new LinkedHashMap<>();
        state.put("a", filled(10, group));
        state.put("b", Arrays.asList(filled(20, group + 1), 7));
        state.put("c", filled(30, group + 2));
        state.put("name", "layer");
        return state;
    }

    private static Map<String, Object> signedZeros() {
        Map<String, Object> state = new LinkedHashMap<>();
        state.put("float32", Tensor.fromFloats(new long[] {2}, new float[] {-0f, 1f}));
        state.put("float64", Tensor.fromDoubles(new long[] {2}, new double[] {-0d, -2.5}));
        state.put(
                "float16",
                Tensor.fromHalfFloats(new long[] {2}, DataType.FLOAT16, new float[] {-0f, 3f}));
        state.put(
                "bfloat16",
                Tensor.fromHalfFloats(new long[] {2}, DataType.BFLOAT16, new float[] {-0f, -1f}));
        return state;
    }

    private static Tensor filled(int length, int offset) {
        byte[] bytes = new byte[length];
        for (int i = 0; i < length; i++) {
            bytes[i] = (byte) (i * offset);
        }
        return Tensor.fromBytes(bytes);
    }

    /** Counts how often every tensor file is read. */
    private static class CountingStorage extends FileSystemCheckpointStorage {

        private final Map<String, AtomicInteger> tensorReads = new ConcurrentHashMap<>();

        private CountingStorage(Path root) {
            super(LocalFileIO.create(), root, 2);
        }

        @Override
        public Object loadObject(String path) {
            if (path.contains(".tensors/")) {
                tensorReads.computeIfAbsent(path, p -> new AtomicInteger()).incrementAndGet();
            }
            return super.loadObject(path);
        }
    }
}
