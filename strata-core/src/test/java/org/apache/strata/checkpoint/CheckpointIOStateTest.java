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

import org.apache.strata.collective.LocalProcessGroup;
import org.apache.strata.options.Options;
import org.apache.strata.storage.CheckpointMarker;
import org.apache.strata.storage.CheckpointStorage;
import org.apache.strata.testutils.MultiRankRunner;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.UncheckedIOException;
import java.util.Collections;

import static org.apache.strata.storage.CheckpointStorage.CHECKPOINT_MARKER;
import static org.apache.strata.storage.CheckpointStorage.DONE_MARKER;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/** Test for {@link CheckpointIOState}. */
class CheckpointIOStateTest {

    @TempDir java.nio.file.Path tempDir;

    private CheckpointStorage storage;

    @BeforeEach
    void before() {
        storage = CheckpointStorage.create(tempDir.toString(), new Options());
    }

    @Test
    void testSyncSaveRetainsNewest() {
        CheckpointIOState ioState = singleRank(false);
        for (int step = 1; step <= 3; step++) {
            String tag = "step_" + step;
            ioState.begin(storage, tag);
            assertThat(ioState.state()).isEqualTo(LifecycleState.BEGUN);
            ioState.addSaveTask(step, tag + "/model/dp_rank_00_tp_rank_00_pp_rank_00.pt");
            ioState.end(2);
            assertThat(ioState.state()).isEqualTo(LifecycleState.IDLE);
            assertThat(storage.fileExists(tag + "/" + DONE_MARKER)).isTrue();
        }
        ioState.close();

        assertThat(storage.listCompletedCheckpointTags()).containsExactly("step_2", "step_3");
        assertThat(storage.fileExists("step_1")).isFalse();
        assertThat(storage.loadObject("step_3/model/dp_rank_00_tp_rank_00_pp_rank_00.pt"))
                .isEqualTo(3);
        assertThat(ioState.relativePaths())
                .containsExactly("model/dp_rank_00_tp_rank_00_pp_rank_00.pt");
    }

    @Test
    void testAsyncSaveMarkedDoneAtNextDrain() {
        CheckpointIOState ioState = singleRank(true);

        ioState.begin(storage, "step_1");
        ioState.addSaveTask("payload-1", "step_1/scheduler.pt");
        ioState.end(1);
        assertThat(ioState.state()).isEqualTo(LifecycleState.SAVING);
        assertThat(storage.fileExists("step_1/" + CHECKPOINT_MARKER)).isTrue();
        assertThat(storage.fileExists("step_1/" + DONE_MARKER)).isFalse();

        // beginning the next checkpoint drains the previous one
        ioState.begin(storage, "step_2");
        assertThat(storage.fileExists("step_1/" + DONE_MARKER)).isTrue();
        assertThat(storage.loadObject("step_1/scheduler.pt")).isEqualTo("payload-1");

        ioState.addSaveTask("payload-2", "step_2/scheduler.pt");
        ioState.end(1);
        ioState.waitAll();
        assertThat(ioState.state()).isEqualTo(LifecycleState.IDLE);

        assertThat(storage.listCompletedCheckpointTags()).containsExactly("step_2");
        assertThat(storage.fileExists("step_1")).isFalse();
        ioState.close();
    }

    @Test
    void testAsyncRemovalCompletedOnClose() {
        CheckpointIOState ioState = singleRank(true);
        for (int step = 1; step <= 4; step++) {
            String tag = "step_" + step;
            ioState.begin(storage, tag);
            ioState.addSaveTask(step, tag + "/user_content.pt");
            ioState.end(1);
        }
        ioState.close();

        assertThat(storage.listCheckpointTags()).containsExactly("step_4");
        assertThat(storage.listCompletedCheckpointTags()).containsExactly("step_4");
    }

    @Test
    void testDoneWrittenWithoutLocalItems() {
        CheckpointIOState ioState = singleRank(true);
        ioState.begin(storage, "step_1");
        ioState.end(null);
        ioState.close();

        assertThat(storage.listCompletedCheckpointTags()).containsExactly("step_1");
    }

    @Test
    void testCrashResidueRemoved() {
        // an interrupted removal older than every completed checkpoint
        writeMarker("step_0", 1);
        storage.saveObject("stale", "step_0/model/a.pt");
        // an interrupted save newer than every completed checkpoint
        writeMarker("step_9", Long.MAX_VALUE);

        CheckpointIOState ioState = singleRank(false);
        ioState.begin(storage, "step_1");
        ioState.addSaveTask("fresh", "step_1/model/a.pt");
        ioState.end(null);
        ioState.close();

        assertThat(storage.listCheckpointTags()).containsExactly("step_1", "step_9");
        assertThat(storage.fileExists("step_0")).isFalse();
    }

    @Test
    void testBackToBackSavesKeepNewestRegardlessOfTagName() {
        CheckpointIOState ioState = singleRank(false);
        for (int step = 9999; step > 9899; step--) {
            String tag = "z" + step;
            ioState.begin(storage, tag);
            ioState.addSaveTask(step, tag + "/model/a.pt");
            ioState.end(1);
            assertThat(storage.listCompletedCheckpointTags()).containsExactly(tag);
        }
        ioState.close();
    }

    @Test
    void testCreateTimeAfterExistingCheckpoints() {
        // a checkpoint written by a coordinator whose clock runs ahead
        long ahead = System.currentTimeMillis() + 3_600_000L;
        writeMarker("step_2", ahead);
        storage.saveText("1", "step_2/" + DONE_MARKER);

        CheckpointIOState ioState = singleRank(false);
        ioState.begin(storage, "step_10");
        ioState.end(null);
        ioState.close();

        assertThat(storage.listCompletedCheckpointTags()).containsExactly("step_2", "step_10");
        assertThat(storage.latestCheckpointCreateTime()).isEqualTo(ahead + 1);
        assertThat(
                        CheckpointMarker.fromContent(
                                        storage.loadText("step_10/" + CHECKPOINT_MARKER))
                                .createTimeMillis())
                .isEqualTo(ahead + 1);
    }

    @Test
    void testExplicitRemovalIsIdempotent() {
        CheckpointIOState ioState = singleRank(false);
        ioState.begin(storage, "step_1");
        ioState.addSaveTask(1, "step_1/model/a.pt");
        ioState.end(null);

        ioState.submitRemove(null, false, Collections.singletonList("step_1"));
        assertThat(storage.listCheckpointTags()).isEmpty();

        // removing a checkpoint that no longer exists is not an error
        ioState.submitRemove(null, false, Collections.singletonList("step_1"));
        ioState.close();
    }

    @Test
    void testSaveTaskOutsideCheckpoint() {
        CheckpointIOState ioState = singleRank(false);
        assertThatThrownBy(() -> ioState.addSaveTask(1, "step_1/a.pt"))
                .isInstanceOf(IllegalStateException.class);

        ioState.begin(storage, "step_1");
        assertThatThrownBy(() -> ioState.addSaveTask(1, "step_2/a.pt"))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("is not under checkpoint step_1");
        assertThatThrownBy(() -> ioState.addSaveTask(1, "step_1_extra/a.pt"))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> ioState.end(-5)).isInstanceOf(IllegalArgumentException.class);

        ioState.end(null);
        assertThatThrownBy(() -> ioState.end(null)).isInstanceOf(IllegalStateException.class);
        ioState.close();
    }

    @Test
    void testBeginTwiceWithoutEnd() {
        CheckpointIOState ioState = singleRank(false);
        ioState.begin(storage, "step_1");
        assertThatThrownBy(() -> ioState.begin(storage, "step_2"))
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("step_1");
    }

    @Test
    void testBackgroundFailureRaisedAtDrain() {
        CheckpointIOState ioState = singleRank(true);
        ioState.begin(storage, "step_1");
        ioState.addSaveTask(new Object(), "step_1/user_content.pt");
        ioState.end(null);

        assertThatThrownBy(ioState::waitAll).isInstanceOf(UncheckedIOException.class);
        assertThat(storage.fileExists("step_1/" + DONE_MARKER)).isFalse();
    }

    @Test
    void testMultiRankSyncSave() throws Exception {
        MultiRankRunner.run(
                2,
                pg -> {
                    CheckpointIOState ioState = new CheckpointIOState(pg, pg.rank() == 0, false);
                    for (int step = 1; step <= 3; step++) {
                        String tag = "step_" + step;
                        ioState.begin(storage, tag);
                        ioState.addSaveTask(
                                pg.rank(), String.format("%s/model/rank_%d.pt", tag, pg.rank()));
                        ioState.end(1);
                    }
                    ioState.close();
                    return null;
                });

        assertThat(storage.listCheckpointTags()).containsExactly("step_3");
        assertThat(storage.loadObject("step_3/model/rank_0.pt")).isEqualTo(0);
        assertThat(storage.loadObject("step_3/model/rank_1.pt")).isEqualTo(1);
    }

    @Test
    void testMultiRankAsyncSave() throws Exception {
        MultiRankRunner.run(
                3,
                pg -> {
                    try (CheckpointIOState ioState =
                            new CheckpointIOState(pg, pg.rank() == 2, true)) {
                        for (int step = 1; step <= 3; step++) {
                            String tag = "step_" + step;
                            ioState.begin(storage, tag);
                            if (pg.rank() != 1) {
                                ioState.addSaveTask(
                                        step, String.format("%s/rank_%d.pt", tag, pg.rank()));
                            }
                            ioState.end(2);
                        }
                    }
                    return null;
                });

        assertThat(storage.listCompletedCheckpointTags()).containsExactly("step_2", "step_3");
        assertThat(storage.fileExists("step_1")).isFalse();
        assertThat(storage.loadObject("step_3/rank_2.pt")).isEqualTo(3);
    }

    private CheckpointIOState singleRank(boolean asyncSave) {
        LocalProcessGroup pg = LocalProcessGroup.create(1, 1).get(0);
        return new CheckpointIOState(pg, true, asyncSave);
    }

    private void writeMarker(String tag, long createTimeMillis) {
        storage.createDir(tag);
        storage.saveText(
                CheckpointMarker.create(createTimeMillis).toJson(), tag + "/" + CHECKPOINT_MARKER);
    }
}
