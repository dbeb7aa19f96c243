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

package org.apache.strata.fs;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/** Test for {@link Path}. */
class PathTest {

    @Test
    void testResolveChild() {
        Path root = new Path("/ckpt/run-1/");
        Path shard = new Path(root, "step_100/model/dp_rank_00_tp_rank_00_pp_rank_00.pt");

        assertThat(shard.toString())
                .isEqualTo("/ckpt/run-1/step_100/model/dp_rank_00_tp_rank_00_pp_rank_00.pt");
        assertThat(shard.getName()).isEqualTo("dp_rank_00_tp_rank_00_pp_rank_00.pt");
        assertThat(shard.getParent()).isEqualTo(new Path("/ckpt/run-1/step_100/model"));
    }

    @Test
    void testSchemeAndAuthority() {
        Path path = new Path("s3://bucket//ckpt/step_1");

        assertThat(path.toUri().getScheme()).isEqualTo("s3");
        assertThat(path.toUri().getAuthority()).isEqualTo("bucket");
        assertThat(path.toString()).isEqualTo("s3://bucket/ckpt/step_1");
        assertThat(new Path(path, "done").toString()).isEqualTo("s3://bucket/ckpt/step_1/done");
    }

    @Test
    void testRootHasNoParent() {
        assertThat(new Path("/").getParent()).isNull();
        assertThat(new Path("/a").getParent()).isEqualTo(new Path("/"));
    }

    @Test
    void testTempPathInSameDirectory() {
        Path done = new Path("/ckpt/step_1/done");
        Path tmp = done.createTempPath();

        assertThat(tmp.getParent()).isEqualTo(done.getParent());
        assertThat(tmp.getName()).startsWith(".done.").endsWith(".tmp");
    }

    @Test
    void testEmptyPath() {
        assertThatThrownBy(() -> new Path("")).isInstanceOf(IllegalArgumentException.class);
    }
}
