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

package org.apache.strata.fs.local;

import org.apache.strata.fs.FileIO;
import org.apache.strata.fs.FileStatus;
import org.apache.strata.fs.Path;
import org.apache.strata.fs.UnsupportedSchemeException;
import org.apache.strata.options.Options;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.FileAlreadyExistsException;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/** Test for {@link LocalFileIO}. */
class LocalFileIOTest {

    @TempDir java.nio.file.Path tempDir;

    @Test
    void testWriteReadAndOverwrite() throws Exception {
        FileIO fileIO = LocalFileIO.create();
        Path file = new Path(tempDir.toString(), "step_1/done");

        fileIO.writeFile(file, "1", false);
        assertThat(fileIO.readFileUtf8(file)).isEqualTo("1");

        assertThatThrownBy(() -> fileIO.writeFile(file, "2", false))
                .isInstanceOf(FileAlreadyExistsException.class);

        fileIO.overwriteFileUtf8(file, "2");
        assertThat(fileIO.readFileUtf8(file)).isEqualTo("2");
    }

    @Test
    void testDeleteIsIdempotent() throws Exception {
        FileIO fileIO = LocalFileIO.create();
        Path file = new Path(tempDir.toString(), "a/b/c.pt");
        fileIO.writeFile(file, "x", false);

        assertThat(fileIO.delete(file, false)).isTrue();
        assertThat(fileIO.delete(file, false)).isFalse();
        assertThat(fileIO.exists(file)).isFalse();

        Path dir = new Path(tempDir.toString(), "a");
        assertThat(fileIO.delete(dir, true)).isTrue();
        assertThat(fileIO.exists(dir)).isFalse();
    }

    @Test
    void testListDirectories() throws Exception {
        FileIO fileIO = LocalFileIO.create();
        Path root = new Path(tempDir.toString());
        fileIO.mkdirs(new Path(root, "step_1"));
        fileIO.mkdirs(new Path(root, "step_2"));
        fileIO.writeFile(new Path(root, "latest"), "step_2", false);

        FileStatus[] directories = fileIO.listDirectories(root);
        assertThat(directories)
                .extracting(status -> status.getPath().getName())
                .containsExactlyInAnyOrder("step_1", "step_2");
        assertThat(fileIO.listStatus(new Path(root, "missing"))).isEmpty();
    }

    @Test
    void testConcurrentMkdirs() throws Exception {
        FileIO fileIO = LocalFileIO.create();
        Path shared = new Path(tempDir.toString(), "model/x.pt.tensors");

        assertThat(fileIO.mkdirs(shared)).isTrue();
        assertThat(fileIO.mkdirs(shared)).isTrue();
        assertThat(fileIO.isDir(shared)).isTrue();
    }

    @Test
    void testAtomicWrite() throws Exception {
        FileIO fileIO = LocalFileIO.create();
        Path marker = new Path(tempDir.toString(), "step_1/checkpoint");

        assertThat(fileIO.tryToWriteAtomic(marker, "{}")).isTrue();
        assertThat(fileIO.tryToWriteAtomic(marker, "{}")).isFalse();
        assertThat(fileIO.listStatus(marker.getParent())).hasSize(1);
    }

    @Test
    void testGetBySchemeAndServiceLoader() throws Exception {
        assertThat(FileIO.get(new Path(tempDir.toString()), new Options()))
                .isInstanceOf(LocalFileIO.class);
        assertThat(FileIO.get(new Path("file://" + tempDir), new Options()))
                .isInstanceOf(LocalFileIO.class);
        assertThatThrownBy(() -> FileIO.get(new Path("unknown://bucket/ckpt"), new Options()))
                .isInstanceOf(UnsupportedSchemeException.class);
    }
}
