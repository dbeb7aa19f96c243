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

package org.apache.strata.storage;

import org.apache.strata.CheckpointOptions;
import org.apache.strata.annotation.Public;
import org.apache.strata.fs.FileIO;
import org.apache.strata.fs.Path;
import org.apache.strata.options.Options;

import javax.annotation.Nullable;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.util.Collection;
import java.util.List;

import static org.apache.strata.utils.Preconditions.checkArgument;
import static org.apache.strata.utils.StringUtils.isNullOrWhitespaceOnly;

/**
 * 检查点存储端口。
 *
 * <p>所有路径都是相对于检查点根目录的相对路径,形如 {@code <tag>/<relative-path>}。一个子目录只有在包含
 * {@code checkpoint} 标记文件时才被视为检查点,包含 {@code done} 标记文件时才被视为已完成的检查点。
 *
 * <p>I/O 失败以 {@link UncheckedIOException} 抛出,消息中带有出错的路径。删除操作是幂等的:删除不存在的
 * 文件或目录不是错误。
 *
 * <h2>目录结构</h2>
 * <pre>
 * root/
 *   step_100/
 *     checkpoint
 *     model/dp_rank_00_tp_rank_00_pp_rank_00.pt
 *     optim/dp_rank_00_tp_rank_00_pp_rank_00.pt
 *     scheduler.pt
 *     user_content.pt
 *     done
 * </pre>
 */
@Public
public interface CheckpointStorage {

    /** 检查点标记文件名。 */
    String CHECKPOINT_MARKER = "checkpoint";

    /** 完成标记文件名。 */
    String DONE_MARKER = "done";

    /** 根目录。 */
    String dirname();

    /** 创建目录,已存在时不做任何事。 */
    void createDir(String path);

    /** 创建多个 rank 可能同时创建的目录。 */
    void createSharedDir(String path);

    void saveText(String text, String path);

    String loadText(String path);

    /** 以 Java 序列化写入对象,覆盖已有文件。 */
    void saveObject(Object obj, String path);

    Object loadObject(String path);

    boolean fileExists(String path);

    void removeFile(String path);

    /** 并行删除文件,不存在的文件被忽略。 */
    void removeFiles(Collection<String> paths);

    /** 递归删除检查点目录。 */
    void removeDirs(Collection<String> tags);

    /** 所有检查点,从旧到新。 */
    List<String> listCheckpointTags();

    /** 已完成的检查点,从旧到新。 */
    List<String> listCompletedCheckpointTags();

    /**
     * 最新检查点的排序键,即 {@link #listCheckpointTags()} 最后一个检查点的创建时间。
     *
     * @return 没有任何检查点时返回 null
     */
    @Nullable
    Long latestCheckpointCreateTime();

    /** 检查点是否以按张量拆分的格式保存。 */
    boolean isCheckpointSharded(String tag);

    /**
     * 根据根目录的 scheme 创建存储。
     *
     * @param root 检查点根目录
     * @param options 配置,传给 {@link FileIO} 并决定删除并发度
     */
    static CheckpointStorage create(String root, Options options) {
        checkArgument(!isNullOrWhitespaceOnly(root), "Checkpoint directory must not be empty.");
        Path rootPath = new Path(root);
        try {
            FileIO fileIO = FileIO.get(rootPath, options);
            return new FileSystemCheckpointStorage(
                    fileIO, rootPath, new CheckpointOptions(options).deleteThreadNum());
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to access checkpoint directory " + root, e);
        }
    }
}
