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

import org.apache.strata.fs.FileIO;
import org.apache.strata.fs.FileStatus;
import org.apache.strata.fs.Path;
import org.apache.strata.fs.PositionOutputStream;
import org.apache.strata.fs.SeekableInputStream;
import org.apache.strata.utils.BinPacking;
import org.apache.strata.utils.FileOperationThreadPool;
import org.apache.strata.utils.FutureUtils;
import org.apache.strata.utils.InstantiationUtil;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.annotation.Nullable;

import java.io.FileNotFoundException;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ThreadPoolExecutor;

import static org.apache.strata.utils.Preconditions.checkArgument;

/**
 * 基于 {@link FileIO} 的 {@link CheckpointStorage}。
 *
 * <p>检查点列表按 {@code checkpoint} 标记中的创建时间排序,时间相同按名称排序;旧版本的标记没有创建时间,
 * 使用标记文件的修改时间。
 *
 * <p>批量删除在 {@link FileOperationThreadPool} 上并行执行,文件按顺序切分成与线程数相当的批次。
 */
public class FileSystemCheckpointStorage implements CheckpointStorage {

    private static final Logger LOG = LoggerFactory.getLogger(FileSystemCheckpointStorage.class);

    private final FileIO fileIO;
    private final Path root;
    private final int deleteThreadNum;

    public FileSystemCheckpointStorage(FileIO fileIO, Path root, int deleteThreadNum) {
        checkArgument(
                deleteThreadNum > 0,
                "Delete thread number must be positive, but is %s.",
                deleteThreadNum);
        this.fileIO = fileIO;
        this.root = root;
        this.deleteThreadNum = deleteThreadNum;
    }

    public FileIO fileIO() {
        return fileIO;
    }

    @Override
    public String dirname() {
        return root.toString();
    }

    /** 相对路径对应的绝对路径。 */
    public Path toPath(String path) {
        return new Path(root, path);
    }

    @Override
    public void createDir(String path) {
        Path dir = toPath(path);
        try {
            fileIO.checkOrMkdirs(dir);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to create directory " + dir, e);
        }
    }

    @Override
    public void createSharedDir(String path) {
        Path dir = toPath(path);
        try {
            // other ranks may create the same directory concurrently
            if (!fileIO.mkdirs(dir) && !fileIO.exists(dir)) {
                throw new IOException("Mkdirs failed to create " + dir);
            }
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to create shared directory " + dir, e);
        }
    }

    @Override
    public void saveText(String text, String path) {
        Path file = toPath(path);
        try {
            fileIO.overwriteFileUtf8(file, text);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to write " + file, e);
        }
    }

    @Override
    public String loadText(String path) {
        Path file = toPath(path);
        try {
            return fileIO.readFileUtf8(file);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read " + file, e);
        }
    }

    @Override
    public void saveObject(Object obj, String path) {
        Path file = toPath(path);
        long start = System.currentTimeMillis();
        try (PositionOutputStream out = fileIO.newOutputStream(file, true)) {
            InstantiationUtil.serializeObject(out, obj);
            if (LOG.isDebugEnabled()) {
                LOG.debug(
                        "Saved {} ({} bytes) in {} ms.",
                        file,
                        out.getPos(),
                        System.currentTimeMillis() - start);
            }
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to save object to " + file, e);
        }
    }

    @Override
    public Object loadObject(String path) {
        Path file = toPath(path);
        try (SeekableInputStream in = fileIO.newInputStream(file)) {
            return InstantiationUtil.deserializeObject(
                    in, Thread.currentThread().getContextClassLoader());
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to load object from " + file, e);
        } catch (ClassNotFoundException e) {
            throw new UncheckedIOException(
                    "Failed to load object from " + file, new IOException(e));
        }
    }

    @Override
    public boolean fileExists(String path) {
        Path file = toPath(path);
        try {
            return fileIO.exists(file);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to check existence of " + file, e);
        }
    }

    @Override
    public void removeFile(String path) {
        Path file = toPath(path);
        try {
            if (!fileIO.delete(file, false) && fileIO.exists(file)) {
                throw new IOException("Failed to delete " + file);
            }
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to remove " + file, e);
        }
    }

    @Override
    public void removeFiles(Collection<String> paths) {
        if (paths.isEmpty()) {
            return;
        }

        long batchSize = (paths.size() + deleteThreadNum - 1) / deleteThreadNum;
        List<List<String>> batches = BinPacking.packForOrdered(paths, path -> 1L, batchSize);
        ThreadPoolExecutor executor = FileOperationThreadPool.getExecutorService(deleteThreadNum);

        List<CompletableFuture<Void>> deletionFutures = new ArrayList<>(batches.size());
        for (List<String> batch : batches) {
            deletionFutures.add(
                    CompletableFuture.runAsync(() -> batch.forEach(this::removeFile), executor));
        }

        try {
            FutureUtils.waitForAll(deletionFutures).get();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new RuntimeException("Interrupted while removing checkpoint files.", e);
        } catch (ExecutionException e) {
            Throwable cause = FutureUtils.stripException(e);
            if (cause instanceof RuntimeException) {
                throw (RuntimeException) cause;
            }
            throw new RuntimeException(cause);
        }
        LOG.debug("Removed {} files under {}.", paths.size(), root);
    }

    @Override
    public void removeDirs(Collection<String> tags) {
        for (String tag : tags) {
            Path dir = toPath(tag);
            try {
                if (!fileIO.delete(dir, true) && fileIO.exists(dir)) {
                    throw new IOException("Failed to delete directory " + dir);
                }
            } catch (IOException e) {
                throw new UncheckedIOException("Failed to remove checkpoint " + dir, e);
            }
        }
    }

    @Override
    public List<String> listCheckpointTags() {
        List<TagEntry> entries = listTagEntries();
        List<String> tags = new ArrayList<>(entries.size());
        for (TagEntry entry : entries) {
            tags.add(entry.tag);
        }
        return tags;
    }

    @Nullable
    @Override
    public Long latestCheckpointCreateTime() {
        List<TagEntry> entries = listTagEntries();
        return entries.isEmpty() ? null : entries.get(entries.size() - 1).orderKey;
    }

    private List<TagEntry> listTagEntries() {
        FileStatus[] directories;
        try {
            directories = fileIO.listDirectories(root);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to list checkpoints under " + root, e);
        }

        List<TagEntry> entries = new ArrayList<>();
        for (FileStatus directory : directories) {
            String tag = directory.getPath().getName();
            TagEntry entry = readTagEntry(tag);
            if (entry != null) {
                entries.add(entry);
            }
        }
        entries.sort(
                Comparator.comparingLong((TagEntry entry) -> entry.orderKey)
                        .thenComparing(entry -> entry.tag));
        return entries;
    }

    @Override
    public List<String> listCompletedCheckpointTags() {
        List<String> completed = new ArrayList<>();
        for (String tag : listCheckpointTags()) {
            if (fileExists(tag + "/" + DONE_MARKER)) {
                completed.add(tag);
            }
        }
        return completed;
    }

    @Override
    public boolean isCheckpointSharded(String tag) {
        for (String payload : new String[] {"model", "optim"}) {
            try {
                for (FileStatus status : fileIO.listDirectories(toPath(tag + "/" + payload))) {
                    if (status.getPath().getName().endsWith(".tensors")) {
                        return true;
                    }
                }
            } catch (IOException e) {
                throw new UncheckedIOException("Failed to inspect checkpoint " + tag, e);
            }
        }
        return false;
    }

    @Nullable
    private TagEntry readTagEntry(String tag) {
        Path marker = toPath(tag + "/" + CHECKPOINT_MARKER);
        try {
            if (!fileIO.exists(marker)) {
                // a user directory, not a checkpoint
                return null;
            }
            CheckpointMarker content = CheckpointMarker.fromContent(fileIO.readFileUtf8(marker));
            long orderKey =
                    content != null
                            ? content.createTimeMillis()
                            : fileIO.getFileStatus(marker).getModificationTime();
            return new TagEntry(tag, orderKey);
        } catch (FileNotFoundException e) {
            LOG.debug("Checkpoint marker {} disappeared while listing.", marker);
            return null;
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read checkpoint marker " + marker, e);
        }
    }

    @Override
    public String toString() {
        return "FileSystemCheckpointStorage{" + root + '}';
    }

    private static final class TagEntry {
        private final String tag;
        private final long orderKey;

        private TagEntry(String tag, long orderKey) {
            this.tag = tag;
            this.orderKey = orderKey;
        }
    }
}
