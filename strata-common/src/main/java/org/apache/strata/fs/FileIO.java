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

import org.apache.strata.annotation.Public;
import org.apache.strata.fs.local.LocalFileIO;
import org.apache.strata.options.Options;
import org.apache.strata.utils.IOUtils;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.annotation.concurrent.ThreadSafe;

import java.io.Closeable;
import java.io.IOException;
import java.io.OutputStreamWriter;
import java.io.Serializable;
import java.net.URI;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.ServiceLoader;

import static org.apache.strata.utils.Preconditions.checkArgument;

/**
 * 文件 I/O 接口,检查点存储读写文件的唯一入口。
 *
 * <p>实现需要是线程安全的:同一个实例会被保存线程、删除线程池以及多个 rank 同时使用。
 *
 * <h2>实现发现</h2>
 * <p>{@link #get(Path, Options)} 根据路径的 scheme 选择实现:
 * <ul>
 *   <li>没有 scheme 的路径使用 {@link LocalFileIO}
 *   <li>其余 scheme 通过 {@link ServiceLoader} 发现的 {@link FileIOLoader} 加载
 * </ul>
 *
 * <h2>使用示例</h2>
 * <pre>{@code
 * FileIO fileIO = FileIO.get(new Path("/ckpt"), new Options());
 * fileIO.overwriteFileUtf8(new Path("/ckpt/step_100/done"), "1");
 * }</pre>
 *
 * @since 0.1
 */
@Public
@ThreadSafe
public interface FileIO extends Serializable, Closeable {

    Logger LOG = LoggerFactory.getLogger(FileIO.class);

    /** 是否对象存储,对象存储上的目录只是前缀。 */
    boolean isObjectStore();

    /** 用配置初始化实现。 */
    void configure(Options options);

    /**
     * 打开文件读取。
     *
     * @param path 文件路径
     * @return 输入流
     * @throws IOException 文件不存在或无法打开
     */
    SeekableInputStream newInputStream(Path path) throws IOException;

    /**
     * 打开文件写入,父目录不存在时自动创建。
     *
     * @param path 文件路径
     * @param overwrite 文件已存在时是否覆盖
     * @return 输出流
     * @throws IOException 文件已存在且不允许覆盖,或无法创建
     */
    PositionOutputStream newOutputStream(Path path, boolean overwrite) throws IOException;

    FileStatus getFileStatus(Path path) throws IOException;

    /** 列出目录下的直接子项,目录不存在时返回空数组。 */
    FileStatus[] listStatus(Path path) throws IOException;

    /** 列出目录下的直接子目录。 */
    default FileStatus[] listDirectories(Path path) throws IOException {
        List<FileStatus> directories = new ArrayList<>();
        for (FileStatus status : listStatus(path)) {
            if (status.isDir()) {
                directories.add(status);
            }
        }
        return directories.toArray(new FileStatus[0]);
    }

    boolean exists(Path path) throws IOException;

    /**
     * 删除文件或目录。
     *
     * @param path 路径
     * @param recursive 是否递归删除非空目录
     * @return 路径被删除时返回 true,路径不存在时返回 false
     */
    boolean delete(Path path, boolean recursive) throws IOException;

    boolean mkdirs(Path path) throws IOException;

    boolean rename(Path src, Path dst) throws IOException;

    @Override
    default void close() throws IOException {}

    // -------------------------------------------------------------------------
    //                            工具方法
    // -------------------------------------------------------------------------

    default void deleteQuietly(Path file) {
        if (LOG.isDebugEnabled()) {
            LOG.debug("Ready to delete " + file.toString());
        }

        try {
            if (!delete(file, false) && exists(file)) {
                LOG.warn("Failed to delete file " + file);
            }
        } catch (IOException e) {
            LOG.warn("Exception occurs when deleting file " + file, e);
        }
    }

    default boolean isDir(Path path) throws IOException {
        return getFileStatus(path).isDir();
    }

    /** 目录存在时校验它确实是目录,否则创建。 */
    default void checkOrMkdirs(Path path) throws IOException {
        if (exists(path)) {
            checkArgument(isDir(path), "The path '%s' should be a directory.", path);
        } else {
            mkdirs(path);
        }
    }

    /** 以 UTF-8 读取整个文件。 */
    default String readFileUtf8(Path path) throws IOException {
        try (SeekableInputStream in = newInputStream(path)) {
            return new String(IOUtils.readFully(in, false), StandardCharsets.UTF_8);
        }
    }

    default void writeFile(Path path, String content, boolean overwrite) throws IOException {
        try (PositionOutputStream out = newOutputStream(path, overwrite)) {
            OutputStreamWriter writer = new OutputStreamWriter(out, StandardCharsets.UTF_8);
            writer.write(content);
            writer.flush();
        }
    }

    default void overwriteFileUtf8(Path path, String content) throws IOException {
        writeFile(path, content, true);
    }

    /**
     * 先写临时文件再改名,目标文件要么不存在,要么内容完整。
     *
     * @return 改名成功时返回 true
     */
    default boolean tryToWriteAtomic(Path path, String content) throws IOException {
        Path tmp = path.createTempPath();
        boolean success = false;
        try {
            writeFile(tmp, content, false);
            success = rename(tmp, path);
        } finally {
            if (!success) {
                deleteQuietly(tmp);
            }
        }

        return success;
    }

    // -------------------------------------------------------------------------
    //                         静态创建方法
    // -------------------------------------------------------------------------

    /**
     * 根据路径的 scheme 返回对应的 {@link FileIO}。
     *
     * @param path 路径
     * @param options 传给实现的配置
     * @throws UnsupportedSchemeException 类路径中没有该 scheme 的实现
     */
    static FileIO get(Path path, Options options) throws IOException {
        URI uri = path.toUri();
        if (LOG.isDebugEnabled()) {
            LOG.debug("Getting FileIO by scheme {}.", uri.getScheme());
        }

        if (uri.getScheme() == null) {
            FileIO fileIO = new LocalFileIO();
            fileIO.configure(options);
            return fileIO;
        }

        // print a helpful pointer for malformed local URIs
        if (uri.getScheme().equals("file")
                && uri.getAuthority() != null
                && !uri.getAuthority().isEmpty()) {
            String supposedUri = "file:///" + uri.getAuthority() + uri.getPath();

            throw new IOException(
                    "Found local file path with authority '"
                            + uri.getAuthority()
                            + "' in path '"
                            + uri
                            + "'. Hint: Did you forget a slash? (correct path would be '"
                            + supposedUri
                            + "')");
        }

        FileIOLoader loader = discoverLoaders().get(uri.getScheme());
        if (loader == null) {
            throw new UnsupportedSchemeException(
                    String.format(
                            "Could not find a file io implementation for scheme '%s' in the classpath"
                                    + " to access path '%s'.",
                            uri.getScheme(), path));
        }

        FileIO fileIO = loader.load(path);
        fileIO.configure(options);
        return fileIO;
    }

    /** 通过 {@link ServiceLoader} 发现所有 {@link FileIOLoader},同一 scheme 不能有两个实现。 */
    static Map<String, FileIOLoader> discoverLoaders() {
        Map<String, FileIOLoader> results = new HashMap<>();
        Iterator<FileIOLoader> iterator =
                ServiceLoader.load(FileIOLoader.class, FileIOLoader.class.getClassLoader())
                        .iterator();
        iterator.forEachRemaining(
                fileIO -> {
                    FileIOLoader previous = results.put(fileIO.getScheme(), fileIO);
                    if (previous != null) {
                        throw new RuntimeException(
                                String.format(
                                        "Multiple FileIO for scheme '%s' found in the classpath.\n"
                                                + "Ambiguous FileIO classes are:\n"
                                                + "%s\n%s",
                                        fileIO.getScheme(),
                                        previous.getClass().getName(),
                                        fileIO.getClass().getName()));
                    }
                });
        return results;
    }
}
