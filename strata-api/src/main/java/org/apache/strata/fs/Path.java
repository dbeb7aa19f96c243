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

import java.io.Serializable;
import java.net.URI;
import java.net.URISyntaxException;
import java.util.UUID;
import java.util.regex.Pattern;

/**
 * 文件系统中的文件或目录名称。
 *
 * <p>路径字符串使用斜杠作为目录分隔符,可以带有 scheme 和 authority(例如 {@code file:///ckpt}
 * 或 {@code s3://bucket/ckpt})。不带 scheme 的路径视为本地路径。
 *
 * <p>检查点存储中的所有位置都由根目录加上相对路径组成,例如
 * {@code new Path(root, "step_100/model/dp_rank_00_tp_rank_00_pp_rank_00.pt")}。
 *
 * @since 0.1
 */
@Public
public class Path implements Comparable<Path>, Serializable {

    private static final long serialVersionUID = 1L;

    /** 目录分隔符,斜杠。 */
    public static final String SEPARATOR = "/";

    /** 目录分隔符,字符形式。 */
    public static final char SEPARATOR_CHAR = '/';

    /** 当前目录,"."。 */
    public static final String CUR_DIR = ".";

    /** 用于折叠重复斜杠。 */
    private static final Pattern SLASHES = Pattern.compile("/+");

    private URI uri;

    public Path(String parent, String child) {
        this(new Path(parent), new Path(child));
    }

    /**
     * 以父路径解析子路径。
     *
     * @param parent 父路径
     * @param child 子路径,相对路径会拼接在父路径之后
     */
    public Path(Path parent, String child) {
        this(parent, new Path(child));
    }

    /**
     * 以父路径解析子路径。
     *
     * @param parent 父路径
     * @param child 子路径
     */
    public Path(Path parent, Path child) {
        // Add a slash to parent's path so resolution is compatible with URI's
        URI parentUri = parent.uri;
        String parentPath = parentUri.getPath();
        if (!(parentPath.equals(SEPARATOR) || parentPath.isEmpty())) {
            try {
                parentUri =
                        new URI(
                                parentUri.getScheme(),
                                parentUri.getAuthority(),
                                parentUri.getPath() + SEPARATOR,
                                null,
                                parentUri.getFragment());
            } catch (URISyntaxException e) {
                throw new IllegalArgumentException(e);
            }
        }
        URI resolved = parentUri.resolve(child.uri);
        initialize(resolved.getScheme(), resolved.getAuthority(), resolved.getPath());
    }

    /**
     * 从路径字符串构造。字符串不需要预先转义。
     *
     * @param pathString 路径字符串,不能为空
     */
    public Path(String pathString) {
        if (pathString == null) {
            throw new IllegalArgumentException("Can not create a Path from a null string");
        }
        if (pathString.isEmpty()) {
            throw new IllegalArgumentException("Can not create a Path from an empty string");
        }

        String scheme = null;
        String authority = null;
        int start = 0;

        // parse uri scheme, if any
        int colon = pathString.indexOf(':');
        int slash = pathString.indexOf(SEPARATOR_CHAR);
        if ((colon != -1) && ((slash == -1) || (colon < slash))) {
            scheme = pathString.substring(0, colon);
            start = colon + 1;
        }

        // parse uri authority, if any
        if (pathString.startsWith("//", start) && (pathString.length() - start > 2)) {
            int nextSlash = pathString.indexOf(SEPARATOR_CHAR, start + 2);
            int authEnd = nextSlash > 0 ? nextSlash : pathString.length();
            authority = pathString.substring(start + 2, authEnd);
            start = authEnd;
        }

        initialize(scheme, authority, pathString.substring(start));
    }

    /**
     * 从 URI 构造。
     *
     * @param uri 路径对应的 URI
     */
    public Path(URI uri) {
        this.uri = uri.normalize();
    }

    private void initialize(String scheme, String authority, String path) {
        try {
            this.uri = new URI(scheme, authority, normalizePath(path), null, null).normalize();
        } catch (URISyntaxException e) {
            throw new IllegalArgumentException(e);
        }
    }

    private static String normalizePath(String path) {
        path = SLASHES.matcher(path).replaceAll(SEPARATOR);
        // trim trailing slash from non-root path
        if (path.length() > 1 && path.endsWith(SEPARATOR)) {
            path = path.substring(0, path.length() - 1);
        }
        return path;
    }

    public URI toUri() {
        return uri;
    }

    /** 返回路径的最后一个组成部分。 */
    public String getName() {
        String path = uri.getPath();
        int slash = path.lastIndexOf(SEPARATOR);
        return path.substring(slash + 1);
    }

    /**
     * 返回父路径,根路径返回 null。
     *
     * @return 父路径
     */
    public Path getParent() {
        String path = uri.getPath();
        int lastSlash = path.lastIndexOf(SEPARATOR_CHAR);
        if (path.isEmpty() || (lastSlash == 0 && path.length() == 1)) {
            return null;
        }
        String parent;
        if (lastSlash == -1) {
            parent = CUR_DIR;
        } else {
            parent = path.substring(0, lastSlash == 0 ? 1 : lastSlash);
        }
        try {
            return new Path(new URI(uri.getScheme(), uri.getAuthority(), parent, null, null));
        } catch (URISyntaxException e) {
            throw new IllegalArgumentException(e);
        }
    }

    /** 在同一目录下生成一个隐藏的临时文件路径,用于先写后改名。 */
    public Path createTempPath() {
        return new Path(getParent(), String.format(".%s.%s.tmp", getName(), UUID.randomUUID()));
    }

    @Override
    public String toString() {
        // we can't use uri.toString(), which escapes everything
        StringBuilder buffer = new StringBuilder();
        if (uri.getScheme() != null) {
            buffer.append(uri.getScheme()).append(":");
        }
        if (uri.getAuthority() != null) {
            buffer.append("//").append(uri.getAuthority());
        }
        if (uri.getPath() != null) {
            buffer.append(uri.getPath());
        }
        return buffer.toString();
    }

    @Override
    public boolean equals(Object o) {
        if (!(o instanceof Path)) {
            return false;
        }
        Path that = (Path) o;
        return this.uri.equals(that.uri);
    }

    @Override
    public int hashCode() {
        return uri.hashCode();
    }

    @Override
    public int compareTo(Path that) {
        return this.uri.compareTo(that.uri);
    }
}
