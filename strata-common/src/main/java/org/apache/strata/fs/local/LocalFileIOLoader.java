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

import org.apache.strata.fs.FileIOLoader;
import org.apache.strata.fs.Path;

/**
 * 加载 {@link LocalFileIO} 的 {@link FileIOLoader},处理 {@code file://} 路径。
 *
 * <pre>
 * file:///mnt/ckpt
 * file:///tmp/strata/run-1
 * </pre>
 */
public class LocalFileIOLoader implements FileIOLoader {

    private static final long serialVersionUID = 1L;

    /** 本地文件系统的 URI scheme: "file"。 */
    public static final String SCHEME = "file";

    @Override
    public String getScheme() {
        return SCHEME;
    }

    @Override
    public LocalFileIO load(Path path) {
        return new LocalFileIO();
    }
}
