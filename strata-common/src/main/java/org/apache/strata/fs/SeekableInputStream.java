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

import java.io.IOException;
import java.io.InputStream;

/** 可以定位读取位置的输入流。 */
@Public
public abstract class SeekableInputStream extends InputStream {

    /**
     * 移动到指定位置,下一次读取从该位置开始。
     *
     * @param desired 距离文件开头的字节偏移
     */
    public abstract void seek(long desired) throws IOException;

    public abstract long getPos() throws IOException;

    @Override
    public abstract int read(byte[] b, int off, int len) throws IOException;

    @Override
    public abstract void close() throws IOException;
}
