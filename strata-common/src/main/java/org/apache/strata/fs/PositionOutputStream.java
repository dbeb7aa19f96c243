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
import java.io.OutputStream;

/** 可以查询当前写入位置的输出流。 */
@Public
public abstract class PositionOutputStream extends OutputStream {

    /** 已写入的字节数。 */
    public abstract long getPos() throws IOException;

    @Override
    public abstract void write(byte[] b) throws IOException;

    @Override
    public abstract void write(byte[] b, int off, int len) throws IOException;

    @Override
    public abstract void flush() throws IOException;

    @Override
    public abstract void close() throws IOException;
}
