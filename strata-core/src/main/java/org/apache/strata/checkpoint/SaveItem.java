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

import static org.apache.strata.utils.Preconditions.checkNotNull;

/** 一个待写入的载荷及其相对路径 {@code <tag>/<relative-path>}。 */
public final class SaveItem {

    private final Object payload;
    private final String path;

    public SaveItem(Object payload, String path) {
        this.payload = checkNotNull(payload, "payload");
        this.path = checkNotNull(path, "path");
    }

    public Object payload() {
        return payload;
    }

    public String path() {
        return path;
    }

    @Override
    public String toString() {
        return "SaveItem{" + path + '}';
    }
}
