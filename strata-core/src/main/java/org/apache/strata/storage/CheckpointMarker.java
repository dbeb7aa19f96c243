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

import org.apache.strata.utils.JsonSerdeUtil;

import org.apache.paimon.shade.jackson2.com.fasterxml.jackson.annotation.JsonCreator;
import org.apache.paimon.shade.jackson2.com.fasterxml.jackson.annotation.JsonGetter;
import org.apache.paimon.shade.jackson2.com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import org.apache.paimon.shade.jackson2.com.fasterxml.jackson.annotation.JsonProperty;

import javax.annotation.Nullable;

import java.io.UncheckedIOException;
import java.util.Objects;

/**
 * {@code <tag>/checkpoint} 标记文件的内容。
 *
 * <pre>{@code
 * {
 *   "version" : 1,
 *   "createTimeMillis" : 1700000000000
 * }
 * }</pre>
 *
 * <p>{@code createTimeMillis} 是检查点列表的排序键。旧版本写入的标记内容为 {@code 1},不是 JSON 对象,
 * 此时排序退化为标记文件的修改时间。
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public class CheckpointMarker {

    public static final int CURRENT_VERSION = 1;

    private static final String FIELD_VERSION = "version";
    private static final String FIELD_CREATE_TIME_MILLIS = "createTimeMillis";

    @JsonProperty(FIELD_VERSION)
    private final int version;

    @JsonProperty(FIELD_CREATE_TIME_MILLIS)
    private final long createTimeMillis;

    @JsonCreator
    public CheckpointMarker(
            @JsonProperty(FIELD_VERSION) int version,
            @JsonProperty(FIELD_CREATE_TIME_MILLIS) long createTimeMillis) {
        this.version = version;
        this.createTimeMillis = createTimeMillis;
    }

    public static CheckpointMarker create(long createTimeMillis) {
        return new CheckpointMarker(CURRENT_VERSION, createTimeMillis);
    }

    @JsonGetter(FIELD_VERSION)
    public int version() {
        return version;
    }

    @JsonGetter(FIELD_CREATE_TIME_MILLIS)
    public long createTimeMillis() {
        return createTimeMillis;
    }

    public String toJson() {
        return JsonSerdeUtil.toJson(this);
    }

    /**
     * 解析标记内容。
     *
     * @return 旧版本的非 JSON 内容返回 null
     */
    @Nullable
    public static CheckpointMarker fromContent(String content) {
        if (!content.trim().startsWith("{")) {
            return null;
        }
        try {
            return JsonSerdeUtil.fromJson(content, CheckpointMarker.class);
        } catch (UncheckedIOException e) {
            // not a marker written by this version, ordered by modification time instead
            return null;
        }
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        CheckpointMarker that = (CheckpointMarker) o;
        return version == that.version && createTimeMillis == that.createTimeMillis;
    }

    @Override
    public int hashCode() {
        return Objects.hash(version, createTimeMillis);
    }

    @Override
    public String toString() {
        return "CheckpointMarker{version=" + version + ", createTimeMillis=" + createTimeMillis + '}';
    }
}
