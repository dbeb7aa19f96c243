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

package org.apache.strata.options;

import org.apache.strata.annotation.Public;

import java.util.Arrays;
import java.util.Collections;

import static org.apache.strata.utils.Preconditions.checkNotNull;

/**
 * 配置选项。
 *
 * <p>描述一个配置参数:键、值类型、可选的默认值、回退键以及说明文字。实例通过 {@link ConfigOptions}
 * 构建器创建,示例:
 *
 * <pre>{@code
 * ConfigOption<Integer> numKept =
 *     ConfigOptions.key("checkpoint.num-kept")
 *         .intType()
 *         .noDefaultValue()
 *         .withDescription("Number of completed checkpoints to keep.");
 * }</pre>
 *
 * <p>实例不可变,{@code with*} 方法总是返回新的选项。
 *
 * @param <T> 选项值的类型
 */
@Public
public class ConfigOption<T> {

    private static final FallbackKey[] EMPTY = new FallbackKey[0];

    private final String key;

    private final FallbackKey[] fallbackKeys;

    private final T defaultValue;

    private final String description;

    private final Class<?> clazz;

    ConfigOption(
            String key,
            Class<?> clazz,
            String description,
            T defaultValue,
            FallbackKey... fallbackKeys) {
        this.key = checkNotNull(key);
        this.description = description;
        this.defaultValue = defaultValue;
        this.fallbackKeys = fallbackKeys == null || fallbackKeys.length == 0 ? EMPTY : fallbackKeys;
        this.clazz = checkNotNull(clazz);
    }

    Class<?> getClazz() {
        return clazz;
    }

    /** 追加已弃用的键,读取时仍然生效。 */
    public ConfigOption<T> withDeprecatedKeys(String... deprecatedKeys) {
        FallbackKey[] merged = new FallbackKey[deprecatedKeys.length + this.fallbackKeys.length];
        for (int i = 0; i < deprecatedKeys.length; i++) {
            merged[i] = FallbackKey.createDeprecatedKey(deprecatedKeys[i]);
        }
        System.arraycopy(
                this.fallbackKeys, 0, merged, deprecatedKeys.length, this.fallbackKeys.length);
        return new ConfigOption<>(key, clazz, description, defaultValue, merged);
    }

    public ConfigOption<T> withDescription(final String description) {
        return new ConfigOption<>(key, clazz, description, defaultValue, fallbackKeys);
    }

    public String key() {
        return key;
    }

    public T defaultValue() {
        return defaultValue;
    }

    public Iterable<FallbackKey> fallbackKeys() {
        return (fallbackKeys == EMPTY) ? Collections.emptyList() : Arrays.asList(fallbackKeys);
    }

    public String description() {
        return description;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        } else if (o != null && o.getClass() == ConfigOption.class) {
            ConfigOption<?> that = (ConfigOption<?>) o;
            return this.key.equals(that.key)
                    && Arrays.equals(this.fallbackKeys, that.fallbackKeys)
                    && (this.defaultValue == null
                            ? that.defaultValue == null
                            : (that.defaultValue != null
                                    && this.defaultValue.equals(that.defaultValue)));
        } else {
            return false;
        }
    }

    @Override
    public int hashCode() {
        return 31 * key.hashCode()
                + 17 * Arrays.hashCode(fallbackKeys)
                + (defaultValue != null ? defaultValue.hashCode() : 0);
    }

    @Override
    public String toString() {
        return String.format(
                "Key: '%s' , default: %s (fallback keys: %s)",
                key, defaultValue, Arrays.toString(fallbackKeys));
    }
}
