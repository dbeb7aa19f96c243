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

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.annotation.concurrent.ThreadSafe;

import java.io.Serializable;
import java.util.HashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * 字符串键值对形式的配置集合。
 *
 * <p>值以字符串保存,读取 {@link ConfigOption} 时才按选项类型转换;主键不存在时依次查找回退键,
 * 都不存在时返回选项的默认值。
 *
 * <p>所有方法都是同步的,可以在多个 rank 线程之间共享同一个实例。
 */
@Public
@ThreadSafe
public class Options implements Serializable {

    private static final long serialVersionUID = 1L;

    private static final Logger LOG = LoggerFactory.getLogger(Options.class);

    private final HashMap<String, String> data;

    public Options() {
        this.data = new HashMap<>();
    }

    public Options(Map<String, String> map) {
        this();
        map.forEach(this::setString);
    }

    public static Options fromMap(Map<String, String> map) {
        return new Options(map);
    }

    public synchronized void setString(String key, String value) {
        data.put(key, value);
    }

    public synchronized void set(String key, String value) {
        data.put(key, value);
    }

    public synchronized <T> Options set(ConfigOption<T> option, T value) {
        setValueInternal(option.key(), value);
        return this;
    }

    /**
     * 读取选项的值,未设置时返回默认值(可能为 null)。
     *
     * @param option 配置选项
     * @return 转换后的值
     */
    public synchronized <T> T get(ConfigOption<T> option) {
        return getOptional(option).orElseGet(option::defaultValue);
    }

    public synchronized String get(String key) {
        return data.get(key);
    }

    /**
     * 读取选项的值,未设置时返回空。
     *
     * @throws IllegalArgumentException 值无法转换为选项类型
     */
    public synchronized <T> Optional<T> getOptional(ConfigOption<T> option) {
        Optional<Object> rawValue = getRawValueFromOption(option);
        Class<?> clazz = option.getClazz();

        try {
            return rawValue.map(v -> OptionsUtils.convertValue(v, clazz));
        } catch (Exception e) {
            throw new IllegalArgumentException(
                    String.format(
                            "Could not parse value '%s' for key '%s'.",
                            rawValue.map(Object::toString).orElse(""), option.key()),
                    e);
        }
    }

    public synchronized boolean contains(ConfigOption<?> option) {
        return getRawValueFromOption(option).isPresent();
    }

    public synchronized Set<String> keySet() {
        return data.keySet();
    }

    public synchronized String remove(String key) {
        return data.remove(key);
    }

    public synchronized boolean containsKey(String key) {
        return data.containsKey(key);
    }

    @Override
    public synchronized boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        Options options = (Options) o;
        return Objects.equals(data, options.data);
    }

    @Override
    public synchronized int hashCode() {
        return Objects.hash(data);
    }

    @Override
    public synchronized String toString() {
        return data.toString();
    }

    // -------------------------------------------------------------------------
    //                     Internal methods
    // -------------------------------------------------------------------------

    private <T> void setValueInternal(String key, T value) {
        if (key == null) {
            throw new NullPointerException("Key must not be null.");
        }
        if (value == null) {
            throw new NullPointerException("Value must not be null.");
        }
        data.put(key, OptionsUtils.convertToString(value));
    }

    private Optional<Object> getRawValueFromOption(ConfigOption<?> option) {
        Optional<Object> valueFromExactKey = getRawValue(option.key());
        if (valueFromExactKey.isPresent()) {
            return valueFromExactKey;
        }
        for (FallbackKey fallbackKey : option.fallbackKeys()) {
            Optional<Object> valueFromFallbackKey = getRawValue(fallbackKey.getKey());
            if (valueFromFallbackKey.isPresent()) {
                if (fallbackKey.isDeprecated()) {
                    LOG.warn(
                            "Config uses deprecated configuration key '{}' instead of proper key '{}'",
                            fallbackKey.getKey(),
                            option.key());
                }
                return valueFromFallbackKey;
            }
        }
        return Optional.empty();
    }

    private Optional<Object> getRawValue(String key) {
        if (key == null) {
            throw new NullPointerException("Key must not be null.");
        }
        return Optional.ofNullable(data.get(key));
    }
}
