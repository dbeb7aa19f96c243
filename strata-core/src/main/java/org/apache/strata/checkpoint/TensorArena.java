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

import org.apache.strata.tensor.Tensor;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Function;
import java.util.function.Predicate;

import static org.apache.strata.utils.Preconditions.checkState;

/**
 * 对载荷结构做整体替换。
 *
 * <p>按深度优先的遍历顺序收集所有满足条件的叶子,一次性交给转换函数,再用转换结果按同样的顺序重建结构。
 * {@code Map} 重建为 {@link LinkedHashMap},{@code List} 重建为 {@link ArrayList},其余值原样保留。
 * 遍历顺序只取决于结构本身,因此持有相同结构的 rank 会得到相同的编号。
 */
final class TensorArena {

    private TensorArena() {}

    /**
     * 替换结构中满足条件的叶子。
     *
     * @param root 载荷结构
     * @param selector 选择要替换的叶子
     * @param converter 输入按遍历顺序排列的叶子,返回同样长度的替换值
     * @return 重建后的结构,输入结构不会被修改
     */
    static Object transform(
            Object root, Predicate<Object> selector, Function<List<Object>, List<?>> converter) {
        List<Object> selected = new ArrayList<>();
        collect(root, selector, selected);

        List<?> replacements = converter.apply(selected);
        checkState(
                replacements.size() == selected.size(),
                "Converter returned %s values for %s selected leaves.",
                replacements.size(),
                selected.size());

        Iterator<?> iterator = replacements.iterator();
        return rebuild(root, selector, iterator);
    }

    /** 复制结构和其中的张量,得到与训练状态不再共享内存的快照。 */
    static Object copyTensors(Object root) {
        return transform(
                root,
                value -> value instanceof Tensor,
                tensors -> {
                    List<Object> copies = new ArrayList<>(tensors.size());
                    for (Object tensor : tensors) {
                        copies.add(((Tensor) tensor).copy());
                    }
                    return copies;
                });
    }

    private static void collect(Object value, Predicate<Object> selector, List<Object> selected) {
        if (value != null && selector.test(value)) {
            selected.add(value);
        } else if (value instanceof Map) {
            for (Object child : ((Map<?, ?>) value).values()) {
                collect(child, selector, selected);
            }
        } else if (value instanceof List) {
            for (Object child : (List<?>) value) {
                collect(child, selector, selected);
            }
        }
    }

    private static Object rebuild(Object value, Predicate<Object> selector, Iterator<?> iterator) {
        if (value != null && selector.test(value)) {
            return iterator.next();
        } else if (value instanceof Map) {
            Map<?, ?> map = (Map<?, ?>) value;
            Map<Object, Object> rebuilt = new LinkedHashMap<>(map.size());
            for (Map.Entry<?, ?> entry : map.entrySet()) {
                rebuilt.put(entry.getKey(), rebuild(entry.getValue(), selector, iterator));
            }
            return rebuilt;
        } else if (value instanceof List) {
            List<?> list = (List<?>) value;
            List<Object> rebuilt = new ArrayList<>(list.size());
            for (Object child : list) {
                rebuilt.add(rebuild(child, selector, iterator));
            }
            return rebuilt;
        }
        return value;
    }
}
