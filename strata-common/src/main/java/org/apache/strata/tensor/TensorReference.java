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

package org.apache.strata.tensor;

import org.apache.strata.annotation.Public;

import java.io.Serializable;

/**
 * 载荷结构中代替张量的占位符。
 *
 * <p>拆分保存张量时,载荷结构里的每个张量都被替换为一个引用,张量本身写入
 * {@code <path>.tensors/tensor_<id>.pt}。加载时按 {@link #id()} 找回对应的张量。
 */
@Public
public final class TensorReference implements Serializable {

    private static final long serialVersionUID = 1L;

    private final int id;

    public TensorReference(int id) {
        this.id = id;
    }

    public int id() {
        return id;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        return id == ((TensorReference) o).id;
    }

    @Override
    public int hashCode() {
        return Integer.hashCode(id);
    }

    @Override
    public String toString() {
        return "TensorReference{" + id + '}';
    }
}
