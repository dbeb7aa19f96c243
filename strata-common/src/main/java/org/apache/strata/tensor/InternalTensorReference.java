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

/**
 * 保存过程中使用的张量引用,额外携带形状和类型。
 *
 * <p>只在张量被替换之后、元数据表被抽取之前存在,不会被持久化。
 */
public final class InternalTensorReference {

    private final int id;
    private final TensorInfo info;

    public InternalTensorReference(int id, long[] shape, DataType dtype) {
        this.id = id;
        this.info = new TensorInfo(shape, dtype);
    }

    public int id() {
        return id;
    }

    public TensorInfo info() {
        return info;
    }

    /** 对外持久化的引用。 */
    public TensorReference toReference() {
        return new TensorReference(id);
    }

    @Override
    public String toString() {
        return "InternalTensorReference{id=" + id + ", info=" + info + '}';
    }
}
