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
import java.util.Arrays;
import java.util.Objects;

/** 张量的形状和类型,元数据表({@code .info.pt})中的值。 */
@Public
public final class TensorInfo implements Serializable {

    private static final long serialVersionUID = 1L;

    private final long[] shape;
    private final DataType dtype;

    public TensorInfo(long[] shape, DataType dtype) {
        this.shape = shape.clone();
        this.dtype = dtype;
    }

    public long[] shape() {
        return shape.clone();
    }

    public DataType dtype() {
        return dtype;
    }

    /** 分配一个该形状和类型的加法单位元张量,见 {@link Tensor#additiveIdentity(long[], DataType)}。 */
    public Tensor additiveIdentity() {
        return Tensor.additiveIdentity(shape, dtype);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        TensorInfo that = (TensorInfo) o;
        return Arrays.equals(shape, that.shape) && dtype == that.dtype;
    }

    @Override
    public int hashCode() {
        return 31 * Objects.hashCode(dtype) + Arrays.hashCode(shape);
    }

    @Override
    public String toString() {
        return "TensorInfo{shape=" + Arrays.toString(shape) + ", dtype=" + dtype + '}';
    }
}
