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
import java.nio.ByteBuffer;
import java.nio.ByteOrder;
import java.util.Arrays;

import static org.apache.strata.utils.Preconditions.checkArgument;
import static org.apache.strata.utils.Preconditions.checkNotNull;

/**
 * 主机内存中的稠密张量。
 *
 * <p>张量由形状、元素类型和按行优先、小端字节序存放的元素字节组成。检查点只关心张量的字节内容:
 * 保存时按字节大小分配写入任务,加载时对同一组内的张量做逐元素求和。
 *
 * <h2>使用示例</h2>
 * <pre>{@code
 * Tensor weight = Tensor.fromFloats(new long[] {2, 2}, new float[] {1f, 2f, 3f, 4f});
 * Tensor zeros = Tensor.zeros(weight.shape(), weight.dtype());
 * zeros.addInPlace(weight);
 * }</pre>
 *
 * <p>张量是可变的,{@link #addInPlace(Tensor)} 会修改当前张量。需要快照时使用 {@link #copy()}。
 */
@Public
public final class Tensor implements Serializable {

    private static final long serialVersionUID = 1L;

    private final long[] shape;
    private final DataType dtype;
    private final byte[] data;

    /**
     * 用已有字节构造张量,字节数组不会被复制。
     *
     * @param shape 形状
     * @param dtype 元素类型
     * @param data 小端字节序的元素内容,长度必须等于 {@code numel * elementSize}
     */
    public Tensor(long[] shape, DataType dtype, byte[] data) {
        this.shape = checkNotNull(shape, "shape").clone();
        this.dtype = checkNotNull(dtype, "dtype");
        this.data = checkNotNull(data, "data");
        checkArgument(
                data.length == numel(this.shape) * dtype.elementSize(),
                "Tensor of shape %s and dtype %s needs %s bytes, but got %s.",
                Arrays.toString(shape),
                dtype,
                numel(this.shape) * dtype.elementSize(),
                data.length);
    }

    /** 返回全零张量。 */
    public static Tensor zeros(long[] shape, DataType dtype) {
        int byteSize = Math.toIntExact(numel(shape) * dtype.elementSize());
        return new Tensor(shape, dtype, new byte[byteSize]);
    }

    /**
     * 返回加法单位元张量:累加任意张量 {@code x} 后得到与 {@code x} 逐位相同的结果。
     *
     * <p>浮点类型的元素为 {@code -0.0},其余类型与 {@link #zeros(long[], DataType)} 相同。
     */
    public static Tensor additiveIdentity(long[] shape, DataType dtype) {
        Tensor tensor = zeros(shape, dtype);
        if (dtype.isFloatingPoint()) {
            int size = dtype.elementSize();
            // little endian, the sign bit lives in the last byte of each element
            for (int offset = size - 1; offset < tensor.data.length; offset += size) {
                tensor.data[offset] = (byte) 0x80;
            }
        }
        return tensor;
    }

    /** 一维 {@link DataType#UINT8} 张量。 */
    public static Tensor fromBytes(byte[] values) {
        return new Tensor(new long[] {values.length}, DataType.UINT8, values.clone());
    }

    public static Tensor fromFloats(long[] shape, float[] values) {
        ByteBuffer buffer = allocate(values.length, DataType.FLOAT32);
        for (float value : values) {
            buffer.putFloat(value);
        }
        return new Tensor(shape, DataType.FLOAT32, buffer.array());
    }

    public static Tensor fromDoubles(long[] shape, double[] values) {
        ByteBuffer buffer = allocate(values.length, DataType.FLOAT64);
        for (double value : values) {
            buffer.putDouble(value);
        }
        return new Tensor(shape, DataType.FLOAT64, buffer.array());
    }

    public static Tensor fromLongs(long[] shape, long[] values) {
        ByteBuffer buffer = allocate(values.length, DataType.INT64);
        for (long value : values) {
            buffer.putLong(value);
        }
        return new Tensor(shape, DataType.INT64, buffer.array());
    }

    public static Tensor fromInts(long[] shape, int[] values) {
        ByteBuffer buffer = allocate(values.length, DataType.INT32);
        for (int value : values) {
            buffer.putInt(value);
        }
        return new Tensor(shape, DataType.INT32, buffer.array());
    }

    /**
     * 按给定的半精度类型编码浮点数。
     *
     * @param dtype {@link DataType#FLOAT16} 或 {@link DataType#BFLOAT16}
     */
    public static Tensor fromHalfFloats(long[] shape, DataType dtype, float[] values) {
        checkArgument(
                dtype == DataType.FLOAT16 || dtype == DataType.BFLOAT16,
                "Not a half precision type: %s",
                dtype);
        ByteBuffer buffer = allocate(values.length, dtype);
        for (float value : values) {
            buffer.putShort(
                    dtype == DataType.FLOAT16 ? floatToHalf(value) : floatToBFloat16(value));
        }
        return new Tensor(shape, dtype, buffer.array());
    }

    public long[] shape() {
        return shape.clone();
    }

    public DataType dtype() {
        return dtype;
    }

    /** 元素字节,返回内部数组本身。 */
    public byte[] data() {
        return data;
    }

    public long numel() {
        return numel(shape);
    }

    public int elementSize() {
        return dtype.elementSize();
    }

    /** 元素占用的总字节数。 */
    public long byteSize() {
        return data.length;
    }

    /** 深拷贝,返回的张量不与当前张量共享字节。 */
    public Tensor copy() {
        return new Tensor(shape, dtype, data.clone());
    }

    /**
     * 以 {@code double} 读取第 {@code index} 个元素(按行优先展开)。
     *
     * @param index 展开后的下标
     */
    public double getDouble(int index) {
        ByteBuffer buffer = wrap(data);
        int offset = index * dtype.elementSize();
        switch (dtype) {
            case FLOAT64:
                return buffer.getDouble(offset);
            case FLOAT32:
                return buffer.getFloat(offset);
            case FLOAT16:
                return halfToFloat(buffer.getShort(offset));
            case BFLOAT16:
                return bfloat16ToFloat(buffer.getShort(offset));
            case INT64:
                return buffer.getLong(offset);
            case INT32:
                return buffer.getInt(offset);
            case INT16:
                return buffer.getShort(offset);
            case INT8:
                return buffer.get(offset);
            case UINT8:
                return buffer.get(offset) & 0xff;
            case BOOL:
                return buffer.get(offset) != 0 ? 1 : 0;
            default:
                throw new UnsupportedOperationException("Unsupported data type: " + dtype);
        }
    }

    /**
     * 逐元素累加另一个张量,结果写回当前张量。
     *
     * <p>整数类型按位宽回绕,{@link DataType#BOOL} 做逻辑或。
     *
     * @param other 形状和类型都相同的张量
     * @return 当前张量
     */
    public Tensor addInPlace(Tensor other) {
        checkArgument(
                dtype == other.dtype && Arrays.equals(shape, other.shape),
                "Cannot add tensor %s to tensor %s.",
                other,
                this);
        ByteBuffer self = wrap(data);
        ByteBuffer that = wrap(other.data);
        int size = dtype.elementSize();
        for (int offset = 0; offset < data.length; offset += size) {
            switch (dtype) {
                case FLOAT64:
                    self.putDouble(offset, self.getDouble(offset) + that.getDouble(offset));
                    break;
                case FLOAT32:
                    self.putFloat(offset, self.getFloat(offset) + that.getFloat(offset));
                    break;
                case FLOAT16:
                    self.putShort(
                            offset,
                            floatToHalf(
                                    halfToFloat(self.getShort(offset))
                                            + halfToFloat(that.getShort(offset))));
                    break;
                case BFLOAT16:
                    self.putShort(
                            offset,
                            floatToBFloat16(
                                    bfloat16ToFloat(self.getShort(offset))
                                            + bfloat16ToFloat(that.getShort(offset))));
                    break;
                case INT64:
                    self.putLong(offset, self.getLong(offset) + that.getLong(offset));
                    break;
                case INT32:
                    self.putInt(offset, self.getInt(offset) + that.getInt(offset));
                    break;
                case INT16:
                    self.putShort(offset, (short) (self.getShort(offset) + that.getShort(offset)));
                    break;
                case INT8:
                case UINT8:
                    self.put(offset, (byte) (self.get(offset) + that.get(offset)));
                    break;
                case BOOL:
                    self.put(offset, (byte) ((self.get(offset) | that.get(offset)) != 0 ? 1 : 0));
                    break;
                default:
                    throw new UnsupportedOperationException("Unsupported data type: " + dtype);
            }
        }
        return this;
    }

    // ------------------------------------------------------------------------
    //  half precision conversion
    // ------------------------------------------------------------------------

    static float halfToFloat(short half) {
        int bits = half & 0xffff;
        int sign = (bits >>> 15) << 31;
        int exponent = (bits >>> 10) & 0x1f;
        int mantissa = bits & 0x3ff;
        if (exponent == 0) {
            // zero or subnormal, value is mantissa * 2^-24
            float value = mantissa / 16777216f;
            return sign != 0 ? -value : value;
        } else if (exponent == 0x1f) {
            return Float.intBitsToFloat(sign | 0x7f800000 | (mantissa << 13));
        }
        return Float.intBitsToFloat(sign | ((exponent + 112) << 23) | (mantissa << 13));
    }

    /** 就近舍入到偶数。 */
    static short floatToHalf(float value) {
        int bits = Float.floatToRawIntBits(value);
        int sign = (bits >>> 16) & 0x8000;
        int exponent = (bits >>> 23) & 0xff;
        int mantissa = bits & 0x7fffff;
        if (exponent == 0xff) {
            // keep the top of the NaN payload, the quiet bit stops it from becoming infinity
            return (short) (sign | 0x7c00 | (mantissa != 0 ? 0x200 | (mantissa >>> 13) : 0));
        }
        int halfExponent = exponent - 112;
        if (halfExponent >= 0x1f) {
            return (short) (sign | 0x7c00);
        }
        if (halfExponent <= 0) {
            if (halfExponent < -10) {
                return (short) sign;
            }
            mantissa |= 0x800000;
            int shift = 14 - halfExponent;
            int halfMantissa = mantissa >> shift;
            int remainder = mantissa & ((1 << shift) - 1);
            int halfway = 1 << (shift - 1);
            if (remainder > halfway || (remainder == halfway && (halfMantissa & 1) != 0)) {
                halfMantissa++;
            }
            return (short) (sign | halfMantissa);
        }
        int result = sign | (halfExponent << 10) | (mantissa >> 13);
        int remainder = mantissa & 0x1fff;
        if (remainder > 0x1000 || (remainder == 0x1000 && (result & 1) != 0)) {
            // may carry into the exponent, which rounds up to infinity correctly
            result++;
        }
        return (short) result;
    }

    static float bfloat16ToFloat(short value) {
        return Float.intBitsToFloat((value & 0xffff) << 16);
    }

    static short floatToBFloat16(float value) {
        int bits = Float.floatToRawIntBits(value);
        if (Float.isNaN(value)) {
            return (short) ((bits >>> 16) | 0x40);
        }
        int rounding = 0x7fff + ((bits >>> 16) & 1);
        return (short) ((bits + rounding) >>> 16);
    }

    // ------------------------------------------------------------------------

    private static long numel(long[] shape) {
        long numel = 1;
        for (long dim : shape) {
            checkArgument(dim >= 0, "Negative dimension in shape %s", Arrays.toString(shape));
            numel *= dim;
        }
        return numel;
    }

    private static ByteBuffer allocate(int numel, DataType dtype) {
        return ByteBuffer.allocate(numel * dtype.elementSize()).order(ByteOrder.LITTLE_ENDIAN);
    }

    private static ByteBuffer wrap(byte[] bytes) {
        return ByteBuffer.wrap(bytes).order(ByteOrder.LITTLE_ENDIAN);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        Tensor that = (Tensor) o;
        return dtype == that.dtype
                && Arrays.equals(shape, that.shape)
                && Arrays.equals(data, that.data);
    }

    @Override
    public int hashCode() {
        int result = dtype.hashCode();
        result = 31 * result + Arrays.hashCode(shape);
        result = 31 * result + Arrays.hashCode(data);
        return result;
    }

    @Override
    public String toString() {
        return "Tensor{shape=" + Arrays.toString(shape) + ", dtype=" + dtype + '}';
    }
}
