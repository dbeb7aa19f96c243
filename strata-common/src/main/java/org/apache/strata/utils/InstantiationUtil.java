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

package org.apache.strata.utils;

import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.ObjectInputStream;
import java.io.ObjectOutputStream;
import java.io.ObjectStreamClass;
import java.io.OutputStream;
import java.io.Serializable;
import java.util.HashMap;

/**
 * Java 序列化工具,检查点载荷文件({@code .pt})的编码方式。
 *
 * <p>载荷是由 {@code Map}、{@code List}、张量和基本类型组成的对象树,整体写成一个 Java 序列化流。
 */
public final class InstantiationUtil {

    public static <T> T deserializeObject(byte[] bytes, ClassLoader cl)
            throws IOException, ClassNotFoundException {

        return deserializeObject(new ByteArrayInputStream(bytes), cl);
    }

    /**
     * 从流中反序列化一个对象,使用给定的类加载器解析类。
     *
     * <p>不会关闭输入流。
     */
    @SuppressWarnings("unchecked")
    public static <T> T deserializeObject(InputStream in, ClassLoader cl)
            throws IOException, ClassNotFoundException {

        final ClassLoader old = Thread.currentThread().getContextClassLoader();
        // not using resource try to avoid AutoClosable's close() on the given stream
        try {
            ObjectInputStream oois = new ClassLoaderObjectInputStream(in, cl);
            Thread.currentThread().setContextClassLoader(cl);
            return (T) oois.readObject();
        } finally {
            Thread.currentThread().setContextClassLoader(old);
        }
    }

    public static byte[] serializeObject(Object o) throws IOException {
        try (ByteArrayOutputStream baos = new ByteArrayOutputStream();
                ObjectOutputStream oos = new ObjectOutputStream(baos)) {
            oos.writeObject(o);
            oos.flush();
            return baos.toByteArray();
        }
    }

    /** 把对象序列化到流中,不会关闭输出流。 */
    public static void serializeObject(OutputStream out, Object o) throws IOException {
        ObjectOutputStream oos =
                out instanceof ObjectOutputStream
                        ? (ObjectOutputStream) out
                        : new ObjectOutputStream(out);
        oos.writeObject(o);
        oos.flush();
    }

    /** 通过序列化再反序列化得到深拷贝。 */
    public static <T extends Serializable> T clone(T obj)
            throws IOException, ClassNotFoundException {
        if (obj == null) {
            return null;
        } else {
            final byte[] serializedObject = serializeObject(obj);
            return deserializeObject(serializedObject, obj.getClass().getClassLoader());
        }
    }

    /** 使用指定类加载器解析类的 {@link ObjectInputStream}。 */
    public static class ClassLoaderObjectInputStream extends ObjectInputStream {

        private static final HashMap<String, Class<?>> PRIMITIVE_CLASSES = new HashMap<>(9);

        static {
            PRIMITIVE_CLASSES.put("boolean", boolean.class);
            PRIMITIVE_CLASSES.put("byte", byte.class);
            PRIMITIVE_CLASSES.put("char", char.class);
            PRIMITIVE_CLASSES.put("short", short.class);
            PRIMITIVE_CLASSES.put("int", int.class);
            PRIMITIVE_CLASSES.put("long", long.class);
            PRIMITIVE_CLASSES.put("float", float.class);
            PRIMITIVE_CLASSES.put("double", double.class);
            PRIMITIVE_CLASSES.put("void", void.class);
        }

        protected final ClassLoader classLoader;

        public ClassLoaderObjectInputStream(InputStream in, ClassLoader classLoader)
                throws IOException {
            super(in);
            this.classLoader = classLoader;
        }

        @Override
        protected Class<?> resolveClass(ObjectStreamClass desc)
                throws IOException, ClassNotFoundException {
            if (classLoader != null) {
                String name = desc.getName();
                try {
                    return Class.forName(name, false, classLoader);
                } catch (ClassNotFoundException ex) {
                    Class<?> cl = PRIMITIVE_CLASSES.get(name);
                    if (cl != null) {
                        return cl;
                    } else {
                        throw ex;
                    }
                }
            }

            return super.resolveClass(desc);
        }
    }

    private InstantiationUtil() {}
}
