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

package org.apache.strata.annotation;

import java.lang.annotation.Documented;
import java.lang.annotation.ElementType;
import java.lang.annotation.Target;

/**
 * 公共稳定接口注解。
 *
 * <p>被标记的类型属于 Strata 对外承诺的 API:训练驱动程序直接依赖这些类型来保存、加载和清理检查点。
 * 在同一个主版本内,方法签名和持久化格式保持向后兼容。
 *
 * <p>内部实现类不应标记此注解,仅为测试放宽访问权限的成员使用 {@link VisibleForTesting}。
 *
 * @see VisibleForTesting
 */
@Documented
@Target(ElementType.TYPE)
@Public
public @interface Public {}
