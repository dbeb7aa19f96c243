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

package org.apache.strata.collective;

import org.apache.strata.annotation.Public;

/**
 * 命名屏障。
 *
 * <p>所有 rank 调用 {@link #rendezvous(String)} 后才会一起返回。各 rank 必须以相同的顺序到达相同名字的屏障,
 * 检查点协议中所有对存储可见的修改都由屏障排序,例如:
 *
 * <pre>{@code
 * barrier.rendezvous("saving checkpoint done");
 * if (rank == coordinator) {
 *     storage.saveText("1", tag + "/done");
 * }
 * barrier.rendezvous("mark checkpoint as done");
 * }</pre>
 */
@Public
public interface Barrier {

    /**
     * 阻塞直到所有 rank 都到达同名屏障。
     *
     * @param name 屏障名称,用于诊断调用顺序错误
     */
    void rendezvous(String name);
}
