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

/**
 * 一个保存周期的状态。
 *
 * <pre>
 * IDLE -begin-> BEGUN -end-> SAVING -drain-> DONE_MARKED -retention-> RETIRING -> IDLE
 * </pre>
 *
 * <p>同步模式下 {@code end} 直接走完整个周期;异步模式下周期停在 {@link #SAVING},直到下一次
 * {@code begin} 或显式排空。
 */
public enum LifecycleState {
    /** 没有进行中的保存周期。 */
    IDLE,
    /** 已开始,正在收集保存任务。 */
    BEGUN,
    /** 保存任务已提交,尚未写入完成标记。 */
    SAVING,
    /** 完成标记已写入,尚未执行保留策略。 */
    DONE_MARKED,
    /** 正在删除过期或损坏的检查点。 */
    RETIRING
}
