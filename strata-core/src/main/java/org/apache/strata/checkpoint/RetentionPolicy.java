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

import org.apache.strata.storage.CheckpointStorage;

import javax.annotation.Nullable;

import java.util.ArrayList;
import java.util.List;
import java.util.function.Predicate;

import static org.apache.strata.utils.Preconditions.checkArgument;

/**
 * 检查点保留策略。
 *
 * <p>从旧到新遍历检查点:
 * <ul>
 *   <li>第一个已完成检查点之前的未完成检查点是损坏的,来自被中断的删除,需要删除
 *   <li>第一个已完成检查点之后的未完成检查点来自被中断的保存,会被恢复后的训练覆盖,保留
 *   <li>已完成检查点超过保留数量 K 时,删除最旧的那些
 * </ul>
 *
 * <p>保留数量为 null 或 {@link #KEEP_ALL} 时保留全部已完成检查点。
 */
public final class RetentionPolicy {

    /** 保留全部已完成的检查点。 */
    public static final int KEEP_ALL = -1;

    private RetentionPolicy() {}

    /**
     * 校验保留数量。
     *
     * @throws IllegalArgumentException 小于 -1 的保留数量
     */
    public static void checkNumKept(@Nullable Integer numKept) {
        checkArgument(
                numKept == null || numKept >= KEEP_ALL,
                "Number of kept checkpoints must be -1 (keep all) or non-negative, but is %s.",
                numKept);
    }

    /**
     * 决定需要删除的检查点。
     *
     * @param tags 检查点,从旧到新
     * @param isCompleted 检查点是否已完成
     * @param numKept 保留数量
     */
    public static RetentionDecision determine(
            List<String> tags, Predicate<String> isCompleted, @Nullable Integer numKept) {
        checkNumKept(numKept);

        List<String> corrupted = new ArrayList<>();
        List<String> completed = new ArrayList<>();
        for (String tag : tags) {
            if (isCompleted.test(tag)) {
                completed.add(tag);
            } else if (completed.isEmpty()) {
                corrupted.add(tag);
            }
        }

        List<String> expired = new ArrayList<>();
        if (numKept != null && numKept != KEEP_ALL && completed.size() > numKept) {
            expired.addAll(completed.subList(0, completed.size() - numKept));
        }
        return new RetentionDecision(corrupted, expired);
    }

    /** 对存储中的检查点应用保留策略,返回需要删除的检查点。 */
    public static List<String> determineRemoveTags(
            CheckpointStorage storage, @Nullable Integer numKept) {
        return determine(
                        storage.listCheckpointTags(),
                        tag -> storage.fileExists(tag + "/" + CheckpointStorage.DONE_MARKER),
                        numKept)
                .removal();
    }
}
