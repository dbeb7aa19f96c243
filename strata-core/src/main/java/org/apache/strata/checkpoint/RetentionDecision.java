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

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/** {@link RetentionPolicy} 的结果:损坏的检查点与超出保留数量的检查点,均按从旧到新排列。 */
public final class RetentionDecision {

    private final List<String> corrupted;
    private final List<String> expired;

    public RetentionDecision(List<String> corrupted, List<String> expired) {
        this.corrupted = Collections.unmodifiableList(new ArrayList<>(corrupted));
        this.expired = Collections.unmodifiableList(new ArrayList<>(expired));
    }

    /** 第一个已完成检查点之前的未完成检查点,通常是中断的删除留下的残余。 */
    public List<String> corrupted() {
        return corrupted;
    }

    /** 超出保留数量的最旧的已完成检查点。 */
    public List<String> expired() {
        return expired;
    }

    /** 需要删除的检查点:先损坏的,再过期的。 */
    public List<String> removal() {
        List<String> removal = new ArrayList<>(corrupted.size() + expired.size());
        removal.addAll(corrupted);
        removal.addAll(expired);
        return removal;
    }

    public boolean isEmpty() {
        return corrupted.isEmpty() && expired.isEmpty();
    }

    @Override
    public String toString() {
        return "RetentionDecision{corrupted=" + corrupted + ", expired=" + expired + '}';
    }
}
