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

import org.apache.strata.annotation.Public;
import org.apache.strata.state.OptimizerStateAdapter;
import org.apache.strata.state.StateAdapter;

import javax.annotation.Nullable;

/** 一次加载要恢复的载荷。为 null 的载荷不加载。 */
@Public
public final class LoadRequest {

    @Nullable private final StateAdapter model;
    @Nullable private final OptimizerStateAdapter optimizer;
    @Nullable private final StateAdapter scheduler;
    @Nullable private final Boolean strict;

    private LoadRequest(Builder builder) {
        this.model = builder.model;
        this.optimizer = builder.optimizer;
        this.scheduler = builder.scheduler;
        this.strict = builder.strict;
    }

    public static Builder builder() {
        return new Builder();
    }

    @Nullable
    public StateAdapter model() {
        return model;
    }

    @Nullable
    public OptimizerStateAdapter optimizer() {
        return optimizer;
    }

    @Nullable
    public StateAdapter scheduler() {
        return scheduler;
    }

    /** 模型恢复是否严格,null 表示使用 {@code checkpoint.load.strict}。 */
    @Nullable
    public Boolean strict() {
        return strict;
    }

    /** Builder for {@link LoadRequest}. */
    public static final class Builder {

        @Nullable private StateAdapter model;
        @Nullable private OptimizerStateAdapter optimizer;
        @Nullable private StateAdapter scheduler;
        @Nullable private Boolean strict;

        private Builder() {}

        public Builder model(@Nullable StateAdapter model) {
            this.model = model;
            return this;
        }

        public Builder optimizer(@Nullable OptimizerStateAdapter optimizer) {
            this.optimizer = optimizer;
            return this;
        }

        public Builder scheduler(@Nullable StateAdapter scheduler) {
            this.scheduler = scheduler;
            return this;
        }

        public Builder strict(boolean strict) {
            this.strict = strict;
            return this;
        }

        public LoadRequest build() {
            return new LoadRequest(this);
        }
    }
}
