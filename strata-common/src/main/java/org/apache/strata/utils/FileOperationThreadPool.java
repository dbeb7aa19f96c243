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

import java.util.concurrent.ThreadPoolExecutor;

import static org.apache.strata.utils.ThreadPoolUtils.createCachedThreadPool;

/** 批量文件操作(例如删除过期检查点)共享的线程池。 */
public class FileOperationThreadPool {

    private static final String THREAD_NAME = "FILE-OPERATION-THREAD-POOL";

    private static ThreadPoolExecutor executorService =
            createCachedThreadPool(Runtime.getRuntime().availableProcessors(), THREAD_NAME);

    /**
     * 返回至少有 {@code threadNum} 个线程的线程池。
     *
     * @param threadNum 需要的线程数
     */
    public static synchronized ThreadPoolExecutor getExecutorService(int threadNum) {
        if (threadNum <= executorService.getMaximumPoolSize()) {
            return executorService;
        }
        // the previous pool is left to time out its idle threads
        executorService = createCachedThreadPool(threadNum, THREAD_NAME);

        return executorService;
    }
}
