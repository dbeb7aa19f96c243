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

import java.util.concurrent.Executors;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;

/** 线程池创建工具。 */
public class ThreadPoolUtils {

    /**
     * 创建核心线程数等于最大线程数、空闲线程一分钟后回收的线程池。
     *
     * @param threadNum 线程数
     * @param namePrefix 线程名前缀
     */
    public static ThreadPoolExecutor createCachedThreadPool(int threadNum, String namePrefix) {
        ThreadPoolExecutor executor =
                new ThreadPoolExecutor(
                        threadNum,
                        threadNum,
                        1,
                        TimeUnit.MINUTES,
                        new LinkedBlockingQueue<>(),
                        new ExecutorThreadFactory(namePrefix));
        executor.allowCoreThreadTimeOut(true);
        return executor;
    }

    /**
     * 创建单线程执行器,任务按提交顺序执行。
     *
     * @param name 线程名前缀
     */
    public static ThreadPoolExecutor createSingleThreadExecutor(String name) {
        return (ThreadPoolExecutor)
                Executors.newFixedThreadPool(1, new ExecutorThreadFactory(name));
    }

    private ThreadPoolUtils() {}
}
