/*
 * Copyright 2020 Amazon.com, Inc. or its affiliates. All Rights Reserved.
 *
 * Licensed under the Apache License, Version 2.0 (the "License").
 * You may not use this file except in compliance with the License.
 * A copy of the License is located at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * or in the "license" file accompanying this file. This file is distributed
 * on an "AS IS" BASIS, WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either
 * express or implied. See the License for the specific language governing
 * permissions and limitations under the License.
 */

package com.amazon.predictivemaintenance.executor;

import static com.amazon.predictivemaintenance.CommonUtils.checkArgument;

import java.util.List;
import java.util.concurrent.Callable;
import java.util.concurrent.ForkJoinPool;
import java.util.function.IntFunction;
import java.util.stream.Collectors;
import java.util.stream.IntStream;

/**
 * Builds ensemble members in parallel on a private thread pool. The pool is
 * created lazily so that an executor restored from a configuration does not
 * hold threads until it is first used.
 */
public class ParallelTreeBuildExecutor extends AbstractTreeBuildExecutor {

    private ForkJoinPool forkJoinPool;
    private final int threadPoolSize;

    public ParallelTreeBuildExecutor(int threadPoolSize) {
        checkArgument(threadPoolSize > 0, "threadPoolSize must be positive");
        this.threadPoolSize = threadPoolSize;
    }

    public int getThreadPoolSize() {
        return threadPoolSize;
    }

    @Override
    protected <T> List<T> build(int count, IntFunction<T> guardedFactory) {
        return submitAndJoin(
                () -> IntStream.range(0, count).parallel().mapToObj(guardedFactory).collect(Collectors.toList()));
    }

    private synchronized ForkJoinPool pool() {
        if (forkJoinPool == null) {
            forkJoinPool = new ForkJoinPool(threadPoolSize);
        }
        return forkJoinPool;
    }

    private <T> T submitAndJoin(Callable<T> callable) {
        return pool().submit(callable).join();
    }
}
