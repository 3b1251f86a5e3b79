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
import static com.amazon.predictivemaintenance.CommonUtils.checkNotNull;

import java.util.List;
import java.util.concurrent.CancellationException;
import java.util.function.BooleanSupplier;
import java.util.function.IntFunction;

/**
 * Builds the members of an ensemble. Member {@code i} is produced by calling
 * the factory with {@code i}; the factory must derive all of its randomness
 * from that index so that sequential and parallel builds return the same
 * ensemble.
 */
public abstract class AbstractTreeBuildExecutor {

    /**
     * Build {@code count} members and return them in index order. The
     * cancellation flag is checked before each member is built.
     *
     * @param count     number of members
     * @param factory   builds member i
     * @param cancelled polled before each member
     * @param <T>       the member type
     * @return the members, member i at position i
     * @throws CancellationException if the flag is raised before all members are
     *                               built
     */
    public <T> List<T> buildAll(int count, IntFunction<T> factory, BooleanSupplier cancelled) {
        checkArgument(count > 0, "count must be positive");
        checkNotNull(factory, "factory must not be null");
        checkNotNull(cancelled, "cancelled must not be null");
        return build(count, i -> {
            if (cancelled.getAsBoolean()) {
                throw new CancellationException("build cancelled before member " + i);
            }
            return factory.apply(i);
        });
    }

    protected abstract <T> List<T> build(int count, IntFunction<T> guardedFactory);
}
