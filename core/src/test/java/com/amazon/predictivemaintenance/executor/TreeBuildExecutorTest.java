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

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.List;
import java.util.concurrent.CancellationException;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.stream.Stream;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtensionContext;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.Arguments;
import org.junit.jupiter.params.provider.ArgumentsProvider;
import org.junit.jupiter.params.provider.ArgumentsSource;

public class TreeBuildExecutorTest {

    static class ExecutorProvider implements ArgumentsProvider {
        @Override
        public Stream<? extends Arguments> provideArguments(ExtensionContext context) {
            return Stream.of(Arguments.of(new SequentialTreeBuildExecutor()),
                    Arguments.of(new ParallelTreeBuildExecutor(4)));
        }
    }

    @ParameterizedTest
    @ArgumentsSource(ExecutorProvider.class)
    public void testMembersInIndexOrder(AbstractTreeBuildExecutor executor) {
        List<Integer> members = executor.buildAll(100, i -> i * i, () -> false);
        assertEquals(100, members.size());
        for (int i = 0; i < 100; i++) {
            assertEquals(i * i, (int) members.get(i));
        }
    }

    @ParameterizedTest
    @ArgumentsSource(ExecutorProvider.class)
    public void testCancellation(AbstractTreeBuildExecutor executor) {
        AtomicInteger built = new AtomicInteger();
        assertThrows(CancellationException.class,
                () -> executor.buildAll(50, i -> built.incrementAndGet(), () -> built.get() >= 5));
        assertTrue(built.get() < 50);
    }

    @ParameterizedTest
    @ArgumentsSource(ExecutorProvider.class)
    public void testArguments(AbstractTreeBuildExecutor executor) {
        assertThrows(IllegalArgumentException.class, () -> executor.buildAll(0, i -> i, () -> false));
        assertThrows(NullPointerException.class, () -> executor.buildAll(1, null, () -> false));
    }

    @Test
    public void testPoolSize() {
        assertEquals(3, new ParallelTreeBuildExecutor(3).getThreadPoolSize());
        assertThrows(IllegalArgumentException.class, () -> new ParallelTreeBuildExecutor(0));
    }
}
