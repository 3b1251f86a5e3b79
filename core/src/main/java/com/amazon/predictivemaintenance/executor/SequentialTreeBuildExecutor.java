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

import java.util.ArrayList;
import java.util.List;
import java.util.function.IntFunction;

/**
 * Builds ensemble members one after another on the calling thread.
 */
public class SequentialTreeBuildExecutor extends AbstractTreeBuildExecutor {

    @Override
    protected <T> List<T> build(int count, IntFunction<T> guardedFactory) {
        List<T> members = new ArrayList<>(count);
        for (int i = 0; i < count; i++) {
            members.add(guardedFactory.apply(i));
        }
        return members;
    }
}
