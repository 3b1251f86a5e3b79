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

package com.amazon.predictivemaintenance.prediction;

import static com.amazon.predictivemaintenance.CommonUtils.checkArgument;
import static com.amazon.predictivemaintenance.CommonUtils.checkNotNull;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.List;

import lombok.Getter;

/**
 * Labeled examples for a set of horizons, ordered by timestamp, and the number
 * of vectors left out because a horizon was censored.
 */
@Getter
public class LabeledDataset {

    private final long[] horizons;

    private final List<LabeledExample> examples;

    private final int censoredCount;

    public LabeledDataset(long[] horizons, List<LabeledExample> examples, int censoredCount) {
        checkNotNull(horizons, "horizons must not be null");
        checkNotNull(examples, "examples must not be null");
        checkArgument(censoredCount >= 0, "censoredCount cannot be negative");
        this.horizons = horizons.clone();
        List<LabeledExample> sorted = new ArrayList<>(examples);
        sorted.sort(Comparator.comparingLong(LabeledExample::getTimestamp));
        this.examples = Collections.unmodifiableList(sorted);
        this.censoredCount = censoredCount;
    }

    public long[] getHorizons() {
        return horizons.clone();
    }

    public int size() {
        return examples.size();
    }

    public int positives(int horizonIndex) {
        int count = 0;
        for (LabeledExample example : examples) {
            if (example.isPositive(horizonIndex)) {
                ++count;
            }
        }
        return count;
    }

    /**
     * @return positives at the longest horizon
     */
    public int positives() {
        return positives(horizons.length - 1);
    }

    /**
     * @param count number of examples
     * @return the oldest examples, in time order
     */
    public LabeledDataset head(int count) {
        return new LabeledDataset(horizons, examples.subList(0, count), 0);
    }

    // the newest examples
    public LabeledDataset tail(int count) {
        return new LabeledDataset(horizons, examples.subList(examples.size() - count, examples.size()), 0);
    }
}
