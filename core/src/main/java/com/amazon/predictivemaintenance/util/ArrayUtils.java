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

package com.amazon.predictivemaintenance.util;

import java.util.Random;

/**
 * A utility class for data arrays.
 */
public class ArrayUtils {

    private ArrayUtils() {
    }

    // ranges shorter than this are insertion sorted
    private static final int INSERTION_SORT_LIMIT = 16;

    /**
     * Sorts {@code indices[from..to)} by {@code keys[indices[i]]} in place without
     * boxing. Equal keys keep no particular order.
     *
     * @param indices positions into keys
     * @param keys    sort keys
     * @param from    first position, inclusive
     * @param to      last position, exclusive
     */
    public static void sortByKey(int[] indices, double[] keys, int from, int to) {
        while (to - from > INSERTION_SORT_LIMIT) {
            double pivot = median(keys[indices[from]], keys[indices[(from + to) >>> 1]], keys[indices[to - 1]]);
            int i = from;
            int j = to - 1;
            while (i <= j) {
                while (keys[indices[i]] < pivot) {
                    ++i;
                }
                while (keys[indices[j]] > pivot) {
                    --j;
                }
                if (i <= j) {
                    swap(indices, i++, j--);
                }
            }
            // recurse into the smaller side, loop on the larger
            if (j + 1 - from < to - i) {
                sortByKey(indices, keys, from, j + 1);
                from = i;
            } else {
                sortByKey(indices, keys, i, to);
                to = j + 1;
            }
        }
        for (int i = from + 1; i < to; i++) {
            int current = indices[i];
            double key = keys[current];
            int j = i - 1;
            while (j >= from && keys[indices[j]] > key) {
                indices[j + 1] = indices[j];
                --j;
            }
            indices[j + 1] = current;
        }
    }

    /**
     * partial Fisher-Yates shuffle; the first {@code count} entries become a
     * uniform random selection
     *
     * @param array  values to shuffle
     * @param count  number of leading entries to randomize
     * @param random source of randomness
     */
    public static void shufflePrefix(int[] array, int count, Random random) {
        int limit = Math.min(count, array.length);
        for (int i = 0; i < limit; i++) {
            swap(array, i, i + random.nextInt(array.length - i));
        }
    }

    public static int[] identity(int size) {
        int[] answer = new int[size];
        for (int i = 0; i < size; i++) {
            answer[i] = i;
        }
        return answer;
    }

    public static void swap(int[] array, int i, int j) {
        int temp = array[i];
        array[i] = array[j];
        array[j] = temp;
    }

    private static double median(double a, double b, double c) {
        return Math.max(Math.min(a, b), Math.min(Math.max(a, b), c));
    }
}
