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

package com.amazon.predictivemaintenance.tree;

import static com.amazon.predictivemaintenance.CommonUtils.averagePathLength;
import static com.amazon.predictivemaintenance.CommonUtils.ceilLog2;
import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.Random;

import org.junit.jupiter.api.Test;

import com.amazon.predictivemaintenance.util.ArrayUtils;

public class IsolationTreeTest {

    private static double[][] cloud(int n, long seed) {
        Random random = new Random(seed);
        double[][] points = new double[n][3];
        for (int i = 0; i < n; i++) {
            for (int j = 0; j < 3; j++) {
                points[i][j] = random.nextGaussian();
            }
        }
        return points;
    }

    @Test
    public void testOutlierIsIsolatedEarly() {
        double[][] points = cloud(256, 1);
        points[0] = new double[] { 20, 20, 20 };
        double outlier = 0;
        double inlier = 0;
        for (int t = 0; t < 50; t++) {
            IsolationTree tree = IsolationTree.grow(points, ArrayUtils.identity(256), ceilLog2(256), new Random(t));
            outlier += tree.pathLength(points[0]);
            inlier += tree.pathLength(new double[] { 0, 0, 0 });
        }
        assertTrue(outlier < inlier);
    }

    @Test
    public void testStructure() {
        double[][] points = cloud(64, 2);
        IsolationTree tree = IsolationTree.grow(points, ArrayUtils.identity(64), 6, new Random(3));
        NodeStore store = tree.getNodeStore();
        assertEquals(64, tree.getMass());
        int leafMass = 0;
        for (int i = 0; i < store.size(); i++) {
            if (store.isLeaf(i)) {
                leafMass += store.getMass(i);
            } else {
                assertEquals(store.getMass(i),
                        store.getMass(store.getLeftIndex(i)) + store.getMass(store.getRightIndex(i)));
            }
        }
        assertEquals(64, leafMass);
        for (double[] point : points) {
            assertTrue(store.depthOf(point) <= 6);
        }
    }

    @Test
    public void testIdenticalPointsFormOneLeaf() {
        double[][] points = new double[10][];
        for (int i = 0; i < 10; i++) {
            points[i] = new double[] { 1, 2 };
        }
        IsolationTree tree = IsolationTree.grow(points, ArrayUtils.identity(10), 4, new Random(0));
        assertEquals(1, tree.getNodeStore().size());
        assertEquals(averagePathLength(10), tree.pathLength(new double[] { 1, 2 }), 1e-12);
    }

    @Test
    public void testSameSeedSameTree() {
        double[][] points = cloud(100, 5);
        IsolationTree first = IsolationTree.grow(points, ArrayUtils.identity(100), 7, new Random(11));
        IsolationTree second = IsolationTree.grow(points, ArrayUtils.identity(100), 7, new Random(11));
        assertArrayEquals(first.getNodeStore().getCutValues(), second.getNodeStore().getCutValues());
        assertArrayEquals(first.getNodeStore().getCutDimension(), second.getNodeStore().getCutDimension());
    }
}
