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

import static com.amazon.predictivemaintenance.tree.NodeStore.NULL;
import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

public class NodeStoreTest {

    private NodeStore nodeStore;

    // root cuts dimension 0 at 5; its right child cuts dimension 1 at 2
    @BeforeEach
    public void setUp() {
        nodeStore = NodeStore.builder().leftIndex(new int[] { 1, NULL, 3, NULL, NULL })
                .rightIndex(new int[] { 2, NULL, 4, NULL, NULL }).cutDimension(new int[] { 0, NULL, 1, NULL, NULL })
                .cutValues(new double[] { 5, 0, 2, 0, 0 }).mass(new int[] { 10, 4, 6, 1, 5 }).valueWidth(2)
                .leafValues(new double[] { 0, 0, 0.25, 0.5, 0, 0, 1, 1, 0, 0.2 }).build();
    }

    @Test
    public void testTraversal() {
        assertFalse(nodeStore.isLeaf(0));
        assertTrue(nodeStore.isLeaf(1));
        assertEquals(1, nodeStore.findLeaf(new double[] { 5, 100 }));
        assertEquals(3, nodeStore.findLeaf(new double[] { 6, 2 }));
        assertEquals(4, nodeStore.findLeaf(new double[] { 6, 2.5 }));
        assertEquals(1, nodeStore.depthOf(new double[] { 0, 0 }));
        assertEquals(2, nodeStore.depthOf(new double[] { 9, 9 }));
        assertEquals(10, nodeStore.getMass(0));
    }

    @Test
    public void testLeafValues() {
        assertEquals(0.5, nodeStore.getLeafValue(1, 1));
        double[] accumulator = new double[2];
        nodeStore.addLeafValues(3, accumulator);
        nodeStore.addLeafValues(4, accumulator);
        assertArrayEquals(new double[] { 1, 1.2 }, accumulator, 1e-12);
    }

    @Test
    public void testGettersReturnCopies() {
        int[] mass = nodeStore.getMass();
        mass[0] = 99;
        assertEquals(10, nodeStore.getMass(0));
        assertEquals(5, nodeStore.size());
    }

    @Test
    public void testRejectsBackwardChildren() {
        assertThrows(IllegalArgumentException.class,
                () -> NodeStore.builder().leftIndex(new int[] { 0, NULL }).rightIndex(new int[] { 1, NULL })
                        .cutDimension(new int[] { 0, NULL }).cutValues(new double[2]).mass(new int[] { 2, 1 })
                        .build());
        assertThrows(IllegalArgumentException.class,
                () -> NodeStore.builder().leftIndex(new int[] { NULL }).rightIndex(new int[] { NULL })
                        .cutDimension(new int[] { NULL }).cutValues(new double[1]).mass(new int[] { 1 })
                        .valueWidth(1).build());
    }
}
