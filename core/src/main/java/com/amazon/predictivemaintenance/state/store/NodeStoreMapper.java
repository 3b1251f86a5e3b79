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

package com.amazon.predictivemaintenance.state.store;

import static com.amazon.predictivemaintenance.CommonUtils.checkArgument;

import com.amazon.predictivemaintenance.state.IStateMapper;
import com.amazon.predictivemaintenance.tree.NodeStore;

public class NodeStoreMapper implements IStateMapper<NodeStore, NodeStoreState> {

    @Override
    public NodeStoreState toState(NodeStore model) {
        NodeStoreState state = new NodeStoreState();
        state.setSize(model.size());
        state.setLeftIndex(model.getLeftIndex());
        state.setRightIndex(model.getRightIndex());
        state.setCutDimension(model.getCutDimension());
        state.setCutValue(model.getCutValues());
        state.setMass(model.getMass());
        state.setValueWidth(model.getValueWidth());
        state.setLeafValues(model.getLeafValues());
        return state;
    }

    @Override
    public NodeStore toModel(NodeStoreState state, long seed) {
        checkArgument(state.getLeftIndex() != null && state.getLeftIndex().length == state.getSize(),
                "incorrect node count");
        return NodeStore.builder().leftIndex(state.getLeftIndex().clone()).rightIndex(state.getRightIndex().clone())
                .cutDimension(state.getCutDimension().clone()).cutValues(state.getCutValue().clone())
                .mass(state.getMass().clone()).valueWidth(state.getValueWidth())
                .leafValues((state.getLeafValues() == null) ? null : state.getLeafValues().clone()).build();
    }
}
