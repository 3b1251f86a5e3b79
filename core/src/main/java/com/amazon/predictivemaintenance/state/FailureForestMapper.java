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

package com.amazon.predictivemaintenance.state;

import static com.amazon.predictivemaintenance.CommonUtils.checkArgument;

import java.util.ArrayList;
import java.util.List;

import com.amazon.predictivemaintenance.prediction.FailureForest;
import com.amazon.predictivemaintenance.state.store.NodeStoreMapper;
import com.amazon.predictivemaintenance.state.store.NodeStoreState;
import com.amazon.predictivemaintenance.tree.DecisionTree;

public class FailureForestMapper implements IStateMapper<FailureForest, FailureForestState> {

    @Override
    public FailureForestState toState(FailureForest model) {
        FailureForestState state = new FailureForestState();
        state.setSchemaState(new FeatureSchemaMapper().toState(model.getSchema()));
        state.setHorizons(model.getHorizons());
        NodeStoreMapper nodeStoreMapper = new NodeStoreMapper();
        List<NodeStoreState> treeStates = new ArrayList<>();
        for (DecisionTree tree : model.getTrees()) {
            treeStates.add(nodeStoreMapper.toState(tree.getNodeStore()));
        }
        state.setTreeStates(treeStates);
        return state;
    }

    @Override
    public FailureForest toModel(FailureForestState state, long seed) {
        checkArgument(state.getTreeStates() != null && !state.getTreeStates().isEmpty(), "no trees in state");
        NodeStoreMapper nodeStoreMapper = new NodeStoreMapper();
        List<DecisionTree> trees = new ArrayList<>();
        for (NodeStoreState treeState : state.getTreeStates()) {
            trees.add(new DecisionTree(nodeStoreMapper.toModel(treeState)));
        }
        return new FailureForest(new FeatureSchemaMapper().toModel(state.getSchemaState()), state.getHorizons(),
                trees);
    }
}
