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

import lombok.Getter;
import lombok.Setter;

import com.amazon.predictivemaintenance.anomalydetection.IsolationForest;
import com.amazon.predictivemaintenance.state.store.NodeStoreMapper;
import com.amazon.predictivemaintenance.state.store.NodeStoreState;
import com.amazon.predictivemaintenance.tree.IsolationTree;

@Getter
@Setter
public class IsolationForestMapper implements IStateMapper<IsolationForest, IsolationForestState> {

    /**
     * If true, the restored forest must have the same number of trees it was
     * saved with; a state with no trees is always rejected.
     */
    private boolean strictTreeCount = true;

    private int expectedNumberOfTrees = 0;

    @Override
    public IsolationForestState toState(IsolationForest model) {
        IsolationForestState state = new IsolationForestState();
        state.setSchemaState(new FeatureSchemaMapper().toState(model.getSchema()));
        state.setSampleSize(model.getSampleSize());
        state.setContamination(model.getContamination());
        state.setThreshold(model.getThreshold());
        state.setBaselineMean(model.getBaselineMean());
        state.setBaselineDeviation(model.getBaselineDeviation());
        NodeStoreMapper nodeStoreMapper = new NodeStoreMapper();
        List<NodeStoreState> treeStates = new ArrayList<>();
        for (IsolationTree tree : model.getTrees()) {
            treeStates.add(nodeStoreMapper.toState(tree.getNodeStore()));
        }
        state.setTreeStates(treeStates);
        return state;
    }

    @Override
    public IsolationForest toModel(IsolationForestState state, long seed) {
        checkArgument(state.getTreeStates() != null && !state.getTreeStates().isEmpty(), "no trees in state");
        if (strictTreeCount && expectedNumberOfTrees > 0) {
            checkArgument(state.getTreeStates().size() == expectedNumberOfTrees,
                    "expected " + expectedNumberOfTrees + " trees, found " + state.getTreeStates().size());
        }
        NodeStoreMapper nodeStoreMapper = new NodeStoreMapper();
        List<IsolationTree> trees = new ArrayList<>();
        for (NodeStoreState treeState : state.getTreeStates()) {
            trees.add(new IsolationTree(nodeStoreMapper.toModel(treeState)));
        }
        return new IsolationForest(new FeatureSchemaMapper().toModel(state.getSchemaState()), trees,
                state.getSampleSize(), state.getContamination(), state.getThreshold(), state.getBaselineMean(),
                state.getBaselineDeviation());
    }
}
