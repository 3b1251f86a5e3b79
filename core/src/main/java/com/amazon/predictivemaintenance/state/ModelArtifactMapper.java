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

import lombok.Getter;
import lombok.Setter;

import com.amazon.predictivemaintenance.ITrainedModel;
import com.amazon.predictivemaintenance.anomalydetection.IsolationForest;
import com.amazon.predictivemaintenance.config.ModelKind;
import com.amazon.predictivemaintenance.prediction.FailureForest;
import com.amazon.predictivemaintenance.store.ArtifactKey;
import com.amazon.predictivemaintenance.store.ModelArtifact;

@Getter
@Setter
public class ModelArtifactMapper implements IStateMapper<ModelArtifact<? extends ITrainedModel>, ModelArtifactState> {

    private IsolationForestMapper isolationForestMapper = new IsolationForestMapper();

    private FailureForestMapper failureForestMapper = new FailureForestMapper();

    @Override
    public ModelArtifactState toState(ModelArtifact<? extends ITrainedModel> model) {
        ModelArtifactState state = new ModelArtifactState();
        ArtifactKey key = model.getKey();
        state.setModelKind(key.getModelKind().name());
        state.setEquipmentClass(key.getEquipmentClass());
        state.setEquipmentId(key.getEquipmentId().orElse(null));
        state.setArtifactVersion(model.getVersion());
        state.setTrainedAt(model.getTrainedAt());
        state.setTrainingStart(model.getTrainingStart());
        state.setTrainingEnd(model.getTrainingEnd());
        if (key.getModelKind() == ModelKind.ANOMALY) {
            state.setAnomalyModelState(isolationForestMapper.toState((IsolationForest) model.getModel()));
        } else {
            state.setFailureModelState(failureForestMapper.toState((FailureForest) model.getModel()));
        }
        return state;
    }

    @Override
    public ModelArtifact<? extends ITrainedModel> toModel(ModelArtifactState state, long seed) {
        ModelKind kind = ModelKind.valueOf(state.getModelKind());
        ArtifactKey key = (state.getEquipmentId() == null) ? ArtifactKey.forClass(kind, state.getEquipmentClass())
                : ArtifactKey.forEquipment(kind, state.getEquipmentClass(), state.getEquipmentId());
        if (kind == ModelKind.ANOMALY) {
            checkArgument(state.getAnomalyModelState() != null, "missing anomaly model state");
            IsolationForest forest = isolationForestMapper.toModel(state.getAnomalyModelState(), seed);
            return new ModelArtifact<>(key, state.getArtifactVersion(), state.getTrainedAt(),
                    state.getTrainingStart(), state.getTrainingEnd(), forest);
        }
        checkArgument(state.getFailureModelState() != null, "missing failure model state");
        FailureForest forest = failureForestMapper.toModel(state.getFailureModelState(), seed);
        return new ModelArtifact<>(key, state.getArtifactVersion(), state.getTrainedAt(), state.getTrainingStart(),
                state.getTrainingEnd(), forest);
    }
}
