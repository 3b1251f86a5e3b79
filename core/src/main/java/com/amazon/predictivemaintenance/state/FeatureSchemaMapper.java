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

import com.amazon.predictivemaintenance.config.Channel;
import com.amazon.predictivemaintenance.inputtypes.FeatureSchema;
import com.amazon.predictivemaintenance.inputtypes.FeatureSchema.Ratio;
import com.amazon.predictivemaintenance.inputtypes.FeatureSchema.Statistic;

public class FeatureSchemaMapper implements IStateMapper<FeatureSchema, FeatureSchemaState> {

    @Override
    public FeatureSchemaState toState(FeatureSchema model) {
        FeatureSchemaState state = new FeatureSchemaState();
        state.setSchemaVersion(model.getVersion());
        state.setChannels(model.getChannels().stream().map(Enum::name).toArray(String[]::new));
        state.setStatistics(model.getStatistics().stream().map(Enum::name).toArray(String[]::new));
        state.setRatioNumerators(model.getRatios().stream().map(r -> r.getNumerator().name()).toArray(String[]::new));
        state.setRatioDenominators(
                model.getRatios().stream().map(r -> r.getDenominator().name()).toArray(String[]::new));
        state.setFingerprint(model.getFingerprint());
        return state;
    }

    @Override
    public FeatureSchema toModel(FeatureSchemaState state, long seed) {
        List<Channel> channels = new ArrayList<>();
        for (String channel : state.getChannels()) {
            channels.add(Channel.valueOf(channel));
        }
        List<Statistic> statistics = new ArrayList<>();
        for (String statistic : state.getStatistics()) {
            statistics.add(Statistic.valueOf(statistic));
        }
        checkArgument(state.getRatioNumerators().length == state.getRatioDenominators().length,
                "incomplete ratio definitions");
        List<Ratio> ratios = new ArrayList<>();
        for (int i = 0; i < state.getRatioNumerators().length; i++) {
            ratios.add(new Ratio(Channel.valueOf(state.getRatioNumerators()[i]),
                    Channel.valueOf(state.getRatioDenominators()[i])));
        }
        FeatureSchema schema = FeatureSchema.builder().version(state.getSchemaVersion()).channels(channels)
                .statistics(statistics).ratios(ratios).build();
        checkArgument(state.getFingerprint() == null || state.getFingerprint().equals(schema.getFingerprint()),
                "schema fingerprint " + schema.getFingerprint() + " does not match " + state.getFingerprint());
        return schema;
    }
}
