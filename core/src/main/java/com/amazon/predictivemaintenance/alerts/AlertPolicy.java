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

package com.amazon.predictivemaintenance.alerts;

import static com.amazon.predictivemaintenance.CommonUtils.checkArgument;

import lombok.Getter;

/**
 * Thresholds and timings of alert synthesis.
 * <ul>
 * <li>CRITICAL: probability at the shortest horizon at least
 * {@code criticalProbability}, or remaining life below
 * {@code criticalRemainingLife}</li>
 * <li>WARNING: anomalous and probability at {@code warningHorizon} above
 * {@code warningProbability}</li>
 * <li>INFO: anomalous</li>
 * </ul>
 */
@Getter
public class AlertPolicy {

    public static final long MINUTE = 60_000L;

    public static final long HOUR = 60 * MINUTE;

    public static final double DEFAULT_CRITICAL_PROBABILITY = 0.6;

    public static final long DEFAULT_CRITICAL_REMAINING_LIFE = 24 * HOUR;

    public static final double DEFAULT_WARNING_PROBABILITY = 0.4;

    public static final long DEFAULT_PAIRING_TOLERANCE = 10 * MINUTE;

    public static final long DEFAULT_COOLDOWN = 30 * MINUTE;

    public static final long DEFAULT_CLEAR_WINDOW = 2 * HOUR;

    public static final int DEFAULT_RESOLVED_HISTORY_SIZE = 50;

    private final double criticalProbability;

    private final long criticalRemainingLife;

    private final double warningProbability;

    // null selects the longest forecast horizon
    private final Long warningHorizon;

    private final long pairingTolerance;

    private final long cooldown;

    private final long clearWindow;

    private final int resolvedHistorySize;

    protected AlertPolicy(Builder<?> builder) {
        checkArgument(builder.criticalProbability > 0 && builder.criticalProbability <= 1,
                "criticalProbability must be in (0, 1]");
        checkArgument(builder.warningProbability >= 0 && builder.warningProbability < 1,
                "warningProbability must be in [0, 1)");
        checkArgument(builder.criticalRemainingLife >= 0, "criticalRemainingLife cannot be negative");
        checkArgument(builder.warningHorizon == null || builder.warningHorizon > 0, "warningHorizon must be positive");
        checkArgument(builder.pairingTolerance >= 0, "pairingTolerance cannot be negative");
        checkArgument(builder.cooldown > 0, "cooldown must be positive");
        checkArgument(builder.clearWindow >= builder.cooldown, "clearWindow must be at least the cooldown");
        checkArgument(builder.resolvedHistorySize >= 0, "resolvedHistorySize cannot be negative");
        this.criticalProbability = builder.criticalProbability;
        this.criticalRemainingLife = builder.criticalRemainingLife;
        this.warningProbability = builder.warningProbability;
        this.warningHorizon = builder.warningHorizon;
        this.pairingTolerance = builder.pairingTolerance;
        this.cooldown = builder.cooldown;
        this.clearWindow = builder.clearWindow;
        this.resolvedHistorySize = builder.resolvedHistorySize;
    }

    public static AlertPolicy defaults() {
        return builder().build();
    }

    public static Builder<?> builder() {
        return new Builder<>();
    }

    public static class Builder<T extends Builder<T>> {

        private double criticalProbability = DEFAULT_CRITICAL_PROBABILITY;
        private long criticalRemainingLife = DEFAULT_CRITICAL_REMAINING_LIFE;
        private double warningProbability = DEFAULT_WARNING_PROBABILITY;
        private Long warningHorizon = null;
        private long pairingTolerance = DEFAULT_PAIRING_TOLERANCE;
        private long cooldown = DEFAULT_COOLDOWN;
        private long clearWindow = DEFAULT_CLEAR_WINDOW;
        private int resolvedHistorySize = DEFAULT_RESOLVED_HISTORY_SIZE;

        public T criticalProbability(double criticalProbability) {
            this.criticalProbability = criticalProbability;
            return (T) this;
        }

        public T criticalRemainingLife(long criticalRemainingLife) {
            this.criticalRemainingLife = criticalRemainingLife;
            return (T) this;
        }

        public T warningProbability(double warningProbability) {
            this.warningProbability = warningProbability;
            return (T) this;
        }

        public T warningHorizon(long warningHorizon) {
            this.warningHorizon = warningHorizon;
            return (T) this;
        }

        public T pairingTolerance(long pairingTolerance) {
            this.pairingTolerance = pairingTolerance;
            return (T) this;
        }

        public T cooldown(long cooldown) {
            this.cooldown = cooldown;
            return (T) this;
        }

        public T clearWindow(long clearWindow) {
            this.clearWindow = clearWindow;
            return (T) this;
        }

        public T resolvedHistorySize(int resolvedHistorySize) {
            this.resolvedHistorySize = resolvedHistorySize;
            return (T) this;
        }

        public AlertPolicy build() {
            return new AlertPolicy(this);
        }
    }
}
