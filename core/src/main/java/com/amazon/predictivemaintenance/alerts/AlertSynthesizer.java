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
import static com.amazon.predictivemaintenance.CommonUtils.checkNotNull;

import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.EnumMap;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.OptionalInt;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicLong;

import lombok.Getter;
import lombok.extern.slf4j.Slf4j;

import com.amazon.predictivemaintenance.config.Channel;
import com.amazon.predictivemaintenance.config.Severity;
import com.amazon.predictivemaintenance.ingest.EquipmentDirectory;
import com.amazon.predictivemaintenance.returntypes.AnomalyResult;
import com.amazon.predictivemaintenance.returntypes.FailureForecast;

/**
 * Fuses anomaly results and failure forecasts into a deduplicated stream of
 * alert events.
 *
 * Alerts are keyed by equipment and dominant reason code. While an alert is
 * active, later signals for its key never create another alert; they either
 * escalate it or extend its suppression. An alert without a qualifying signal
 * for longer than the clear window is resolved exactly once. Each unit of
 * equipment has its own book of alerts, so signals for different units do not
 * contend.
 */
@Slf4j
public class AlertSynthesizer {

    @Getter
    private final AlertPolicy policy;

    @Getter
    private final ActionCatalog actionCatalog;

    @Getter
    private final ImpactEstimator impactEstimator;

    private final EquipmentDirectory equipmentDirectory;

    private final List<AlertSink> sinks;

    private final Map<String, AlertBook> books = new ConcurrentHashMap<>();

    private final AtomicLong sequence = new AtomicLong();

    protected AlertSynthesizer(Builder<?> builder) {
        this.policy = checkNotNull(builder.policy, "policy must not be null");
        this.actionCatalog = checkNotNull(builder.actionCatalog, "actionCatalog must not be null");
        this.impactEstimator = checkNotNull(builder.impactEstimator, "impactEstimator must not be null");
        this.equipmentDirectory = checkNotNull(builder.equipmentDirectory, "equipmentDirectory must not be null");
        this.sinks = new CopyOnWriteArrayList<>(builder.sinks);
    }

    public void addSink(AlertSink sink) {
        sinks.add(checkNotNull(sink, "sink must not be null"));
    }

    public void removeSink(AlertSink sink) {
        sinks.remove(sink);
    }

    /**
     * Fuse the signals of one unit of equipment. Either signal may be absent.
     * When both are present and their timestamps differ by more than the pairing
     * tolerance, the older one is ignored. Stale alerts of the unit are resolved
     * first, as of the signal time.
     *
     * @param equipmentClass class of the equipment
     * @param anomaly        anomaly result, or null
     * @param forecast       failure forecast, or null
     * @return the events produced, in order
     */
    public List<AlertEvent> fuse(String equipmentClass, AnomalyResult anomaly, FailureForecast forecast) {
        checkNotNull(equipmentClass, "equipmentClass must not be null");
        checkArgument(anomaly != null || forecast != null, "at least one signal is required");
        if (anomaly != null && forecast != null) {
            checkArgument(anomaly.getEquipmentId().equals(forecast.getEquipmentId()),
                    "signals belong to different equipment");
            if (Math.abs(anomaly.getTimestamp() - forecast.getTimestamp()) > policy.getPairingTolerance()) {
                if (anomaly.getTimestamp() < forecast.getTimestamp()) {
                    log.debug("ignoring stale anomaly result {}", anomaly);
                    anomaly = null;
                } else {
                    log.debug("ignoring stale failure forecast {}", forecast);
                    forecast = null;
                }
            }
        }
        String equipmentId = (anomaly != null) ? anomaly.getEquipmentId() : forecast.getEquipmentId();
        Signal signal = classify(anomaly, forecast);

        AlertBook book = books.computeIfAbsent(equipmentId, k -> new AlertBook());
        List<AlertEvent> events = new ArrayList<>();
        synchronized (book) {
            book.resolveStale(signal.time, events);
            if (signal.severity != null) {
                apply(book, equipmentClass, equipmentId, signal, events);
            }
            deliver(events);
        }
        return events;
    }

    /**
     * Resolve every active alert whose last qualifying signal is older than the
     * clear window.
     *
     * @param now current time
     * @return the RESOLVED events
     */
    public List<AlertEvent> resolveStale(long now) {
        List<AlertEvent> answer = new ArrayList<>();
        for (AlertBook book : books.values()) {
            List<AlertEvent> events = new ArrayList<>();
            synchronized (book) {
                book.resolveStale(now, events);
                deliver(events);
            }
            answer.addAll(events);
        }
        return answer;
    }

    public List<Alert> getActiveAlerts() {
        List<Alert> answer = new ArrayList<>();
        for (AlertBook book : books.values()) {
            synchronized (book) {
                answer.addAll(book.active.values());
            }
        }
        answer.sort((a, b) -> b.getSeverity().compareTo(a.getSeverity()));
        return answer;
    }

    public List<Alert> getActiveAlerts(String equipmentId) {
        AlertBook book = books.get(equipmentId);
        if (book == null) {
            return Collections.emptyList();
        }
        synchronized (book) {
            return new ArrayList<>(book.active.values());
        }
    }

    /**
     * @param equipmentId a unit of equipment
     * @return the most recently resolved alerts of the unit, oldest first
     */
    public List<Alert> getResolvedAlerts(String equipmentId) {
        AlertBook book = books.get(equipmentId);
        if (book == null) {
            return Collections.emptyList();
        }
        synchronized (book) {
            return new ArrayList<>(book.resolved);
        }
    }

    Signal classify(AnomalyResult anomaly, FailureForecast forecast) {
        long time = Math.max((anomaly == null) ? Long.MIN_VALUE : anomaly.getTimestamp(),
                (forecast == null) ? Long.MIN_VALUE : forecast.getTimestamp());
        boolean anomalous = anomaly != null && anomaly.isAnomalous();
        boolean shortRisk = false;
        boolean lowLife = false;
        boolean longRisk = false;
        double probability = 0;
        if (forecast != null) {
            shortRisk = forecast.getShortestHorizonProbability() >= policy.getCriticalProbability();
            lowLife = forecast.getEstimatedRemainingLife().isPresent()
                    && forecast.getEstimatedRemainingLife().getAsLong() < policy.getCriticalRemainingLife();
            longRisk = warningHorizonProbability(forecast) > policy.getWarningProbability();
            probability = forecast.getLongestHorizonProbability();
        }

        Severity severity = null;
        if (shortRisk || lowLife) {
            severity = Severity.CRITICAL;
        } else if (anomalous && longRisk) {
            severity = Severity.WARNING;
        } else if (anomalous) {
            severity = Severity.INFO;
        }

        List<ReasonCode> codes = new ArrayList<>();
        if (severity != null) {
            if (anomalous) {
                for (Channel channel : anomaly.getContributingChannels()) {
                    codes.add(ReasonCode.anomalyOf(channel));
                }
            }
            if (shortRisk) {
                codes.add(ReasonCode.FAILURE_RISK_SHORT_HORIZON);
            }
            if (lowLife) {
                codes.add(ReasonCode.LOW_REMAINING_LIFE);
            }
            if (longRisk) {
                codes.add(ReasonCode.FAILURE_RISK_LONG_HORIZON);
            }
        }
        if (codes.isEmpty()) {
            // an anomaly that could not be attributed to any channel
            severity = null;
        }
        return new Signal(time, severity, codes, probability);
    }

    double warningHorizonProbability(FailureForecast forecast) {
        if (policy.getWarningHorizon() == null) {
            return forecast.getLongestHorizonProbability();
        }
        long[] horizons = forecast.getHorizons();
        double[] probabilities = forecast.getProbabilities();
        for (int i = 0; i < horizons.length; i++) {
            if (horizons[i] >= policy.getWarningHorizon()) {
                return probabilities[i];
            }
        }
        return forecast.getLongestHorizonProbability();
    }

    void apply(AlertBook book, String equipmentClass, String equipmentId, Signal signal, List<AlertEvent> events) {
        Alert existing = book.overlapping(signal.codes);
        if (existing == null) {
            ReasonCode dominant = signal.codes.get(0);
            MaintenanceImpact impact = impactEstimator.estimate(equipmentClass, ageOf(equipmentId, signal.time),
                    signal.probability);
            Alert alert = new Alert(equipmentId + "-" + sequence.incrementAndGet(), equipmentId, equipmentClass,
                    signal.time, signal.severity, signal.codes, dominant,
                    actionCatalog.recommend(equipmentClass, dominant), signal.time + policy.getCooldown(),
                    signal.time, AlertStatus.ACTIVE, -1, impact);
            book.active.put(dominant, alert);
            events.add(new AlertEvent(AlertEventType.CREATED, alert, signal.time));
            log.info("created {} alert {} for {} ({})", alert.getSeverity(), alert.getId(), equipmentId, dominant);
        } else if (signal.severity.isHigherThan(existing.getSeverity())) {
            MaintenanceImpact impact = impactEstimator.estimate(equipmentClass, ageOf(equipmentId, signal.time),
                    signal.probability);
            Alert alert = existing.escalate(signal.severity, signal.time, signal.codes, policy.getCooldown(), impact);
            book.active.put(alert.getDominantReasonCode(), alert);
            events.add(new AlertEvent(AlertEventType.ESCALATED, alert, signal.time));
            log.info("escalated alert {} for {} from {} to {}", alert.getId(), equipmentId, existing.getSeverity(),
                    alert.getSeverity());
        } else {
            book.active.put(existing.getDominantReasonCode(),
                    existing.refresh(signal.time, signal.codes, policy.getCooldown()));
            log.debug("suppressed duplicate signal for alert {}", existing.getId());
        }
    }

    OptionalInt ageOf(String equipmentId, long time) {
        int year = Instant.ofEpochMilli(time).atZone(ZoneOffset.UTC).getYear();
        return equipmentDirectory.find(equipmentId).map(p -> OptionalInt.of(p.ageInYears(year)))
                .orElse(OptionalInt.empty());
    }

    void deliver(List<AlertEvent> events) {
        for (AlertEvent event : events) {
            for (AlertSink sink : sinks) {
                try {
                    sink.accept(event);
                } catch (RuntimeException e) {
                    log.warn("alert sink failed on {}", event, e);
                }
            }
        }
    }

    /**
     * the classified outcome of one fusion
     */
    static class Signal {
        final long time;
        // null when no alert qualifies
        final Severity severity;
        final List<ReasonCode> codes;
        final double probability;

        Signal(long time, Severity severity, List<ReasonCode> codes, double probability) {
            this.time = time;
            this.severity = severity;
            this.codes = codes;
            this.probability = probability;
        }
    }

    /**
     * alerts of one unit of equipment; guarded by its own monitor
     */
    class AlertBook {
        // keyed by the dominant reason of each alert
        final Map<ReasonCode, Alert> active = new EnumMap<>(ReasonCode.class);
        final Deque<Alert> resolved = new ArrayDeque<>();

        /**
         * @param codes reasons of a new signal
         * @return the most severe active alert sharing a reason with the signal,
         *         or null if there is none
         */
        Alert overlapping(List<ReasonCode> codes) {
            Alert answer = null;
            for (Alert alert : active.values()) {
                if (!Collections.disjoint(alert.getReasonCodes(), codes)
                        && (answer == null || alert.getSeverity().isHigherThan(answer.getSeverity()))) {
                    answer = alert;
                }
            }
            return answer;
        }

        void resolveStale(long now, List<AlertEvent> events) {
            Iterator<Map.Entry<ReasonCode, Alert>> iterator = active.entrySet().iterator();
            while (iterator.hasNext()) {
                Alert alert = iterator.next().getValue();
                if (now - alert.getLastSignalAt() > policy.getClearWindow()) {
                    iterator.remove();
                    Alert closed = alert.resolve(now);
                    resolved.addLast(closed);
                    while (resolved.size() > policy.getResolvedHistorySize()) {
                        resolved.removeFirst();
                    }
                    events.add(new AlertEvent(AlertEventType.RESOLVED, closed, now));
                    log.info("resolved alert {} for {}", closed.getId(), closed.getEquipmentId());
                }
            }
        }
    }

    public static Builder<?> builder() {
        return new Builder<>();
    }

    public static class Builder<T extends Builder<T>> {

        private AlertPolicy policy = AlertPolicy.defaults();
        private ActionCatalog actionCatalog = ActionCatalog.defaults();
        private ImpactEstimator impactEstimator = ImpactEstimator.defaults();
        private EquipmentDirectory equipmentDirectory = EquipmentDirectory.empty();
        private final List<AlertSink> sinks = new ArrayList<>();

        public T policy(AlertPolicy policy) {
            this.policy = policy;
            return (T) this;
        }

        public T actionCatalog(ActionCatalog actionCatalog) {
            this.actionCatalog = actionCatalog;
            return (T) this;
        }

        public T impactEstimator(ImpactEstimator impactEstimator) {
            this.impactEstimator = impactEstimator;
            return (T) this;
        }

        public T equipmentDirectory(EquipmentDirectory equipmentDirectory) {
            this.equipmentDirectory = equipmentDirectory;
            return (T) this;
        }

        public T sink(AlertSink sink) {
            this.sinks.add(checkNotNull(sink, "sink must not be null"));
            return (T) this;
        }

        public AlertSynthesizer build() {
            return new AlertSynthesizer(this);
        }
    }
}
