/**
 * Licensed to the Apache Software Foundation (ASF) under one
 * or more contributor license agreements.  See the NOTICE file
 * distributed with this work for additional information
 * regarding copyright ownership.  The ASF licenses this file
 * to you under the Apache License, Version 2.0 (the
 * "License"); you may not use this file except in compliance
 * with the License.  You may obtain a copy of the License at
 *     http://www.apache.org/licenses/LICENSE-2.0
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */
package org.greengagedb.querystats.metrics;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import jakarta.annotation.PostConstruct;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import lombok.extern.slf4j.Slf4j;
import org.greengagedb.querystats.common.Constants;
import org.greengagedb.querystats.common.MetricNameBuilder;
import org.greengagedb.querystats.model.CaptureOutcome;

import java.time.Duration;
import java.time.Instant;
import java.util.Locale;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Metrics about capture cycles and the historical log
 */
@Slf4j
@ApplicationScoped
public class CaptureMetrics {

    private static final String NAME_CYCLES = MetricNameBuilder.build(Constants.SUBSYSTEM_CAPTURE, "cycles");
    private static final String NAME_DATA_LOSS = MetricNameBuilder.build(Constants.SUBSYSTEM_CAPTURE, "data_loss");
    private static final String NAME_DURATION = MetricNameBuilder.build(Constants.SUBSYSTEM_CAPTURE, "duration_seconds");
    private static final String NAME_LAST_COMPLETED = MetricNameBuilder.build(Constants.SUBSYSTEM_CAPTURE, "last_completed_timestamp_seconds");
    private static final String NAME_ROWS_PERSISTED = MetricNameBuilder.build(Constants.SUBSYSTEM_HISTORY, "rows_persisted");
    private static final String NAME_ROWS_PRUNED = MetricNameBuilder.build(Constants.SUBSYSTEM_HISTORY, "rows_pruned");

    private final AtomicLong lastCompletedEpochSeconds = new AtomicLong();
    private final MeterRegistry registry;

    private Counter dataLossCounter;
    private Counter rowsPersistedCounter;
    private Counter rowsPrunedCounter;
    private Timer captureDurationTimer;

    @Inject
    public CaptureMetrics(MeterRegistry registry) {
        this.registry = registry;
    }

    @PostConstruct
    public void init() {
        dataLossCounter = Counter.builder(NAME_DATA_LOSS)
                .description("Capture cycles whose rows were lost after the counters were reset")
                .register(registry);
        rowsPersistedCounter = Counter.builder(NAME_ROWS_PERSISTED)
                .description("Total number of statement rows written to the historical log")
                .register(registry);
        rowsPrunedCounter = Counter.builder(NAME_ROWS_PRUNED)
                .description("Total number of historical rows removed by retention")
                .register(registry);
        captureDurationTimer = Timer.builder(NAME_DURATION)
                .description("Duration of capture cycles in seconds")
                .register(registry);
        Gauge.builder(NAME_LAST_COMPLETED, lastCompletedEpochSeconds::get)
                .description("Unix time of the last completed capture cycle")
                .register(registry);
        log.info("Capture metrics initialized");
    }

    /**
     * Count a finished cycle by domain and outcome.
     *
     * @param domainId Reset domain
     * @param outcome  How the cycle ended
     */
    public void recordCycle(String domainId, CaptureOutcome outcome) {
        Counter.builder(NAME_CYCLES)
                .tag("domain", domainId)
                .tag("outcome", outcome.name().toLowerCase(Locale.ROOT))
                .description("Number of capture cycles per reset domain and outcome")
                .register(registry)
                .increment();
        if (outcome == CaptureOutcome.COMPLETED) {
            lastCompletedEpochSeconds.set(Instant.now().getEpochSecond());
        }
    }

    public void incrementDataLoss() {
        dataLossCounter.increment();
    }

    public void addRowsPersisted(int rows) {
        rowsPersistedCounter.increment(rows);
    }

    public void addRowsPruned(int rows) {
        rowsPrunedCounter.increment(rows);
    }

    public void recordCaptureDuration(Duration duration) {
        captureDurationTimer.record(duration);
    }
}
