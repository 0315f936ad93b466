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
package org.greengagedb.querystats.capture;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import lombok.extern.slf4j.Slf4j;
import org.greengagedb.querystats.config.QueryStatsConfig;
import org.greengagedb.querystats.history.HistoricalStore;
import org.greengagedb.querystats.metrics.CaptureMetrics;
import org.greengagedb.querystats.model.CaptureOutcome;
import org.greengagedb.querystats.model.CaptureResult;
import org.greengagedb.querystats.model.HistoricalRow;
import org.greengagedb.querystats.model.RawStatRecord;
import org.greengagedb.querystats.registry.DatabaseRegistry;
import org.greengagedb.querystats.registry.MonitoredDatabase;
import org.greengagedb.querystats.registry.ResetDomain;

import java.sql.SQLException;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Runs the snapshot, reset and persist cycle for the reset domain of a database.
 *
 * <p>Every member of the domain is snapshotted before the shared counters are reset, and the
 * reset is issued at most once per cycle. A failed snapshot aborts the cycle with the counters
 * untouched and nothing written. A failed write after the reset is data loss and is raised as
 * {@link CaptureDataLossException}.
 *
 * <p>Cycles of the same domain are serialized across processes with an advisory lock.
 */
@Slf4j
@ApplicationScoped
public class CaptureCoordinator {

    private final DatabaseRegistry registry;
    private final HistoricalStore historicalStore;
    private final QueryStatsConfig config;
    private final CaptureMetrics metrics;
    private final AdvisoryLockManager lockManager;
    private final Clock clock;

    @Inject
    public CaptureCoordinator(DatabaseRegistry registry,
                              HistoricalStore historicalStore,
                              QueryStatsConfig config,
                              CaptureMetrics metrics,
                              AdvisoryLockManager lockManager) {
        this(registry, historicalStore, config, metrics, lockManager, Clock.systemUTC());
    }

    CaptureCoordinator(DatabaseRegistry registry,
                       HistoricalStore historicalStore,
                       QueryStatsConfig config,
                       CaptureMetrics metrics,
                       AdvisoryLockManager lockManager,
                       Clock clock) {
        this.registry = registry;
        this.historicalStore = historicalStore;
        this.config = config;
        this.metrics = metrics;
        this.lockManager = lockManager;
        this.clock = clock;
    }

    /**
     * Capture the live statistics of every member of the database's reset domain.
     *
     * @param active Database the cycle is run through; its counters are the ones reset
     * @return How the cycle ended
     * @throws CaptureDataLossException if the counters were reset but the rows were not persisted
     */
    public CaptureResult capture(MonitoredDatabase active) throws CaptureDataLossException {
        Instant start = clock.instant();
        ResetDomain domain = registry.resetDomainOf(active);
        try {
            CaptureResult result = captureDomain(active, domain, start);
            metrics.recordCycle(domain.id(), result.outcome());
            return result;
        } catch (CaptureDataLossException e) {
            metrics.recordCycle(domain.id(), CaptureOutcome.DATA_LOSS);
            throw e;
        } finally {
            recordDuration(start);
        }
    }

    private CaptureResult captureDomain(MonitoredDatabase active, ResetDomain domain, Instant start)
            throws CaptureDataLossException {
        if (!historicalStore.enabled()) {
            log.debug("Historical log is not available, skipping capture for domain '{}'", domain.id());
            return CaptureResult.skipped(start, domain.id(), CaptureOutcome.HISTORY_DISABLED);
        }

        Optional<DomainLock> lock;
        try {
            lock = lockManager.tryAcquire(active, domain.id());
        } catch (SQLException e) {
            log.warn("Could not take capture lock for domain '{}': {}", domain.id(), e.getMessage());
            return CaptureResult.aborted(start, domain.id(), e);
        }
        if (lock.isEmpty()) {
            log.info("Capture for domain '{}' is running elsewhere, skipping cycle", domain.id());
            return CaptureResult.skipped(start, domain.id(), CaptureOutcome.LOCKED);
        }

        try (DomainLock ignored = lock.get()) {
            return runCycle(active, domain, start);
        }
    }

    private CaptureResult runCycle(MonitoredDatabase active, ResetDomain domain, Instant start)
            throws CaptureDataLossException {
        transition(domain, CaptureState.IDLE, CaptureState.SNAPSHOTTING);
        Map<String, List<RawStatRecord>> snapshots = new LinkedHashMap<>();
        for (MonitoredDatabase member : domain.members()) {
            try {
                List<RawStatRecord> rows = member.statsSource()
                        .currentStats(member.databaseName(), null, config.captureRowLimit());
                snapshots.put(member.id(), rows);
                log.debug("Snapshot of '{}' returned {} rows", member.id(), rows.size());
            } catch (Exception e) {
                log.warn("Snapshot of '{}' failed, aborting capture for domain '{}' without reset: {}",
                        member.id(), domain.id(), e.getMessage());
                transition(domain, CaptureState.SNAPSHOTTING, CaptureState.IDLE);
                return CaptureResult.aborted(start, domain.id(), e);
            }
        }

        List<HistoricalRow> rows = toHistoricalRows(snapshots, start);
        if (rows.isEmpty()) {
            log.debug("Nothing to capture for domain '{}'", domain.id());
            transition(domain, CaptureState.SNAPSHOTTING, CaptureState.IDLE);
            return CaptureResult.skipped(start, domain.id(), CaptureOutcome.NOTHING_TO_CAPTURE);
        }

        transition(domain, CaptureState.SNAPSHOTTING, CaptureState.RESETTING);
        try {
            if (!active.statsSource().reset()) {
                log.warn("Query stats reset was not performed for domain '{}', nothing persisted", domain.id());
                transition(domain, CaptureState.RESETTING, CaptureState.IDLE);
                return CaptureResult.aborted(start, domain.id(),
                        new SQLException("Query stats reset unavailable for " + active.id()));
            }
        } catch (Exception e) {
            log.warn("Query stats reset failed for domain '{}', nothing persisted: {}", domain.id(), e.getMessage());
            transition(domain, CaptureState.RESETTING, CaptureState.IDLE);
            return CaptureResult.aborted(start, domain.id(), e);
        }

        transition(domain, CaptureState.RESETTING, CaptureState.PERSISTING);
        try {
            int persisted = historicalStore.append(rows);
            metrics.addRowsPersisted(persisted);
            log.info("Captured {} query stats rows for domain '{}' ({})",
                    persisted, domain.id(), String.join(", ", snapshots.keySet()));
            return CaptureResult.completed(start, domain.id(), persisted);
        } catch (Exception e) {
            log.error("Query stats for domain '{}' were reset but {} rows could not be persisted: {}",
                    domain.id(), rows.size(), e.getMessage(), e);
            metrics.incrementDataLoss();
            historicalStore.invalidateSchema();
            throw new CaptureDataLossException(domain.id(), rows.size(), e);
        } finally {
            transition(domain, CaptureState.PERSISTING, CaptureState.IDLE);
        }
    }

    /**
     * Tag every captured row with its member id and the cycle instant. Rows without calls carry
     * nothing worth keeping and are dropped.
     */
    static List<HistoricalRow> toHistoricalRows(Map<String, List<RawStatRecord>> snapshots, Instant capturedAt) {
        List<HistoricalRow> rows = new ArrayList<>();
        for (Map.Entry<String, List<RawStatRecord>> entry : snapshots.entrySet()) {
            for (RawStatRecord record : entry.getValue()) {
                if (record.calls() > 0) {
                    rows.add(HistoricalRow.of(entry.getKey(), record, capturedAt));
                }
            }
        }
        return rows;
    }

    private void transition(ResetDomain domain, CaptureState from, CaptureState to) {
        log.debug("Capture for domain '{}': {} -> {}", domain.id(), from, to);
    }

    private void recordDuration(Instant start) {
        Duration duration = Duration.between(start, clock.instant());
        metrics.recordCaptureDuration(duration);
        log.debug("Capture cycle completed in {} ms", duration.toMillis());
    }
}
