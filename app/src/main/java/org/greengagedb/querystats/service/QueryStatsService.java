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
package org.greengagedb.querystats.service;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import lombok.extern.slf4j.Slf4j;
import org.greengagedb.querystats.aggregate.QueryStatsAggregator;
import org.greengagedb.querystats.capture.CaptureCoordinator;
import org.greengagedb.querystats.capture.CaptureDataLossException;
import org.greengagedb.querystats.common.Constants;
import org.greengagedb.querystats.config.CaptureConfig;
import org.greengagedb.querystats.config.QueryStatsConfig;
import org.greengagedb.querystats.history.HistoricalStore;
import org.greengagedb.querystats.metrics.CaptureMetrics;
import org.greengagedb.querystats.model.AggregatedStat;
import org.greengagedb.querystats.model.CaptureResult;
import org.greengagedb.querystats.model.DatabaseCapabilities;
import org.greengagedb.querystats.model.QueryHashPoint;
import org.greengagedb.querystats.model.QueryStatsOptions;
import org.greengagedb.querystats.registry.DatabaseRegistry;
import org.greengagedb.querystats.registry.MonitoredDatabase;

import java.sql.Connection;
import java.sql.SQLException;
import java.sql.Statement;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.function.Predicate;

/**
 * Entry point of the query statistics engine. Databases are addressed by registration id.
 *
 * <p>Capability probes never throw: a failure to introspect a database is logged and reported
 * as {@code false}.
 */
@Slf4j
@ApplicationScoped
public class QueryStatsService {

    private static final String CREATE_EXTENSION_SQL = "CREATE EXTENSION IF NOT EXISTS " + Constants.EXTENSION_NAME;
    private static final String DROP_EXTENSION_SQL = "DROP EXTENSION IF EXISTS " + Constants.EXTENSION_NAME;

    private final DatabaseRegistry registry;
    private final QueryStatsAggregator aggregator;
    private final CaptureCoordinator coordinator;
    private final HistoricalStore historicalStore;
    private final QueryStatsConfig queryStatsConfig;
    private final CaptureConfig captureConfig;
    private final CaptureMetrics metrics;
    private final Clock clock;

    @Inject
    public QueryStatsService(DatabaseRegistry registry,
                             QueryStatsAggregator aggregator,
                             CaptureCoordinator coordinator,
                             HistoricalStore historicalStore,
                             QueryStatsConfig queryStatsConfig,
                             CaptureConfig captureConfig,
                             CaptureMetrics metrics) {
        this(registry, aggregator, coordinator, historicalStore, queryStatsConfig, captureConfig, metrics,
                Clock.systemUTC());
    }

    QueryStatsService(DatabaseRegistry registry,
                      QueryStatsAggregator aggregator,
                      CaptureCoordinator coordinator,
                      HistoricalStore historicalStore,
                      QueryStatsConfig queryStatsConfig,
                      CaptureConfig captureConfig,
                      CaptureMetrics metrics,
                      Clock clock) {
        this.registry = registry;
        this.aggregator = aggregator;
        this.coordinator = coordinator;
        this.historicalStore = historicalStore;
        this.queryStatsConfig = queryStatsConfig;
        this.captureConfig = captureConfig;
        this.metrics = metrics;
        this.clock = clock;
    }

    /**
     * Ranked, de-duplicated statement statistics of a database.
     *
     * @param databaseId Registration id
     * @param options    Source mix, window, ordering and filters
     * @return At most the configured top limit of entries
     * @throws SQLException if a source read failed
     */
    public List<AggregatedStat> queryStats(String databaseId, QueryStatsOptions options) throws SQLException {
        return aggregator.queryStats(registry.get(databaseId), options);
    }

    public List<AggregatedStat> slowQueries(String databaseId, QueryStatsOptions options) throws SQLException {
        return aggregator.slowQueries(registry.get(databaseId), options);
    }

    /**
     * Captured samples of one native hash over the configured window.
     *
     * @param databaseId Registration id
     * @param queryHash  Native hash
     * @return Samples oldest first, empty when history or hashes are unsupported
     * @throws SQLException if the history read failed
     */
    public List<QueryHashPoint> queryHashStats(String databaseId, long queryHash) throws SQLException {
        MonitoredDatabase database = registry.get(databaseId);
        if (!historicalStore.enabled() || !database.capabilities().hashSupport().isSupported()) {
            return List.of();
        }
        Instant since = clock.instant().minus(queryStatsConfig.hashStatsWindow());
        return historicalStore.hashSeries(database.id(), queryHash, since);
    }

    /**
     * Run one capture cycle for the reset domain of a database.
     *
     * @param databaseId Registration id
     * @return How the cycle ended
     * @throws CaptureDataLossException if the counters were reset but the rows were not persisted
     */
    public CaptureResult captureQueryStats(String databaseId) throws CaptureDataLossException {
        return coordinator.capture(registry.get(databaseId));
    }

    /**
     * Delete history rows older than the configured retention.
     *
     * @return Number of rows deleted
     * @throws SQLException if the delete failed
     */
    public int cleanQueryStats() throws SQLException {
        Instant cutoff = clock.instant().minus(captureConfig.retention());
        int deleted = historicalStore.prune(cutoff);
        metrics.addRowsPruned(deleted);
        return deleted;
    }

    public void enableQueryStats(String databaseId) throws SQLException {
        MonitoredDatabase database = registry.get(databaseId);
        executeAdmin(database, CREATE_EXTENSION_SQL);
        log.info("Enabled {} on '{}'", Constants.EXTENSION_NAME, databaseId);
    }

    public void disableQueryStats(String databaseId) throws SQLException {
        MonitoredDatabase database = registry.get(databaseId);
        executeAdmin(database, DROP_EXTENSION_SQL);
        log.info("Disabled {} on '{}'", Constants.EXTENSION_NAME, databaseId);
    }

    /**
     * Reset the live counters of a database outside of a capture cycle. Counters not yet
     * captured are lost.
     *
     * @param databaseId Registration id
     * @return true if the reset was issued, false if the extension is not usable
     * @throws SQLException if the reset failed
     */
    public boolean resetQueryStats(String databaseId) throws SQLException {
        MonitoredDatabase database = registry.get(databaseId);
        try {
            boolean reset = database.statsSource().reset();
            if (reset) {
                log.info("Reset query stats of '{}'", databaseId);
            }
            return reset;
        } finally {
            database.invalidateCapabilities();
        }
    }

    /**
     * Whether the extension could be installed on the server.
     */
    public boolean queryStatsAvailable(String databaseId) {
        return probe(databaseId, DatabaseCapabilities::extensionAvailable);
    }

    /**
     * Whether statistics can be read now: installed and readable by the current role.
     */
    public boolean queryStatsEnabled(String databaseId) {
        return probe(databaseId, DatabaseCapabilities::usable);
    }

    public boolean queryStatsExtensionEnabled(String databaseId) {
        return probe(databaseId, DatabaseCapabilities::extensionInstalled);
    }

    public boolean queryStatsReadable(String databaseId) {
        return probe(databaseId, capabilities -> capabilities.readable().ok());
    }

    public boolean historicalQueryStatsEnabled() {
        try {
            return historicalStore.enabled();
        } catch (Exception e) {
            log.warn("Error checking query stats history: {}", e.getMessage());
            return false;
        }
    }

    private boolean probe(String databaseId, Predicate<DatabaseCapabilities> check) {
        try {
            return check.test(registry.get(databaseId).capabilities());
        } catch (Exception e) {
            log.warn("Error checking query stats capabilities of '{}': {}", databaseId, e.getMessage());
            log.debug("Capability check error details:", e);
            return false;
        }
    }

    private void executeAdmin(MonitoredDatabase database, String sql) throws SQLException {
        try (Connection conn = database.getConnection();
             Statement stmt = conn.createStatement()) {
            stmt.setQueryTimeout(timeoutSeconds());
            stmt.execute(sql);
        } finally {
            database.invalidateCapabilities();
        }
    }

    private int timeoutSeconds() {
        Duration timeout = queryStatsConfig.statementTimeout();
        return timeout == null ? 0 : (int) Math.max(1, timeout.toSeconds());
    }
}
