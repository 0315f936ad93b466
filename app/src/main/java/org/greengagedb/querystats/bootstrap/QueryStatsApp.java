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
package org.greengagedb.querystats.bootstrap;

import io.quarkus.runtime.StartupEvent;
import io.quarkus.scheduler.Scheduled;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.event.Observes;
import jakarta.inject.Inject;
import lombok.extern.slf4j.Slf4j;
import org.greengagedb.querystats.capture.CaptureDataLossException;
import org.greengagedb.querystats.config.CaptureConfig;
import org.greengagedb.querystats.config.DatabasesConfig;
import org.greengagedb.querystats.config.QueryStatsConfig;
import org.greengagedb.querystats.history.HistoricalStore;
import org.greengagedb.querystats.model.CaptureResult;
import org.greengagedb.querystats.model.DatabaseCapabilities;
import org.greengagedb.querystats.registry.DatabaseRegistry;
import org.greengagedb.querystats.registry.MonitoredDatabase;
import org.greengagedb.querystats.registry.ResetDomain;
import org.greengagedb.querystats.service.QueryStatsService;

import java.util.Map;
import java.util.Optional;

/**
 * Application lifecycle bean that reports configuration on startup
 * and schedules periodic capture and retention.
 *
 * <p><b>Lifecycle:</b>
 * <ol>
 *   <li>Startup: Print banner, log configuration, introspect every registered database</li>
 *   <li>Runtime: One capture cycle per reset domain each interval, retention sweep</li>
 * </ol>
 */
@Slf4j
@ApplicationScoped
public class QueryStatsApp {
    private final DatabaseRegistry registry;
    private final QueryStatsService queryStatsService;
    private final HistoricalStore historicalStore;
    private final DatabasesConfig databasesConfig;
    private final QueryStatsConfig queryStatsConfig;
    private final CaptureConfig captureConfig;
    private final Banners banner;

    @Inject
    public QueryStatsApp(DatabaseRegistry registry,
                         QueryStatsService queryStatsService,
                         HistoricalStore historicalStore,
                         DatabasesConfig databasesConfig,
                         QueryStatsConfig queryStatsConfig,
                         CaptureConfig captureConfig,
                         Banners banner) {
        this.registry = registry;
        this.queryStatsService = queryStatsService;
        this.historicalStore = historicalStore;
        this.databasesConfig = databasesConfig;
        this.queryStatsConfig = queryStatsConfig;
        this.captureConfig = captureConfig;
        this.banner = banner;
    }

    void onStartup(@Observes StartupEvent event) {
        banner.printHeader();
        logConfiguration();
        // Non-blocking, capabilities are introspected again on first use if this fails
        logCapabilities();
        banner.printFooter(captureConfig.enabled());
    }

    private void logConfiguration() {
        log.info("Configuration:");
        log.info("  Capture interval:       {}", captureConfig.enabled() ? captureConfig.interval() : "disabled");
        log.info("  Retention:              {}", captureConfig.retention());
        log.info("  History table:          {}", queryStatsConfig.historyTable());
        log.info("  History enabled:        {}", historicalStore.enabled());
        log.info("  Registered databases:   {}", registry.size());
        for (Map.Entry<String, DatabasesConfig.Database> entry : databasesConfig.databases().entrySet()) {
            log.info("    {} -> {}", entry.getKey(), maskSensitiveInfo(entry.getValue().url()));
        }
        for (ResetDomain domain : registry.domains()) {
            if (domain.members().size() > 1) {
                log.info("  Reset domain '{}':      {}", domain.id(), domain.memberIds());
            }
        }
    }

    /**
     * Mask sensitive information in connection strings for logging.
     *
     * @param url Database connection URL
     * @return Masked URL with password hidden
     */
    static String maskSensitiveInfo(String url) {
        if (url == null) {
            return "not configured";
        }
        return url.replaceAll("password=[^&\\s]+", "password=***")
                .replaceAll(":[^:/@]+@", ":***@");
    }

    private void logCapabilities() {
        for (MonitoredDatabase database : registry.all()) {
            try {
                DatabaseCapabilities capabilities = database.capabilities();
                if (!capabilities.extensionInstalled()) {
                    log.warn("Database '{}': pg_stat_statements is not installed{}", database.id(),
                            capabilities.extensionAvailable() ? " but available" : "");
                } else if (!capabilities.readable().ok()) {
                    log.warn("Database '{}': pg_stat_statements is not readable: {}",
                            database.id(), capabilities.readable().reason());
                }
            } catch (Exception e) {
                log.warn("Error introspecting database '{}' on startup: {}", database.id(), e.getMessage());
                log.debug("Introspection error details:", e);
            }
        }
    }

    /**
     * Periodic capture job, one cycle per reset domain.
     *
     * <p>Uses the interval configured in app.capture.interval.
     * Concurrent execution is skipped; cycles of the same domain on other
     * instances are excluded by the advisory lock.
     */
    @Scheduled(every = "${app.capture.interval}",
            concurrentExecution = Scheduled.ConcurrentExecution.SKIP)
    void schedulePeriodicCapture() {
        if (!captureConfig.enabled()) {
            return;
        }
        log.debug("Periodic capture triggered");
        for (ResetDomain domain : registry.domains()) {
            Optional<MonitoredDatabase> leader = domain.captureLeader();
            if (leader.isEmpty()) {
                log.debug("No member of domain '{}' has capture enabled", domain.id());
                continue;
            }
            try {
                CaptureResult result = queryStatsService.captureQueryStats(leader.get().id());
                if (!result.successful()) {
                    log.debug("Capture for domain '{}' ended with {}", domain.id(), result.outcome());
                }
            } catch (CaptureDataLossException e) {
                // Already logged and counted by the coordinator
                log.debug("Capture for domain '{}' lost {} rows", e.getDomainId(), e.getRowsLost());
            } catch (Exception e) {
                log.error("Unexpected error in scheduled capture of domain '{}': {}", domain.id(), e.getMessage(), e);
            }
        }
    }

    @Scheduled(every = "${app.capture.retention-interval}",
            concurrentExecution = Scheduled.ConcurrentExecution.SKIP)
    void schedulePeriodicRetention() {
        log.debug("Periodic retention triggered");
        try {
            queryStatsService.cleanQueryStats();
        } catch (Exception e) {
            log.error("Unexpected error in scheduled retention: {}", e.getMessage(), e);
        }
    }
}
