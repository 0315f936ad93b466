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
package org.greengagedb.querystats.registry;

import lombok.Builder;
import lombok.extern.slf4j.Slf4j;
import org.greengagedb.querystats.history.HistoricalStore;
import org.greengagedb.querystats.history.HistorySchema;
import org.greengagedb.querystats.model.DatabaseCapabilities;
import org.greengagedb.querystats.source.CapabilityIntrospector;
import org.greengagedb.querystats.source.PgStatStatementsSource;
import org.greengagedb.querystats.source.StatsSource;
import org.greengagedb.querystats.source.UnavailableStatsSource;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.SQLException;
import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicReference;

/**
 * A logical database backed by its own PostgreSQL connection pool.
 *
 * <p>Usable capabilities are cached until invalidated or until the history schema they were
 * derived from changes. A non-usable result is never cached, so a database that becomes readable
 * is picked up on the next call.
 */
@Slf4j
public class PostgresDatabase implements MonitoredDatabase {

    private static final int DEFAULT_MAX_QUERY_LENGTH = 10000;

    private final String id;
    private final String displayName;
    private final String resetDomainId;
    private final String databaseName;
    private final boolean captureEnabled;
    private final DataSource dataSource;
    private final CapabilityIntrospector introspector;
    private final HistoricalStore historicalStore;
    private final Duration statementTimeout;
    private final int maxQueryLength;
    private final AtomicReference<CachedCapabilities> cachedCapabilitiesRef = new AtomicReference<>();

    @Builder
    private PostgresDatabase(String id,
                             String displayName,
                             String resetDomainId,
                             String databaseName,
                             Boolean captureEnabled,
                             DataSource dataSource,
                             CapabilityIntrospector introspector,
                             HistoricalStore historicalStore,
                             Duration statementTimeout,
                             Integer maxQueryLength) {
        this.id = Objects.requireNonNull(id, "id");
        this.displayName = displayName != null ? displayName : id;
        this.resetDomainId = resetDomainId != null ? resetDomainId : id;
        this.databaseName = databaseName;
        this.captureEnabled = captureEnabled == null || captureEnabled;
        this.dataSource = Objects.requireNonNull(dataSource, "dataSource");
        this.introspector = Objects.requireNonNull(introspector, "introspector");
        this.historicalStore = Objects.requireNonNull(historicalStore, "historicalStore");
        this.statementTimeout = statementTimeout;
        this.maxQueryLength = maxQueryLength != null ? maxQueryLength : DEFAULT_MAX_QUERY_LENGTH;
    }

    @Override
    public String id() {
        return id;
    }

    @Override
    public String displayName() {
        return displayName;
    }

    @Override
    public String resetDomainId() {
        return resetDomainId;
    }

    @Override
    public String databaseName() {
        return databaseName;
    }

    @Override
    public boolean captureEnabled() {
        return captureEnabled;
    }

    @Override
    public DatabaseCapabilities capabilities() throws SQLException {
        HistorySchema schema = historicalStore.schema();
        CachedCapabilities local = cachedCapabilitiesRef.get();
        if (local != null && local.schema().equals(schema)) {
            return local.capabilities();
        }
        synchronized (this) {
            local = cachedCapabilitiesRef.get();
            if (local != null && local.schema().equals(schema)) {
                return local.capabilities();
            }
            DatabaseCapabilities resolved = introspector.introspect(dataSource, schema);
            if (!resolved.usable()) {
                cachedCapabilitiesRef.set(null);
                log.debug("Database '{}': query stats not usable (installed={}, readable={}), not cached",
                        id, resolved.extensionInstalled(), resolved.readable());
                return resolved;
            }
            cachedCapabilitiesRef.set(new CachedCapabilities(schema, resolved));
            log.info("Database '{}': {} installed={}, readable={}, native hash={}, user={}",
                    id,
                    resolved.version() != null ? "PostgreSQL " + resolved.version().fullVersion() : "unknown version",
                    resolved.extensionInstalled(),
                    resolved.readable().ok(),
                    resolved.hashSupport(),
                    resolved.userSupport());
            return resolved;
        }
    }

    @Override
    public void invalidateCapabilities() {
        cachedCapabilitiesRef.set(null);
    }

    @Override
    public StatsSource statsSource() throws SQLException {
        DatabaseCapabilities capabilities = capabilities();
        if (capabilities.usable()) {
            return new PgStatStatementsSource(id, dataSource, capabilities, statementTimeout, maxQueryLength);
        }
        return new UnavailableStatsSource(capabilities);
    }

    @Override
    public Connection getConnection() throws SQLException {
        return dataSource.getConnection();
    }

    @Override
    public String toString() {
        return "PostgresDatabase[" + id + ", domain=" + resetDomainId + "]";
    }

    private record CachedCapabilities(HistorySchema schema, DatabaseCapabilities capabilities) {
    }
}
