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
package org.greengagedb.querystats.source;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import lombok.extern.slf4j.Slf4j;
import org.eclipse.microprofile.faulttolerance.Retry;
import org.eclipse.microprofile.faulttolerance.Timeout;
import org.greengagedb.querystats.common.Constants;
import org.greengagedb.querystats.config.QueryStatsConfig;
import org.greengagedb.querystats.history.HistorySchema;
import org.greengagedb.querystats.model.CapabilitySupport;
import org.greengagedb.querystats.model.DatabaseCapabilities;
import org.greengagedb.querystats.model.PostgresVersion;
import org.greengagedb.querystats.model.ProbeResult;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.time.Duration;
import java.time.temporal.ChronoUnit;

/**
 * Resolves the statement statistics capabilities of a database in one pass.
 *
 * <p>A usable result is meant to be cached per logical database until an administrative change
 * such as installing the extension. A read failure that is not a stable configuration state
 * (connection loss, cancelled statement) is thrown rather than reported as "not readable".
 */
@Slf4j
@ApplicationScoped
public class CapabilityIntrospector {

    private static final String VERSION_SQL = "SHOW server_version_num";
    private static final String AVAILABLE_SQL =
            "SELECT COUNT(*) AS count FROM pg_available_extensions WHERE name = '" + Constants.EXTENSION_NAME + "'";
    private static final String INSTALLED_SQL =
            "SELECT COUNT(*) AS count FROM pg_extension WHERE extname = '" + Constants.EXTENSION_NAME + "'";
    private static final String READABLE_SQL = "SELECT 1 FROM " + Constants.EXTENSION_NAME + " LIMIT 1";

    private final Duration statementTimeout;

    @Inject
    public CapabilityIntrospector(QueryStatsConfig config) {
        this(config.statementTimeout());
    }

    CapabilityIntrospector(Duration statementTimeout) {
        this.statementTimeout = statementTimeout;
    }

    /**
     * Introspect a database.
     *
     * @param dataSource    Database to inspect
     * @param historySchema Columns of the historical log, so hash and user support agree on both sources
     * @return Capabilities (never null)
     * @throws SQLException if the catalog queries fail, or the read probe fails for a reason
     *                      other than missing privilege or a missing preload
     */
    @Retry(maxRetries = 2, delay = 1, delayUnit = ChronoUnit.SECONDS, retryOn = SQLException.class)
    @Timeout(value = 10, unit = ChronoUnit.SECONDS)
    public DatabaseCapabilities introspect(DataSource dataSource, HistorySchema historySchema) throws SQLException {
        try (Connection conn = dataSource.getConnection()) {
            PostgresVersion version = PostgresVersion.parse(querySingle(conn, VERSION_SQL));
            boolean available = countPositive(conn, AVAILABLE_SQL);
            boolean installed = countPositive(conn, INSTALLED_SQL);
            ProbeResult readable = installed
                    ? probeReadable(conn)
                    : ProbeResult.failure(Constants.EXTENSION_NAME + " is not installed");

            boolean hashSupported = version != null && version.supportsQueryId() && historySchema.hasQueryHash();
            boolean userSupported = historySchema.hasUser();

            DatabaseCapabilities capabilities = new DatabaseCapabilities(
                    version,
                    available,
                    installed,
                    readable,
                    CapabilitySupport.of(hashSupported),
                    CapabilitySupport.of(userSupported));
            log.debug("Introspected capabilities: {}", capabilities);
            return capabilities;
        } catch (SQLException e) {
            log.warn("Capability introspection failed (attempt may be retried): {}", e.getMessage());
            throw e;
        }
    }

    /**
     * Probe read access to the statistics view. Missing privilege and a library that was never
     * preloaded are reported as failures; anything else is thrown.
     */
    ProbeResult probeReadable(Connection conn) throws SQLException {
        try (Statement stmt = createStatement(conn);
             ResultSet rs = stmt.executeQuery(READABLE_SQL)) {
            rs.next();
            return ProbeResult.success();
        } catch (SQLException e) {
            if (Constants.INSUFFICIENT_PRIVILEGE_SQL_STATE.equals(e.getSQLState())) {
                log.info("Current credential cannot read {}: {}", Constants.EXTENSION_NAME, e.getMessage());
                return ProbeResult.failure("permission denied: " + e.getMessage());
            }
            if (Constants.NOT_IN_PREREQUISITE_STATE_SQL_STATE.equals(e.getSQLState())) {
                log.warn("{} is installed but not readable: {}", Constants.EXTENSION_NAME, e.getMessage());
                return ProbeResult.failure(e.getMessage());
            }
            throw e;
        }
    }

    private String querySingle(Connection conn, String sql) throws SQLException {
        try (Statement stmt = createStatement(conn);
             ResultSet rs = stmt.executeQuery(sql)) {
            return rs.next() ? rs.getString(1) : null;
        }
    }

    private boolean countPositive(Connection conn, String sql) throws SQLException {
        try (Statement stmt = createStatement(conn);
             ResultSet rs = stmt.executeQuery(sql)) {
            return rs.next() && rs.getLong("count") > 0;
        }
    }

    private Statement createStatement(Connection conn) throws SQLException {
        Statement stmt = conn.createStatement();
        if (statementTimeout != null) {
            try {
                stmt.setQueryTimeout((int) Math.max(1, statementTimeout.toSeconds()));
            } catch (SQLException e) {
                stmt.close();
                throw e;
            }
        }
        return stmt;
    }
}
