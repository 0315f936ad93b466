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

import lombok.extern.slf4j.Slf4j;
import org.greengagedb.querystats.model.DatabaseCapabilities;
import org.greengagedb.querystats.model.ProbeResult;
import org.greengagedb.querystats.model.RawStatRecord;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Live statistics read from {@code pg_stat_statements}.
 *
 * <p>Column choice follows the cached capabilities: {@code queryid} only when native hashes
 * are supported, {@code rolname} only when the user column is supported, and
 * {@code total_exec_time} on servers that renamed {@code total_time}.
 */
@Slf4j
public class PgStatStatementsSource implements StatsSource {

    private static final String STATS_SQL_TEMPLATE = """
            SELECT LEFT(s.query, ?)  AS query,
                   %s                AS query_hash,
                   %s                AS query_user,
                   s.%s              AS total_time,
                   s.calls           AS calls
            FROM pg_stat_statements s
                     INNER JOIN pg_database d ON d.oid = s.dbid
                     INNER JOIN pg_roles r ON r.oid = s.userid
            WHERE d.datname = COALESCE(CAST(? AS text), current_database()::text)
              %s
            ORDER BY 4 DESC
            LIMIT ?
            """;
    private static final String RESET_SQL = "SELECT pg_stat_statements_reset()";

    private final String databaseId;
    private final DataSource dataSource;
    private final DatabaseCapabilities capabilities;
    private final Duration statementTimeout;
    private final int maxQueryLength;

    public PgStatStatementsSource(String databaseId,
                                  DataSource dataSource,
                                  DatabaseCapabilities capabilities,
                                  Duration statementTimeout,
                                  int maxQueryLength) {
        this.databaseId = Objects.requireNonNull(databaseId, "databaseId");
        this.dataSource = Objects.requireNonNull(dataSource, "dataSource");
        this.capabilities = Objects.requireNonNull(capabilities, "capabilities");
        this.statementTimeout = statementTimeout;
        this.maxQueryLength = maxQueryLength;
    }

    @Override
    public boolean installable() {
        return capabilities.extensionAvailable();
    }

    @Override
    public boolean installed() {
        return capabilities.extensionInstalled();
    }

    @Override
    public ProbeResult readable() {
        return capabilities.readable();
    }

    @Override
    public List<RawStatRecord> currentStats(String databaseFilter, Long hashFilter, int limit) throws SQLException {
        boolean hashSupported = capabilities.hashSupport().isSupported();
        if (hashFilter != null && !hashSupported) {
            return List.of();
        }
        String sql = buildStatsSql(hashFilter != null);

        List<RawStatRecord> rows = new ArrayList<>();
        try (Connection conn = dataSource.getConnection();
             PreparedStatement ps = conn.prepareStatement(sql)) {
            ps.setQueryTimeout(timeoutSeconds());
            int idx = 1;
            ps.setInt(idx++, maxQueryLength);
            ps.setString(idx++, databaseFilter);
            if (hashFilter != null) {
                ps.setLong(idx++, hashFilter);
            }
            ps.setInt(idx, limit);

            try (ResultSet rs = ps.executeQuery()) {
                while (rs.next()) {
                    long hash = rs.getLong("query_hash");
                    Long nativeHash = rs.wasNull() ? null : hash;
                    rows.add(RawStatRecord.live(
                            rs.getString("query"),
                            nativeHash,
                            rs.getString("query_user"),
                            Math.max(0.0, rs.getDouble("total_time")),
                            Math.max(0L, rs.getLong("calls")),
                            databaseId));
                }
            }
        } catch (SQLException e) {
            log.warn("Failed to read live query stats for database '{}': {}", databaseId, e.getMessage());
            throw e;
        }
        log.debug("Read {} live query stats rows for database '{}'", rows.size(), databaseId);
        return rows;
    }

    @Override
    public boolean reset() throws SQLException {
        try (Connection conn = dataSource.getConnection();
             Statement stmt = conn.createStatement()) {
            stmt.setQueryTimeout(timeoutSeconds());
            stmt.execute(RESET_SQL);
            log.info("Reset query stats through database '{}'", databaseId);
            return true;
        }
    }

    String buildStatsSql(boolean filterByHash) {
        return STATS_SQL_TEMPLATE.formatted(
                capabilities.hashSupport().isSupported() ? "s.queryid" : "NULL::bigint",
                capabilities.userSupport().isSupported() ? "r.rolname::text" : "NULL::text",
                capabilities.usesExecTimeColumns() ? "total_exec_time" : "total_time",
                filterByHash ? "AND s.queryid = ?" : "");
    }

    private int timeoutSeconds() {
        return statementTimeout == null ? 0 : (int) Math.max(1, statementTimeout.toSeconds());
    }
}
