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
package org.greengagedb.querystats.history;

import io.agroal.api.AgroalDataSource;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import lombok.extern.slf4j.Slf4j;
import org.greengagedb.querystats.common.Constants;
import org.greengagedb.querystats.config.QueryStatsConfig;
import org.greengagedb.querystats.model.HistoricalRow;
import org.greengagedb.querystats.model.QueryHashPoint;
import org.greengagedb.querystats.model.RawStatRecord;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.sql.Timestamp;
import java.sql.Types;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.atomic.AtomicReference;
import java.util.regex.Pattern;

/**
 * Historical log kept in a PostgreSQL table of the stats database (the default datasource).
 *
 * <p>Expected table:
 * <pre>
 * CREATE TABLE query_stats_history (
 *     id          bigserial PRIMARY KEY,
 *     database    text NOT NULL,
 *     query       text,
 *     total_time  double precision,
 *     calls       bigint,
 *     captured_at timestamptz,
 *     query_hash  bigint,   -- optional
 *     "user"      text      -- optional
 * );
 * </pre>
 */
@Slf4j
@ApplicationScoped
public class JdbcHistoricalStore implements HistoricalStore {

    private static final Pattern TABLE_NAME = Pattern.compile("[A-Za-z_][A-Za-z0-9_]*(\\.[A-Za-z_][A-Za-z0-9_]*)?");

    private static final String COLUMNS_SQL = """
            SELECT column_name
            FROM information_schema.columns
            WHERE table_schema = COALESCE(CAST(? AS text), current_schema())
              AND table_name = ?
            """;

    private static final String QUERY_SQL_TEMPLATE = """
            WITH grouped AS (SELECT %s AS query_hash,
                                    %s AS text_key,
                                    %s AS query_user,
                                    array_agg(LEFT(query, ?)
                                              ORDER BY REPLACE(LEFT(query, 1000), '?', '!') COLLATE "C" ASC) AS queries,
                                    SUM(total_time)  AS total_time,
                                    SUM(calls)       AS calls,
                                    MAX(captured_at) AS last_captured_at
                             FROM %s
                             WHERE database = ?
                               %s
                             GROUP BY 1, 2, 3)
            SELECT query_hash,
                   query_user,
                   queries[1]                        AS query,
                   queries[array_length(queries, 1)] AS explainable_query,
                   total_time,
                   calls,
                   last_captured_at
            FROM grouped
            """;

    private static final String HASH_SERIES_SQL_TEMPLATE = """
            SELECT captured_at, total_time, calls
            FROM %s
            WHERE database = ?
              AND captured_at >= ?
              AND query_hash = ?
            ORDER BY captured_at ASC
            """;

    private final DataSource dataSource;
    private final String table;
    private final String schemaName;
    private final String tableName;
    private final Duration statementTimeout;
    private final int maxQueryLength;
    private final AtomicReference<HistorySchema> cachedSchemaRef = new AtomicReference<>();

    @Inject
    public JdbcHistoricalStore(AgroalDataSource dataSource, QueryStatsConfig config) {
        this((DataSource) dataSource, config.historyTable(), config.statementTimeout(), config.maxQueryLength());
    }

    public JdbcHistoricalStore(DataSource dataSource, String table, Duration statementTimeout, int maxQueryLength) {
        this.dataSource = Objects.requireNonNull(dataSource, "dataSource");
        if (table == null || !TABLE_NAME.matcher(table).matches()) {
            throw new IllegalArgumentException("Invalid history table name: " + table);
        }
        this.table = table;
        int dot = table.indexOf('.');
        this.schemaName = dot < 0 ? null : table.substring(0, dot);
        this.tableName = dot < 0 ? table : table.substring(dot + 1);
        this.statementTimeout = statementTimeout;
        this.maxQueryLength = maxQueryLength;
    }

    @Override
    public boolean enabled() {
        return schema().compatible();
    }

    @Override
    public HistorySchema schema() {
        HistorySchema local = cachedSchemaRef.get();
        if (local != null) {
            return local;
        }
        try {
            HistorySchema introspected = introspectSchema();
            if (!introspected.compatible()) {
                if (introspected.exists()) {
                    log.warn("History table '{}' is missing required columns {}, historical query stats disabled",
                            table, HistorySchema.REQUIRED_COLUMNS);
                }
                return introspected;
            }
            cachedSchemaRef.set(introspected);
            return introspected;
        } catch (SQLException e) {
            log.warn("Could not introspect history table '{}': {}", table, e.getMessage());
            return HistorySchema.missing();
        }
    }

    @Override
    public void invalidateSchema() {
        cachedSchemaRef.set(null);
    }

    @Override
    public int append(List<HistoricalRow> rows) throws SQLException {
        if (rows.isEmpty()) {
            return 0;
        }
        HistorySchema schema = schema();
        if (!schema.compatible()) {
            throw new SQLException("History table '" + table + "' is missing or incompatible");
        }
        String sql = buildInsertSql(schema);

        try (Connection conn = dataSource.getConnection()) {
            boolean autoCommit = conn.getAutoCommit();
            conn.setAutoCommit(false);
            try (PreparedStatement ps = conn.prepareStatement(sql)) {
                ps.setQueryTimeout(timeoutSeconds());
                for (HistoricalRow row : rows) {
                    bindRow(ps, row, schema);
                    ps.addBatch();
                }
                ps.executeBatch();
                conn.commit();
            } catch (SQLException e) {
                conn.rollback();
                log.error("Failed to append {} rows to '{}', rolled back: {}", rows.size(), table, e.getMessage());
                throw e;
            } finally {
                conn.setAutoCommit(autoCommit);
            }
        }
        log.debug("Appended {} rows to '{}'", rows.size(), table);
        return rows.size();
    }

    @Override
    public List<RawStatRecord> query(String databaseId, Instant startAt, Instant endAt, Long hashFilter)
            throws SQLException {
        HistorySchema schema = schema();
        if (!schema.compatible()) {
            return List.of();
        }
        if (hashFilter != null && !schema.hasQueryHash()) {
            return List.of();
        }

        StringBuilder where = new StringBuilder();
        if (startAt != null) {
            where.append("AND captured_at >= ? ");
        }
        if (endAt != null) {
            where.append("AND captured_at <= ? ");
        }
        if (hashFilter != null) {
            where.append("AND query_hash = ? ");
        }
        String sql = QUERY_SQL_TEMPLATE.formatted(
                schema.hasQueryHash() ? "query_hash" : "NULL::bigint",
                schema.hasQueryHash() ? "CASE WHEN query_hash IS NULL THEN md5(query) END" : "md5(query)",
                schema.hasUser() ? "\"user\"" : "NULL::text",
                table,
                where.toString().trim());

        List<RawStatRecord> rows = new ArrayList<>();
        try (Connection conn = dataSource.getConnection();
             PreparedStatement ps = conn.prepareStatement(sql)) {
            ps.setQueryTimeout(timeoutSeconds());
            int idx = 1;
            ps.setInt(idx++, maxQueryLength);
            ps.setString(idx++, databaseId);
            if (startAt != null) {
                ps.setTimestamp(idx++, Timestamp.from(startAt));
            }
            if (endAt != null) {
                ps.setTimestamp(idx++, Timestamp.from(endAt));
            }
            if (hashFilter != null) {
                ps.setLong(idx, hashFilter);
            }
            try (ResultSet rs = ps.executeQuery()) {
                while (rs.next()) {
                    long hash = rs.getLong("query_hash");
                    Long queryHash = rs.wasNull() ? null : hash;
                    Timestamp lastCapturedAt = rs.getTimestamp("last_captured_at");
                    rows.add(new RawStatRecord(
                            rs.getString("query"),
                            queryHash,
                            rs.getString("query_user"),
                            Math.max(0.0, rs.getDouble("total_time")),
                            Math.max(0L, rs.getLong("calls")),
                            databaseId,
                            lastCapturedAt != null ? lastCapturedAt.toInstant() : Instant.EPOCH,
                            rs.getString("explainable_query")));
                }
            }
        }
        log.debug("Read {} historical query stats groups for database '{}'", rows.size(), databaseId);
        return rows;
    }

    @Override
    public List<QueryHashPoint> hashSeries(String databaseId, long queryHash, Instant since) throws SQLException {
        if (!schema().hasQueryHash()) {
            return List.of();
        }
        List<QueryHashPoint> points = new ArrayList<>();
        try (Connection conn = dataSource.getConnection();
             PreparedStatement ps = conn.prepareStatement(HASH_SERIES_SQL_TEMPLATE.formatted(table))) {
            ps.setQueryTimeout(timeoutSeconds());
            ps.setString(1, databaseId);
            ps.setTimestamp(2, Timestamp.from(since));
            ps.setLong(3, queryHash);
            try (ResultSet rs = ps.executeQuery()) {
                while (rs.next()) {
                    double totalTimeMs = rs.getDouble("total_time");
                    long calls = rs.getLong("calls");
                    points.add(new QueryHashPoint(
                            rs.getTimestamp("captured_at").toInstant(),
                            totalTimeMs / Constants.MILLIS_PER_MINUTE,
                            calls > 0 ? totalTimeMs / calls : 0.0,
                            calls));
                }
            }
        }
        return points;
    }

    @Override
    public int prune(Instant capturedBefore) throws SQLException {
        if (!enabled()) {
            return 0;
        }
        try (Connection conn = dataSource.getConnection();
             PreparedStatement ps = conn.prepareStatement("DELETE FROM " + table + " WHERE captured_at < ?")) {
            ps.setQueryTimeout(timeoutSeconds());
            ps.setTimestamp(1, Timestamp.from(capturedBefore));
            int deleted = ps.executeUpdate();
            log.info("Pruned {} rows captured before {} from '{}'", deleted, capturedBefore, table);
            return deleted;
        }
    }

    /**
     * Test connectivity of the stats database.
     *
     * @return true if a trivial query succeeds
     */
    public boolean testConnection() {
        try (Connection conn = dataSource.getConnection();
             Statement stmt = conn.createStatement();
             ResultSet rs = stmt.executeQuery("SELECT 1")) {
            return rs.next() && rs.getInt(1) == 1;
        } catch (SQLException e) {
            log.debug("Stats database connection test failed", e);
            return false;
        }
    }

    String buildInsertSql(HistorySchema schema) {
        List<String> columns = new ArrayList<>(List.of("database", "query", "total_time", "calls", "captured_at"));
        if (schema.hasQueryHash()) {
            columns.add("query_hash");
        }
        if (schema.hasUser()) {
            columns.add("\"user\"");
        }
        String placeholders = String.join(", ", Collections.nCopies(columns.size(), "?"));
        return "INSERT INTO " + table + " (" + String.join(", ", columns) + ") VALUES (" + placeholders + ")";
    }

    private void bindRow(PreparedStatement ps, HistoricalRow row, HistorySchema schema) throws SQLException {
        int idx = 1;
        ps.setString(idx++, row.databaseId());
        ps.setString(idx++, row.query());
        ps.setDouble(idx++, row.totalTimeMs());
        ps.setLong(idx++, row.calls());
        ps.setTimestamp(idx++, Timestamp.from(row.capturedAt()));
        if (schema.hasQueryHash()) {
            if (row.queryHash() != null) {
                ps.setLong(idx++, row.queryHash());
            } else {
                ps.setNull(idx++, Types.BIGINT);
            }
        }
        if (schema.hasUser()) {
            ps.setString(idx, row.user());
        }
    }

    private HistorySchema introspectSchema() throws SQLException {
        Set<String> columns = new HashSet<>();
        try (Connection conn = dataSource.getConnection();
             PreparedStatement ps = conn.prepareStatement(COLUMNS_SQL)) {
            ps.setQueryTimeout(timeoutSeconds());
            ps.setString(1, schemaName);
            ps.setString(2, tableName);
            try (ResultSet rs = ps.executeQuery()) {
                while (rs.next()) {
                    columns.add(rs.getString("column_name"));
                }
            }
        }
        log.debug("History table '{}' has columns {}", table, columns);
        return new HistorySchema(columns);
    }

    private int timeoutSeconds() {
        return statementTimeout == null ? 0 : (int) Math.max(1, statementTimeout.toSeconds());
    }
}
