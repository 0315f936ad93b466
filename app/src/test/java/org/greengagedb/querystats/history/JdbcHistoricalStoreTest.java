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

import org.greengagedb.querystats.model.HistoricalRow;
import org.greengagedb.querystats.model.RawStatRecord;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.sql.Types;
import java.time.Duration;
import java.time.Instant;
import java.util.Arrays;
import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.contains;
import static org.mockito.ArgumentMatchers.startsWith;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class JdbcHistoricalStoreTest {

    private static final Instant CAPTURED_AT = Instant.parse("2024-05-01T12:00:00Z");
    private static final String[] FULL_COLUMNS =
            {"database", "query", "total_time", "calls", "captured_at", "query_hash", "user"};

    @Mock
    private DataSource dataSource;

    @Mock
    private Connection connection;

    @Mock
    private PreparedStatement columnsStatement;

    @Mock
    private ResultSet columnsResultSet;

    @Mock
    private PreparedStatement statement;

    @Mock
    private ResultSet resultSet;

    private JdbcHistoricalStore store;

    @BeforeEach
    void setUp() throws SQLException {
        store = new JdbcHistoricalStore(dataSource, "query_stats_history", Duration.ofSeconds(30), 10000);
        lenient().when(dataSource.getConnection()).thenReturn(connection);
        lenient().when(connection.prepareStatement(contains("information_schema"))).thenReturn(columnsStatement);
        lenient().when(columnsStatement.executeQuery()).thenReturn(columnsResultSet);
    }

    private void givenColumns(String... columns) throws SQLException {
        if (columns.length == 0) {
            when(columnsResultSet.next()).thenReturn(false);
            return;
        }
        Boolean[] more = new Boolean[columns.length];
        Arrays.fill(more, true);
        more[columns.length - 1] = false;
        when(columnsResultSet.next()).thenReturn(true, more);
        when(columnsResultSet.getString("column_name"))
                .thenReturn(columns[0], Arrays.copyOfRange(columns, 1, columns.length));
    }

    private static HistoricalRow row(Long hash) {
        return new HistoricalRow("main", "SELECT 1", hash, "app", 1500.0, 3, CAPTURED_AT);
    }

    @Test
    void testConstructor_InvalidTableName_ThrowsException() {
        Exception exception = assertThrows(IllegalArgumentException.class,
                () -> new JdbcHistoricalStore(dataSource, "stats; DROP TABLE x", Duration.ofSeconds(1), 100));
        assertTrue(exception.getMessage().contains("Invalid history table name"));
        assertThrows(IllegalArgumentException.class,
                () -> new JdbcHistoricalStore(dataSource, null, Duration.ofSeconds(1), 100));
    }

    @Test
    void testConstructor_SchemaQualifiedTableName() throws SQLException {
        // Setup
        JdbcHistoricalStore qualified = new JdbcHistoricalStore(dataSource, "monitoring.query_stats_history",
                Duration.ofSeconds(1), 100);
        givenColumns(FULL_COLUMNS);

        // Execute
        boolean enabled = qualified.enabled();

        // Verify
        assertTrue(enabled);
        verify(columnsStatement).setString(1, "monitoring");
        verify(columnsStatement).setString(2, "query_stats_history");
    }

    @Test
    void testEnabled_TableMissing_False() throws SQLException {
        // Setup
        givenColumns();

        // Execute & Verify
        assertFalse(store.enabled());
        assertFalse(store.schema().exists());
        assertEquals(List.of(), store.query("main", null, null, null));
        assertEquals(0, store.prune(CAPTURED_AT));
    }

    @Test
    void testEnabled_MissingRequiredColumn_False() throws SQLException {
        // Setup
        givenColumns("database", "query", "calls", "captured_at");

        // Execute
        HistorySchema schema = store.schema();

        // Verify
        assertTrue(schema.exists());
        assertFalse(schema.compatible());
    }

    @Test
    void testEnabled_TableCreatedAfterFirstCheck_PickedUp() throws SQLException {
        // Setup
        when(columnsResultSet.next()).thenReturn(false, true, true, true, true, true, false);
        when(columnsResultSet.getString("column_name"))
                .thenReturn("database", "query", "total_time", "calls", "captured_at");

        // Execute & Verify
        assertFalse(store.enabled());
        assertTrue(store.enabled());
        assertTrue(store.enabled());
        verify(columnsStatement, times(2)).executeQuery();
    }

    @Test
    void testEnabled_IntrospectionFails_FalseAndRetried() throws SQLException {
        // Setup
        when(dataSource.getConnection()).thenThrow(new SQLException("Connection refused"));

        // Execute
        assertFalse(store.enabled());
        assertFalse(store.enabled());

        // Verify
        verify(dataSource, times(2)).getConnection();
    }

    @Test
    void testSchema_CachedUntilInvalidated() throws SQLException {
        // Setup
        givenColumns(FULL_COLUMNS);

        // Execute
        store.schema();
        store.schema();

        // Verify
        verify(columnsStatement, times(1)).executeQuery();
        store.invalidateSchema();
        store.schema();
        verify(columnsStatement, times(2)).executeQuery();
    }

    @Test
    void testAppend_Empty_NoConnection() throws SQLException {
        assertEquals(0, store.append(List.of()));
        verifyNoInteractions(dataSource);
    }

    @Test
    void testAppend_Incompatible_ThrowsException() throws SQLException {
        // Setup
        givenColumns();

        // Execute & Verify
        List<HistoricalRow> rows = List.of(row(1L));
        assertThrows(SQLException.class, () -> store.append(rows));
        verify(connection, never()).commit();
    }

    @Test
    void testAppend_WritesBatchInTransaction() throws SQLException {
        // Setup
        givenColumns(FULL_COLUMNS);
        when(connection.getAutoCommit()).thenReturn(true);
        when(connection.prepareStatement(startsWith("INSERT"))).thenReturn(statement);

        // Execute
        int written = store.append(List.of(row(42L), row(null)));

        // Verify
        assertEquals(2, written);
        verify(connection).setAutoCommit(false);
        verify(statement, times(2)).addBatch();
        verify(statement).executeBatch();
        verify(connection).commit();
        verify(connection, never()).rollback();
        verify(connection).setAutoCommit(true);
        verify(statement).setLong(6, 42L);
        verify(statement).setNull(6, Types.BIGINT);
        verify(statement, times(2)).setString(7, "app");
        verify(statement, times(2)).setTimestamp(5, Timestamp.from(CAPTURED_AT));
    }

    @Test
    void testAppend_BatchFails_RollsBackAndThrows() throws SQLException {
        // Setup
        givenColumns(FULL_COLUMNS);
        when(connection.getAutoCommit()).thenReturn(true);
        when(connection.prepareStatement(startsWith("INSERT"))).thenReturn(statement);
        when(statement.executeBatch()).thenThrow(new SQLException("duplicate key"));

        // Execute & Verify
        List<HistoricalRow> rows = List.of(row(1L));
        assertThrows(SQLException.class, () -> store.append(rows));
        verify(connection).rollback();
        verify(connection, never()).commit();
        verify(connection).setAutoCommit(true);
    }

    @Test
    void testBuildInsertSql_RequiredColumnsOnly() {
        HistorySchema schema = new HistorySchema(Set.of("database", "query", "total_time", "calls", "captured_at"));

        assertEquals("INSERT INTO query_stats_history (database, query, total_time, calls, captured_at) "
                + "VALUES (?, ?, ?, ?, ?)", store.buildInsertSql(schema));
    }

    @Test
    void testBuildInsertSql_WithHashAndUser() {
        HistorySchema schema = new HistorySchema(Set.of(FULL_COLUMNS));

        assertEquals("INSERT INTO query_stats_history (database, query, total_time, calls, captured_at, "
                + "query_hash, \"user\") VALUES (?, ?, ?, ?, ?, ?, ?)", store.buildInsertSql(schema));
    }

    @Test
    void testQuery_MapsGroupedRows() throws SQLException {
        // Setup
        givenColumns(FULL_COLUMNS);
        when(connection.prepareStatement(contains("WITH grouped"))).thenReturn(statement);
        when(statement.executeQuery()).thenReturn(resultSet);
        when(resultSet.next()).thenReturn(true, false);
        when(resultSet.getLong("query_hash")).thenReturn(42L);
        when(resultSet.wasNull()).thenReturn(false);
        when(resultSet.getTimestamp("last_captured_at")).thenReturn(Timestamp.from(CAPTURED_AT));
        when(resultSet.getString("query")).thenReturn("SELECT * FROM t WHERE x = ?");
        when(resultSet.getString("query_user")).thenReturn("app");
        when(resultSet.getDouble("total_time")).thenReturn(90_000.0);
        when(resultSet.getLong("calls")).thenReturn(12L);
        when(resultSet.getString("explainable_query")).thenReturn("SELECT * FROM t WHERE x = 1");
        Instant start = CAPTURED_AT.minusSeconds(3600);

        // Execute
        List<RawStatRecord> rows = store.query("main", start, null, null);

        // Verify
        assertEquals(1, rows.size());
        RawStatRecord record = rows.get(0);
        assertEquals(42L, record.nativeHash());
        assertEquals("app", record.user());
        assertEquals(1.5, record.totalMinutes(), 1e-9);
        assertEquals(12, record.calls());
        assertEquals("main", record.databaseId());
        assertEquals(CAPTURED_AT, record.capturedAt());
        assertEquals("SELECT * FROM t WHERE x = 1", record.explainableQuery());
        verify(statement).setInt(1, 10000);
        verify(statement).setString(2, "main");
        verify(statement).setTimestamp(3, Timestamp.from(start));
    }

    @Test
    void testQuery_HashFilterWithoutHashColumn_ReturnsEmpty() throws SQLException {
        // Setup
        givenColumns("database", "query", "total_time", "calls", "captured_at");

        // Execute
        List<RawStatRecord> rows = store.query("main", null, null, 42L);

        // Verify
        assertTrue(rows.isEmpty());
        verify(connection, never()).prepareStatement(contains("WITH grouped"));
    }

    @Test
    void testPrune_DeletesOlderRows() throws SQLException {
        // Setup
        givenColumns(FULL_COLUMNS);
        when(connection.prepareStatement(startsWith("DELETE"))).thenReturn(statement);
        when(statement.executeUpdate()).thenReturn(7);

        // Execute
        int deleted = store.prune(CAPTURED_AT);

        // Verify
        assertEquals(7, deleted);
        verify(statement).setTimestamp(1, Timestamp.from(CAPTURED_AT));
    }

    @Test
    void testTestConnection_QueryFails_ReturnsFalse() throws SQLException {
        // Setup
        when(dataSource.getConnection()).thenThrow(new SQLException("Connection failed"));

        // Execute & Verify
        assertFalse(store.testConnection());
    }
}
