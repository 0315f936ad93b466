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
package org.greengagedb.querystats.aggregate;

import org.greengagedb.querystats.config.QueryStatsConfig;
import org.greengagedb.querystats.history.HistoricalStore;
import org.greengagedb.querystats.model.AggregatedStat;
import org.greengagedb.querystats.model.QueryStatsOptions;
import org.greengagedb.querystats.model.RawStatRecord;
import org.greengagedb.querystats.model.SortMetric;
import org.greengagedb.querystats.registry.MonitoredDatabase;
import org.greengagedb.querystats.source.StatsSource;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.sql.SQLException;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class QueryStatsAggregatorTest {

    private static final Instant NOW = Instant.parse("2024-05-01T12:00:00Z");
    private static final double DELTA = 1e-9;

    @Mock
    private HistoricalStore historicalStore;

    @Mock
    private QueryStatsConfig config;

    @Mock
    private MonitoredDatabase database;

    @Mock
    private StatsSource statsSource;

    private QueryStatsAggregator aggregator;

    @BeforeEach
    void setUp() throws SQLException {
        lenient().when(config.topLimit()).thenReturn(100);
        lenient().when(config.sourceRowLimit()).thenReturn(1000);
        lenient().when(config.slowQueryCalls()).thenReturn(100L);
        lenient().when(config.slowQueryMs()).thenReturn(20.0);
        lenient().when(database.id()).thenReturn("main");
        lenient().when(database.statsSource()).thenReturn(statsSource);

        aggregator = new QueryStatsAggregator(historicalStore, config, Clock.fixed(NOW, ZoneOffset.UTC));
    }

    private void givenLive(RawStatRecord... rows) throws SQLException {
        when(statsSource.currentStats(any(), any(), anyInt())).thenReturn(List.of(rows));
    }

    private void givenHistorical(RawStatRecord... rows) throws SQLException {
        when(historicalStore.query(eq("main"), any(), any(), any())).thenReturn(List.of(rows));
    }

    private static RawStatRecord live(String query, Long hash, double totalMs, long calls) {
        return RawStatRecord.live(query, hash, "app", totalMs, calls, "main");
    }

    private static RawStatRecord historical(String query, Long hash, double totalMs, long calls, String explainable) {
        return new RawStatRecord(query, hash, "app", totalMs, calls, "main", NOW.minusSeconds(600), explainable);
    }

    private static QueryStatsOptions historicalOptions() {
        return QueryStatsOptions.builder().historical(true).build();
    }

    @Test
    void testQueryStats_SameTextDifferentHash_MergedByNormalizedText() throws SQLException {
        // Setup
        givenLive(live("SELECT * FROM t WHERE x = ?", 111L, 60_000, 5));
        givenHistorical(historical("SELECT *  FROM t\nWHERE x = ?", 222L, 30_000, 3, null));

        // Execute
        List<AggregatedStat> stats = aggregator.queryStats(database, historicalOptions());

        // Verify
        assertEquals(1, stats.size());
        AggregatedStat stat = stats.get(0);
        assertEquals(8, stat.calls());
        assertEquals(1.5, stat.totalMinutes(), DELTA);
        assertEquals("SELECT * FROM t WHERE x = ?", stat.query());
        assertEquals(100.0, stat.totalPercent(), DELTA);
    }

    @Test
    void testQueryStats_SameHashDifferentText_MergedByHash() throws SQLException {
        // Setup
        givenLive(live("SELECT a FROM t WHERE id = ?", 42L, 1_000, 10));
        givenHistorical(historical("select a from t where id=$1", 42L, 2_000, 20, null));

        // Execute
        List<AggregatedStat> stats = aggregator.queryStats(database, historicalOptions());

        // Verify
        assertEquals(1, stats.size());
        assertEquals(30, stats.get(0).calls());
        assertEquals(42L, stats.get(0).queryHash());
        assertEquals("SELECT a FROM t WHERE id = ?", stats.get(0).query());
    }

    @Test
    void testQueryStats_DifferentUsers_KeptApart() throws SQLException {
        // Setup
        givenLive(RawStatRecord.live("SELECT 1", 7L, "alice", 1_000, 1, "main"),
                RawStatRecord.live("SELECT 1", 7L, "bob", 2_000, 1, "main"));

        // Execute
        List<AggregatedStat> stats = aggregator.queryStats(database, QueryStatsOptions.defaults());

        // Verify
        assertEquals(2, stats.size());
        assertEquals("bob", stats.get(0).user());
        assertEquals("alice", stats.get(1).user());
    }

    @Test
    void testQueryStats_PlaceholderArity_MergedByNormalizedText() throws SQLException {
        // Setup
        givenLive(live("SELECT * FROM t WHERE id IN (?, ?)", null, 1_000, 1),
                live("SELECT * FROM t WHERE id IN (?, ?, ?, ?)", null, 1_000, 1));

        // Execute
        List<AggregatedStat> stats = aggregator.queryStats(database, QueryStatsOptions.defaults());

        // Verify
        assertEquals(1, stats.size());
        assertEquals(2, stats.get(0).calls());
    }

    @Test
    void testQueryStats_DerivedMetricsConsistent() throws SQLException {
        // Setup
        givenLive(live("SELECT a FROM t1", 1L, 12_345, 7),
                live("SELECT b FROM t2", 2L, 98_765.5, 13),
                live("SELECT c FROM t3", 3L, 3.25, 1),
                live("SELECT d FROM t4", 4L, 600_000, 999));

        // Execute
        List<AggregatedStat> stats = aggregator.queryStats(database, QueryStatsOptions.defaults());

        // Verify
        assertEquals(4, stats.size());
        double percentSum = 0;
        for (AggregatedStat stat : stats) {
            assertEquals(stat.totalMinutes() * 60_000, stat.averageTimeMs() * stat.calls(), 1e-6);
            percentSum += stat.totalPercent();
        }
        assertEquals(100.0, percentSum, 1e-6);
    }

    @Test
    void testQueryStats_ZeroCalls_Excluded() throws SQLException {
        // Setup
        givenLive(live("SELECT a FROM t1", 1L, 5_000, 0),
                live("SELECT b FROM t2", 2L, 1_000, 4));

        // Execute
        List<AggregatedStat> stats = aggregator.queryStats(database, QueryStatsOptions.defaults());

        // Verify
        assertEquals(1, stats.size());
        assertEquals("SELECT b FROM t2", stats.get(0).query());
        assertEquals(100.0, stats.get(0).totalPercent(), DELTA);
    }

    @Test
    void testQueryStats_RankedDescendingBySelectedMetric() throws SQLException {
        // Setup
        givenLive(live("SELECT a FROM t1", 1L, 10_000, 1),
                live("SELECT b FROM t2", 2L, 1_000, 50),
                live("SELECT c FROM t3", 3L, 5_000, 10));

        // Execute
        List<AggregatedStat> byTime = aggregator.queryStats(database, QueryStatsOptions.defaults());
        List<AggregatedStat> byCalls = aggregator.queryStats(database,
                QueryStatsOptions.builder().sort(SortMetric.CALLS).build());

        // Verify
        assertEquals(List.of("SELECT a FROM t1", "SELECT c FROM t3", "SELECT b FROM t2"),
                byTime.stream().map(AggregatedStat::query).toList());
        assertEquals(List.of("SELECT b FROM t2", "SELECT c FROM t3", "SELECT a FROM t1"),
                byCalls.stream().map(AggregatedStat::query).toList());
    }

    @Test
    void testQueryStats_MinCallsFilter_AppliedAfterTopLimit() throws SQLException {
        // Setup: 150 statements, descending total time; 40 of the top 100 reach 100 calls,
        // and every statement ranked below 100 would pass the filter
        List<RawStatRecord> rows = new ArrayList<>();
        for (int i = 0; i < 150; i++) {
            long calls;
            if (i >= 100) {
                calls = 500;
            } else {
                calls = i % 5 < 2 ? 100 : 10;
            }
            rows.add(live("SELECT " + i + " FROM t", null, (150 - i) * 1_000.0, calls));
        }
        when(statsSource.currentStats(any(), any(), anyInt())).thenReturn(rows);

        // Execute
        List<AggregatedStat> stats = aggregator.queryStats(database,
                QueryStatsOptions.builder().minCalls(100L).build());

        // Verify
        assertEquals(40, stats.size());
        List<String> expected = new ArrayList<>();
        for (int i = 0; i < 100; i++) {
            if (i % 5 < 2) {
                expected.add("SELECT " + i + " FROM t");
            }
        }
        assertEquals(expected, stats.stream().map(AggregatedStat::query).toList());
    }

    @Test
    void testQueryStats_MinAverageFilter() throws SQLException {
        // Setup
        givenLive(live("SELECT a FROM t1", 1L, 1_000, 10),
                live("SELECT b FROM t2", 2L, 1_000, 1000));

        // Execute
        List<AggregatedStat> stats = aggregator.queryStats(database,
                QueryStatsOptions.builder().minAverageTimeMs(50.0).build());

        // Verify
        assertEquals(1, stats.size());
        assertEquals("SELECT a FROM t1", stats.get(0).query());
        // Percentages stay relative to the unfiltered result set
        assertTrue(stats.get(0).totalPercent() < 100.0);
    }

    @Test
    void testQueryStats_WindowEndInPast_SkipsLiveSource() throws SQLException {
        // Setup
        givenHistorical(historical("SELECT a FROM t1", 1L, 1_000, 1, null));
        QueryStatsOptions options = QueryStatsOptions.builder()
                .historical(true)
                .startAt(NOW.minusSeconds(7200))
                .endAt(NOW.minusSeconds(3600))
                .build();

        // Execute
        List<AggregatedStat> stats = aggregator.queryStats(database, options);

        // Verify
        assertEquals(1, stats.size());
        verify(database, never()).statsSource();
        verify(historicalStore).query("main", NOW.minusSeconds(7200), NOW.minusSeconds(3600), null);
    }

    @Test
    void testQueryStats_LiveOnly_DoesNotReadHistory() throws SQLException {
        // Setup
        givenLive(live("SELECT a FROM t1", 1L, 1_000, 1));

        // Execute
        aggregator.queryStats(database, QueryStatsOptions.defaults());

        // Verify
        verifyNoInteractions(historicalStore);
    }

    @Test
    void testQueryStats_HashFilter_PassedToBothSources() throws SQLException {
        // Setup
        givenLive();
        givenHistorical();

        // Execute
        aggregator.queryStats(database, QueryStatsOptions.builder().historical(true).queryHash(7L).build());

        // Verify
        verify(statsSource).currentStats(null, 7L, 1000);
        verify(historicalStore).query("main", null, null, 7L);
    }

    @Test
    void testQueryStats_TopLimitApplied() throws SQLException {
        // Setup
        when(config.topLimit()).thenReturn(2);
        givenLive(live("SELECT a FROM t1", 1L, 3_000, 1),
                live("SELECT b FROM t2", 2L, 2_000, 1),
                live("SELECT c FROM t3", 3L, 1_000, 1));

        // Execute
        List<AggregatedStat> stats = aggregator.queryStats(database, QueryStatsOptions.defaults());

        // Verify
        assertEquals(2, stats.size());
        assertEquals("SELECT b FROM t2", stats.get(1).query());
    }

    @Test
    void testQueryStats_ExplainableCandidateFromHistory() throws SQLException {
        // Setup
        givenLive(live("SELECT * FROM t WHERE x = ?", 9L, 1_000, 1));
        givenHistorical(historical("SELECT * FROM t WHERE x = ?", 9L, 1_000, 1, "SELECT * FROM t WHERE x = 42"));

        // Execute
        List<AggregatedStat> stats = aggregator.queryStats(database, historicalOptions());

        // Verify
        assertEquals(1, stats.size());
        assertEquals("SELECT * FROM t WHERE x = 42", stats.get(0).explainableQuery());
    }

    @Test
    void testQueryStats_NoExplainableCandidate_Null() throws SQLException {
        // Setup
        givenLive(live("UPDATE t SET x = ? WHERE id = ?", 9L, 1_000, 1));

        // Execute
        List<AggregatedStat> stats = aggregator.queryStats(database, QueryStatsOptions.defaults());

        // Verify
        assertNull(stats.get(0).explainableQuery());
    }

    @Test
    void testQueryStats_EmptySources_ReturnsEmpty() throws SQLException {
        // Setup
        givenLive();
        givenHistorical();

        // Execute
        List<AggregatedStat> stats = aggregator.queryStats(database, historicalOptions());

        // Verify
        assertTrue(stats.isEmpty());
    }

    @Test
    void testQueryStats_SourceFailure_Propagates() throws SQLException {
        // Setup
        when(statsSource.currentStats(any(), any(), anyInt())).thenThrow(new SQLException("canceling statement"));

        // Execute & Verify
        assertThrows(SQLException.class, () -> aggregator.queryStats(database, QueryStatsOptions.defaults()));
    }

    @Test
    void testSlowQueries_FiltersByCallsAndAverage() throws SQLException {
        // Setup
        givenLive(live("SELECT slow FROM t", 1L, 6_000, 200),
                live("SELECT fast FROM t", 2L, 1_000, 200),
                live("SELECT rare FROM t", 3L, 5_000, 50));

        // Execute
        List<AggregatedStat> stats = aggregator.slowQueries(database, QueryStatsOptions.defaults());

        // Verify
        assertEquals(1, stats.size());
        assertEquals("SELECT slow FROM t", stats.get(0).query());
        assertEquals(30.0, stats.get(0).averageTimeMs(), DELTA);
    }
}
