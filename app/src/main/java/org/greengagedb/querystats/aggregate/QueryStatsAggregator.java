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

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import lombok.extern.slf4j.Slf4j;
import org.greengagedb.querystats.common.Constants;
import org.greengagedb.querystats.common.QueryNormalizer;
import org.greengagedb.querystats.config.QueryStatsConfig;
import org.greengagedb.querystats.history.HistoricalStore;
import org.greengagedb.querystats.model.AggregatedStat;
import org.greengagedb.querystats.model.QueryStatsOptions;
import org.greengagedb.querystats.model.RawStatRecord;
import org.greengagedb.querystats.registry.MonitoredDatabase;

import java.sql.SQLException;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Merges live and historical statement statistics into one ranked, de-duplicated view.
 *
 * <p>Rows are grouped twice: first by {@code (native hash, user)}, which merges the same
 * statement across sources even when its text drifted, then by {@code (normalized text, user)},
 * which catches statements whose native hash differs between sources or is missing on one side.
 *
 * <p>Reads are side-effect free and may run while a capture cycle resets the counters; a read
 * can then see a torn view for at most one capture interval.
 */
@Slf4j
@ApplicationScoped
public class QueryStatsAggregator {

    private final HistoricalStore historicalStore;
    private final QueryStatsConfig config;
    private final Clock clock;

    @Inject
    public QueryStatsAggregator(HistoricalStore historicalStore, QueryStatsConfig config) {
        this(historicalStore, config, Clock.systemUTC());
    }

    QueryStatsAggregator(HistoricalStore historicalStore, QueryStatsConfig config, Clock clock) {
        this.historicalStore = Objects.requireNonNull(historicalStore, "historicalStore");
        this.config = Objects.requireNonNull(config, "config");
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    /**
     * Ranked statistics for a database.
     *
     * <p>The top {@code top-limit} groups are selected first; {@code minAverageTimeMs} and
     * {@code minCalls} only narrow that selection, so a filtered result never reaches groups
     * ranked below the limit.
     *
     * @param database Database to read
     * @param options  Read options
     * @return Ranked statistics (never null, may be empty)
     * @throws SQLException if a source read fails
     */
    public List<AggregatedStat> queryStats(MonitoredDatabase database, QueryStatsOptions options) throws SQLException {
        Instant now = clock.instant();

        List<RawStatRecord> liveRows = options.excludesLive(now)
                ? List.of()
                : database.statsSource().currentStats(database.databaseName(), options.queryHash(), config.sourceRowLimit());
        List<RawStatRecord> historicalRows = options.historical()
                ? historicalStore.query(database.id(), options.startAt(), options.endAt(), options.queryHash())
                : List.of();
        log.debug("Merging {} live and {} historical rows for database '{}'",
                liveRows.size(), historicalRows.size(), database.id());

        return rank(merge(liveRows, historicalRows), options);
    }

    /**
     * Statistics of statements that are both frequent and slow.
     *
     * @param database Database to read
     * @param options  Read options
     * @return Entries with {@code calls >= slow-query-calls} and {@code average >= slow-query-ms}
     * @throws SQLException if a source read fails
     */
    public List<AggregatedStat> slowQueries(MonitoredDatabase database, QueryStatsOptions options) throws SQLException {
        return queryStats(database, options).stream()
                .filter(s -> s.calls() >= config.slowQueryCalls())
                .filter(s -> s.averageTimeMs() >= config.slowQueryMs())
                .toList();
    }

    /**
     * Group rows by native hash, then by normalized text.
     */
    List<StatGroup> merge(List<RawStatRecord> liveRows, List<RawStatRecord> historicalRows) {
        Map<GroupKey, StatGroup> byHash = new LinkedHashMap<>();
        for (RawStatRecord row : concat(liveRows, historicalRows)) {
            Object identity = row.nativeHash() != null ? row.nativeHash() : row.query();
            byHash.computeIfAbsent(new GroupKey(identity, row.user()), k -> new StatGroup()).add(row);
        }

        Map<GroupKey, StatGroup> byText = new LinkedHashMap<>();
        for (StatGroup group : byHash.values()) {
            GroupKey key = new GroupKey(QueryNormalizer.normalize(group.query()), group.user());
            byText.computeIfAbsent(key, k -> new StatGroup()).merge(group);
        }
        return new ArrayList<>(byText.values());
    }

    List<AggregatedStat> rank(Collection<StatGroup> groups, QueryStatsOptions options) {
        List<StatGroup> counted = groups.stream()
                .filter(g -> g.calls() > 0)
                .toList();
        double grandTotalMinutes = counted.stream()
                .mapToDouble(g -> g.totalTimeMs() / Constants.MILLIS_PER_MINUTE)
                .sum();

        Comparator<AggregatedStat> order = Comparator
                .comparingDouble((AggregatedStat s) -> s.metric(options.sort()))
                .reversed()
                .thenComparing(AggregatedStat::query);

        List<AggregatedStat> ranked = counted.stream()
                .map(g -> toStat(g, grandTotalMinutes))
                .sorted(order)
                .limit(config.topLimit())
                .toList();

        return ranked.stream()
                .filter(s -> options.minAverageTimeMs() == null || s.averageTimeMs() >= options.minAverageTimeMs())
                .filter(s -> options.minCalls() == null || s.calls() >= options.minCalls())
                .toList();
    }

    private AggregatedStat toStat(StatGroup group, double grandTotalMinutes) {
        double totalMinutes = group.totalTimeMs() / Constants.MILLIS_PER_MINUTE;
        return new AggregatedStat(
                group.queryHash(),
                group.user(),
                group.query(),
                group.explainableQuery().orElse(null),
                totalMinutes,
                group.calls(),
                totalMinutes * Constants.MILLIS_PER_MINUTE / group.calls(),
                grandTotalMinutes > 0 ? totalMinutes * 100.0 / grandTotalMinutes : 0.0);
    }

    private static List<RawStatRecord> concat(List<RawStatRecord> first, List<RawStatRecord> second) {
        List<RawStatRecord> all = new ArrayList<>(first.size() + second.size());
        all.addAll(first);
        all.addAll(second);
        return all;
    }

    private record GroupKey(Object identity, String user) {
    }
}
