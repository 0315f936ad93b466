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
package org.greengagedb.querystats.model;

import lombok.Builder;

import java.time.Instant;

/**
 * Every option recognized by a query stats read, with its default.
 *
 * <ul>
 *   <li>{@code historical} - include the historical log (default false)</li>
 *   <li>{@code startAt}/{@code endAt} - window over captured rows, both optional</li>
 *   <li>{@code sort} - ranking metric (default {@link SortMetric#TOTAL_MINUTES})</li>
 *   <li>{@code minAverageTimeMs}/{@code minCalls} - post-ranking filters, optional</li>
 *   <li>{@code queryHash} - restrict both sources to one native hash, optional</li>
 * </ul>
 */
@Builder(toBuilder = true)
public record QueryStatsOptions(boolean historical,
                                Instant startAt,
                                Instant endAt,
                                SortMetric sort,
                                Double minAverageTimeMs,
                                Long minCalls,
                                Long queryHash) {

    public QueryStatsOptions {
        if (sort == null) {
            sort = SortMetric.TOTAL_MINUTES;
        }
        if (startAt != null && endAt != null && startAt.isAfter(endAt)) {
            throw new IllegalArgumentException("startAt " + startAt + " is after endAt " + endAt);
        }
        if (minAverageTimeMs != null && minAverageTimeMs < 0) {
            throw new IllegalArgumentException("minAverageTimeMs must be >= 0");
        }
        if (minCalls != null && minCalls < 0) {
            throw new IllegalArgumentException("minCalls must be >= 0");
        }
    }

    /**
     * Live-only read ranked by total time, no filters.
     */
    public static QueryStatsOptions defaults() {
        return QueryStatsOptions.builder().build();
    }

    /**
     * A window whose end lies in the past has no live component.
     *
     * @param now Current instant
     * @return true if live statistics must be left out
     */
    public boolean excludesLive(Instant now) {
        return historical && endAt != null && endAt.isBefore(now);
    }
}
