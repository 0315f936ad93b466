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

/**
 * Ranked, de-duplicated statistics for one statement group.
 *
 * @param queryHash          Native hash of the representative row, null when unsupported
 * @param user               Role, null when unsupported
 * @param query              Representative statement text
 * @param explainableQuery   Text safe for plan inspection, null when none qualifies
 * @param totalMinutes       Summed execution time in minutes
 * @param calls              Summed executions
 * @param averageTimeMs      {@code totalMinutes * 60000 / calls}
 * @param totalPercent       Share of the result set's total minutes
 */
public record AggregatedStat(Long queryHash,
                             String user,
                             String query,
                             String explainableQuery,
                             double totalMinutes,
                             long calls,
                             double averageTimeMs,
                             double totalPercent) {

    public double metric(SortMetric metric) {
        return switch (metric) {
            case TOTAL_MINUTES -> totalMinutes;
            case AVERAGE_TIME -> averageTimeMs;
            case CALLS -> calls;
        };
    }
}
