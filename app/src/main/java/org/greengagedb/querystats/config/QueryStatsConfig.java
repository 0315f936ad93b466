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
package org.greengagedb.querystats.config;

import io.smallrye.config.ConfigMapping;
import io.smallrye.config.WithDefault;

import java.time.Duration;

/**
 * Configuration of the query stats read path and statistics queries.
 */
@ConfigMapping(prefix = "app.query-stats")
public interface QueryStatsConfig {

    /**
     * Number of ranked entries kept before filters are applied.
     *
     * @return Top limit (default: 100)
     */
    @WithDefault("100")
    int topLimit();

    /**
     * Maximum rows read from the live view on the read path.
     *
     * @return Row limit (default: 1000)
     */
    @WithDefault("1000")
    int sourceRowLimit();

    /**
     * Maximum rows read from the live view per member during capture.
     *
     * @return Row limit (default: 1000000)
     */
    @WithDefault("1000000")
    int captureRowLimit();

    /**
     * Timeout applied to every statement issued against a monitored database.
     *
     * @return Statement timeout (default: 30 seconds)
     */
    @WithDefault("30s")
    Duration statementTimeout();

    /**
     * Table holding captured statistics in the stats database.
     *
     * @return Table name (default: query_stats_history)
     */
    @WithDefault("query_stats_history")
    String historyTable();

    /**
     * Statement text longer than this is truncated when read.
     *
     * @return Maximum query length (default: 10000)
     */
    @WithDefault("10000")
    int maxQueryLength();

    @WithDefault("20")
    double slowQueryMs();

    @WithDefault("100")
    long slowQueryCalls();

    /**
     * How far back a per-hash time series reaches.
     *
     * @return Window (default: 24 hours)
     */
    @WithDefault("24h")
    Duration hashStatsWindow();
}
