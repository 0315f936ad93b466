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

import org.greengagedb.querystats.model.ProbeResult;
import org.greengagedb.querystats.model.RawStatRecord;

import java.sql.SQLException;
import java.util.List;

/**
 * Read access to the engine's live, volatile statement statistics.
 *
 * <p>Two variants exist: {@link PgStatStatementsSource} when the extension is installed and
 * readable, and {@link UnavailableStatsSource} otherwise. Unavailability is a normal state:
 * the unavailable variant returns empty results instead of failing.
 *
 * <p>The three probes are independent and should be read in order:
 * {@link #installable()}, {@link #installed()}, {@link #readable()}. Only
 * {@link #installed()} AND {@link #readable()} together mean "usable now".
 */
public interface StatsSource {

    /**
     * The extension can be installed on this server in principle.
     */
    boolean installable();

    /**
     * The extension is currently installed in the database.
     */
    boolean installed();

    /**
     * Whether the current credential can read the statistics view.
     */
    ProbeResult readable();

    default boolean usable() {
        return installed() && readable().ok();
    }

    /**
     * Read current statistics, highest total time first.
     *
     * @param databaseFilter Physical database name, null for the connection's own database
     * @param hashFilter     Restrict to one native hash, null for all
     * @param limit          Maximum number of rows
     * @return Rows (never null, empty when unavailable)
     * @throws SQLException on fetch failure or timeout
     */
    List<RawStatRecord> currentStats(String databaseFilter, Long hashFilter, int limit) throws SQLException;

    /**
     * Reset the shared physical counters. The call is not interruptible once issued.
     *
     * @return true if a reset was issued, false when the source is unavailable
     * @throws SQLException if the reset call fails
     */
    boolean reset() throws SQLException;
}
