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
import org.greengagedb.querystats.model.QueryHashPoint;
import org.greengagedb.querystats.model.RawStatRecord;

import java.sql.SQLException;
import java.time.Instant;
import java.util.List;

/**
 * Durable, append-only log of captured statement statistics.
 *
 * <p>When the backing table is missing or lacks the expected columns, {@link #enabled()}
 * is false and every read returns empty instead of failing.
 */
public interface HistoricalStore {

    /**
     * Whether the backing log exists and is schema-compatible. Never throws.
     */
    boolean enabled();

    /**
     * Columns of the backing log. A compatible schema is cached; a missing or incompatible one is
     * introspected again on every call.
     */
    HistorySchema schema();

    /**
     * Forget the cached schema so the next call introspects again.
     */
    void invalidateSchema();

    /**
     * Append rows as a single atomic bulk write.
     *
     * @param rows Rows to insert
     * @return Number of rows inserted
     * @throws SQLException if the write failed; no row is visible in that case
     */
    int append(List<HistoricalRow> rows) throws SQLException;

    /**
     * Sum captured rows of one logical database per {@code (hash-or-text, user)} group.
     *
     * <p>The representative text is the first of the group in normalized sort order; the
     * explainable candidate is the last one.
     *
     * @param databaseId Logical database id
     * @param startAt    Inclusive window start, null for unbounded
     * @param endAt      Inclusive window end, null for unbounded
     * @param hashFilter Restrict to one native hash, null for all
     * @return One row per group (empty when disabled)
     * @throws SQLException on read failure
     */
    List<RawStatRecord> query(String databaseId, Instant startAt, Instant endAt, Long hashFilter) throws SQLException;

    /**
     * Captured samples of one native hash since a given instant, oldest first.
     */
    List<QueryHashPoint> hashSeries(String databaseId, long queryHash, Instant since) throws SQLException;

    /**
     * Delete rows captured before the given instant.
     *
     * @return Number of rows deleted (0 when disabled)
     */
    int prune(Instant capturedBefore) throws SQLException;
}
