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

import java.time.Instant;
import java.util.Objects;

/**
 * Persisted form of a captured statement row. Rows are append-only.
 */
public record HistoricalRow(String databaseId,
                            String query,
                            Long queryHash,
                            String user,
                            double totalTimeMs,
                            long calls,
                            Instant capturedAt) {

    public HistoricalRow {
        Objects.requireNonNull(databaseId, "databaseId");
        Objects.requireNonNull(capturedAt, "capturedAt");
        query = Objects.requireNonNullElse(query, "");
    }

    /**
     * Tag a live row with the logical database and cycle instant it was captured in.
     */
    public static HistoricalRow of(String databaseId, RawStatRecord record, Instant capturedAt) {
        return new HistoricalRow(databaseId,
                record.query(),
                record.nativeHash(),
                record.user(),
                record.totalTimeMs(),
                record.calls(),
                capturedAt);
    }
}
