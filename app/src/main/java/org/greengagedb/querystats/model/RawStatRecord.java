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

import org.greengagedb.querystats.common.Constants;

import java.time.Instant;
import java.util.Objects;

/**
 * One statement statistics row from either the live view or the historical log.
 *
 * @param query             Statement text (may be empty, never null)
 * @param nativeHash        Engine query id, null when unsupported
 * @param user              Role that ran the statement, null when unsupported
 * @param totalTimeMs       Total execution time in milliseconds
 * @param calls             Number of executions
 * @param databaseId        Logical database id the row belongs to
 * @param capturedAt        Capture instant for historical rows, null for live rows
 * @param explainableQuery  Candidate text for plan inspection, null when none was chosen
 */
public record RawStatRecord(String query,
                            Long nativeHash,
                            String user,
                            double totalTimeMs,
                            long calls,
                            String databaseId,
                            Instant capturedAt,
                            String explainableQuery) {

    public RawStatRecord {
        query = Objects.requireNonNullElse(query, "");
        if (calls < 0) {
            throw new IllegalArgumentException("calls must be >= 0, got " + calls);
        }
        if (totalTimeMs < 0) {
            throw new IllegalArgumentException("totalTimeMs must be >= 0, got " + totalTimeMs);
        }
    }

    /**
     * Create a row read from the live statistics view.
     */
    public static RawStatRecord live(String query, Long nativeHash, String user,
                                     double totalTimeMs, long calls, String databaseId) {
        return new RawStatRecord(query, nativeHash, user, totalTimeMs, calls, databaseId, null, null);
    }

    public double totalMinutes() {
        return totalTimeMs / Constants.MILLIS_PER_MINUTE;
    }

    public boolean isHistorical() {
        return capturedAt != null;
    }
}
