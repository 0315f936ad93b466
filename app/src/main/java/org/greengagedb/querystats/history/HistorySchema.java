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

import java.util.Locale;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Columns found on the historical log table.
 *
 * @param columns Lower-case column names, empty when the table does not exist
 */
public record HistorySchema(Set<String> columns) {
    static final Set<String> REQUIRED_COLUMNS = Set.of("database", "query", "total_time", "calls", "captured_at");
    static final String QUERY_HASH_COLUMN = "query_hash";
    static final String USER_COLUMN = "user";

    private static final HistorySchema MISSING = new HistorySchema(Set.of());

    public HistorySchema {
        columns = columns.stream()
                .map(c -> c.toLowerCase(Locale.ROOT))
                .collect(Collectors.toUnmodifiableSet());
    }

    public static HistorySchema missing() {
        return MISSING;
    }

    public boolean exists() {
        return !columns.isEmpty();
    }

    /**
     * The table exists and has every column capture writes.
     */
    public boolean compatible() {
        return columns.containsAll(REQUIRED_COLUMNS);
    }

    public boolean hasQueryHash() {
        return compatible() && columns.contains(QUERY_HASH_COLUMN);
    }

    public boolean hasUser() {
        return compatible() && columns.contains(USER_COLUMN);
    }
}
