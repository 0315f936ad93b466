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

import java.util.Locale;

/**
 * Metrics a query stats result can be ranked by (always descending).
 */
public enum SortMetric {
    TOTAL_MINUTES,
    AVERAGE_TIME,
    CALLS;

    /**
     * Parse a metric name such as {@code total_minutes} or {@code average_time}.
     *
     * @param value Metric name, null or blank for the default
     * @return Parsed metric, {@link #TOTAL_MINUTES} by default
     * @throws IllegalArgumentException if the name is unknown
     */
    public static SortMetric fromString(String value) {
        if (value == null || value.isBlank()) {
            return TOTAL_MINUTES;
        }
        return SortMetric.valueOf(value.trim().toUpperCase(Locale.ROOT));
    }
}
