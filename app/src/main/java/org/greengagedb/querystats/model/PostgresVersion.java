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
 * Represents a PostgreSQL server version as reported by {@code server_version_num}
 */
public record PostgresVersion(int major, int minor, int versionNum) {
    private static final int QUERY_ID_VERSION_NUM = 90400;
    private static final int EXEC_TIME_COLUMNS_VERSION_NUM = 130000;
    private static final int NEW_SCHEME_VERSION_NUM = 100000;

    /**
     * Parse a {@code server_version_num} value such as {@code 90624} or {@code 150004}.
     *
     * @param versionNum The numeric version string
     * @return Parsed version or null if parsing fails
     */
    public static PostgresVersion parse(String versionNum) {
        if (versionNum == null || versionNum.isBlank()) {
            return null;
        }
        final int num;
        try {
            num = Integer.parseInt(versionNum.trim());
        } catch (NumberFormatException e) {
            return null;
        }
        if (num <= 0) {
            return null;
        }
        if (num >= NEW_SCHEME_VERSION_NUM) {
            return new PostgresVersion(num / 10000, 0, num);
        }
        return new PostgresVersion(num / 10000, (num / 100) % 100, num);
    }

    /**
     * Whether {@code pg_stat_statements} exposes a {@code queryid} column.
     */
    public boolean supportsQueryId() {
        return versionNum >= QUERY_ID_VERSION_NUM;
    }

    /**
     * Whether timing columns are named {@code total_exec_time} instead of {@code total_time}.
     */
    public boolean usesExecTimeColumns() {
        return versionNum >= EXEC_TIME_COLUMNS_VERSION_NUM;
    }

    public String fullVersion() {
        return versionNum >= NEW_SCHEME_VERSION_NUM ? String.valueOf(major) : major + "." + minor;
    }
}
