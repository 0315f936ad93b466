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

import org.greengagedb.querystats.model.DatabaseCapabilities;
import org.greengagedb.querystats.model.ProbeResult;
import org.greengagedb.querystats.model.RawStatRecord;

import java.util.List;

/**
 * Source used when the extension is missing or not readable. Never fails.
 */
public class UnavailableStatsSource implements StatsSource {

    private final DatabaseCapabilities capabilities;

    public UnavailableStatsSource(DatabaseCapabilities capabilities) {
        this.capabilities = capabilities;
    }

    @Override
    public boolean installable() {
        return capabilities.extensionAvailable();
    }

    @Override
    public boolean installed() {
        return capabilities.extensionInstalled();
    }

    @Override
    public ProbeResult readable() {
        return capabilities.readable();
    }

    @Override
    public List<RawStatRecord> currentStats(String databaseFilter, Long hashFilter, int limit) {
        return List.of();
    }

    @Override
    public boolean reset() {
        return false;
    }
}
