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
package org.greengagedb.querystats.health;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.eclipse.microprofile.health.HealthCheck;
import org.eclipse.microprofile.health.HealthCheckResponse;
import org.eclipse.microprofile.health.HealthCheckResponseBuilder;
import org.eclipse.microprofile.health.Liveness;
import org.greengagedb.querystats.history.JdbcHistoricalStore;
import org.greengagedb.querystats.registry.DatabaseRegistry;
import org.greengagedb.querystats.registry.MonitoredDatabase;
import org.greengagedb.querystats.service.QueryStatsService;

/**
 * Health check for the stats database.
 * Note: This is a liveness check; a monitored database without the extension is reported in the data
 * but does not fail the check
 */
@Liveness
@ApplicationScoped
public class QueryStatsHealthCheck implements HealthCheck {

    @Inject
    JdbcHistoricalStore historicalStore;

    @Inject
    DatabaseRegistry registry;

    @Inject
    QueryStatsService queryStatsService;

    @Override
    public HealthCheckResponse call() {
        boolean connected = historicalStore.testConnection();

        HealthCheckResponseBuilder builder = HealthCheckResponse.named("query-stats")
                .status(connected)
                .withData("accessible", connected)
                .withData("history", historicalStore.enabled());
        for (MonitoredDatabase database : registry.all()) {
            builder.withData(database.id(), queryStatsService.queryStatsEnabled(database.id()));
        }
        return builder.build();
    }
}
