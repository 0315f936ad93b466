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
package org.greengagedb.querystats.registry;

import io.agroal.api.AgroalDataSource;
import jakarta.annotation.PreDestroy;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import lombok.extern.slf4j.Slf4j;
import org.greengagedb.querystats.config.DatabasesConfig;
import org.greengagedb.querystats.config.QueryStatsConfig;
import org.greengagedb.querystats.connection.DbDatasourceFactory;
import org.greengagedb.querystats.history.HistoricalStore;
import org.greengagedb.querystats.source.CapabilityIntrospector;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;

/**
 * Registry of monitored logical databases and the reset domains they form.
 *
 * <p>Registrations that declare the same {@code reset-domain} share one physical counter state;
 * a registration without one forms its own domain.
 */
@Slf4j
@ApplicationScoped
public class DatabaseRegistry {

    private final Map<String, MonitoredDatabase> databases;
    private final List<AgroalDataSource> ownedDataSources = new ArrayList<>();

    @Inject
    public DatabaseRegistry(DatabasesConfig databasesConfig,
                            QueryStatsConfig queryStatsConfig,
                            DbDatasourceFactory datasourceFactory,
                            CapabilityIntrospector introspector,
                            HistoricalStore historicalStore) {
        Map<String, MonitoredDatabase> registered = new TreeMap<>();
        for (Map.Entry<String, DatabasesConfig.Database> entry : databasesConfig.databases().entrySet()) {
            String id = entry.getKey();
            DatabasesConfig.Database config = entry.getValue();
            try {
                AgroalDataSource dataSource = datasourceFactory.create(id, config);
                ownedDataSources.add(dataSource);
                registered.put(id, PostgresDatabase.builder()
                        .id(id)
                        .displayName(config.displayName().orElse(null))
                        .resetDomainId(config.resetDomain().orElse(null))
                        .databaseName(config.databaseName().orElse(null))
                        .captureEnabled(config.captureEnabled())
                        .dataSource(dataSource)
                        .introspector(introspector)
                        .historicalStore(historicalStore)
                        .statementTimeout(queryStatsConfig.statementTimeout())
                        .maxQueryLength(queryStatsConfig.maxQueryLength())
                        .build());
                log.info("Registered database '{}'", id);
            } catch (Exception e) {
                log.error("Error registering database '{}': {}", id, e.getMessage(), e);
            }
        }
        if (registered.isEmpty()) {
            log.warn("No databases registered, configure app.registry.databases.<id>.url");
        }
        this.databases = Collections.unmodifiableMap(registered);
    }

    /**
     * Create a registry over already-built databases.
     *
     * @param databases Registered databases
     */
    public DatabaseRegistry(Collection<? extends MonitoredDatabase> databases) {
        Map<String, MonitoredDatabase> registered = new TreeMap<>();
        for (MonitoredDatabase database : databases) {
            if (registered.putIfAbsent(database.id(), database) != null) {
                throw new IllegalArgumentException("Duplicate database id: " + database.id());
            }
        }
        this.databases = Collections.unmodifiableMap(registered);
    }

    public List<MonitoredDatabase> all() {
        return List.copyOf(databases.values());
    }

    public Optional<MonitoredDatabase> find(String id) {
        return Optional.ofNullable(databases.get(id));
    }

    /**
     * Get a registered database.
     *
     * @param id Registration id
     * @return Registered database
     * @throws IllegalArgumentException if the id is unknown
     */
    public MonitoredDatabase get(String id) {
        MonitoredDatabase database = databases.get(id);
        if (database == null) {
            throw new IllegalArgumentException("Unknown database: " + id + ", registered: " + databases.keySet());
        }
        return database;
    }

    /**
     * Resolve the reset domain of a database: every registration declaring the same domain,
     * including the database itself.
     *
     * @param database Active database
     * @return Reset domain containing the database
     */
    public ResetDomain resetDomainOf(MonitoredDatabase database) {
        String domainId = database.resetDomainId();
        List<MonitoredDatabase> members = new ArrayList<>();
        for (MonitoredDatabase candidate : databases.values()) {
            if (candidate.resetDomainId().equals(domainId) && !candidate.id().equals(database.id())) {
                members.add(candidate);
            }
        }
        members.add(database);
        return new ResetDomain(domainId, members);
    }

    /**
     * Group every registration into its reset domain.
     *
     * @return Domains ordered by id
     */
    public List<ResetDomain> domains() {
        Map<String, List<MonitoredDatabase>> grouped = new LinkedHashMap<>();
        for (MonitoredDatabase database : databases.values()) {
            grouped.computeIfAbsent(database.resetDomainId(), k -> new ArrayList<>()).add(database);
        }
        return grouped.entrySet().stream()
                .sorted(Map.Entry.comparingByKey())
                .map(e -> new ResetDomain(e.getKey(), e.getValue()))
                .toList();
    }

    public int size() {
        return databases.size();
    }

    @PreDestroy
    void close() {
        if (!ownedDataSources.isEmpty()) {
            log.debug("Closing {} database DataSources", ownedDataSources.size());
            ownedDataSources.forEach(AgroalDataSource::close);
            ownedDataSources.clear();
        }
    }
}
