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
package org.greengagedb.querystats.connection;

import io.agroal.api.AgroalDataSource;
import io.agroal.api.configuration.supplier.AgroalPropertiesReader;
import jakarta.enterprise.context.ApplicationScoped;
import lombok.extern.slf4j.Slf4j;
import org.greengagedb.querystats.config.DatabasesConfig;

import java.sql.SQLException;
import java.util.HashMap;
import java.util.Map;

/**
 * Factory for creating one DataSource per registered logical database.
 *
 * <p>Each DataSource is configured with:
 * <ul>
 *   <li>A small connection pool (one connection for reads, one held by the capture lock)</li>
 *   <li>Short max lifetime (2 minutes) to avoid stale connections</li>
 *   <li>The registration's own JDBC URL and credentials</li>
 * </ul>
 */
@Slf4j
@ApplicationScoped
public class DbDatasourceFactory {

    private static final int CONNECTION_MAX_LIFETIME_SECONDS = 120;

    /**
     * Create a new DataSource for the specified registration.
     *
     * @param databaseId Registration id, used for logging and validation
     * @param database   Registration settings
     * @return Configured AgroalDataSource for the database
     * @throws SQLException             If DataSource creation fails
     * @throws IllegalArgumentException If the registration is invalid
     */
    public AgroalDataSource create(String databaseId, DatabasesConfig.Database database) throws SQLException {
        validateDatabaseId(databaseId);
        validateUrl(databaseId, database.url());

        int poolSize = Math.max(1, database.poolSize());
        Map<String, String> props = new HashMap<>();
        props.put(AgroalPropertiesReader.JDBC_URL, database.url());
        props.put(AgroalPropertiesReader.PRINCIPAL, database.username());
        database.password().ifPresent(password -> props.put(AgroalPropertiesReader.CREDENTIAL, password));
        props.put(AgroalPropertiesReader.MAX_SIZE, String.valueOf(poolSize));
        props.put(AgroalPropertiesReader.MIN_SIZE, "0");
        props.put(AgroalPropertiesReader.INITIAL_SIZE, "1");
        props.put(AgroalPropertiesReader.MAX_LIFETIME_S, String.valueOf(CONNECTION_MAX_LIFETIME_SECONDS));

        try {
            AgroalDataSource dataSource = AgroalDataSource.from(
                    new AgroalPropertiesReader().readProperties(props).get()
            );
            log.debug("Created DataSource for database '{}' with pool size {}", databaseId, poolSize);
            return dataSource;
        } catch (SQLException e) {
            log.error("Failed to create DataSource for database '{}': {}", databaseId, e.getMessage());
            throw e;
        }
    }

    /**
     * Validate the registration id, which ends up in log lines, metric tags and the history table.
     *
     * @param databaseId Registration id to validate
     * @throws IllegalArgumentException If the id is invalid
     */
    void validateDatabaseId(String databaseId) {
        if (databaseId == null || databaseId.trim().isEmpty()) {
            throw new IllegalArgumentException("Database id cannot be null or empty");
        }

        if (databaseId.contains(";") || databaseId.contains("'") ||
                databaseId.contains("\"") || databaseId.contains("--")) {
            throw new IllegalArgumentException("Database id contains invalid characters: " + databaseId);
        }
    }

    private void validateUrl(String databaseId, String url) {
        if (url == null || !url.startsWith("jdbc:postgresql:")) {
            throw new IllegalArgumentException("Database '" + databaseId + "' needs a jdbc:postgresql: URL, got: " + url);
        }
    }
}
