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

import org.greengagedb.querystats.model.DatabaseCapabilities;
import org.greengagedb.querystats.source.StatsSource;

import java.sql.Connection;
import java.sql.SQLException;

/**
 * A registered logical database, passed explicitly to every read and capture call.
 */
public interface MonitoredDatabase {

    /**
     * Registration id; also the {@code database} value of captured history rows.
     */
    String id();

    String displayName();

    /**
     * Id of the physical counter domain shared with other registrations (own id by default).
     */
    String resetDomainId();

    /**
     * Physical database name the live view is filtered on, null for the connection's own.
     */
    String databaseName();

    boolean captureEnabled();

    /**
     * Cached capabilities, introspected on first use.
     *
     * @throws SQLException if introspection failed
     */
    DatabaseCapabilities capabilities() throws SQLException;

    /**
     * Forget cached capabilities so the next call introspects again.
     */
    void invalidateCapabilities();

    /**
     * Live statistics source matching the current capabilities.
     *
     * @throws SQLException if capabilities could not be resolved
     */
    StatsSource statsSource() throws SQLException;

    /**
     * Raw connection, used for advisory locking and administrative statements.
     */
    Connection getConnection() throws SQLException;
}
