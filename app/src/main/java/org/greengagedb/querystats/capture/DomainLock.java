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
package org.greengagedb.querystats.capture;

import lombok.extern.slf4j.Slf4j;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.SQLException;

/**
 * A held session-level advisory lock. Closing it releases the lock and returns the connection.
 * When the unlock fails the physical connection is aborted, so the pool never hands out a
 * session that still holds the lock.
 */
@Slf4j
public class DomainLock implements AutoCloseable {

    private static final String UNLOCK_SQL = "SELECT pg_advisory_unlock(?, ?)";

    private final Connection connection;
    private final String domainId;
    private final int namespace;
    private final int key;

    DomainLock(Connection connection, String domainId, int namespace, int key) {
        this.connection = connection;
        this.domainId = domainId;
        this.namespace = namespace;
        this.key = key;
    }

    public String domainId() {
        return domainId;
    }

    @Override
    public void close() {
        try {
            unlock();
            log.debug("Released capture lock for domain '{}'", domainId);
        } catch (SQLException e) {
            log.warn("Error releasing capture lock for domain '{}', discarding its connection: {}",
                    domainId, e.getMessage());
            abortConnection();
        } finally {
            closeConnection();
        }
    }

    private void unlock() throws SQLException {
        try (PreparedStatement ps = connection.prepareStatement(UNLOCK_SQL)) {
            ps.setInt(1, namespace);
            ps.setInt(2, key);
            ps.execute();
        }
    }

    private void abortConnection() {
        try {
            connection.abort(Runnable::run);
        } catch (SQLException e) {
            log.warn("Error aborting connection of domain '{}': {}", domainId, e.getMessage());
        }
    }

    private void closeConnection() {
        try {
            connection.close();
        } catch (SQLException e) {
            log.warn("Error returning connection of domain '{}': {}", domainId, e.getMessage());
        }
    }
}
