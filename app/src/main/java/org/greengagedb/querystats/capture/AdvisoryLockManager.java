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

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import lombok.extern.slf4j.Slf4j;
import org.greengagedb.querystats.config.CaptureConfig;
import org.greengagedb.querystats.registry.MonitoredDatabase;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.Optional;

/**
 * Cross-process mutual exclusion for capture cycles, using PostgreSQL advisory locks taken on
 * the server that owns the reset domain's counters.
 *
 * <p>The two-key form {@code (namespace, hash(domainId))} is used so the lock cannot collide
 * with single-key advisory locks of other applications.
 */
@Slf4j
@ApplicationScoped
public class AdvisoryLockManager {

    private static final String TRY_LOCK_SQL = "SELECT pg_try_advisory_lock(?, ?)";

    private final int namespace;

    @Inject
    public AdvisoryLockManager(CaptureConfig captureConfig) {
        this(captureConfig.lockNamespace());
    }

    AdvisoryLockManager(int namespace) {
        this.namespace = namespace;
    }

    /**
     * Try to take the lock for a reset domain without waiting.
     *
     * @param database Database whose server holds the lock
     * @param domainId Reset domain to lock
     * @return Held lock, or empty if another runner holds it
     * @throws SQLException if the lock call fails
     */
    public Optional<DomainLock> tryAcquire(MonitoredDatabase database, String domainId) throws SQLException {
        int key = lockKey(domainId);
        Connection conn = database.getConnection();
        try (PreparedStatement ps = conn.prepareStatement(TRY_LOCK_SQL)) {
            ps.setInt(1, namespace);
            ps.setInt(2, key);
            try (ResultSet rs = ps.executeQuery()) {
                if (rs.next() && rs.getBoolean(1)) {
                    log.debug("Acquired capture lock for domain '{}'", domainId);
                    return Optional.of(new DomainLock(conn, domainId, namespace, key));
                }
            }
        } catch (SQLException e) {
            conn.close();
            throw e;
        }
        conn.close();
        return Optional.empty();
    }

    static int lockKey(String domainId) {
        return domainId.hashCode();
    }
}
