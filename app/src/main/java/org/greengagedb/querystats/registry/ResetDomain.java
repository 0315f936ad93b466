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

import java.util.Comparator;
import java.util.List;
import java.util.Optional;

/**
 * Registrations that read and reset the same physical counter state.
 *
 * @param id      Domain id (the id of the registration owning the counters)
 * @param members Members sorted by id, never empty
 */
public record ResetDomain(String id, List<MonitoredDatabase> members) {

    public ResetDomain {
        if (members == null || members.isEmpty()) {
            throw new IllegalArgumentException("Reset domain " + id + " has no members");
        }
        members = members.stream()
                .sorted(Comparator.comparing(MonitoredDatabase::id))
                .toList();
    }

    /**
     * Member the scheduler runs the cycle through: the registration named like the domain if it
     * has capture enabled, otherwise the first member that does.
     *
     * @return Leader, empty if no member has capture enabled
     */
    public Optional<MonitoredDatabase> captureLeader() {
        Optional<MonitoredDatabase> owner = members.stream()
                .filter(m -> m.id().equals(id))
                .filter(MonitoredDatabase::captureEnabled)
                .findFirst();
        if (owner.isPresent()) {
            return owner;
        }
        return members.stream().filter(MonitoredDatabase::captureEnabled).findFirst();
    }

    public List<String> memberIds() {
        return members.stream().map(MonitoredDatabase::id).toList();
    }
}
