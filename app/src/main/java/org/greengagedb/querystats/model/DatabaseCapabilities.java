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
 * Capabilities of one logical database, resolved from a single introspection and cached.
 *
 * @param version            Server version, null if it could not be read
 * @param extensionAvailable The statistics extension can be installed on this server
 * @param extensionInstalled The extension is installed in the database
 * @param readable           Whether the current credential can read the statistics view
 * @param hashSupport        Native query hashes are usable on both sources
 * @param userSupport        The role column is usable on both sources
 */
public record DatabaseCapabilities(PostgresVersion version,
                                   boolean extensionAvailable,
                                   boolean extensionInstalled,
                                   ProbeResult readable,
                                   CapabilitySupport hashSupport,
                                   CapabilitySupport userSupport) {

    /**
     * Installed and readable: the live statistics can be used now.
     */
    public boolean usable() {
        return extensionInstalled && readable.ok();
    }

    /**
     * Whether timing columns are named {@code total_exec_time}.
     */
    public boolean usesExecTimeColumns() {
        return version != null && version.usesExecTimeColumns();
    }
}
