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
package org.greengagedb.querystats.config;

import io.smallrye.config.ConfigMapping;
import io.smallrye.config.WithDefault;

import java.util.Map;
import java.util.Optional;

/**
 * Registry of logical databases whose statement statistics are monitored.
 *
 * <pre>
 * app.registry.databases.main.url=jdbc:postgresql://db:5432/main
 * app.registry.databases.main.username=monitor
 * app.registry.databases.reports.url=jdbc:postgresql://db:5432/reports
 * app.registry.databases.reports.reset-domain=main
 * </pre>
 */
@ConfigMapping(prefix = "app.registry")
public interface DatabasesConfig {

    Map<String, Database> databases();

    interface Database {

        String url();

        String username();

        Optional<String> password();

        /**
         * Human readable name, defaults to the registration id.
         */
        Optional<String> displayName();

        /**
         * Physical database the live view is filtered on, defaults to the connection's own.
         */
        Optional<String> databaseName();

        /**
         * Registration id of the physical counter domain this database shares,
         * defaults to its own id.
         */
        Optional<String> resetDomain();

        @WithDefault("true")
        boolean captureEnabled();

        @WithDefault("2")
        int poolSize();
    }
}
