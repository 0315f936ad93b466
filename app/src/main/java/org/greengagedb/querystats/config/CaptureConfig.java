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

import java.time.Duration;

/**
 * Configuration for the periodic capture-and-reset job and retention sweep.
 */
@ConfigMapping(prefix = "app.capture")
public interface CaptureConfig {

    /**
     * Whether the scheduled capture runs at all.
     *
     * @return true to capture (default: true)
     */
    @WithDefault("true")
    boolean enabled();

    /**
     * Interval between capture cycles. Reads may observe counters reset mid-read
     * for at most one interval.
     *
     * @return Capture interval (default: 5 minutes)
     */
    @WithDefault("5m")
    Duration interval();

    /**
     * Age after which captured rows are pruned.
     *
     * @return Retention (default: 336 hours)
     */
    @WithDefault("336h")
    Duration retention();

    @WithDefault("1h")
    Duration retentionInterval();

    /**
     * First key of the two-key advisory lock guarding a reset domain.
     *
     * @return Lock namespace (default: 271828)
     */
    @WithDefault("271828")
    int lockNamespace();
}
