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
package org.greengagedb.querystats.common;

import lombok.experimental.UtilityClass;

/**
 * Global constants for query statistics capture and metrics
 */
@UtilityClass
public final class Constants {
    public static final String NAMESPACE = "querystats";
    public static final String SUBSYSTEM_CAPTURE = "capture";
    public static final String SUBSYSTEM_HISTORY = "history";
    public static final String EXTENSION_NAME = "pg_stat_statements";
    public static final String INSUFFICIENT_PRIVILEGE_SQL_STATE = "42501";
    public static final String NOT_IN_PREREQUISITE_STATE_SQL_STATE = "55000";
    public static final double MILLIS_PER_MINUTE = 60_000.0;
}
