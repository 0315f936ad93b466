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
 * How a capture cycle ended.
 */
public enum CaptureOutcome {
    /** Snapshots taken, counters reset, rows persisted. */
    COMPLETED,
    /** Every member's snapshot was empty; no reset issued. */
    NOTHING_TO_CAPTURE,
    /** Another runner holds the reset domain lock. */
    LOCKED,
    /** The historical log is missing or incompatible. */
    HISTORY_DISABLED,
    /** A snapshot or the reset failed; counters left untouched. */
    ABORTED,
    /** Counters reset but the rows could not be persisted. */
    DATA_LOSS;

    public boolean resetIssued() {
        return this == COMPLETED || this == DATA_LOSS;
    }
}
