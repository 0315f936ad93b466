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

import java.time.Duration;
import java.time.Instant;

/**
 * Result of a capture cycle, including timing and status information.
 *
 * @param timestamp     When the cycle started; also the capture instant of every persisted row
 * @param domainId      Reset domain the cycle ran for
 * @param outcome       How the cycle ended
 * @param rowsPersisted Number of rows written to the historical log
 * @param error         Optional error if the cycle was aborted
 */
public record CaptureResult(Instant timestamp,
                            String domainId,
                            CaptureOutcome outcome,
                            int rowsPersisted,
                            Throwable error) {

    /**
     * Create a completed capture result.
     *
     * @param start         When the cycle started
     * @param domainId      Reset domain
     * @param rowsPersisted Rows written
     * @return Completed capture result
     */
    public static CaptureResult completed(Instant start, String domainId, int rowsPersisted) {
        return new CaptureResult(start, domainId, CaptureOutcome.COMPLETED, rowsPersisted, null);
    }

    /**
     * Create a result for a cycle that did nothing.
     *
     * @param start    When the cycle started
     * @param domainId Reset domain
     * @param outcome  Why nothing was done
     * @return Skipped capture result
     */
    public static CaptureResult skipped(Instant start, String domainId, CaptureOutcome outcome) {
        return new CaptureResult(start, domainId, outcome, 0, null);
    }

    /**
     * Create an aborted capture result with error details.
     *
     * @param start    When the cycle started
     * @param domainId Reset domain
     * @param error    The error that caused the abort
     * @return Aborted capture result
     */
    public static CaptureResult aborted(Instant start, String domainId, Throwable error) {
        return new CaptureResult(start, domainId, CaptureOutcome.ABORTED, 0, error);
    }

    public boolean successful() {
        return outcome == CaptureOutcome.COMPLETED || outcome == CaptureOutcome.NOTHING_TO_CAPTURE;
    }

    /**
     * Get the age of this capture result.
     *
     * @return Duration since the cycle started
     */
    public Duration getAge() {
        return Duration.between(timestamp, Instant.now());
    }
}
