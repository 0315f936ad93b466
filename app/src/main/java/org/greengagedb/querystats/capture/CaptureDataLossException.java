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

import lombok.Getter;

/**
 * Counters were reset but the captured rows could not be persisted. The rows are gone
 * from the engine, so this is unrecoverable for the cycle.
 */
@Getter
public class CaptureDataLossException extends Exception {

    private final String domainId;
    private final int rowsLost;

    public CaptureDataLossException(String domainId, int rowsLost, Throwable cause) {
        super("Query stats were reset for domain '" + domainId + "' but " + rowsLost
                + " captured rows could not be persisted", cause);
        this.domainId = domainId;
        this.rowsLost = rowsLost;
    }
}
