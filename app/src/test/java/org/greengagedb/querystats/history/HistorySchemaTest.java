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
package org.greengagedb.querystats.history;

import org.junit.jupiter.api.Test;

import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class HistorySchemaTest {

    @Test
    void testMissing() {
        HistorySchema schema = HistorySchema.missing();

        assertFalse(schema.exists());
        assertFalse(schema.compatible());
        assertFalse(schema.hasQueryHash());
        assertFalse(schema.hasUser());
    }

    @Test
    void testCompatible_ColumnNamesCaseInsensitive() {
        HistorySchema schema = new HistorySchema(Set.of("DATABASE", "Query", "total_time", "calls", "CAPTURED_AT"));

        assertTrue(schema.compatible());
        assertFalse(schema.hasQueryHash());
        assertFalse(schema.hasUser());
    }

    @Test
    void testOptionalColumns() {
        HistorySchema schema = new HistorySchema(
                Set.of("database", "query", "total_time", "calls", "captured_at", "query_hash", "user"));

        assertTrue(schema.hasQueryHash());
        assertTrue(schema.hasUser());
    }

    @Test
    void testOptionalColumnsIgnoredWhenIncompatible() {
        HistorySchema schema = new HistorySchema(Set.of("database", "query", "query_hash", "user"));

        assertTrue(schema.exists());
        assertFalse(schema.compatible());
        assertFalse(schema.hasQueryHash());
        assertFalse(schema.hasUser());
    }
}
