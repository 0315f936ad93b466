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

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class QueryNormalizerTest {

    @Test
    void testNormalize_Null_ReturnsEmpty() {
        assertEquals("", QueryNormalizer.normalize(null));
    }

    @Test
    void testNormalize_CollapsesWhitespace() {
        assertEquals("SELECT a FROM t WHERE x = ?",
                QueryNormalizer.normalize("  SELECT a\n\tFROM   t\r\nWHERE x = ?  "));
    }

    @Test
    void testNormalize_StripsBlockComments() {
        assertEquals("SELECT a FROM t",
                QueryNormalizer.normalize("/* app:api, route:/users */ SELECT a /* hint */FROM t"));
    }

    @Test
    void testNormalize_StripsMultiLineComment() {
        assertEquals("SELECT 1", QueryNormalizer.normalize("SELECT /* line one\nline two */ 1"));
    }

    @Test
    void testNormalize_CollapsesPlaceholderLists() {
        String three = QueryNormalizer.normalize("SELECT * FROM t WHERE id IN (?, ?, ?)");
        String five = QueryNormalizer.normalize("SELECT * FROM t WHERE id IN (?,?,  ?, ?,\n?)");

        assertEquals("SELECT * FROM t WHERE id IN (?)", three);
        assertEquals(three, five);
    }

    @Test
    void testNormalize_IsIdempotent() {
        String[] samples = {
                "SELECT * FROM t WHERE id IN (?, ?, ?)",
                "/* c */  UPDATE t SET a = ?  WHERE b = ?",
                "INSERT INTO t VALUES (?, ?), (?, ?)",
                "",
                "   "
        };
        for (String sample : samples) {
            String once = QueryNormalizer.normalize(sample);
            assertEquals(once, QueryNormalizer.normalize(once), "Not a fixed point: " + sample);
        }
    }

    @Test
    void testNormalize_SingleParameterUnchanged() {
        assertEquals("SELECT * FROM t WHERE x = ?", QueryNormalizer.normalize("SELECT * FROM t WHERE x = ?"));
    }

    @Test
    void testIsExplainable_PlainSelect_True() {
        assertTrue(QueryNormalizer.isExplainable("SELECT * FROM users WHERE active"));
        assertTrue(QueryNormalizer.isExplainable("select count(*) from orders"));
    }

    @Test
    void testIsExplainable_NoSelect_False() {
        assertFalse(QueryNormalizer.isExplainable("UPDATE t SET a = 1"));
        assertFalse(QueryNormalizer.isExplainable("VACUUM t"));
    }

    @Test
    void testIsExplainable_Placeholders_False() {
        assertFalse(QueryNormalizer.isExplainable("SELECT * FROM t WHERE x = ?"));
        assertFalse(QueryNormalizer.isExplainable("SELECT * FROM t WHERE id IN (?)"));
        assertFalse(QueryNormalizer.isExplainable("SELECT * FROM t WHERE x = $1"));
        assertFalse(QueryNormalizer.isExplainable("SELECT * FROM t LIMIT ?"));
        assertFalse(QueryNormalizer.isExplainable("SELECT * FROM t limit   ?"));
    }

    @Test
    void testIsExplainable_NullOrBlank_False() {
        assertFalse(QueryNormalizer.isExplainable(null));
        assertFalse(QueryNormalizer.isExplainable(""));
        assertFalse(QueryNormalizer.isExplainable("  "));
    }
}
