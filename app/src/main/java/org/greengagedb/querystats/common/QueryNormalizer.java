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

import java.util.regex.Pattern;

/**
 * Canonicalizes statement text so that the same parameterized statement groups together
 * regardless of comments, whitespace or the arity of placeholder lists.
 *
 * <p>Both methods are pure and total: they never throw and accept {@code null}.
 */
@UtilityClass
public final class QueryNormalizer {

    private static final Pattern BLOCK_COMMENT = Pattern.compile("/\\*.*?\\*/", Pattern.DOTALL);
    private static final Pattern PLACEHOLDER_LIST = Pattern.compile("\\?(\\s*,\\s*\\?)+");
    private static final Pattern WHITESPACE = Pattern.compile("\\s+");

    private static final Pattern SELECT_CLAUSE = Pattern.compile("select", Pattern.CASE_INSENSITIVE);
    private static final Pattern NUMBERED_PLACEHOLDER = Pattern.compile("\\$\\d+");
    private static final Pattern LIMIT_PLACEHOLDER = Pattern.compile("limit\\s+\\?", Pattern.CASE_INSENSITIVE);

    /**
     * Build the grouping form of a statement.
     *
     * <p>Block comments are removed, runs of positional placeholders ({@code ?, ?, ?}) collapse
     * to a single {@code ?} and whitespace collapses to single spaces. Applying it to its own
     * output returns the same string.
     *
     * @param query Raw statement text (may be null)
     * @return Normalized text, empty string for null input
     */
    public static String normalize(String query) {
        if (query == null) {
            return "";
        }
        String text = BLOCK_COMMENT.matcher(query).replaceAll(" ");
        text = WHITESPACE.matcher(text).replaceAll(" ");
        text = PLACEHOLDER_LIST.matcher(text).replaceAll("?");
        return text.trim();
    }

    /**
     * Whether a statement looks standalone enough to be handed to EXPLAIN verbatim.
     *
     * <p>Rejects anything without a selection clause and any parameterized template:
     * {@code ?)}, {@code = ?}, numbered placeholders and {@code LIMIT ?}.
     *
     * @param query Statement text (may be null)
     * @return true if the text can be explained as is
     */
    public static boolean isExplainable(String query) {
        if (query == null || query.isBlank()) {
            return false;
        }
        return SELECT_CLAUSE.matcher(query).find()
                && !query.contains("?)")
                && !query.contains("= ?")
                && !NUMBERED_PLACEHOLDER.matcher(query).find()
                && !LIMIT_PLACEHOLDER.matcher(query).find();
    }
}
