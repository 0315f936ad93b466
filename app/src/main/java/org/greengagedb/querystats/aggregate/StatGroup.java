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
package org.greengagedb.querystats.aggregate;

import org.greengagedb.querystats.common.QueryNormalizer;
import org.greengagedb.querystats.model.RawStatRecord;

import java.util.Optional;
import java.util.SortedSet;
import java.util.TreeSet;

/**
 * Mutable accumulator for one merge group. Not thread-safe; lives for one read.
 */
final class StatGroup {

    private String query;
    private Long queryHash;
    private String user;
    private double totalTimeMs;
    private long calls;
    private final SortedSet<String> explainableCandidates = new TreeSet<>();

    void add(RawStatRecord row) {
        if (query == null && !row.query().isEmpty()) {
            query = row.query();
            queryHash = row.nativeHash();
        }
        if (user == null) {
            user = row.user();
        }
        totalTimeMs += row.totalTimeMs();
        calls += row.calls();
        String candidate = row.explainableQuery() != null ? row.explainableQuery() : row.query();
        if (!candidate.isEmpty()) {
            explainableCandidates.add(candidate);
        }
    }

    void merge(StatGroup other) {
        if (query == null && other.query != null) {
            query = other.query;
            queryHash = other.queryHash;
        }
        if (user == null) {
            user = other.user;
        }
        totalTimeMs += other.totalTimeMs;
        calls += other.calls;
        explainableCandidates.addAll(other.explainableCandidates);
    }

    String query() {
        return query != null ? query : "";
    }

    Long queryHash() {
        return queryHash;
    }

    String user() {
        return user;
    }

    double totalTimeMs() {
        return totalTimeMs;
    }

    long calls() {
        return calls;
    }

    /**
     * First candidate in text order that can be explained verbatim.
     */
    Optional<String> explainableQuery() {
        return explainableCandidates.stream()
                .filter(QueryNormalizer::isExplainable)
                .findFirst();
    }
}
