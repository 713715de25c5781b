package me.golemcore.memory.port.outbound;

/*
 * Copyright 2026 Aleksei Kuleshov
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 *
 * Contact: alex@kuleshov.tech
 */

import java.util.Collection;
import java.util.List;
import java.util.Map;

/**
 * Port for an approximate nearest-neighbour index. Treated as a black box:
 * callers only rely on "smaller distance means more similar".
 *
 * <p>
 * Documents live in named collections; collection names are already
 * owner-scoped by the caller.
 */
public interface VectorIndexPort {

    /**
     * Insert or replace documents.
     */
    void upsert(String collection, List<VectorRecord> records);

    /**
     * Find the {@code k} nearest documents to {@code query}, nearest first.
     */
    List<VectorMatch> search(String collection, float[] query, int k);

    /**
     * Remove documents by id. Unknown ids are ignored.
     */
    void delete(String collection, Collection<String> ids);

    /**
     * Remove every document of a collection.
     */
    void clear(String collection);

    /**
     * Number of documents in a collection.
     */
    int count(String collection);

    record VectorRecord(String id, float[] vector, Map<String, String> metadata) {
    }

    record VectorMatch(String id, double distance, Map<String, String> metadata) {
    }
}
