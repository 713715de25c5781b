package me.golemcore.memory.retrieval;

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

import java.util.List;
import java.util.function.BiFunction;
import java.util.function.LongSupplier;

/**
 * A store the concurrent retriever can fan a query out to.
 */
public interface MemorySource {

    String name();

    /**
     * Blocking lookup, called on a retrieval worker thread.
     */
    List<String> search(String query, int k);

    /**
     * Counter bumped on every mutation, used to key cached results.
     */
    long writeVersion();

    static MemorySource of(String name, BiFunction<String, Integer, List<String>> search, LongSupplier writeVersion) {
        return new MemorySource() {
            @Override
            public String name() {
                return name;
            }

            @Override
            public List<String> search(String query, int k) {
                return search.apply(query, k);
            }

            @Override
            public long writeVersion() {
                return writeVersion.getAsLong();
            }

            @Override
            public String toString() {
                return "MemorySource[" + name + "]";
            }
        };
    }
}
