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

import java.time.Duration;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;

/**
 * Port for the optional second-tier (network) cache. A soft dependency: every
 * failure must surface as a miss or a no-op, never as an exception.
 */
public interface RemoteCachePort {

    CompletableFuture<Optional<String>> get(String key);

    CompletableFuture<Void> set(String key, String value, Duration ttl);

    CompletableFuture<Void> delete(String key);

    /**
     * Delete every key starting with {@code prefix}.
     */
    CompletableFuture<Void> deleteByPrefix(String prefix);

    boolean isAvailable();
}
