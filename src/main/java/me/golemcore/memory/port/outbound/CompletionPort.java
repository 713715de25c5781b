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

import java.util.concurrent.CompletableFuture;

/**
 * Port for single-prompt text completion. Optional collaborator: callers must
 * check {@link #isAvailable()} and fall back to rule-based paths when it is
 * not.
 */
public interface CompletionPort {

    /**
     * Complete a prompt.
     *
     * @param prompt
     *            full prompt text
     * @return model output text
     */
    CompletableFuture<String> complete(String prompt);

    /**
     * Check if a completion backend is configured.
     */
    boolean isAvailable();
}
