package me.golemcore.memory.domain.model;

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

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Origin of a graph edge. Priority: manual &gt; llm &gt; rule = unknown &gt;
 * inference.
 */
public enum RelationSource {

    MANUAL("manual", 3),
    LLM("llm", 2),
    RULE("rule", 1),
    UNKNOWN("unknown", 1),
    INFERENCE("inference", 0);

    private final String value;
    private final int priority;

    RelationSource(String value, int priority) {
        this.value = value;
        this.priority = priority;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    public int getPriority() {
        return priority;
    }

    /**
     * Whether an edge from this source may replace one from {@code existing}.
     */
    public boolean canOverride(RelationSource existing) {
        return existing == null || priority >= existing.priority;
    }

    @JsonCreator
    public static RelationSource fromValue(String raw) {
        if (raw == null) {
            return UNKNOWN;
        }
        String normalized = raw.trim().toLowerCase(Locale.ROOT);
        for (RelationSource source : values()) {
            if (source.value.equals(normalized)) {
                return source;
            }
        }
        return UNKNOWN;
    }
}
