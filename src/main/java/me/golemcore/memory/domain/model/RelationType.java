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
import java.util.Optional;

/**
 * Knowledge-graph relation types. Symmetric types are always stored as a pair
 * of directed edges.
 */
public enum RelationType {

    RELATED_TO("related_to", true),
    PART_OF("part_of", false),
    CAUSES("causes", false),
    PRECEDES("precedes", false),
    SIMILAR_TO("similar_to", true),
    OPPOSITE_TO("opposite_to", true),
    EXAMPLE_OF("example_of", false),
    DEFINED_BY("defined_by", false),
    LOCATED_IN("located_in", false),
    OWNED_BY("owned_by", false);

    private final String value;
    private final boolean symmetric;

    RelationType(String value, boolean symmetric) {
        this.value = value;
        this.symmetric = symmetric;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    public boolean isSymmetric() {
        return symmetric;
    }

    public static Optional<RelationType> parse(String raw) {
        if (raw == null) {
            return Optional.empty();
        }
        String normalized = raw.trim().toLowerCase(Locale.ROOT);
        for (RelationType type : values()) {
            if (type.value.equals(normalized)) {
                return Optional.of(type);
            }
        }
        return Optional.empty();
    }

    @JsonCreator
    public static RelationType fromValue(String raw) {
        return parse(raw).orElseThrow(() -> new IllegalArgumentException("Unknown relation type: " + raw));
    }
}
