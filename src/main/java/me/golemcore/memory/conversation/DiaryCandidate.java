package me.golemcore.memory.conversation;

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

/**
 * Interaction offered to the diary.
 *
 * @param importance
 *            in [0, 1]
 * @param emotion
 *            dominant emotion label ({@code happy}, {@code sad},
 *            {@code neutral}, ...), may be null
 */
public record DiaryCandidate(String content, double importance, String emotion, List<String> people,
        String location, String event) {

    public DiaryCandidate {
        people = people != null ? List.copyOf(people) : List.of();
    }

    public static DiaryCandidate of(String content, double importance, String emotion) {
        return new DiaryCandidate(content, importance, emotion, List.of(), null, null);
    }

    public boolean mentionsPeoplePlaceOrEvent() {
        return !people.isEmpty() || (location != null && !location.isBlank()) || (event != null && !event.isBlank());
    }
}
