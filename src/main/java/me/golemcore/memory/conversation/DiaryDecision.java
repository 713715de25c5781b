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

/**
 * Outcome of the diary filter for one candidate entry.
 */
public enum DiaryDecision {

    SAVED(true),
    TOO_SHORT(false),
    DUPLICATE(false),
    DAILY_CAP_REACHED(false),
    TOO_SOON(false),
    NOT_NOTABLE(false);

    private final boolean saved;

    DiaryDecision(boolean saved) {
        this.saved = saved;
    }

    public boolean isSaved() {
        return saved;
    }
}
