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

import me.golemcore.memory.domain.model.ChatMessage;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Set;

/**
 * Sliding window over the last {@code k} user/assistant exchanges.
 *
 * <p>
 * Every write or clear bumps {@link #version()}, so caches keyed on it never
 * serve stale context. {@code k <= 0} keeps every message.
 */
public class ShortTermMemory {

    private static final Set<String> VALID_ROLES = Set.of(ChatMessage.USER, ChatMessage.ASSISTANT, "system");

    private final Deque<ChatMessage> messages = new ArrayDeque<>();
    private int windowPairs;
    private long version;

    public ShortTermMemory(int windowPairs) {
        this.windowPairs = Math.max(0, windowPairs);
    }

    public synchronized void addMessage(String role, String content) {
        addMessages(List.of(new ChatMessage(role, content != null ? content : "")));
    }

    /**
     * Append one exchange atomically.
     */
    public void addInteraction(String userMessage, String assistantMessage) {
        addMessages(List.of(ChatMessage.user(nullToEmpty(userMessage)),
                ChatMessage.assistant(nullToEmpty(assistantMessage))));
    }

    public synchronized void addMessages(List<ChatMessage> batch) {
        boolean changed = false;
        for (ChatMessage message : batch) {
            if (message == null || !VALID_ROLES.contains(message.role())) {
                continue;
            }
            messages.addLast(message);
            changed = true;
        }
        if (changed) {
            trim();
            version++;
        }
    }

    public synchronized void setWindowPairs(int pairs) {
        int normalized = Math.max(0, pairs);
        if (normalized == windowPairs) {
            return;
        }
        windowPairs = normalized;
        trim();
        version++;
    }

    public synchronized List<ChatMessage> getMessages() {
        return new ArrayList<>(messages);
    }

    public synchronized int size() {
        return messages.size();
    }

    public synchronized long version() {
        return version;
    }

    public synchronized void clear() {
        messages.clear();
        version++;
    }

    private void trim() {
        int limit = windowPairs * 2;
        if (limit <= 0) {
            return;
        }
        while (messages.size() > limit) {
            messages.removeFirst();
        }
    }

    private static String nullToEmpty(String value) {
        return value != null ? value : "";
    }
}
