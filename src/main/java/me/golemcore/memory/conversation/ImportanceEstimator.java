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
import java.util.Locale;

/**
 * Rule-based importance estimate of a user/assistant exchange. Cheap enough
 * for the hot path; no model call.
 */
public final class ImportanceEstimator {

    private static final double BASE = 0.5;

    private static final List<String> IMPORTANCE_KEYWORDS = List.of(
            "喜欢", "讨厌", "爱好", "习惯", "生日", "家人", "朋友", "工作", "学习", "计划", "目标", "梦想",
            "重要", "记住", "名字", "约定", "承诺", "答应", "保证", "必须",
            "remember", "birthday", "family", "friend", "my name", "promise", "important", "goal", "dream",
            "plan", "hobby", "favorite", "always", "never");

    private static final List<String> EMOTIONAL_KEYWORDS = List.of(
            "开心", "高兴", "快乐", "幸福", "难过", "伤心", "痛苦", "失望", "生气", "愤怒", "想念", "思念",
            "happy", "glad", "sad", "upset", "angry", "love", "hate", "miss", "worried", "afraid", "excited");

    private static final List<String> QUESTION_MARKERS = List.of("?", "？", "吗", "呢");

    private ImportanceEstimator() {
    }

    public static double estimate(String userMessage, String assistantMessage) {
        String user = userMessage != null ? userMessage : "";
        String assistant = assistantMessage != null ? assistantMessage : "";
        double importance = BASE;

        int totalLength = user.length() + assistant.length();
        if (totalLength > 200) {
            importance += 0.1;
        }
        if (totalLength > 500) {
            importance += 0.1;
        }

        String lower = user.toLowerCase(Locale.ROOT);
        for (String keyword : IMPORTANCE_KEYWORDS) {
            if (lower.contains(keyword)) {
                importance += 0.05;
            }
        }
        if (QUESTION_MARKERS.stream().anyMatch(user::contains)) {
            importance += 0.05;
        }
        if (EMOTIONAL_KEYWORDS.stream().anyMatch(lower::contains)) {
            importance += 0.1;
        }
        return Math.max(0.0, Math.min(1.0, importance));
    }
}
