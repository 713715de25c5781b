package me.golemcore.memory.quality;

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

import lombok.extern.slf4j.Slf4j;
import me.golemcore.memory.domain.model.KnowledgeEntry;
import me.golemcore.memory.task.BackgroundTaskQueue;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.function.Consumer;
import java.util.function.Supplier;

/**
 * Runs validation, scoring and conflict detection together. Results are
 * advisory: callers attach them to the entry and never reject a write because
 * of them.
 */
@Slf4j
public class KnowledgeQualityManager {

    private final KnowledgeScorer scorer;
    private final KnowledgeValidator validator;
    private final ConflictDetector conflictDetector;
    private final BackgroundTaskQueue taskQueue;
    private final double lowScoreWarning;

    public KnowledgeQualityManager(KnowledgeScorer scorer, KnowledgeValidator validator,
            ConflictDetector conflictDetector, BackgroundTaskQueue taskQueue, double lowScoreWarning) {
        this.scorer = scorer;
        this.validator = validator;
        this.conflictDetector = conflictDetector;
        this.taskQueue = taskQueue;
        this.lowScoreWarning = lowScoreWarning;
    }

    public QualityAssessment assess(KnowledgeEntry entry, Collection<KnowledgeEntry> existing) {
        ValidationResult validation = validator.validate(entry);
        double score = scorer.score(entry);
        List<Conflict> conflicts = existing != null ? conflictDetector.detect(entry, existing) : List.of();

        List<String> issues = new ArrayList<>(validation.issues());
        conflicts.forEach(conflict -> issues.add("conflicts with " + conflict.existingId()));
        QualityAssessment assessment = new QualityAssessment(entry.getId(), validation.valid(), score,
                List.copyOf(issues), validation.suggestions(), conflicts);

        if (!assessment.valid() || score < lowScoreWarning || assessment.hasConflicts()) {
            log.warn("[Quality] Entry {} score={} issues={}", entry.getId(), String.format("%.2f", score),
                    assessment.issues());
        }
        return assessment;
    }

    /**
     * Assess on the background queue. The assessment is dropped when the queue
     * is full.
     *
     * @param existing
     *            evaluated on the worker thread
     */
    public BackgroundTaskQueue.Outcome assessAsync(KnowledgeEntry entry, Supplier<List<KnowledgeEntry>> existing,
            Consumer<QualityAssessment> onResult) {
        KnowledgeEntry snapshot = entry.copy();
        return taskQueue.submit("quality:" + entry.getId(),
                () -> onResult.accept(assess(snapshot, existing.get())),
                BackgroundTaskQueue.Overflow.DROP);
    }

    public double score(KnowledgeEntry entry) {
        return scorer.score(entry);
    }
}
