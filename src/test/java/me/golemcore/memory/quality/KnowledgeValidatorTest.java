package me.golemcore.memory.quality;

import me.golemcore.memory.domain.model.KnowledgeEntry;
import me.golemcore.memory.testsupport.MutableClock;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;

import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class KnowledgeValidatorTest {

    private final MutableClock clock = new MutableClock(Instant.parse("2026-03-01T09:00:00Z"));
    private final KnowledgeValidator validator = new KnowledgeValidator(new KnowledgeScorer(), clock);

    @Test
    void shouldAcceptWellFormedEntry() {
        ValidationResult result = validator.validate(KnowledgeEntry.builder()
                .title("Green tea")
                .content("Green tea steeps best at eighty degrees.")
                .timestamp(clock.instant())
                .build());

        assertTrue(result.valid());
        assertTrue(result.issues().isEmpty());
        assertTrue(result.qualityScore() > 0.0);
    }

    @Test
    void shouldRejectMissingTitleAndContent() {
        ValidationResult result = validator.validate(KnowledgeEntry.builder().build());

        assertFalse(result.valid());
        assertTrue(result.issues().contains(KnowledgeValidator.MISSING_TITLE));
        assertTrue(result.issues().contains(KnowledgeValidator.MISSING_CONTENT));
    }

    @Test
    void shouldFlagShortContentWithoutInvalidating() {
        ValidationResult result = validator.validate(KnowledgeEntry.builder().title("Tea").content("Tea.").build());

        assertTrue(result.valid());
        assertTrue(result.issues().contains(KnowledgeValidator.CONTENT_TOO_SHORT));
        assertFalse(result.suggestions().isEmpty());
    }

    @Test
    void shouldFlagLongContent() {
        ValidationResult result = validator.validate(KnowledgeEntry.builder()
                .title("word")
                .content("word ".repeat(500))
                .build());

        assertTrue(result.issues().contains(KnowledgeValidator.CONTENT_TOO_LONG));
    }

    @Test
    void shouldFlagUnrelatedTitle() {
        assertFalse(validator.isConsistent("Quantum physics", "Bread needs flour and water to rise."));
        assertTrue(validator.isConsistent("Bread recipe", "Bread needs flour and water to rise."));
        assertTrue(validator.isConsistent("the", "anything at all"));
    }

    @Test
    void shouldFlagEntriesOlderThanAYear() {
        KnowledgeEntry entry = KnowledgeEntry.builder()
                .title("Green tea")
                .content("Green tea steeps best at eighty degrees.")
                .timestamp(clock.instant().minus(Duration.ofDays(400)))
                .build();

        ValidationResult result = validator.validate(entry);

        assertTrue(result.valid());
        assertTrue(result.issues().contains(KnowledgeValidator.OUTDATED));
    }
}
