package com.gt.quranquest.model;

import java.time.Instant;

public record VerseLearningState(int verseId,
                                 int chapterId,
                                 int verseNumberInChapter,
                                 VerseStatus status,
                                 ConfidenceLevel confidence,
                                 int readCount,
                                 int testAttempts,
                                 int successfulRecalls,
                                 Instant lastPracticedAt,
                                 Instant masteredAt) {

    public VerseLearningState {
        if (readCount < 0 || testAttempts < 0 || successfulRecalls < 0) {
            throw new IllegalArgumentException("Negative counter in learning state for verse " + verseId);
        }
        if (successfulRecalls > testAttempts) {
            throw new IllegalArgumentException("Verse " + verseId + " has more successful recalls (" + successfulRecalls
                    + ") than test attempts (" + testAttempts + ")");
        }
        if (status == VerseStatus.Mastered && masteredAt == null) {
            throw new IllegalArgumentException("Verse " + verseId + " is mastered without a mastery time");
        }
    }
}
