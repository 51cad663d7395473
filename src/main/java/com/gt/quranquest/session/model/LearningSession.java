package com.gt.quranquest.session.model;

import java.time.Instant;
import java.util.List;

public record LearningSession(String sessionId,
                              int chapterId,
                              String chapterLabel,
                              VerseRange verseRange,
                              List<SessionItem> items,
                              Instant startedAt,
                              Instant completedAt,
                              int cursor,
                              int sessionReadCount,
                              int sessionMasteredCount) {

    public LearningSession {
        items = List.copyOf(items);
    }
}
