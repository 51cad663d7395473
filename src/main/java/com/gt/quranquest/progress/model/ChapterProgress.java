package com.gt.quranquest.progress.model;

public record ChapterProgress(int chapterId,
                              int totalVerses,
                              int newCount,
                              int learningCount,
                              int reviewingCount,
                              int masteredCount,
                              double percentComplete) { }
