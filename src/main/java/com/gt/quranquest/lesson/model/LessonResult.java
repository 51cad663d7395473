package com.gt.quranquest.lesson.model;

public record LessonResult(String lessonId,
                           int totalExercises,
                           int correctCount,
                           int incorrectCount,
                           double accuracy,
                           long timeSpentMs,
                           int xpEarned,
                           int stars,
                           int maxCombo,
                           boolean isPerfect) { }
