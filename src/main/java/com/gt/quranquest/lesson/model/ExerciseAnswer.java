package com.gt.quranquest.lesson.model;

public record ExerciseAnswer(String exerciseId,
                             ExerciseType type,
                             boolean isCorrect,
                             long timeSpentMs) { }
