package com.gt.quranquest.lesson.model;

public record Exercise(String id, ExerciseType type, String targetText) { }
