package com.gt.quranquest.lesson.model;

import java.util.List;

public record Lesson(String id, String title, int xpReward, List<Exercise> exercises) {

    public Lesson {
        exercises = exercises == null ? List.of() : List.copyOf(exercises);
    }
}
