package com.gt.quranquest.alignment.model;

import java.util.List;

public record AlignmentScore(double errorRate, List<AlignmentFeedback> feedback) {

    public AlignmentScore {
        feedback = List.copyOf(feedback);
    }
}
