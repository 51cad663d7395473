package com.gt.quranquest.recitation.model;

import com.gt.quranquest.alignment.model.AlignmentFeedback;

import java.util.List;

public record RecitationAnalysis(double accuracy, double wordErrorRate, List<AlignmentFeedback> feedback) {

    public RecitationAnalysis {
        feedback = List.copyOf(feedback);
    }
}
