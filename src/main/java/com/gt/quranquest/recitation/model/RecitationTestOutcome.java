package com.gt.quranquest.recitation.model;

import com.gt.quranquest.model.VerseLearningState;

public record RecitationTestOutcome(RecitationAnalysis analysis,
                                    boolean passed,
                                    int xpEarned,
                                    VerseLearningState state) { }
