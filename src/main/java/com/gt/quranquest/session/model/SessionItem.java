package com.gt.quranquest.session.model;

import com.gt.quranquest.model.Verse;
import com.gt.quranquest.model.VerseLearningState;

public record SessionItem(Verse verse, VerseLearningState learningState) { }
