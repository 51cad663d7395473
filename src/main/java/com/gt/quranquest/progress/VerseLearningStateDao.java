package com.gt.quranquest.progress;

import com.gt.quranquest.model.VerseLearningState;

import java.util.List;
import java.util.Optional;

/**
 * Keyed store for verse learning state. Implementations report failures as
 * {@link com.gt.quranquest.exception.DaoException} and never retry.
 */
public interface VerseLearningStateDao {

    Optional<VerseLearningState> get(int verseId);

    void put(VerseLearningState state);

    List<VerseLearningState> getForChapter(int chapterId);
}
