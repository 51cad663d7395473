package com.gt.quranquest.progress.impl;

import com.gt.quranquest.model.VerseLearningState;
import com.gt.quranquest.progress.VerseLearningStateDao;

import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

// Process-lifetime store for local runs. Nothing survives a restart.
public class InMemoryVerseLearningStateDao implements VerseLearningStateDao {

    private final Map<Integer, VerseLearningState> states = new ConcurrentHashMap<>();

    @Override
    public Optional<VerseLearningState> get(int verseId) {
        return Optional.ofNullable(states.get(verseId));
    }

    @Override
    public void put(VerseLearningState state) {
        states.put(state.verseId(), state);
    }

    @Override
    public List<VerseLearningState> getForChapter(int chapterId) {
        return states.values().stream()
                .filter(state -> state.chapterId() == chapterId)
                .sorted(Comparator.comparingInt(VerseLearningState::verseNumberInChapter))
                .toList();
    }
}
