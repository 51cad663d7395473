package com.gt.quranquest.progress;

import com.gt.quranquest.exception.UntrackedVerseException;
import com.gt.quranquest.model.ConfidenceLevel;
import com.gt.quranquest.model.TestResult;
import com.gt.quranquest.model.Verse;
import com.gt.quranquest.model.VerseLearningState;
import com.gt.quranquest.model.VerseStatus;
import com.gt.quranquest.progress.model.ChapterProgress;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Instant;
import java.util.EnumMap;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Owns the learning state of every verse. All changes are made here, one verse at a time, and written to the
 * {@link VerseLearningStateDao} before they become visible to readers. States are immutable records; each change
 * replaces the stored record.
 */
@Component
public class VerseProgressTracker {

    private static final Logger log = LoggerFactory.getLogger(VerseProgressTracker.class);

    private final VerseLearningStateDao verseLearningStateDao;
    private final Clock clock;

    private final Map<Integer, VerseLearningState> states = new HashMap<>();

    @Autowired
    public VerseProgressTracker(VerseLearningStateDao verseLearningStateDao, Clock clock) {
        this.verseLearningStateDao = verseLearningStateDao;
        this.clock = clock;
    }

    /**
     * Returns the verse's current state, creating and storing a fresh one on first contact.
     */
    public synchronized VerseLearningState track(Verse verse) {
        Optional<VerseLearningState> existing = lookup(verse.id());
        if (existing.isPresent()) {
            return existing.get();
        }

        log.debug("Tracking verse {} ({}:{})", verse.id(), verse.chapterId(), verse.numberInChapter());
        return save(createInitialState(verse));
    }

    public synchronized Optional<VerseLearningState> getState(int verseId) {
        return lookup(verseId);
    }

    /**
     * Counts a re-read of the verse. Reading an untracked verse is ignored and returns empty.
     */
    public synchronized Optional<VerseLearningState> markRead(int verseId) {
        Optional<VerseLearningState> existing = lookup(verseId);
        if (existing.isEmpty()) {
            log.warn("Read requested for verse " + verseId + ". However, verse has no learning state.");
            return Optional.empty();
        }

        VerseLearningState state = existing.get();
        return Optional.of(save(new VerseLearningState(
                state.verseId(),
                state.chapterId(),
                state.verseNumberInChapter(),
                state.status() == VerseStatus.New ? VerseStatus.Learning : state.status(),
                state.confidence(),
                state.readCount() + 1,
                state.testAttempts(),
                state.successfulRecalls(),
                clock.instant(),
                state.masteredAt())));
    }

    public synchronized VerseLearningState setConfidence(int verseId, ConfidenceLevel level) {
        Objects.requireNonNull(level, "confidence level");
        VerseLearningState state = require(verseId, "set confidence");

        return save(new VerseLearningState(
                state.verseId(),
                state.chapterId(),
                state.verseNumberInChapter(),
                VerseStatusTransitions.next(state.status(), level),
                level,
                state.readCount(),
                state.testAttempts(),
                state.successfulRecalls(),
                clock.instant(),
                state.masteredAt()));
    }

    public synchronized VerseLearningState startTest(int verseId) {
        VerseLearningState state = require(verseId, "start test");

        return save(new VerseLearningState(
                state.verseId(),
                state.chapterId(),
                state.verseNumberInChapter(),
                VerseStatus.Reviewing,
                state.confidence(),
                state.readCount(),
                state.testAttempts() + 1,
                state.successfulRecalls(),
                state.lastPracticedAt(),
                state.masteredAt()));
    }

    /**
     * Applies a recall test outcome. A pass masters the verse (the first mastery time is kept); a failure sends it
     * back to learning with confidence reset. A pass reported without a started test counts as its own attempt.
     */
    public synchronized VerseLearningState submitTestResult(TestResult result) {
        VerseLearningState state = require(result.verseId(), "submit test result");
        Instant now = clock.instant();

        VerseStatus newStatus = VerseStatusTransitions.next(state.status(), state.confidence(), result.passed());
        int successfulRecalls = result.passed() ? state.successfulRecalls() + 1 : state.successfulRecalls();
        int testAttempts = Math.max(state.testAttempts(), successfulRecalls);
        Instant masteredAt = result.passed() && state.masteredAt() == null ? now : state.masteredAt();

        VerseLearningState updated = save(new VerseLearningState(
                state.verseId(),
                state.chapterId(),
                state.verseNumberInChapter(),
                newStatus,
                result.passed() ? ConfidenceLevel.Confident : ConfidenceLevel.NotConfident,
                state.readCount(),
                testAttempts,
                successfulRecalls,
                result.attemptedAt() != null ? result.attemptedAt() : now,
                masteredAt));

        if (result.passed() && state.status() != VerseStatus.Mastered) {
            log.info("Verse {} ({}:{}) mastered after {} attempts", updated.verseId(), updated.chapterId(),
                    updated.verseNumberInChapter(), updated.testAttempts());
        }

        return updated;
    }

    /**
     * Summarizes a chapter by status. Verses that were never tracked count as new.
     */
    public ChapterProgress getChapterProgress(int chapterId, int totalVerses) {
        List<VerseLearningState> chapterStates = verseLearningStateDao.getForChapter(chapterId);

        Map<VerseStatus, Integer> counts = new EnumMap<>(VerseStatus.class);
        for (VerseStatus status : VerseStatus.values()) {
            counts.put(status, 0);
        }
        for (VerseLearningState state : chapterStates) {
            counts.merge(state.status(), 1, Integer::sum);
        }

        int untrackedCount = Math.max(0, totalVerses - chapterStates.size());
        int masteredCount = counts.get(VerseStatus.Mastered);

        return new ChapterProgress(
                chapterId,
                totalVerses,
                counts.get(VerseStatus.New) + untrackedCount,
                counts.get(VerseStatus.Learning),
                counts.get(VerseStatus.Reviewing),
                masteredCount,
                totalVerses > 0 ? masteredCount * 100.0 / totalVerses : 0);
    }

    private Optional<VerseLearningState> lookup(int verseId) {
        VerseLearningState cached = states.get(verseId);
        if (cached != null) {
            return Optional.of(cached);
        }

        Optional<VerseLearningState> stored = verseLearningStateDao.get(verseId);
        stored.ifPresent(state -> states.put(verseId, state));
        return stored;
    }

    private VerseLearningState require(int verseId, String operation) {
        return lookup(verseId).orElseThrow(() -> new UntrackedVerseException(verseId, operation));
    }

    // A failed write leaves the in-memory state untouched
    private VerseLearningState save(VerseLearningState state) {
        verseLearningStateDao.put(state);
        states.put(state.verseId(), state);
        return state;
    }

    private VerseLearningState createInitialState(Verse verse) {
        return new VerseLearningState(
                verse.id(),
                verse.chapterId(),
                verse.numberInChapter(),
                VerseStatus.New,
                ConfidenceLevel.NotConfident,
                0,
                0,
                0,
                null,
                null);
    }
}
