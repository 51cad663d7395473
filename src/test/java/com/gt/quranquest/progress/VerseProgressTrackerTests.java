package com.gt.quranquest.progress;

import com.gt.quranquest.exception.DaoException;
import com.gt.quranquest.exception.UntrackedVerseException;
import com.gt.quranquest.model.ConfidenceLevel;
import com.gt.quranquest.model.TestResult;
import com.gt.quranquest.model.Verse;
import com.gt.quranquest.model.VerseLearningState;
import com.gt.quranquest.model.VerseStatus;
import com.gt.quranquest.progress.impl.InMemoryVerseLearningStateDao;
import com.gt.quranquest.progress.model.ChapterProgress;
import com.gt.quranquest.util.MutableClock;
import com.gt.quranquest.util.TestUtils;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

public class VerseProgressTrackerTests {

    private static final Instant START = Instant.parse("2026-03-01T08:00:00Z");
    private static final Verse VERSE = TestUtils.getVerse(1, 1, 1);

    private InMemoryVerseLearningStateDao verseLearningStateDao;
    private MutableClock clock;
    private VerseProgressTracker verseProgressTracker;

    @BeforeEach
    public void before() {
        verseLearningStateDao = new InMemoryVerseLearningStateDao();
        clock = new MutableClock(START);
        verseProgressTracker = new VerseProgressTracker(verseLearningStateDao, clock);
    }

    @Test
    public void testTrack() {
        VerseLearningState state = verseProgressTracker.track(VERSE);

        assertEquals(VerseStatus.New, state.status());
        assertEquals(ConfidenceLevel.NotConfident, state.confidence());
        assertEquals(0, state.readCount());
        assertEquals(0, state.testAttempts());
        assertEquals(0, state.successfulRecalls());
        assertNull(state.lastPracticedAt());
        assertNull(state.masteredAt());
        assertEquals(Optional.of(state), verseLearningStateDao.get(VERSE.id()));
    }

    @Test
    public void testTrack_keepsExistingState() {
        verseProgressTracker.track(VERSE);
        verseProgressTracker.markRead(VERSE.id());

        VerseLearningState state = verseProgressTracker.track(VERSE);

        assertEquals(VerseStatus.Learning, state.status());
        assertEquals(1, state.readCount());
    }

    @Test
    public void testGetState_loadsFromDao() {
        VerseLearningState stored = new VerseLearningState(5, 2, 3, VerseStatus.Reviewing, ConfidenceLevel.Confident, 4, 1, 0, START, null);
        verseLearningStateDao.put(stored);

        assertEquals(Optional.of(stored), verseProgressTracker.getState(5));
        assertEquals(Optional.empty(), verseProgressTracker.getState(6));
    }

    @Test
    public void testMarkRead() {
        verseProgressTracker.track(VERSE);

        clock.advance(Duration.ofMinutes(1));
        VerseLearningState once = verseProgressTracker.markRead(VERSE.id()).orElseThrow();
        assertEquals(VerseStatus.Learning, once.status());
        assertEquals(1, once.readCount());
        assertEquals(START.plus(Duration.ofMinutes(1)), once.lastPracticedAt());

        clock.advance(Duration.ofMinutes(1));
        VerseLearningState twice = verseProgressTracker.markRead(VERSE.id()).orElseThrow();
        assertEquals(VerseStatus.Learning, twice.status());
        assertEquals(2, twice.readCount());
        assertEquals(START.plus(Duration.ofMinutes(2)), twice.lastPracticedAt());
    }

    @Test
    public void testMarkRead_keepsLaterStatus() {
        verseProgressTracker.track(VERSE);
        verseProgressTracker.setConfidence(VERSE.id(), ConfidenceLevel.Confident);

        VerseLearningState state = verseProgressTracker.markRead(VERSE.id()).orElseThrow();

        assertEquals(VerseStatus.Reviewing, state.status());
    }

    @Test
    public void testMarkRead_untrackedVerse() {
        assertEquals(Optional.empty(), verseProgressTracker.markRead(42));
        assertEquals(Optional.empty(), verseLearningStateDao.get(42));
    }

    @Test
    public void testSetConfidence() {
        verseProgressTracker.track(VERSE);

        VerseLearningState unsure = verseProgressTracker.setConfidence(VERSE.id(), ConfidenceLevel.SomewhatConfident);
        assertEquals(VerseStatus.Learning, unsure.status());
        assertEquals(ConfidenceLevel.SomewhatConfident, unsure.confidence());
        assertEquals(START, unsure.lastPracticedAt());

        VerseLearningState confident = verseProgressTracker.setConfidence(VERSE.id(), ConfidenceLevel.Confident);
        assertEquals(VerseStatus.Reviewing, confident.status());
        assertEquals(ConfidenceLevel.Confident, confident.confidence());
    }

    @Test
    public void testStartTest() {
        verseProgressTracker.track(VERSE);

        VerseLearningState state = verseProgressTracker.startTest(VERSE.id());

        assertEquals(VerseStatus.Reviewing, state.status());
        assertEquals(1, state.testAttempts());
        assertEquals(0, state.successfulRecalls());
        assertNull(state.lastPracticedAt());
    }

    @Test
    public void testSubmitTestResult_passed() {
        verseProgressTracker.track(VERSE);
        verseProgressTracker.startTest(VERSE.id());
        Instant attemptedAt = START.plus(Duration.ofSeconds(30));
        clock.advance(Duration.ofMinutes(1));

        VerseLearningState state = verseProgressTracker.submitTestResult(new TestResult(VERSE.id(), true, attemptedAt));

        assertEquals(VerseStatus.Mastered, state.status());
        assertEquals(ConfidenceLevel.Confident, state.confidence());
        assertEquals(1, state.testAttempts());
        assertEquals(1, state.successfulRecalls());
        assertEquals(attemptedAt, state.lastPracticedAt());
        assertEquals(START.plus(Duration.ofMinutes(1)), state.masteredAt());
    }

    @Test
    public void testSubmitTestResult_failed() {
        verseProgressTracker.track(VERSE);
        verseProgressTracker.setConfidence(VERSE.id(), ConfidenceLevel.Confident);
        verseProgressTracker.startTest(VERSE.id());

        VerseLearningState state = verseProgressTracker.submitTestResult(new TestResult(VERSE.id(), false, null));

        assertEquals(VerseStatus.Learning, state.status());
        assertEquals(ConfidenceLevel.NotConfident, state.confidence());
        assertEquals(1, state.testAttempts());
        assertEquals(0, state.successfulRecalls());
        assertEquals(START, state.lastPracticedAt());
        assertNull(state.masteredAt());
    }

    @Test
    public void testSubmitTestResult_masteredAtIsKept() {
        verseProgressTracker.track(VERSE);
        verseProgressTracker.startTest(VERSE.id());
        verseProgressTracker.submitTestResult(new TestResult(VERSE.id(), true, START));

        clock.advance(Duration.ofDays(1));
        verseProgressTracker.startTest(VERSE.id());
        VerseLearningState failed = verseProgressTracker.submitTestResult(new TestResult(VERSE.id(), false, clock.instant()));
        assertEquals(VerseStatus.Learning, failed.status());
        assertEquals(START, failed.masteredAt());

        clock.advance(Duration.ofDays(1));
        verseProgressTracker.startTest(VERSE.id());
        VerseLearningState again = verseProgressTracker.submitTestResult(new TestResult(VERSE.id(), true, clock.instant()));
        assertEquals(VerseStatus.Mastered, again.status());
        assertEquals(START, again.masteredAt());
        assertEquals(3, again.testAttempts());
        assertEquals(2, again.successfulRecalls());
    }

    @Test
    public void testMasteredAtUnchangedByPractice() {
        verseProgressTracker.track(VERSE);
        verseProgressTracker.startTest(VERSE.id());
        VerseLearningState mastered = verseProgressTracker.submitTestResult(new TestResult(VERSE.id(), true, START));

        clock.advance(Duration.ofHours(1));
        VerseLearningState read = verseProgressTracker.markRead(VERSE.id()).orElseThrow();
        assertEquals(VerseStatus.Mastered, read.status());
        assertEquals(mastered.masteredAt(), read.masteredAt());

        clock.advance(Duration.ofHours(1));
        VerseLearningState confident = verseProgressTracker.setConfidence(VERSE.id(), ConfidenceLevel.Confident);
        assertEquals(VerseStatus.Reviewing, confident.status());
        assertEquals(mastered.masteredAt(), confident.masteredAt());

        clock.advance(Duration.ofHours(1));
        VerseLearningState unsure = verseProgressTracker.setConfidence(VERSE.id(), ConfidenceLevel.NotConfident);
        assertEquals(VerseStatus.Reviewing, unsure.status());
        assertEquals(START, unsure.masteredAt());
        assertEquals(START.plus(Duration.ofHours(3)), unsure.lastPracticedAt());
    }

    @Test
    public void testSubmitTestResult_passWithoutStartedTest() {
        verseProgressTracker.track(VERSE);

        VerseLearningState state = verseProgressTracker.submitTestResult(new TestResult(VERSE.id(), true, START));

        assertEquals(1, state.testAttempts());
        assertEquals(1, state.successfulRecalls());
    }

    @Test
    public void testUntrackedVerse() {
        UntrackedVerseException ex = assertThrows(UntrackedVerseException.class,
                () -> verseProgressTracker.setConfidence(7, ConfidenceLevel.Confident));
        assertEquals(7, ex.getVerseId());

        assertThrows(UntrackedVerseException.class, () -> verseProgressTracker.startTest(7));
        assertThrows(UntrackedVerseException.class,
                () -> verseProgressTracker.submitTestResult(new TestResult(7, true, START)));
    }

    @Test
    public void testFailedWriteLeavesStateUnchanged() {
        VerseLearningStateDao failingDao = new InMemoryVerseLearningStateDao() {
            private boolean fail = false;

            @Override
            public void put(VerseLearningState state) {
                if (fail) {
                    throw new DaoException("Store unavailable");
                }
                super.put(state);
                fail = true;
            }
        };
        VerseProgressTracker tracker = new VerseProgressTracker(failingDao, clock);
        VerseLearningState initial = tracker.track(VERSE);

        assertThrows(DaoException.class, () -> tracker.markRead(VERSE.id()));

        assertEquals(Optional.of(initial), tracker.getState(VERSE.id()));
        assertEquals(Optional.of(initial), failingDao.get(VERSE.id()));
    }

    @Test
    public void testGetChapterProgress() {
        for (Verse verse : TestUtils.getAlFatihaVerses().subList(0, 4)) {
            verseProgressTracker.track(verse);
        }
        verseProgressTracker.markRead(2);
        verseProgressTracker.setConfidence(3, ConfidenceLevel.Confident);
        verseProgressTracker.submitTestResult(new TestResult(4, true, START));
        verseProgressTracker.track(TestUtils.getVerse(100, 2, 1));

        ChapterProgress progress = verseProgressTracker.getChapterProgress(TestUtils.AL_FATIHA_ID, 7);

        assertEquals(7, progress.totalVerses());
        assertEquals(4, progress.newCount());
        assertEquals(1, progress.learningCount());
        assertEquals(1, progress.reviewingCount());
        assertEquals(1, progress.masteredCount());
        assertEquals(100.0 / 7, progress.percentComplete(), 1e-9);
    }

    @Test
    public void testGetChapterProgress_emptyChapter() {
        ChapterProgress progress = verseProgressTracker.getChapterProgress(9, 0);

        assertEquals(0, progress.newCount());
        assertEquals(0, progress.percentComplete(), 1e-9);
    }
}
