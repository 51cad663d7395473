package com.gt.quranquest.session;

import com.gt.quranquest.model.ConfidenceLevel;
import com.gt.quranquest.model.TestResult;
import com.gt.quranquest.model.Verse;
import com.gt.quranquest.model.VerseLearningState;
import com.gt.quranquest.model.VerseStatus;
import com.gt.quranquest.progress.VerseProgressTracker;
import com.gt.quranquest.session.model.LearningSession;
import com.gt.quranquest.session.model.SessionItem;
import com.gt.quranquest.session.model.SessionProgress;
import com.gt.quranquest.session.model.VerseRange;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Walks the learner through one range of verses at a time. Holds the single live {@link LearningSession}, which is
 * never persisted. Verse state changes are delegated to the {@link VerseProgressTracker}; the session only keeps
 * snapshots of that state and refreshes them after each delegated change.
 */
@Component
public class LearningSessionService {

    private static final Logger log = LoggerFactory.getLogger(LearningSessionService.class);

    private final VerseProgressTracker verseProgressTracker;
    private final Clock clock;

    private LearningSession currentSession;

    @Autowired
    public LearningSessionService(VerseProgressTracker verseProgressTracker, Clock clock) {
        this.verseProgressTracker = verseProgressTracker;
        this.clock = clock;
    }

    public synchronized LearningSession initializeSession(int chapterId, String chapterLabel, List<Verse> verses, int startNum, int endNum) {
        List<SessionItem> items = new ArrayList<>();
        for (Verse verse : verses) {
            if (verse.numberInChapter() >= startNum && verse.numberInChapter() <= endNum) {
                items.add(new SessionItem(verse, verseProgressTracker.track(verse)));
            }
        }

        currentSession = new LearningSession(
                UUID.randomUUID().toString(),
                chapterId,
                chapterLabel,
                new VerseRange(startNum, endNum),
                items,
                clock.instant(),
                null,
                0,
                0,
                0);

        log.info("Started session {} for {} verses {}-{} ({} items)", currentSession.sessionId(), chapterLabel, startNum, endNum, items.size());
        return currentSession;
    }

    public synchronized Optional<LearningSession> getCurrentSession() {
        return Optional.ofNullable(currentSession);
    }

    public synchronized Optional<SessionItem> currentItem() {
        if (currentSession == null || currentSession.items().isEmpty()) {
            return Optional.empty();
        }

        return Optional.of(currentSession.items().get(currentSession.cursor()));
    }

    public synchronized Optional<SessionItem> nextItem() {
        return moveCursorTo(currentSession == null ? 0 : currentSession.cursor() + 1);
    }

    public synchronized Optional<SessionItem> previousItem() {
        return moveCursorTo(currentSession == null ? 0 : currentSession.cursor() - 1);
    }

    public synchronized Optional<SessionItem> goToItem(int index) {
        return moveCursorTo(index);
    }

    public synchronized SessionProgress sessionProgress() {
        if (currentSession == null) {
            return new SessionProgress(0, 0, 0);
        }

        int total = currentSession.items().size();
        int masteredCount = (int) currentSession.items().stream()
                .filter(item -> item.learningState().status() == VerseStatus.Mastered)
                .count();

        return new SessionProgress(total, masteredCount, total > 0 ? masteredCount * 100.0 / total : 0);
    }

    public synchronized Optional<LearningSession> completeSession() {
        if (currentSession == null) {
            log.warn("Complete requested with no active session");
            return Optional.empty();
        }

        currentSession = copySession(currentSession.items(), currentSession.cursor(), currentSession.sessionReadCount(),
                currentSession.sessionMasteredCount(), true);

        log.info("Completed session {}: {} reads, {} verses mastered", currentSession.sessionId(),
                currentSession.sessionReadCount(), currentSession.sessionMasteredCount());
        return Optional.of(currentSession);
    }

    public synchronized void resetSession() {
        if (currentSession != null) {
            log.info("Discarding session {}", currentSession.sessionId());
        }

        currentSession = null;
    }

    public synchronized Optional<VerseLearningState> markRead(int verseId) {
        Optional<VerseLearningState> updated = verseProgressTracker.markRead(verseId);
        updated.ifPresent(state -> refreshSnapshot(state, 1, 0));
        return updated;
    }

    public synchronized VerseLearningState setConfidence(int verseId, ConfidenceLevel level) {
        VerseLearningState updated = verseProgressTracker.setConfidence(verseId, level);
        refreshSnapshot(updated, 0, 0);
        return updated;
    }

    public synchronized VerseLearningState startTest(int verseId) {
        VerseLearningState updated = verseProgressTracker.startTest(verseId);
        refreshSnapshot(updated, 0, 0);
        return updated;
    }

    public synchronized VerseLearningState submitTestResult(TestResult result) {
        VerseLearningState updated = verseProgressTracker.submitTestResult(result);
        refreshSnapshot(updated, 0, result.passed() ? 1 : 0);
        return updated;
    }

    private Optional<SessionItem> moveCursorTo(int index) {
        if (currentSession == null) {
            return Optional.empty();
        }

        int maxIndex = Math.max(0, currentSession.items().size() - 1);
        int cursor = Math.max(0, Math.min(index, maxIndex));
        if (cursor != currentSession.cursor()) {
            currentSession = copySession(currentSession.items(), cursor, currentSession.sessionReadCount(),
                    currentSession.sessionMasteredCount(), false);
        }

        return currentItem();
    }

    private void refreshSnapshot(VerseLearningState state, int readIncrement, int masteredIncrement) {
        if (currentSession == null) {
            return;
        }

        boolean inSession = false;
        List<SessionItem> items = new ArrayList<>(currentSession.items().size());
        for (SessionItem item : currentSession.items()) {
            if (item.verse().id() == state.verseId()) {
                items.add(new SessionItem(item.verse(), state));
                inSession = true;
            } else {
                items.add(item);
            }
        }

        if (!inSession) {
            return;
        }

        currentSession = copySession(items, currentSession.cursor(), currentSession.sessionReadCount() + readIncrement,
                currentSession.sessionMasteredCount() + masteredIncrement, false);
    }

    private LearningSession copySession(List<SessionItem> items, int cursor, int readCount, int masteredCount, boolean markCompleted) {
        return new LearningSession(
                currentSession.sessionId(),
                currentSession.chapterId(),
                currentSession.chapterLabel(),
                currentSession.verseRange(),
                items,
                currentSession.startedAt(),
                markCompleted ? clock.instant() : currentSession.completedAt(),
                cursor,
                readCount,
                masteredCount);
    }
}
