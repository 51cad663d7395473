package com.gt.quranquest.progress;

import com.gt.quranquest.model.ConfidenceLevel;
import com.gt.quranquest.model.VerseStatus;

/**
 * Transition table of the verse mastery state machine. Confidence reports and test results derive the next status
 * here and nowhere else.
 * <pre>
 *   New ──read, unsure─────────▶ Learning ──confident──▶ Reviewing ──test passed──▶ Mastered
 *                                     ▲                        │                           │
 *                                     └──────test failed───────┴───────────────────────────┘
 * </pre>
 */
public final class VerseStatusTransitions {

    private VerseStatusTransitions() { }

    public static VerseStatus next(VerseStatus currentStatus, ConfidenceLevel confidence) {
        return next(currentStatus, confidence, null);
    }

    /**
     * @param testPassed outcome of a recall test, or null when the change is not driven by a test
     */
    public static VerseStatus next(VerseStatus currentStatus, ConfidenceLevel confidence, Boolean testPassed) {
        if (Boolean.TRUE.equals(testPassed)) {
            return VerseStatus.Mastered;
        }

        if (Boolean.FALSE.equals(testPassed)) {
            return VerseStatus.Learning;
        }

        if (confidence == ConfidenceLevel.Confident) {
            return VerseStatus.Reviewing;
        }

        if (currentStatus == VerseStatus.New) {
            return VerseStatus.Learning;
        }

        return currentStatus;
    }
}
