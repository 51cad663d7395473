package com.gt.quranquest.lesson;

import com.gt.quranquest.exception.LessonNotStartedException;
import com.gt.quranquest.lesson.model.Exercise;
import com.gt.quranquest.lesson.model.ExerciseAnswer;
import com.gt.quranquest.lesson.model.Lesson;
import com.gt.quranquest.lesson.model.LessonResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Tracks one lesson attempt and turns it into stars and XP.
 * <p>
 * XP is accumulated in a fixed order, each step working on the running total:
 * correct answers, then the combo multiplier, then the perfect-lesson bonus, then the speed bonus, then the lesson's
 * own reward. The speed bonus compares the average time per exercise, so uneven pacing within a lesson is not
 * penalized.
 */
@Component
public class LessonRewardCalculator {

    private static final Logger log = LoggerFactory.getLogger(LessonRewardCalculator.class);

    private final Clock clock;
    private final int xpPerCorrect;
    private final double comboBonusMultiplier;
    private final double maxComboMultiplier;
    private final int perfectBonus;
    private final long speedBonusThresholdMs;
    private final int speedBonus;

    private Lesson currentLesson;
    private int currentExerciseIndex;
    private Map<String, ExerciseAnswer> answers = new LinkedHashMap<>();
    private int correctCount;
    private int incorrectCount;
    private int combo;
    private int maxCombo;
    private int heartsUsed;
    private Instant startTime;

    @Autowired
    public LessonRewardCalculator(Clock clock,
                                  @Value("${quranquest.reward.xpPerCorrect:10}") int xpPerCorrect,
                                  @Value("${quranquest.reward.comboBonusMultiplier:0.5}") double comboBonusMultiplier,
                                  @Value("${quranquest.reward.maxComboMultiplier:5.0}") double maxComboMultiplier,
                                  @Value("${quranquest.reward.perfectBonus:50}") int perfectBonus,
                                  @Value("${quranquest.reward.speedBonusThresholdMs:30000}") long speedBonusThresholdMs,
                                  @Value("${quranquest.reward.speedBonus:25}") int speedBonus) {
        this.clock = clock;
        this.xpPerCorrect = xpPerCorrect;
        this.comboBonusMultiplier = comboBonusMultiplier;
        this.maxComboMultiplier = maxComboMultiplier;
        this.perfectBonus = perfectBonus;
        this.speedBonusThresholdMs = speedBonusThresholdMs;
        this.speedBonus = speedBonus;
    }

    public synchronized void startLesson(Lesson lesson) {
        clearAttempt();
        currentLesson = lesson;
        startTime = clock.instant();

        log.info("Started lesson {} with {} exercises", lesson.id(), lesson.exercises().size());
    }

    /**
     * Records an answer and updates the combo. Returns whether the answer was correct.
     */
    public synchronized boolean submitAnswer(ExerciseAnswer answer) {
        requireLesson("submit an answer");

        answers.put(answer.exerciseId(), answer);
        if (answer.isCorrect()) {
            correctCount++;
            combo++;
            maxCombo = Math.max(maxCombo, combo);
        } else {
            incorrectCount++;
            combo = 0;
            heartsUsed++;
        }

        return answer.isCorrect();
    }

    public synchronized Optional<Exercise> nextExercise() {
        if (currentLesson != null) {
            currentExerciseIndex = Math.max(0, Math.min(currentExerciseIndex + 1, currentLesson.exercises().size() - 1));
        }
        return currentExercise();
    }

    public synchronized Optional<Exercise> previousExercise() {
        currentExerciseIndex = Math.max(currentExerciseIndex - 1, 0);
        return currentExercise();
    }

    public synchronized Optional<Exercise> currentExercise() {
        if (currentLesson == null || currentExerciseIndex >= currentLesson.exercises().size()) {
            return Optional.empty();
        }

        return Optional.of(currentLesson.exercises().get(currentExerciseIndex));
    }

    public synchronized double progress() {
        if (currentLesson == null || currentLesson.exercises().isEmpty()) {
            return 0;
        }

        return (currentExerciseIndex + 1) * 100.0 / currentLesson.exercises().size();
    }

    public synchronized LessonResult complete() {
        requireLesson("complete a lesson");

        int totalExercises = currentLesson.exercises().size();
        long timeSpentMs = startTime == null ? 0 : Duration.between(startTime, clock.instant()).toMillis();
        double accuracy = totalExercises > 0 ? correctCount * 100.0 / totalExercises : 0;
        boolean isPerfect = incorrectCount == 0;

        int xpEarned = calculateXp(totalExercises, timeSpentMs, isPerfect);
        LessonResult result = new LessonResult(
                currentLesson.id(),
                totalExercises,
                correctCount,
                incorrectCount,
                accuracy,
                timeSpentMs,
                xpEarned,
                calculateStars(accuracy),
                maxCombo,
                isPerfect);

        log.info("Completed lesson {}: {}/{} correct, {} stars, {} xp", result.lessonId(), correctCount, totalExercises, result.stars(), xpEarned);
        return result;
    }

    public synchronized void resetLesson() {
        clearAttempt();
    }

    public synchronized int getCombo() {
        return combo;
    }

    public synchronized int getMaxCombo() {
        return maxCombo;
    }

    public synchronized int getHeartsUsed() {
        return heartsUsed;
    }

    public synchronized Map<String, ExerciseAnswer> getAnswers() {
        return Map.copyOf(answers);
    }

    static int calculateStars(double accuracy) {
        if (accuracy >= 90) {
            return 3;
        } else if (accuracy >= 70) {
            return 2;
        } else if (accuracy >= 50) {
            return 1;
        }

        return 0;
    }

    int calculateXp(int totalExercises, long timeSpentMs, boolean isPerfect) {
        int xp = correctCount * xpPerCorrect;

        double comboMultiplier = Math.min(maxCombo * comboBonusMultiplier, maxComboMultiplier);
        xp += (int) Math.floor(xp * comboMultiplier);

        if (isPerfect) {
            xp += perfectBonus;
        }

        // An empty lesson has no average pace
        if (totalExercises > 0 && (double) timeSpentMs / totalExercises < speedBonusThresholdMs) {
            xp += speedBonus;
        }

        return xp + currentLesson.xpReward();
    }

    private void requireLesson(String operation) {
        if (currentLesson == null) {
            throw new LessonNotStartedException("Cannot " + operation + ": no lesson in progress");
        }
    }

    private void clearAttempt() {
        currentLesson = null;
        currentExerciseIndex = 0;
        answers = new LinkedHashMap<>();
        correctCount = 0;
        incorrectCount = 0;
        combo = 0;
        maxCombo = 0;
        heartsUsed = 0;
        startTime = null;
    }
}
