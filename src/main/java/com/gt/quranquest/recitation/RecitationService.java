package com.gt.quranquest.recitation;

import com.gt.quranquest.alignment.AlignmentScorer;
import com.gt.quranquest.alignment.ArabicTextNormalizer;
import com.gt.quranquest.alignment.model.AlignmentScore;
import com.gt.quranquest.model.TestResult;
import com.gt.quranquest.model.VerseLearningState;
import com.gt.quranquest.recitation.model.RecitationAnalysis;
import com.gt.quranquest.recitation.model.RecitationTestOutcome;
import com.gt.quranquest.session.LearningSessionService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Clock;

@Component
public class RecitationService {

    private static final Logger log = LoggerFactory.getLogger(RecitationService.class);

    static final int BASE_RECITATION_XP = 10;
    static final int MIN_RECITATION_XP = 5;

    private final AlignmentScorer alignmentScorer;
    private final ArabicTextNormalizer arabicTextNormalizer;
    private final LearningSessionService learningSessionService;
    private final Clock clock;
    private final double passAccuracy;

    @Autowired
    public RecitationService(AlignmentScorer alignmentScorer,
                             ArabicTextNormalizer arabicTextNormalizer,
                             LearningSessionService learningSessionService,
                             Clock clock,
                             @Value("${quranquest.recitation.passAccuracy:80.0}") double passAccuracy) {
        this.alignmentScorer = alignmentScorer;
        this.arabicTextNormalizer = arabicTextNormalizer;
        this.learningSessionService = learningSessionService;
        this.clock = clock;
        this.passAccuracy = passAccuracy;
    }

    /**
     * Compares a transcription with the expected verse text after normalizing both. Accuracy is the complement of
     * the word error rate, bounded to 0-100 and rounded to two decimals.
     */
    public RecitationAnalysis analyze(String expectedText, String transcription) {
        AlignmentScore score = alignmentScorer.score(
                arabicTextNormalizer.normalize(expectedText),
                arabicTextNormalizer.normalize(transcription));

        double accuracy = Math.max(0, Math.min(100, (1 - score.errorRate()) * 100));

        return new RecitationAnalysis(round(accuracy, 2), round(score.errorRate(), 4), score.feedback());
    }

    public int calculateXpReward(double accuracy, long durationSeconds) {
        double durationFactor = Math.min(2.0, 1.0 + (durationSeconds / 60.0) * 0.5);
        int xp = (int) (BASE_RECITATION_XP * accuracyMultiplier(accuracy) * durationFactor);

        return Math.max(MIN_RECITATION_XP, xp);
    }

    /**
     * Runs a recitation as a recall test for the verse: the test is started, the recitation scored, and the outcome
     * submitted as passed when accuracy reaches the configured threshold.
     */
    public RecitationTestOutcome submitRecitationTest(int verseId, String expectedText, String transcription, long durationSeconds) {
        learningSessionService.startTest(verseId);

        RecitationAnalysis analysis = analyze(expectedText, transcription);
        boolean passed = analysis.accuracy() >= passAccuracy;
        VerseLearningState state = learningSessionService.submitTestResult(new TestResult(verseId, passed, clock.instant()));

        log.debug("Recitation test for verse {}: accuracy {}, passed {}", verseId, analysis.accuracy(), passed);
        return new RecitationTestOutcome(analysis, passed, calculateXpReward(analysis.accuracy(), durationSeconds), state);
    }

    private double accuracyMultiplier(double accuracy) {
        if (accuracy >= 95) {
            return 3.0;
        } else if (accuracy >= 90) {
            return 2.5;
        } else if (accuracy >= 80) {
            return 2.0;
        } else if (accuracy >= 70) {
            return 1.5;
        } else if (accuracy >= 50) {
            return 1.0;
        }

        return 0.5;
    }

    // Half-even on the exact binary value, so a stored 0.125 rounds to 0.12
    static double round(double value, int places) {
        return new BigDecimal(value).setScale(places, RoundingMode.HALF_EVEN).doubleValue();
    }
}
