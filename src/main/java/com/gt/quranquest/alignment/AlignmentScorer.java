package com.gt.quranquest.alignment;

import com.gt.quranquest.alignment.model.AlignmentFeedback;
import com.gt.quranquest.alignment.model.AlignmentScore;
import com.gt.quranquest.alignment.model.WordStatus;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * Scores a transcribed recitation against the expected text, word by word.
 * <p>
 * Two independent passes are made. The error rate is the word-level Levenshtein distance divided by the number of
 * reference words (WER). The feedback tape comes from a greedy left-to-right walk that never backtracks, so an
 * inserted or dropped word in the middle of a verse shows up as a run of incorrect words even though the error rate
 * counts it once. The tape is meant for highlighting only.
 * <p>
 * The error rate is not clamped: a hypothesis much longer than the reference yields a value above 1.
 * No case, punctuation or diacritic normalization happens here.
 */
@Component
public class AlignmentScorer {

    private static final String WORD_SEPARATOR = "\\s+";

    public AlignmentScore score(String expectedText, String hypothesisText) {
        List<String> referenceWords = splitWords(expectedText);
        List<String> hypothesisWords = splitWords(hypothesisText);

        if (referenceWords.isEmpty()) {
            return new AlignmentScore(0, List.of());
        }

        double errorRate = (double) wordEditDistance(referenceWords, hypothesisWords) / referenceWords.size();

        return new AlignmentScore(errorRate, buildFeedback(referenceWords, hypothesisWords));
    }

    public double wordErrorRate(String expectedText, String hypothesisText) {
        List<String> referenceWords = splitWords(expectedText);
        if (referenceWords.isEmpty()) {
            return 0;
        }

        return (double) wordEditDistance(referenceWords, splitWords(hypothesisText)) / referenceWords.size();
    }

    int wordEditDistance(List<String> reference, List<String> hypothesis) {
        int[] v0 = new int[hypothesis.size() + 1];
        int[] v1 = new int[hypothesis.size() + 1];
        for (int j = 0; j <= hypothesis.size(); j++) {
            v0[j] = j;
        }

        for (int i = 0; i < reference.size(); i++) {
            v1[0] = i + 1;

            for (int j = 0; j < hypothesis.size(); j++) {
                int delCost = v0[j + 1] + 1;
                int insertCost = v1[j] + 1;
                int subCost = reference.get(i).equals(hypothesis.get(j)) ? v0[j] : v0[j] + 1;

                v1[j + 1] = Integer.min(Integer.min(delCost, insertCost), subCost);
            }

            int[] temp = v0;
            v0 = v1;
            v1 = temp;
        }

        return v0[hypothesis.size()];
    }

    List<AlignmentFeedback> buildFeedback(List<String> reference, List<String> hypothesis) {
        List<AlignmentFeedback> feedback = new ArrayList<>(Math.max(reference.size(), hypothesis.size()));

        int refIndex = 0;
        int hypIndex = 0;
        while (refIndex < reference.size() || hypIndex < hypothesis.size()) {
            if (refIndex >= reference.size()) {
                feedback.add(new AlignmentFeedback(hypIndex, hypothesis.get(hypIndex), "", WordStatus.Extra, null));
                hypIndex++;
            } else if (hypIndex >= hypothesis.size()) {
                String expected = reference.get(refIndex);
                feedback.add(new AlignmentFeedback(refIndex, "", expected, WordStatus.Missing, expected));
                refIndex++;
            } else if (reference.get(refIndex).equals(hypothesis.get(hypIndex))) {
                feedback.add(new AlignmentFeedback(refIndex, hypothesis.get(hypIndex), reference.get(refIndex), WordStatus.Correct, null));
                refIndex++;
                hypIndex++;
            } else {
                String expected = reference.get(refIndex);
                feedback.add(new AlignmentFeedback(refIndex, hypothesis.get(hypIndex), expected, WordStatus.Incorrect, expected));
                refIndex++;
                hypIndex++;
            }
        }

        return feedback;
    }

    private List<String> splitWords(String text) {
        if (text == null || text.isBlank()) {
            return List.of();
        }

        return List.of(text.strip().split(WORD_SEPARATOR));
    }
}
