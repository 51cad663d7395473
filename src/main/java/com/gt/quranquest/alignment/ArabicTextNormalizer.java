package com.gt.quranquest.alignment;

import org.springframework.stereotype.Component;

import java.text.Normalizer;
import java.util.Map;
import java.util.regex.Pattern;

/**
 * Reduces Arabic text to a comparable skeleton before scoring: tashkeel is dropped, the text is NFKC normalized
 * and letter variants that transcription models mix up are folded together.
 */
@Component
public class ArabicTextNormalizer {

    // Fathatan through hamza below, plus the superscript alef
    private static final Pattern DIACRITICS = Pattern.compile("[\\u064B-\\u0655\\u0670]");

    private static final Map<Character, Character> LETTER_FOLDS = Map.of(
            'آ', 'ا',   // alef with madda
            'أ', 'ا',   // alef with hamza above
            'إ', 'ا',   // alef with hamza below
            'ٱ', 'ا',   // alef wasla
            'ة', 'ه',   // ta marbuta
            'ى', 'ي');  // alef maksura

    public String normalize(String text) {
        if (text == null) {
            return "";
        }

        String withoutDiacritics = DIACRITICS.matcher(text).replaceAll("");
        String composed = Normalizer.normalize(withoutDiacritics, Normalizer.Form.NFKC);

        StringBuilder folded = new StringBuilder(composed.length());
        for (int i = 0; i < composed.length(); i++) {
            char c = composed.charAt(i);
            folded.append(LETTER_FOLDS.getOrDefault(c, c));
        }

        return folded.toString().strip();
    }
}
