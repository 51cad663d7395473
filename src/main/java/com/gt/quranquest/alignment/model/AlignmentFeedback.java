package com.gt.quranquest.alignment.model;

/**
 * One entry of the word alignment tape.
 *
 * @param wordIndex index into the reference words, or into the hypothesis words for {@link WordStatus#Extra}
 * @param token the spoken word, empty when {@link WordStatus#Missing}
 * @param expectedToken the reference word, empty when {@link WordStatus#Extra}
 * @param suggestion the word the reciter should have said, null when nothing needs correcting
 */
public record AlignmentFeedback(int wordIndex,
                                String token,
                                String expectedToken,
                                WordStatus status,
                                String suggestion) { }
