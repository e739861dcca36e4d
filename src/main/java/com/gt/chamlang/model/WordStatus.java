package com.gt.chamlang.model;

import com.fasterxml.jackson.databind.annotation.JsonSerialize;
import com.gt.chamlang.serialization.WordStatusSerializer;

/**
 * Learner-facing badge for a word. Derived from the Leitner box and the current correct streak, independent of the
 * configured box count.
 */
@JsonSerialize(using = WordStatusSerializer.class)
public enum WordStatus {
    New("new"),
    StillLearning("still_learning"),
    AlmostDone("almost_done"),
    Mastered("mastered");

    private final String tag;

    WordStatus(String tag) {
        this.tag = tag;
    }

    public String getTag() {
        return tag;
    }

    public static WordStatus of(WordProgress wordProgress) {
        if (wordProgress == null || wordProgress.totalReviews() == 0) {
            return New;
        }

        int box = Math.max(1, Math.min(wordProgress.leitnerBox(), 7));
        int consecutiveCorrect = wordProgress.consecutiveCorrectCount();

        if (box >= 5 || (box == 3 && consecutiveCorrect >= 2)) {
            return Mastered;
        } else if (box >= 4 || (box == 3 && consecutiveCorrect >= 1)) {
            return AlmostDone;
        }

        return StillLearning;
    }
}
