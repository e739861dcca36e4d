package com.gt.chamlang.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import java.time.Instant;
import java.util.Collection;
import java.util.Collections;
import java.util.EnumSet;
import java.util.Set;

/**
 * Review state of a single vocabulary item for one language.
 * <p>
 * {@code failedInSession} and {@code retryCount} are session-scoped. They are carried here so a caller sees the
 * full result of an answer, but the store never persists them.
 */
public record WordProgress(String vocabularyId,
                           String word,
                           int correctCount,
                           int incorrectCount,
                           int masteryLevel,
                           Instant lastPracticed,
                           Instant nextReviewDate,
                           int intervalDays,
                           int lastIntervalDays,
                           double easinessFactor,
                           int consecutiveCorrectCount,
                           int leitnerBox,
                           int totalReviews,
                           boolean failedInSession,
                           int retryCount,
                           Set<PracticeMode> completedModesInCycle) {

    public static final double DEFAULT_EASINESS_FACTOR = 2.5;

    public WordProgress {
        completedModesInCycle = toModeSet(completedModesInCycle);
    }

    public static WordProgress createInitial(String vocabularyId, String word, Instant now) {
        return new WordProgress(vocabularyId, word, 0, 0, 0, null, now, 0, 0, DEFAULT_EASINESS_FACTOR,
                0, 1, 0, false, 0, Set.of());
    }

    public boolean isDue(Instant now) {
        return nextReviewDate == null || !now.isBefore(nextReviewDate);
    }

    @JsonIgnore
    public boolean isNew() {
        return totalReviews == 0;
    }

    public WordProgress withSessionStateCleared() {
        if (!failedInSession && retryCount == 0) {
            return this;
        }

        return toBuilder().failedInSession(false).retryCount(0).build();
    }

    public Builder toBuilder() {
        return new Builder(this);
    }

    public static Builder builder() {
        return new Builder();
    }

    private static Set<PracticeMode> toModeSet(Collection<PracticeMode> modes) {
        EnumSet<PracticeMode> modeSet = EnumSet.noneOf(PracticeMode.class);
        if (modes != null) {
            for (PracticeMode mode : modes) {
                if (mode != null) {
                    modeSet.add(mode);
                }
            }
        }

        return Collections.unmodifiableSet(modeSet);
    }

    public static class Builder {
        private String vocabularyId;
        private String word;
        private int correctCount;
        private int incorrectCount;
        private int masteryLevel;
        private Instant lastPracticed;
        private Instant nextReviewDate;
        private int intervalDays;
        private int lastIntervalDays;
        private double easinessFactor = DEFAULT_EASINESS_FACTOR;
        private int consecutiveCorrectCount;
        private int leitnerBox = 1;
        private int totalReviews;
        private boolean failedInSession;
        private int retryCount;
        private Set<PracticeMode> completedModesInCycle = Set.of();

        private Builder() { }

        private Builder(WordProgress wordProgress) {
            this.vocabularyId = wordProgress.vocabularyId;
            this.word = wordProgress.word;
            this.correctCount = wordProgress.correctCount;
            this.incorrectCount = wordProgress.incorrectCount;
            this.masteryLevel = wordProgress.masteryLevel;
            this.lastPracticed = wordProgress.lastPracticed;
            this.nextReviewDate = wordProgress.nextReviewDate;
            this.intervalDays = wordProgress.intervalDays;
            this.lastIntervalDays = wordProgress.lastIntervalDays;
            this.easinessFactor = wordProgress.easinessFactor;
            this.consecutiveCorrectCount = wordProgress.consecutiveCorrectCount;
            this.leitnerBox = wordProgress.leitnerBox;
            this.totalReviews = wordProgress.totalReviews;
            this.failedInSession = wordProgress.failedInSession;
            this.retryCount = wordProgress.retryCount;
            this.completedModesInCycle = wordProgress.completedModesInCycle;
        }

        public Builder vocabularyId(String vocabularyId) {
            this.vocabularyId = vocabularyId;
            return this;
        }

        public Builder word(String word) {
            this.word = word;
            return this;
        }

        public Builder correctCount(int correctCount) {
            this.correctCount = correctCount;
            return this;
        }

        public Builder incorrectCount(int incorrectCount) {
            this.incorrectCount = incorrectCount;
            return this;
        }

        public Builder masteryLevel(int masteryLevel) {
            this.masteryLevel = masteryLevel;
            return this;
        }

        public Builder lastPracticed(Instant lastPracticed) {
            this.lastPracticed = lastPracticed;
            return this;
        }

        public Builder nextReviewDate(Instant nextReviewDate) {
            this.nextReviewDate = nextReviewDate;
            return this;
        }

        public Builder intervalDays(int intervalDays) {
            this.intervalDays = intervalDays;
            return this;
        }

        public Builder lastIntervalDays(int lastIntervalDays) {
            this.lastIntervalDays = lastIntervalDays;
            return this;
        }

        public Builder easinessFactor(double easinessFactor) {
            this.easinessFactor = easinessFactor;
            return this;
        }

        public Builder consecutiveCorrectCount(int consecutiveCorrectCount) {
            this.consecutiveCorrectCount = consecutiveCorrectCount;
            return this;
        }

        public Builder leitnerBox(int leitnerBox) {
            this.leitnerBox = leitnerBox;
            return this;
        }

        public Builder totalReviews(int totalReviews) {
            this.totalReviews = totalReviews;
            return this;
        }

        public Builder failedInSession(boolean failedInSession) {
            this.failedInSession = failedInSession;
            return this;
        }

        public Builder retryCount(int retryCount) {
            this.retryCount = retryCount;
            return this;
        }

        public Builder completedModesInCycle(Set<PracticeMode> completedModesInCycle) {
            this.completedModesInCycle = completedModesInCycle;
            return this;
        }

        public WordProgress build() {
            return new WordProgress(vocabularyId, word, correctCount, incorrectCount, masteryLevel, lastPracticed,
                    nextReviewDate, intervalDays, lastIntervalDays, easinessFactor, consecutiveCorrectCount,
                    leitnerBox, totalReviews, failedInSession, retryCount, completedModesInCycle);
        }
    }
}
