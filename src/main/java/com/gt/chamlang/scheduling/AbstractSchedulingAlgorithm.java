package com.gt.chamlang.scheduling;

import com.gt.chamlang.model.AnswerOutcome;
import com.gt.chamlang.model.WordProgress;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.time.temporal.ChronoUnit;

/**
 * Shared answer handling for every algorithm variant: counters, Leitner box movement, the mode cycle gate and session
 * failure flags. Subclasses only decide the easiness factor and the next interval.
 */
public abstract class AbstractSchedulingAlgorithm implements SchedulingAlgorithm {

    private static final Logger log = LoggerFactory.getLogger(AbstractSchedulingAlgorithm.class);

    static final int MAX_INTERVAL_DAYS = 36500;
    private static final int MAX_MASTERY_LEVEL = 5;

    protected final int maxBoxes;

    protected AbstractSchedulingAlgorithm(int maxBoxes) {
        this.maxBoxes = Math.max(1, maxBoxes);
    }

    @Override
    public WordProgress advance(WordProgress wordProgress, AnswerOutcome answerOutcome) {
        WordProgress current = clampToValidRange(wordProgress);
        Instant answeredAt = answerOutcome.answeredAt();

        int correctCount = current.correctCount() + (answerOutcome.correct() ? 1 : 0);
        int incorrectCount = current.incorrectCount() + (answerOutcome.correct() ? 0 : 1);

        WordProgress.Builder builder = current.toBuilder()
                .totalReviews(current.totalReviews() + 1)
                .lastPracticed(answeredAt)
                .correctCount(correctCount)
                .incorrectCount(incorrectCount)
                .masteryLevel(calculateMasteryLevel(correctCount, incorrectCount));

        ModeCycleTracker.CycleTransition transition = ModeCycleTracker.recordAnswer(
                current.completedModesInCycle(), answerOutcome.mode(), answerOutcome.correct());
        builder.completedModesInCycle(transition.completedModes());

        if (answerOutcome.correct()) {
            int consecutiveCorrect = current.consecutiveCorrectCount() + 1;
            builder.consecutiveCorrectCount(consecutiveCorrect);

            if (transition.cycleClosed()) {
                int newBox = Math.min(current.leitnerBox() + 1, maxBoxes);
                double newEasinessFactor = easinessAfterCycle(current.easinessFactor(), consecutiveCorrect);
                int newInterval = clampInterval(intervalAfterCycle(current.intervalDays(), newEasinessFactor, newBox));

                builder.leitnerBox(newBox)
                        .easinessFactor(newEasinessFactor)
                        .lastIntervalDays(current.intervalDays())
                        .intervalDays(newInterval)
                        .nextReviewDate(answeredAt.plus(newInterval, ChronoUnit.DAYS));
            }
        } else {
            if (transition.forfeited()) {
                log.debug("Partial mode cycle {} forfeited for {}", current.completedModesInCycle(), current.vocabularyId());
            }

            int newBox = Math.max(current.leitnerBox() - 1, 1);
            double newEasinessFactor = easinessAfterMiss(current.easinessFactor());
            int newInterval = clampInterval(intervalAfterMiss(current.intervalDays(), newEasinessFactor, newBox));

            builder.consecutiveCorrectCount(0)
                    .leitnerBox(newBox)
                    .easinessFactor(newEasinessFactor)
                    .lastIntervalDays(current.intervalDays())
                    .intervalDays(newInterval)
                    .nextReviewDate(answeredAt.plus(newInterval, ChronoUnit.DAYS))
                    .failedInSession(true)
                    .retryCount(current.retryCount() + 1);
        }

        return builder.build();
    }

    protected abstract double easinessAfterCycle(double easinessFactor, int consecutiveCorrectCount);

    protected abstract double easinessAfterMiss(double easinessFactor);

    protected abstract int intervalAfterCycle(int intervalDays, double easinessFactor, int newBox);

    protected abstract int intervalAfterMiss(int intervalDays, double easinessFactor, int newBox);

    public static int calculateMasteryLevel(int correctCount, int incorrectCount) {
        int total = correctCount + incorrectCount;
        if (total == 0) {
            return 0;
        }

        return (int) Math.round((double) correctCount / total * MAX_MASTERY_LEVEL);
    }

    private static int clampInterval(int intervalDays) {
        return Math.max(0, Math.min(MAX_INTERVAL_DAYS, intervalDays));
    }

    private WordProgress clampToValidRange(WordProgress wordProgress) {
        double easinessFactor = wordProgress.easinessFactor() <= 0
                ? WordProgress.DEFAULT_EASINESS_FACTOR
                : EasinessFactor.clamp(wordProgress.easinessFactor());
        int leitnerBox = Math.max(1, Math.min(maxBoxes, wordProgress.leitnerBox()));
        int intervalDays = clampInterval(wordProgress.intervalDays());
        int lastIntervalDays = clampInterval(wordProgress.lastIntervalDays());
        int correctCount = Math.max(0, wordProgress.correctCount());
        int incorrectCount = Math.max(0, wordProgress.incorrectCount());
        int consecutiveCorrect = Math.max(0, wordProgress.consecutiveCorrectCount());
        int totalReviews = Math.max(0, wordProgress.totalReviews());
        int retryCount = Math.max(0, wordProgress.retryCount());
        Instant nextReviewDate = wordProgress.nextReviewDate() == null ? Instant.EPOCH : wordProgress.nextReviewDate();

        boolean inRange = easinessFactor == wordProgress.easinessFactor()
                && leitnerBox == wordProgress.leitnerBox()
                && intervalDays == wordProgress.intervalDays()
                && lastIntervalDays == wordProgress.lastIntervalDays()
                && correctCount == wordProgress.correctCount()
                && incorrectCount == wordProgress.incorrectCount()
                && consecutiveCorrect == wordProgress.consecutiveCorrectCount()
                && totalReviews == wordProgress.totalReviews()
                && retryCount == wordProgress.retryCount()
                && wordProgress.nextReviewDate() != null;

        if (inRange) {
            return wordProgress;
        }

        log.debug("Word progress for {} was out of range and has been clamped", wordProgress.vocabularyId());

        return wordProgress.toBuilder()
                .easinessFactor(easinessFactor)
                .leitnerBox(leitnerBox)
                .intervalDays(intervalDays)
                .lastIntervalDays(lastIntervalDays)
                .correctCount(correctCount)
                .incorrectCount(incorrectCount)
                .consecutiveCorrectCount(consecutiveCorrect)
                .totalReviews(totalReviews)
                .retryCount(retryCount)
                .nextReviewDate(nextReviewDate)
                .build();
    }
}
