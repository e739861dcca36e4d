package com.gt.chamlang.progress;

import com.gt.chamlang.model.PracticeResult;
import com.gt.chamlang.model.PracticeSession;
import com.gt.chamlang.model.UserPracticeProgress;
import com.gt.chamlang.model.WordProgress;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.time.LocalDate;
import java.util.LinkedHashSet;
import java.util.Set;

/**
 * Folds completed sessions into the per-language totals and practice streak.
 */
@Component
public class StatsAggregator {

    private static final Logger log = LoggerFactory.getLogger(StatsAggregator.class);

    /**
     * @param aggregate the aggregate before the session, with {@code wordsProgress} as it was when the session began
     * @param today the calendar day the session completed on, in the configured stats zone
     */
    public UserPracticeProgress applySession(UserPracticeProgress aggregate, PracticeSession session, LocalDate today) {
        int newlyPracticed = countNewlyPracticedWords(aggregate, session);
        int currentStreak = nextStreak(aggregate.currentStreak(), aggregate.lastPracticeDate(), today);
        LocalDate lastPracticeDate = aggregate.lastPracticeDate() != null && aggregate.lastPracticeDate().isAfter(today)
                ? aggregate.lastPracticeDate()
                : today;

        log.debug("Applying session {} for {}: {} new words, streak {} -> {}", session.id(), aggregate.language(),
                newlyPracticed, aggregate.currentStreak(), currentStreak);

        return new UserPracticeProgress(
                aggregate.language(),
                aggregate.wordsProgress(),
                aggregate.totalSessions() + 1,
                aggregate.totalWordsPracticed() + newlyPracticed,
                currentStreak,
                Math.max(aggregate.longestStreak(), currentStreak),
                lastPracticeDate);
    }

    public int effectiveStreak(UserPracticeProgress aggregate, LocalDate today) {
        LocalDate lastPracticeDate = aggregate.lastPracticeDate();
        if (lastPracticeDate == null) {
            return 0;
        }

        if (!lastPracticeDate.isBefore(today.minusDays(1))) {
            return aggregate.currentStreak();
        }

        return 0;
    }

    private static int countNewlyPracticedWords(UserPracticeProgress aggregate, PracticeSession session) {
        Set<String> sessionVocabularyIds = new LinkedHashSet<>();
        for (PracticeResult result : session.results()) {
            if (result.vocabularyId() != null) {
                sessionVocabularyIds.add(result.vocabularyId());
            }
        }

        int newlyPracticed = 0;
        for (String vocabularyId : sessionVocabularyIds) {
            WordProgress previous = aggregate.wordsProgress().get(vocabularyId);
            if (previous == null || previous.isNew()) {
                newlyPracticed++;
            }
        }

        return newlyPracticed;
    }

    private static int nextStreak(int currentStreak, LocalDate lastPracticeDate, LocalDate today) {
        if (lastPracticeDate == null || currentStreak <= 0) {
            return 1;
        }

        if (today.equals(lastPracticeDate.plusDays(1))) {
            return currentStreak + 1;
        } else if (!today.isAfter(lastPracticeDate)) {
            // Same day, or a clock that moved backwards across a zone change
            return currentStreak;
        }

        return 1;
    }
}
