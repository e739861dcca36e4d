package com.gt.chamlang.progress;

import com.gt.chamlang.model.*;
import com.gt.chamlang.util.TestUtils;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.springframework.test.context.junit.jupiter.SpringExtension;

import java.time.LocalDate;
import java.time.temporal.ChronoUnit;
import java.util.Arrays;
import java.util.List;
import java.util.Map;

import static com.gt.chamlang.util.TestUtils.TEST_NOW;
import static org.junit.jupiter.api.Assertions.*;

@ExtendWith(SpringExtension.class)
public class StatsAggregatorTests {

    private static final String TEST_LANGUAGE = "ch";
    private static final LocalDate TEST_DAY = LocalDate.of(2024, 3, 10);

    private StatsAggregator statsAggregator;

    @BeforeEach
    public void setup() {
        statsAggregator = new StatsAggregator();
    }

    @Test
    public void testApplySession_FirstSession() {
        UserPracticeProgress updated = statsAggregator.applySession(UserPracticeProgress.empty(TEST_LANGUAGE),
                session("a", "b"), TEST_DAY);

        assertEquals(1, updated.totalSessions());
        assertEquals(2, updated.totalWordsPracticed());
        assertEquals(1, updated.currentStreak());
        assertEquals(1, updated.longestStreak());
        assertEquals(TEST_DAY, updated.lastPracticeDate());
    }

    @Test
    public void testApplySession_StreakAcrossDays() {
        UserPracticeProgress aggregate = UserPracticeProgress.empty(TEST_LANGUAGE);

        aggregate = statsAggregator.applySession(aggregate, session("a"), TEST_DAY);
        aggregate = statsAggregator.applySession(aggregate, session("a"), TEST_DAY);
        assertEquals(1, aggregate.currentStreak());
        assertEquals(2, aggregate.totalSessions());

        aggregate = statsAggregator.applySession(aggregate, session("a"), TEST_DAY.plusDays(1));
        assertEquals(2, aggregate.currentStreak());
        assertEquals(2, aggregate.longestStreak());

        aggregate = statsAggregator.applySession(aggregate, session("a"), TEST_DAY.plusDays(4));
        assertEquals(1, aggregate.currentStreak());
        assertEquals(2, aggregate.longestStreak());
        assertEquals(TEST_DAY.plusDays(4), aggregate.lastPracticeDate());
    }

    @Test
    public void testApplySession_EarlierDayKeepsStreakAndDate() {
        UserPracticeProgress aggregate = new UserPracticeProgress(TEST_LANGUAGE, Map.of(), 6, 30, 4, 9, TEST_DAY);

        UserPracticeProgress updated = statsAggregator.applySession(aggregate, session("a"), TEST_DAY.minusDays(1));

        assertEquals(4, updated.currentStreak());
        assertEquals(9, updated.longestStreak());
        assertEquals(TEST_DAY, updated.lastPracticeDate());
        assertEquals(7, updated.totalSessions());
    }

    @Test
    public void testApplySession_CountsOnlyNewlyPracticedWords() {
        Map<String, WordProgress> wordsProgress = Map.of(
                "seen", TestUtils.dueWord("seen", 1),
                "fresh", WordProgress.createInitial("fresh", "fresh", TEST_NOW));
        UserPracticeProgress aggregate = new UserPracticeProgress(TEST_LANGUAGE, wordsProgress, 3, 12, 1, 1, TEST_DAY.minusDays(1));

        UserPracticeProgress updated = statsAggregator.applySession(aggregate, session("seen", "fresh", "unknown", "fresh"), TEST_DAY);

        assertEquals(14, updated.totalWordsPracticed());
        assertEquals(2, updated.currentStreak());
        assertEquals(wordsProgress, updated.wordsProgress());
    }

    @Test
    public void testEffectiveStreak() {
        UserPracticeProgress aggregate = new UserPracticeProgress(TEST_LANGUAGE, Map.of(), 6, 30, 4, 9, TEST_DAY);

        assertEquals(4, statsAggregator.effectiveStreak(aggregate, TEST_DAY));
        assertEquals(4, statsAggregator.effectiveStreak(aggregate, TEST_DAY.plusDays(1)));
        assertEquals(0, statsAggregator.effectiveStreak(aggregate, TEST_DAY.plusDays(2)));
        assertEquals(0, statsAggregator.effectiveStreak(UserPracticeProgress.empty(TEST_LANGUAGE), TEST_DAY));
    }

    private static PracticeSession session(String... vocabularyIds) {
        List<PracticeResult> results = Arrays.stream(vocabularyIds)
                .map(vocabularyId -> new PracticeResult(vocabularyId, vocabularyId, true, PracticeMode.Flashcard, 3))
                .toList();

        return PracticeSession.completed("session-1", null, PracticeMode.Flashcard, TEST_LANGUAGE, null, null, results,
                TEST_NOW.minus(5, ChronoUnit.MINUTES), TEST_NOW);
    }
}
