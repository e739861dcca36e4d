package com.gt.chamlang.progress;

import com.gt.chamlang.model.WordProgress;
import com.gt.chamlang.progress.model.BoxCount;
import com.gt.chamlang.progress.model.LearningStats;
import com.gt.chamlang.util.TestUtils;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.springframework.test.context.junit.jupiter.SpringExtension;

import java.time.LocalDate;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.time.temporal.ChronoUnit;
import java.util.List;

import static com.gt.chamlang.util.TestUtils.TEST_NOW;
import static org.junit.jupiter.api.Assertions.*;

@ExtendWith(SpringExtension.class)
public class LearningStatsCalculatorTests {

    private static final String TEST_LANGUAGE = "ch";
    private static final LocalDate TEST_DAY = LocalDate.of(2024, 3, 10);

    private LearningStatsCalculator learningStatsCalculator;

    @BeforeEach
    public void setup() {
        learningStatsCalculator = new LearningStatsCalculator();
    }

    @Test
    public void testCalculate() {
        List<WordProgress> wordsProgress = List.of(
                TestUtils.reviewedWord("a", 1, 0, TEST_NOW),
                TestUtils.reviewedWord("b", 2, 1, TEST_NOW.plus(6, ChronoUnit.HOURS)),
                TestUtils.reviewedWord("c", 3, 4, TEST_NOW.plus(2, ChronoUnit.DAYS)),
                TestUtils.reviewedWord("d", 5, 20, TEST_NOW.plus(20, ChronoUnit.DAYS)));

        LearningStats stats = learningStatsCalculator.calculate(TEST_LANGUAGE, wordsProgress, 5, TEST_DAY, ZoneOffset.UTC);

        assertEquals(TEST_LANGUAGE, stats.language());
        assertEquals(4, stats.totalWords());
        assertEquals(2, stats.wordsDueToday());
        assertEquals(1, stats.masteredWords());
        assertEquals(1, stats.newWords());
        assertEquals(2, stats.learningWords());
        assertEquals(2.8, stats.averageBox());
        assertEquals(55, stats.masteryPercentage());
        assertEquals(List.of(new BoxCount(1, 1, 25), new BoxCount(2, 1, 25), new BoxCount(3, 1, 25),
                new BoxCount(4, 0, 0), new BoxCount(5, 1, 25)), stats.boxDistribution());
    }

    @Test
    public void testCalculate_NoWords() {
        LearningStats stats = learningStatsCalculator.calculate(TEST_LANGUAGE, List.of(), 3, TEST_DAY, ZoneOffset.UTC);

        assertEquals(0, stats.totalWords());
        assertEquals(0.0, stats.averageBox());
        assertEquals(0, stats.masteryPercentage());
        assertEquals(3, stats.boxDistribution().size());
        assertTrue(stats.boxDistribution().stream().allMatch(boxCount -> boxCount.wordCount() == 0));
    }

    @Test
    public void testGetBoxDistribution_ClampsOutOfRangeBoxes() {
        List<WordProgress> wordsProgress = List.of(
                TestUtils.reviewedWord("a", 7, 30, TEST_NOW),
                TestUtils.reviewedWord("b", 0, 0, TEST_NOW));

        List<BoxCount> distribution = learningStatsCalculator.getBoxDistribution(wordsProgress, 3);

        assertEquals(List.of(new BoxCount(1, 1, 50), new BoxCount(2, 0, 0), new BoxCount(3, 1, 50)), distribution);
    }

    @Test
    public void testIsDueOn_UsesCalendarDayInZone() {
        WordProgress lateEvening = TestUtils.reviewedWord("a", 2, 1, TEST_NOW.plus(11, ChronoUnit.HOURS));

        assertTrue(LearningStatsCalculator.isDueOn(lateEvening, TEST_DAY, ZoneOffset.UTC));
        assertFalse(LearningStatsCalculator.isDueOn(lateEvening, TEST_DAY, ZoneId.of("Pacific/Guam")));
        assertTrue(LearningStatsCalculator.isDueOn(lateEvening, TEST_DAY.plusDays(1), ZoneId.of("Pacific/Guam")));
    }
}
