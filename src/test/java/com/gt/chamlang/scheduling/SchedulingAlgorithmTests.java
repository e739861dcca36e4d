package com.gt.chamlang.scheduling;

import com.gt.chamlang.model.PracticeMode;
import com.gt.chamlang.model.SrAlgorithm;
import com.gt.chamlang.model.WordProgress;
import com.gt.chamlang.util.TestUtils;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.springframework.test.context.junit.jupiter.SpringExtension;

import java.time.temporal.ChronoUnit;

import static com.gt.chamlang.util.TestUtils.TEST_NOW;
import static org.junit.jupiter.api.Assertions.*;

@ExtendWith(SpringExtension.class)
public class SchedulingAlgorithmTests {

    private static final String VOCABULARY_ID = "vocab-1";

    @Test
    public void testFactory() {
        assertInstanceOf(Sm2SchedulingAlgorithm.class, SchedulingAlgorithmFactory.create(SrAlgorithm.Sm2, 5));
        assertInstanceOf(ModifiedSm2SchedulingAlgorithm.class, SchedulingAlgorithmFactory.create(SrAlgorithm.ModifiedSm2, 5));
        assertInstanceOf(SimpleSchedulingAlgorithm.class, SchedulingAlgorithmFactory.create(SrAlgorithm.Simple, 5));
        assertInstanceOf(Sm2SchedulingAlgorithm.class, SchedulingAlgorithmFactory.create(null, 5));
    }

    @Test
    public void testSm2_IntervalGrowth() {
        SchedulingAlgorithm algorithm = new Sm2SchedulingAlgorithm(5);
        WordProgress progress = WordProgress.createInitial(VOCABULARY_ID, "word", TEST_NOW);

        progress = completeCycle(algorithm, progress);
        assertEquals(1, progress.intervalDays());
        assertEquals(0, progress.lastIntervalDays());
        assertEquals(2.5, progress.easinessFactor(), 1e-9);

        progress = completeCycle(algorithm, progress);
        assertEquals(3, progress.intervalDays());
        assertEquals(1, progress.lastIntervalDays());

        progress = completeCycle(algorithm, progress);
        assertEquals(8, progress.intervalDays());
        assertEquals(4, progress.leitnerBox());
    }

    @Test
    public void testSm2_IntervalUsesUpdatedEasinessFactor() {
        SchedulingAlgorithm algorithm = new Sm2SchedulingAlgorithm(5);
        WordProgress progress = TestUtils.reviewedWord(VOCABULARY_ID, 2, 10, TEST_NOW)
                .toBuilder()
                .easinessFactor(2.0)
                .build();

        progress = completeCycle(algorithm, progress);

        // first clean cycle grades 4, which leaves the factor unchanged
        assertEquals(2.0, progress.easinessFactor(), 1e-9);
        assertEquals(20, progress.intervalDays());
        assertEquals(TEST_NOW.plus(20, ChronoUnit.DAYS), progress.nextReviewDate());
    }

    @Test
    public void testSm2_MissHalvesInterval() {
        SchedulingAlgorithm algorithm = new Sm2SchedulingAlgorithm(5);

        assertEquals(4, algorithm.advance(TestUtils.reviewedWord(VOCABULARY_ID, 3, 9, TEST_NOW), TestUtils.incorrect(PracticeMode.Flashcard)).intervalDays());
        assertEquals(1, algorithm.advance(TestUtils.reviewedWord(VOCABULARY_ID, 3, 1, TEST_NOW), TestUtils.incorrect(PracticeMode.Flashcard)).intervalDays());
        assertEquals(1, algorithm.advance(TestUtils.reviewedWord(VOCABULARY_ID, 3, 0, TEST_NOW), TestUtils.incorrect(PracticeMode.Flashcard)).intervalDays());
    }

    @Test
    public void testModifiedSm2_BoxPresets() {
        SchedulingAlgorithm fiveBoxes = new ModifiedSm2SchedulingAlgorithm(5);
        WordProgress progress = WordProgress.createInitial(VOCABULARY_ID, "word", TEST_NOW);

        int[] expectedIntervals = {3, 7, 14, 30, 30};
        for (int expectedInterval : expectedIntervals) {
            progress = completeCycle(fiveBoxes, progress);
            assertEquals(expectedInterval, progress.intervalDays());
        }
        assertEquals(5, progress.leitnerBox());

        progress = fiveBoxes.advance(progress, TestUtils.incorrect(PracticeMode.FillWord));
        assertEquals(4, progress.leitnerBox());
        assertEquals(14, progress.intervalDays());
        assertTrue(progress.easinessFactor() < 2.5);
    }

    @Test
    public void testModifiedSm2_OtherBoxCounts() {
        WordProgress progress = WordProgress.createInitial(VOCABULARY_ID, "word", TEST_NOW);

        assertEquals(7, completeCycle(new ModifiedSm2SchedulingAlgorithm(3), progress).intervalDays());
        assertEquals(2, completeCycle(new ModifiedSm2SchedulingAlgorithm(7), progress).intervalDays());

        WordProgress boxTwo = TestUtils.reviewedWord(VOCABULARY_ID, 2, 7, TEST_NOW);
        assertEquals(1, new ModifiedSm2SchedulingAlgorithm(3).advance(boxTwo, TestUtils.incorrect(PracticeMode.Flashcard)).intervalDays());
    }

    @Test
    public void testModifiedSm2_UnsupportedBoxCountFallsBackToFiveBoxPresets() {
        ModifiedSm2SchedulingAlgorithm algorithm = new ModifiedSm2SchedulingAlgorithm(4);

        assertEquals(1, algorithm.intervalForBox(1));
        assertEquals(14, algorithm.intervalForBox(4));
        assertEquals(30, algorithm.intervalForBox(9));
    }

    @Test
    public void testSimple_DoublingAndCap() {
        SchedulingAlgorithm algorithm = new SimpleSchedulingAlgorithm(7);
        WordProgress progress = WordProgress.createInitial(VOCABULARY_ID, "word", TEST_NOW);

        progress = completeCycle(algorithm, progress);
        assertEquals(1, progress.intervalDays());
        progress = completeCycle(algorithm, progress);
        assertEquals(2, progress.intervalDays());
        progress = completeCycle(algorithm, progress);
        assertEquals(4, progress.intervalDays());

        WordProgress longInterval = TestUtils.reviewedWord(VOCABULARY_ID, 6, 100, TEST_NOW);
        assertEquals(120, completeCycle(algorithm, longInterval).intervalDays());
    }

    @Test
    public void testSimple_MissResetsIntervalAndKeepsEasiness() {
        SchedulingAlgorithm algorithm = new SimpleSchedulingAlgorithm(5);
        WordProgress progress = TestUtils.reviewedWord(VOCABULARY_ID, 4, 16, TEST_NOW);

        WordProgress updated = algorithm.advance(progress, TestUtils.incorrect(PracticeMode.MultipleChoice));

        assertEquals(1, updated.intervalDays());
        assertEquals(16, updated.lastIntervalDays());
        assertEquals(3, updated.leitnerBox());
        assertEquals(2.5, updated.easinessFactor(), 1e-9);
    }

    private static WordProgress completeCycle(SchedulingAlgorithm algorithm, WordProgress progress) {
        WordProgress updated = progress;
        for (PracticeMode mode : PracticeMode.values()) {
            updated = algorithm.advance(updated, TestUtils.correct(mode));
        }

        return updated;
    }
}
