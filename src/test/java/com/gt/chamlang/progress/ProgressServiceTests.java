package com.gt.chamlang.progress;

import com.gt.chamlang.exception.ValidationException;
import com.gt.chamlang.model.LearningSettings;
import com.gt.chamlang.model.PracticeMode;
import com.gt.chamlang.model.SrAlgorithm;
import com.gt.chamlang.model.UserPracticeProgress;
import com.gt.chamlang.model.WordProgress;
import com.gt.chamlang.model.WordStatus;
import com.gt.chamlang.progress.model.LearningStats;
import com.gt.chamlang.progress.model.WordProgressView;
import com.gt.chamlang.scheduling.AbstractSchedulingAlgorithm;
import com.gt.chamlang.settings.LearningSettingsService;
import com.gt.chamlang.util.TestUtils;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.springframework.test.context.junit.jupiter.SpringExtension;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.time.temporal.ChronoUnit;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

import static com.gt.chamlang.util.TestUtils.TEST_NOW;
import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

@ExtendWith(SpringExtension.class)
public class ProgressServiceTests {

    private static final String TEST_LANGUAGE = "ch";
    private static final LocalDate TEST_DAY = LocalDate.of(2024, 3, 10);

    private static final WordProgress DUE_WORD = TestUtils.dueWord("a", 2);
    private static final WordProgress NOT_DUE_WORD = TestUtils.notDueWord("b", 3);
    private static final WordProgress MASTERED_WORD = TestUtils.reviewedWord("c", 5, 30, TEST_NOW.plus(30, ChronoUnit.DAYS));

    @Mock private WordProgressDao wordProgressDao;
    @Mock private UserPracticeProgressDao userPracticeProgressDao;
    @Mock private LearningSettingsService learningSettingsService;

    private ProgressService progressService;

    @BeforeEach
    public void setup() {
        progressService = new ProgressService(wordProgressDao, userPracticeProgressDao, new StatsAggregator(),
                new LearningStatsCalculator(), learningSettingsService, Clock.fixed(TEST_NOW, ZoneOffset.UTC));

        when(wordProgressDao.loadWordProgress(TEST_LANGUAGE)).thenReturn(List.of(DUE_WORD, NOT_DUE_WORD, MASTERED_WORD));
    }

    @Test
    public void testLoadPracticeProgress() {
        when(userPracticeProgressDao.loadPracticeProgress(TEST_LANGUAGE)).thenReturn(Optional.of(
                new UserPracticeProgress(TEST_LANGUAGE, Map.of(), 12, 40, 5, 8, TEST_DAY.minusDays(3))));

        UserPracticeProgress practiceProgress = progressService.loadPracticeProgress(TEST_LANGUAGE);

        assertEquals(12, practiceProgress.totalSessions());
        assertEquals(5, practiceProgress.currentStreak());
        assertEquals(3, practiceProgress.wordsProgress().size());
        assertEquals(DUE_WORD, practiceProgress.wordsProgress().get("a"));
    }

    @Test
    public void testGetPracticeProgress_StaleStreakReportedAsZero() {
        when(userPracticeProgressDao.loadPracticeProgress(TEST_LANGUAGE)).thenReturn(Optional.of(
                new UserPracticeProgress(TEST_LANGUAGE, Map.of(), 12, 40, 5, 8, TEST_DAY.minusDays(3))));

        UserPracticeProgress practiceProgress = progressService.getPracticeProgress(TEST_LANGUAGE);

        assertEquals(0, practiceProgress.currentStreak());
        assertEquals(8, practiceProgress.longestStreak());
        assertEquals(TEST_DAY.minusDays(3), practiceProgress.lastPracticeDate());
        verify(userPracticeProgressDao, never()).savePracticeProgress(any());
    }

    @Test
    public void testGetPracticeProgress_NoStoredAggregate() {
        UserPracticeProgress practiceProgress = progressService.getPracticeProgress(TEST_LANGUAGE);

        assertEquals(TEST_LANGUAGE, practiceProgress.language());
        assertEquals(0, practiceProgress.totalSessions());
        assertEquals(0, practiceProgress.currentStreak());
        assertNull(practiceProgress.lastPracticeDate());
        assertEquals(3, practiceProgress.wordsProgress().size());
    }

    @Test
    public void testGetWordProgress() {
        List<WordProgressView> views = progressService.getWordProgress(TEST_LANGUAGE, null);

        assertEquals(3, views.size());
        assertEquals(new WordProgressView(DUE_WORD, WordStatus.StillLearning, true), views.get(0));
        assertEquals(new WordProgressView(NOT_DUE_WORD, WordStatus.StillLearning, false), views.get(1));
        assertEquals(new WordProgressView(MASTERED_WORD, WordStatus.Mastered, false), views.get(2));
        verify(wordProgressDao, never()).loadWordProgressBatch(any(), any());
    }

    @Test
    public void testGetWordProgress_ForIds() {
        when(wordProgressDao.loadWordProgressBatch(TEST_LANGUAGE, List.of("a"))).thenReturn(List.of(DUE_WORD));

        List<WordProgressView> views = progressService.getWordProgress(TEST_LANGUAGE, List.of("a"));

        assertEquals(1, views.size());
        assertEquals(DUE_WORD, views.get(0).progress());
        verify(wordProgressDao, never()).loadWordProgress(any());
    }

    @Test
    public void testGetLearningStats_UsesConfiguredBoxCount() {
        when(learningSettingsService.getLearningSettings()).thenReturn(new LearningSettings(SrAlgorithm.Sm2, 7, 20, 100, true));

        LearningStats stats = progressService.getLearningStats(TEST_LANGUAGE);

        assertEquals(3, stats.totalWords());
        assertEquals(1, stats.wordsDueToday());
        assertEquals(0, stats.masteredWords());
        assertEquals(7, stats.boxDistribution().size());
    }

    @Test
    public void testGetDueCountAndNextDueDate() {
        assertEquals(1, progressService.getDueCount(TEST_LANGUAGE));
        assertEquals(Optional.of(DUE_WORD.nextReviewDate()), progressService.getNextDueDate(TEST_LANGUAGE));

        when(wordProgressDao.loadWordProgress("es")).thenReturn(List.of());
        assertEquals(0, progressService.getDueCount("es"));
        assertEquals(Optional.<Instant>empty(), progressService.getNextDueDate("es"));
    }

    @Test
    public void testSaveWordProgress() {
        WordProgress clientProgress = DUE_WORD.toBuilder()
                .masteryLevel(0)
                .failedInSession(true)
                .retryCount(2)
                .completedModesInCycle(Set.of(PracticeMode.Flashcard))
                .build();

        WordProgressView view = progressService.saveWordProgress(TEST_LANGUAGE, clientProgress);

        ArgumentCaptor<WordProgress> wordProgressCaptor = ArgumentCaptor.forClass(WordProgress.class);
        verify(wordProgressDao, times(1)).saveWordProgress(eq(TEST_LANGUAGE), wordProgressCaptor.capture());

        WordProgress saved = wordProgressCaptor.getValue();
        assertEquals(AbstractSchedulingAlgorithm.calculateMasteryLevel(3, 1), saved.masteryLevel());
        assertFalse(saved.failedInSession());
        assertEquals(0, saved.retryCount());
        assertEquals(Set.of(PracticeMode.Flashcard), saved.completedModesInCycle());
        assertEquals(DUE_WORD.nextReviewDate(), saved.nextReviewDate());
        assertEquals(DUE_WORD.easinessFactor(), saved.easinessFactor());
        assertEquals(saved, view.progress());
        assertTrue(view.due());
    }

    @Test
    public void testSaveWordProgress_MissingVocabularyId() {
        WordProgress noId = DUE_WORD.toBuilder().vocabularyId(" ").build();

        assertThrows(ValidationException.class, () -> progressService.saveWordProgress(TEST_LANGUAGE, noId));
        assertThrows(ValidationException.class, () -> progressService.saveWordProgress(TEST_LANGUAGE, null));

        verify(wordProgressDao, never()).saveWordProgress(any(), any());
    }

    @Test
    public void testBlankLanguageRejected() {
        assertThrows(ValidationException.class, () -> progressService.getPracticeProgress(""));
        assertThrows(ValidationException.class, () -> progressService.getLearningStats(null));
        assertThrows(ValidationException.class, () -> progressService.saveWordProgress(" ", DUE_WORD));

        verifyNoInteractions(wordProgressDao);
    }
}
