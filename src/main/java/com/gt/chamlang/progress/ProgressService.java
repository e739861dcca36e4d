package com.gt.chamlang.progress;

import com.gt.chamlang.exception.ValidationException;
import com.gt.chamlang.model.LearningSettings;
import com.gt.chamlang.model.UserPracticeProgress;
import com.gt.chamlang.model.WordProgress;
import com.gt.chamlang.model.WordStatus;
import com.gt.chamlang.progress.model.LearningStats;
import com.gt.chamlang.progress.model.WordProgressView;
import com.gt.chamlang.scheduling.AbstractSchedulingAlgorithm;
import com.gt.chamlang.settings.LearningSettingsService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.util.*;
import java.util.function.Function;
import java.util.stream.Collectors;

@Component
public class ProgressService {

    private static final Logger log = LoggerFactory.getLogger(ProgressService.class);

    private final WordProgressDao wordProgressDao;
    private final UserPracticeProgressDao userPracticeProgressDao;
    private final StatsAggregator statsAggregator;
    private final LearningStatsCalculator learningStatsCalculator;
    private final LearningSettingsService learningSettingsService;
    private final Clock clock;

    @Autowired
    public ProgressService(WordProgressDao wordProgressDao,
                           UserPracticeProgressDao userPracticeProgressDao,
                           StatsAggregator statsAggregator,
                           LearningStatsCalculator learningStatsCalculator,
                           LearningSettingsService learningSettingsService,
                           Clock clock) {
        this.wordProgressDao = wordProgressDao;
        this.userPracticeProgressDao = userPracticeProgressDao;
        this.statsAggregator = statsAggregator;
        this.learningStatsCalculator = learningStatsCalculator;
        this.learningSettingsService = learningSettingsService;
        this.clock = clock;
    }

    // Full aggregate including every word's progress, with the stored streak as recorded.
    public UserPracticeProgress loadPracticeProgress(String language) {
        validateLanguage(language);

        Map<String, WordProgress> wordsProgress = wordProgressDao.loadWordProgress(language)
                .stream()
                .collect(Collectors.toMap(WordProgress::vocabularyId, Function.identity(), (first, second) -> second));

        return userPracticeProgressDao.loadPracticeProgress(language)
                .orElse(UserPracticeProgress.empty(language))
                .withWordsProgress(wordsProgress);
    }

    /**
     * Aggregate for display. The streak is reported as zero once a full calendar day has passed without practice,
     * although the stored value is only reset by the next completed session.
     */
    public UserPracticeProgress getPracticeProgress(String language) {
        UserPracticeProgress practiceProgress = loadPracticeProgress(language);

        return practiceProgress.withCurrentStreak(statsAggregator.effectiveStreak(practiceProgress, today()));
    }

    public List<WordProgressView> getWordProgress(String language, Collection<String> vocabularyIds) {
        validateLanguage(language);
        Instant now = clock.instant();

        List<WordProgress> wordsProgress = vocabularyIds == null || vocabularyIds.isEmpty()
                ? wordProgressDao.loadWordProgress(language)
                : wordProgressDao.loadWordProgressBatch(language, vocabularyIds);

        return wordsProgress.stream()
                .map(wordProgress -> new WordProgressView(wordProgress, WordStatus.of(wordProgress), wordProgress.isDue(now)))
                .toList();
    }

    /**
     * Stores progress computed by a client. The record is written as given apart from {@code masteryLevel}, which is
     * derived from the answer counts.
     */
    public WordProgressView saveWordProgress(String language, WordProgress wordProgress) {
        validateLanguage(language);
        if (wordProgress == null || wordProgress.vocabularyId() == null || wordProgress.vocabularyId().isBlank()) {
            throw new ValidationException("Vocabulary id is required");
        }

        WordProgress toSave = wordProgress.toBuilder()
                .masteryLevel(AbstractSchedulingAlgorithm.calculateMasteryLevel(wordProgress.correctCount(), wordProgress.incorrectCount()))
                .build()
                .withSessionStateCleared();

        wordProgressDao.saveWordProgress(language, toSave);
        log.debug("Saved client progress for {} in {}", toSave.vocabularyId(), language);

        return new WordProgressView(toSave, WordStatus.of(toSave), toSave.isDue(clock.instant()));
    }

    public LearningStats getLearningStats(String language) {
        validateLanguage(language);
        LearningSettings settings = learningSettingsService.getLearningSettings();

        return learningStatsCalculator.calculate(language, wordProgressDao.loadWordProgress(language),
                settings.leitnerBoxCount(), today(), clock.getZone());
    }

    public int getDueCount(String language) {
        validateLanguage(language);
        Instant now = clock.instant();

        return (int) wordProgressDao.loadWordProgress(language)
                .stream()
                .filter(wordProgress -> wordProgress.isDue(now))
                .count();
    }

    // Earliest scheduled review for the language, for callers that schedule reminders.
    public Optional<Instant> getNextDueDate(String language) {
        validateLanguage(language);

        return wordProgressDao.loadWordProgress(language)
                .stream()
                .map(WordProgress::nextReviewDate)
                .filter(Objects::nonNull)
                .min(Comparator.naturalOrder());
    }

    private LocalDate today() {
        return LocalDate.ofInstant(clock.instant(), clock.getZone());
    }

    private static void validateLanguage(String language) {
        if (language == null || language.isBlank()) {
            throw new ValidationException("Language is required");
        }
    }
}
