package com.gt.chamlang.model;

import java.time.LocalDate;
import java.util.Map;

public record UserPracticeProgress(String language,
                                   Map<String, WordProgress> wordsProgress,
                                   int totalSessions,
                                   int totalWordsPracticed,
                                   int currentStreak,
                                   int longestStreak,
                                   LocalDate lastPracticeDate) {

    public UserPracticeProgress {
        wordsProgress = wordsProgress == null ? Map.of() : Map.copyOf(wordsProgress);
    }

    public static UserPracticeProgress empty(String language) {
        return new UserPracticeProgress(language, Map.of(), 0, 0, 0, 0, null);
    }

    public UserPracticeProgress withWordsProgress(Map<String, WordProgress> wordsProgress) {
        return new UserPracticeProgress(language, wordsProgress, totalSessions, totalWordsPracticed,
                currentStreak, longestStreak, lastPracticeDate);
    }

    public UserPracticeProgress withCurrentStreak(int currentStreak) {
        return new UserPracticeProgress(language, wordsProgress, totalSessions, totalWordsPracticed,
                currentStreak, longestStreak, lastPracticeDate);
    }
}
