package com.gt.chamlang.model;

import java.time.Duration;
import java.time.Instant;
import java.util.List;

/**
 * A finished practice session. {@code mode} is null for mixed-mode sessions. Results are kept in answer order and
 * a word answered more than once appears more than once.
 */
public record PracticeSession(String id,
                              String collectionId,
                              PracticeMode mode,
                              String language,
                              String topic,
                              String level,
                              List<PracticeResult> results,
                              int totalQuestions,
                              int correctAnswers,
                              Instant startedAt,
                              Instant completedAt,
                              long durationSeconds) {

    public PracticeSession {
        results = results == null ? List.of() : List.copyOf(results);
    }

    public static PracticeSession completed(String id, String collectionId, PracticeMode mode, String language,
                                            String topic, String level, List<PracticeResult> results,
                                            Instant startedAt, Instant completedAt) {
        int correctAnswers = (int) results.stream().filter(PracticeResult::correct).count();
        long durationSeconds = Math.max(0, Duration.between(startedAt, completedAt).getSeconds());

        return new PracticeSession(id, collectionId, mode, language, topic, level, results, results.size(),
                correctAnswers, startedAt, completedAt, durationSeconds);
    }
}
