package com.gt.chamlang.scheduling;

import com.gt.chamlang.exception.ValidationException;
import com.gt.chamlang.model.AnswerOutcome;
import com.gt.chamlang.model.LearningSettings;
import com.gt.chamlang.model.PracticeMode;
import com.gt.chamlang.model.WordProgress;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.time.Instant;

@Component
public class SchedulingEngine {

    private static final Logger log = LoggerFactory.getLogger(SchedulingEngine.class);

    public WordProgress createInitialWordProgress(String vocabularyId, String word, Instant now) {
        validateVocabularyId(vocabularyId);

        return WordProgress.createInitial(vocabularyId, word, now);
    }

    public WordProgress advance(WordProgress wordProgress, AnswerOutcome answerOutcome, LearningSettings learningSettings) {
        return advance(wordProgress, answerOutcome,
                SchedulingAlgorithmFactory.create(learningSettings.srAlgorithm(), learningSettings.leitnerBoxCount()));
    }

    public WordProgress advance(WordProgress wordProgress, AnswerOutcome answerOutcome, SchedulingAlgorithm schedulingAlgorithm) {
        if (wordProgress == null) {
            throw new ValidationException("Word progress is required");
        }
        validateVocabularyId(wordProgress.vocabularyId());
        if (answerOutcome == null || answerOutcome.mode() == null) {
            throw new ValidationException("Practice mode is required for " + wordProgress.vocabularyId());
        }
        if (answerOutcome.answeredAt() == null) {
            throw new ValidationException("Answer time is required for " + wordProgress.vocabularyId());
        }

        WordProgress updated = schedulingAlgorithm.advance(wordProgress, answerOutcome);

        log.debug("Advanced {} ({}): box {} -> {}, interval {} -> {}", updated.vocabularyId(),
                answerOutcome.correct() ? "correct" : "incorrect", wordProgress.leitnerBox(), updated.leitnerBox(),
                wordProgress.intervalDays(), updated.intervalDays());

        return updated;
    }

    public static PracticeMode toPracticeMode(String modeTag) {
        PracticeMode practiceMode = PracticeMode.fromTag(modeTag);
        if (practiceMode == null) {
            throw new ValidationException("Unrecognized practice mode: " + modeTag);
        }

        return practiceMode;
    }

    private static void validateVocabularyId(String vocabularyId) {
        if (vocabularyId == null || vocabularyId.isBlank()) {
            throw new ValidationException("Vocabulary id is required");
        }
    }
}
