package com.gt.chamlang.session.model;

import com.gt.chamlang.model.PracticeMode;
import com.gt.chamlang.model.WordProgress;

import java.util.Set;

/**
 * @param remainingModes modes the word still needs a correct answer in before its current cycle closes
 */
public record AnswerResult(WordProgress progress,
                           Set<PracticeMode> remainingModes,
                           String nextVocabularyId,
                           int remaining,
                           boolean deferred,
                           boolean sessionComplete) { }
