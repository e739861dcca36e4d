package com.gt.chamlang.scheduling;

import com.gt.chamlang.model.AnswerOutcome;
import com.gt.chamlang.model.WordProgress;

public interface SchedulingAlgorithm {

    WordProgress advance(WordProgress wordProgress, AnswerOutcome answerOutcome);
}
