package com.gt.chamlang.model;

public record PracticeResult(String vocabularyId,
                             String word,
                             boolean correct,
                             PracticeMode mode,
                             int timeSpentSeconds) { }
