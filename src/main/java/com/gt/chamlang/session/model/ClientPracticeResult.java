package com.gt.chamlang.session.model;

// A result as reported by a client that ran the session itself; the mode is still an unvalidated tag.
public record ClientPracticeResult(String vocabularyId,
                                   String word,
                                   boolean correct,
                                   String mode,
                                   int timeSpentSeconds) { }
