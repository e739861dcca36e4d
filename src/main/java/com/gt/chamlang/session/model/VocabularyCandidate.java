package com.gt.chamlang.session.model;

public record VocabularyCandidate(String vocabularyId, String word) { }
