package com.gt.chamlang.model;

import java.util.Set;

public record LearningSettings(SrAlgorithm srAlgorithm,
                               int leitnerBoxCount,
                               int newWordsPerSession,
                               int sessionLimit,
                               boolean showFailedWordsInSession) {

    public static final Set<Integer> ALLOWED_BOX_COUNTS = Set.of(3, 5, 7);
}
