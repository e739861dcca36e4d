package com.gt.chamlang.progress.model;

import java.util.List;

public record LearningStats(String language,
                            int totalWords,
                            int wordsDueToday,
                            int masteredWords,
                            int learningWords,
                            int newWords,
                            double averageBox,
                            int masteryPercentage,
                            List<BoxCount> boxDistribution) { }
