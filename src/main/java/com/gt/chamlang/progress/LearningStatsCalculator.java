package com.gt.chamlang.progress;

import com.gt.chamlang.model.WordProgress;
import com.gt.chamlang.progress.model.BoxCount;
import com.gt.chamlang.progress.model.LearningStats;
import org.springframework.stereotype.Component;

import java.time.LocalDate;
import java.time.ZoneId;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;

@Component
public class LearningStatsCalculator {

    public LearningStats calculate(String language, Collection<WordProgress> wordsProgress, int leitnerBoxCount,
                                   LocalDate today, ZoneId zoneId) {
        int totalWords = wordsProgress.size();
        int wordsDueToday = 0;
        int masteredWords = 0;
        int newWords = 0;
        long sumOfBoxes = 0;

        for (WordProgress wordProgress : wordsProgress) {
            if (isDueOn(wordProgress, today, zoneId)) {
                wordsDueToday++;
            }
            if (wordProgress.leitnerBox() >= leitnerBoxCount) {
                masteredWords++;
            } else if (wordProgress.leitnerBox() <= 1) {
                newWords++;
            }
            sumOfBoxes += wordProgress.leitnerBox();
        }

        double averageBox = totalWords > 0 ? Math.round((double) sumOfBoxes / totalWords * 10) / 10.0 : 0;
        int masteryPercentage = totalWords > 0
                ? (int) Math.round((double) sumOfBoxes / ((long) totalWords * leitnerBoxCount) * 100)
                : 0;

        return new LearningStats(
                language,
                totalWords,
                wordsDueToday,
                masteredWords,
                totalWords - masteredWords - newWords,
                newWords,
                averageBox,
                masteryPercentage,
                getBoxDistribution(wordsProgress, leitnerBoxCount));
    }

    public List<BoxCount> getBoxDistribution(Collection<WordProgress> wordsProgress, int leitnerBoxCount) {
        int[] counts = new int[leitnerBoxCount + 1];
        for (WordProgress wordProgress : wordsProgress) {
            int box = Math.max(1, Math.min(leitnerBoxCount, wordProgress.leitnerBox()));
            counts[box]++;
        }

        int total = wordsProgress.size();
        List<BoxCount> distribution = new ArrayList<>();
        for (int boxNumber = 1; boxNumber <= leitnerBoxCount; boxNumber++) {
            int percentage = total > 0 ? (int) Math.round((double) counts[boxNumber] / total * 100) : 0;
            distribution.add(new BoxCount(boxNumber, counts[boxNumber], percentage));
        }

        return distribution;
    }

    // Due today means scheduled for any time up to the end of the current calendar day.
    public static boolean isDueOn(WordProgress wordProgress, LocalDate day, ZoneId zoneId) {
        if (wordProgress.nextReviewDate() == null) {
            return true;
        }

        return !LocalDate.ofInstant(wordProgress.nextReviewDate(), zoneId).isAfter(day);
    }
}
