package com.gt.chamlang.scheduling;

import com.gt.chamlang.model.WordProgress;

/**
 * SM-2 easiness factor arithmetic.
 */
public final class EasinessFactor {

    public static final double MIN = 1.3;
    public static final double MAX = WordProgress.DEFAULT_EASINESS_FACTOR;

    public static final int QUALITY_AFTER_MISS = 2;

    private static final int MAX_QUALITY = 5;
    private static final int BASE_CYCLE_QUALITY = 3;
    private static final int CORRECT_ANSWERS_PER_QUALITY_STEP = 3;

    private EasinessFactor() { }

    public static double update(double easinessFactor, int quality) {
        int qualityGap = MAX_QUALITY - quality;
        return clamp(easinessFactor + (0.1 - qualityGap * (0.08 + qualityGap * 0.02)));
    }

    public static double clamp(double easinessFactor) {
        if (Double.isNaN(easinessFactor)) {
            return MAX;
        }

        return Math.max(MIN, Math.min(MAX, easinessFactor));
    }

    // A clean pass through every mode gives 4, a second consecutive clean pass gives 5.
    public static int qualityAfterCycle(int consecutiveCorrectCount) {
        return Math.min(MAX_QUALITY, BASE_CYCLE_QUALITY + consecutiveCorrectCount / CORRECT_ANSWERS_PER_QUALITY_STEP);
    }
}
