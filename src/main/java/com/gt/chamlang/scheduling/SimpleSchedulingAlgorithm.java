package com.gt.chamlang.scheduling;

/**
 * Leitner-only scheduling. Intervals double on every closed cycle and drop back to one day on a miss; the easiness
 * factor is left alone.
 */
public class SimpleSchedulingAlgorithm extends AbstractSchedulingAlgorithm {

    static final int MAX_SIMPLE_INTERVAL_DAYS = 120;

    public SimpleSchedulingAlgorithm(int maxBoxes) {
        super(maxBoxes);
    }

    @Override
    protected double easinessAfterCycle(double easinessFactor, int consecutiveCorrectCount) {
        return easinessFactor;
    }

    @Override
    protected double easinessAfterMiss(double easinessFactor) {
        return easinessFactor;
    }

    @Override
    protected int intervalAfterCycle(int intervalDays, double easinessFactor, int newBox) {
        if (intervalDays == 0) {
            return 1;
        }

        return Math.min(intervalDays * 2, MAX_SIMPLE_INTERVAL_DAYS);
    }

    @Override
    protected int intervalAfterMiss(int intervalDays, double easinessFactor, int newBox) {
        return 1;
    }
}
