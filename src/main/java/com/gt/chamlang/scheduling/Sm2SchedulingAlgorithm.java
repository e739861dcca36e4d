package com.gt.chamlang.scheduling;

/**
 * Classic SM-2 interval growth: the interval is multiplied by the updated easiness factor each time a cycle closes
 * and halved on a miss.
 */
public class Sm2SchedulingAlgorithm extends AbstractSchedulingAlgorithm {

    public Sm2SchedulingAlgorithm(int maxBoxes) {
        super(maxBoxes);
    }

    @Override
    protected double easinessAfterCycle(double easinessFactor, int consecutiveCorrectCount) {
        return EasinessFactor.update(easinessFactor, EasinessFactor.qualityAfterCycle(consecutiveCorrectCount));
    }

    @Override
    protected double easinessAfterMiss(double easinessFactor) {
        return EasinessFactor.update(easinessFactor, EasinessFactor.QUALITY_AFTER_MISS);
    }

    @Override
    protected int intervalAfterCycle(int intervalDays, double easinessFactor, int newBox) {
        if (intervalDays == 0) {
            return 1;
        }

        return (int) Math.max(1, Math.round(intervalDays * easinessFactor));
    }

    @Override
    protected int intervalAfterMiss(int intervalDays, double easinessFactor, int newBox) {
        return Math.max(1, intervalDays / 2);
    }
}
