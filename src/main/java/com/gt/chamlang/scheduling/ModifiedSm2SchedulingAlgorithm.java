package com.gt.chamlang.scheduling;

import java.util.Map;

/**
 * Fixed interval per Leitner box. The easiness factor is still maintained so that switching back to SM-2 starts from
 * a meaningful value.
 */
public class ModifiedSm2SchedulingAlgorithm extends Sm2SchedulingAlgorithm {

    static final Map<Integer, int[]> BOX_INTERVAL_PRESETS = Map.of(
            3, new int[] {1, 7, 30},
            5, new int[] {1, 3, 7, 14, 30},
            7, new int[] {1, 2, 4, 7, 14, 30, 60});

    private static final int DEFAULT_PRESET_BOX_COUNT = 5;

    private final int[] boxIntervals;

    public ModifiedSm2SchedulingAlgorithm(int maxBoxes) {
        super(maxBoxes);

        this.boxIntervals = BOX_INTERVAL_PRESETS.getOrDefault(maxBoxes, BOX_INTERVAL_PRESETS.get(DEFAULT_PRESET_BOX_COUNT));
    }

    @Override
    protected int intervalAfterCycle(int intervalDays, double easinessFactor, int newBox) {
        return intervalForBox(newBox);
    }

    @Override
    protected int intervalAfterMiss(int intervalDays, double easinessFactor, int newBox) {
        return intervalForBox(newBox);
    }

    int intervalForBox(int box) {
        int index = Math.max(0, Math.min(boxIntervals.length - 1, box - 1));
        return boxIntervals[index];
    }
}
