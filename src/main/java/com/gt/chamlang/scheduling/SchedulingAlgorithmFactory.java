package com.gt.chamlang.scheduling;

import com.gt.chamlang.model.SrAlgorithm;

public final class SchedulingAlgorithmFactory {

    private SchedulingAlgorithmFactory() { }

    public static SchedulingAlgorithm create(SrAlgorithm srAlgorithm, int leitnerBoxCount) {
        if (srAlgorithm == SrAlgorithm.ModifiedSm2) {
            return new ModifiedSm2SchedulingAlgorithm(leitnerBoxCount);
        } else if (srAlgorithm == SrAlgorithm.Simple) {
            return new SimpleSchedulingAlgorithm(leitnerBoxCount);
        }

        return new Sm2SchedulingAlgorithm(leitnerBoxCount);
    }
}
