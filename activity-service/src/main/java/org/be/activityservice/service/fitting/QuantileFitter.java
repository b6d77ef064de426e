package org.be.activityservice.service.fitting;

import org.apache.commons.math3.stat.descriptive.rank.Percentile;
import org.be.activityservice.enums.FitMethod;
import org.be.activityservice.model.ThresholdSet;

/**
 * 경험적 분위수 임계값. 0 을 포함한 전체 구간에서 순서통계량 사이를 선형 보간한다.
 */
public class QuantileFitter implements ThresholdFitter {

    @Override
    public ThresholdSet fit(double[] values, double[] quantileLevels) {
        Percentile percentile = new Percentile().withEstimationType(Percentile.EstimationType.R_7);
        percentile.setData(values);

        double[] ceilings = new double[quantileLevels.length];
        for (int i = 0; i < quantileLevels.length; i++) {
            ceilings[i] = values.length == 0 ? Double.NaN : percentile.evaluate(quantileLevels[i] * 100.0);
        }
        return new ThresholdSet(ceilings, FitMethod.QUANTILE);
    }
}
