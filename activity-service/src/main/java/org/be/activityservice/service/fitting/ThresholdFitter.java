package org.be.activityservice.service.fitting;

import org.be.activityservice.model.ThresholdSet;

public interface ThresholdFitter {

    /**
     * 시계열 구간으로부터 분위수 레벨별 상한값을 계산
     *
     * @param values         적합 대상 구간 (0 포함)
     * @param quantileLevels (0,1) 범위의 오름차순 레벨
     */
    ThresholdSet fit(double[] values, double[] quantileLevels);
}
