package org.be.activityservice.model;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;
import org.be.activityservice.enums.FitMethod;

import java.util.Arrays;

/**
 * 분위수 레벨별 상한값 집합 (레벨 오름차순).
 */
@Getter
@ToString
@EqualsAndHashCode
public class ThresholdSet {

    private final double[] ceilings;
    private final FitMethod method;

    public ThresholdSet(double[] ceilings, FitMethod method) {
        this.ceilings = ceilings.clone();
        this.method = method;
    }

    public double[] getCeilings() {
        return ceilings.clone();
    }

    public int size() {
        return ceilings.length;
    }

    public double get(int index) {
        return ceilings[index];
    }

    public double last() {
        return ceilings[ceilings.length - 1];
    }

    public static ThresholdSet of(FitMethod method, double... ceilings) {
        return new ThresholdSet(Arrays.copyOf(ceilings, ceilings.length), method);
    }
}
