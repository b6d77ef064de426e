package org.be.activityservice.service.fitting;

import lombok.Value;

/**
 * 일반화 극값(GEV) 분포. 형상 파라미터 c 는 scipy genextreme 부호 규약(c = -xi)을 따른다.
 */
@Value
public class GevDistribution {

    private static final double SHAPE_EPSILON = 1e-12;

    double shape;
    double location;
    double scale;

    public double logDensity(double x) {
        double y = (x - location) / scale;
        if (Math.abs(shape) < SHAPE_EPSILON) {
            return -y - Math.exp(-y) - Math.log(scale);
        }
        double t = 1.0 - shape * y;
        if (t <= 0.0) {
            return Double.NEGATIVE_INFINITY;
        }
        double logT = Math.log(t);
        return (1.0 / shape - 1.0) * logT - Math.exp(logT / shape) - Math.log(scale);
    }

    public double logLikelihood(double[] sample) {
        double sum = 0.0;
        for (double x : sample) {
            sum += logDensity(x);
        }
        return sum;
    }

    /**
     * 누적확률 p 에 대한 분위수
     */
    public double inverseCumulative(double p) {
        double logP = -Math.log(p);
        if (Math.abs(shape) < SHAPE_EPSILON) {
            return location - scale * Math.log(logP);
        }
        return location + scale * (1.0 - Math.pow(logP, shape)) / shape;
    }

    /**
     * 질량 mass 를 담는 중앙 구간의 상한
     */
    public double intervalUpper(double mass) {
        return inverseCumulative((1.0 + mass) / 2.0);
    }
}
