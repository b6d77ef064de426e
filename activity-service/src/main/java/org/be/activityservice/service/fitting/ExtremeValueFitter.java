package org.be.activityservice.service.fitting;

import lombok.extern.slf4j.Slf4j;
import org.apache.commons.math3.exception.MathIllegalStateException;
import org.apache.commons.math3.exception.TooManyEvaluationsException;
import org.apache.commons.math3.optim.InitialGuess;
import org.apache.commons.math3.optim.MaxEval;
import org.apache.commons.math3.optim.MaxIter;
import org.apache.commons.math3.optim.PointValuePair;
import org.apache.commons.math3.optim.nonlinear.scalar.GoalType;
import org.apache.commons.math3.optim.nonlinear.scalar.ObjectiveFunction;
import org.apache.commons.math3.optim.nonlinear.scalar.noderiv.NelderMeadSimplex;
import org.apache.commons.math3.optim.nonlinear.scalar.noderiv.SimplexOptimizer;
import org.apache.commons.math3.stat.descriptive.moment.Mean;
import org.apache.commons.math3.stat.descriptive.moment.Skewness;
import org.apache.commons.math3.stat.descriptive.moment.StandardDeviation;
import org.be.activityservice.enums.FitMethod;
import org.be.activityservice.exception.FitFailedException;
import org.be.activityservice.model.ThresholdSet;

import java.util.Arrays;

/**
 * GEV 최대우도 적합 기반 임계값.
 * 0 값은 "활동 없음" 버킷이므로 표본에서 제외하고, 각 레벨의 중앙 신뢰구간 상한을 반올림해 사용한다.
 */
@Slf4j
public class ExtremeValueFitter implements ThresholdFitter {

    // 우도가 정의되지 않는 파라미터 영역
    private static final double PENALTY = 1e300;

    private final int maxEvaluations;

    public ExtremeValueFitter(int maxEvaluations) {
        this.maxEvaluations = maxEvaluations;
    }

    @Override
    public ThresholdSet fit(double[] values, double[] quantileLevels) {
        GevDistribution distribution = estimate(nonzero(values));

        double[] ceilings = new double[quantileLevels.length];
        for (int i = 0; i < quantileLevels.length; i++) {
            double upper = distribution.intervalUpper(quantileLevels[i]);
            if (!Double.isFinite(upper)) {
                throw new FitFailedException("Non-finite interval bound for level " + quantileLevels[i]);
            }
            // 반올림은 half-even
            ceilings[i] = Math.rint(upper);
        }
        return new ThresholdSet(ceilings, FitMethod.EXTREME_VALUE);
    }

    /**
     * 표본 평균/표준편차를 위치/척도 초기값으로 하는 최대우도 추정
     */
    public GevDistribution estimate(double[] sample) {
        if (sample.length < 2) {
            throw new FitFailedException("Not enough samples for extreme value fit: " + sample.length);
        }
        double mean = new Mean().evaluate(sample);
        double std = new StandardDeviation().evaluate(sample);
        if (!(std > 0.0) || !Double.isFinite(std)) {
            throw new FitFailedException("Degenerate sample, standard deviation = " + std);
        }
        double skew = new Skewness().evaluate(sample);
        double shapeGuess = skew < 0 ? 0.5 : -0.5;

        ObjectiveFunction negativeLogLikelihood = new ObjectiveFunction(point -> {
            double scale = Math.exp(point[2]);
            double ll = new GevDistribution(point[0], point[1], scale).logLikelihood(sample);
            return Double.isFinite(ll) ? -ll : PENALTY;
        });

        SimplexOptimizer optimizer = new SimplexOptimizer(1e-10, 1e-10);
        PointValuePair optimum;
        try {
            optimum = optimizer.optimize(
                    new MaxEval(maxEvaluations),
                    new MaxIter(maxEvaluations),
                    negativeLogLikelihood,
                    GoalType.MINIMIZE,
                    new InitialGuess(new double[]{shapeGuess, mean, Math.log(std)}),
                    new NelderMeadSimplex(new double[]{0.1, std * 0.1, 0.1}));
        } catch (TooManyEvaluationsException e) {
            throw new FitFailedException("Extreme value fit did not converge", e);
        } catch (MathIllegalStateException e) {
            throw new FitFailedException("Extreme value fit failed", e);
        }

        double[] params = optimum.getPoint();
        if (optimum.getValue() >= PENALTY || !Arrays.stream(params).allMatch(Double::isFinite)) {
            throw new FitFailedException("Extreme value fit produced invalid parameters");
        }
        GevDistribution fitted = new GevDistribution(params[0], params[1], Math.exp(params[2]));
        log.trace("GEV 적합 완료: n={}, {}", sample.length, fitted);
        return fitted;
    }

    static double[] nonzero(double[] values) {
        return Arrays.stream(values).filter(v -> v > 0).toArray();
    }
}
