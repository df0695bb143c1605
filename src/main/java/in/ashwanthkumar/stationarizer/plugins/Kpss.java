package in.ashwanthkumar.stationarizer.plugins;

import in.ashwanthkumar.stationarizer.exception.InsufficientDataException;
import in.ashwanthkumar.stationarizer.model.Regression;
import in.ashwanthkumar.stationarizer.model.TestFamily;
import in.ashwanthkumar.stationarizer.model.TestResult;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.math3.stat.regression.SimpleRegression;

/**
 * Kwiatkowski-Phillips-Schmidt-Shin test of stationarity around a deterministic trend (or a
 * level, with {@link Regression#CONSTANT}).
 * <p>
 * The statistic is the sum of squared partial sums of the regression residuals, scaled by n² and
 * by a Bartlett-kernel estimate of the long run variance whose bandwidth is picked with the
 * data dependent rule of Hobijn et al. (1998). The p-value is interpolated in the KPSS (1992)
 * table, so it is bounded to [0.01, 0.10].
 * </p>
 */
@Slf4j
@Getter
public class Kpss implements TrendStationarityTest {
    private static final double[] P_VALUES = {0.10, 0.05, 0.025, 0.01};
    private static final double[] CONSTANT_CRITICAL_VALUES = {0.347, 0.463, 0.574, 0.739};
    private static final double[] CONSTANT_TREND_CRITICAL_VALUES = {0.119, 0.146, 0.176, 0.216};

    private final Regression regression;

    public Kpss() {
        this(Regression.CONSTANT_TREND);
    }

    public Kpss(Regression regression) {
        this.regression = regression;
    }

    @Override
    public TestResult test(String column, double[] series) {
        SeriesChecks.requireTestable(column, series, regression.deterministicTerms() + 2);
        int nobs = series.length;

        double[] residuals = residuals(series);
        double sumOfSquares = dot(residuals, residuals, 0);
        if (sumOfSquares == 0.0) {
            throw new InsufficientDataException(column, "series is an exact deterministic trend");
        }

        int lags = Math.min(autoLag(residuals), nobs - 1);

        double partialSum = 0.0;
        double eta = 0.0;
        for (double residual : residuals) {
            partialSum += residual;
            eta += partialSum * partialSum;
        }
        eta /= (double) nobs * nobs;

        double statistic = eta / longRunVariance(residuals, lags);
        double pValue = interpolatePValue(statistic, regression);
        if (pValue == P_VALUES[0] || pValue == P_VALUES[P_VALUES.length - 1]) {
            log.debug("{}: KPSS statistic {} is outside of the p-value table, p-value clipped to {}", column, statistic, pValue);
        }
        return TestResult.of(column, TestFamily.TREND_STATIONARITY, statistic, pValue, lags, nobs);
    }

    private double[] residuals(double[] series) {
        double[] residuals = new double[series.length];
        if (regression == Regression.CONSTANT) {
            double mean = 0.0;
            for (double value : series) {
                mean += value;
            }
            mean /= series.length;
            for (int t = 0; t < series.length; t++) {
                residuals[t] = series[t] - mean;
            }
        } else {
            SimpleRegression trend = new SimpleRegression();
            for (int t = 0; t < series.length; t++) {
                trend.addData(t, series[t]);
            }
            for (int t = 0; t < series.length; t++) {
                residuals[t] = series[t] - trend.predict(t);
            }
        }
        return residuals;
    }

    /**
     * Bandwidth selection of Hobijn, Franses and Ooms (1998).
     */
    static int autoLag(double[] residuals) {
        int nobs = residuals.length;
        int covarianceLags = (int) Math.pow(nobs, 2.0 / 9.0);
        double s0 = dot(residuals, residuals, 0) / nobs;
        double s1 = 0.0;
        for (int i = 1; i <= covarianceLags; i++) {
            double product = dot(residuals, residuals, i) / (nobs / 2.0);
            s0 += product;
            s1 += i * product;
        }
        double sHat = s1 / s0;
        double gammaHat = 1.1447 * Math.pow(sHat * sHat, 1.0 / 3.0);
        return (int) (gammaHat * Math.pow(nobs, 1.0 / 3.0));
    }

    /**
     * Newey-West estimate of the long run variance with Bartlett weights.
     */
    static double longRunVariance(double[] residuals, int lags) {
        double variance = dot(residuals, residuals, 0);
        for (int i = 1; i <= lags; i++) {
            variance += 2.0 * (1.0 - i / (lags + 1.0)) * dot(residuals, residuals, i);
        }
        return variance / residuals.length;
    }

    static double interpolatePValue(double statistic, Regression regression) {
        double[] critical = regression == Regression.CONSTANT ? CONSTANT_CRITICAL_VALUES : CONSTANT_TREND_CRITICAL_VALUES;
        if (statistic <= critical[0]) {
            return P_VALUES[0];
        }
        int last = critical.length - 1;
        if (statistic >= critical[last]) {
            return P_VALUES[last];
        }
        int i = 0;
        while (statistic > critical[i + 1]) {
            i++;
        }
        double weight = (statistic - critical[i]) / (critical[i + 1] - critical[i]);
        return P_VALUES[i] + weight * (P_VALUES[i + 1] - P_VALUES[i]);
    }

    // Σ x[t]·x[t-lag] for t >= lag
    private static double dot(double[] x, double[] y, int lag) {
        double sum = 0.0;
        for (int t = lag; t < x.length; t++) {
            sum += x[t] * y[t - lag];
        }
        return sum;
    }
}
