package in.ashwanthkumar.stationarizer.plugins;

import in.ashwanthkumar.stationarizer.exception.InsufficientDataException;
import in.ashwanthkumar.stationarizer.model.Regression;
import in.ashwanthkumar.stationarizer.model.TestFamily;
import in.ashwanthkumar.stationarizer.model.TestResult;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.math3.distribution.NormalDistribution;
import org.apache.commons.math3.exception.MathIllegalArgumentException;

/**
 * Augmented Dickey-Fuller unit root test.
 * <p>
 * Regresses the first difference on the deterministic terms, the lagged level and lagged
 * differences:
 * <pre>
 *     Δy(t) = α + β·t + γ·y(t-1) + Σ φ(i)·Δy(t-i) + ε(t)
 * </pre>
 * The lag order is picked by AIC among 0..maxLag (all candidates fitted on the same sample), the
 * statistic is the t-ratio of γ and its p-value comes from MacKinnon's (1994) response surface
 * for a single series.
 * </p>
 */
@Slf4j
@Getter
public class AugmentedDickeyFuller implements UnitRootTest {
    private static final NormalDistribution STANDARD_NORMAL = new NormalDistribution();

    private final Regression regression;

    public AugmentedDickeyFuller() {
        this(Regression.CONSTANT_TREND);
    }

    public AugmentedDickeyFuller(Regression regression) {
        this.regression = regression;
    }

    @Override
    public TestResult test(String column, double[] series) {
        SeriesChecks.requireTestable(column, series, 3);
        int nobs = series.length;
        int trendTerms = regression.deterministicTerms();

        int maxLag = Math.min(nobs / 2 - trendTerms - 1, defaultMaxLag(nobs));
        if (maxLag < 0) {
            throw new InsufficientDataException(column,
                    String.format("sample size %d is too short for the %s regression", nobs, regression));
        }

        double[] diff = new double[nobs - 1];
        for (int i = 1; i < nobs; i++) {
            diff[i - 1] = series[i] - series[i - 1];
        }

        try {
            int bestLag = selectLag(series, diff, maxLag);
            LeastSquares fit = regress(series, diff, bestLag, bestLag);
            // γ sits right after the deterministic columns
            double statistic = fit.tStatistic(trendTerms);
            if (!Double.isFinite(statistic)) {
                throw new InsufficientDataException(column, "unit root regression is degenerate");
            }
            double pValue = mackinnonPValue(statistic, regression);
            log.debug("{}: ADF lag {} chosen out of {}, {} observations", column, bestLag, maxLag, fit.getObservations());
            return TestResult.of(column, TestFamily.UNIT_ROOT, statistic, pValue, bestLag, fit.getObservations());
        } catch (MathIllegalArgumentException e) {
            // also covers SingularMatrixException from collinear regressors
            throw new InsufficientDataException(column, "unit root regression could not be estimated", e);
        }
    }

    /**
     * Schwert's rule of thumb, 12·(n/100)^(1/4) rounded up.
     */
    static int defaultMaxLag(int nobs) {
        return (int) Math.ceil(12.0 * Math.pow(nobs / 100.0, 0.25));
    }

    private int selectLag(double[] series, double[] diff, int maxLag) {
        int bestLag = 0;
        double bestAic = Double.POSITIVE_INFINITY;
        for (int lag = 0; lag <= maxLag; lag++) {
            double aic = regress(series, diff, lag, maxLag).aic();
            if (aic < bestAic) {
                bestAic = aic;
                bestLag = lag;
            }
        }
        return bestLag;
    }

    /**
     * Fit the ADF regression with {@code lags} lagged differences on the rows from {@code start}
     * onwards, so that fits with different lags can share the same sample.
     */
    private LeastSquares regress(double[] series, double[] diff, int lags, int start) {
        int rows = diff.length - start;
        int trendTerms = regression.deterministicTerms();
        double[] y = new double[rows];
        double[][] x = new double[rows][trendTerms + 1 + lags];
        for (int row = 0; row < rows; row++) {
            int t = start + row;
            y[row] = diff[t];
            int col = 0;
            x[row][col++] = 1.0;
            if (regression == Regression.CONSTANT_TREND) {
                x[row][col++] = row + 1.0;
            }
            x[row][col++] = series[t];
            for (int lag = 1; lag <= lags; lag++) {
                x[row][col++] = diff[t - lag];
            }
        }
        return LeastSquares.fit(y, x);
    }

    /**
     * MacKinnon's approximate asymptotic p-value of the ADF statistic for a single series.
     */
    static double mackinnonPValue(double statistic, Regression regression) {
        Surface surface = Surface.of(regression);
        if (statistic > surface.max) {
            return 1.0;
        }
        if (statistic < surface.min) {
            return 0.0;
        }
        double[] coefficients = statistic <= surface.star ? surface.smallP : surface.largeP;
        double value = 0.0;
        for (int i = coefficients.length - 1; i >= 0; i--) {
            value = value * statistic + coefficients[i];
        }
        return STANDARD_NORMAL.cumulativeProbability(value);
    }

    /**
     * Response surface coefficients (MacKinnon 1994, as tabulated by statsmodels) for N = 1.
     */
    private enum Surface {
        CONSTANT(2.74, -18.83, -1.61,
                new double[]{2.1659, 1.4412, 3.8269e-2},
                new double[]{1.7339, 9.3202e-1, -1.2745e-1, -1.0368e-2}),
        CONSTANT_TREND(0.7, -16.18, -2.89,
                new double[]{3.2512, 1.6047, 4.9588e-2},
                new double[]{2.5261, 6.1654e-1, -3.7956e-1, -6.0285e-2});

        // p-value is 1 above max and 0 below min
        private final double max;
        private final double min;
        // switch point between the small and the large p-value polynomials
        private final double star;
        private final double[] smallP;
        private final double[] largeP;

        Surface(double max, double min, double star, double[] smallP, double[] largeP) {
            this.max = max;
            this.min = min;
            this.star = star;
            this.smallP = smallP;
            this.largeP = largeP;
        }

        static Surface of(Regression regression) {
            switch (regression) {
                case CONSTANT:
                    return CONSTANT;
                case CONSTANT_TREND:
                    return CONSTANT_TREND;
                default:
                    throw new IllegalArgumentException("No response surface for " + regression);
            }
        }
    }
}
