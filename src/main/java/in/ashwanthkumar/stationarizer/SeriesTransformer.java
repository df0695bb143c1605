package in.ashwanthkumar.stationarizer;

import com.google.common.base.Preconditions;
import in.ashwanthkumar.stationarizer.model.Decision;
import org.apache.commons.math3.stat.regression.SimpleRegression;

/**
 * Applies a {@link Decision} to a series. Input arrays are never modified.
 */
public class SeriesTransformer {

    /**
     * Detrend first, then difference, when both are scheduled.
     *
     * @return The same array when nothing is scheduled, a new one otherwise
     */
    public double[] apply(double[] series, Decision decision) {
        double[] result = series;
        if (decision.isDetrend()) {
            result = detrend(result);
        }
        if (decision.isDifference()) {
            result = difference(result);
        }
        return result;
    }

    /**
     * Residual of the OLS fit of the series on an intercept and the time index 0..n-1.
     */
    public static double[] detrend(double[] series) {
        Preconditions.checkArgument(series.length >= 2, "Detrending needs at least 2 observations, got %s", series.length);
        SimpleRegression trend = new SimpleRegression();
        for (int t = 0; t < series.length; t++) {
            trend.addData(t, series[t]);
        }
        double[] residuals = new double[series.length];
        for (int t = 0; t < series.length; t++) {
            residuals[t] = series[t] - trend.predict(t);
        }
        return residuals;
    }

    /**
     * y[t] = x[t] - x[t-1], one observation shorter than the input.
     */
    public static double[] difference(double[] series) {
        Preconditions.checkArgument(series.length >= 1, "Differencing needs at least 1 observation");
        double[] diff = new double[series.length - 1];
        for (int t = 1; t < series.length; t++) {
            diff[t - 1] = series[t] - series[t - 1];
        }
        return diff;
    }
}
