package in.ashwanthkumar.stationarizer;

import java.util.Arrays;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Aligns series of different lengths on their latest observation. Differencing drops the
 * earliest observation of a series, so the others lose their earliest observations too.
 */
public class LengthReconciler {

    /**
     * @param series Column name -> transformed series
     * @return Column name -> series of equal length, in the same order
     */
    public Map<String, double[]> reconcile(Map<String, double[]> series) {
        int minLength = minLength(series.values());
        Map<String, double[]> reconciled = new LinkedHashMap<>();
        series.forEach((column, values) -> reconciled.put(column, trim(values, minLength)));
        return reconciled;
    }

    public int minLength(Collection<double[]> series) {
        return series.stream().mapToInt(values -> values.length).min().orElse(0);
    }

    /**
     * Drop the leading observations beyond {@code length}. The series is returned as is when it is
     * not longer than that.
     */
    public double[] trim(double[] series, int length) {
        if (series.length <= length) {
            return series;
        }
        return Arrays.copyOfRange(series, series.length - length, series.length);
    }
}
