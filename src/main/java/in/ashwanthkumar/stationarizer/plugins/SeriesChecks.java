package in.ashwanthkumar.stationarizer.plugins;

import com.google.common.primitives.Doubles;
import in.ashwanthkumar.stationarizer.exception.InsufficientDataException;

final class SeriesChecks {
    private SeriesChecks() {
    }

    /**
     * Fails with {@link InsufficientDataException} unless the series has at least
     * {@code minimumLength} finite observations that are not all equal.
     */
    static void requireTestable(String column, double[] series, int minimumLength) {
        if (series.length < minimumLength) {
            throw new InsufficientDataException(column,
                    String.format("%d observations, at least %d are required", series.length, minimumLength));
        }
        for (double value : series) {
            if (!Double.isFinite(value)) {
                throw new InsufficientDataException(column, "series contains missing or non-finite observations");
            }
        }
        if (Doubles.max(series) == Doubles.min(series)) {
            throw new InsufficientDataException(column, "series is constant");
        }
    }
}
