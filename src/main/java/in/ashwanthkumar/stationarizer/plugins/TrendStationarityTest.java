package in.ashwanthkumar.stationarizer.plugins;

import in.ashwanthkumar.stationarizer.model.TestResult;

/**
 * A test whose null hypothesis is that the series is stationary around a deterministic trend. A
 * small p-value is evidence against trend stationarity.
 */
public interface TrendStationarityTest {
    /**
     * Run the test on a single series
     *
     * @param column Name of the column the series came from, used in results and errors
     * @param series Observations ordered from the earliest to the latest
     * @return Result of the {@link in.ashwanthkumar.stationarizer.model.TestFamily#TREND_STATIONARITY} family
     * @throws in.ashwanthkumar.stationarizer.exception.InsufficientDataException when the series is too short or degenerate
     */
    TestResult test(String column, double[] series);
}
