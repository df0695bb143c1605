package in.ashwanthkumar.stationarizer.model;

import com.google.common.base.Preconditions;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

/**
 * Raw outcome of one stationarity test on one series.
 */
@Getter
@EqualsAndHashCode
@ToString
public class TestResult {
    private final String column;
    private final TestFamily family;
    // informational only, decisions are made on the p-value
    private final double statistic;
    private final double pValue;
    // lag order (ADF) or bandwidth (KPSS) used
    private final int lags;
    // number of observations in the final regression
    private final int observations;

    private TestResult(String column, TestFamily family, double statistic, double pValue, int lags, int observations) {
        Preconditions.checkArgument(pValue >= 0.0 && pValue <= 1.0, "p-value %s of %s is outside [0, 1]", pValue, column);
        this.column = column;
        this.family = family;
        this.statistic = statistic;
        this.pValue = pValue;
        this.lags = lags;
        this.observations = observations;
    }

    public static TestResult of(String column, TestFamily family, double statistic, double pValue, int lags, int observations) {
        return new TestResult(column, family, statistic, pValue, lags, observations);
    }
}
