package in.ashwanthkumar.stationarizer.model;

/**
 * The two families of hypothesis tests run on every series. Each family is corrected for
 * multiplicity as one batch of p-values (unless pooled, see {@link PoolingMode}).
 */
public enum TestFamily {
    // H0: the series has a unit root
    UNIT_ROOT,

    // H0: the series is stationary around a deterministic trend
    TREND_STATIONARITY,
}
