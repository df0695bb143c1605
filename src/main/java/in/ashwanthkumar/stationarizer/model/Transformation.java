package in.ashwanthkumar.stationarizer.model;

public enum Transformation {
    // subtract the OLS fit on the time index
    DETREND,

    // first difference, drops the earliest observation
    DIFFERENCE,
}
