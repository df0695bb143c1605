package in.ashwanthkumar.stationarizer.model;

/**
 * Human readable reading of the pair of corrected test outcomes. This is for reporting only,
 * the {@link Decision} is derived from the two rejections directly.
 */
public enum Conclusion {
    CONTRADICTION("Contradictory results regarding the existence of a unit root. Various possible reasons exist."),
    NO_REJECTION("Not enough proof to reject both null hypotheses."),
    TREND_STATIONARY("The series likely does not have a unit root, but rather is trend stationary."),
    UNIT_ROOT("The series likely has a unit root.");

    private final String description;

    Conclusion(String description) {
        this.description = description;
    }

    public String getDescription() {
        return description;
    }

    public static Conclusion of(boolean rejectUnitRoot, boolean rejectTrendStationarity) {
        if (rejectUnitRoot && rejectTrendStationarity) {
            return CONTRADICTION;
        }
        if (rejectUnitRoot) {
            return TREND_STATIONARY;
        }
        if (rejectTrendStationarity) {
            return UNIT_ROOT;
        }
        return NO_REJECTION;
    }
}
