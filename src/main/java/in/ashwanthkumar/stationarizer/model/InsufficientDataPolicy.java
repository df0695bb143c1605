package in.ashwanthkumar.stationarizer.model;

/**
 * What to do with a column that is too short or degenerate to be tested.
 */
public enum InsufficientDataPolicy {
    // fail the whole run, no partial output
    ABORT,

    // log it, keep the column untransformed and leave it out of the correction
    SKIP,
}
