package in.ashwanthkumar.stationarizer.model;

/**
 * Deterministic terms included in the test regressions.
 */
public enum Regression {
    // constant only
    CONSTANT(1),

    // constant and linear time trend
    CONSTANT_TREND(2);

    private final int deterministicTerms;

    Regression(int deterministicTerms) {
        this.deterministicTerms = deterministicTerms;
    }

    public int deterministicTerms() {
        return deterministicTerms;
    }
}
