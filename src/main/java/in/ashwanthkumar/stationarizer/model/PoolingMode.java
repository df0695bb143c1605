package in.ashwanthkumar.stationarizer.model;

/**
 * How p-values are grouped before the multiple testing correction.
 */
public enum PoolingMode {
    // N unit root p-values and N trend stationarity p-values are corrected as two separate batches
    PER_FAMILY,

    // all 2N p-values are corrected as a single batch
    POOLED,
}
