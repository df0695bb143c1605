package in.ashwanthkumar.stationarizer.plugins;

/**
 * Controls the error rate of a batch of hypothesis tests.
 */
public interface MultipleTestingCorrection {
    /**
     * @return Name used in logs and reports
     */
    String label();

    /**
     * Correct a batch of p-values.
     *
     * @param pValues Raw p-values, in any order
     * @param alpha   Family-wise error rate or false discovery rate to control, depending on the procedure
     * @return Rejections and adjusted p-values, index aligned with {@code pValues}
     */
    CorrectionOutcome correct(double[] pValues, double alpha);
}
