package in.ashwanthkumar.stationarizer.plugins;

import lombok.Getter;
import org.apache.commons.math3.stat.regression.OLSMultipleLinearRegression;

/**
 * Ordinary least squares fit of a design matrix that carries its own deterministic columns.
 */
@Getter
final class LeastSquares {
    private final double[] coefficients;
    private final double[] standardErrors;
    private final double residualSumOfSquares;
    private final int observations;
    private final int parameters;

    private LeastSquares(double[] coefficients, double[] standardErrors, double residualSumOfSquares, int observations) {
        this.coefficients = coefficients;
        this.standardErrors = standardErrors;
        this.residualSumOfSquares = residualSumOfSquares;
        this.observations = observations;
        this.parameters = coefficients.length;
    }

    /**
     * @throws org.apache.commons.math3.exception.MathIllegalArgumentException when there are fewer rows than regressors,
     *                                                                        or a SingularMatrixException (a subclass) when they are collinear
     */
    static LeastSquares fit(double[] y, double[][] x) {
        OLSMultipleLinearRegression regression = new OLSMultipleLinearRegression();
        // constant and trend columns are part of x
        regression.setNoIntercept(true);
        regression.newSampleData(y, x);
        return new LeastSquares(
                regression.estimateRegressionParameters(),
                regression.estimateRegressionParametersStandardErrors(),
                regression.calculateResidualSumOfSquares(),
                y.length
        );
    }

    double tStatistic(int index) {
        return coefficients[index] / standardErrors[index];
    }

    /**
     * Akaike information criterion of the gaussian log likelihood, the same value statsmodels
     * reports for an OLS fit.
     */
    double aic() {
        double n = observations;
        double logLikelihood = -n / 2.0 * (Math.log(2.0 * Math.PI) + Math.log(residualSumOfSquares / n) + 1.0);
        return -2.0 * logLikelihood + 2.0 * parameters;
    }
}
