package in.ashwanthkumar.stationarizer.plugins;

import in.ashwanthkumar.stationarizer.StochasticProcesses;
import in.ashwanthkumar.stationarizer.exception.InsufficientDataException;
import in.ashwanthkumar.stationarizer.model.Regression;
import in.ashwanthkumar.stationarizer.model.TestFamily;
import in.ashwanthkumar.stationarizer.model.TestResult;
import org.apache.commons.math3.linear.SingularMatrixException;
import org.junit.Test;

import java.util.Random;

import static org.hamcrest.CoreMatchers.instanceOf;
import static org.hamcrest.CoreMatchers.is;
import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.closeTo;
import static org.hamcrest.Matchers.greaterThanOrEqualTo;
import static org.hamcrest.Matchers.lessThan;
import static org.hamcrest.Matchers.lessThanOrEqualTo;

public class AugmentedDickeyFullerTest {
    private static final int SEEDS = 20;

    private final AugmentedDickeyFuller adf = new AugmentedDickeyFuller();

    @Test
    public void testRandomWalkKeepsTheUnitRoot() {
        int notRejected = 0;
        for (int seed = 0; seed < SEEDS; seed++) {
            double[] walk = StochasticProcesses.randomWalk(new Random(seed), 500, 1.0);
            TestResult result = adf.test("walk", walk);
            assertThat(result.getFamily(), is(TestFamily.UNIT_ROOT));
            if (result.getPValue() > 0.05) {
                notRejected++;
            }
        }
        assertThat(notRejected, greaterThanOrEqualTo(15));
    }

    @Test
    public void testWhiteNoiseRejectsTheUnitRoot() {
        for (int seed = 0; seed < SEEDS; seed++) {
            double[] noise = StochasticProcesses.whiteNoise(new Random(seed), 500, 1.0);
            assertThat(adf.test("noise", noise).getPValue(), lessThan(0.01));
        }
    }

    @Test
    public void testTrendStationarySeriesRejectsTheUnitRoot() {
        for (int seed = 0; seed < SEEDS; seed++) {
            double[] trend = StochasticProcesses.trendStationary(new Random(seed), 200, 0.5, 1.0);
            assertThat(adf.test("trend", trend).getPValue(), lessThan(0.05));
        }
    }

    @Test
    public void testLagOrderAndObservations() {
        double[] noise = StochasticProcesses.whiteNoise(new Random(7), 100, 1.0);
        TestResult result = adf.test("noise", noise);
        assertThat(result.getLags(), lessThanOrEqualTo(AugmentedDickeyFuller.defaultMaxLag(100)));
        // one observation is lost to differencing and one per lag
        assertThat(result.getObservations(), is(100 - 1 - result.getLags()));
    }

    @Test
    public void testStatisticAndLagOfAFixedSeries() {
        // reference values of adfuller(x, regression="ct", autolag="AIC")
        double[] x = {0.5, 1.2, 0.9, 1.8, 2.6, 2.1, 3.0, 3.4, 2.8, 3.9, 4.7, 4.1, 5.2, 5.0, 5.9, 6.8, 6.1, 7.3, 7.0, 8.2,
                8.9, 8.1, 9.4, 9.0, 10.1};
        TestResult result = adf.test("fixed", x);
        assertThat(result.getLags(), is(8));
        assertThat(result.getObservations(), is(16));
        assertThat(result.getStatistic(), closeTo(-4.715237455807706, 1e-6));
        assertThat(result.getPValue(), closeTo(AugmentedDickeyFuller.mackinnonPValue(-4.715237455807706, Regression.CONSTANT_TREND), 1e-6));
    }

    @Test
    public void testCollinearRegressorsAreReportedAsInsufficientData() {
        // every lagged level and lagged difference is zero, only the last step moves
        double[] spike = new double[20];
        spike[19] = 1.0;
        try {
            adf.test("spike", spike);
        } catch (InsufficientDataException e) {
            assertThat(e.getColumn(), is("spike"));
            assertThat(e.getCause(), instanceOf(SingularMatrixException.class));
            return;
        }
        throw new AssertionError("Expected the singular regression to be rejected");
    }

    @Test
    public void testDefaultMaxLag() {
        assertThat(AugmentedDickeyFuller.defaultMaxLag(100), is(12));
        assertThat(AugmentedDickeyFuller.defaultMaxLag(500), is(18));
    }

    @Test
    public void testMackinnonPValue() {
        // 5% critical value of the constant + trend case
        assertThat(AugmentedDickeyFuller.mackinnonPValue(-3.41, Regression.CONSTANT_TREND), closeTo(0.05, 0.005));
        // 5% critical value of the constant case
        assertThat(AugmentedDickeyFuller.mackinnonPValue(-2.86, Regression.CONSTANT), closeTo(0.05, 0.005));
        assertThat(AugmentedDickeyFuller.mackinnonPValue(1.0, Regression.CONSTANT_TREND), is(1.0));
        assertThat(AugmentedDickeyFuller.mackinnonPValue(-20.0, Regression.CONSTANT_TREND), is(0.0));
    }

    @Test
    public void testMackinnonPValueIsMonotonic() {
        double previous = 0.0;
        for (double statistic = -16.0; statistic <= 0.7; statistic += 0.05) {
            double pValue = AugmentedDickeyFuller.mackinnonPValue(statistic, Regression.CONSTANT_TREND);
            assertThat(pValue, greaterThanOrEqualTo(previous));
            previous = pValue;
        }
    }

    @Test(expected = InsufficientDataException.class)
    public void testTooShortSeries() {
        adf.test("short", new double[]{1.0, 3.0, 2.0, 5.0, 4.0});
    }

    @Test(expected = InsufficientDataException.class)
    public void testConstantSeries() {
        double[] constant = new double[50];
        java.util.Arrays.fill(constant, 3.0);
        adf.test("constant", constant);
    }

    @Test
    public void testNonFiniteSeriesNamesTheColumn() {
        double[] noise = StochasticProcesses.whiteNoise(new Random(1), 50, 1.0);
        noise[10] = Double.NaN;
        try {
            adf.test("gappy", noise);
        } catch (InsufficientDataException e) {
            assertThat(e.getColumn(), is("gappy"));
            return;
        }
        throw new AssertionError("Expected the series with a NaN to be rejected");
    }
}
