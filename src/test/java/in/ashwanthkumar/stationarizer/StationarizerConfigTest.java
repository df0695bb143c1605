package in.ashwanthkumar.stationarizer;

import in.ashwanthkumar.stationarizer.exception.CorrectionMethodException;
import in.ashwanthkumar.stationarizer.model.InsufficientDataPolicy;
import in.ashwanthkumar.stationarizer.model.PoolingMode;
import in.ashwanthkumar.stationarizer.model.Regression;
import in.ashwanthkumar.stationarizer.plugins.CorrectionMethod;
import org.junit.Test;

import java.util.Properties;

import static org.hamcrest.CoreMatchers.is;
import static org.hamcrest.MatcherAssert.assertThat;

public class StationarizerConfigTest {
    @Test
    public void testDefaults() {
        StationarizerConfig config = StationarizerConfig.defaults();
        assertThat(config.getAlpha(), is(0.05));
        assertThat(config.correctionMethod(), is(CorrectionMethod.BENJAMINI_YEKUTIELI));
        assertThat(config.getPoolingMode(), is(PoolingMode.PER_FAMILY));
        assertThat(config.getInsufficientDataPolicy(), is(InsufficientDataPolicy.ABORT));
        assertThat(config.getRegression(), is(Regression.CONSTANT_TREND));
    }

    @Test
    public void testEmptyPropertiesGiveTheDefaults() {
        assertThat(StationarizerConfig.fromProperties(new Properties()), is(StationarizerConfig.defaults()));
    }

    @Test
    public void testFromProperties() {
        Properties properties = new Properties();
        properties.setProperty(StationarizerConfig.ALPHA_PROPERTY, " 0.1 ");
        properties.setProperty(StationarizerConfig.MULTITEST_PROPERTY, "fdr_bh");
        properties.setProperty(StationarizerConfig.POOLING_PROPERTY, "pooled");
        properties.setProperty(StationarizerConfig.INSUFFICIENT_DATA_PROPERTY, "skip");
        properties.setProperty(StationarizerConfig.REGRESSION_PROPERTY, "constant");

        StationarizerConfig config = StationarizerConfig.fromProperties(properties).validate();

        assertThat(config.getAlpha(), is(0.1));
        assertThat(config.correctionMethod(), is(CorrectionMethod.BENJAMINI_HOCHBERG));
        assertThat(config.getPoolingMode(), is(PoolingMode.POOLED));
        assertThat(config.getInsufficientDataPolicy(), is(InsufficientDataPolicy.SKIP));
        assertThat(config.getRegression(), is(Regression.CONSTANT));
    }

    @Test
    public void testHyphenatedEnumValues() {
        Properties properties = new Properties();
        properties.setProperty(StationarizerConfig.POOLING_PROPERTY, "per-family");
        properties.setProperty(StationarizerConfig.REGRESSION_PROPERTY, "constant-trend");
        StationarizerConfig config = StationarizerConfig.fromProperties(properties);
        assertThat(config.getPoolingMode(), is(PoolingMode.PER_FAMILY));
        assertThat(config.getRegression(), is(Regression.CONSTANT_TREND));
    }

    @Test
    public void testWithers() {
        StationarizerConfig config = StationarizerConfig.defaults().withAlpha(0.01).withMultitestMethod("holm");
        assertThat(config.getAlpha(), is(0.01));
        assertThat(config.correctionMethod(), is(CorrectionMethod.HOLM));
        assertThat(StationarizerConfig.defaults().getAlpha(), is(0.05));
    }

    @Test(expected = IllegalArgumentException.class)
    public void testAlphaMustBeAProbability() {
        StationarizerConfig.defaults().withAlpha(0.0).validate();
    }

    @Test(expected = CorrectionMethodException.class)
    public void testUnknownCorrectionMethod() {
        StationarizerConfig.defaults().withMultitestMethod("fisher").validate();
    }
}
