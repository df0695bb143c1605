package in.ashwanthkumar.stationarizer;

import com.google.common.base.Preconditions;
import in.ashwanthkumar.stationarizer.model.InsufficientDataPolicy;
import in.ashwanthkumar.stationarizer.model.PoolingMode;
import in.ashwanthkumar.stationarizer.model.Regression;
import in.ashwanthkumar.stationarizer.plugins.CorrectionMethod;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.RequiredArgsConstructor;
import lombok.ToString;
import lombok.With;
import org.apache.commons.lang3.StringUtils;

import java.util.Properties;

/**
 * Options of a stationarization run.
 */
@RequiredArgsConstructor(staticName = "of")
@Getter
@With
@EqualsAndHashCode
@ToString
public class StationarizerConfig {
    public static final double DEFAULT_ALPHA = 0.05;
    public static final String DEFAULT_MULTITEST_METHOD = "benjamini-yekutieli";

    public static final String ALPHA_PROPERTY = "stationarizer.alpha";
    public static final String MULTITEST_PROPERTY = "stationarizer.multitest";
    public static final String POOLING_PROPERTY = "stationarizer.pooling";
    public static final String INSUFFICIENT_DATA_PROPERTY = "stationarizer.insufficient-data";
    public static final String REGRESSION_PROPERTY = "stationarizer.regression";

    // FWER or FDR to control, depending on the correction method
    private final double alpha;
    private final String multitestMethod;
    private final PoolingMode poolingMode;
    private final InsufficientDataPolicy insufficientDataPolicy;
    // deterministic terms of both test regressions
    private final Regression regression;

    public static StationarizerConfig defaults() {
        return StationarizerConfig.of(DEFAULT_ALPHA, DEFAULT_MULTITEST_METHOD, PoolingMode.PER_FAMILY,
                InsufficientDataPolicy.ABORT, Regression.CONSTANT_TREND);
    }

    /**
     * Read the options from {@code stationarizer.*} properties, falling back to the defaults for
     * the ones that are not set.
     */
    public static StationarizerConfig fromProperties(Properties properties) {
        StationarizerConfig defaults = defaults();
        String alpha = properties.getProperty(ALPHA_PROPERTY);
        String pooling = properties.getProperty(POOLING_PROPERTY);
        String insufficientData = properties.getProperty(INSUFFICIENT_DATA_PROPERTY);
        String regression = properties.getProperty(REGRESSION_PROPERTY);
        return StationarizerConfig.of(
                StringUtils.isBlank(alpha) ? defaults.alpha : Double.parseDouble(alpha.trim()),
                StringUtils.defaultIfBlank(properties.getProperty(MULTITEST_PROPERTY), defaults.multitestMethod).trim(),
                StringUtils.isBlank(pooling) ? defaults.poolingMode : PoolingMode.valueOf(constantName(pooling)),
                StringUtils.isBlank(insufficientData) ? defaults.insufficientDataPolicy : InsufficientDataPolicy.valueOf(constantName(insufficientData)),
                StringUtils.isBlank(regression) ? defaults.regression : Regression.valueOf(constantName(regression))
        );
    }

    /**
     * @throws IllegalArgumentException when alpha is not in (0, 1)
     * @throws in.ashwanthkumar.stationarizer.exception.CorrectionMethodException when the correction method is unknown
     */
    public StationarizerConfig validate() {
        Preconditions.checkArgument(alpha > 0.0 && alpha < 1.0, "alpha must be in (0, 1), got %s", alpha);
        Preconditions.checkNotNull(poolingMode, "poolingMode");
        Preconditions.checkNotNull(insufficientDataPolicy, "insufficientDataPolicy");
        Preconditions.checkNotNull(regression, "regression");
        correctionMethod();
        return this;
    }

    public CorrectionMethod correctionMethod() {
        return CorrectionMethod.fromName(multitestMethod);
    }

    // "per-family" -> PER_FAMILY
    private static String constantName(String value) {
        return StringUtils.upperCase(value.trim()).replace('-', '_');
    }
}
